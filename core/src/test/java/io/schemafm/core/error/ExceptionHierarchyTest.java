package io.schemafm.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

/**
 * Tests for the exception hierarchy. Verifies the three abstract tiers, their categories and the
 * fields every concrete type carries.
 */
class ExceptionHierarchyTest {

    // --- Hierarchy structure ---

    @Test
    void featureModelExceptionIsAbstractAndRoot() {
        assertThat(FeatureModelException.class).isAbstract();
        assertThat(FeatureModelException.class.getSuperclass()).isEqualTo(RuntimeException.class);
    }

    @Test
    void tiersAreAbstractAndExtendRoot() {
        assertThat(SchemaException.class).isAbstract();
        assertThat(MappingException.class).isAbstract();
        assertThat(InputException.class).isAbstract();
        assertThat(SchemaException.class.getSuperclass()).isEqualTo(FeatureModelException.class);
        assertThat(MappingException.class.getSuperclass()).isEqualTo(FeatureModelException.class);
        assertThat(InputException.class.getSuperclass()).isEqualTo(FeatureModelException.class);
    }

    // --- Schema tier ---

    @Test
    void unresolvedReferenceIsRecoverableSchemaError() {
        var ex = new UnresolvedReferenceException("io.k8s.api.core.v1.PodSpec", "#/definitions/Container");

        assertThat(ex).isInstanceOf(SchemaException.class);
        assertThat(ex.category()).isEqualTo(FeatureModelException.Category.SCHEMA);
        assertThat(ex.definition()).isEqualTo("io.k8s.api.core.v1.PodSpec");
        assertThat(ex.reference()).isEqualTo("#/definitions/Container");
        assertThat(ex.detail()).contains("#/definitions/Container");
    }

    @Test
    void unsupportedConstructNamesConstruct() {
        var ex = new UnsupportedConstructException("Weird", "patternProperties");

        assertThat(ex).isInstanceOf(SchemaException.class);
        assertThat(ex.construct()).isEqualTo("patternProperties");
        assertThat(ex.category()).isEqualTo(FeatureModelException.Category.SCHEMA);
    }

    // --- Mapping tier ---

    @Test
    void ambiguousKeyPathCarriesBothPaths() {
        var ex = new AmbiguousKeyPathException("Pod.metadata.labels.app", "Pod.metadata.labels.*");

        assertThat(ex).isInstanceOf(MappingException.class);
        assertThat(ex.category()).isEqualTo(FeatureModelException.Category.MAPPING);
        assertThat(ex.keyPath()).isEqualTo("Pod.metadata.labels.app");
        assertThat(ex.conflictingPath()).isEqualTo("Pod.metadata.labels.*");
    }

    // --- Input tier ---

    @Test
    void inputExceptionsAreFatalAndCarrySource() {
        var cause = new java.io.IOException("disk gone");
        InputException[] all = {
            new SchemaLoadException("bad schema", cause, "schema.json"),
            new KeyMappingLoadException("bad csv", "mapping.csv"),
            new DocumentReadException("bad doc", "pod.yaml"),
            new TranslationBudgetExceededException("too deep", "deep.yaml"),
            new ModelParseException("bad model", "model.fm", 3)
        };
        for (InputException ex : all) {
            assertThat(ex.category()).isEqualTo(FeatureModelException.Category.FATAL);
            assertThat(ex.source()).isNotBlank();
        }
        assertThat(all[0].getCause()).isSameAs(cause);
    }

    @Test
    void modelParseExceptionAppendsLineNumber() {
        var ex = new ModelParseException("Unknown section 'foo'", "model.fm", 7);

        assertThat(ex.line()).isEqualTo(7);
        assertThat(ex.getMessage()).isEqualTo("Unknown section 'foo' (line 7)");
    }

    @Test
    void modelParseExceptionWithoutLineKeepsMessage() {
        var ex = new ModelParseException("Cannot read model file", new java.io.IOException("x"), "model.fm");

        assertThat(ex.line()).isEqualTo(-1);
        assertThat(ex.getMessage()).isEqualTo("Cannot read model file");
    }
}
