package io.schemafm.core;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

/**
 * Architecture guardrails for the core module: no dependency on the batch runner, no reflection,
 * and no mutable state in the components shared between document workers.
 */
@AnalyzeClasses(packages = "io.schemafm.core", importOptions = {ImportOption.DoNotIncludeTests.class})
class CoreArchitectureTest {

    @ArchTest
    static final ArchRule noBatchDependencies = noClasses()
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("io.schemafm.batch..")
            .because("core must stay usable without the batch runner");

    @ArchTest
    static final ArchRule noReflectionUsage = noClasses()
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("java.lang.reflect..")
            .because("reflection is forbidden by project governance");

    @ArchTest
    static final ArchRule modelIsSelfContained = noClasses()
            .that()
            .resideInAnyPackage("io.schemafm.core.model..", "io.schemafm.core.error..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage(
                    "io.schemafm.core.engine..",
                    "io.schemafm.core.serial..",
                    "io.schemafm.core.translate..",
                    "io.schemafm.core.validate..",
                    "io.schemafm.core.synth..")
            .because("the model types are shared by every stage and must not depend on any of them");

    @ArchTest
    static final ArchRule sharedWorkersHaveOnlyFinalFields = classes()
            .that()
            .haveSimpleName("ConfigurationTranslator")
            .or()
            .haveSimpleName("ModelValidator")
            .or()
            .haveSimpleName("DocumentChecker")
            .should()
            .haveOnlyFinalFields()
            .because("one instance is shared by all workers of a batch");
}
