package io.schemafm.core.error;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class DiagnosticsTest {

    @Test
    void countsByCodeAreSortedByCode() {
        Diagnostics diagnostics = new Diagnostics();
        diagnostics.warn(Diagnostics.UNRESOLVED_REFERENCE, "A", "missing B");
        diagnostics.info(Diagnostics.ALIAS, "A.x", "same key path as A.y");
        diagnostics.warn(Diagnostics.UNRESOLVED_REFERENCE, "C", "missing D");

        assertThat(diagnostics.countsByCode())
                .containsExactly(
                        java.util.Map.entry(Diagnostics.ALIAS, 1),
                        java.util.Map.entry(Diagnostics.UNRESOLVED_REFERENCE, 2));
        assertThat(diagnostics.withCode(Diagnostics.ALIAS)).hasSize(1);
        assertThat(diagnostics.size()).isEqualTo(3);
    }

    @Test
    void schemaExceptionBecomesWarning() {
        Diagnostic d = Diagnostic.of(new UnsupportedConstructException("Weird", "not"));

        assertThat(d.severity()).isEqualTo(Diagnostic.Severity.WARNING);
        assertThat(d.code()).isEqualTo(Diagnostics.UNSUPPORTED_CONSTRUCT);
        assertThat(d.subject()).isEqualTo("Weird");
        assertThat(d.toString()).startsWith("WARNING [unsupported-construct] Weird: ");
    }

    @Test
    void diagnosticRequiresAllFields() {
        assertThatThrownBy(() -> Diagnostic.warning(null, "s", "m")).isInstanceOf(NullPointerException.class);
    }
}
