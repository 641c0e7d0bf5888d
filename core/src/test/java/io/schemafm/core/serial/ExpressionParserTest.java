package io.schemafm.core.serial;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.schemafm.core.model.Expression;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("ExpressionParser")
class ExpressionParserTest {

    @Test
    @DisplayName("and binds tighter than or, which binds tighter than implies")
    void precedence() {
        Expression e = ExpressionParser.parse("a & b | c => d");

        assertThat(e).isEqualTo(Expression.implies(
                Expression.or(Expression.and(Expression.ref("a"), Expression.ref("b")), Expression.ref("c")),
                Expression.ref("d")));
    }

    @Test
    @DisplayName("value tests keep escaped quotes")
    void valueTest() {
        Expression e = ExpressionParser.parse("Pod.spec.restartPolicy == 'it\\'s'");

        assertThat(e).isEqualTo(new Expression.ValueEquals("Pod.spec.restartPolicy", "it's"));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "Pod.a => Pod.b",
        "Pod.a => !Pod.b",
        "(Pod.a | Pod.b) & Pod.c",
        "!(Pod.a & Pod.b)",
        "Pod.a <=> Pod.b | Pod.c",
        "Pod.mode == 'exec' => !Pod.tcpSocket"
    })
    @DisplayName("parsing the rendered form gives the same text back")
    void renderedFormIsStable(String text) {
        assertThat(ExpressionParser.parse(text).render()).isEqualTo(text);
    }

    @Test
    @DisplayName("trailing tokens are rejected")
    void trailingTokens() {
        assertThatThrownBy(() -> ExpressionParser.parse("a => b c"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("after expression");
    }
}
