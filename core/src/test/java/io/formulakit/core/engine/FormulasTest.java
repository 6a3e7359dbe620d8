package io.formulakit.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.formulakit.core.error.FormulaParseException;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FormulasTest {

    @BeforeEach
    void clearCache() {
        Formulas.clearCache();
    }

    @Test
    void fluentRequest() {
        double damage = Formulas.run("baseDamage * (1 + strength * 0.1)")
                .set("baseDamage", 10)
                .set("strength", 5)
                .evaluate();

        assertThat(damage).isEqualTo(15.0);
    }

    @Test
    void expressionIsCachedUnderItsHash() {
        Formulas.run("x * 2", Map.of("x", 3.0));
        Formulas.run("x * 2", Map.of("x", 4.0));

        assertThat(Formulas.allFormulas())
                .containsExactly(Map.entry(Formulas.cacheIdFor("x * 2"), "x * 2"));
    }

    @Test
    void cacheIdIsLowercaseSha256Hex() {
        assertThat(Formulas.cacheIdFor("abc"))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    void explicitCacheIdIsReRegisteredWhenExpressionChanges() {
        assertThat(Formulas.run("1 + 1").withCache("calc")).isEqualTo(2.0);
        assertThat(Formulas.run("2 * 5").withCache("calc")).isEqualTo(10.0);

        assertThat(Formulas.allFormulas()).containsExactly(Map.entry("calc", "2 * 5"));
    }

    @Test
    void blankCacheIdFallsBackToHash() {
        assertThat(Formulas.run("7", Map.of(), " ")).isEqualTo(7.0);

        assertThat(Formulas.allFormulas()).containsOnlyKeys(Formulas.cacheIdFor("7"));
    }

    @Test
    void withInputsReplacesPreviousInputs() {
        double result = Formulas.run("a + b")
                .set("a", 100)
                .withInputs(Map.of("a", 1.0, "b", 2.0))
                .evaluate();

        assertThat(result).isEqualTo(3.0);
    }

    @Test
    void missingInputYieldsZero() {
        assertThat(Formulas.run("a + b").set("a", 1).evaluate()).isZero();
    }

    @Test
    void parseErrorPropagates() {
        assertThatThrownBy(() -> Formulas.run("1 +").evaluate()).isInstanceOf(FormulaParseException.class);
        assertThat(Formulas.allFormulas()).isEmpty();
    }

    @Test
    void blankArgumentsAreRejected() {
        assertThatThrownBy(() -> Formulas.run(" "))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("expression must not be null or blank");
        assertThatThrownBy(() -> Formulas.run("1").set("", 1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("input key must not be null or blank");
        assertThatThrownBy(() -> Formulas.run("1").withCache(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("cache id must not be null or blank");
    }

    @Test
    void clearCacheEmptiesRegistry() {
        Formulas.run("1", Map.of());

        Formulas.clearCache();

        assertThat(Formulas.allFormulas()).isEmpty();
    }
}
