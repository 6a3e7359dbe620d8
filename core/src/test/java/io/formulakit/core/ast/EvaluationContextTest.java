package io.formulakit.core.ast;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.formulakit.core.error.MissingVariableException;
import io.formulakit.core.random.FixedRandomProvider;
import io.formulakit.core.random.ThreadLocalRandomProvider;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EvaluationContextTest {

    @Test
    void copiesInitialInputs() {
        Map<String, Double> inputs = new HashMap<>(Map.of("a", 1.0));
        EvaluationContext context = new EvaluationContext(inputs);
        context.set("a", 5);
        inputs.put("b", 2.0);

        assertThat(inputs.get("a")).isEqualTo(1.0);
        assertThat(context.contains("b")).isFalse();
    }

    @Test
    void rejectsNullInputValues() {
        Map<String, Double> inputs = new HashMap<>();
        inputs.put("a", null);

        assertThatThrownBy(() -> new EvaluationContext(inputs))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("'a'");
    }

    @Test
    void getThrowsForUnboundName() {
        EvaluationContext context = new EvaluationContext();

        assertThatThrownBy(() -> context.get("speed"))
                .isInstanceOfSatisfying(MissingVariableException.class, e -> assertThat(e.variableName())
                        .isEqualTo("speed"));
        assertThat(context.getOrDefault("speed", 3)).isEqualTo(3.0);
    }

    @Test
    void resetDropsLocalsAndSeedsNamesWithZero() {
        EvaluationContext context = new EvaluationContext(Map.of("x", 4.0, "temp", 9.0));
        context.withRandom(new FixedRandomProvider());

        context.reset(List.of("x", "y"));

        assertThat(context.snapshot()).containsOnly(Map.entry("x", 0.0), Map.entry("y", 0.0));
        assertThat(context.random(ThreadLocalRandomProvider.INSTANCE)).isSameAs(ThreadLocalRandomProvider.INSTANCE);
    }

    @Test
    void snapshotIsImmutableCopy() {
        EvaluationContext context = new EvaluationContext().set("a", 1);
        Map<String, Double> snapshot = context.snapshot();
        context.set("a", 2);

        assertThat(snapshot).containsEntry("a", 1.0);
        assertThatThrownBy(() -> snapshot.put("b", 1.0)).isInstanceOf(UnsupportedOperationException.class);
    }
}
