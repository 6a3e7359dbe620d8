package io.formulakit.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import io.formulakit.core.model.Binding;
import io.formulakit.core.model.EvaluationResult;
import io.formulakit.core.parser.FormulaParser;
import io.formulakit.core.spi.FormulaListener;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("FormulaRunner")
class FormulaRunnerTest {

    private final List<FormulaListener.EvaluationFailedEvent> failures = new CopyOnWriteArrayList<>();
    private FormulaRegistry registry;
    private FormulaRunner runner;

    @BeforeEach
    void setUp() {
        registry = new FormulaRegistry(new FormulaParser(), new FormulaListener() {
            @Override
            public void onEvaluationFailed(EvaluationFailedEvent event) {
                failures.add(event);
            }
        });
        runner = new FormulaRunner(registry);
        registry.register("damage", "baseDamage * (1 + strength * 0.1)");
        registry.register("sum", "a + b");
        registry.register("bonus", "if (level > 10) { 50 } else { 10 }");
    }

    @Nested
    class MapInputs {

        @Test
        void evaluatesRegisteredFormula() {
            assertThat(runner.evaluate("damage", Map.of("baseDamage", 10.0, "strength", 5.0)))
                    .isEqualTo(15.0);
        }

        @Test
        void unknownIdYieldsZeroAndReportsFailure() {
            assertThat(runner.evaluate("ghost", Map.of())).isZero();
            assertThat(failures).singleElement().satisfies(event -> {
                assertThat(event.id()).isEqualTo("ghost");
                assertThat(event.errorDetail()).isEqualTo("Formula 'ghost' not found");
            });
        }

        @Test
        void missingInputYieldsZeroAndReportsFailure() {
            assertThat(runner.evaluate("sum", Map.of("a", 1.0))).isZero();
            assertThat(failures).singleElement().satisfies(event -> assertThat(event.errorDetail())
                    .contains("b"));
        }

        @Test
        void specialValuesAreOrdinaryResults() {
            registry.register("ratio", "a / b");

            assertThat(runner.evaluate("ratio", Map.of("a", 1.0, "b", 0.0))).isInfinite();
            assertThat(failures).isEmpty();
        }
    }

    @Nested
    class Pooling {

        @Test
        void bindingsAreApplied() {
            assertThat(runner.evaluate("sum", Binding.of("a", 2), Binding.of("b", 3))).isEqualTo(5.0);
            assertThat(runner.evaluate("sum", Binding.of("a", 4), Binding.of("b", 6))).isEqualTo(10.0);
        }

        @Test
        void pooledContextDoesNotLeakPreviousValues() {
            runner.evaluate("sum", Binding.of("a", 100), Binding.of("b", 100));

            assertThat(runner.evaluate("sum", Binding.of("a", 1))).isEqualTo(1.0);
            assertThat(failures).isEmpty();
        }

        @Test
        void missingInputFailsWhenPoolingDisabled() {
            runner.setInputPooling(false);

            assertThat(runner.evaluate("sum", Binding.of("a", 1))).isZero();
            assertThat(failures).hasSize(1);
            assertThat(runner.stats().pooledFormulaCount()).isZero();
        }

        @Test
        void statsTrackPooledFormulas() {
            runner.evaluate("sum", Binding.of("a", 1), Binding.of("b", 1));
            runner.evaluate("sum", Binding.of("a", 1), Binding.of("b", 1));
            runner.evaluate("bonus", Binding.of("level", 12));

            assertThat(runner.stats().pooledFormulaCount()).isEqualTo(2);
            assertThat(runner.stats().poolingEnabled()).isTrue();
            assertThat(runner.stats()).hasToString("Pooled: 2, Pooling: Enabled");

            runner.clearPools();

            assertThat(runner.stats().pooledFormulaCount()).isZero();
        }

        @Test
        void removedFormulasLeaveThePool() {
            runner.evaluate("sum", Binding.of("a", 1), Binding.of("b", 1));
            runner.prepare("damage");
            runner.prepare("bonus");

            registry.remove("sum");

            assertThat(runner.stats().pooledFormulaCount()).isEqualTo(2);

            registry.clear();

            assertThat(runner.stats().pooledFormulaCount()).isZero();
        }

        @Test
        void evaluatingRemovedFormulaDropsItsContext() {
            runner.evaluate("sum", Binding.of("a", 1), Binding.of("b", 1));
            registry.remove("sum");

            assertThat(runner.evaluate("sum", Binding.of("a", 1))).isZero();
            assertThat(runner.stats().pooledFormulaCount()).isZero();
        }

        @Test
        void prepareCreatesPoolEntry() {
            assertThat(runner.prepare("damage")).isTrue();
            assertThat(runner.prepare("ghost")).isFalse();
            assertThat(runner.stats().pooledFormulaCount()).isEqualTo(1);
        }

        @Test
        void unknownIdWithBindingsYieldsZero() {
            assertThat(runner.evaluate("ghost", Binding.of("a", 1))).isZero();
            assertThat(failures).hasSize(1);
        }

        @Test
        void concurrentPooledCallsDoNotInterfere() throws Exception {
            ExecutorService pool = Executors.newFixedThreadPool(8);
            try {
                List<Future<Boolean>> futures = new ArrayList<>();
                for (int t = 0; t < 8; t++) {
                    final int offset = t;
                    futures.add(pool.submit(() -> {
                        for (int i = 0; i < 500; i++) {
                            double a = offset * 1000 + i;
                            if (runner.evaluate("sum", Binding.of("a", a), Binding.of("b", 1)) != a + 1) {
                                return false;
                            }
                        }
                        return true;
                    }));
                }
                for (Future<Boolean> future : futures) {
                    assertThat(future.get(30, TimeUnit.SECONDS)).isTrue();
                }
            } finally {
                pool.shutdownNow();
            }
        }
    }

    @Nested
    class TryEvaluate {

        @Test
        void success() {
            EvaluationResult result = runner.tryEvaluate("bonus", Map.of("level", 11.0));

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.value()).isEqualTo(50.0);
        }

        @Test
        void notFound() {
            EvaluationResult result = runner.tryEvaluate("ghost", Map.of());

            assertThat(result.isNotFound()).isTrue();
            assertThat(result.errorDetail()).isEqualTo("Formula 'ghost' not found");
        }

        @Test
        void errorDoesNotNotifyListener() {
            EvaluationResult result = runner.tryEvaluate("sum", Map.of());

            assertThat(result.isError()).isTrue();
            assertThat(result.errorDetail()).contains("a");
            assertThat(failures).isEmpty();
        }
    }

    @Nested
    class BatchAndMultiple {

        @Test
        void batchEvaluatesEachInputSet() {
            double[] results = runner.evaluateBatch("sum", List.of(
                    Map.of("a", 1.0, "b", 2.0),
                    Map.of("a", 3.0, "b", 4.0)));

            assertThat(results).containsExactly(3.0, 7.0);
        }

        @Test
        void batchStopsAtFirstFailure() {
            double[] results = runner.evaluateBatch("sum", List.of(
                    Map.of("a", 1.0, "b", 2.0),
                    Map.of("a", 3.0),
                    Map.of("a", 5.0, "b", 6.0)));

            assertThat(results).containsExactly(3.0, 0.0, 0.0);
            assertThat(failures).hasSize(1);
        }

        @Test
        void batchForUnknownIdIsAllZeros() {
            assertThat(runner.evaluateBatch("ghost", List.of(Map.of(), Map.of()))).containsExactly(0.0, 0.0);
        }

        @Test
        void multipleKeepsRequestedOrder() {
            Map<String, Double> results = runner.evaluateMultiple(
                    List.of("sum", "damage", "ghost"),
                    Map.of("a", 1.0, "b", 2.0, "baseDamage", 20.0, "strength", 2.5));

            assertThat(results).containsKeys("sum", "damage", "ghost");
            assertThat(new ArrayList<>(results.keySet())).containsExactly("sum", "damage", "ghost");
            assertThat(results.get("sum")).isEqualTo(3.0);
            assertThat(results.get("damage")).isCloseTo(25.0, within(1e-9));
            assertThat(results.get("ghost")).isZero();
        }
    }
}
