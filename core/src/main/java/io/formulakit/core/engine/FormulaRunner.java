package io.formulakit.core.engine;

import io.formulakit.core.ast.EvaluationContext;
import io.formulakit.core.error.FormulaEvalException;
import io.formulakit.core.error.FormulaNotFoundException;
import io.formulakit.core.model.Binding;
import io.formulakit.core.model.EvaluationResult;
import io.formulakit.core.model.Formula;
import io.formulakit.core.model.RunnerStats;
import io.formulakit.core.spi.FormulaListener;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates registered formulas by id.
 *
 * <p>
 * Failures (unknown id, missing input) are logged, reported to the registry's listener and
 * answered with {@code 0}; {@link #tryEvaluate} returns them as an {@link EvaluationResult}
 * instead. Arithmetic special values (NaN, infinities) are ordinary results.
 *
 * <p>
 * The varargs entry point {@link #evaluate(String, Binding...)} can reuse one binding context per
 * formula. A pooled context is taken out of the pool for the duration of a call, so concurrent
 * calls never share one; a call that finds the pool empty allocates a fresh context. Pooled
 * contexts are pre-seeded with every required input at {@code 0}, so inputs left out of such a
 * call read as {@code 0} instead of failing.
 *
 * <p>
 * Thread-safe.
 */
public final class FormulaRunner {

    private static final Logger LOG = LoggerFactory.getLogger(FormulaRunner.class);

    private final FormulaRegistry registry;
    private final FormulaListener listener;
    private final Map<String, EvaluationContext> pools = new ConcurrentHashMap<>();
    private volatile boolean inputPooling = true;

    public FormulaRunner(FormulaRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.listener = registry.listener();
    }

    public FormulaRegistry registry() {
        return registry;
    }

    /**
     * Evaluates a formula against a copy of {@code inputs}.
     *
     * @return the result, or {@code 0} if the id is unknown or evaluation failed
     */
    public double evaluate(String formulaId, Map<String, Double> inputs) {
        Optional<Formula> formula = registry.find(formulaId);
        if (formula.isEmpty()) {
            reportFailure(formulaId, new FormulaNotFoundException(formulaId));
            return 0;
        }
        try {
            return formula.get().evaluate(inputs);
        } catch (FormulaEvalException e) {
            reportFailure(formulaId, e);
            return 0;
        }
    }

    /**
     * Evaluates a formula against the given bindings, reusing a pooled context when pooling is
     * enabled.
     *
     * @return the result, or {@code 0} if the id is unknown or evaluation failed
     */
    public double evaluate(String formulaId, Binding... bindings) {
        Optional<Formula> found = registry.find(formulaId);
        if (found.isEmpty()) {
            if (formulaId != null) {
                pools.remove(formulaId);
            }
            reportFailure(formulaId, new FormulaNotFoundException(formulaId));
            return 0;
        }
        Formula formula = found.get();

        EvaluationContext context;
        if (inputPooling) {
            context = pools.remove(formulaId);
            if (context == null) {
                context = new EvaluationContext();
            }
            context.reset(formula.requiredInputs());
        } else {
            context = new EvaluationContext();
        }
        for (Binding binding : bindings) {
            context.set(binding.name(), binding.value());
        }

        try {
            return formula.evaluate(context);
        } catch (FormulaEvalException e) {
            reportFailure(formulaId, e);
            return 0;
        } finally {
            if (inputPooling) {
                pools.put(formulaId, context);
            }
        }
    }

    /** Evaluates a formula without logging or listener notification on failure. */
    public EvaluationResult tryEvaluate(String formulaId, Map<String, Double> inputs) {
        Optional<Formula> formula = registry.find(formulaId);
        if (formula.isEmpty()) {
            return EvaluationResult.notFound(formulaId);
        }
        try {
            return EvaluationResult.success(formulaId, formula.get().evaluate(inputs));
        } catch (FormulaEvalException e) {
            return EvaluationResult.error(formulaId, e.getMessage());
        }
    }

    /**
     * Evaluates one formula against several input sets, each in its own context. The first failure
     * stops the batch; its slot and every later slot stay {@code 0}.
     *
     * @return one result per input set, in order
     */
    public double[] evaluateBatch(String formulaId, List<Map<String, Double>> batch) {
        double[] results = new double[batch.size()];
        Optional<Formula> formula = registry.find(formulaId);
        if (formula.isEmpty()) {
            reportFailure(formulaId, new FormulaNotFoundException(formulaId));
            return results;
        }
        try {
            for (int i = 0; i < results.length; i++) {
                results[i] = formula.get().evaluate(batch.get(i));
            }
        } catch (FormulaEvalException e) {
            reportFailure(formulaId, e);
        }
        return results;
    }

    /**
     * Evaluates several formulas against the same inputs.
     *
     * @return results keyed by id, in the order the ids were given
     */
    public Map<String, Double> evaluateMultiple(Collection<String> formulaIds, Map<String, Double> inputs) {
        Map<String, Double> results = new LinkedHashMap<>();
        for (String formulaId : formulaIds) {
            results.put(formulaId, evaluate(formulaId, inputs));
        }
        return results;
    }

    /**
     * Creates the pooled context for a formula ahead of its first pooled evaluation.
     *
     * @return {@code false} if the id is unknown
     */
    public boolean prepare(String formulaId) {
        Optional<Formula> formula = registry.find(formulaId);
        if (formula.isEmpty()) {
            if (formulaId != null) {
                pools.remove(formulaId);
            }
            LOG.warn("Cannot prepare formula: id={} not found", formulaId);
            return false;
        }
        pools.computeIfAbsent(formulaId, id -> {
            EvaluationContext context = new EvaluationContext();
            context.reset(formula.get().requiredInputs());
            return context;
        });
        return true;
    }

    /** Drops every pooled context. */
    public void clearPools() {
        pools.clear();
    }

    public boolean isInputPooling() {
        return inputPooling;
    }

    /** Enables or disables context pooling for {@link #evaluate(String, Binding...)}. */
    public void setInputPooling(boolean inputPooling) {
        this.inputPooling = inputPooling;
    }

    /**
     * Current pooling statistics. Contexts checked out by in-flight calls are not counted. Contexts of
     * formulas no longer in the registry are dropped first.
     */
    public RunnerStats stats() {
        pools.keySet().removeIf(id -> !registry.contains(id));
        return new RunnerStats(pools.size(), inputPooling);
    }

    private void reportFailure(String formulaId, RuntimeException cause) {
        LOG.warn("formula.evaluation_failed id={} error={}", formulaId, cause.getMessage());
        try {
            listener.onEvaluationFailed(new FormulaListener.EvaluationFailedEvent(formulaId, cause.getMessage()));
        } catch (Exception e) {
            LOG.warn("FormulaListener.onEvaluationFailed failed", e);
        }
    }
}
