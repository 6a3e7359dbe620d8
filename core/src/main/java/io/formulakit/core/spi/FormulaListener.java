package io.formulakit.core.spi;

import java.util.Set;

/**
 * SPI for observability hooks on the formula registry and runner.
 *
 * <p>
 * Embedders bridge these callbacks to whatever metrics or audit system they
 * run. All methods have no-op defaults so implementations override only what
 * they need, and all receive immutable event records.
 *
 * <p>
 * Implementations MUST be thread-safe and non-blocking. Exceptions thrown by a
 * listener are caught and logged at WARN; they never change the outcome of a
 * registration or evaluation.
 */
public interface FormulaListener {

    /** Listener that ignores every event. */
    FormulaListener NOOP = new FormulaListener() {};

    /**
     * Called after an expression is parsed and stored under an id.
     *
     * @param event contains id, expression, requiredInputs
     */
    default void onFormulaRegistered(FormulaRegisteredEvent event) {}

    /**
     * Called when an expression fails to parse at registration time.
     *
     * @param event contains id, errorDetail
     */
    default void onFormulaRejected(FormulaRejectedEvent event) {}

    /**
     * Called when an evaluation through the runner fails (unknown id, missing
     * input). Arithmetic special values are not failures.
     *
     * @param event contains id, errorDetail
     */
    default void onEvaluationFailed(EvaluationFailedEvent event) {}

    /**
     * Called after the registry is cleared.
     *
     * @param event contains the number of formulas removed
     */
    default void onRegistryCleared(RegistryClearedEvent event) {}

    // --- Event records ---

    /** Event emitted when a formula is registered. */
    record FormulaRegisteredEvent(String id, String expression, Set<String> requiredInputs) {
        public FormulaRegisteredEvent {
            requiredInputs = Set.copyOf(requiredInputs);
        }
    }

    /** Event emitted when a formula is rejected at registration time. */
    record FormulaRejectedEvent(String id, String errorDetail) {}

    /** Event emitted when an evaluation fails. */
    record EvaluationFailedEvent(String id, String errorDetail) {}

    /** Event emitted when the registry is cleared. */
    record RegistryClearedEvent(int count) {}
}
