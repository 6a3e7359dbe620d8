package io.formulakit.core.model;

/**
 * Snapshot of a runner's pooling state.
 *
 * @param pooledFormulaCount number of formulas with a pooled binding context
 * @param poolingEnabled     whether the varargs entry point reuses pooled contexts
 */
public record RunnerStats(int pooledFormulaCount, boolean poolingEnabled) {

    @Override
    public String toString() {
        return "Pooled: " + pooledFormulaCount + ", Pooling: " + (poolingEnabled ? "Enabled" : "Disabled");
    }
}
