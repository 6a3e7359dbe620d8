package io.formulakit.core.model;

import java.util.Objects;

/**
 * Outcome of {@link io.formulakit.core.engine.FormulaRunner#tryEvaluate}. Exactly one of three
 * states:
 *
 * <ul>
 * <li>{@link Type#SUCCESS}: {@code value} holds the result.
 * <li>{@link Type#ERROR}: evaluation failed; {@code errorDetail} describes why.
 * <li>{@link Type#NOT_FOUND}: no formula is registered under the id.
 * </ul>
 *
 * {@code value} is {@code 0} for both failure states.
 */
public final class EvaluationResult {

    /** The type of evaluation outcome. */
    public enum Type {
        SUCCESS,
        ERROR,
        NOT_FOUND
    }

    private final Type type;
    private final String formulaId;
    private final double value;
    private final String errorDetail;

    private EvaluationResult(Type type, String formulaId, double value, String errorDetail) {
        this.type = type;
        this.formulaId = formulaId;
        this.value = value;
        this.errorDetail = errorDetail;
    }

    public static EvaluationResult success(String formulaId, double value) {
        return new EvaluationResult(Type.SUCCESS, formulaId, value, null);
    }

    public static EvaluationResult error(String formulaId, String errorDetail) {
        Objects.requireNonNull(errorDetail, "errorDetail must not be null for ERROR");
        return new EvaluationResult(Type.ERROR, formulaId, 0, errorDetail);
    }

    public static EvaluationResult notFound(String formulaId) {
        return new EvaluationResult(Type.NOT_FOUND, formulaId, 0, "Formula '" + formulaId + "' not found");
    }

    public Type type() {
        return type;
    }

    public String formulaId() {
        return formulaId;
    }

    /** The evaluated value; {@code 0} unless {@code type() == SUCCESS}. */
    public double value() {
        return value;
    }

    /** Failure description, or {@code null} on success. */
    public String errorDetail() {
        return errorDetail;
    }

    public boolean isSuccess() {
        return type == Type.SUCCESS;
    }

    public boolean isError() {
        return type == Type.ERROR;
    }

    public boolean isNotFound() {
        return type == Type.NOT_FOUND;
    }

    @Override
    public String toString() {
        return switch (type) {
            case SUCCESS -> "EvaluationResult[SUCCESS, id=" + formulaId + ", value=" + value + "]";
            case ERROR -> "EvaluationResult[ERROR, id=" + formulaId + ", detail=" + errorDetail + "]";
            case NOT_FOUND -> "EvaluationResult[NOT_FOUND, id=" + formulaId + "]";
        };
    }
}
