package io.formulakit.core.ast;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.DoubleUnaryOperator;
import java.util.function.Function;
import java.util.stream.Collectors;

/** Single-argument math functions callable from a formula. */
public enum MathFunction {
    SQRT("sqrt", Math::sqrt),
    ABS("abs", Math::abs),
    FLOOR("floor", Math::floor),
    CEIL("ceil", Math::ceil),
    /** Rounds half to even. */
    ROUND("round", Math::rint),
    SIN("sin", Math::sin),
    COS("cos", Math::cos),
    TAN("tan", Math::tan),
    /** Natural logarithm. */
    LOG("log", Math::log),
    EXP("exp", Math::exp),
    CLAMP01("clamp01", MathFunction::clamp01),
    /** {@code 1} for zero and positive values, {@code -1} otherwise. */
    SIGN("sign", x -> x >= 0 ? 1 : -1),
    NEGATIVE("negative", x -> -x),
    ACOS("acos", Math::acos),
    ASIN("asin", Math::asin),
    ATAN("atan", Math::atan);

    private static final Map<String, MathFunction> BY_NAME =
            Arrays.stream(values()).collect(Collectors.toUnmodifiableMap(MathFunction::functionName, Function.identity()));

    private final String functionName;
    private final DoubleUnaryOperator operation;

    MathFunction(String functionName, DoubleUnaryOperator operation) {
        this.functionName = functionName;
        this.operation = operation;
    }

    /**
     * Looks up a function by the name used in formulas. Names are case-sensitive.
     *
     * @param name the function name, e.g. {@code "sqrt"}
     * @return the function, or empty if no single-argument function has this name
     */
    public static Optional<MathFunction> byName(String name) {
        return Optional.ofNullable(BY_NAME.get(name));
    }

    public String functionName() {
        return functionName;
    }

    public double apply(double argument) {
        return operation.applyAsDouble(argument);
    }

    static double clamp01(double value) {
        if (value < 0) {
            return 0;
        }
        return value > 1 ? 1 : value;
    }
}
