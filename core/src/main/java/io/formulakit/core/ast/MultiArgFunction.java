package io.formulakit.core.ast;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Functions taking several arguments. A call with fewer arguments than {@link #arity()} does not
 * fail: it yields its first argument, or {@code 0} when called with none. Arguments beyond the
 * arity are ignored.
 */
public enum MultiArgFunction {
    MIN("min", 2) {
        @Override
        double compute(double[] args) {
            return Math.min(args[0], args[1]);
        }
    },
    MAX("max", 2) {
        @Override
        double compute(double[] args) {
            return Math.max(args[0], args[1]);
        }
    },
    /** {@code clamp(value, min, max)}. */
    CLAMP("clamp", 3) {
        @Override
        double compute(double[] args) {
            double value = args[0];
            if (value < args[1]) {
                return args[1];
            }
            return value > args[2] ? args[2] : value;
        }
    },
    /** {@code lerp(a, b, t)} with {@code t} clamped into [0, 1]. */
    LERP("lerp", 3) {
        @Override
        double compute(double[] args) {
            return args[0] + (args[1] - args[0]) * MathFunction.clamp01(args[2]);
        }
    },
    POW("pow", 2) {
        @Override
        double compute(double[] args) {
            return Math.pow(args[0], args[1]);
        }
    };

    private static final Map<String, MultiArgFunction> BY_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(MultiArgFunction::functionName, Function.identity()));

    private final String functionName;
    private final int arity;

    MultiArgFunction(String functionName, int arity) {
        this.functionName = functionName;
        this.arity = arity;
    }

    public static Optional<MultiArgFunction> byName(String name) {
        return Optional.ofNullable(BY_NAME.get(name));
    }

    public String functionName() {
        return functionName;
    }

    /** Minimum number of arguments for the full computation. */
    public int arity() {
        return arity;
    }

    public double apply(double[] args) {
        if (args.length < arity) {
            return args.length == 0 ? 0 : args[0];
        }
        return compute(args);
    }

    abstract double compute(double[] args);
}
