package io.latexium.core.evaluate;

import java.util.Map;
import java.util.Set;
import java.util.function.DoubleUnaryOperator;

/** Numeric table for the unary functions the engine recognizes. */
public final class MathFunctions {

    private static final Map<String, DoubleUnaryOperator> TABLE = Map.ofEntries(
            entry("sin", Math::sin),
            entry("cos", Math::cos),
            entry("tan", Math::tan),
            entry("sec", x -> 1 / Math.cos(x)),
            entry("csc", x -> 1 / Math.sin(x)),
            entry("cot", x -> 1 / Math.tan(x)),
            entry("asin", Math::asin),
            entry("acos", Math::acos),
            entry("atan", Math::atan),
            entry("sinh", Math::sinh),
            entry("cosh", Math::cosh),
            entry("tanh", Math::tanh),
            entry("ln", Math::log),
            entry("log", Math::log10),
            entry("exp", Math::exp),
            entry("sqrt", Math::sqrt),
            entry("abs", Math::abs));

    /** Functions that satisfy {@code f(-x) = -f(x)}. */
    public static final Set<String> ODD = Set.of("sin", "tan", "csc", "cot", "asin", "atan", "sinh", "tanh");

    /** Functions that satisfy {@code f(-x) = f(x)}. */
    public static final Set<String> EVEN = Set.of("cos", "sec", "cosh", "abs");

    private MathFunctions() {
        // utility class
    }

    private static Map.Entry<String, DoubleUnaryOperator> entry(String name, DoubleUnaryOperator fn) {
        return Map.entry(name, fn);
    }

    public static boolean isKnown(String name) {
        return TABLE.containsKey(name);
    }

    /** Applies {@code name} to {@code x}; {@code NaN} for an unknown function or out-of-domain input. */
    public static double apply(String name, double x) {
        DoubleUnaryOperator fn = TABLE.get(name);
        return fn == null ? Double.NaN : fn.applyAsDouble(x);
    }
}
