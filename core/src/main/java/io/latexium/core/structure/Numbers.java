package io.latexium.core.structure;

import io.latexium.core.ast.AstNode;
import io.latexium.core.ast.Fraction;
import io.latexium.core.ast.NumberLiteral;
import io.latexium.core.ast.Nodes;
import io.latexium.core.ast.UnaryExpression;
import io.latexium.core.ast.UnaryOperator;
import io.latexium.core.error.ArithmeticEvalException;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Optional;

/** Double arithmetic with exact snapping to integers and small rationals. */
public final class Numbers {

    /** Values within this distance of 0 or ±1 snap to the exact value. */
    public static final double SNAP_EPSILON = 1e-14;

    private static final double RATIONAL_TOLERANCE = 1e-12;
    private static final int MAX_DENOMINATOR = 1000;
    private static final double MAX_EXACT = 1e15;

    private Numbers() {
        // utility class
    }

    public static boolean isInteger(double value) {
        return Double.isFinite(value) && value == Math.rint(value) && Math.abs(value) < MAX_EXACT;
    }

    public static long gcd(long a, long b) {
        a = Math.abs(a);
        b = Math.abs(b);
        while (b != 0) {
            long t = a % b;
            a = b;
            b = t;
        }
        return a;
    }

    public static double snap(double value) {
        if (Math.abs(value) < SNAP_EPSILON) {
            return 0.0;
        }
        if (Math.abs(value - 1) < SNAP_EPSILON) {
            return 1.0;
        }
        if (Math.abs(value + 1) < SNAP_EPSILON) {
            return -1.0;
        }
        return value;
    }

    /** Returns {@code {p, q}} with {@code q > 0} and {@code gcd(p, q) = 1}, if {@code value} is close to p/q. */
    public static Optional<long[]> rational(double value) {
        if (!Double.isFinite(value) || Math.abs(value) >= MAX_EXACT) {
            return Optional.empty();
        }
        double tolerance = RATIONAL_TOLERANCE * Math.max(1.0, Math.abs(value));
        for (long q = 1; q <= MAX_DENOMINATOR; q++) {
            long p = Math.round(value * q);
            if (Math.abs((double) p / q - value) <= tolerance) {
                long g = gcd(p, q);
                return Optional.of(new long[] {p / g, q / g});
            }
        }
        return Optional.empty();
    }

    /** Exact node for {@code value} if it is an integer or a small rational. */
    public static Optional<AstNode> exact(double value) {
        return rational(snap(value)).map(pq -> fraction(pq[0], pq[1]));
    }

    /** Exact node where possible, otherwise a plain literal. */
    public static AstNode toNode(double value) {
        if (!Double.isFinite(value)) {
            throw new ArithmeticEvalException("Result is not a finite number");
        }
        return exact(value).orElseGet(() -> Nodes.num(value));
    }

    /** Reduced {@code p/q}; the sign always sits on the numerator. */
    public static AstNode fraction(long p, long q) {
        if (q == 0) {
            throw new ArithmeticEvalException("Division by zero");
        }
        if (q < 0) {
            p = -p;
            q = -q;
        }
        long g = gcd(p, q);
        if (g > 1) {
            p /= g;
            q /= g;
        }
        return q == 1 ? Nodes.num(p) : Nodes.frac(Nodes.num(p), Nodes.num(q));
    }

    /**
     * Value of a purely numeric node: a literal, a negated numeric node, or a fraction of numeric
     * nodes. {@code NaN} for anything else.
     */
    public static double constantValue(AstNode node) {
        if (node instanceof NumberLiteral n) {
            return n.value();
        }
        if (node instanceof UnaryExpression u) {
            double inner = constantValue(u.operand());
            return u.operator() == UnaryOperator.MINUS ? -inner : inner;
        }
        if (node instanceof Fraction f) {
            double d = constantValue(f.denominator());
            double n = constantValue(f.numerator());
            if (Double.isNaN(n) || Double.isNaN(d) || d == 0) {
                return Double.NaN;
            }
            return n / d;
        }
        return Double.NaN;
    }

    public static boolean isConstant(AstNode node) {
        return !Double.isNaN(constantValue(node));
    }

    /** Plain decimal text: integers without a fraction part, others to 12 significant digits. */
    public static String format(double value) {
        if (isInteger(value)) {
            return Long.toString((long) value);
        }
        return BigDecimal.valueOf(value)
                .round(new MathContext(12))
                .stripTrailingZeros()
                .toPlainString();
    }

    /** Rounds to {@code digits} significant digits. */
    public static double toPrecision(double value, int digits) {
        if (!Double.isFinite(value) || value == 0) {
            return value;
        }
        return BigDecimal.valueOf(value).round(new MathContext(digits)).doubleValue();
    }
}
