package io.latexium.core.structure;

import io.latexium.core.ast.AstNode;
import io.latexium.core.ast.BinaryExpression;
import io.latexium.core.ast.Fraction;
import io.latexium.core.ast.Identifier;
import io.latexium.core.ast.NumberLiteral;
import io.latexium.core.ast.Nodes;
import io.latexium.core.ast.UnaryExpression;
import io.latexium.core.ast.UnaryOperator;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Univariate polynomial with numeric coefficients, extracted structurally from an expression tree.
 * Works on unsimplified input: nested sums, products and integer powers are multiplied out during
 * extraction.
 */
public final class Polynomial {

    static final int MAX_DEGREE = 64;
    private static final double EPSILON = 1e-9;

    private final double[] coefficients;

    private Polynomial(double[] coefficients) {
        int degree = coefficients.length - 1;
        while (degree > 0 && coefficients[degree] == 0) {
            degree--;
        }
        this.coefficients = new double[degree + 1];
        for (int k = 0; k <= degree; k++) {
            // collapse -0.0 so equality stays exact
            this.coefficients[k] = coefficients[k] + 0.0;
        }
    }

    /** Polynomial from coefficients in ascending degree order. */
    public static Polynomial of(double... ascending) {
        return new Polynomial(ascending.length == 0 ? new double[] {0} : ascending);
    }

    /**
     * Extracts the polynomial in {@code variable} represented by {@code node}, or empty if any
     * part of the tree is not a polynomial with numeric coefficients.
     */
    public static Optional<Polynomial> from(AstNode node, String variable) {
        return Optional.ofNullable(extract(node, variable));
    }

    private static Polynomial extract(AstNode node, String variable) {
        if (node instanceof NumberLiteral n) {
            return of(n.value());
        }
        if (node instanceof Identifier id) {
            return id.isFreeOccurrenceOf(variable) ? of(0, 1) : null;
        }
        if (node instanceof UnaryExpression u) {
            Polynomial inner = extract(u.operand(), variable);
            return inner == null ? null : u.operator() == UnaryOperator.MINUS ? inner.scale(-1) : inner;
        }
        if (node instanceof Fraction f) {
            return quotient(f.numerator(), f.denominator(), variable);
        }
        if (node instanceof BinaryExpression b) {
            switch (b.operator()) {
                case ADD, SUBTRACT, MULTIPLY -> {
                    Polynomial left = extract(b.left(), variable);
                    Polynomial right = left == null ? null : extract(b.right(), variable);
                    if (right == null) {
                        return null;
                    }
                    return switch (b.operator()) {
                        case ADD -> left.add(right);
                        case SUBTRACT -> left.add(right.scale(-1));
                        default -> left.multiply(right);
                    };
                }
                case DIVIDE -> {
                    return quotient(b.left(), b.right(), variable);
                }
                case POWER -> {
                    double exponent = Numbers.constantValue(b.right());
                    if (!Numbers.isInteger(exponent) || exponent < 0 || exponent > MAX_DEGREE) {
                        return null;
                    }
                    Polynomial base = extract(b.left(), variable);
                    if (base == null || base.degree() * exponent > MAX_DEGREE) {
                        return null;
                    }
                    return base.pow((int) exponent);
                }
                default -> {
                    return null;
                }
            }
        }
        return null;
    }

    private static Polynomial quotient(AstNode numerator, AstNode denominator, String variable) {
        double d = Numbers.constantValue(denominator);
        if (Double.isNaN(d) || d == 0) {
            return null;
        }
        Polynomial n = extract(numerator, variable);
        return n == null ? null : n.scale(1 / d);
    }

    public int degree() {
        return coefficients.length - 1;
    }

    /** Coefficient of {@code x^k}; zero beyond the degree. */
    public double coefficient(int k) {
        return k < coefficients.length ? coefficients[k] : 0;
    }

    public double leading() {
        return coefficients[degree()];
    }

    public boolean isZero() {
        return degree() == 0 && coefficients[0] == 0;
    }

    /** Number of non-zero coefficients. */
    public int termCount() {
        int count = 0;
        for (double c : coefficients) {
            if (c != 0) {
                count++;
            }
        }
        return count;
    }

    public boolean hasIntegerCoefficients() {
        for (double c : coefficients) {
            if (!Numbers.isInteger(c)) {
                return false;
            }
        }
        return true;
    }

    /** Lowest degree with a non-zero coefficient. */
    public int lowestDegree() {
        for (int k = 0; k < coefficients.length; k++) {
            if (coefficients[k] != 0) {
                return k;
            }
        }
        return 0;
    }

    public Polynomial add(Polynomial other) {
        double[] result = new double[Math.max(coefficients.length, other.coefficients.length)];
        for (int k = 0; k < result.length; k++) {
            result[k] = coefficient(k) + other.coefficient(k);
        }
        return new Polynomial(result);
    }

    public Polynomial scale(double factor) {
        double[] result = new double[coefficients.length];
        for (int k = 0; k < result.length; k++) {
            result[k] = coefficients[k] * factor;
        }
        return new Polynomial(result);
    }

    public Polynomial multiply(Polynomial other) {
        double[] result = new double[coefficients.length + other.coefficients.length - 1];
        for (int i = 0; i < coefficients.length; i++) {
            for (int j = 0; j < other.coefficients.length; j++) {
                result[i + j] += coefficients[i] * other.coefficients[j];
            }
        }
        return new Polynomial(result);
    }

    public Polynomial pow(int exponent) {
        Polynomial result = of(1);
        for (int i = 0; i < exponent; i++) {
            result = result.multiply(this);
        }
        return result;
    }

    /**
     * Rewrites {@code p(x)} as {@code q(u)} with {@code u = x^k}, if every non-zero coefficient sits
     * at a multiple of {@code k}.
     */
    public Optional<Polynomial> compress(int k) {
        if (degree() % k != 0) {
            return Optional.empty();
        }
        double[] result = new double[degree() / k + 1];
        for (int i = 0; i < coefficients.length; i++) {
            if (coefficients[i] != 0) {
                if (i % k != 0) {
                    return Optional.empty();
                }
                result[i / k] = coefficients[i];
            }
        }
        return Optional.of(new Polynomial(result));
    }

    /**
     * Synthetic division by {@code (a x + b)}. Empty if the remainder is not zero.
     */
    public Optional<Polynomial> divideByLinear(double a, double b) {
        double root = -b / a;
        int n = degree();
        double[] quotient = new double[n];
        double carry = 0;
        for (int k = n; k >= 1; k--) {
            carry = coefficients[k] + carry * root;
            quotient[k - 1] = carry;
        }
        double remainder = coefficients[0] + carry * root;
        if (Math.abs(remainder) > EPSILON * Math.max(1, Math.abs(coefficients[0]))) {
            return Optional.empty();
        }
        return Optional.of(new Polynomial(quotient).scale(1 / a));
    }

    public double evaluate(double x) {
        double result = 0;
        for (int k = coefficients.length - 1; k >= 0; k--) {
            result = result * x + coefficients[k];
        }
        return result;
    }

    /** Canonical sum of terms in descending degree. */
    public AstNode toAst(String variable) {
        List<Term> terms = new ArrayList<>();
        for (int k = degree(); k >= 0; k--) {
            double c = Numbers.snap(coefficients[k]);
            if (c == 0) {
                continue;
            }
            AstNode form = k == 0
                    ? NumberLiteral.ONE
                    : k == 1 ? Nodes.var(variable) : Nodes.pow(Nodes.var(variable), k);
            terms.add(Term.of(c, form));
        }
        return Terms.rebuild(terms);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Polynomial p && Arrays.equals(coefficients, p.coefficients);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(coefficients);
    }

    @Override
    public String toString() {
        return "Polynomial" + Arrays.toString(coefficients);
    }
}
