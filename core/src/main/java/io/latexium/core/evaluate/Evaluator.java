package io.latexium.core.evaluate;

import io.latexium.core.ast.AstNode;
import io.latexium.core.ast.BinaryExpression;
import io.latexium.core.ast.Binder;
import io.latexium.core.ast.Fraction;
import io.latexium.core.ast.FunctionCall;
import io.latexium.core.ast.Identifier;
import io.latexium.core.ast.Integral;
import io.latexium.core.ast.NodeVisitor;
import io.latexium.core.ast.NumberLiteral;
import io.latexium.core.ast.Product;
import io.latexium.core.ast.Sum;
import io.latexium.core.ast.UnaryExpression;
import io.latexium.core.ast.UnaryOperator;
import io.latexium.core.error.ArithmeticEvalException;
import io.latexium.core.error.UnsupportedConstructException;
import io.latexium.core.structure.Numbers;
import java.util.HashMap;
import java.util.Map;

/**
 * Numeric interpretation of an expression tree in double precision.
 *
 * <p>Free identifiers are looked up in the caller's bindings, then among the constants {@code e}
 * and {@code pi}. Bound identifiers take the value their binder assigns while it iterates.
 * Definite integrals use the composite Simpson rule.
 */
public final class Evaluator {

    static final int SIMPSON_PANELS = 1000;
    static final long MAX_ITERATIONS = 1_000_000;

    /**
     * @throws UnsupportedConstructException for unbound variables, the imaginary unit, comparisons
     *     and indefinite binders
     * @throws ArithmeticEvalException on division by zero or a non-finite intermediate result
     */
    public double evaluate(AstNode node, Map<String, Double> bindings) {
        return node.accept(new Interpreter(Map.copyOf(bindings), Map.of()));
    }

    /** True if {@code node} evaluates without any bindings. */
    public boolean isNumeric(AstNode node) {
        try {
            evaluate(node, Map.of());
            return true;
        } catch (UnsupportedConstructException | ArithmeticEvalException e) {
            return false;
        }
    }

    private static final class Interpreter implements NodeVisitor<Double> {

        private final Map<String, Double> bindings;
        /** Values of bound identifiers, keyed by unique id. */
        private final Map<String, Double> bound;

        Interpreter(Map<String, Double> bindings, Map<String, Double> bound) {
            this.bindings = bindings;
            this.bound = bound;
        }

        private double eval(AstNode node) {
            return node.accept(this);
        }

        private Interpreter with(Identifier variable, double value) {
            Map<String, Double> next = new HashMap<>(bound);
            next.put(variable.uniqueId(), value);
            return new Interpreter(bindings, next);
        }

        @Override
        public Double visitNumber(NumberLiteral node) {
            return node.value();
        }

        @Override
        public Double visitIdentifier(Identifier node) {
            if (!node.isFree()) {
                Double value = bound.get(node.uniqueId());
                if (value == null) {
                    throw new UnsupportedConstructException("Bound variable '" + node.name() + "' has no value here");
                }
                return value;
            }
            Double value = bindings.get(node.name());
            if (value != null) {
                return value;
            }
            return switch (node.name()) {
                case "e" -> Math.E;
                case "pi" -> Math.PI;
                case "i" -> throw new UnsupportedConstructException("The imaginary unit i cannot be evaluated");
                default -> throw new UnsupportedConstructException("Unbound variable '" + node.name() + "'");
            };
        }

        @Override
        public Double visitBinary(BinaryExpression node) {
            double left = eval(node.left());
            double right = eval(node.right());
            return switch (node.operator()) {
                case ADD -> finite(left + right);
                case SUBTRACT -> finite(left - right);
                case MULTIPLY -> finite(left * right);
                case DIVIDE -> divide(left, right);
                case POWER -> power(left, right);
                default -> throw new UnsupportedConstructException(
                        "Comparison '" + node.operator().symbol() + "' has no numeric value");
            };
        }

        @Override
        public Double visitUnary(UnaryExpression node) {
            double value = eval(node.operand());
            return node.operator() == UnaryOperator.MINUS ? -value : value;
        }

        @Override
        public Double visitFunction(FunctionCall node) {
            if (!node.isUnary() || !MathFunctions.isKnown(node.name())) {
                throw new UnsupportedConstructException("Function '" + node.name() + "' cannot be evaluated");
            }
            double argument = eval(node.arg());
            double value = MathFunctions.apply(node.name(), argument);
            if (!Double.isFinite(value)) {
                throw new ArithmeticEvalException(
                        node.name() + "(" + Numbers.format(argument) + ") is undefined");
            }
            return value;
        }

        @Override
        public Double visitFraction(Fraction node) {
            return divide(eval(node.numerator()), eval(node.denominator()));
        }

        @Override
        public Double visitIntegral(Integral node) {
            requireBounds(node);
            double a = eval(node.lower());
            double b = eval(node.upper());
            double h = (b - a) / SIMPSON_PANELS;
            double total = at(node, a) + at(node, b);
            for (int k = 1; k < SIMPSON_PANELS; k++) {
                total += (k % 2 == 1 ? 4 : 2) * at(node, a + k * h);
            }
            return finite(total * h / 3);
        }

        @Override
        public Double visitSum(Sum node) {
            double total = 0;
            for (long k = lower(node), n = upper(node); k <= n; k++) {
                total += at(node, k);
            }
            return finite(total);
        }

        @Override
        public Double visitProduct(Product node) {
            double total = 1;
            for (long k = lower(node), n = upper(node); k <= n; k++) {
                total *= at(node, k);
            }
            return finite(total);
        }

        private double at(Binder binder, double value) {
            return with(binder.variable(), value).eval(binder.body());
        }

        private long lower(Binder binder) {
            requireBounds(binder);
            return integerBound(eval(binder.lower()), binder);
        }

        private long upper(Binder binder) {
            long lower = integerBound(eval(binder.lower()), binder);
            long upper = integerBound(eval(binder.upper()), binder);
            if (upper - lower > MAX_ITERATIONS) {
                throw new UnsupportedConstructException(
                        "Too many terms in " + binder.kind().id() + ": " + (upper - lower + 1));
            }
            return upper;
        }

        private static long integerBound(double value, Binder binder) {
            if (!Numbers.isInteger(Numbers.snap(value))) {
                throw new UnsupportedConstructException(
                        "Bounds of a " + binder.kind().id() + " must be integers, got " + Numbers.format(value));
            }
            return Math.round(value);
        }

        private static void requireBounds(Binder binder) {
            if (!binder.hasBounds()) {
                throw new UnsupportedConstructException(
                        "Indefinite " + binder.kind().id() + " has no numeric value");
            }
        }

        private static double divide(double numerator, double denominator) {
            if (denominator == 0) {
                throw new ArithmeticEvalException("Division by zero");
            }
            return finite(numerator / denominator);
        }

        private static double power(double base, double exponent) {
            if (base == 0 && exponent < 0) {
                throw new ArithmeticEvalException("Division by zero");
            }
            return finite(Math.pow(base, exponent));
        }

        private static double finite(double value) {
            if (!Double.isFinite(value)) {
                throw new ArithmeticEvalException("Result is not a finite number");
            }
            return value;
        }
    }
}
