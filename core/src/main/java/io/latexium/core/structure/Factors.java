package io.latexium.core.structure;

import io.latexium.core.ast.AstNode;
import io.latexium.core.ast.BinaryExpression;
import io.latexium.core.ast.BinaryOperator;
import io.latexium.core.ast.Fraction;
import io.latexium.core.ast.FunctionCall;
import io.latexium.core.ast.NumberLiteral;
import io.latexium.core.ast.Nodes;
import io.latexium.core.ast.UnaryExpression;
import io.latexium.core.ast.UnaryOperator;
import io.latexium.core.error.ArithmeticEvalException;
import java.util.ArrayList;
import java.util.List;

/** Flattening of multiplicative chains into a numeric coefficient and symbolic factors. */
public final class Factors {

    private Factors() {
        // utility class
    }

    /**
     * A product split into its parts. {@code denominators} collects the non-numeric denominators
     * of any fractions met while flattening.
     */
    public record Decomposition(double coefficient, List<AstNode> factors, List<AstNode> denominators) {

        public Decomposition {
            factors = List.copyOf(factors);
            denominators = List.copyOf(denominators);
        }
    }

    public static Decomposition decompose(AstNode node) {
        double[] coefficient = {1.0};
        List<AstNode> factors = new ArrayList<>();
        List<AstNode> denominators = new ArrayList<>();
        walk(node, coefficient, factors, denominators);
        return new Decomposition(coefficient[0], factors, denominators);
    }

    private static void walk(AstNode node, double[] coefficient, List<AstNode> factors, List<AstNode> denominators) {
        double value = Numbers.constantValue(node);
        if (!Double.isNaN(value)) {
            coefficient[0] *= value;
            return;
        }
        if (node instanceof BinaryExpression b && b.operator() == BinaryOperator.MULTIPLY) {
            walk(b.left(), coefficient, factors, denominators);
            walk(b.right(), coefficient, factors, denominators);
        } else if (node instanceof UnaryExpression u) {
            if (u.operator() == UnaryOperator.MINUS) {
                coefficient[0] = -coefficient[0];
            }
            walk(u.operand(), coefficient, factors, denominators);
        } else if (node instanceof Fraction f) {
            double d = Numbers.constantValue(f.denominator());
            if (d == 0) {
                throw new ArithmeticEvalException("Division by zero");
            }
            if (Double.isNaN(d)) {
                denominators.add(f.denominator());
            } else {
                coefficient[0] /= d;
            }
            walk(f.numerator(), coefficient, factors, denominators);
        } else {
            factors.add(node);
        }
    }

    /** Left-associated product of {@code factors}; {@code 1} when empty. */
    public static AstNode chain(List<AstNode> factors) {
        if (factors.isEmpty()) {
            return NumberLiteral.ONE;
        }
        AstNode result = factors.get(0);
        for (int i = 1; i < factors.size(); i++) {
            result = Nodes.mul(result, factors.get(i));
        }
        return result;
    }

    /** Factors of a multiplicative chain, without touching numeric or signed parts. */
    public static List<AstNode> operands(AstNode node) {
        List<AstNode> result = new ArrayList<>();
        collect(node, result);
        return result;
    }

    private static void collect(AstNode node, List<AstNode> out) {
        if (node instanceof BinaryExpression b && b.operator() == BinaryOperator.MULTIPLY) {
            collect(b.left(), out);
            collect(b.right(), out);
        } else {
            out.add(node);
        }
    }

    /** Base of a power, or the node itself. */
    public static AstNode base(AstNode node) {
        if (node instanceof BinaryExpression b && b.operator() == BinaryOperator.POWER) {
            return b.left();
        }
        if (Nodes.isFunction(node, "sqrt")) {
            return ((FunctionCall) node).arg();
        }
        return node;
    }

    /** Exponent of a power ({@code 1/2} for a square root), or {@code 1}. */
    public static AstNode exponent(AstNode node) {
        if (node instanceof BinaryExpression b && b.operator() == BinaryOperator.POWER) {
            return b.right();
        }
        if (Nodes.isFunction(node, "sqrt")) {
            return Numbers.fraction(1, 2);
        }
        return NumberLiteral.ONE;
    }
}
