package io.latexium.core.solve;

import io.latexium.core.ast.AstNode;
import io.latexium.core.ast.BinaryExpression;
import io.latexium.core.ast.BinaryOperator;
import io.latexium.core.ast.Nodes;
import io.latexium.core.error.UnsupportedConstructException;
import io.latexium.core.simplify.Simplifier;
import io.latexium.core.structure.Numbers;
import io.latexium.core.structure.Polynomial;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Real roots of polynomial equations of degree at most two. An equation {@code l = r} is solved
 * as {@code l - r = 0}; any other expression is taken to equal zero.
 */
public final class Solver {

    static final int MAX_DEGREE = 2;

    private final Simplifier simplifier;

    public Solver(Simplifier simplifier) {
        this.simplifier = Objects.requireNonNull(simplifier, "simplifier must not be null");
    }

    /**
     * @throws UnsupportedConstructException for inequalities, non-polynomial input and degree
     *     above two
     */
    public Solution solve(AstNode node, String variable) {
        AstNode expression = toZeroForm(node);
        Polynomial p = Polynomial.from(expression, variable)
                .or(() -> Polynomial.from(simplifier.simplify(expression), variable))
                .orElseThrow(() -> new UnsupportedConstructException(
                        "Equation is not a polynomial in " + variable + " with numeric coefficients"));
        List<String> steps = new ArrayList<>();
        steps.add("Solving for " + variable);
        steps.add("Polynomial of degree " + p.degree());
        if (p.degree() > MAX_DEGREE) {
            throw new UnsupportedConstructException(
                    "Equations of degree " + p.degree() + " are not supported");
        }
        return switch (p.degree()) {
            case 0 -> constant(p.coefficient(0), steps);
            case 1 -> linear(p.coefficient(1), p.coefficient(0), variable, steps);
            default -> quadratic(p.coefficient(2), p.coefficient(1), p.coefficient(0), steps);
        };
    }

    private static AstNode toZeroForm(AstNode node) {
        if (node instanceof BinaryExpression b && b.operator().isComparison()) {
            if (b.operator() != BinaryOperator.EQUALS) {
                throw new UnsupportedConstructException("Inequalities cannot be solved");
            }
            return Nodes.sub(b.left(), b.right());
        }
        return node;
    }

    private static Solution constant(double c, List<String> steps) {
        if (Numbers.snap(c) == 0) {
            steps.add("Equation has infinitely many solutions");
            return Solution.all(steps);
        }
        steps.add("No solutions");
        return Solution.none(steps);
    }

    private static Solution linear(double a, double b, String variable, List<String> steps) {
        steps.add("Linear equation: " + variable + " = " + Numbers.format(-b) + " / " + Numbers.format(a));
        return Solution.roots(List.of(Numbers.toNode(-b / a)), steps);
    }

    private Solution quadratic(double a, double b, double c, List<String> steps) {
        double discriminant = Numbers.snap(b * b - 4 * a * c);
        steps.add("Discriminant: " + Numbers.format(discriminant));
        if (discriminant < 0) {
            steps.add("No real solutions");
            return Solution.none(steps);
        }
        if (discriminant == 0) {
            steps.add("Repeated root");
            return Solution.roots(List.of(Numbers.toNode(-b / (2 * a))), steps);
        }
        double root = Math.sqrt(discriminant);
        double low = (-b - root) / (2 * a);
        double high = (-b + root) / (2 * a);
        List<AstNode> roots = new ArrayList<>();
        Optional<AstNode> exactRoot = Numbers.exact(root);
        if (exactRoot.isPresent()) {
            roots.add(Numbers.toNode(Math.min(low, high)));
            roots.add(Numbers.toNode(Math.max(low, high)));
        } else {
            AstNode radical = Nodes.fn("sqrt", Numbers.toNode(discriminant));
            AstNode minus = symbolicRoot(Nodes.sub(Numbers.toNode(-b), radical), a);
            AstNode plus = symbolicRoot(Nodes.add(Numbers.toNode(-b), radical), a);
            // with a < 0 the "+" branch is the smaller root
            if (a > 0) {
                roots.add(minus);
                roots.add(plus);
            } else {
                roots.add(plus);
                roots.add(minus);
            }
        }
        return Solution.roots(roots, steps);
    }

    private AstNode symbolicRoot(AstNode numerator, double a) {
        return simplifier.simplify(Nodes.frac(numerator, Numbers.toNode(2 * a)));
    }
}
