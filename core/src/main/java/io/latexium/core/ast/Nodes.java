package io.latexium.core.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;

/** Construction and inspection helpers shared by every rewrite pass. */
public final class Nodes {

    private Nodes() {
        // utility class
    }

    // --- Construction ---

    public static NumberLiteral num(double value) {
        return new NumberLiteral(value);
    }

    public static Identifier var(String name) {
        return Identifier.free(name);
    }

    public static BinaryExpression add(AstNode left, AstNode right) {
        return new BinaryExpression(BinaryOperator.ADD, left, right);
    }

    public static BinaryExpression sub(AstNode left, AstNode right) {
        return new BinaryExpression(BinaryOperator.SUBTRACT, left, right);
    }

    public static BinaryExpression mul(AstNode left, AstNode right) {
        return new BinaryExpression(BinaryOperator.MULTIPLY, left, right);
    }

    public static BinaryExpression pow(AstNode base, AstNode exponent) {
        return new BinaryExpression(BinaryOperator.POWER, base, exponent);
    }

    public static BinaryExpression pow(AstNode base, double exponent) {
        return pow(base, num(exponent));
    }

    public static Fraction frac(AstNode numerator, AstNode denominator) {
        return new Fraction(numerator, denominator);
    }

    public static UnaryExpression neg(AstNode operand) {
        return new UnaryExpression(UnaryOperator.MINUS, operand);
    }

    public static FunctionCall fn(String name, AstNode... args) {
        return new FunctionCall(name, Arrays.asList(args));
    }

    /** {@code ln|u|}, the antiderivative form of {@code 1/u}. */
    public static FunctionCall lnAbs(AstNode argument) {
        return fn("ln", fn("abs", argument));
    }

    // --- Inspection ---

    public static boolean isNumber(AstNode node) {
        return node instanceof NumberLiteral;
    }

    public static boolean isNumber(AstNode node, double value) {
        return node instanceof NumberLiteral n && n.value() == value;
    }

    public static boolean isOperator(AstNode node, BinaryOperator operator) {
        return node instanceof BinaryExpression b && b.operator() == operator;
    }

    public static boolean isFunction(AstNode node, String name) {
        return node instanceof FunctionCall f && f.name().equals(name) && f.isUnary();
    }

    public static boolean isNegation(AstNode node) {
        return node instanceof UnaryExpression u && u.operator() == UnaryOperator.MINUS;
    }

    /** Direct children in source order; binder bounds come after the body. */
    public static List<AstNode> children(AstNode node) {
        if (node instanceof BinaryExpression b) {
            return List.of(b.left(), b.right());
        }
        if (node instanceof UnaryExpression u) {
            return List.of(u.operand());
        }
        if (node instanceof FunctionCall f) {
            return f.args();
        }
        if (node instanceof Fraction f) {
            return List.of(f.numerator(), f.denominator());
        }
        if (node instanceof Binder b) {
            List<AstNode> result = new ArrayList<>();
            result.add(b.body());
            if (b.hasBounds()) {
                result.add(b.lower());
                result.add(b.upper());
            }
            return result;
        }
        return List.of();
    }

    /** Rebuilds {@code node} with every direct child replaced by {@code fn(child)}. */
    public static AstNode mapChildren(AstNode node, Function<AstNode, AstNode> fn) {
        if (node instanceof BinaryExpression b) {
            return new BinaryExpression(b.operator(), fn.apply(b.left()), fn.apply(b.right()));
        }
        if (node instanceof UnaryExpression u) {
            return new UnaryExpression(u.operator(), fn.apply(u.operand()));
        }
        if (node instanceof FunctionCall f) {
            return new FunctionCall(f.name(), f.args().stream().map(fn).toList());
        }
        if (node instanceof Fraction f) {
            return new Fraction(fn.apply(f.numerator()), fn.apply(f.denominator()));
        }
        if (node instanceof Binder b) {
            return b.with(
                    fn.apply(b.body()),
                    b.variable(),
                    b.hasBounds() ? fn.apply(b.lower()) : null,
                    b.hasBounds() ? fn.apply(b.upper()) : null);
        }
        return node;
    }

    /**
     * True if a free occurrence of {@code variable} appears anywhere in {@code node}. Occurrences
     * bound by an inner binder do not count.
     */
    public static boolean dependsOn(AstNode node, String variable) {
        if (node instanceof Identifier id) {
            return id.isFreeOccurrenceOf(variable);
        }
        for (AstNode child : children(node)) {
            if (dependsOn(child, variable)) {
                return true;
            }
        }
        return false;
    }

    /** Names of all free identifiers, sorted. */
    public static Set<String> freeVariables(AstNode node) {
        Set<String> names = new TreeSet<>();
        collectFree(node, names);
        return names;
    }

    private static void collectFree(AstNode node, Set<String> names) {
        if (node instanceof Identifier id) {
            if (id.isFree()) {
                names.add(id.name());
            }
            return;
        }
        for (AstNode child : children(node)) {
            collectFree(child, names);
        }
    }

    /** Replaces every free occurrence of {@code variable} with {@code replacement}. */
    public static AstNode substitute(AstNode node, String variable, AstNode replacement) {
        if (node instanceof Identifier id) {
            return id.isFreeOccurrenceOf(variable) ? replacement : id;
        }
        return mapChildren(node, child -> substitute(child, variable, replacement));
    }

    /** Replaces every subtree structurally equal to {@code target}. */
    public static AstNode replace(AstNode node, AstNode target, AstNode replacement) {
        if (node.equals(target)) {
            return replacement;
        }
        return mapChildren(node, child -> replace(child, target, replacement));
    }
}
