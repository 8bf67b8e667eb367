package io.latexium.core.structure;

import io.latexium.core.ast.AstNode;
import io.latexium.core.ast.BinaryExpression;
import io.latexium.core.ast.BinaryOperator;
import io.latexium.core.ast.Binder;
import io.latexium.core.ast.Fraction;
import io.latexium.core.ast.FunctionCall;
import io.latexium.core.ast.Identifier;
import io.latexium.core.ast.NumberLiteral;
import io.latexium.core.ast.UnaryExpression;
import io.latexium.core.ast.UnaryOperator;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Normalization key for like-term grouping. Addition and multiplication are keyed as sorted
 * multisets, and scope metadata is dropped, so {@code y*x} and {@code x*y} share a key regardless
 * of where their identifiers came from.
 */
public final class CanonicalKey {

    private CanonicalKey() {
        // utility class
    }

    public static String of(AstNode node) {
        if (node instanceof NumberLiteral n) {
            return Numbers.format(n.value());
        }
        if (node instanceof Identifier id) {
            return id.name();
        }
        if (node instanceof BinaryExpression b) {
            return switch (b.operator()) {
                case ADD, SUBTRACT -> additive(node);
                case MULTIPLY -> multiplicative(node);
                case POWER -> "{" + of(b.left()) + "}^{" + of(b.right()) + "}";
                default -> "(" + of(b.left()) + b.operator().symbol() + of(b.right()) + ")";
            };
        }
        if (node instanceof UnaryExpression u) {
            return u.operator() == UnaryOperator.MINUS ? additive(node) : of(u.operand());
        }
        if (node instanceof FunctionCall f) {
            return f.name() + "(" + f.args().stream().map(CanonicalKey::of).collect(Collectors.joining(",")) + ")";
        }
        if (node instanceof Fraction f) {
            return "frac{" + of(f.numerator()) + "}{" + of(f.denominator()) + "}";
        }
        Binder binder = (Binder) node;
        String bounds = binder.hasBounds() ? "[" + of(binder.lower()) + "," + of(binder.upper()) + "]" : "";
        return binder.kind().id() + "_" + binder.variable().name() + bounds + "(" + of(binder.body()) + ")";
    }

    private static String additive(AstNode node) {
        List<String> keys = new ArrayList<>();
        collectAdditive(node, false, keys);
        Collections.sort(keys);
        return "(" + String.join("+", keys) + ")";
    }

    private static void collectAdditive(AstNode node, boolean negated, List<String> keys) {
        if (node instanceof BinaryExpression b && b.operator() == BinaryOperator.ADD) {
            collectAdditive(b.left(), negated, keys);
            collectAdditive(b.right(), negated, keys);
        } else if (node instanceof BinaryExpression b && b.operator() == BinaryOperator.SUBTRACT) {
            collectAdditive(b.left(), negated, keys);
            collectAdditive(b.right(), !negated, keys);
        } else if (node instanceof UnaryExpression u) {
            collectAdditive(u.operand(), negated ^ (u.operator() == UnaryOperator.MINUS), keys);
        } else {
            keys.add((negated ? "-" : "") + of(node));
        }
    }

    private static String multiplicative(AstNode node) {
        List<String> keys = new ArrayList<>();
        collectMultiplicative(node, keys);
        Collections.sort(keys);
        return "[" + String.join("*", keys) + "]";
    }

    private static void collectMultiplicative(AstNode node, List<String> keys) {
        if (node instanceof BinaryExpression b && b.operator() == BinaryOperator.MULTIPLY) {
            collectMultiplicative(b.left(), keys);
            collectMultiplicative(b.right(), keys);
        } else {
            keys.add(of(node));
        }
    }
}
