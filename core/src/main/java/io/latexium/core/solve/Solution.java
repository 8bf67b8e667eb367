package io.latexium.core.solve;

import io.latexium.core.ast.AstNode;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of solving one equation. Exactly one of three states:
 *
 * <ul>
 *   <li>{@link Type#ROOTS}: one or more real roots, in ascending order;
 *   <li>{@link Type#NONE}: no real root;
 *   <li>{@link Type#ALL}: every value of the variable satisfies the equation.
 * </ul>
 */
public final class Solution {

    public enum Type {
        ROOTS,
        NONE,
        ALL
    }

    private final Type type;
    private final List<AstNode> roots;
    private final List<String> steps;

    private Solution(Type type, List<AstNode> roots, List<String> steps) {
        this.type = type;
        this.roots = List.copyOf(roots);
        this.steps = List.copyOf(steps);
    }

    public static Solution roots(List<AstNode> roots, List<String> steps) {
        Objects.requireNonNull(roots, "roots must not be null");
        if (roots.isEmpty()) {
            throw new IllegalArgumentException("a ROOTS solution needs at least one root");
        }
        return new Solution(Type.ROOTS, roots, steps);
    }

    public static Solution none(List<String> steps) {
        return new Solution(Type.NONE, List.of(), steps);
    }

    public static Solution all(List<String> steps) {
        return new Solution(Type.ALL, List.of(), steps);
    }

    public Type type() {
        return type;
    }

    /** Roots in ascending order; empty unless {@code type() == ROOTS}. */
    public List<AstNode> roots() {
        return roots;
    }

    public List<String> steps() {
        return steps;
    }

    @Override
    public String toString() {
        return switch (type) {
            case ROOTS -> "Solution[ROOTS, count=" + roots.size() + "]";
            case NONE -> "Solution[NONE]";
            case ALL -> "Solution[ALL]";
        };
    }
}
