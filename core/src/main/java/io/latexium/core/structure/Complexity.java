package io.latexium.core.structure;

import io.latexium.core.ast.AstNode;
import io.latexium.core.ast.BinaryExpression;
import io.latexium.core.ast.Fraction;
import io.latexium.core.ast.FunctionCall;
import io.latexium.core.ast.Identifier;
import io.latexium.core.ast.NumberLiteral;
import io.latexium.core.ast.UnaryExpression;

/**
 * Structural size score used to rank competing successful integration results. Not a
 * correctness signal.
 */
public final class Complexity {

    private Complexity() {
        // utility class
    }

    public static double of(AstNode node) {
        if (node instanceof NumberLiteral) {
            return 0;
        }
        if (node instanceof Identifier) {
            return 0.5;
        }
        if (node instanceof BinaryExpression b) {
            return 1 + of(b.left()) + of(b.right());
        }
        if (node instanceof UnaryExpression u) {
            return 0.5 + of(u.operand());
        }
        if (node instanceof FunctionCall f) {
            double total = 1;
            for (AstNode arg : f.args()) {
                total += of(arg);
            }
            return total;
        }
        if (node instanceof Fraction f) {
            return 1.5 + of(f.numerator()) + of(f.denominator());
        }
        return 2;
    }
}
