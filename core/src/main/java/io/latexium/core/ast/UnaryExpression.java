package io.latexium.core.ast;

import java.util.Objects;

public record UnaryExpression(UnaryOperator operator, AstNode operand) implements AstNode {

    public UnaryExpression {
        Objects.requireNonNull(operator, "operator must not be null");
        Objects.requireNonNull(operand, "operand must not be null");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitUnary(this);
    }
}
