package io.latexium.core.ast;

import java.util.Objects;

public record BinaryExpression(BinaryOperator operator, AstNode left, AstNode right) implements AstNode {

    public BinaryExpression {
        Objects.requireNonNull(operator, "operator must not be null");
        Objects.requireNonNull(left, "left must not be null");
        Objects.requireNonNull(right, "right must not be null");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitBinary(this);
    }
}
