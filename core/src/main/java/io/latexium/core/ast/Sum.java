package io.latexium.core.ast;

import java.util.Objects;

public record Sum(AstNode body, Identifier variable, AstNode lower, AstNode upper) implements Binder {

    public Sum {
        Objects.requireNonNull(body, "body must not be null");
        Objects.requireNonNull(variable, "variable must not be null");
        if ((lower == null) != (upper == null)) {
            throw new IllegalArgumentException("bounds must be given together or not at all");
        }
    }

    @Override
    public BindingKind kind() {
        return BindingKind.SUM;
    }

    @Override
    public Sum with(AstNode body, Identifier variable, AstNode lower, AstNode upper) {
        return new Sum(body, variable, lower, upper);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitSum(this);
    }
}
