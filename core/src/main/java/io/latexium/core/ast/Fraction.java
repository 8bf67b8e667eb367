package io.latexium.core.ast;

import java.util.Objects;

public record Fraction(AstNode numerator, AstNode denominator) implements AstNode {

    public Fraction {
        Objects.requireNonNull(numerator, "numerator must not be null");
        Objects.requireNonNull(denominator, "denominator must not be null");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitFraction(this);
    }
}
