package io.latexium.core.ast;

/** Numeric constant. Negative zero is normalized to zero so structural equality stays exact. */
public record NumberLiteral(double value) implements AstNode {

    public static final NumberLiteral ZERO = new NumberLiteral(0);
    public static final NumberLiteral ONE = new NumberLiteral(1);

    public NumberLiteral {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("number literal must be finite: " + value);
        }
        if (value == 0.0) {
            value = 0.0;
        }
    }

    public boolean isInteger() {
        return value == Math.rint(value) && Math.abs(value) < 1e15;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitNumber(this);
    }
}
