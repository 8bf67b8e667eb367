package io.latexium.core.ast;

/** Exhaustive dispatch over {@link AstNode} variants. */
public interface NodeVisitor<R> {

    R visitNumber(NumberLiteral node);

    R visitIdentifier(Identifier node);

    R visitBinary(BinaryExpression node);

    R visitUnary(UnaryExpression node);

    R visitFunction(FunctionCall node);

    R visitFraction(Fraction node);

    R visitIntegral(Integral node);

    R visitSum(Sum node);

    R visitProduct(Product node);
}
