package io.latexium.core.ast;

/**
 * Expression tree node. The hierarchy is closed: every rewrite pass handles each variant through
 * {@link NodeVisitor}, so adding a variant breaks compilation at every site that must learn about
 * it.
 *
 * <p>Nodes are immutable. Rewrites always build new nodes; subtrees may be shared freely.
 */
public sealed interface AstNode
        permits NumberLiteral, Identifier, BinaryExpression, UnaryExpression, FunctionCall, Fraction, Binder {

    <R> R accept(NodeVisitor<R> visitor);
}
