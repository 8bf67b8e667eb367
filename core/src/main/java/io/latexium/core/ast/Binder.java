package io.latexium.core.ast;

/**
 * A node that binds a variable over its body: integral, sum, or product. Bounds are optional and
 * are always resolved in the enclosing scope, never the binder's own.
 */
public sealed interface Binder extends AstNode permits Integral, Sum, Product {

    AstNode body();

    Identifier variable();

    /** Lower bound, or {@code null} for an indefinite form. */
    AstNode lower();

    /** Upper bound, or {@code null} for an indefinite form. */
    AstNode upper();

    BindingKind kind();

    /** Returns a binder of the same kind with the given parts. */
    Binder with(AstNode body, Identifier variable, AstNode lower, AstNode upper);

    default boolean hasBounds() {
        return lower() != null && upper() != null;
    }
}
