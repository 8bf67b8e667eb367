package io.latexium.core.ast;

/** Whether an identifier occurrence is bound by an enclosing binder. */
public enum Scope {
    FREE,
    BOUND
}
