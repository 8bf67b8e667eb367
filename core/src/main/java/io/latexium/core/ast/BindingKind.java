package io.latexium.core.ast;

/** The binder form that introduced a bound variable. */
public enum BindingKind {
    INTEGRAL("integral"),
    SUM("sum"),
    PRODUCT("product");

    private final String id;

    BindingKind(String id) {
        this.id = id;
    }

    /** Lower-case name used in unique ids and JSON. */
    public String id() {
        return id;
    }
}
