package io.latexium.core.ast;

import java.util.Objects;

/**
 * Variable reference. Free occurrences carry {@code free_<name>} as unique id; bound occurrences
 * carry {@code bound_<name>_<depth>_<kind>} of the binder that owns them, so two occurrences of the
 * same name under different binders never compare equal.
 */
public record Identifier(String name, Scope scope, Integer bindingDepth, BindingKind bindingKind, String uniqueId)
        implements AstNode {

    public Identifier {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(scope, "scope must not be null");
        Objects.requireNonNull(uniqueId, "uniqueId must not be null");
        if (scope == Scope.BOUND && (bindingDepth == null || bindingKind == null)) {
            throw new IllegalArgumentException("bound identifier '" + name + "' needs a binding depth and kind");
        }
    }

    /** Creates a free occurrence of {@code name}. */
    public static Identifier free(String name) {
        return new Identifier(name, Scope.FREE, null, null, "free_" + name);
    }

    /** Creates an occurrence bound by the binder at {@code depth} of the given kind. */
    public static Identifier bound(String name, int depth, BindingKind kind) {
        return new Identifier(name, Scope.BOUND, depth, kind, "bound_" + name + "_" + depth + "_" + kind.id());
    }

    public boolean isFree() {
        return scope == Scope.FREE;
    }

    /** True if this is the free occurrence of {@code variable}. */
    public boolean isFreeOccurrenceOf(String variable) {
        return scope == Scope.FREE && name.equals(variable);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitIdentifier(this);
    }
}
