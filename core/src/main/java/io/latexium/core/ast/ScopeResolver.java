package io.latexium.core.ast;

/**
 * Annotates every identifier as free or bound. Resolution runs top-down with a persistent binder
 * stack: each recursive call receives the stack of its ancestors, so sibling subtrees (an
 * integrand and its bounds) never observe each other's binders.
 */
public final class ScopeResolver {

    private ScopeResolver() {
        // utility class
    }

    /** Returns a copy of {@code root} with all identifiers annotated. Total over well-formed trees. */
    public static AstNode resolve(AstNode root) {
        return resolve(root, BinderStack.EMPTY);
    }

    /**
     * Returns the body of {@code binder} re-resolved as a top-level tree, so the variable it bound
     * becomes free. Used when a parsed {@code \int f dx} is handed to the integrator.
     */
    public static AstNode release(Binder binder) {
        return resolve(binder.body());
    }

    private static AstNode resolve(AstNode node, BinderStack stack) {
        if (node instanceof Identifier id) {
            BinderStack frame = stack.lookup(id.name());
            return frame == null ? Identifier.free(id.name()) : Identifier.bound(id.name(), frame.depth, frame.kind);
        }
        if (node instanceof Binder binder) {
            BinderStack inner = stack.push(binder.variable().name(), binder.kind());
            Identifier variable = Identifier.bound(binder.variable().name(), inner.depth, inner.kind);
            AstNode body = resolve(binder.body(), inner);
            // bounds see the enclosing scope only
            AstNode lower = binder.hasBounds() ? resolve(binder.lower(), stack) : null;
            AstNode upper = binder.hasBounds() ? resolve(binder.upper(), stack) : null;
            return binder.with(body, variable, lower, upper);
        }
        return Nodes.mapChildren(node, child -> resolve(child, stack));
    }

    /** Immutable linked stack of active binders; the head is the innermost. */
    private static final class BinderStack {

        static final BinderStack EMPTY = new BinderStack(null, 0, null, null);

        final String name;
        final int depth;
        final BindingKind kind;
        final BinderStack parent;

        private BinderStack(String name, int depth, BindingKind kind, BinderStack parent) {
            this.name = name;
            this.depth = depth;
            this.kind = kind;
            this.parent = parent;
        }

        BinderStack push(String variable, BindingKind bindingKind) {
            return new BinderStack(variable, depth + 1, bindingKind, this);
        }

        BinderStack lookup(String variable) {
            for (BinderStack frame = this; frame != EMPTY; frame = frame.parent) {
                if (frame.name.equals(variable)) {
                    return frame;
                }
            }
            return null;
        }
    }
}
