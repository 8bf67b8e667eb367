package io.latexium.core.ast;

import java.util.List;
import java.util.Objects;

/** Named function application. Arguments are ordered; the list is copied. */
public record FunctionCall(String name, List<AstNode> args) implements AstNode {

    public FunctionCall {
        Objects.requireNonNull(name, "name must not be null");
        args = List.copyOf(args);
    }

    public FunctionCall(String name, AstNode arg) {
        this(name, List.of(arg));
    }

    /** The first argument; most functions are unary. */
    public AstNode arg() {
        if (args.isEmpty()) {
            throw new IllegalStateException("function '" + name + "' has no arguments");
        }
        return args.get(0);
    }

    public boolean isUnary() {
        return args.size() == 1;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitFunction(this);
    }
}
