package io.latexium.core.structure;

import io.latexium.core.ast.AstNode;
import io.latexium.core.ast.Nodes;
import java.util.List;
import java.util.Set;

/** Picks the variable an operation should work in when the caller does not name one. */
public final class VariableInference {

    public static final String DEFAULT_VARIABLE = "x";

    private static final List<String> PRIORITY = List.of("x", "y", "z", "t", "u", "v", "w");
    private static final Set<String> CONSTANTS = Set.of("e", "pi", "i");

    private VariableInference() {
        // utility class
    }

    /** First free variable by priority x, y, z, t, u, v, w, then alphabetical; {@code x} if none. */
    public static String infer(AstNode node) {
        Set<String> free = Nodes.freeVariables(node);
        free.removeAll(CONSTANTS);
        for (String candidate : PRIORITY) {
            if (free.contains(candidate)) {
                return candidate;
            }
        }
        return free.isEmpty() ? DEFAULT_VARIABLE : free.iterator().next();
    }
}
