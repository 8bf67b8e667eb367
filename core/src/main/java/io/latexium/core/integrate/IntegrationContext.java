package io.latexium.core.integrate;

import io.latexium.core.ast.AstNode;
import io.latexium.core.model.StrategyResult;
import io.latexium.core.structure.CanonicalKey;
import java.util.HashSet;
import java.util.Set;

/**
 * State of one integration call chain: the variable, the recursion depth and the strategies
 * already tried. A strategy that failed on a node is not retried on the same node further down
 * the chain; a sub-problem on a different node sees every strategy again.
 */
public final class IntegrationContext {

    private final IntegrationEngine engine;
    private final String variable;
    private final int depth;
    private final int maxDepth;
    private final Set<String> attempted;

    IntegrationContext(IntegrationEngine engine, String variable, int depth, int maxDepth, Set<String> attempted) {
        this.engine = engine;
        this.variable = variable;
        this.depth = depth;
        this.maxDepth = maxDepth;
        this.attempted = attempted;
    }

    public String variable() {
        return variable;
    }

    public int depth() {
        return depth;
    }

    public int maxDepth() {
        return maxDepth;
    }

    /** Integrates a sub-problem one level deeper, in the same variable. */
    public StrategyResult recurse(AstNode node) {
        return recurse(node, variable);
    }

    /** Integrates a sub-problem one level deeper, in {@code newVariable}. */
    public StrategyResult recurse(AstNode node, String newVariable) {
        IntegrationContext child =
                new IntegrationContext(engine, newVariable, depth + 1, maxDepth, new HashSet<>(attempted));
        return engine.integrate(node, child);
    }

    boolean isAttempted(String strategy, AstNode node) {
        return attempted.contains(key(strategy, node));
    }

    void markAttempted(String strategy, AstNode node) {
        attempted.add(key(strategy, node));
    }

    private String key(String strategy, AstNode node) {
        return strategy + "|" + variable + "|" + CanonicalKey.of(node);
    }
}
