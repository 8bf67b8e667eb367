package io.latexium.core.integrate;

import io.latexium.core.ast.AstNode;
import io.latexium.core.model.StrategyResult;

/**
 * One integration technique. Strategies are tried in ascending {@link #priority()}; a strategy
 * that does not apply returns {@link StrategyResult#failure(String)} rather than throwing.
 */
public interface IntegrationStrategy {

    /** Unique name, used in derivation steps, logs and the attempted-strategy guard. */
    String name();

    /** Lower runs first. Priorities 1 and 2 are trusted: their first success ends the search. */
    int priority();

    /** Cheap structural check; {@link #integrate} is only called when this returns true. */
    boolean canHandle(AstNode node, IntegrationContext context);

    /**
     * Attempts an antiderivative of {@code node} with respect to {@link
     * IntegrationContext#variable()}. Sub-problems go through {@link
     * IntegrationContext#recurse(AstNode)}.
     */
    StrategyResult integrate(AstNode node, IntegrationContext context);
}
