package io.latexium.core.factor;

import io.latexium.core.ast.AstNode;
import io.latexium.core.model.StrategyResult;

/**
 * One factorization pattern. A strategy whose structural precondition does not hold returns
 * {@link StrategyResult#failure(String)}; it never throws for a non-matching input.
 */
public interface FactorStrategy {

    /** Unique name, used in derivation steps and logs. */
    String name();

    /**
     * Attempts to factor {@code node}, an additive expression, with respect to {@code variable}.
     */
    StrategyResult apply(AstNode node, String variable);
}
