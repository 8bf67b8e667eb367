package io.latexium.core.model;

import io.latexium.core.ast.AstNode;
import io.latexium.core.structure.Complexity;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one integration or factorization strategy. A failure is an ordinary value: {@code
 * result} is {@code null} and {@code steps} explains why the strategy did not apply.
 */
public record StrategyResult(AstNode result, boolean success, List<String> steps, double complexity) {

    public StrategyResult {
        steps = List.copyOf(steps);
        if (success) {
            Objects.requireNonNull(result, "result must not be null for a successful strategy");
        } else if (result != null) {
            throw new IllegalArgumentException("a failed strategy carries no result");
        }
    }

    public static StrategyResult success(AstNode result, List<String> steps) {
        return new StrategyResult(result, true, steps, Complexity.of(result));
    }

    public static StrategyResult success(AstNode result, String... steps) {
        return success(result, List.of(steps));
    }

    public static StrategyResult failure(String reason) {
        return new StrategyResult(null, false, List.of(reason), Double.POSITIVE_INFINITY);
    }
}
