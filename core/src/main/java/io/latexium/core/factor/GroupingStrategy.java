package io.latexium.core.factor;

import io.latexium.core.ast.AstNode;
import io.latexium.core.model.StrategyResult;
import io.latexium.core.structure.Factors;
import io.latexium.core.structure.Numbers;
import io.latexium.core.structure.Polynomial;
import java.util.List;
import java.util.Optional;

/**
 * Pairs the terms of a four-term cubic: {@code ax^3 + bx^2 + cx + d = (x^2 + d/b)(ax + b)} when
 * {@code ad = bc}.
 */
public final class GroupingStrategy implements FactorStrategy {

    @Override
    public String name() {
        return "grouping";
    }

    @Override
    public StrategyResult apply(AstNode node, String variable) {
        Optional<Polynomial> extracted = Polynomial.from(node, variable);
        if (extracted.isEmpty()
                || extracted.get().degree() != 3
                || extracted.get().termCount() != 4
                || !extracted.get().hasIntegerCoefficients()) {
            return StrategyResult.failure("Not a four-term integer cubic");
        }
        Polynomial p = extracted.get();
        long a = (long) p.coefficient(3);
        long b = (long) p.coefficient(2);
        long c = (long) p.coefficient(1);
        long d = (long) p.coefficient(0);
        if (a * d != b * c) {
            return StrategyResult.failure("Term pairs share no binomial");
        }
        long g = Numbers.gcd(a, b);
        if (a < 0) {
            g = -g;
        }
        Polynomial linear = Polynomial.of(b / (double) g, a / (double) g);
        Polynomial quadratic = Polynomial.of(g * (double) d / b, 0, g);
        if (!quadratic.hasIntegerCoefficients()) {
            return StrategyResult.failure("Grouping leaves fractional coefficients");
        }
        AstNode result = Factors.chain(List.of(quadratic.toAst(variable), linear.toAst(variable)));
        return StrategyResult.success(result, "Grouped terms in pairs");
    }
}
