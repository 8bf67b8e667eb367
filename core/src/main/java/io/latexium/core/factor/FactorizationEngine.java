package io.latexium.core.factor;

import io.latexium.core.ast.AstNode;
import io.latexium.core.ast.BinaryExpression;
import io.latexium.core.ast.BinaryOperator;
import io.latexium.core.ast.Fraction;
import io.latexium.core.ast.Nodes;
import io.latexium.core.error.StrategyRegistrationException;
import io.latexium.core.model.StrategyResult;
import io.latexium.core.structure.Factors;
import io.latexium.core.structure.Terms;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs factorization strategies in a fixed order; the first strategy that matches wins. Factors
 * produced by a match are factored again, so {@code 3x^2 - 3} ends as {@code 3(x - 1)(x + 1)}.
 *
 * <p>Unlike integration, matches are not ranked by complexity. The strategy set is validated at
 * construction: an engine never runs with a partial set.
 */
public final class FactorizationEngine {

    private static final Logger LOG = LoggerFactory.getLogger(FactorizationEngine.class);

    static final int MAX_NESTING = 6;

    private final List<FactorStrategy> strategies;

    public FactorizationEngine() {
        this(defaultStrategies());
    }

    public FactorizationEngine(List<FactorStrategy> strategies) {
        if (strategies == null || strategies.isEmpty()) {
            throw new StrategyRegistrationException("Factorization engine requires at least one strategy");
        }
        Set<String> names = new HashSet<>();
        for (FactorStrategy strategy : strategies) {
            if (strategy == null) {
                throw new StrategyRegistrationException("Factorization strategy list contains null");
            }
            String name = strategy.name();
            if (name == null || name.isEmpty()) {
                throw new StrategyRegistrationException("Factorization strategy name must not be null or empty");
            }
            if (!names.add(name)) {
                throw new StrategyRegistrationException("Duplicate factorization strategy: '" + name + "'");
            }
        }
        this.strategies = List.copyOf(strategies);
    }

    /** Common factor, difference of squares, quadratic, grouping, cubic, substitution, perfect power. */
    public static List<FactorStrategy> defaultStrategies() {
        return List.of(
                new CommonFactorStrategy(),
                new DifferenceOfSquaresStrategy(),
                new QuadraticStrategy(),
                new GroupingStrategy(),
                new CubicStrategy(),
                new SubstitutionStrategy(),
                new PerfectPowerStrategy());
    }

    public List<String> strategyNames() {
        return strategies.stream().map(FactorStrategy::name).toList();
    }

    /** Factored form of {@code node}, or {@code node} itself if no pattern matches. */
    public AstNode factor(AstNode node, String variable) {
        return factor(node, variable, 0, new ArrayList<>());
    }

    /** Like {@link #factor} but reports the strategies that matched. */
    public StrategyResult factorWithSteps(AstNode node, String variable) {
        List<String> steps = new ArrayList<>();
        AstNode result = factor(node, variable, 0, steps);
        if (steps.isEmpty()) {
            return StrategyResult.failure("No factorization pattern matched");
        }
        return StrategyResult.success(result, steps);
    }

    private AstNode factor(AstNode node, String variable, int nesting, List<String> steps) {
        if (nesting > MAX_NESTING) {
            return node;
        }
        if (node instanceof Fraction f) {
            return Nodes.frac(
                    factor(f.numerator(), variable, nesting + 1, steps),
                    factor(f.denominator(), variable, nesting + 1, steps));
        }
        if (Nodes.isOperator(node, BinaryOperator.MULTIPLY) || Nodes.isOperator(node, BinaryOperator.POWER)) {
            return refine(node, variable, nesting + 1, steps);
        }
        if (!Terms.isSum(node)) {
            return node;
        }
        for (FactorStrategy strategy : strategies) {
            StrategyResult result;
            try {
                result = strategy.apply(node, variable);
            } catch (RuntimeException e) {
                LOG.debug("factor.strategy name={} outcome=error detail={}", strategy.name(), e.getMessage());
                continue;
            }
            if (result.success()) {
                LOG.debug("factor.strategy name={} outcome=success", strategy.name());
                steps.addAll(result.steps());
                return refine(result.result(), variable, nesting + 1, steps);
            }
        }
        return node;
    }

    /** Factors every additive factor of a product, including the bases of powers. */
    private AstNode refine(AstNode node, String variable, int nesting, List<String> steps) {
        List<AstNode> refined = new ArrayList<>();
        for (AstNode operand : Factors.operands(node)) {
            if (operand instanceof BinaryExpression b && b.operator() == BinaryOperator.POWER) {
                refined.add(Nodes.pow(factor(b.left(), variable, nesting, steps), b.right()));
            } else {
                refined.add(factor(operand, variable, nesting, steps));
            }
        }
        return Factors.chain(refined);
    }
}
