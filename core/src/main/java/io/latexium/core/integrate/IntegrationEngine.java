package io.latexium.core.integrate;

import io.latexium.core.ast.AstNode;
import io.latexium.core.calculus.Differentiator;
import io.latexium.core.error.StrategyRegistrationException;
import io.latexium.core.model.StrategyResult;
import io.latexium.core.simplify.Simplifier;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Strategy search for antiderivatives.
 *
 * <p>Strategies run in ascending priority. The first success of a priority 1 or 2 strategy is
 * returned at once; later successes compete on {@link StrategyResult#complexity()}, the first
 * one winning ties, and a result of complexity 1 or less ends the search early.
 */
public final class IntegrationEngine {

    private static final Logger LOG = LoggerFactory.getLogger(IntegrationEngine.class);

    public static final int DEFAULT_MAX_DEPTH = 3;

    static final int TRUSTED_PRIORITY = 2;
    static final String NO_STRATEGY = "No suitable integration strategy found";

    private final List<IntegrationStrategy> strategies;
    private final Simplifier simplifier;
    private final int maxDepth;

    public IntegrationEngine(Simplifier simplifier) {
        this(simplifier, DEFAULT_MAX_DEPTH);
    }

    public IntegrationEngine(Simplifier simplifier, int maxDepth) {
        this(defaultStrategies(simplifier, new Differentiator(simplifier)), simplifier, maxDepth);
    }

    public IntegrationEngine(List<IntegrationStrategy> strategies, Simplifier simplifier, int maxDepth) {
        this.simplifier = Objects.requireNonNull(simplifier, "simplifier must not be null");
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must not be negative, got " + maxDepth);
        }
        this.maxDepth = maxDepth;
        this.strategies = validate(strategies);
    }

    /** Basic, trigonometric, substitution, rational, by parts. */
    public static List<IntegrationStrategy> defaultStrategies(Simplifier simplifier, Differentiator differentiator) {
        return List.of(
                new BasicStrategy(),
                new TrigonometricStrategy(),
                new SubstitutionStrategy(simplifier, differentiator),
                new RationalStrategy(simplifier),
                new IntegrationByPartsStrategy(differentiator));
    }

    private static List<IntegrationStrategy> validate(List<IntegrationStrategy> strategies) {
        if (strategies == null || strategies.isEmpty()) {
            throw new StrategyRegistrationException("Integration engine requires at least one strategy");
        }
        Set<String> names = new HashSet<>();
        for (IntegrationStrategy strategy : strategies) {
            if (strategy == null) {
                throw new StrategyRegistrationException("Integration strategy list contains null");
            }
            String name = strategy.name();
            if (name == null || name.isEmpty()) {
                throw new StrategyRegistrationException("Integration strategy name must not be null or empty");
            }
            if (!names.add(name)) {
                throw new StrategyRegistrationException("Duplicate integration strategy: '" + name + "'");
            }
            if (strategy.priority() < 1) {
                throw new StrategyRegistrationException(
                        "Integration strategy '" + name + "' has invalid priority " + strategy.priority());
            }
        }
        List<IntegrationStrategy> sorted = new ArrayList<>(strategies);
        sorted.sort(Comparator.comparingInt(IntegrationStrategy::priority));
        return List.copyOf(sorted);
    }

    public List<String> strategyNames() {
        return strategies.stream().map(IntegrationStrategy::name).toList();
    }

    public int maxDepth() {
        return maxDepth;
    }

    /** A fresh top-level context for {@code variable}. */
    public IntegrationContext rootContext(String variable) {
        return new IntegrationContext(this, variable, 0, maxDepth, new HashSet<>());
    }

    public StrategyResult integrate(AstNode node, String variable) {
        Objects.requireNonNull(variable, "variable must not be null");
        return integrate(node, rootContext(variable));
    }

    /**
     * Searches the strategies in priority order. A successful result's steps start with the
     * failures of the strategies tried before it, each as {@code name: reason}.
     */
    StrategyResult integrate(AstNode node, IntegrationContext context) {
        if (context.depth() > context.maxDepth()) {
            return StrategyResult.failure("Maximum integration depth " + context.maxDepth() + " exceeded");
        }
        StrategyResult best = null;
        String bestName = null;
        List<String> failures = new ArrayList<>();
        for (IntegrationStrategy strategy : strategies) {
            if (context.isAttempted(strategy.name(), node) || !handles(strategy, node, context)) {
                continue;
            }
            StrategyResult result = attempt(strategy, node, context);
            context.markAttempted(strategy.name(), node);
            if (!result.success()) {
                failures.add(strategy.name() + ": " + String.join("; ", result.steps()));
                continue;
            }
            List<String> trail = new ArrayList<>(failures);
            trail.addAll(result.steps());
            StrategyResult simplified = StrategyResult.success(simplifier.simplify(result.result()), trail);
            if (strategy.priority() <= TRUSTED_PRIORITY) {
                LOG.debug("integrate.strategy name={} depth={} outcome=accepted", strategy.name(), context.depth());
                return simplified;
            }
            if (best == null || simplified.complexity() < best.complexity()) {
                best = simplified;
                bestName = strategy.name();
            }
            if (best.complexity() <= 1) {
                break;
            }
        }
        if (best != null) {
            LOG.debug("integrate.strategy name={} depth={} outcome=best complexity={}",
                    bestName, context.depth(), best.complexity());
            return best;
        }
        List<String> steps = new ArrayList<>();
        steps.add(NO_STRATEGY);
        steps.addAll(failures);
        return new StrategyResult(null, false, steps, Double.POSITIVE_INFINITY);
    }

    private boolean handles(IntegrationStrategy strategy, AstNode node, IntegrationContext context) {
        try {
            return strategy.canHandle(node, context);
        } catch (RuntimeException e) {
            LOG.debug("integrate.strategy name={} outcome=can-handle-error detail={}", strategy.name(), e.getMessage());
            return false;
        }
    }

    private StrategyResult attempt(IntegrationStrategy strategy, AstNode node, IntegrationContext context) {
        try {
            return strategy.integrate(node, context);
        } catch (RuntimeException e) {
            LOG.debug("integrate.strategy name={} outcome=error detail={}", strategy.name(), e.getMessage());
            return StrategyResult.failure("Strategy error: " + e.getMessage());
        }
    }
}
