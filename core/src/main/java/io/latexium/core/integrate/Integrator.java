package io.latexium.core.integrate;

import io.latexium.core.ast.AstNode;
import io.latexium.core.ast.Nodes;
import io.latexium.core.error.IntegrationFailedException;
import io.latexium.core.error.LatexiumException;
import io.latexium.core.model.StrategyResult;
import io.latexium.core.simplify.Simplifier;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for integration. The strategy engine runs first; if it fails or throws, the
 * {@link LegacyIntegrator} is tried without surfacing the engine's error. Only a failure of both
 * reaches the caller.
 */
public final class Integrator {

    private static final Logger LOG = LoggerFactory.getLogger(Integrator.class);

    private final IntegrationEngine engine;
    private final LegacyIntegrator legacy;
    private final Simplifier simplifier;
    private final boolean legacyFallback;

    public Integrator(IntegrationEngine engine, LegacyIntegrator legacy, Simplifier simplifier, boolean legacyFallback) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.legacy = Objects.requireNonNull(legacy, "legacy must not be null");
        this.simplifier = Objects.requireNonNull(simplifier, "simplifier must not be null");
        this.legacyFallback = legacyFallback;
    }

    public IntegrationEngine engine() {
        return engine;
    }

    /**
     * Antiderivative of {@code node}, without the constant of integration.
     *
     * @throws IntegrationFailedException when neither the engine nor the legacy integrator succeeds
     */
    public StrategyResult integrate(AstNode node, String variable) {
        StrategyResult modern;
        try {
            modern = engine.integrate(node, variable);
        } catch (RuntimeException e) {
            LOG.debug("integrate.engine outcome=error detail={}", e.getMessage());
            modern = StrategyResult.failure(String.valueOf(e.getMessage()));
        }
        if (modern.success()) {
            return modern;
        }
        if (!legacyFallback) {
            throw new IntegrationFailedException(String.join("; ", modern.steps()));
        }
        try {
            AstNode result = simplifier.simplify(legacy.integrate(node, variable));
            LOG.debug("integrate.fallback outcome=success variable={}", variable);
            List<String> steps = new ArrayList<>();
            steps.add("Strategy search failed; used the legacy rule table");
            return StrategyResult.success(result, steps);
        } catch (LatexiumException e) {
            LOG.debug("integrate.fallback outcome=failure detail={}", e.getMessage());
            throw new IntegrationFailedException("Unable to integrate: " + e.getMessage(), e);
        }
    }

    /** {@code F(upper) - F(lower)}, simplified. */
    public AstNode evaluateBounds(AstNode antiderivative, String variable, AstNode lower, AstNode upper) {
        AstNode atUpper = Nodes.substitute(antiderivative, variable, upper);
        AstNode atLower = Nodes.substitute(antiderivative, variable, lower);
        return simplifier.simplify(Nodes.sub(atUpper, atLower));
    }
}
