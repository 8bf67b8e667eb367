package io.latexium.core;

import io.latexium.core.ast.AstNode;
import io.latexium.core.ast.FunctionCall;
import io.latexium.core.ast.Integral;
import io.latexium.core.ast.Nodes;
import io.latexium.core.ast.NumberLiteral;
import io.latexium.core.ast.ScopeResolver;
import io.latexium.core.calculus.Differentiator;
import io.latexium.core.config.EngineConfig;
import io.latexium.core.error.LatexiumException;
import io.latexium.core.evaluate.Evaluator;
import io.latexium.core.factor.FactorizationEngine;
import io.latexium.core.integrate.IntegrationEngine;
import io.latexium.core.integrate.Integrator;
import io.latexium.core.integrate.LegacyIntegrator;
import io.latexium.core.model.AnalysisResult;
import io.latexium.core.model.AstJson;
import io.latexium.core.model.StepTrace;
import io.latexium.core.model.StrategyResult;
import io.latexium.core.model.ValueType;
import io.latexium.core.parser.LatexParser;
import io.latexium.core.render.LatexRenderer;
import io.latexium.core.simplify.Simplifier;
import io.latexium.core.simplify.SimplifyOptions;
import io.latexium.core.solve.Solution;
import io.latexium.core.solve.Solver;
import io.latexium.core.spi.AnalysisListener;
import io.latexium.core.structure.Numbers;
import io.latexium.core.structure.VariableInference;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the engine. Every operation parses its LaTeX input, runs one analysis, and
 * returns an {@link AnalysisResult}; errors caused by the input are reported in the result, never
 * thrown.
 *
 * <p>Where an operation takes a variable, {@code null} means "infer it": the first free
 * identifier by priority x, y, z, t, u, v, w, then alphabetical, or {@code x} when there is none.
 *
 * <p>Instances are immutable and safe to share between threads; the optional listener must be
 * thread-safe itself.
 */
public final class Latexium {

    private static final Logger LOG = LoggerFactory.getLogger(Latexium.class);

    private final EngineConfig config;
    private final Simplifier simplifier;
    private final Differentiator differentiator;
    private final Integrator integrator;
    private final Solver solver;
    private final Evaluator evaluator;
    private final AnalysisListener listener;

    public Latexium() {
        this(EngineConfig.defaults());
    }

    public Latexium(EngineConfig config) {
        this(config, null);
    }

    /**
     * @param config   engine settings
     * @param listener optional observer of completed and failed operations, may be {@code null}
     */
    public Latexium(EngineConfig config, AnalysisListener listener) {
        this.config = config;
        this.simplifier = new Simplifier(new FactorizationEngine(), config.maxExpansionPower());
        this.differentiator = new Differentiator(simplifier);
        IntegrationEngine engine = new IntegrationEngine(
                IntegrationEngine.defaultStrategies(simplifier, differentiator),
                simplifier,
                config.integrationMaxDepth());
        this.integrator = new Integrator(engine, new LegacyIntegrator(), simplifier, config.legacyFallback());
        this.solver = new Solver(simplifier);
        this.evaluator = new Evaluator();
        this.listener = listener; // nullable
    }

    public EngineConfig config() {
        return config;
    }

    // --- Operations ---

    public AnalysisResult differentiate(String latex, String variable) {
        return run("differentiate", latex, trace -> {
            AstNode node = LatexParser.parse(latex);
            String v = variableFor(node, variable);
            trace.add("Differentiating with respect to " + v);
            trace.add("Expression: " + LatexRenderer.render(node));
            AstNode derivative = differentiator.differentiate(node, v);
            trace.add("Derivative: " + LatexRenderer.render(derivative));
            return new Outcome(LatexRenderer.render(derivative), ValueType.EXACT, derivative);
        });
    }

    /**
     * Antiderivative of {@code latex}. A top-level {@code \int ... dx} is unwrapped first and its
     * own variable wins; with bounds the result is the definite value {@code F(b) - F(a)}.
     */
    public AnalysisResult integrate(String latex, String variable) {
        return run("integrate", latex, trace -> {
            AstNode node = LatexParser.parse(latex);
            AstNode integrand = node;
            String v;
            Integral definite = null;
            if (node instanceof Integral integral) {
                integrand = ScopeResolver.release(integral);
                v = integral.variable().name();
                definite = integral.hasBounds() ? integral : null;
            } else {
                v = variableFor(node, variable);
            }
            trace.add("Integrating with respect to " + v);
            trace.add("Expression: " + LatexRenderer.render(integrand));
            StrategyResult result = integrator.integrate(integrand, v);
            trace.nest(result.steps());
            AstNode antiderivative = result.result();
            trace.add("Integral: " + LatexRenderer.render(antiderivative) + " + C");
            if (definite == null) {
                return new Outcome(
                        LatexRenderer.render(antiderivative) + " + C", ValueType.SYMBOLIC, antiderivative);
            }
            AstNode value = integrator.evaluateBounds(antiderivative, v, definite.lower(), definite.upper());
            trace.add("Evaluated from " + LatexRenderer.render(definite.lower())
                    + " to " + LatexRenderer.render(definite.upper()) + ": " + LatexRenderer.render(value));
            return new Outcome(LatexRenderer.render(value), ValueType.EXACT, value);
        });
    }

    public AnalysisResult solve(String latex, String variable) {
        return run("solve", latex, trace -> {
            AstNode node = LatexParser.parse(latex);
            String v = variableFor(node, variable);
            Solution solution = solver.solve(node, v);
            solution.steps().forEach(trace::add);
            return switch (solution.type()) {
                case ROOTS -> {
                    List<AstNode> roots = solution.roots();
                    String value = roots.stream().map(LatexRenderer::render).collect(Collectors.joining(", "));
                    trace.add("Solutions: " + v + " = " + value);
                    AstNode ast = roots.size() == 1 ? roots.get(0) : new FunctionCall(LatexRenderer.SOLUTIONS, roots);
                    yield new Outcome(value, ValueType.EXACT, ast);
                }
                case NONE -> new Outcome(
                        "No solutions", ValueType.EXACT, new FunctionCall(LatexRenderer.SOLUTIONS, List.of()));
                case ALL -> new Outcome(
                        "All real numbers", ValueType.EXACT, new FunctionCall(LatexRenderer.REALS, List.of()));
            };
        });
    }

    /**
     * Numeric value of {@code latex} under {@code bindings}. When free variables other than
     * {@code e} and {@code pi} stay unbound, the result is the substituted expression simplified
     * with factoring on.
     */
    public AnalysisResult evaluate(String latex, Map<String, Double> bindings) {
        return run("evaluate", latex, trace -> numeric(latex, bindings, trace, value -> {
            AstNode exact = Numbers.toNode(value);
            return new Outcome(LatexRenderer.render(exact), ValueType.EXACT, exact);
        }));
    }

    /** Like {@link #evaluate} but rounds numeric values to the configured significant digits. */
    public AnalysisResult approximate(String latex, Map<String, Double> bindings) {
        return run("approximate", latex, trace -> numeric(latex, bindings, trace, value -> {
            double rounded = Numbers.toPrecision(value, config.approximationPrecision());
            trace.add("Rounded to " + config.approximationPrecision() + " significant digits");
            return new Outcome(Numbers.format(rounded), ValueType.APPROXIMATE, new NumberLiteral(rounded));
        }));
    }

    /** Simplifies with {@code options}, or the configured options when {@code null}. */
    public AnalysisResult simplify(String latex, SimplifyOptions options) {
        SimplifyOptions effective = options == null ? config.simplify() : options;
        return run("simplify", latex, trace -> {
            AstNode node = LatexParser.parse(latex);
            trace.add("Expression: " + LatexRenderer.render(node));
            AstNode result = simplifier.overlapSimplify(node, effective, config.overlapMaxIterations());
            trace.add("Simplified: " + LatexRenderer.render(result));
            ValueType type = Nodes.isNumber(result) ? ValueType.EXACT : ValueType.SYMBOLIC;
            return new Outcome(LatexRenderer.render(result), type, result);
        });
    }

    public AnalysisResult factor(String latex, String variable) {
        return run("factor", latex, trace -> {
            AstNode node = LatexParser.parse(latex);
            String v = variableFor(node, variable);
            AstNode expanded = simplifier.simplify(node, config.simplify().toBuilder().factor(false).build());
            trace.add("Expression: " + LatexRenderer.render(expanded));
            StrategyResult factored = simplifier.factorizer().factorWithSteps(expanded, v);
            AstNode result = expanded;
            if (factored.success()) {
                trace.nest(factored.steps());
                SimplifyOptions keepFactors =
                        config.simplify().toBuilder().expand(false).factor(false).build();
                result = simplifier.simplify(factored.result(), keepFactors);
            } else {
                trace.add("Already irreducible");
            }
            trace.add("Factored: " + LatexRenderer.render(result));
            return new Outcome(LatexRenderer.render(result), ValueType.SYMBOLIC, result);
        });
    }

    /** Scope-resolved tree of {@code latex}, rendered back as its value. */
    public AnalysisResult parse(String latex) {
        return run("parse", latex, trace -> {
            AstNode node = LatexParser.parse(latex);
            Set<String> free = Nodes.freeVariables(node);
            trace.add("Free variables: " + (free.isEmpty() ? "none" : String.join(", ", free)));
            return new Outcome(LatexRenderer.render(node), ValueType.SYMBOLIC, node);
        });
    }

    /** Reads an AST JSON document, validated against the AST schema, and renders it as LaTeX. */
    public AnalysisResult render(String astJson) {
        return run("render", astJson, trace -> {
            AstNode node = AstJson.fromJson(astJson);
            return new Outcome(LatexRenderer.render(node), ValueType.SYMBOLIC, node);
        });
    }

    // --- Internals ---

    private record Outcome(String value, ValueType type, AstNode ast) {}

    private Outcome numeric(
            String latex, Map<String, Double> bindings, StepTrace trace, Function<Double, Outcome> numericOutcome) {
        Map<String, Double> values = bindings == null ? Map.of() : bindings;
        AstNode node = LatexParser.parse(latex);
        trace.add("Expression: " + LatexRenderer.render(node));
        if (!values.isEmpty()) {
            trace.add("Substituting " + new TreeMap<>(values).entrySet().stream()
                    .map(e -> e.getKey() + " = " + Numbers.format(e.getValue()))
                    .collect(Collectors.joining(", ")));
        }
        Set<String> unbound = Nodes.freeVariables(node);
        unbound.removeAll(values.keySet());
        unbound.removeIf(name -> name.equals("e") || name.equals("pi"));
        if (unbound.isEmpty()) {
            double value = evaluator.evaluate(node, values);
            trace.add("Value: " + Numbers.format(value));
            return numericOutcome.apply(value);
        }
        AstNode substituted = node;
        for (Map.Entry<String, Double> binding : values.entrySet()) {
            substituted = Nodes.substitute(substituted, binding.getKey(), Numbers.toNode(binding.getValue()));
        }
        trace.add("Unbound variables remain: " + String.join(", ", unbound));
        AstNode result = simplifier.simplify(substituted, config.simplify().toBuilder().factor(true).build());
        trace.add("Simplified: " + LatexRenderer.render(result));
        return new Outcome(LatexRenderer.render(result), ValueType.SYMBOLIC, result);
    }

    private static String variableFor(AstNode node, String requested) {
        return requested == null || requested.isBlank() ? VariableInference.infer(node) : requested;
    }

    private AnalysisResult run(String operation, String input, Function<StepTrace, Outcome> body) {
        long startNanos = System.nanoTime();
        StepTrace trace = new StepTrace();
        try {
            Outcome outcome = body.apply(trace);
            long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
            LOG.info("analysis.completed operation={} duration_ms={}", operation, elapsedMs);
            notifyCompleted(operation, input, elapsedMs, outcome.value());
            return AnalysisResult.success(trace.build(), outcome.value(), outcome.type(), outcome.ast());
        } catch (LatexiumException e) {
            long failedMs = (System.nanoTime() - startNanos) / 1_000_000;
            LOG.info(
                    "analysis.failed operation={} duration_ms={} urn={} detail={}",
                    operation,
                    failedMs,
                    e.urn(),
                    e.detail());
            notifyFailed(operation, input, failedMs, e.detail());
            return AnalysisResult.error(trace.build(), e.detail());
        }
    }

    // Listener exceptions are caught and logged; they never change the result.

    private void notifyCompleted(String operation, String input, long durationMs, String detail) {
        if (listener == null) return;
        try {
            listener.onAnalysisCompleted(
                    new AnalysisListener.AnalysisCompletedEvent(operation, input, durationMs, detail));
        } catch (Exception e) {
            LOG.warn("AnalysisListener.onAnalysisCompleted failed", e);
        }
    }

    private void notifyFailed(String operation, String input, long durationMs, String detail) {
        if (listener == null) return;
        try {
            listener.onAnalysisFailed(new AnalysisListener.AnalysisFailedEvent(operation, input, durationMs, detail));
        } catch (Exception e) {
            LOG.warn("AnalysisListener.onAnalysisFailed failed", e);
        }
    }
}
