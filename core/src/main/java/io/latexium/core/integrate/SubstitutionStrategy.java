package io.latexium.core.integrate;

import io.latexium.core.ast.AstNode;
import io.latexium.core.ast.BinaryExpression;
import io.latexium.core.ast.BinaryOperator;
import io.latexium.core.ast.Fraction;
import io.latexium.core.ast.FunctionCall;
import io.latexium.core.ast.Identifier;
import io.latexium.core.ast.Nodes;
import io.latexium.core.calculus.Differentiator;
import io.latexium.core.model.StrategyResult;
import io.latexium.core.render.LatexRenderer;
import io.latexium.core.simplify.Simplifier;
import io.latexium.core.structure.Complexity;
import io.latexium.core.structure.Terms;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Change of variable. Two passes: a linear inner argument {@code f(ax + b)} is handled directly
 * from the table; otherwise every sub-expression {@code g} is tried as {@code w = g}, and the
 * substitution succeeds when {@code integrand / g'} no longer mentions the variable once {@code g}
 * is replaced by {@code w}.
 */
final class SubstitutionStrategy implements IntegrationStrategy {

    private static final List<String> FRESH_NAMES = List.of("u", "w", "v", "s", "q");

    private final Simplifier simplifier;
    private final Differentiator differentiator;

    SubstitutionStrategy(Simplifier simplifier, Differentiator differentiator) {
        this.simplifier = simplifier;
        this.differentiator = differentiator;
    }

    @Override
    public String name() {
        return "substitution";
    }

    @Override
    public int priority() {
        return 3;
    }

    @Override
    public boolean canHandle(AstNode node, IntegrationContext context) {
        return !Differentiator.isConstant(node, context.variable());
    }

    @Override
    public StrategyResult integrate(AstNode node, IntegrationContext context) {
        String variable = context.variable();
        Antiderivatives.Split split = Antiderivatives.split(node, variable);
        Optional<AstNode> linear = linearInner(split.varying(), variable);
        if (linear.isPresent()) {
            return StrategyResult.success(split.times(linear.get()), "Substituted linear inner argument");
        }
        Optional<StrategyResult> general = general(split.varying(), context);
        if (general.isPresent()) {
            StrategyResult found = general.get();
            return StrategyResult.success(split.times(found.result()), found.steps());
        }
        return StrategyResult.failure("No substitution reduces the integrand");
    }

    /** {@code f(ax + b)}, {@code (ax + b)^n} and {@code c^(ax + b)} with a non-trivial inner argument. */
    static Optional<AstNode> linearInner(AstNode node, String variable) {
        if (node instanceof FunctionCall f && f.isUnary() && !Antiderivatives.isVariable(f.arg(), variable)) {
            Optional<Antiderivatives.Linear> linear = Antiderivatives.linear(f.arg(), variable);
            if (linear.isPresent()) {
                return Antiderivatives.table(f.name(), f.arg()).map(linear.get()::unscale);
            }
            return Optional.empty();
        }
        AstNode base = powerBase(node);
        if (base != null && !Antiderivatives.isVariable(base, variable)) {
            Optional<Antiderivatives.Linear> linear = Antiderivatives.linear(base, variable);
            OptionalDouble n = Antiderivatives.exponentOf(node, base);
            if (linear.isPresent() && n.isPresent()) {
                return Optional.of(linear.get().unscale(Antiderivatives.power(base, n.getAsDouble())));
            }
        }
        if (node instanceof BinaryExpression b && b.operator() == BinaryOperator.POWER
                && Differentiator.isConstant(b.left(), variable)
                && !Antiderivatives.isVariable(b.right(), variable)) {
            return Antiderivatives.linear(b.right(), variable)
                    .map(l -> l.unscale(Antiderivatives.exponential(b.left(), b.right())));
        }
        return Optional.empty();
    }

    private static AstNode powerBase(AstNode node) {
        if (node instanceof Fraction f && Terms.isOne(f.numerator())) {
            return powerBase(f.denominator());
        }
        if (node instanceof BinaryExpression b && b.operator() == BinaryOperator.POWER) {
            return b.left();
        }
        if (Nodes.isFunction(node, "sqrt")) {
            return ((FunctionCall) node).arg();
        }
        return node instanceof Fraction ? null : node;
    }

    private Optional<StrategyResult> general(AstNode node, IntegrationContext context) {
        String variable = context.variable();
        String fresh = freshName(node);
        for (AstNode candidate : candidates(node, variable)) {
            AstNode derivative;
            try {
                derivative = differentiator.differentiate(candidate, variable);
            } catch (RuntimeException e) {
                continue;
            }
            if (Nodes.isNumber(derivative, 0)) {
                continue;
            }
            AstNode quotient = simplifier.simplify(Nodes.frac(node, derivative));
            AstNode reduced = simplifier.simplify(Nodes.replace(quotient, candidate, Nodes.var(fresh)));
            if (!Differentiator.isConstant(reduced, variable)) {
                continue;
            }
            StrategyResult inner = context.recurse(reduced, fresh);
            if (inner.success()) {
                AstNode back = Nodes.substitute(inner.result(), fresh, candidate);
                List<String> steps = new ArrayList<>();
                steps.add("Substituted " + fresh + " = " + LatexRenderer.render(candidate));
                steps.addAll(inner.steps());
                return Optional.of(StrategyResult.success(back, steps));
            }
        }
        return Optional.empty();
    }

    /**
     * Sub-expressions worth substituting, most complex first: function calls and their arguments,
     * power bases, denominators. The bare variable and the whole integrand are skipped.
     */
    private static List<AstNode> candidates(AstNode node, String variable) {
        Set<AstNode> found = new LinkedHashSet<>();
        collect(node, variable, found);
        found.remove(node);
        List<AstNode> ordered = new ArrayList<>(found);
        ordered.sort(Comparator.comparingDouble((AstNode n) -> Complexity.of(n)).reversed());
        return ordered;
    }

    private static void collect(AstNode node, String variable, Set<AstNode> out) {
        if (Differentiator.isConstant(node, variable) || node instanceof Identifier) {
            return;
        }
        if (node instanceof FunctionCall f) {
            out.add(f);
            for (AstNode arg : f.args()) {
                if (!(arg instanceof Identifier)) {
                    out.add(arg);
                }
            }
        } else if (node instanceof BinaryExpression b && b.operator() == BinaryOperator.POWER) {
            out.add(b);
            if (!(b.left() instanceof Identifier)) {
                out.add(b.left());
            }
        } else if (node instanceof Fraction f && !(f.denominator() instanceof Identifier)) {
            out.add(f.denominator());
        }
        for (AstNode child : Nodes.children(node)) {
            collect(child, variable, out);
        }
    }

    private static String freshName(AstNode node) {
        Set<String> used = Nodes.freeVariables(node);
        for (String name : FRESH_NAMES) {
            if (!used.contains(name)) {
                return name;
            }
        }
        int i = 1;
        while (used.contains("u" + i)) {
            i++;
        }
        return "u" + i;
    }
}
