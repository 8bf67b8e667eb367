package io.latexium.core.integrate;

import io.latexium.core.ast.AstNode;
import io.latexium.core.ast.BinaryExpression;
import io.latexium.core.ast.BinaryOperator;
import io.latexium.core.ast.FunctionCall;
import io.latexium.core.ast.Nodes;
import io.latexium.core.model.StrategyResult;
import io.latexium.core.structure.Factors;
import io.latexium.core.structure.Numbers;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Powers and products of trigonometric functions of a linear argument: half-angle identities for
 * squares, odd powers through {@code sin^2 + cos^2 = 1}, the reduction formula for even powers,
 * and the {@code sin cos}, {@code sec tan}, {@code csc cot} products.
 */
final class TrigonometricStrategy implements IntegrationStrategy {

    private static final Set<String> TRIG = Set.of("sin", "cos", "tan", "sec", "csc", "cot");
    private static final int MAX_POWER = 12;

    @Override
    public String name() {
        return "trigonometric";
    }

    @Override
    public int priority() {
        return 2;
    }

    @Override
    public boolean canHandle(AstNode node, IntegrationContext context) {
        return containsTrig(node, context.variable());
    }

    private static boolean containsTrig(AstNode node, String variable) {
        if (node instanceof FunctionCall f && TRIG.contains(f.name()) && f.isUnary()
                && Antiderivatives.linear(f.arg(), variable).isPresent()) {
            return true;
        }
        for (AstNode child : Nodes.children(node)) {
            if (containsTrig(child, variable)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public StrategyResult integrate(AstNode node, IntegrationContext context) {
        String variable = context.variable();
        Antiderivatives.Split split = Antiderivatives.split(node, variable);
        AstNode varying = split.varying();
        Optional<StrategyResult> result = single(varying, variable)
                .or(() -> power(varying, context))
                .or(() -> product(varying, variable));
        if (result.isEmpty()) {
            return StrategyResult.failure("No trigonometric pattern matched");
        }
        StrategyResult found = result.get();
        return found.success() ? StrategyResult.success(split.times(found.result()), found.steps()) : found;
    }

    /** {@code f(ax + b)} for a single trigonometric function. */
    private Optional<StrategyResult> single(AstNode node, String variable) {
        if (!(node instanceof FunctionCall f) || !TRIG.contains(f.name()) || !f.isUnary()) {
            return Optional.empty();
        }
        Optional<Antiderivatives.Linear> linear = Antiderivatives.linear(f.arg(), variable);
        if (linear.isEmpty()) {
            return Optional.empty();
        }
        return Antiderivatives.table(f.name(), f.arg())
                .map(antiderivative -> StrategyResult.success(
                        linear.get().unscale(antiderivative), "Applied trigonometric table entry"));
    }

    private Optional<StrategyResult> power(AstNode node, IntegrationContext context) {
        if (!(node instanceof BinaryExpression b) || b.operator() != BinaryOperator.POWER
                || !(b.left() instanceof FunctionCall f) || !TRIG.contains(f.name()) || !f.isUnary()) {
            return Optional.empty();
        }
        double n = Numbers.constantValue(b.right());
        Optional<Antiderivatives.Linear> linear = Antiderivatives.linear(f.arg(), context.variable());
        if (linear.isEmpty() || !Numbers.isInteger(n) || n < 2 || n > MAX_POWER) {
            return Optional.empty();
        }
        AstNode u = f.arg();
        AstNode x = Nodes.var(context.variable());
        Antiderivatives.Linear l = linear.get();
        int k = (int) n;
        if (k == 2) {
            return square(f.name(), u, x, l);
        }
        if (!f.name().equals("sin") && !f.name().equals("cos")) {
            return Optional.empty();
        }
        if (k % 2 == 1) {
            return Optional.of(StrategyResult.success(
                    l.unscale(oddPower(f.name(), u, k)), "Rewrote odd power with sin^2 + cos^2 = 1"));
        }
        return Optional.of(evenPower(f.name(), u, k, l, context));
    }

    private Optional<StrategyResult> square(String name, AstNode u, AstNode x, Antiderivatives.Linear l) {
        AstNode doubled = Nodes.fn("sin", Nodes.mul(Nodes.num(2), u));
        AstNode half = Nodes.frac(x, Nodes.num(2));
        AstNode quarter = l.unscale(Nodes.frac(doubled, Nodes.num(4)));
        AstNode result = switch (name) {
            case "sin" -> Nodes.sub(half, quarter);
            case "cos" -> Nodes.add(half, quarter);
            case "tan" -> Nodes.sub(l.unscale(Nodes.fn("tan", u)), x);
            case "sec" -> l.unscale(Nodes.fn("tan", u));
            case "csc" -> l.unscale(Nodes.neg(Nodes.fn("cot", u)));
            case "cot" -> Nodes.sub(l.unscale(Nodes.neg(Nodes.fn("cot", u))), x);
            default -> null;
        };
        return Optional.ofNullable(result)
                .map(r -> StrategyResult.success(r, "Applied half-angle identity to " + name + "^2"));
    }

    /**
     * {@code sin^(2k+1) u = (1 - cos^2 u)^k sin u}, integrated term by term in {@code cos u}; the
     * cosine case mirrors it in {@code sin u}.
     */
    private static AstNode oddPower(String name, AstNode u, int n) {
        int k = (n - 1) / 2;
        String other = name.equals("sin") ? "cos" : "sin";
        AstNode w = Nodes.fn(other, u);
        AstNode sum = null;
        for (int j = 0; j <= k; j++) {
            double coefficient = binomial(k, j) * (j % 2 == 0 ? 1 : -1) / (2.0 * j + 1);
            AstNode term = Nodes.mul(Numbers.toNode(coefficient), Nodes.pow(w, 2 * j + 1));
            sum = sum == null ? term : Nodes.add(sum, term);
        }
        return name.equals("sin") ? Nodes.neg(sum) : sum;
    }

    /**
     * {@code ∫sin^n = -sin^(n-1) cos / n + (n-1)/n ∫sin^(n-2)} and the cosine counterpart; the
     * remaining integral recurses.
     */
    private StrategyResult evenPower(
            String name, AstNode u, int n, Antiderivatives.Linear l, IntegrationContext context) {
        StrategyResult rest = context.recurse(Nodes.pow(Nodes.fn(name, u), n - 2));
        if (!rest.success()) {
            return StrategyResult.failure("Reduction formula sub-integral failed");
        }
        String other = name.equals("sin") ? "cos" : "sin";
        AstNode lead = Nodes.frac(
                Nodes.mul(Nodes.pow(Nodes.fn(name, u), n - 1), Nodes.fn(other, u)), Nodes.num(n));
        AstNode boundary = l.unscale(name.equals("sin") ? Nodes.neg(lead) : lead);
        AstNode tail = Nodes.mul(Numbers.toNode((n - 1.0) / n), rest.result());
        return StrategyResult.success(Nodes.add(boundary, tail), "Applied reduction formula for " + name + "^" + n);
    }

    private Optional<StrategyResult> product(AstNode node, String variable) {
        List<AstNode> factors = Factors.operands(node);
        if (factors.size() != 2
                || !(factors.get(0) instanceof FunctionCall a) || !(factors.get(1) instanceof FunctionCall b)
                || !a.isUnary() || !b.isUnary() || !a.arg().equals(b.arg()) || a.name().equals(b.name())) {
            return Optional.empty();
        }
        AstNode u = a.arg();
        Optional<Antiderivatives.Linear> linear = Antiderivatives.linear(u, variable);
        if (linear.isEmpty()) {
            return Optional.empty();
        }
        Set<String> pair = Set.of(a.name(), b.name());
        AstNode result;
        if (pair.equals(Set.of("sin", "cos"))) {
            result = Nodes.neg(Nodes.frac(Nodes.pow(Nodes.fn("cos", u), 2), Nodes.num(2)));
        } else if (pair.equals(Set.of("sec", "tan"))) {
            result = Nodes.fn("sec", u);
        } else if (pair.equals(Set.of("csc", "cot"))) {
            result = Nodes.neg(Nodes.fn("csc", u));
        } else {
            return Optional.empty();
        }
        return Optional.of(StrategyResult.success(linear.get().unscale(result), "Integrated trigonometric product"));
    }

    private static double binomial(int n, int k) {
        double result = 1;
        for (int i = 1; i <= k; i++) {
            result = result * (n - k + i) / i;
        }
        return result;
    }
}
