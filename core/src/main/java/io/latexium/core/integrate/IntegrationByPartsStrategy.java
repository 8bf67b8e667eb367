package io.latexium.core.integrate;

import io.latexium.core.ast.AstNode;
import io.latexium.core.ast.BinaryExpression;
import io.latexium.core.ast.BinaryOperator;
import io.latexium.core.ast.FunctionCall;
import io.latexium.core.ast.Nodes;
import io.latexium.core.calculus.Differentiator;
import io.latexium.core.model.StrategyResult;
import io.latexium.core.structure.Factors;
import io.latexium.core.structure.Numbers;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * {@code ∫u dv = uv - ∫v du}, with {@code u} chosen by LIATE order: logarithmic, inverse
 * trigonometric, algebraic, trigonometric, exponential. Single logarithms and inverse
 * trigonometric functions of the variable are integrated as {@code 1 * f(x)}.
 */
final class IntegrationByPartsStrategy implements IntegrationStrategy {

    private static final Set<String> LOGARITHMIC = Set.of("ln", "log");
    private static final Set<String> INVERSE_TRIG = Set.of("asin", "acos", "atan");
    private static final Set<String> TRIG = Set.of("sin", "cos", "tan", "sec", "csc", "cot", "sinh", "cosh");

    private final Differentiator differentiator;

    IntegrationByPartsStrategy(Differentiator differentiator) {
        this.differentiator = differentiator;
    }

    @Override
    public String name() {
        return "by-parts";
    }

    @Override
    public int priority() {
        return 5;
    }

    @Override
    public boolean canHandle(AstNode node, IntegrationContext context) {
        AstNode varying = Antiderivatives.split(node, context.variable()).varying();
        return isSingle(varying, context.variable()) || Factors.operands(varying).size() >= 2;
    }

    @Override
    public StrategyResult integrate(AstNode node, IntegrationContext context) {
        String variable = context.variable();
        Antiderivatives.Split split = Antiderivatives.split(node, variable);
        AstNode varying = split.varying();
        if (isSingle(varying, variable)) {
            FunctionCall f = (FunctionCall) varying;
            return StrategyResult.success(
                    split.times(single(f.name(), f.arg())), "Integrated 1 * " + f.name() + " by parts");
        }
        List<AstNode> factors = Factors.operands(varying);
        if (factors.size() < 2) {
            return StrategyResult.failure("Integrand is not a product");
        }
        int chosen = 0;
        for (int i = 1; i < factors.size(); i++) {
            if (rank(factors.get(i), variable) < rank(factors.get(chosen), variable)) {
                chosen = i;
            }
        }
        AstNode u = factors.get(chosen);
        List<AstNode> rest = new ArrayList<>(factors);
        rest.remove(chosen);
        AstNode dv = Factors.chain(rest);

        StrategyResult v = context.recurse(dv);
        if (!v.success()) {
            return StrategyResult.failure("Could not integrate dv");
        }
        AstNode du = differentiator.differentiate(u, variable);
        StrategyResult remaining = context.recurse(Nodes.mul(v.result(), du));
        if (!remaining.success()) {
            return StrategyResult.failure("Could not integrate v du");
        }
        List<String> steps = new ArrayList<>();
        steps.add("Integrated by parts with u chosen by LIATE order");
        steps.addAll(remaining.steps());
        AstNode result = Nodes.sub(Nodes.mul(u, v.result()), remaining.result());
        return StrategyResult.success(split.times(result), steps);
    }

    private static boolean isSingle(AstNode node, String variable) {
        return node instanceof FunctionCall f && f.isUnary()
                && (LOGARITHMIC.contains(f.name()) || INVERSE_TRIG.contains(f.name()))
                && Antiderivatives.isVariable(f.arg(), variable);
    }

    private static AstNode single(String name, AstNode x) {
        AstNode one = Numbers.toNode(1);
        AstNode root = Nodes.fn("sqrt", Nodes.sub(one, Nodes.pow(x, 2)));
        return switch (name) {
            case "ln" -> Antiderivatives.lnIntegral(x);
            case "log" -> Nodes.frac(Antiderivatives.lnIntegral(x), Nodes.fn("ln", Nodes.num(10)));
            case "asin" -> Nodes.add(Nodes.mul(x, Nodes.fn("asin", x)), root);
            case "acos" -> Nodes.sub(Nodes.mul(x, Nodes.fn("acos", x)), root);
            case "atan" -> Nodes.sub(
                    Nodes.mul(x, Nodes.fn("atan", x)),
                    Nodes.mul(Nodes.frac(one, Nodes.num(2)), Nodes.fn("ln", Nodes.add(one, Nodes.pow(x, 2)))));
            default -> throw new IllegalArgumentException("No by-parts form for '" + name + "'");
        };
    }

    /** LIATE rank: lower means a better choice for {@code u}. */
    static int rank(AstNode factor, String variable) {
        if (factor instanceof FunctionCall f) {
            if (LOGARITHMIC.contains(f.name())) {
                return 0;
            }
            if (INVERSE_TRIG.contains(f.name())) {
                return 1;
            }
            if (TRIG.contains(f.name())) {
                return 3;
            }
            if (f.name().equals("exp")) {
                return 4;
            }
            return 5;
        }
        if (factor instanceof BinaryExpression b && b.operator() == BinaryOperator.POWER
                && Differentiator.isConstant(b.left(), variable)) {
            return 4;
        }
        return 2;
    }
}
