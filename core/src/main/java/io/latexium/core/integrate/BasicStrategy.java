package io.latexium.core.integrate;

import io.latexium.core.ast.AstNode;
import io.latexium.core.ast.BinaryExpression;
import io.latexium.core.ast.BinaryOperator;
import io.latexium.core.ast.FunctionCall;
import io.latexium.core.ast.Nodes;
import io.latexium.core.calculus.Differentiator;
import io.latexium.core.model.StrategyResult;
import io.latexium.core.structure.Numbers;
import io.latexium.core.structure.Term;
import io.latexium.core.structure.Terms;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Constants, powers of the variable, the elementary function table and linearity over sums and
 * constant factors.
 */
final class BasicStrategy implements IntegrationStrategy {

    @Override
    public String name() {
        return "basic";
    }

    @Override
    public int priority() {
        return 1;
    }

    @Override
    public boolean canHandle(AstNode node, IntegrationContext context) {
        return true;
    }

    @Override
    public StrategyResult integrate(AstNode node, IntegrationContext context) {
        String variable = context.variable();
        if (Differentiator.isConstant(node, variable)) {
            return StrategyResult.success(Nodes.mul(node, Nodes.var(variable)), "Integrated a constant");
        }
        if (Terms.isSum(node)) {
            return sum(node, context);
        }
        Antiderivatives.Split split = Antiderivatives.split(node, variable);
        Optional<AstNode> direct = direct(split.varying(), variable);
        if (direct.isPresent()) {
            return StrategyResult.success(split.times(direct.get()), "Applied basic rule");
        }
        if (split.hasConstant()) {
            StrategyResult inner = context.recurse(split.varying());
            if (inner.success()) {
                List<String> steps = new ArrayList<>();
                steps.add("Pulled out constant factor");
                steps.addAll(inner.steps());
                return StrategyResult.success(split.times(inner.result()), steps);
            }
        }
        return StrategyResult.failure("No basic rule applies");
    }

    private StrategyResult sum(AstNode node, IntegrationContext context) {
        List<String> steps = new ArrayList<>();
        steps.add("Integrated term by term");
        AstNode total = null;
        for (Term term : Terms.flatten(node)) {
            StrategyResult part = context.recurse(term.canonicalForm());
            if (!part.success()) {
                return StrategyResult.failure("A term of the sum could not be integrated");
            }
            steps.addAll(part.steps());
            AstNode scaled = Nodes.mul(Numbers.toNode(term.coefficient()), part.result());
            if (total == null) {
                total = term.sign() < 0 ? Nodes.neg(scaled) : scaled;
            } else {
                total = term.sign() < 0 ? Nodes.sub(total, scaled) : Nodes.add(total, scaled);
            }
        }
        return StrategyResult.success(total, steps);
    }

    /** Table entries whose argument is the bare variable. */
    static Optional<AstNode> direct(AstNode node, String variable) {
        AstNode x = Nodes.var(variable);
        OptionalDouble n = Antiderivatives.exponentOf(node, x);
        if (n.isPresent()) {
            return Optional.of(Antiderivatives.power(x, n.getAsDouble()));
        }
        if (node instanceof FunctionCall f && f.isUnary() && Antiderivatives.isVariable(f.arg(), variable)) {
            return Antiderivatives.table(f.name(), x);
        }
        if (node instanceof BinaryExpression b && b.operator() == BinaryOperator.POWER) {
            if (Differentiator.isConstant(b.left(), variable) && Antiderivatives.isVariable(b.right(), variable)) {
                return Optional.of(Antiderivatives.exponential(b.left(), x));
            }
            if (Nodes.isNumber(b.right(), 2) && Nodes.isFunction(b.left(), "sec")
                    && Antiderivatives.isVariable(((FunctionCall) b.left()).arg(), variable)) {
                return Optional.of(Nodes.fn("tan", x));
            }
        }
        return Optional.empty();
    }
}
