package io.latexium.core.integrate;

import io.latexium.core.ast.AstNode;
import io.latexium.core.ast.FunctionCall;
import io.latexium.core.ast.Nodes;
import io.latexium.core.calculus.Differentiator;
import io.latexium.core.error.IntegrationFailedException;
import io.latexium.core.render.LatexRenderer;
import io.latexium.core.structure.Numbers;
import io.latexium.core.structure.Term;
import io.latexium.core.structure.Terms;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Single-pass integrator: rule table, linearity, power rule and linear inner arguments. No
 * strategy search and no recursion limit beyond the size of the tree.
 */
public final class LegacyIntegrator {

    /**
     * Antiderivative of {@code node} with respect to {@code variable}, without a constant.
     *
     * @throws IntegrationFailedException when no rule matches some part of the integrand
     */
    public AstNode integrate(AstNode node, String variable) {
        if (Differentiator.isConstant(node, variable)) {
            return Nodes.mul(node, Nodes.var(variable));
        }
        if (Terms.isSum(node)) {
            AstNode total = null;
            for (Term term : Terms.flatten(node)) {
                AstNode part = Nodes.mul(
                        Numbers.toNode(term.coefficient()), integrate(term.canonicalForm(), variable));
                if (total == null) {
                    total = term.sign() < 0 ? Nodes.neg(part) : part;
                } else {
                    total = term.sign() < 0 ? Nodes.sub(total, part) : Nodes.add(total, part);
                }
            }
            return total;
        }
        Antiderivatives.Split split = Antiderivatives.split(node, variable);
        if (split.hasConstant()) {
            return split.times(integrate(split.varying(), variable));
        }
        return rule(node, variable).orElseThrow(() -> new IntegrationFailedException(
                "No integration rule for " + LatexRenderer.render(node) + " with respect to " + variable));
    }

    private Optional<AstNode> rule(AstNode node, String variable) {
        AstNode x = Nodes.var(variable);
        OptionalDouble n = Antiderivatives.exponentOf(node, x);
        if (n.isPresent()) {
            return Optional.of(Antiderivatives.power(x, n.getAsDouble()));
        }
        if (Nodes.isFunction(node, "ln") && Antiderivatives.isVariable(((FunctionCall) node).arg(), variable)) {
            return Optional.of(Antiderivatives.lnIntegral(x));
        }
        Optional<AstNode> direct = BasicStrategy.direct(node, variable);
        if (direct.isPresent()) {
            return direct;
        }
        return SubstitutionStrategy.linearInner(node, variable);
    }
}
