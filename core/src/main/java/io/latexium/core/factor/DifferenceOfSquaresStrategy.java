package io.latexium.core.factor;

import io.latexium.core.ast.AstNode;
import io.latexium.core.ast.Nodes;
import io.latexium.core.model.StrategyResult;
import io.latexium.core.structure.Term;
import io.latexium.core.structure.Terms;
import java.util.List;
import java.util.Optional;

/** {@code a^2 - b^2 => (a - b)(a + b)}, matched on the structure of both terms. */
public final class DifferenceOfSquaresStrategy implements FactorStrategy {

    @Override
    public String name() {
        return "difference-of-squares";
    }

    @Override
    public StrategyResult apply(AstNode node, String variable) {
        List<Term> terms = Terms.flatten(node);
        if (terms.size() != 2 || terms.get(0).sign() == terms.get(1).sign()) {
            return StrategyResult.failure("Not a difference of two terms");
        }
        Term positive = terms.get(0).sign() > 0 ? terms.get(0) : terms.get(1);
        Term negative = terms.get(0).sign() > 0 ? terms.get(1) : terms.get(0);
        Optional<AstNode> a = Roots.termRoot(positive, 2);
        Optional<AstNode> b = Roots.termRoot(negative, 2);
        if (a.isEmpty() || b.isEmpty()) {
            return StrategyResult.failure("Terms are not perfect squares");
        }
        AstNode result = Nodes.mul(Nodes.sub(a.get(), b.get()), Nodes.add(a.get(), b.get()));
        return StrategyResult.success(result, "Difference of squares");
    }
}
