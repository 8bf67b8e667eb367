package io.latexium.core.factor;

import io.latexium.core.ast.AstNode;
import io.latexium.core.model.StrategyResult;
import io.latexium.core.structure.Factors;
import io.latexium.core.structure.Numbers;
import io.latexium.core.structure.Term;
import io.latexium.core.structure.Terms;
import java.util.ArrayList;
import java.util.List;

/** Pulls out the gcd of integer coefficients and the lowest common power of the variable. */
public final class CommonFactorStrategy implements FactorStrategy {

    @Override
    public String name() {
        return "common-factor";
    }

    @Override
    public StrategyResult apply(AstNode node, String variable) {
        List<Term> terms = Terms.flatten(node);
        if (terms.size() < 2) {
            return StrategyResult.failure("Not a sum of terms");
        }
        long gcd = 0;
        int minPower = Integer.MAX_VALUE;
        for (Term term : terms) {
            gcd = Numbers.isInteger(term.coefficient()) && gcd >= 0
                    ? Numbers.gcd(gcd, (long) term.coefficient())
                    : -1;
            minPower = Math.min(minPower, Roots.variableExponent(term, variable));
        }
        if (gcd < 0) {
            gcd = 1;
        }
        if (gcd <= 1 && minPower == 0) {
            return StrategyResult.failure("No common factor");
        }
        List<Term> reduced = new ArrayList<>();
        for (Term term : terms) {
            AstNode form = Roots.divideVariable(term.canonicalForm(), variable, minPower);
            reduced.add(Term.of(term.signedCoefficient() / gcd, form));
        }
        List<AstNode> factors = new ArrayList<>();
        if (gcd > 1) {
            factors.add(Numbers.toNode(gcd));
        }
        if (minPower > 0) {
            factors.add(Roots.power(variable, minPower));
        }
        factors.add(Terms.rebuild(reduced));
        AstNode result = Factors.chain(factors);
        return StrategyResult.success(result, "Extracted common factor " + describe(gcd, variable, minPower));
    }

    private static String describe(long gcd, String variable, int power) {
        String variablePart = power == 0 ? "" : power == 1 ? variable : variable + "^" + power;
        return gcd > 1 ? gcd + variablePart : variablePart;
    }
}
