package io.latexium.core.factor;

import io.latexium.core.ast.AstNode;
import io.latexium.core.ast.Nodes;
import io.latexium.core.model.StrategyResult;
import io.latexium.core.structure.Factors;
import io.latexium.core.structure.Polynomial;
import io.latexium.core.structure.Term;
import io.latexium.core.structure.Terms;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Sum and difference of cubes, matched structurally, then integer cubics with a rational root
 * found through the rational root theorem.
 */
public final class CubicStrategy implements FactorStrategy {

    @Override
    public String name() {
        return "cubic";
    }

    @Override
    public StrategyResult apply(AstNode node, String variable) {
        StrategyResult cubes = sumOfCubes(node);
        if (cubes.success()) {
            return cubes;
        }
        return rationalRoot(node, variable);
    }

    private static StrategyResult sumOfCubes(AstNode node) {
        List<Term> terms = Terms.flatten(node);
        if (terms.size() != 2) {
            return StrategyResult.failure("Not a binomial");
        }
        Term first = terms.get(0);
        Term second = terms.get(1);
        if (first.sign() < 0) {
            return StrategyResult.failure("Leading term is negative");
        }
        Optional<AstNode> a = Roots.termRoot(first, 3);
        Optional<AstNode> b = Roots.termRoot(second, 3);
        if (a.isEmpty() || b.isEmpty() || first.isConstant()) {
            return StrategyResult.failure("Terms are not perfect cubes");
        }
        AstNode x = a.get();
        AstNode y = b.get();
        AstNode square = Nodes.pow(x, 2);
        AstNode cross = Nodes.mul(x, y);
        AstNode otherSquare = Nodes.pow(y, 2);
        if (second.sign() > 0) {
            AstNode result = Nodes.mul(Nodes.add(x, y), Nodes.add(Nodes.sub(square, cross), otherSquare));
            return StrategyResult.success(result, "Sum of cubes");
        }
        AstNode result = Nodes.mul(Nodes.sub(x, y), Nodes.add(Nodes.add(square, cross), otherSquare));
        return StrategyResult.success(result, "Difference of cubes");
    }

    private static StrategyResult rationalRoot(AstNode node, String variable) {
        Optional<Polynomial> extracted = Polynomial.from(node, variable);
        if (extracted.isEmpty() || extracted.get().degree() != 3 || !extracted.get().hasIntegerCoefficients()) {
            return StrategyResult.failure("Not an integer cubic in " + variable);
        }
        Polynomial p = extracted.get();
        long leading = Math.abs((long) p.coefficient(3));
        long constant = Math.abs((long) p.coefficient(0));
        if (constant == 0) {
            return StrategyResult.failure("Zero constant term");
        }
        for (long numerator : divisors(constant)) {
            for (long denominator : divisors(leading)) {
                for (long sign : new long[] {1, -1}) {
                    long[] root = QuadraticStrategy.reduce(sign * numerator, denominator);
                    Optional<Polynomial> quotient = p.divideByLinear(root[1], -root[0]);
                    if (quotient.isPresent() && quotient.get().hasIntegerCoefficients()) {
                        Polynomial linear = Polynomial.of(-root[0], root[1]);
                        AstNode result = Factors.chain(List.of(
                                linear.toAst(variable), quotient.get().toAst(variable)));
                        return StrategyResult.success(
                                result, "Rational root " + root[0] + (root[1] == 1 ? "" : "/" + root[1]));
                    }
                }
            }
        }
        return StrategyResult.failure("No rational root");
    }

    private static List<Long> divisors(long n) {
        List<Long> result = new ArrayList<>();
        for (long d = 1; d * d <= n; d++) {
            if (n % d == 0) {
                result.add(d);
                if (d != n / d) {
                    result.add(n / d);
                }
            }
        }
        result.sort(Long::compare);
        return result;
    }
}
