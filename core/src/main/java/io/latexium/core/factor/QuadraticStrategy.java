package io.latexium.core.factor;

import io.latexium.core.ast.AstNode;
import io.latexium.core.ast.Nodes;
import io.latexium.core.model.StrategyResult;
import io.latexium.core.structure.Factors;
import io.latexium.core.structure.Numbers;
import io.latexium.core.structure.Polynomial;
import io.latexium.core.structure.Terms;
import java.util.List;
import java.util.Optional;

/**
 * Factors {@code ax^2 + bx + c} with integer coefficients over the rationals. A negative
 * discriminant or one that is not a perfect square leaves the input unfactored.
 */
public final class QuadraticStrategy implements FactorStrategy {

    @Override
    public String name() {
        return "quadratic";
    }

    @Override
    public StrategyResult apply(AstNode node, String variable) {
        Optional<Polynomial> extracted = Polynomial.from(node, variable);
        if (extracted.isEmpty() || extracted.get().degree() != 2 || !extracted.get().hasIntegerCoefficients()) {
            return StrategyResult.failure("Not an integer quadratic in " + variable);
        }
        Polynomial p = extracted.get();
        long a = (long) p.coefficient(2);
        long b = (long) p.coefficient(1);
        long c = (long) p.coefficient(0);
        long discriminant = b * b - 4 * a * c;
        if (discriminant < 0) {
            return StrategyResult.failure("Negative discriminant");
        }
        Optional<Long> root = Roots.integerRoot(discriminant, 2);
        if (root.isEmpty()) {
            return StrategyResult.failure("Discriminant is not a perfect square");
        }
        long s = root.get();
        long[] r1 = reduce(-b - s, 2 * a);
        long[] r2 = reduce(-b + s, 2 * a);
        Polynomial f1 = Polynomial.of(-r1[0], r1[1]);
        Polynomial f2 = Polynomial.of(-r2[0], r2[1]);
        double k = (double) a / (r1[1] * r2[1]);
        AstNode product = discriminant == 0
                ? Nodes.pow(f1.toAst(variable), 2)
                : Factors.chain(List.of(f1.toAst(variable), f2.toAst(variable)));
        AstNode result = k == 1 ? product : Terms.node(k, product);
        String kind = discriminant == 0 ? "perfect square" : "two rational roots";
        return StrategyResult.success(result, "Quadratic with " + kind + " (discriminant " + discriminant + ")");
    }

    /** Reduced {@code p/q} with a positive denominator. */
    static long[] reduce(long p, long q) {
        if (q < 0) {
            p = -p;
            q = -q;
        }
        long g = Math.max(1, Numbers.gcd(p, q));
        return new long[] {p / g, q / g};
    }
}
