package io.latexium.core.factor;

import io.latexium.core.ast.AstNode;
import io.latexium.core.ast.Nodes;
import io.latexium.core.model.StrategyResult;
import io.latexium.core.structure.Polynomial;
import java.util.Optional;

/** Recognizes {@code (ax + b)^n} for integer polynomials of degree {@code n >= 2}. */
public final class PerfectPowerStrategy implements FactorStrategy {

    @Override
    public String name() {
        return "perfect-power";
    }

    @Override
    public StrategyResult apply(AstNode node, String variable) {
        Optional<Polynomial> extracted = Polynomial.from(node, variable);
        if (extracted.isEmpty() || extracted.get().degree() < 2 || !extracted.get().hasIntegerCoefficients()) {
            return StrategyResult.failure("Not an integer polynomial in " + variable);
        }
        Polynomial p = extracted.get();
        int n = p.degree();
        Optional<Long> a = Roots.integerRoot(p.leading(), n);
        Optional<Long> b = Roots.integerRoot(Math.abs(p.coefficient(0)), n);
        if (a.isEmpty() || b.isEmpty() || b.get() == 0) {
            return StrategyResult.failure("Extreme coefficients are not perfect powers");
        }
        for (long sign : new long[] {1, -1}) {
            Polynomial linear = Polynomial.of(sign * b.get(), a.get());
            if (linear.pow(n).equals(p)) {
                return StrategyResult.success(Nodes.pow(linear.toAst(variable), n), "Perfect power of degree " + n);
            }
        }
        return StrategyResult.failure("Not a perfect power");
    }
}
