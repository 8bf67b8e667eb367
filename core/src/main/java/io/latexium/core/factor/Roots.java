package io.latexium.core.factor;

import io.latexium.core.ast.AstNode;
import io.latexium.core.ast.Identifier;
import io.latexium.core.ast.Nodes;
import io.latexium.core.structure.Factors;
import io.latexium.core.structure.Numbers;
import io.latexium.core.structure.Term;
import io.latexium.core.structure.Terms;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Exact integer roots of terms and coefficients, shared by the power-pattern strategies. */
final class Roots {

    private Roots() {
        // utility class
    }

    /** Integer {@code n}-th root of {@code value}, keeping the sign for odd {@code n}. */
    static Optional<Long> integerRoot(double value, int n) {
        if (!Numbers.isInteger(value) || (value < 0 && n % 2 == 0)) {
            return Optional.empty();
        }
        long root = Math.round(Math.signum(value) * Math.pow(Math.abs(value), 1.0 / n));
        long check = 1;
        for (int i = 0; i < n; i++) {
            check *= root;
        }
        return check == (long) value ? Optional.of(root) : Optional.empty();
    }

    /**
     * {@code n}-th root of the magnitude of {@code term}: the coefficient must be a perfect power
     * and every factor of the form must carry an integer exponent divisible by {@code n}.
     */
    static Optional<AstNode> termRoot(Term term, int n) {
        Optional<Long> coefficient = integerRoot(term.coefficient(), n);
        if (coefficient.isEmpty()) {
            return Optional.empty();
        }
        List<AstNode> roots = new ArrayList<>();
        if (!term.isConstant()) {
            for (AstNode factor : Factors.operands(term.canonicalForm())) {
                double exponent = Numbers.constantValue(Factors.exponent(factor));
                if (!Numbers.isInteger(exponent) || exponent % n != 0 || Nodes.isFunction(factor, "sqrt")) {
                    return Optional.empty();
                }
                long reduced = (long) exponent / n;
                AstNode base = Factors.base(factor);
                roots.add(reduced == 1 ? base : Nodes.pow(base, reduced));
            }
        }
        return Optional.of(Terms.node(coefficient.get(), Factors.chain(roots)));
    }

    /** Exponent of {@code variable} in a term's form: {@code x} gives 1, {@code x^k} gives k. */
    static int variableExponent(Term term, String variable) {
        int total = 0;
        if (term.isConstant()) {
            return 0;
        }
        for (AstNode factor : Factors.operands(term.canonicalForm())) {
            if (Nodes.isFunction(factor, "sqrt")) {
                continue;
            }
            AstNode base = Factors.base(factor);
            double exponent = Numbers.constantValue(Factors.exponent(factor));
            if (base instanceof Identifier id
                    && id.isFreeOccurrenceOf(variable)
                    && Numbers.isInteger(exponent)
                    && exponent > 0) {
                total += (int) exponent;
            }
        }
        return total;
    }

    /** Removes {@code x^m} from a term's form. */
    static AstNode divideVariable(AstNode form, String variable, int m) {
        if (m == 0) {
            return form;
        }
        List<AstNode> result = new ArrayList<>();
        int remaining = m;
        for (AstNode factor : Factors.operands(form)) {
            AstNode base = Factors.base(factor);
            double exponent = Numbers.constantValue(Factors.exponent(factor));
            if (remaining > 0
                    && !Nodes.isFunction(factor, "sqrt")
                    && base instanceof Identifier id
                    && id.isFreeOccurrenceOf(variable)
                    && Numbers.isInteger(exponent)) {
                int left = (int) exponent - remaining;
                remaining = 0;
                if (left == 1) {
                    result.add(base);
                } else if (left > 1) {
                    result.add(Nodes.pow(base, left));
                }
            } else {
                result.add(factor);
            }
        }
        return Factors.chain(result);
    }

    /** {@code x^k} as a node. */
    static AstNode power(String variable, int k) {
        return k == 1 ? Nodes.var(variable) : Nodes.pow(Nodes.var(variable), k);
    }
}
