package io.latexium.core.structure;

import io.latexium.core.ast.AstNode;
import io.latexium.core.ast.BinaryExpression;
import io.latexium.core.ast.BinaryOperator;
import io.latexium.core.ast.Fraction;
import io.latexium.core.ast.NumberLiteral;
import io.latexium.core.ast.Nodes;
import io.latexium.core.ast.UnaryExpression;
import io.latexium.core.ast.UnaryOperator;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Flattening of additive chains into {@link Term} lists and the inverse rebuild. The rebuild
 * shape is the simplifier's canonical output: a left-associated chain whose first term carries
 * its own sign and whose later negative terms use subtraction.
 */
public final class Terms {

    private Terms() {
        // utility class
    }

    public static boolean isOne(AstNode node) {
        return node instanceof NumberLiteral n && n.value() == 1.0;
    }

    public static boolean isSum(AstNode node) {
        return Nodes.isOperator(node, BinaryOperator.ADD) || Nodes.isOperator(node, BinaryOperator.SUBTRACT);
    }

    public static List<Term> flatten(AstNode node) {
        List<Term> terms = new ArrayList<>();
        flatten(node, 1, terms);
        return terms;
    }

    private static void flatten(AstNode node, int sign, List<Term> out) {
        if (node instanceof BinaryExpression b && b.operator() == BinaryOperator.ADD) {
            flatten(b.left(), sign, out);
            flatten(b.right(), sign, out);
        } else if (node instanceof BinaryExpression b && b.operator() == BinaryOperator.SUBTRACT) {
            flatten(b.left(), sign, out);
            flatten(b.right(), -sign, out);
        } else if (node instanceof UnaryExpression u) {
            flatten(u.operand(), u.operator() == UnaryOperator.MINUS ? -sign : sign, out);
        } else {
            out.add(leaf(node, sign));
        }
    }

    /** Splits a single addend into coefficient and form. */
    public static Term leaf(AstNode node, int sign) {
        Factors.Decomposition parts = Factors.decompose(node);
        double coefficient = sign * parts.coefficient();
        AstNode numerator = Factors.chain(parts.factors());
        if (parts.denominators().isEmpty()) {
            return Term.of(coefficient, numerator);
        }
        Factors.Decomposition denominator = Factors.decompose(Factors.chain(parts.denominators()));
        coefficient /= denominator.coefficient();
        if (denominator.factors().isEmpty()) {
            return Term.of(coefficient, numerator);
        }
        return Term.of(coefficient, Nodes.frac(numerator, Factors.chain(denominator.factors())));
    }

    /** Canonical node for {@code coefficient * form}. */
    public static AstNode node(double coefficient, AstNode form) {
        if (coefficient == 0) {
            return NumberLiteral.ZERO;
        }
        if (isOne(form)) {
            return Numbers.toNode(coefficient);
        }
        double magnitude = Math.abs(coefficient);
        boolean negative = coefficient < 0;
        Optional<long[]> ratio = Numbers.rational(magnitude);
        if (form instanceof Fraction f) {
            long p = ratio.map(r -> r[0]).orElse(1L);
            long q = ratio.map(r -> r[1]).orElse(1L);
            AstNode numerator = ratio.isPresent()
                    ? withCoefficient(p, f.numerator())
                    : prepend(Nodes.num(magnitude), f.numerator());
            AstNode denominator = withCoefficient(q, f.denominator());
            return Nodes.frac(negative ? negate(numerator) : numerator, denominator);
        }
        if (ratio.isPresent() && ratio.get()[1] != 1) {
            AstNode numerator = withCoefficient(ratio.get()[0], form);
            return Nodes.frac(negative ? negate(numerator) : numerator, Nodes.num(ratio.get()[1]));
        }
        AstNode result = magnitude == 1 ? form : prepend(Nodes.num(magnitude), form);
        return negative ? Nodes.neg(result) : result;
    }

    public static AstNode rebuild(List<Term> terms) {
        if (terms.isEmpty()) {
            return NumberLiteral.ZERO;
        }
        Term first = terms.get(0);
        AstNode result = node(first.signedCoefficient(), first.canonicalForm());
        for (int i = 1; i < terms.size(); i++) {
            Term term = terms.get(i);
            AstNode magnitude = node(term.coefficient(), term.canonicalForm());
            result = term.sign() < 0 ? Nodes.sub(result, magnitude) : Nodes.add(result, magnitude);
        }
        return result;
    }

    /** Negation that folds literals and double negation. */
    public static AstNode negate(AstNode node) {
        double value = Numbers.constantValue(node);
        if (!Double.isNaN(value)) {
            return Numbers.toNode(-value);
        }
        if (Nodes.isNegation(node)) {
            return ((UnaryExpression) node).operand();
        }
        return Nodes.neg(node);
    }

    /**
     * Largest positive integer dividing every coefficient of {@code node}'s terms; {@code 1} when
     * any coefficient is not an integer.
     */
    public static long content(AstNode node) {
        long g = 0;
        for (Term term : flatten(node)) {
            if (!Numbers.isInteger(term.coefficient())) {
                return 1;
            }
            g = Numbers.gcd(g, (long) term.coefficient());
        }
        return g == 0 ? 1 : g;
    }

    /** Divides every term coefficient by {@code divisor}. */
    public static AstNode divide(AstNode node, double divisor) {
        List<Term> scaled = new ArrayList<>();
        for (Term term : flatten(node)) {
            scaled.add(term.withSignedCoefficient(term.signedCoefficient() / divisor));
        }
        return rebuild(scaled);
    }

    private static AstNode withCoefficient(long k, AstNode node) {
        if (k == 1) {
            return node;
        }
        if (isOne(node)) {
            return Nodes.num(k);
        }
        return prepend(Nodes.num(k), node);
    }

    private static AstNode prepend(AstNode coefficient, AstNode form) {
        List<AstNode> factors = new ArrayList<>();
        factors.add(coefficient);
        factors.addAll(Factors.operands(form));
        return Factors.chain(factors);
    }
}
