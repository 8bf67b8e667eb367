package io.latexium.core.integrate;

import io.latexium.core.ast.AstNode;
import io.latexium.core.ast.BinaryExpression;
import io.latexium.core.ast.BinaryOperator;
import io.latexium.core.ast.Fraction;
import io.latexium.core.ast.FunctionCall;
import io.latexium.core.ast.Identifier;
import io.latexium.core.ast.Nodes;
import io.latexium.core.calculus.Differentiator;
import io.latexium.core.structure.Factors;
import io.latexium.core.structure.Numbers;
import io.latexium.core.structure.Polynomial;
import io.latexium.core.structure.Terms;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/** Rule table and pattern helpers shared by the strategies and the legacy integrator. */
final class Antiderivatives {

    private Antiderivatives() {
        // utility class
    }

    /** {@code node = constant * varying}, where {@code constant} does not depend on the variable. */
    record Split(AstNode constant, AstNode varying) {

        boolean hasConstant() {
            return !Terms.isOne(constant);
        }

        AstNode times(AstNode antiderivative) {
            return hasConstant() ? Nodes.mul(constant, antiderivative) : antiderivative;
        }
    }

    /** Slope and intercept of {@code a*x + b}. */
    record Linear(double slope, double intercept) {

        /** {@code F / a}, undoing the inner derivative of the linear argument. */
        AstNode unscale(AstNode antiderivative) {
            return slope == 1 ? antiderivative : Nodes.mul(Numbers.toNode(1 / slope), antiderivative);
        }
    }

    static Split split(AstNode node, String variable) {
        Factors.Decomposition parts = Factors.decompose(node);
        List<AstNode> constant = new ArrayList<>();
        List<AstNode> varying = new ArrayList<>();
        for (AstNode factor : parts.factors()) {
            (Differentiator.isConstant(factor, variable) ? constant : varying).add(factor);
        }
        List<AstNode> constantDenominators = new ArrayList<>();
        List<AstNode> varyingDenominators = new ArrayList<>();
        for (AstNode denominator : parts.denominators()) {
            (Differentiator.isConstant(denominator, variable) ? constantDenominators : varyingDenominators)
                    .add(denominator);
        }
        AstNode c = Terms.node(parts.coefficient(), Factors.chain(constant));
        if (!constantDenominators.isEmpty()) {
            c = Nodes.frac(c, Factors.chain(constantDenominators));
        }
        AstNode v = Factors.chain(varying);
        if (!varyingDenominators.isEmpty()) {
            v = Nodes.frac(v, Factors.chain(varyingDenominators));
        }
        return new Split(c, v);
    }

    /** Matches {@code a*x + b} with {@code a != 0}. */
    static Optional<Linear> linear(AstNode node, String variable) {
        return Polynomial.from(node, variable)
                .filter(p -> p.degree() == 1)
                .map(p -> new Linear(p.coefficient(1), p.coefficient(0)));
    }

    static boolean isVariable(AstNode node, String variable) {
        return node instanceof Identifier id && id.isFreeOccurrenceOf(variable);
    }

    /**
     * Exponent {@code n} when {@code node} is {@code base^n}: {@code base}, {@code base^n} with a
     * numeric {@code n}, {@code sqrt(base)}, or {@code 1/} any of those.
     */
    static OptionalDouble exponentOf(AstNode node, AstNode base) {
        if (node.equals(base)) {
            return OptionalDouble.of(1);
        }
        if (node instanceof BinaryExpression b && b.operator() == BinaryOperator.POWER && b.left().equals(base)) {
            double n = Numbers.constantValue(b.right());
            return Double.isNaN(n) ? OptionalDouble.empty() : OptionalDouble.of(n);
        }
        if (Nodes.isFunction(node, "sqrt") && ((FunctionCall) node).arg().equals(base)) {
            return OptionalDouble.of(0.5);
        }
        if (node instanceof Fraction f && Terms.isOne(f.numerator())) {
            OptionalDouble inner = exponentOf(f.denominator(), base);
            return inner.isPresent() ? OptionalDouble.of(-inner.getAsDouble()) : OptionalDouble.empty();
        }
        return OptionalDouble.empty();
    }

    /** {@code u^(n+1)/(n+1)}, or {@code ln|u|} for {@code n = -1}. */
    static AstNode power(AstNode u, double n) {
        if (n == -1) {
            return Nodes.lnAbs(u);
        }
        AstNode next = Numbers.toNode(n + 1);
        return Nodes.frac(Nodes.pow(u, next), next);
    }

    /** Antiderivative of {@code f(u)} with respect to {@code u}, for the elementary table. */
    static Optional<AstNode> table(String function, AstNode u) {
        AstNode result = switch (function) {
            case "sin" -> Nodes.neg(Nodes.fn("cos", u));
            case "cos" -> Nodes.fn("sin", u);
            case "tan" -> Nodes.neg(Nodes.lnAbs(Nodes.fn("cos", u)));
            case "cot" -> Nodes.lnAbs(Nodes.fn("sin", u));
            case "sec" -> Nodes.lnAbs(Nodes.add(Nodes.fn("sec", u), Nodes.fn("tan", u)));
            case "csc" -> Nodes.neg(Nodes.lnAbs(Nodes.add(Nodes.fn("csc", u), Nodes.fn("cot", u))));
            case "exp" -> Nodes.fn("exp", u);
            case "sinh" -> Nodes.fn("cosh", u);
            case "cosh" -> Nodes.fn("sinh", u);
            case "tanh" -> Nodes.fn("ln", Nodes.fn("cosh", u));
            case "sqrt" -> power(u, 0.5);
            default -> null;
        };
        return Optional.ofNullable(result);
    }

    /** {@code u ln u - u}. */
    static AstNode lnIntegral(AstNode u) {
        return Nodes.sub(Nodes.mul(u, Nodes.fn("ln", u)), u);
    }

    /** True for {@code e}, the base whose exponential integrates to itself. */
    static boolean isEuler(AstNode node) {
        return node instanceof Identifier id && id.isFree() && id.name().equals("e");
    }

    /** Antiderivative of {@code c^u} with respect to {@code u}, for a constant base {@code c}. */
    static AstNode exponential(AstNode base, AstNode u) {
        AstNode power = Nodes.pow(base, u);
        return isEuler(base) ? power : Nodes.frac(power, Nodes.fn("ln", base));
    }
}
