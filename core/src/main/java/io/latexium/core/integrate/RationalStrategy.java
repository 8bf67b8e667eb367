package io.latexium.core.integrate;

import io.latexium.core.ast.AstNode;
import io.latexium.core.ast.Fraction;
import io.latexium.core.ast.FunctionCall;
import io.latexium.core.ast.Nodes;
import io.latexium.core.model.StrategyResult;
import io.latexium.core.simplify.Simplifier;
import io.latexium.core.structure.Numbers;
import io.latexium.core.structure.Polynomial;
import java.util.Optional;

/**
 * Quotients of low-degree polynomials: {@code 1/(ax + b)}, {@code (bx + c)/(kx^2 + a)} split into
 * a logarithm and an arctangent (or a log quotient when {@code a < 0}), and {@code 1/sqrt(a - x^2)}.
 * Anything else is handed to partial fractions, which is not implemented and fails.
 */
final class RationalStrategy implements IntegrationStrategy {

    private final Simplifier simplifier;

    RationalStrategy(Simplifier simplifier) {
        this.simplifier = simplifier;
    }

    @Override
    public String name() {
        return "rational";
    }

    @Override
    public int priority() {
        return 4;
    }

    @Override
    public boolean canHandle(AstNode node, IntegrationContext context) {
        return Antiderivatives.split(node, context.variable()).varying() instanceof Fraction;
    }

    @Override
    public StrategyResult integrate(AstNode node, IntegrationContext context) {
        String variable = context.variable();
        Antiderivatives.Split split = Antiderivatives.split(node, variable);
        Fraction fraction = (Fraction) split.varying();
        Optional<Polynomial> numerator = Polynomial.from(fraction.numerator(), variable);
        if (numerator.isEmpty() || numerator.get().degree() > 1) {
            return StrategyResult.failure("Numerator is not a polynomial of degree at most 1");
        }
        Polynomial n = numerator.get();
        if (Nodes.isFunction(fraction.denominator(), "sqrt") && n.degree() == 0) {
            return arcsine(n.coefficient(0), ((FunctionCall) fraction.denominator()).arg(), variable)
                    .map(r -> StrategyResult.success(split.times(r), "Matched 1/sqrt(a - x^2)"))
                    .orElseGet(() -> StrategyResult.failure("Radical denominator is not of the form a - x^2"));
        }
        Optional<Polynomial> denominator = Polynomial.from(fraction.denominator(), variable);
        if (denominator.isEmpty()) {
            return StrategyResult.failure("Denominator is not a polynomial");
        }
        Polynomial d = denominator.get();
        if (d.degree() == 1 && n.degree() == 0) {
            AstNode result = Nodes.mul(
                    Numbers.toNode(n.coefficient(0) / d.coefficient(1)), Nodes.lnAbs(fraction.denominator()));
            return StrategyResult.success(split.times(result), "Matched c/(ax + b)");
        }
        if (d.degree() == 2 && d.coefficient(1) == 0 && d.coefficient(0) != 0) {
            return StrategyResult.success(
                    split.times(quadratic(n, d, variable)), "Split into logarithmic and inverse tangent parts");
        }
        return partialFractions(n, d);
    }

    /**
     * {@code (n1 x + n0) / (k x^2 + c)}. With {@code a = c/k}, the linear part integrates to
     * {@code n1/(2k) ln|x^2 + a|} and the constant part to an arctangent or a log quotient.
     */
    private AstNode quadratic(Polynomial n, Polynomial d, String variable) {
        AstNode x = Nodes.var(variable);
        double k = d.coefficient(2);
        double a = d.coefficient(0) / k;
        AstNode shifted = Nodes.add(Nodes.pow(x, 2), Numbers.toNode(a));
        AstNode result = Numbers.toNode(0);
        if (n.coefficient(1) != 0) {
            AstNode log = a > 0 ? Nodes.fn("ln", shifted) : Nodes.lnAbs(shifted);
            result = Nodes.mul(Numbers.toNode(n.coefficient(1) / (2 * k)), log);
        }
        if (n.coefficient(0) != 0) {
            AstNode constantPart = Nodes.mul(Numbers.toNode(n.coefficient(0) / k), reciprocal(a, x));
            result = Nodes.add(result, constantPart);
        }
        return result;
    }

    /** {@code ∫ 1/(x^2 + a)}. */
    private AstNode reciprocal(double a, AstNode x) {
        AstNode root = sqrt(Math.abs(a));
        if (a > 0) {
            return Nodes.mul(Nodes.frac(Numbers.toNode(1), root), Nodes.fn("atan", Nodes.frac(x, root)));
        }
        AstNode quotient = Nodes.frac(Nodes.sub(x, root), Nodes.add(x, root));
        return Nodes.mul(Nodes.frac(Numbers.toNode(1), Nodes.mul(Numbers.toNode(2), root)), Nodes.lnAbs(quotient));
    }

    /** {@code c / sqrt(p)} with {@code p = a - m x^2}: {@code c/sqrt(m) asin(x / sqrt(a/m))}. */
    private Optional<AstNode> arcsine(double c, AstNode radicand, String variable) {
        Optional<Polynomial> p = Polynomial.from(radicand, variable);
        if (p.isEmpty() || p.get().degree() != 2 || p.get().coefficient(1) != 0) {
            return Optional.empty();
        }
        double m = -p.get().coefficient(2);
        double a = p.get().coefficient(0);
        if (m <= 0 || a <= 0) {
            return Optional.empty();
        }
        AstNode x = Nodes.var(variable);
        AstNode asin = Nodes.fn("asin", Nodes.frac(x, sqrt(a / m)));
        return Optional.of(Nodes.mul(Nodes.frac(Numbers.toNode(c), sqrt(m)), asin));
    }

    private AstNode sqrt(double value) {
        return simplifier.simplify(Nodes.fn("sqrt", Numbers.toNode(value)));
    }

    // TODO: decompose over the real roots of d found by Polynomial.divideByLinear
    private StrategyResult partialFractions(Polynomial n, Polynomial d) {
        return StrategyResult.failure(
                "Partial fraction decomposition is not implemented (denominator degree " + d.degree() + ")");
    }
}
