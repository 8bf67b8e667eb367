package io.latexium.core.calculus;

import io.latexium.core.ast.AstNode;
import io.latexium.core.ast.BinaryExpression;
import io.latexium.core.ast.Binder;
import io.latexium.core.ast.Fraction;
import io.latexium.core.ast.FunctionCall;
import io.latexium.core.ast.Identifier;
import io.latexium.core.ast.Integral;
import io.latexium.core.ast.NodeVisitor;
import io.latexium.core.ast.Nodes;
import io.latexium.core.ast.NumberLiteral;
import io.latexium.core.ast.Product;
import io.latexium.core.ast.Sum;
import io.latexium.core.ast.UnaryExpression;
import io.latexium.core.ast.UnaryOperator;
import io.latexium.core.error.UnsupportedConstructException;
import io.latexium.core.simplify.Simplifier;
import java.util.Objects;

/**
 * Rule-based symbolic differentiation. Every compound sub-result is passed through the {@link
 * Simplifier}, so the derivative comes back reduced.
 *
 * <p>Only the free occurrence of the variable is a differentiation target. An occurrence bound
 * by an inner integral, sum or product belongs to that binder and differentiates to zero.
 */
public final class Differentiator {

    private final Simplifier simplifier;

    public Differentiator(Simplifier simplifier) {
        this.simplifier = Objects.requireNonNull(simplifier, "simplifier must not be null");
    }

    /**
     * Returns the simplified derivative of {@code node} with respect to {@code variable}.
     *
     * @throws UnsupportedConstructException for binders that depend on the variable, comparisons,
     *     and functions without a derivative rule
     */
    public AstNode differentiate(AstNode node, String variable) {
        Objects.requireNonNull(variable, "variable must not be null");
        return new Rules(variable).d(node);
    }

    /**
     * True if {@code node} does not vary with {@code variable}: no free occurrence and no
     * indefinite binder over the same name, since {@code \int x dx} is a function of {@code x}.
     */
    public static boolean isConstant(AstNode node, String variable) {
        if (node instanceof Binder b && !b.hasBounds() && b.variable().name().equals(variable)) {
            return false;
        }
        if (node instanceof Identifier id) {
            return !id.isFreeOccurrenceOf(variable);
        }
        for (AstNode child : Nodes.children(node)) {
            if (!isConstant(child, variable)) {
                return false;
            }
        }
        return true;
    }

    private final class Rules implements NodeVisitor<AstNode> {

        private final String variable;

        Rules(String variable) {
            this.variable = variable;
        }

        private AstNode d(AstNode node) {
            if (isConstant(node, variable)) {
                return NumberLiteral.ZERO;
            }
            return node.accept(this);
        }

        private AstNode s(AstNode node) {
            return simplifier.simplify(node);
        }

        @Override
        public AstNode visitNumber(NumberLiteral node) {
            return NumberLiteral.ZERO;
        }

        @Override
        public AstNode visitIdentifier(Identifier node) {
            return node.isFreeOccurrenceOf(variable) ? NumberLiteral.ONE : NumberLiteral.ZERO;
        }

        @Override
        public AstNode visitBinary(BinaryExpression node) {
            AstNode u = node.left();
            AstNode v = node.right();
            return switch (node.operator()) {
                case ADD -> s(Nodes.add(d(u), d(v)));
                case SUBTRACT -> s(Nodes.sub(d(u), d(v)));
                case MULTIPLY -> productRule(u, v);
                case DIVIDE -> quotientRule(u, v);
                case POWER -> powerRule(u, v);
                default -> throw new UnsupportedConstructException(
                        "Differentiation of comparison '" + node.operator().symbol() + "' is not supported");
            };
        }

        @Override
        public AstNode visitUnary(UnaryExpression node) {
            AstNode inner = d(node.operand());
            return node.operator() == UnaryOperator.MINUS ? s(Nodes.neg(inner)) : inner;
        }

        @Override
        public AstNode visitFunction(FunctionCall node) {
            if (!node.isUnary()) {
                throw new UnsupportedConstructException(
                        "Differentiation of function '" + node.name() + "' with " + node.args().size()
                                + " arguments is not supported");
            }
            AstNode u = node.arg();
            AstNode inner = d(u);
            if (Nodes.isNumber(inner, 0)) {
                return NumberLiteral.ZERO;
            }
            AstNode outer = outerDerivative(node.name(), u);
            return Nodes.isNumber(inner, 1) ? s(outer) : s(Nodes.mul(outer, inner));
        }

        @Override
        public AstNode visitFraction(Fraction node) {
            return quotientRule(node.numerator(), node.denominator());
        }

        @Override
        public AstNode visitIntegral(Integral node) {
            throw notImplemented("Integral");
        }

        @Override
        public AstNode visitSum(Sum node) {
            throw notImplemented("Sum");
        }

        @Override
        public AstNode visitProduct(Product node) {
            throw notImplemented("Product");
        }

        private AstNode productRule(AstNode u, AstNode v) {
            if (isConstant(u, variable)) {
                return s(Nodes.mul(u, d(v)));
            }
            if (isConstant(v, variable)) {
                return s(Nodes.mul(d(u), v));
            }
            return s(Nodes.add(Nodes.mul(d(u), v), Nodes.mul(u, d(v))));
        }

        private AstNode quotientRule(AstNode u, AstNode v) {
            if (isConstant(v, variable)) {
                return s(Nodes.frac(d(u), v));
            }
            if (isConstant(u, variable)) {
                return s(Nodes.frac(Nodes.neg(Nodes.mul(u, d(v))), Nodes.pow(v, 2)));
            }
            return s(Nodes.frac(Nodes.sub(Nodes.mul(d(u), v), Nodes.mul(u, d(v))), Nodes.pow(v, 2)));
        }

        private AstNode powerRule(AstNode u, AstNode v) {
            boolean constantBase = isConstant(u, variable);
            boolean constantExponent = isConstant(v, variable);
            if (constantBase && constantExponent) {
                return NumberLiteral.ZERO;
            }
            if (constantExponent) {
                AstNode outer = Nodes.mul(v, Nodes.pow(u, Nodes.sub(v, NumberLiteral.ONE)));
                AstNode inner = d(u);
                return Nodes.isNumber(inner, 1) ? s(outer) : s(Nodes.mul(outer, inner));
            }
            if (constantBase) {
                AstNode outer = isEuler(u) ? Nodes.pow(u, v) : Nodes.mul(Nodes.pow(u, v), Nodes.fn("ln", u));
                return s(Nodes.mul(outer, d(v)));
            }
            AstNode inner = Nodes.add(
                    Nodes.mul(d(v), Nodes.fn("ln", u)),
                    Nodes.frac(Nodes.mul(v, d(u)), u));
            return s(Nodes.mul(Nodes.pow(u, v), inner));
        }

        private boolean isEuler(AstNode node) {
            return node instanceof Identifier id && id.isFree() && id.name().equals("e");
        }

        private UnsupportedConstructException notImplemented(String construct) {
            return new UnsupportedConstructException("Differentiation of " + construct + " not yet implemented");
        }
    }

    /** {@code f'(u)} for the unary function {@code f}. */
    static AstNode outerDerivative(String name, AstNode u) {
        AstNode one = NumberLiteral.ONE;
        AstNode oneMinusSquare = Nodes.sub(one, Nodes.pow(u, 2));
        return switch (name) {
            case "sin" -> Nodes.fn("cos", u);
            case "cos" -> Nodes.neg(Nodes.fn("sin", u));
            case "tan" -> Nodes.frac(one, Nodes.pow(Nodes.fn("cos", u), 2));
            case "sec" -> Nodes.mul(Nodes.fn("sec", u), Nodes.fn("tan", u));
            case "csc" -> Nodes.neg(Nodes.mul(Nodes.fn("csc", u), Nodes.fn("cot", u)));
            case "cot" -> Nodes.neg(Nodes.frac(one, Nodes.pow(Nodes.fn("sin", u), 2)));
            case "asin" -> Nodes.frac(one, Nodes.fn("sqrt", oneMinusSquare));
            case "acos" -> Nodes.neg(Nodes.frac(one, Nodes.fn("sqrt", oneMinusSquare)));
            case "atan" -> Nodes.frac(one, Nodes.add(one, Nodes.pow(u, 2)));
            case "sinh" -> Nodes.fn("cosh", u);
            case "cosh" -> Nodes.fn("sinh", u);
            case "tanh" -> Nodes.frac(one, Nodes.pow(Nodes.fn("cosh", u), 2));
            case "exp" -> Nodes.fn("exp", u);
            case "ln" -> Nodes.frac(one, u);
            case "log" -> Nodes.frac(one, Nodes.mul(u, Nodes.fn("ln", Nodes.num(10))));
            case "sqrt" -> Nodes.frac(one, Nodes.mul(Nodes.num(2), Nodes.fn("sqrt", u)));
            case "abs" -> Nodes.frac(u, Nodes.fn("abs", u));
            default -> throw new UnsupportedConstructException(
                    "Differentiation of function '" + name + "' is not supported");
        };
    }
}
