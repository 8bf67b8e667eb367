package io.latexium.core.render;

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
import io.latexium.core.structure.Numbers;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Formats expression trees as LaTeX. Parentheses are added only where precedence requires them,
 * and the output parses back to an equal tree.
 */
public final class LatexRenderer {

    /** Name of the pseudo-function the facade uses to carry a solution set. */
    public static final String SOLUTIONS = "solutions";

    /** Nullary call standing for the whole real line, rendered {@code \mathbb{R}}. */
    public static final String REALS = "reals";

    // binders extend to the right, so they bind loosest
    private static final int BINDER = 0;
    private static final int COMPARISON = 1;
    private static final int ADDITIVE = 2;
    private static final int MULTIPLICATIVE = 3;
    private static final int UNARY = 4;
    private static final int POWER = 5;
    private static final int ATOM = 6;

    private static final Map<String, String> COMMANDS = Map.ofEntries(
            Map.entry("sin", "\\sin"),
            Map.entry("cos", "\\cos"),
            Map.entry("tan", "\\tan"),
            Map.entry("sec", "\\sec"),
            Map.entry("csc", "\\csc"),
            Map.entry("cot", "\\cot"),
            Map.entry("asin", "\\arcsin"),
            Map.entry("acos", "\\arccos"),
            Map.entry("atan", "\\arctan"),
            Map.entry("sinh", "\\sinh"),
            Map.entry("cosh", "\\cosh"),
            Map.entry("tanh", "\\tanh"),
            Map.entry("ln", "\\ln"),
            Map.entry("log", "\\log"),
            Map.entry("exp", "\\exp"));

    private static final Printer PRINTER = new Printer();

    private LatexRenderer() {
        // utility class
    }

    public static String render(AstNode node) {
        return node.accept(PRINTER);
    }

    static int precedence(AstNode node) {
        if (node instanceof NumberLiteral n) {
            return n.value() < 0 ? UNARY : ATOM;
        }
        if (node instanceof BinaryExpression b) {
            if (b.operator().isComparison()) {
                return COMPARISON;
            }
            return switch (b.operator()) {
                case ADD, SUBTRACT -> ADDITIVE;
                case MULTIPLY -> MULTIPLICATIVE;
                case DIVIDE -> ATOM;
                default -> POWER;
            };
        }
        if (node instanceof UnaryExpression) {
            return UNARY;
        }
        if (node instanceof Fraction f) {
            return isNegative(f.numerator()) ? UNARY : ATOM;
        }
        if (node instanceof Binder) {
            return BINDER;
        }
        return ATOM;
    }

    private static boolean isNegative(AstNode node) {
        return Nodes.isNegation(node) || node instanceof NumberLiteral n && n.value() < 0;
    }

    private static final class Printer implements NodeVisitor<String> {

        private String wrap(AstNode child, int minimum) {
            String text = child.accept(this);
            return precedence(child) < minimum ? "(" + text + ")" : text;
        }

        @Override
        public String visitNumber(NumberLiteral node) {
            return Numbers.format(node.value());
        }

        @Override
        public String visitIdentifier(Identifier node) {
            return node.name().equals("pi") ? "\\pi" : node.name();
        }

        @Override
        public String visitBinary(BinaryExpression node) {
            AstNode l = node.left();
            AstNode r = node.right();
            return switch (node.operator()) {
                case ADD -> wrap(l, ADDITIVE) + " + " + operand(r, ADDITIVE);
                case SUBTRACT -> wrap(l, ADDITIVE) + " - " + operand(r, MULTIPLICATIVE);
                case MULTIPLY -> product(l, r);
                case DIVIDE -> "\\frac{" + render(l) + "}{" + render(r) + "}";
                case POWER -> wrap(l, ATOM) + "^{" + render(r) + "}";
                case EQUALS -> comparison(l, "=", r);
                case LESS -> comparison(l, "<", r);
                case GREATER -> comparison(l, ">", r);
                case LESS_EQUAL -> comparison(l, "\\le", r);
                case GREATER_EQUAL -> comparison(l, "\\ge", r);
            };
        }

        /** Right operand of a sum: a leading sign is always parenthesized. */
        private String operand(AstNode node, int minimum) {
            return isNegative(node) ? "(" + render(node) + ")" : wrap(node, minimum);
        }

        private String comparison(AstNode l, String symbol, AstNode r) {
            return wrap(l, ADDITIVE) + " " + symbol + " " + wrap(r, ADDITIVE);
        }

        private String product(AstNode l, AstNode r) {
            String left = wrap(l, MULTIPLICATIVE);
            String right = isNegative(r) ? "(" + render(r) + ")" : wrap(r, POWER);
            if (l instanceof NumberLiteral && implicitAfterNumber(right)) {
                return left + right;
            }
            return left + " \\cdot " + right;
        }

        /** A coefficient can sit directly before a letter, a command or an opening delimiter. */
        private boolean implicitAfterNumber(String right) {
            if (right.startsWith("\\frac")) {
                return false;
            }
            char first = right.charAt(0);
            return Character.isLetter(first) || first == '\\' || first == '(' || first == '|';
        }

        @Override
        public String visitUnary(UnaryExpression node) {
            AstNode operand = node.operand();
            String text = precedence(operand) <= ADDITIVE || isNegative(operand)
                    ? "(" + render(operand) + ")"
                    : render(operand);
            return (node.operator() == UnaryOperator.MINUS ? "-" : "+") + text;
        }

        @Override
        public String visitFunction(FunctionCall node) {
            String name = node.name();
            if (name.equals(REALS) && node.args().isEmpty()) {
                return "\\mathbb{R}";
            }
            if (name.equals(SOLUTIONS)) {
                return node.args().isEmpty()
                        ? "\\emptyset"
                        : node.args().stream().map(LatexRenderer::render).collect(Collectors.joining(", ", "\\{", "\\}"));
            }
            if (node.isUnary()) {
                AstNode arg = node.arg();
                if (name.equals("abs")) {
                    return "|" + render(arg) + "|";
                }
                if (name.equals("sqrt")) {
                    return "\\sqrt{" + render(arg) + "}";
                }
                if (name.equals("ln") && Nodes.isFunction(arg, "abs")) {
                    return "\\ln|" + render(((FunctionCall) arg).arg()) + "|";
                }
            }
            String args = node.args().stream().map(LatexRenderer::render).collect(Collectors.joining(", "));
            return COMMANDS.getOrDefault(name, name) + "(" + args + ")";
        }

        @Override
        public String visitFraction(Fraction node) {
            AstNode numerator = node.numerator();
            if (isNegative(numerator)) {
                AstNode magnitude = numerator instanceof NumberLiteral n
                        ? new NumberLiteral(-n.value())
                        : ((UnaryExpression) numerator).operand();
                return "-\\frac{" + render(magnitude) + "}{" + render(node.denominator()) + "}";
            }
            return "\\frac{" + render(numerator) + "}{" + render(node.denominator()) + "}";
        }

        @Override
        public String visitIntegral(Integral node) {
            return "\\int" + bounds(node) + " " + render(node.body()) + " \\, d" + node.variable().name();
        }

        @Override
        public String visitSum(Sum node) {
            return iterated("\\sum", node);
        }

        @Override
        public String visitProduct(Product node) {
            return iterated("\\prod", node);
        }

        private String iterated(String command, Binder node) {
            String range = node.hasBounds()
                    ? "_{" + node.variable().name() + "=" + render(node.lower()) + "}^{" + render(node.upper()) + "}"
                    : "_{" + node.variable().name() + "}";
            return command + range + " " + wrap(node.body(), MULTIPLICATIVE);
        }

        private String bounds(Binder node) {
            return node.hasBounds() ? "_{" + render(node.lower()) + "}^{" + render(node.upper()) + "}" : "";
        }
    }
}
