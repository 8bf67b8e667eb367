package io.latexium.core.parser;

import io.latexium.core.ast.AstNode;
import io.latexium.core.ast.BinaryExpression;
import io.latexium.core.ast.BinaryOperator;
import io.latexium.core.ast.FunctionCall;
import io.latexium.core.ast.Identifier;
import io.latexium.core.ast.Integral;
import io.latexium.core.ast.Nodes;
import io.latexium.core.ast.NumberLiteral;
import io.latexium.core.ast.Product;
import io.latexium.core.ast.ScopeResolver;
import io.latexium.core.ast.Sum;
import io.latexium.core.ast.UnaryExpression;
import io.latexium.core.ast.UnaryOperator;
import io.latexium.core.error.LatexParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for LaTeX math. Precedence, loosest first: comparison, additive,
 * multiplicative (explicit or by juxtaposition), unary sign, power (right-associative), postfix
 * subscript, primary.
 *
 * <p>Inside an integrand, {@code d} followed by a letter ends the body and names the variable.
 * The returned tree is scope-resolved.
 */
public final class LatexParser {

    private static final Set<String> COMPARISONS = Set.of("=", "<", ">", "<=", ">=");

    private final List<Token> tokens;
    private int index;
    private int absDepth;
    private int integralDepth;

    private LatexParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Parses {@code input} into a scope-resolved tree.
     *
     * @throws LatexParseException with the offending position on any syntax error
     */
    public static AstNode parse(String input) {
        if (input == null || input.isBlank()) {
            throw new LatexParseException("Input is empty", 0);
        }
        LatexParser parser = new LatexParser(Tokenizer.tokenize(input));
        AstNode tree = parser.comparison();
        if (!parser.peek().is(Token.Type.EOF)) {
            throw parser.error("Unexpected token");
        }
        return ScopeResolver.resolve(tree);
    }

    // --- Grammar levels ---

    private AstNode comparison() {
        AstNode left = additive();
        if (peek().is(Token.Type.OPERATOR) && COMPARISONS.contains(peek().text())) {
            BinaryOperator operator = BinaryOperator.fromSymbol(advance().text());
            return new BinaryExpression(operator, left, additive());
        }
        return left;
    }

    private AstNode additive() {
        AstNode left = multiplicative();
        while (true) {
            if (peek().is(Token.Type.OPERATOR, "+")) {
                advance();
                left = Nodes.add(left, multiplicative());
            } else if (peek().is(Token.Type.OPERATOR, "-")) {
                advance();
                left = Nodes.sub(left, multiplicative());
            } else {
                return left;
            }
        }
    }

    private AstNode multiplicative() {
        AstNode left = unary();
        while (true) {
            if (peek().is(Token.Type.OPERATOR, "*")) {
                advance();
                left = Nodes.mul(left, unary());
            } else if (peek().is(Token.Type.OPERATOR, "/")) {
                advance();
                left = Nodes.frac(left, unary());
            } else if (startsImplicitOperand()) {
                left = Nodes.mul(left, power());
            } else {
                return left;
            }
        }
    }

    private AstNode unary() {
        if (peek().is(Token.Type.OPERATOR, "-")) {
            advance();
            return new UnaryExpression(UnaryOperator.MINUS, unary());
        }
        if (peek().is(Token.Type.OPERATOR, "+")) {
            advance();
            return new UnaryExpression(UnaryOperator.PLUS, unary());
        }
        return power();
    }

    private AstNode power() {
        AstNode base = postfix();
        if (peek().is(Token.Type.CARET)) {
            advance();
            AstNode exponent = peek().is(Token.Type.LBRACE) ? braced() : unary();
            return Nodes.pow(base, exponent);
        }
        return base;
    }

    /** Subscripted identifiers such as {@code x_1} or {@code a_{n}}. */
    private AstNode postfix() {
        AstNode node = primary();
        while (node instanceof Identifier id && peek().is(Token.Type.UNDERSCORE)) {
            advance();
            node = Identifier.free(id.name() + "_" + subscript());
        }
        return node;
    }

    private String subscript() {
        if (!peek().is(Token.Type.LBRACE)) {
            Token t = advance();
            if (!t.is(Token.Type.NUMBER) && !t.is(Token.Type.IDENTIFIER)) {
                throw error("Expected subscript");
            }
            return t.text();
        }
        advance();
        StringBuilder text = new StringBuilder();
        while (peek().is(Token.Type.NUMBER) || peek().is(Token.Type.IDENTIFIER)) {
            text.append(advance().text());
        }
        expect(Token.Type.RBRACE, "'}' after subscript");
        if (text.length() == 0) {
            throw error("Empty subscript");
        }
        return text.toString();
    }

    private AstNode primary() {
        Token t = peek();
        switch (t.type()) {
            case NUMBER:
                advance();
                return new NumberLiteral(Double.parseDouble(t.text()));
            case IDENTIFIER:
                advance();
                return Identifier.free(t.text());
            case LPAREN: {
                advance();
                AstNode inner = comparison();
                expect(Token.Type.RPAREN, "')'");
                return inner;
            }
            case LBRACKET: {
                advance();
                AstNode inner = comparison();
                expect(Token.Type.RBRACKET, "']'");
                return inner;
            }
            case LBRACE:
                return braced();
            case PIPE:
                return absolute();
            case FUNCTION:
                return function();
            case COMMAND:
                return command();
            default:
                throw error(t.is(Token.Type.EOF) ? "Unexpected end of input" : "Unexpected token");
        }
    }

    // --- Constructs ---

    private AstNode braced() {
        expect(Token.Type.LBRACE, "'{'");
        AstNode inner = comparison();
        expect(Token.Type.RBRACE, "'}'");
        return inner;
    }

    private AstNode groupOrPrimary() {
        return peek().is(Token.Type.LBRACE) ? braced() : primary();
    }

    private AstNode absolute() {
        advance();
        absDepth++;
        AstNode inner = additive();
        absDepth--;
        expect(Token.Type.PIPE, "closing '|'");
        return Nodes.fn("abs", inner);
    }

    /** {@code \sin x}, {@code \sin(x)}, {@code \sin^2 x}, {@code \log_b x}, {@code abs(x)}. */
    private AstNode function() {
        Token head = advance();
        String name = head.text();
        AstNode exponent = null;
        if (peek().is(Token.Type.CARET)) {
            advance();
            exponent = groupOrPrimary();
        }
        AstNode logBase = null;
        if (name.equals("log") && peek().is(Token.Type.UNDERSCORE)) {
            advance();
            logBase = groupOrPrimary();
        }
        FunctionCall call;
        if (peek().is(Token.Type.LPAREN)) {
            advance();
            List<AstNode> args = new ArrayList<>();
            args.add(comparison());
            while (peek().is(Token.Type.COMMA)) {
                advance();
                args.add(comparison());
            }
            expect(Token.Type.RPAREN, "')' after arguments of " + name);
            call = new FunctionCall(name, args);
        } else if (peek().is(Token.Type.LBRACE)) {
            call = new FunctionCall(name, braced());
        } else {
            call = new FunctionCall(name, functionArgument());
        }
        AstNode result = call;
        if (logBase != null) {
            if (!call.isUnary()) {
                throw new LatexParseException("log with a base takes one argument", head.position());
            }
            result = Nodes.frac(Nodes.fn("ln", call.arg()), Nodes.fn("ln", logBase));
        }
        return exponent == null ? result : Nodes.pow(result, exponent);
    }

    /** Unparenthesized argument: a power followed by juxtaposed letters or numbers, {@code \sin 2x}. */
    private AstNode functionArgument() {
        AstNode argument = power();
        while ((peek().is(Token.Type.IDENTIFIER) || peek().is(Token.Type.NUMBER)) && !atDifferential()) {
            argument = Nodes.mul(argument, power());
        }
        return argument;
    }

    private AstNode command() {
        Token head = advance();
        return switch (head.text()) {
            case "frac" -> {
                AstNode numerator = groupOrPrimary();
                AstNode denominator = groupOrPrimary();
                yield Nodes.frac(numerator, denominator);
            }
            case "sqrt" -> sqrt();
            case "int" -> integral(head);
            case "sum", "prod" -> iterated(head);
            default -> throw new LatexParseException("Unsupported command \\" + head.text(), head.position());
        };
    }

    /** {@code \sqrt{x}}, or {@code x^(1/n)} for {@code \sqrt[n]{x}}. */
    private AstNode sqrt() {
        if (peek().is(Token.Type.LBRACKET)) {
            advance();
            AstNode degree = comparison();
            expect(Token.Type.RBRACKET, "']' after root degree");
            return Nodes.pow(groupOrPrimary(), Nodes.frac(NumberLiteral.ONE, degree));
        }
        return Nodes.fn("sqrt", groupOrPrimary());
    }

    private AstNode integral(Token head) {
        AstNode lower = null;
        AstNode upper = null;
        if (peek().is(Token.Type.UNDERSCORE)) {
            advance();
            lower = bound();
        }
        if (peek().is(Token.Type.CARET)) {
            advance();
            upper = bound();
        }
        if ((lower == null) != (upper == null)) {
            throw new LatexParseException("Definite integral needs both bounds", head.position());
        }
        integralDepth++;
        AstNode body = atDifferential() ? NumberLiteral.ONE : additive();
        integralDepth--;
        if (!peek().is(Token.Type.IDENTIFIER, "d") || !peek(1).is(Token.Type.IDENTIFIER)) {
            throw error("Expected d<variable> after integrand");
        }
        advance();
        Identifier variable = Identifier.free(advance().text());
        return new Integral(body, variable, lower, upper);
    }

    /** {@code \sum_{i=a}^{b} body}; the body extends over one multiplicative term. */
    private AstNode iterated(Token head) {
        expect(Token.Type.UNDERSCORE, "'_' after \\" + head.text());
        expect(Token.Type.LBRACE, "'{' before index");
        Identifier variable = Identifier.free(expect(Token.Type.IDENTIFIER, "index variable").text());
        if (!peek().is(Token.Type.OPERATOR, "=")) {
            throw error("Expected '=' after index variable");
        }
        advance();
        AstNode lower = additive();
        expect(Token.Type.RBRACE, "'}' after lower bound");
        expect(Token.Type.CARET, "'^' before upper bound");
        AstNode upper = bound();
        AstNode body = multiplicative();
        return head.text().equals("sum")
                ? new Sum(body, variable, lower, upper)
                : new Product(body, variable, lower, upper);
    }

    /** A bound: a braced group, a signed primary, or a primary. */
    private AstNode bound() {
        if (peek().is(Token.Type.LBRACE)) {
            return braced();
        }
        if (peek().is(Token.Type.OPERATOR, "-")) {
            advance();
            return Nodes.neg(primary());
        }
        return primary();
    }

    // --- Token helpers ---

    private boolean startsImplicitOperand() {
        if (atDifferential()) {
            return false;
        }
        return switch (peek().type()) {
            case NUMBER, IDENTIFIER, FUNCTION, COMMAND, LPAREN, LBRACE, LBRACKET -> true;
            case PIPE -> absDepth == 0;
            default -> false;
        };
    }

    private boolean atDifferential() {
        return integralDepth > 0 && peek().is(Token.Type.IDENTIFIER, "d") && peek(1).is(Token.Type.IDENTIFIER);
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token peek(int ahead) {
        return tokens.get(Math.min(index + ahead, tokens.size() - 1));
    }

    private Token advance() {
        Token t = tokens.get(index);
        if (!t.is(Token.Type.EOF)) {
            index++;
        }
        return t;
    }

    private Token expect(Token.Type type, String description) {
        if (!peek().is(type)) {
            throw error("Expected " + description);
        }
        return advance();
    }

    private LatexParseException error(String message) {
        Token t = peek();
        String found = t.is(Token.Type.EOF) ? "end of input" : "'" + t.text() + "'";
        return new LatexParseException(message + " at position " + t.position() + ", found " + found, t.position());
    }
}
