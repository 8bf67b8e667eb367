package io.latexium.core.parser;

import io.latexium.core.error.LatexParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Splits LaTeX input into tokens. Letters are read one at a time, so {@code 2xy} yields three
 * factors, unless a known function name starts at that position ({@code sin}, {@code abs}).
 */
public final class Tokenizer {

    /** Plain-word spellings of functions, longest first so {@code sinh} wins over {@code sin}. */
    private static final List<String> WORDS = List.of(
                    "arcsin", "arccos", "arctan", "asin", "acos", "atan", "sinh", "cosh", "tanh",
                    "sqrt", "sin", "cos", "tan", "sec", "csc", "cot", "exp", "log", "abs", "ln", "pi")
            .stream()
            .sorted(Comparator.comparingInt(String::length).reversed())
            .toList();

    private static final Map<String, String> FUNCTION_ALIASES = Map.of(
            "arcsin", "asin",
            "arccos", "acos",
            "arctan", "atan");

    private static final Set<String> FUNCTION_COMMANDS = Set.of(
            "sin", "cos", "tan", "sec", "csc", "cot", "arcsin", "arccos", "arctan",
            "sinh", "cosh", "tanh", "log", "ln", "exp");

    private static final Set<String> STRUCTURE_COMMANDS = Set.of("frac", "sqrt", "int", "sum", "prod");

    private static final Map<String, String> OPERATOR_COMMANDS = Map.of(
            "cdot", "*",
            "times", "*",
            "div", "/",
            "le", "<=",
            "leq", "<=",
            "ge", ">=",
            "geq", ">=");

    /** Spacing and sizing commands that carry no meaning for the tree. */
    private static final Set<String> IGNORED_COMMANDS = Set.of("left", "right", "quad", "qquad");

    private final String input;
    private int pos;

    private Tokenizer(String input) {
        this.input = input;
    }

    /** Tokenizes {@code input}; the list always ends with an {@link Token.Type#EOF} token. */
    public static List<Token> tokenize(String input) {
        return new Tokenizer(input).run();
    }

    private List<Token> run() {
        List<Token> tokens = new ArrayList<>();
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (Character.isDigit(c) || c == '.' && pos + 1 < input.length()
                    && Character.isDigit(input.charAt(pos + 1))) {
                tokens.add(number());
            } else if (Character.isLetter(c)) {
                tokens.add(word());
            } else if (c == '\\') {
                Token command = command();
                if (command != null) {
                    tokens.add(command);
                }
            } else {
                tokens.add(symbol(c));
            }
        }
        tokens.add(new Token(Token.Type.EOF, "", input.length()));
        return tokens;
    }

    private Token number() {
        int start = pos;
        while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
            pos++;
        }
        if (pos < input.length() && input.charAt(pos) == '.') {
            pos++;
            while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
                pos++;
            }
        }
        return new Token(Token.Type.NUMBER, input.substring(start, pos), start);
    }

    private Token word() {
        int start = pos;
        if (input.charAt(pos) == 'π') {
            pos++;
            return new Token(Token.Type.IDENTIFIER, "pi", start);
        }
        for (String name : WORDS) {
            if (input.startsWith(name, pos)) {
                pos += name.length();
                if (name.equals("pi")) {
                    return new Token(Token.Type.IDENTIFIER, "pi", start);
                }
                return new Token(Token.Type.FUNCTION, FUNCTION_ALIASES.getOrDefault(name, name), start);
            }
        }
        pos++;
        return new Token(Token.Type.IDENTIFIER, String.valueOf(input.charAt(start)), start);
    }

    /** Reads a command; returns {@code null} for spacing commands, which are dropped. */
    private Token command() {
        int start = pos;
        pos++;
        if (pos >= input.length()) {
            throw new LatexParseException("Dangling backslash", start);
        }
        char next = input.charAt(pos);
        if (!Character.isLetter(next)) {
            pos++;
            return switch (next) {
                case ',', ';', '!', ':', ' ' -> null;
                case '{' -> new Token(Token.Type.LBRACE, "{", start);
                case '}' -> new Token(Token.Type.RBRACE, "}", start);
                default -> throw new LatexParseException("Unknown command \\" + next, start);
            };
        }
        while (pos < input.length() && Character.isLetter(input.charAt(pos))) {
            pos++;
        }
        String name = input.substring(start + 1, pos);
        if (IGNORED_COMMANDS.contains(name)) {
            return null;
        }
        if (name.equals("pi")) {
            return new Token(Token.Type.IDENTIFIER, "pi", start);
        }
        if (OPERATOR_COMMANDS.containsKey(name)) {
            return new Token(Token.Type.OPERATOR, OPERATOR_COMMANDS.get(name), start);
        }
        if (FUNCTION_COMMANDS.contains(name)) {
            return new Token(Token.Type.FUNCTION, FUNCTION_ALIASES.getOrDefault(name, name), start);
        }
        if (STRUCTURE_COMMANDS.contains(name)) {
            return new Token(Token.Type.COMMAND, name, start);
        }
        throw new LatexParseException("Unknown command \\" + name, start);
    }

    private Token symbol(char c) {
        int start = pos++;
        return switch (c) {
            case '+', '-', '*', '/', '=' -> new Token(Token.Type.OPERATOR, String.valueOf(c), start);
            case '<', '>' -> {
                if (pos < input.length() && input.charAt(pos) == '=') {
                    pos++;
                    yield new Token(Token.Type.OPERATOR, c + "=", start);
                }
                yield new Token(Token.Type.OPERATOR, String.valueOf(c), start);
            }
            case '^' -> new Token(Token.Type.CARET, "^", start);
            case '_' -> new Token(Token.Type.UNDERSCORE, "_", start);
            case '(' -> new Token(Token.Type.LPAREN, "(", start);
            case ')' -> new Token(Token.Type.RPAREN, ")", start);
            case '{' -> new Token(Token.Type.LBRACE, "{", start);
            case '}' -> new Token(Token.Type.RBRACE, "}", start);
            case '[' -> new Token(Token.Type.LBRACKET, "[", start);
            case ']' -> new Token(Token.Type.RBRACKET, "]", start);
            case '|' -> new Token(Token.Type.PIPE, "|", start);
            case ',' -> new Token(Token.Type.COMMA, ",", start);
            case '·', '×' -> new Token(Token.Type.OPERATOR, "*", start);
            default -> throw new LatexParseException("Unexpected character '" + c + "'", start);
        };
    }
}
