package io.latexium.core.parser;

/**
 * One lexical unit. {@code text} is the normalized spelling: commands carry their name without
 * the backslash, operator aliases such as {@code \cdot} carry the plain operator.
 */
public record Token(Type type, String text, int position) {

    public enum Type {
        NUMBER,
        IDENTIFIER,
        FUNCTION,
        COMMAND,
        OPERATOR,
        LPAREN,
        RPAREN,
        LBRACE,
        RBRACE,
        LBRACKET,
        RBRACKET,
        PIPE,
        COMMA,
        UNDERSCORE,
        CARET,
        EOF
    }

    public boolean is(Type expected) {
        return type == expected;
    }

    public boolean is(Type expected, String value) {
        return type == expected && text.equals(value);
    }
}
