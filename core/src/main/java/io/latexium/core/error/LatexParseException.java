package io.latexium.core.error;

/**
 * Thrown when LaTeX input cannot be tokenized or parsed, or when an AST document fails schema
 * validation. URN: {@code urn:latexium:error:parse-failed}
 */
public final class LatexParseException extends LatexiumLoadException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:latexium:error:parse-failed";

    private final int position;

    public LatexParseException(String message, int position) {
        super(message);
        this.position = position;
    }

    public LatexParseException(String message, Throwable cause) {
        super(message, cause);
        this.position = -1;
    }

    /** Offset into the input where parsing stopped, or {@code -1} if not positional. */
    public int position() {
        return position;
    }

    @Override
    public String urn() {
        return URN;
    }
}
