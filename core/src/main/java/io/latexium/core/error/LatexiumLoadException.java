package io.latexium.core.error;

/**
 * Abstract parent for errors raised before any symbolic work starts: malformed input, invalid AST
 * documents, or an engine assembled from an invalid strategy set.
 */
public abstract class LatexiumLoadException extends LatexiumException {

    private static final long serialVersionUID = 1L;

    protected LatexiumLoadException(String message) {
        super(message, Phase.LOAD);
    }

    protected LatexiumLoadException(String message, Throwable cause) {
        super(message, cause, Phase.LOAD);
    }
}
