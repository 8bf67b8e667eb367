package io.latexium.core.error;

/**
 * Abstract parent for errors raised while an operation runs on a well-formed tree. The {@code
 * Latexium} facade catches these and turns them into an error result.
 */
public abstract class LatexiumEvalException extends LatexiumException {

    private static final long serialVersionUID = 1L;

    protected LatexiumEvalException(String message) {
        super(message, Phase.EVALUATION);
    }

    protected LatexiumEvalException(String message, Throwable cause) {
        super(message, cause, Phase.EVALUATION);
    }
}
