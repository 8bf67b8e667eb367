package io.latexium.core.error;

/**
 * Abstract base for all Latexium exceptions. Never thrown directly; use the concrete subclasses
 * under {@link LatexiumLoadException} or {@link LatexiumEvalException}.
 */
public abstract class LatexiumException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        LOAD,
        EVALUATION
    }

    private final Phase phase;

    protected LatexiumException(String message, Phase phase) {
        super(message);
        this.phase = phase;
    }

    protected LatexiumException(String message, Throwable cause, Phase phase) {
        super(message, cause);
        this.phase = phase;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }

    /** Stable identifier for the concrete error type. */
    public abstract String urn();
}
