package io.latexium.core.error;

/**
 * Thrown when an operation meets a construct it does not handle, e.g. differentiating an
 * integral or solving a cubic. Never retried. URN: {@code urn:latexium:error:unsupported-construct}
 */
public final class UnsupportedConstructException extends LatexiumEvalException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:latexium:error:unsupported-construct";

    public UnsupportedConstructException(String message) {
        super(message);
    }

    @Override
    public String urn() {
        return URN;
    }
}
