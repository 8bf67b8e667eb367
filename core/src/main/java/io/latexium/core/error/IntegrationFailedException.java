package io.latexium.core.error;

/**
 * Thrown when neither the strategy engine nor the legacy integrator produces an antiderivative.
 * URN: {@code urn:latexium:error:integration-failed}
 */
public final class IntegrationFailedException extends LatexiumEvalException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:latexium:error:integration-failed";

    public IntegrationFailedException(String message) {
        super(message);
    }

    public IntegrationFailedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String urn() {
        return URN;
    }
}
