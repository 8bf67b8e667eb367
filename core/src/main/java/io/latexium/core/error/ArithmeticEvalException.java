package io.latexium.core.error;

/**
 * Thrown when constant folding or evaluation hits an undefined operation such as division by zero.
 * URN: {@code urn:latexium:error:arithmetic}
 */
public final class ArithmeticEvalException extends LatexiumEvalException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:latexium:error:arithmetic";

    public ArithmeticEvalException(String message) {
        super(message);
    }

    @Override
    public String urn() {
        return URN;
    }
}
