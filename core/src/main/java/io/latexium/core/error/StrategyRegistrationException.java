package io.latexium.core.error;

/**
 * Thrown when an engine is constructed from an invalid strategy set (empty, duplicate names, null
 * entries). Fatal: the engine never runs with a partial set. URN: {@code
 * urn:latexium:error:strategy-registration}
 */
public final class StrategyRegistrationException extends LatexiumLoadException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:latexium:error:strategy-registration";

    public StrategyRegistrationException(String message) {
        super(message);
    }

    @Override
    public String urn() {
        return URN;
    }
}
