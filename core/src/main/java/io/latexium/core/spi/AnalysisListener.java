package io.latexium.core.spi;

/**
 * Observability hook for facade operations.
 *
 * <p>Events are immutable. Exceptions thrown by a listener are caught and logged by the facade and
 * never change the result of the operation.
 */
public interface AnalysisListener {

    /** Called after an operation produced a value. */
    void onAnalysisCompleted(AnalysisCompletedEvent event);

    /** Called after an operation produced an error result. */
    void onAnalysisFailed(AnalysisFailedEvent event);

    // --- Event records ---

    /** Emitted when an operation completes; {@code detail} is the rendered value. */
    record AnalysisCompletedEvent(String operation, String input, long durationMs, String detail) {}

    /** Emitted when an operation fails; {@code detail} is the error text. */
    record AnalysisFailedEvent(String operation, String input, long durationMs, String detail) {}
}
