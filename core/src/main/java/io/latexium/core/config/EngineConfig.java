package io.latexium.core.config;

import io.latexium.core.simplify.SimplifyOptions;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Engine settings. Use {@link #builder()} to override individual defaults.
 *
 * @param simplify               rewrite toggles applied by every simplifying operation
 * @param integrationMaxDepth    maximum nesting of integration strategy recursion
 * @param overlapMaxIterations   rounds of the overlap cancellation loop
 * @param maxExpansionPower      largest integer power of a sum that expansion multiplies out
 * @param approximationPrecision significant digits reported by {@code approximate}
 * @param legacyFallback         retry with the legacy rule table when the strategy search fails
 * @param loggingFormat          {@code text} or {@code json}
 * @param loggingLevel           root log level name
 */
public record EngineConfig(
        SimplifyOptions simplify,
        int integrationMaxDepth,
        int overlapMaxIterations,
        int maxExpansionPower,
        int approximationPrecision,
        boolean legacyFallback,
        String loggingFormat,
        String loggingLevel) {

    private static final Set<String> FORMATS = Set.of("text", "json");
    private static final Set<String> LEVELS = Set.of("TRACE", "DEBUG", "INFO", "WARN", "ERROR", "OFF");

    public EngineConfig {
        Objects.requireNonNull(simplify, "simplify must not be null");
        Objects.requireNonNull(loggingFormat, "loggingFormat must not be null");
        Objects.requireNonNull(loggingLevel, "loggingLevel must not be null");
        requireAtLeast("integrationMaxDepth", integrationMaxDepth, 1);
        requireAtLeast("overlapMaxIterations", overlapMaxIterations, 1);
        requireAtLeast("maxExpansionPower", maxExpansionPower, 2);
        requireAtLeast("approximationPrecision", approximationPrecision, 1);
        if (approximationPrecision > 17) {
            throw new IllegalArgumentException(
                    "approximationPrecision must be at most 17, got " + approximationPrecision);
        }
        loggingFormat = loggingFormat.toLowerCase(Locale.ROOT);
        if (!FORMATS.contains(loggingFormat)) {
            throw new IllegalArgumentException("loggingFormat must be text or json, got '" + loggingFormat + "'");
        }
        loggingLevel = loggingLevel.toUpperCase(Locale.ROOT);
        if (!LEVELS.contains(loggingLevel)) {
            throw new IllegalArgumentException("Unknown logging level '" + loggingLevel + "'");
        }
    }

    private static void requireAtLeast(String name, int value, int minimum) {
        if (value < minimum) {
            throw new IllegalArgumentException(name + " must be at least " + minimum + ", got " + value);
        }
    }

    public static EngineConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private SimplifyOptions simplify = SimplifyOptions.defaults();
        private int integrationMaxDepth = 3;
        private int overlapMaxIterations = 5;
        private int maxExpansionPower = 10;
        private int approximationPrecision = 6;
        private boolean legacyFallback = true;
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";

        Builder() {}

        public Builder simplify(SimplifyOptions simplify) {
            this.simplify = simplify;
            return this;
        }

        public Builder integrationMaxDepth(int integrationMaxDepth) {
            this.integrationMaxDepth = integrationMaxDepth;
            return this;
        }

        public Builder overlapMaxIterations(int overlapMaxIterations) {
            this.overlapMaxIterations = overlapMaxIterations;
            return this;
        }

        public Builder maxExpansionPower(int maxExpansionPower) {
            this.maxExpansionPower = maxExpansionPower;
            return this;
        }

        public Builder approximationPrecision(int approximationPrecision) {
            this.approximationPrecision = approximationPrecision;
            return this;
        }

        public Builder legacyFallback(boolean legacyFallback) {
            this.legacyFallback = legacyFallback;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(
                    simplify,
                    integrationMaxDepth,
                    overlapMaxIterations,
                    maxExpansionPower,
                    approximationPrecision,
                    legacyFallback,
                    loggingFormat,
                    loggingLevel);
        }
    }
}
