package io.latexium.core.simplify;

/**
 * Rewrite toggles for {@link Simplifier}. Every toggle defaults to {@code true} except {@code
 * factor}; {@code maxDepth} bounds the number of fixed-point rounds.
 */
public record SimplifyOptions(
        boolean combineLikeTerms,
        boolean expand,
        boolean simplifyFractions,
        boolean applyIdentities,
        boolean factor,
        int maxDepth) {

    public static final int DEFAULT_MAX_DEPTH = 10;

    public SimplifyOptions {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1, got " + maxDepth);
        }
    }

    public static SimplifyOptions defaults() {
        return new SimplifyOptions(true, true, true, true, false, DEFAULT_MAX_DEPTH);
    }

    public static Builder builder() {
        return new Builder(defaults());
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    /** Field-by-field override of a base option set. */
    public static final class Builder {

        private boolean combineLikeTerms;
        private boolean expand;
        private boolean simplifyFractions;
        private boolean applyIdentities;
        private boolean factor;
        private int maxDepth;

        private Builder(SimplifyOptions base) {
            this.combineLikeTerms = base.combineLikeTerms;
            this.expand = base.expand;
            this.simplifyFractions = base.simplifyFractions;
            this.applyIdentities = base.applyIdentities;
            this.factor = base.factor;
            this.maxDepth = base.maxDepth;
        }

        public Builder combineLikeTerms(boolean value) {
            this.combineLikeTerms = value;
            return this;
        }

        public Builder expand(boolean value) {
            this.expand = value;
            return this;
        }

        public Builder simplifyFractions(boolean value) {
            this.simplifyFractions = value;
            return this;
        }

        public Builder applyIdentities(boolean value) {
            this.applyIdentities = value;
            return this;
        }

        public Builder factor(boolean value) {
            this.factor = value;
            return this;
        }

        public Builder maxDepth(int value) {
            this.maxDepth = value;
            return this;
        }

        public SimplifyOptions build() {
            return new SimplifyOptions(combineLikeTerms, expand, simplifyFractions, applyIdentities, factor, maxDepth);
        }
    }
}
