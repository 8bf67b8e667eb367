package io.latexium.core.structure;

import io.latexium.core.ast.AstNode;
import java.util.Objects;

/**
 * One addend of a flattened sum: {@code sign * coefficient * canonicalForm}. The coefficient is
 * never negative; the sign carries direction.
 */
public record Term(double coefficient, AstNode canonicalForm, int sign) {

    public Term {
        Objects.requireNonNull(canonicalForm, "canonicalForm must not be null");
        if (coefficient < 0) {
            throw new IllegalArgumentException("coefficient must not be negative: " + coefficient);
        }
        if (sign != 1 && sign != -1) {
            throw new IllegalArgumentException("sign must be 1 or -1: " + sign);
        }
    }

    public static Term of(double signedCoefficient, AstNode canonicalForm) {
        return new Term(Math.abs(signedCoefficient), canonicalForm, signedCoefficient < 0 ? -1 : 1);
    }

    public double signedCoefficient() {
        return sign * coefficient;
    }

    public boolean isConstant() {
        return Terms.isOne(canonicalForm);
    }

    public String key() {
        return CanonicalKey.of(canonicalForm);
    }

    public Term withSignedCoefficient(double value) {
        return of(value, canonicalForm);
    }

    public Term negate() {
        return new Term(coefficient, canonicalForm, -sign);
    }
}
