package io.latexium.core.simplify;

import io.latexium.core.ast.AstNode;
import io.latexium.core.ast.Nodes;
import io.latexium.core.structure.CanonicalKey;
import io.latexium.core.structure.Factors;
import io.latexium.core.structure.Numbers;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Multiplicative atoms of a product: base to numeric exponent, keyed canonically. */
final class Atoms {

    private final double coefficient;
    private final Map<String, AstNode> bases = new LinkedHashMap<>();
    private final Map<String, Double> exponents = new LinkedHashMap<>();

    private Atoms(double coefficient) {
        this.coefficient = coefficient;
    }

    static Atoms of(AstNode node) {
        Factors.Decomposition parts = Factors.decompose(node);
        if (!parts.denominators().isEmpty()) {
            Atoms opaque = new Atoms(1);
            opaque.add(node, 1);
            return opaque;
        }
        Atoms atoms = new Atoms(parts.coefficient());
        for (AstNode factor : parts.factors()) {
            double exponent = Numbers.constantValue(Factors.exponent(factor));
            if (Double.isNaN(exponent)) {
                atoms.add(factor, 1);
            } else {
                atoms.add(Factors.base(factor), exponent);
            }
        }
        return atoms;
    }

    private void add(AstNode base, double exponent) {
        String key = CanonicalKey.of(base);
        bases.putIfAbsent(key, base);
        exponents.merge(key, exponent, Double::sum);
    }

    /** Removes the shared part of both atom sets; true if anything was removed. */
    boolean cancelAgainst(Atoms other) {
        boolean changed = false;
        for (String key : exponents.keySet()) {
            Double theirs = other.exponents.get(key);
            if (theirs == null) {
                continue;
            }
            double ours = exponents.get(key);
            double shared = Math.min(ours, theirs);
            if (shared > 0) {
                exponents.put(key, ours - shared);
                other.exponents.put(key, theirs - shared);
                changed = true;
            }
        }
        return changed;
    }

    /** Unsimplified product of the remaining atoms. */
    AstNode toProduct() {
        List<AstNode> factors = new ArrayList<>();
        factors.add(Numbers.toNode(coefficient));
        for (Map.Entry<String, AstNode> entry : bases.entrySet()) {
            double exponent = exponents.get(entry.getKey());
            if (exponent == 1) {
                factors.add(entry.getValue());
            } else if (exponent > 0) {
                factors.add(Nodes.pow(entry.getValue(), Numbers.toNode(exponent)));
            }
        }
        return Factors.chain(factors);
    }
}
