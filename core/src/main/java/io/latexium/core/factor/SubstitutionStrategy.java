package io.latexium.core.factor;

import io.latexium.core.ast.AstNode;
import io.latexium.core.ast.FunctionCall;
import io.latexium.core.ast.Nodes;
import io.latexium.core.model.StrategyResult;
import io.latexium.core.structure.CanonicalKey;
import io.latexium.core.structure.Polynomial;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Treats a repeated sub-expression as a fresh variable, factors, and substitutes back. Covers
 * polynomials in {@code x^k} ({@code x^4 - 5x^2 + 4}) and polynomials in a function atom ({@code
 * sin(x)^2 - 1}).
 */
public final class SubstitutionStrategy implements FactorStrategy {

    private static final List<String> FRESH_NAMES = List.of("u", "w", "v", "s", "q");

    private final FactorizationEngine inner = new FactorizationEngine(List.of(
            new CommonFactorStrategy(),
            new DifferenceOfSquaresStrategy(),
            new QuadraticStrategy(),
            new CubicStrategy()));

    @Override
    public String name() {
        return "substitution";
    }

    @Override
    public StrategyResult apply(AstNode node, String variable) {
        Set<String> used = Nodes.freeVariables(node);
        Optional<String> fresh = FRESH_NAMES.stream().filter(n -> !used.contains(n)).findFirst();
        if (fresh.isEmpty()) {
            return StrategyResult.failure("No fresh variable available");
        }
        String u = fresh.get();
        Optional<Polynomial> polynomial = Polynomial.from(node, variable);
        if (polynomial.isPresent()) {
            return powerSubstitution(polynomial.get(), variable, u);
        }
        return atomSubstitution(node, variable, u);
    }

    private StrategyResult powerSubstitution(Polynomial p, String variable, String u) {
        int k = 0;
        for (int degree = 1; degree <= p.degree(); degree++) {
            if (p.coefficient(degree) != 0) {
                k = gcd(k, degree);
            }
        }
        if (k < 2 || p.lowestDegree() != 0) {
            return StrategyResult.failure("Not a polynomial in a power of " + variable);
        }
        Optional<Polynomial> compressed = p.compress(k);
        if (compressed.isEmpty() || compressed.get().degree() > 3) {
            return StrategyResult.failure("Substituted polynomial is too large");
        }
        AstNode substituted = compressed.get().toAst(u);
        AstNode factored = inner.factor(substituted, u);
        if (CanonicalKey.of(factored).equals(CanonicalKey.of(substituted))) {
            return StrategyResult.failure("Substituted polynomial does not factor");
        }
        AstNode result = Nodes.substitute(factored, u, Roots.power(variable, k));
        return StrategyResult.success(result, "Substituted " + u + " = " + variable + "^" + k);
    }

    private StrategyResult atomSubstitution(AstNode node, String variable, String u) {
        for (FunctionCall atom : functionAtoms(node, variable)) {
            AstNode substituted = Nodes.replace(node, atom, Nodes.var(u));
            if (Nodes.dependsOn(substituted, variable)) {
                continue;
            }
            Optional<Polynomial> polynomial = Polynomial.from(substituted, u);
            if (polynomial.isEmpty() || polynomial.get().degree() < 2) {
                continue;
            }
            AstNode factored = inner.factor(polynomial.get().toAst(u), u);
            if (CanonicalKey.of(factored).equals(CanonicalKey.of(polynomial.get().toAst(u)))) {
                continue;
            }
            AstNode result = Nodes.substitute(factored, u, atom);
            return StrategyResult.success(result, "Substituted " + u + " for " + atom.name() + "(...)");
        }
        return StrategyResult.failure("No repeated sub-expression");
    }

    private static List<FunctionCall> functionAtoms(AstNode node, String variable) {
        List<FunctionCall> atoms = new ArrayList<>();
        collect(node, variable, atoms);
        return atoms;
    }

    private static void collect(AstNode node, String variable, List<FunctionCall> atoms) {
        if (node instanceof FunctionCall f && Nodes.dependsOn(f, variable)) {
            if (!atoms.contains(f)) {
                atoms.add(f);
            }
            return;
        }
        for (AstNode child : Nodes.children(node)) {
            collect(child, variable, atoms);
        }
    }

    private static int gcd(int a, int b) {
        return b == 0 ? a : gcd(b, a % b);
    }
}
