package io.latexium.core.simplify;

import io.latexium.core.ast.AstNode;
import io.latexium.core.ast.BinaryExpression;
import io.latexium.core.ast.BinaryOperator;
import io.latexium.core.ast.Fraction;
import io.latexium.core.ast.FunctionCall;
import io.latexium.core.ast.Identifier;
import io.latexium.core.ast.Integral;
import io.latexium.core.ast.NodeVisitor;
import io.latexium.core.ast.Nodes;
import io.latexium.core.ast.NumberLiteral;
import io.latexium.core.ast.Product;
import io.latexium.core.ast.Sum;
import io.latexium.core.ast.UnaryExpression;
import io.latexium.core.ast.UnaryOperator;
import io.latexium.core.error.ArithmeticEvalException;
import io.latexium.core.evaluate.MathFunctions;
import io.latexium.core.factor.FactorizationEngine;
import io.latexium.core.structure.CanonicalKey;
import io.latexium.core.structure.Factors;
import io.latexium.core.structure.Numbers;
import io.latexium.core.structure.Term;
import io.latexium.core.structure.Terms;
import io.latexium.core.structure.VariableInference;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Canonicalizing rewrite engine. Each round rewrites the tree bottom-up; rounds repeat until the
 * tree stops changing or {@link SimplifyOptions#maxDepth()} rounds have run, so two rules that
 * undo each other cost at most that many rounds.
 *
 * <p>Canonical shapes produced here:
 *
 * <ul>
 *   <li>sums are left-associated chains, highest degree first, constants last;
 *   <li>products put the numeric coefficient first, then identifiers, functions, and the rest;
 *   <li>a negative coefficient is hoisted into a unary minus, except on fractions, where the sign
 *       sits on the numerator;
 *   <li>a product with a non-numeric denominator becomes a single {@link Fraction}.
 * </ul>
 *
 * <p>Instances are immutable and safe to share between threads.
 */
public final class Simplifier {

    private static final Logger LOG = LoggerFactory.getLogger(Simplifier.class);

    public static final int DEFAULT_MAX_EXPANSION_POWER = 10;
    public static final int DEFAULT_OVERLAP_ITERATIONS = 5;

    static final int MAX_EXPANDED_TERMS = 256;

    private static final double MAX_RADICAND = 1e12;

    private final FactorizationEngine factorizer;
    private final int maxExpansionPower;

    public Simplifier() {
        this(new FactorizationEngine(), DEFAULT_MAX_EXPANSION_POWER);
    }

    public Simplifier(FactorizationEngine factorizer, int maxExpansionPower) {
        this.factorizer = Objects.requireNonNull(factorizer, "factorizer must not be null");
        if (maxExpansionPower < 1) {
            throw new IllegalArgumentException("maxExpansionPower must be at least 1, got " + maxExpansionPower);
        }
        this.maxExpansionPower = maxExpansionPower;
    }

    public FactorizationEngine factorizer() {
        return factorizer;
    }

    public AstNode simplify(AstNode node) {
        return simplify(node, SimplifyOptions.defaults());
    }

    /**
     * Simplifies {@code node} to a fixed point. With {@code factor} enabled the result is factored
     * and then simplified once more with expansion switched off, so the factors survive.
     *
     * @throws ArithmeticEvalException on division by zero during folding
     */
    public AstNode simplify(AstNode node, SimplifyOptions options) {
        AstNode current = fixedPoint(node, options);
        if (options.factor()) {
            AstNode factored = factorizer.factor(current, VariableInference.infer(current));
            SimplifyOptions finalPass = options.toBuilder().expand(false).factor(false).build();
            current = fixedPoint(factored, finalPass);
        }
        return current;
    }

    /**
     * Deeper reduction for rational expressions: factors and cancels inside every fraction, then
     * simplifies, until the result stops changing or {@code maxIterations} passes have run.
     */
    public AstNode overlapSimplify(AstNode node, SimplifyOptions options, int maxIterations) {
        Rewriter rewriter = new Rewriter(options);
        AstNode current = node;
        for (int iteration = 0; iteration < maxIterations; iteration++) {
            AstNode next = simplify(rewriter.cancelFractions(current), options);
            if (CanonicalKey.of(next).equals(CanonicalKey.of(current))) {
                return next;
            }
            current = next;
        }
        LOG.debug("simplify.overlap.max-iterations reached iterations={}", maxIterations);
        return current;
    }

    private AstNode fixedPoint(AstNode node, SimplifyOptions options) {
        Rewriter rewriter = new Rewriter(options);
        AstNode current = node;
        for (int round = 0; round < options.maxDepth(); round++) {
            AstNode next = rewriter.rewrite(current);
            if (next.equals(current)) {
                return current;
            }
            current = next;
        }
        LOG.debug("simplify.max-depth reached rounds={}", options.maxDepth());
        return current;
    }

    /** One rewrite round. Each {@code visit} simplifies children first, then the node itself. */
    private final class Rewriter implements NodeVisitor<AstNode> {

        private final SimplifyOptions options;

        Rewriter(SimplifyOptions options) {
            this.options = options;
        }

        AstNode rewrite(AstNode node) {
            return node.accept(this);
        }

        @Override
        public AstNode visitNumber(NumberLiteral node) {
            return node;
        }

        @Override
        public AstNode visitIdentifier(Identifier node) {
            return node;
        }

        @Override
        public AstNode visitBinary(BinaryExpression node) {
            return binary(node.operator(), rewrite(node.left()), rewrite(node.right()));
        }

        @Override
        public AstNode visitUnary(UnaryExpression node) {
            return unary(node.operator(), rewrite(node.operand()));
        }

        @Override
        public AstNode visitFunction(FunctionCall node) {
            return function(node.name(), node.args().stream().map(this::rewrite).toList());
        }

        @Override
        public AstNode visitFraction(Fraction node) {
            return fraction(rewrite(node.numerator()), rewrite(node.denominator()));
        }

        @Override
        public AstNode visitIntegral(Integral node) {
            return Nodes.mapChildren(node, this::rewrite);
        }

        @Override
        public AstNode visitSum(Sum node) {
            return Nodes.mapChildren(node, this::rewrite);
        }

        @Override
        public AstNode visitProduct(Product node) {
            return Nodes.mapChildren(node, this::rewrite);
        }

        // --- Node rules; operands are already simplified ---

        private AstNode binary(BinaryOperator operator, AstNode left, AstNode right) {
            return switch (operator) {
                case ADD, SUBTRACT -> sum(new BinaryExpression(operator, left, right));
                case MULTIPLY -> product(Nodes.mul(left, right));
                case DIVIDE -> fraction(left, right);
                case POWER -> power(left, right);
                default -> new BinaryExpression(operator, left, right);
            };
        }

        private AstNode unary(UnaryOperator operator, AstNode operand) {
            if (operator == UnaryOperator.PLUS) {
                return operand;
            }
            double value = Numbers.constantValue(operand);
            if (!Double.isNaN(value)) {
                return Numbers.toNode(-value);
            }
            if (Nodes.isNegation(operand)) {
                return ((UnaryExpression) operand).operand();
            }
            if (Terms.isSum(operand)) {
                return sum(Nodes.neg(operand));
            }
            if (operand instanceof Fraction f) {
                return fraction(unary(UnaryOperator.MINUS, f.numerator()), f.denominator());
            }
            if (Nodes.isOperator(operand, BinaryOperator.MULTIPLY)) {
                return product(Nodes.neg(operand));
            }
            return Nodes.neg(operand);
        }

        // --- Sums ---

        private AstNode sum(AstNode node) {
            Map<String, Term> groups = new LinkedHashMap<>();
            List<Term> ungrouped = new ArrayList<>();
            double constant = 0;
            for (Term term : Terms.flatten(node)) {
                if (term.isConstant()) {
                    constant += term.signedCoefficient();
                } else if (options.combineLikeTerms()) {
                    groups.merge(term.key(), term, (a, b) ->
                            a.withSignedCoefficient(a.signedCoefficient() + b.signedCoefficient()));
                } else {
                    ungrouped.add(term);
                }
            }
            List<Term> terms = new ArrayList<>(groups.values());
            terms.addAll(ungrouped);
            if (options.applyIdentities()) {
                constant += collapsePythagorean(terms);
            }
            List<Term> kept = new ArrayList<>();
            for (Term term : terms) {
                double coefficient = Numbers.snap(term.signedCoefficient());
                if (coefficient != 0) {
                    kept.add(term.withSignedCoefficient(coefficient));
                }
            }
            kept.sort(TERM_ORDER);
            constant = Numbers.snap(constant);
            if (constant != 0) {
                kept.add(Term.of(constant, NumberLiteral.ONE));
            }
            return Terms.rebuild(kept);
        }

        /**
         * Replaces each pair {@code c sin(u)^2 + c cos(u)^2} with identical {@code u} by nothing and
         * returns the total constant {@code c} they contribute.
         */
        private double collapsePythagorean(List<Term> terms) {
            double constant = 0;
            for (int i = 0; i < terms.size(); i++) {
                AstNode sine = squaredArgument(terms.get(i).canonicalForm(), "sin");
                if (sine == null) {
                    continue;
                }
                for (int j = 0; j < terms.size(); j++) {
                    AstNode cosine = squaredArgument(terms.get(j).canonicalForm(), "cos");
                    if (cosine != null
                            && cosine.equals(sine)
                            && terms.get(i).signedCoefficient() == terms.get(j).signedCoefficient()) {
                        constant += terms.get(i).signedCoefficient();
                        terms.remove(Math.max(i, j));
                        terms.remove(Math.min(i, j));
                        i = -1;
                        break;
                    }
                }
            }
            return constant;
        }

        private AstNode squaredArgument(AstNode form, String function) {
            if (form instanceof BinaryExpression b
                    && b.operator() == BinaryOperator.POWER
                    && Nodes.isNumber(b.right(), 2)
                    && Nodes.isFunction(b.left(), function)) {
                return ((FunctionCall) b.left()).arg();
            }
            return null;
        }

        // --- Products ---

        private AstNode product(AstNode node) {
            Factors.Decomposition parts = Factors.decompose(node);
            double coefficient = parts.coefficient();
            if (coefficient == 0) {
                return NumberLiteral.ZERO;
            }
            List<AstNode> denominators = new ArrayList<>(parts.denominators());
            if (!denominators.isEmpty()) {
                AstNode numerator = product(withCoefficient(coefficient, parts.factors()));
                return fraction(numerator, product(Factors.chain(denominators)));
            }

            Map<String, List<AstNode>> exponents = new LinkedHashMap<>();
            Map<String, AstNode> bases = new LinkedHashMap<>();
            for (AstNode factor : parts.factors()) {
                AstNode base = Factors.base(factor);
                String key = CanonicalKey.of(base);
                bases.putIfAbsent(key, base);
                exponents.computeIfAbsent(key, k -> new ArrayList<>()).add(Factors.exponent(factor));
            }

            List<AstNode> factors = new ArrayList<>();
            for (Map.Entry<String, AstNode> entry : bases.entrySet()) {
                List<AstNode> collected = exponents.get(entry.getKey());
                AstNode exponent = collected.size() == 1 ? collected.get(0) : sum(addChain(collected));
                double value = Numbers.constantValue(exponent);
                if (value == 0) {
                    continue;
                }
                if (value < 0) {
                    denominators.add(power(entry.getValue(), Numbers.toNode(-value)));
                    continue;
                }
                Factors.Decomposition powered = Factors.decompose(power(entry.getValue(), exponent));
                coefficient *= powered.coefficient();
                factors.addAll(powered.factors());
                denominators.addAll(powered.denominators());
            }
            if (coefficient == 0) {
                return NumberLiteral.ZERO;
            }
            if (!denominators.isEmpty()) {
                AstNode numerator = productOf(coefficient, factors);
                return fraction(numerator, product(Factors.chain(denominators)));
            }
            if (options.expand() && factors.stream().anyMatch(Terms::isSum)) {
                AstNode expanded = expand(coefficient, factors);
                if (expanded != null) {
                    return expanded;
                }
            }
            return productOf(coefficient, factors);
        }

        /** Canonical product of already-combined factors. */
        private AstNode productOf(double coefficient, List<AstNode> factors) {
            List<AstNode> ordered = new ArrayList<>(factors);
            ordered.sort(FACTOR_ORDER);
            return Terms.node(coefficient, Factors.chain(ordered));
        }

        /** Distributes a product over its additive factors; {@code null} if the result would be too large. */
        private AstNode expand(double coefficient, List<AstNode> factors) {
            List<Term> partial = new ArrayList<>();
            partial.add(Term.of(coefficient, NumberLiteral.ONE));
            for (AstNode factor : factors) {
                List<Term> next = new ArrayList<>();
                List<Term> addends = Terms.isSum(factor) ? Terms.flatten(factor) : List.of(Term.of(1, factor));
                for (Term left : partial) {
                    for (Term right : addends) {
                        next.add(Term.of(
                                left.signedCoefficient() * right.signedCoefficient(),
                                multiplyForms(left.canonicalForm(), right.canonicalForm())));
                    }
                }
                if (next.size() > MAX_EXPANDED_TERMS) {
                    return null;
                }
                partial = next;
            }
            List<AstNode> products = new ArrayList<>();
            for (Term term : partial) {
                products.add(product(Terms.node(term.signedCoefficient(), term.canonicalForm())));
            }
            return sum(addChain(products));
        }

        private AstNode multiplyForms(AstNode left, AstNode right) {
            if (Terms.isOne(left)) {
                return right;
            }
            if (Terms.isOne(right)) {
                return left;
            }
            return Nodes.mul(left, right);
        }

        // --- Fractions ---

        private AstNode fraction(AstNode numerator, AstNode denominator) {
            double d = Numbers.constantValue(denominator);
            if (d == 0) {
                throw new ArithmeticEvalException("Division by zero");
            }
            double n = Numbers.constantValue(numerator);
            if (!Double.isNaN(n) && !Double.isNaN(d)) {
                return Numbers.isInteger(n) && Numbers.isInteger(d)
                        ? Numbers.fraction((long) n, (long) d)
                        : Numbers.toNode(n / d);
            }
            if (!options.simplifyFractions()) {
                return Nodes.frac(numerator, denominator);
            }
            if (n == 0) {
                return NumberLiteral.ZERO;
            }
            if (numerator instanceof Fraction inner) {
                return fraction(inner.numerator(), product(Nodes.mul(inner.denominator(), denominator)));
            }
            if (denominator instanceof Fraction inner) {
                return fraction(product(Nodes.mul(numerator, inner.denominator())), inner.numerator());
            }
            if (!Double.isNaN(d)) {
                return divideByNumber(numerator, d);
            }
            if (CanonicalKey.of(numerator).equals(CanonicalKey.of(denominator))) {
                return NumberLiteral.ONE;
            }

            boolean negative = false;
            if (isNegativeTerm(numerator)) {
                numerator = unary(UnaryOperator.MINUS, numerator);
                negative = true;
            }
            if (isNegativeTerm(denominator)) {
                denominator = unary(UnaryOperator.MINUS, denominator);
                negative = !negative;
            }
            long g = Numbers.gcd(Terms.content(numerator), Terms.content(denominator));
            if (g > 1) {
                numerator = Terms.divide(numerator, g);
                denominator = Terms.divide(denominator, g);
            }
            AstNode[] cancelled = cancel(numerator, denominator, false);
            if (cancelled != null) {
                numerator = cancelled[0];
                denominator = cancelled[1];
            }
            AstNode signed = negative ? unary(UnaryOperator.MINUS, numerator) : numerator;
            if (cancelled != null) {
                return fraction(signed, denominator);
            }
            return Nodes.frac(signed, denominator);
        }

        private AstNode divideByNumber(AstNode numerator, double divisor) {
            if (!Terms.isSum(numerator)) {
                Factors.Decomposition parts = Factors.decompose(numerator);
                return productOf(parts.coefficient() / divisor, parts.factors());
            }
            if (!Numbers.isInteger(divisor)) {
                return product(Nodes.mul(Numbers.toNode(1 / divisor), numerator));
            }
            long g = Numbers.gcd(Terms.content(numerator), (long) divisor);
            AstNode reduced = g > 1 ? Terms.divide(numerator, g) : numerator;
            double rest = divisor / g;
            if (rest == 1) {
                return reduced;
            }
            if (rest == -1) {
                return unary(UnaryOperator.MINUS, reduced);
            }
            if (rest < 0) {
                return Nodes.frac(unary(UnaryOperator.MINUS, reduced), Nodes.num(-rest));
            }
            return Nodes.frac(reduced, Nodes.num(rest));
        }

        private boolean isNegativeTerm(AstNode node) {
            return !Terms.isSum(node) && Factors.decompose(node).coefficient() < 0;
        }

        /**
         * One cancellation pass over multiplicative atoms. Atoms are compared directly first; if
         * none match, numerator and denominator are factored and compared again. Returns {@code
         * null} when nothing cancels, so an unfactorable fraction is left as written.
         */
        AstNode[] cancel(AstNode numerator, AstNode denominator, boolean factorFirst) {
            if (!factorFirst) {
                AstNode[] direct = cancelAtoms(numerator, denominator);
                if (direct != null) {
                    return direct;
                }
            }
            String variable = VariableInference.infer(Nodes.frac(numerator, denominator));
            AstNode factoredNumerator = factorizer.factor(numerator, variable);
            AstNode factoredDenominator = factorizer.factor(denominator, variable);
            return cancelAtoms(factoredNumerator, factoredDenominator);
        }

        private AstNode[] cancelAtoms(AstNode numerator, AstNode denominator) {
            Atoms top = Atoms.of(numerator);
            Atoms bottom = Atoms.of(denominator);
            if (!top.cancelAgainst(bottom)) {
                return null;
            }
            return new AstNode[] {
                product(top.toProduct()), product(bottom.toProduct())
            };
        }

        AstNode cancelFractions(AstNode node) {
            AstNode mapped = Nodes.mapChildren(node, this::cancelFractions);
            if (mapped instanceof Fraction f) {
                AstNode[] cancelled = cancel(f.numerator(), f.denominator(), true);
                if (cancelled != null) {
                    return Nodes.frac(cancelled[0], cancelled[1]);
                }
            }
            return mapped;
        }

        // --- Powers ---

        private AstNode power(AstNode base, AstNode exponent) {
            double e = Numbers.constantValue(exponent);
            double b = Numbers.constantValue(base);
            if (e == 0) {
                return NumberLiteral.ONE;
            }
            if (e == 1) {
                return base;
            }
            if (b == 1) {
                return NumberLiteral.ONE;
            }
            if (b == 0 && !Double.isNaN(e)) {
                if (e < 0) {
                    throw new ArithmeticEvalException("Division by zero");
                }
                return NumberLiteral.ZERO;
            }
            if (!Double.isNaN(b) && !Double.isNaN(e)) {
                return numericPower(base, b, exponent, e);
            }
            if (options.applyIdentities() && isEulerE(base) && Nodes.isFunction(exponent, "ln")) {
                return ((FunctionCall) exponent).arg();
            }
            boolean integral = Numbers.isInteger(e);
            if (base instanceof BinaryExpression inner && inner.operator() == BinaryOperator.POWER) {
                if (integral || (!Double.isNaN(e) && Numbers.isConstant(inner.right()))) {
                    return power(inner.left(), product(Nodes.mul(inner.right(), exponent)));
                }
            }
            if (Nodes.isFunction(base, "sqrt") && !Double.isNaN(e)) {
                return power(((FunctionCall) base).arg(), Numbers.toNode(e / 2));
            }
            if (options.applyIdentities() && Nodes.isFunction(base, "exp")) {
                return function("exp", List.of(product(Nodes.mul(exponent, ((FunctionCall) base).arg()))));
            }
            if (Nodes.isNegation(base) && integral) {
                AstNode magnitude = power(((UnaryExpression) base).operand(), exponent);
                return ((long) e) % 2 == 0 ? magnitude : unary(UnaryOperator.MINUS, magnitude);
            }
            if (!Double.isNaN(e) && e < 0) {
                return fraction(NumberLiteral.ONE, power(base, Numbers.toNode(-e)));
            }
            if (base instanceof Fraction f && integral) {
                return fraction(power(f.numerator(), exponent), power(f.denominator(), exponent));
            }
            if (Nodes.isOperator(base, BinaryOperator.MULTIPLY) && integral) {
                Factors.Decomposition parts = Factors.decompose(base);
                List<AstNode> powered = new ArrayList<>();
                powered.add(Numbers.toNode(Math.pow(parts.coefficient(), e)));
                for (AstNode factor : parts.factors()) {
                    powered.add(power(factor, exponent));
                }
                return product(Factors.chain(powered));
            }
            if (Terms.isSum(base) && options.expand() && integral && e >= 2 && e <= maxExpansionPower) {
                List<AstNode> copies = new ArrayList<>();
                for (int i = 0; i < (int) e; i++) {
                    copies.add(base);
                }
                // product() would merge the copies back into this power
                AstNode expanded = expand(1, copies);
                if (expanded != null) {
                    return expanded;
                }
            }
            if (e == 0.5) {
                return function("sqrt", List.of(base));
            }
            return Nodes.pow(base, exponent);
        }

        private AstNode numericPower(AstNode base, double b, AstNode exponent, double e) {
            double result = Math.pow(b, e);
            if (!Double.isFinite(result)) {
                return Nodes.pow(base, exponent);
            }
            return Numbers.exact(result).orElseGet(() -> {
                if (Numbers.isInteger(e)) {
                    return Numbers.toNode(result);
                }
                return e == 0.5 ? function("sqrt", List.of(base)) : Nodes.pow(base, exponent);
            });
        }

        // --- Functions ---

        private AstNode function(String name, List<AstNode> args) {
            FunctionCall call = new FunctionCall(name, args);
            if (!call.isUnary()) {
                return call;
            }
            AstNode argument = call.arg();
            if (options.applyIdentities()) {
                AstNode identity = functionIdentity(name, argument);
                if (identity != null) {
                    return identity;
                }
            }
            double value = argumentValue(argument);
            if (!Double.isNaN(value)) {
                double result = Numbers.snap(MathFunctions.apply(name, value));
                if (Double.isFinite(result) && Numbers.exact(result).isPresent()) {
                    return Numbers.exact(result).get();
                }
            }
            if (name.equals("sqrt")) {
                AstNode reduced = squareFreeRoot(argument);
                if (reduced != null) {
                    return reduced;
                }
            }
            return call;
        }

        /** {@code sqrt(k^2 m)} as {@code k sqrt(m)} for an integer radicand; {@code null} if square-free. */
        private AstNode squareFreeRoot(AstNode argument) {
            double value = Numbers.constantValue(argument);
            if (!Numbers.isInteger(value) || value < 4 || value > MAX_RADICAND) {
                return null;
            }
            long radicand = (long) value;
            long outside = 1;
            for (long k = 2; k * k <= radicand; k++) {
                while (radicand % (k * k) == 0) {
                    radicand /= k * k;
                    outside *= k;
                }
            }
            if (outside == 1) {
                return null;
            }
            return productOf(outside, List.of(new FunctionCall("sqrt", Numbers.toNode(radicand))));
        }

        private AstNode functionIdentity(String name, AstNode argument) {
            if (name.equals("ln") && Nodes.isFunction(argument, "exp")) {
                return ((FunctionCall) argument).arg();
            }
            if (name.equals("ln") && Nodes.isOperator(argument, BinaryOperator.POWER)
                    && isEulerE(((BinaryExpression) argument).left())) {
                return ((BinaryExpression) argument).right();
            }
            if (name.equals("exp") && Nodes.isFunction(argument, "ln")) {
                return ((FunctionCall) argument).arg();
            }
            if (name.equals("abs") && Nodes.isFunction(argument, "abs")) {
                return argument;
            }
            if (name.equals("sqrt")
                    && argument instanceof BinaryExpression b
                    && b.operator() == BinaryOperator.POWER
                    && Nodes.isNumber(b.right(), 2)) {
                return new FunctionCall("abs", b.left());
            }
            if (Nodes.isNegation(argument)) {
                AstNode inner = ((UnaryExpression) argument).operand();
                if (MathFunctions.ODD.contains(name)) {
                    return unary(UnaryOperator.MINUS, function(name, List.of(inner)));
                }
                if (MathFunctions.EVEN.contains(name)) {
                    return function(name, List.of(inner));
                }
            }
            return null;
        }

        /** Numeric value of a literal or of a rational multiple of {@code pi} or {@code e}. */
        private double argumentValue(AstNode argument) {
            double value = Numbers.constantValue(argument);
            if (!Double.isNaN(value) || Terms.isSum(argument)) {
                return value;
            }
            Factors.Decomposition parts = Factors.decompose(argument);
            if (parts.factors().size() == 1 && parts.denominators().isEmpty()
                    && parts.factors().get(0) instanceof Identifier id && id.isFree()) {
                if (id.name().equals("pi")) {
                    return parts.coefficient() * Math.PI;
                }
                if (id.name().equals("e")) {
                    return parts.coefficient() * Math.E;
                }
            }
            return Double.NaN;
        }

        private boolean isEulerE(AstNode node) {
            return node instanceof Identifier id && id.isFree() && id.name().equals("e");
        }

        private AstNode withCoefficient(double coefficient, List<AstNode> factors) {
            List<AstNode> all = new ArrayList<>();
            all.add(Numbers.toNode(coefficient));
            all.addAll(factors);
            return Factors.chain(all);
        }
    }

    private static AstNode addChain(List<AstNode> addends) {
        AstNode result = addends.get(0);
        for (int i = 1; i < addends.size(); i++) {
            result = Nodes.add(result, addends.get(i));
        }
        return result;
    }

    /** Constants last, then higher degree first, then by canonical key. */
    static final Comparator<Term> TERM_ORDER = Comparator.comparing(Term::isConstant)
            .thenComparing(Comparator.comparingInt((Term t) -> degree(t.canonicalForm())).reversed())
            .thenComparing(Term::key);

    /** Identifiers and their powers, then functions, then everything else; ties by key. */
    static final Comparator<AstNode> FACTOR_ORDER = Comparator.comparingInt(Simplifier::category)
            .thenComparing(f -> CanonicalKey.of(Factors.base(f)))
            .thenComparing(CanonicalKey::of);

    private static int category(AstNode factor) {
        AstNode base = Factors.base(factor);
        if (base instanceof Identifier && !Nodes.isFunction(factor, "sqrt")) {
            return 0;
        }
        if (factor instanceof FunctionCall || base instanceof FunctionCall) {
            return 1;
        }
        return 2;
    }

    /** Total degree over identifiers with positive integer exponents. */
    static int degree(AstNode form) {
        if (form instanceof Fraction f) {
            return degree(f.numerator());
        }
        int total = 0;
        for (AstNode factor : Factors.operands(form)) {
            if (Factors.base(factor) instanceof Identifier && !Nodes.isFunction(factor, "sqrt")) {
                double exponent = Numbers.constantValue(Factors.exponent(factor));
                if (Numbers.isInteger(exponent) && exponent > 0) {
                    total += (int) exponent;
                }
            }
        }
        return total;
    }
}
