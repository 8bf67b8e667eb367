package io.latexium.core.simplify;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.latexium.core.ast.AstNode;
import io.latexium.core.ast.Fraction;
import io.latexium.core.error.ArithmeticEvalException;
import io.latexium.core.evaluate.Evaluator;
import io.latexium.core.parser.LatexParser;
import io.latexium.core.render.LatexRenderer;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("Simplifier")
class SimplifierTest {

    private final Simplifier simplifier = new Simplifier();
    private final Evaluator evaluator = new Evaluator();

    private String simplify(String latex) {
        return LatexRenderer.render(simplifier.simplify(LatexParser.parse(latex)));
    }

    private String simplify(String latex, SimplifyOptions options) {
        return LatexRenderer.render(simplifier.simplify(LatexParser.parse(latex), options));
    }

    @Nested
    @DisplayName("arithmetic identities")
    class Identities {

        @Test
        void foldsConstants() {
            assertThat(simplify("2 + 3 \\cdot 4")).isEqualTo("14");
        }

        @Test
        void dropsNeutralElements() {
            assertThat(simplify("x + 0")).isEqualTo("x");
            assertThat(simplify("1 \\cdot x")).isEqualTo("x");
            assertThat(simplify("x^1")).isEqualTo("x");
        }

        @Test
        void annihilatesWithZero() {
            assertThat(simplify("0 \\cdot x")).isEqualTo("0");
            assertThat(simplify("x - x")).isEqualTo("0");
        }

        @Test
        void reducesNumericFractions() {
            assertThat(simplify("\\frac{6}{4}")).isEqualTo("\\frac{3}{2}");
        }

        @ParameterizedTest(name = "{0} reduces to {1}")
        @CsvSource(delimiter = '|', value = {
            "\\sqrt{8} | 2\\sqrt{2}",
            "\\sqrt{12} | 2\\sqrt{3}",
            "\\sqrt{72} | 6\\sqrt{2}",
            "3\\sqrt{18} | 9\\sqrt{2}",
            "\\sqrt{7} | \\sqrt{7}",
            "\\sqrt{16} | 4"
        })
        void pullsSquareFactorsOutOfRadicals(String latex, String expected) {
            assertThat(simplify(latex)).isEqualTo(expected);
        }

        @Test
        @DisplayName("e^{ln u} and ln(e^u) collapse to u")
        void logExpInverses() {
            assertThat(simplify("e^{\\ln x}")).isEqualTo("x");
            assertThat(simplify("\\ln(e^x)")).isEqualTo("x");
            assertThat(simplify("\\ln(e^{2x + 1})")).isEqualTo("2x + 1");
        }

        @Test
        @DisplayName("division by zero raises instead of producing infinity")
        void divisionByZero() {
            assertThatThrownBy(() -> simplifier.simplify(LatexParser.parse("\\frac{1}{0}")))
                    .isInstanceOf(ArithmeticEvalException.class);
        }
    }

    @Nested
    @DisplayName("like terms")
    class LikeTerms {

        @Test
        void combinesLikeTerms() {
            assertThat(simplify("2x + 3x")).isEqualTo("5x");
        }

        @Test
        @DisplayName("products match regardless of factor order")
        void commutativeProducts() {
            assertThat(simplify("x y + y x")).isEqualTo(simplify("2 x y"));
        }

        @Test
        void keepsUnlikeTermsApart() {
            assertThat(simplify("x^2 + 3x + 2")).isEqualTo("x^{2} + 3x + 2");
        }

        @Test
        @DisplayName("combine-like-terms off leaves the sum alone")
        void togglesOff() {
            SimplifyOptions options = SimplifyOptions.builder()
                    .combineLikeTerms(false)
                    .build();

            assertThat(simplify("x + x", options)).isNotEqualTo("2x");
        }
    }

    @Nested
    @DisplayName("expansion")
    class Expansion {

        @ParameterizedTest(name = "{0} expands to {1}")
        @CsvSource(delimiter = '|', value = {
            "(x + 1)^2 | x^{2} + 2x + 1",
            "(x - 1)^2 | x^{2} - 2x + 1",
            "(x + 1)(x + 1) | x^{2} + 2x + 1",
            "(x + 2)^3 | x^{3} + 6x^{2} + 12x + 8"
        })
        void powersOfSums(String latex, String expected) {
            assertThat(simplify(latex)).isEqualTo(expected);
        }

        @Test
        void expansionOffKeepsThePower() {
            SimplifyOptions options = SimplifyOptions.builder().expand(false).build();

            assertThat(simplify("(x + 1)^2", options)).isEqualTo("(x + 1)^{2}");
        }

        @Test
        @DisplayName("a perfect square survives factor-then-simplify")
        void perfectSquareWithFactoring() {
            SimplifyOptions options = SimplifyOptions.builder().factor(true).build();

            assertThat(simplify("x^2 + 2x + 1", options)).isEqualTo("(x + 1)^{2}");
        }
    }

    @Nested
    @DisplayName("factoring option")
    class Factoring {

        @Test
        @DisplayName("6x + 9 factors to 3(2x + 3)")
        void commonFactor() {
            SimplifyOptions options = SimplifyOptions.builder().factor(true).build();

            assertThat(simplify("6x + 9", options)).isEqualTo("3(2x + 3)");
        }
    }

    @Test
    @DisplayName("1/x simplifies to a fraction")
    void reciprocalStaysFraction() {
        assertThat(simplifier.simplify(LatexParser.parse("\\frac{1}{x}"))).isInstanceOf(Fraction.class);
    }

    @ParameterizedTest(name = "simplify is idempotent on {0}")
    @ValueSource(strings = {
        "x^2 + 3x + 2x - 1",
        "(x + 1)^2",
        "\\frac{x^2 - 1}{x - 1}",
        "2 \\sin(x) \\cos(x) + \\sin(x)^2",
        "\\frac{2}{4} x + \\frac{x}{2}",
        "e^{x} e^{2x}",
        "\\sqrt{x^2 y}",
        "-(-x) + 3 - x",
        "\\ln(x) + \\ln(x) - 2"
    })
    void idempotent(String latex) {
        AstNode once = simplifier.simplify(LatexParser.parse(latex));

        assertThat(simplifier.simplify(once)).isEqualTo(once);
    }

    @ParameterizedTest(name = "simplify preserves the value of {0}")
    @ValueSource(strings = {
        "(x + 1)^2 - x",
        "\\frac{x^2 - 1}{x + 1}",
        "3x - (2 - x) \\cdot 4",
        "x^{3} x^{-1} + \\frac{6x}{3}",
        "\\sqrt{4 x^2}"
    })
    void preservesValue(String latex) {
        AstNode original = LatexParser.parse(latex);
        AstNode simplified = simplifier.simplify(original);

        for (double x : new double[] {0.5, 1.7, 3.0}) {
            Map<String, Double> at = Map.of("x", x);
            assertThat(evaluator.evaluate(simplified, at))
                    .isCloseTo(evaluator.evaluate(original, at), within(1e-9));
        }
    }

    @Test
    @DisplayName("overlap simplification cancels a common polynomial factor")
    void overlapCancels() {
        AstNode node = LatexParser.parse("\\frac{x^2 - 1}{x - 1}");

        AstNode result = simplifier.overlapSimplify(node, SimplifyOptions.defaults(), 5);

        assertThat(LatexRenderer.render(result)).isEqualTo("x + 1");
    }
}
