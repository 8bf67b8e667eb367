package io.latexium.core.calculus;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.latexium.core.ast.AstNode;
import io.latexium.core.ast.Nodes;
import io.latexium.core.error.UnsupportedConstructException;
import io.latexium.core.evaluate.Evaluator;
import io.latexium.core.parser.LatexParser;
import io.latexium.core.render.LatexRenderer;
import io.latexium.core.simplify.Simplifier;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("Differentiator")
class DifferentiatorTest {

    private final Differentiator differentiator = new Differentiator(new Simplifier());
    private final Evaluator evaluator = new Evaluator();

    private String derive(String latex) {
        return LatexRenderer.render(differentiator.differentiate(LatexParser.parse(latex), "x"));
    }

    @Nested
    @DisplayName("rules")
    class Rules {

        @Test
        void polynomial() {
            assertThat(derive("x^2 + 3x")).isEqualTo("2x + 3");
        }

        @Test
        void constantIsZero() {
            assertThat(derive("42")).isEqualTo("0");
            assertThat(derive("y^2")).isEqualTo("0");
        }

        @Test
        void reciprocal() {
            assertThat(derive("\\frac{1}{x}")).isEqualTo("-\\frac{1}{x^{2}}");
        }

        @Test
        void sine() {
            assertThat(derive("\\sin x")).isEqualTo("\\cos(x)");
        }
    }

    @Nested
    @DisplayName("numeric agreement with a symmetric difference")
    class Numeric {

        private static final double H = 1e-5;

        @ParameterizedTest
        @ValueSource(strings = {
            "x^3 + \\sin x",
            "x \\cdot e^{x}",
            "\\frac{x^2 + 1}{x - 3}",
            "\\ln(x^2 + 1)",
            "\\sqrt{x}",
            "\\cos(2x) \\cdot \\tan x",
            "2^{x}"
        })
        void matchesFiniteDifference(String latex) {
            AstNode f = LatexParser.parse(latex);
            AstNode derivative = differentiator.differentiate(f, "x");
            double x = 1.0;
            double expected = (evaluator.evaluate(f, Map.of("x", x + H)) - evaluator.evaluate(f, Map.of("x", x - H)))
                    / (2 * H);
            assertThat(evaluator.evaluate(derivative, Map.of("x", x))).isCloseTo(expected, within(1e-4));
        }
    }

    @Nested
    @DisplayName("bound variables")
    class Scoping {

        @Test
        void definiteIntegralWithConstantBoundsIsConstant() {
            assertThat(derive("\\int_0^1 x dx")).isEqualTo("0");
        }

        @Test
        void boundOccurrenceDoesNotCount() {
            AstNode node = LatexParser.parse("x \\cdot \\sum_{x=1}^{3} x");
            AstNode derivative = differentiator.differentiate(node, "x");
            assertThat(evaluator.evaluate(derivative, Map.of())).isCloseTo(6.0, within(1e-9));
        }

        @Test
        void indefiniteIntegralOverTheVariableIsRejected() {
            assertThatThrownBy(() -> derive("\\int x dx")).isInstanceOf(UnsupportedConstructException.class);
        }

        @Test
        void isConstantSeesIndefiniteBinder() {
            assertThat(Differentiator.isConstant(LatexParser.parse("\\int x dx"), "x")).isFalse();
            assertThat(Differentiator.isConstant(LatexParser.parse("\\int_0^1 x dx"), "x")).isTrue();
        }
    }

    @Nested
    @DisplayName("unsupported input")
    class Unsupported {

        @Test
        void unknownFunction() {
            AstNode node = Nodes.fn("gamma", Nodes.var("x"));
            assertThatThrownBy(() -> differentiator.differentiate(node, "x"))
                    .isInstanceOf(UnsupportedConstructException.class);
        }

        @Test
        void comparison() {
            assertThatThrownBy(() -> derive("x^2 = 4")).isInstanceOf(UnsupportedConstructException.class);
        }
    }
}
