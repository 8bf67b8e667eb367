package io.latexium.core.factor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.latexium.core.ast.AstNode;
import io.latexium.core.error.StrategyRegistrationException;
import io.latexium.core.evaluate.Evaluator;
import io.latexium.core.model.StrategyResult;
import io.latexium.core.parser.LatexParser;
import io.latexium.core.render.LatexRenderer;
import io.latexium.core.simplify.Simplifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("FactorizationEngine")
class FactorizationEngineTest {

    private final FactorizationEngine engine = new FactorizationEngine();
    private final Evaluator evaluator = new Evaluator();

    private void assertSameFunction(AstNode expected, AstNode actual) {
        for (double x : new double[] {-2.5, -1.0, 0.3, 1.7, 4.0}) {
            assertThat(evaluator.evaluate(actual, Map.of("x", x)))
                    .as("value at x = %s", x)
                    .isCloseTo(evaluator.evaluate(expected, Map.of("x", x)), within(1e-9));
        }
    }

    @Nested
    @DisplayName("patterns")
    class Patterns {

        @Test
        void quadraticWithIntegerRoots() {
            AstNode input = LatexParser.parse("x^2 - 5x + 6");
            StrategyResult result = engine.factorWithSteps(input, "x");

            assertThat(result.success()).isTrue();
            assertThat(result.steps()).anyMatch(step -> step.startsWith("Quadratic"));
            assertThat(LatexRenderer.render(result.result())).contains("(x - 2)").contains("(x - 3)");
            assertSameFunction(input, result.result());
        }

        @Test
        void differenceOfSquares() {
            AstNode input = LatexParser.parse("x^2 - 9");
            AstNode factored = engine.factor(input, "x");

            assertThat(LatexRenderer.render(factored)).contains("x - 3").contains("x + 3");
            assertSameFunction(input, factored);
        }

        @Test
        void commonFactorIsPulledOutFirst() {
            AstNode input = LatexParser.parse("6x + 9");
            StrategyResult result = engine.factorWithSteps(input, "x");

            assertThat(result.success()).isTrue();
            assertThat(LatexRenderer.render(result.result())).startsWith("3");
            assertSameFunction(input, result.result());
        }

        @ParameterizedTest(name = "expanding the factors of {0} gives it back")
        @ValueSource(strings = {"x^2 + 2x + 1", "4x^2 - 12x + 9", "x^2 - 5x + 6", "6x^2 + x - 2", "x^2 - 9", "2x^2 - 8"})
        void expandedFactorsRoundTrip(String latex) {
            Simplifier simplifier = new Simplifier(engine, Simplifier.DEFAULT_MAX_EXPANSION_POWER);
            AstNode input = simplifier.simplify(LatexParser.parse(latex));
            AstNode factored = engine.factor(input, "x");

            assertThat(LatexRenderer.render(factored)).isNotEqualTo(LatexRenderer.render(input));
            assertThat(LatexRenderer.render(simplifier.simplify(factored))).isEqualTo(LatexRenderer.render(input));
        }

        @Test
        void perfectSquareFactorsToAPower() {
            AstNode factored = engine.factor(LatexParser.parse("4x^2 - 12x + 9"), "x");

            assertThat(LatexRenderer.render(factored)).isEqualTo("(2x - 3)^{2}");
        }

        @ParameterizedTest
        @ValueSource(strings = {"x^3 - 6x^2 + 11x - 6", "x^3 + x^2 + x + 1", "x^4 - 5x^2 + 4", "2x^2 - 8"})
        void factoredFormKeepsTheValue(String latex) {
            AstNode input = LatexParser.parse(latex);
            AstNode factored = engine.factor(input, "x");
            assertSameFunction(input, factored);
        }
    }

    @Nested
    @DisplayName("irreducible input")
    class Irreducible {

        @Test
        void sumOfSquaresReportsNoPattern() {
            StrategyResult result = engine.factorWithSteps(LatexParser.parse("x^2 + 1"), "x");

            assertThat(result.success()).isFalse();
            assertThat(result.steps()).containsExactly("No factorization pattern matched");
        }

        @Test
        void factorReturnsInputUnchanged() {
            AstNode input = LatexParser.parse("x^2 + 1");
            assertThat(engine.factor(input, "x")).isEqualTo(input);
        }

        @Test
        void singleTermIsLeftAlone() {
            AstNode input = LatexParser.parse("\\sin x");
            assertThat(engine.factor(input, "x")).isEqualTo(input);
        }
    }

    @Nested
    @DisplayName("registration")
    class Registration {

        @Test
        void defaultOrder() {
            assertThat(engine.strategyNames())
                    .containsExactly(
                            "common-factor",
                            "difference-of-squares",
                            "quadratic",
                            "grouping",
                            "cubic",
                            "substitution",
                            "perfect-power");
        }

        @Test
        void rejectsEmptyList() {
            assertThatThrownBy(() -> new FactorizationEngine(List.of()))
                    .isInstanceOf(StrategyRegistrationException.class)
                    .hasMessageContaining("at least one strategy");
        }

        @Test
        void rejectsNullEntry() {
            List<FactorStrategy> strategies = new ArrayList<>(Arrays.asList(new QuadraticStrategy(), null));
            assertThatThrownBy(() -> new FactorizationEngine(strategies))
                    .isInstanceOf(StrategyRegistrationException.class)
                    .hasMessageContaining("null");
        }

        @Test
        void rejectsDuplicateNames() {
            assertThatThrownBy(() -> new FactorizationEngine(List.of(new QuadraticStrategy(), new QuadraticStrategy())))
                    .isInstanceOf(StrategyRegistrationException.class)
                    .hasMessage("Duplicate factorization strategy: 'quadratic'");
        }

        @Test
        void throwingStrategyIsSkipped() {
            FactorStrategy broken = new FactorStrategy() {
                @Override
                public String name() {
                    return "broken";
                }

                @Override
                public StrategyResult apply(AstNode node, String variable) {
                    throw new IllegalStateException("boom");
                }
            };
            FactorizationEngine withBroken = new FactorizationEngine(List.of(broken, new QuadraticStrategy()));

            StrategyResult result = withBroken.factorWithSteps(LatexParser.parse("x^2 - 5x + 6"), "x");
            assertThat(result.success()).isTrue();
        }
    }
}
