package io.latexium.core.integrate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.latexium.core.ast.AstNode;
import io.latexium.core.ast.Nodes;
import io.latexium.core.error.IntegrationFailedException;
import io.latexium.core.model.StrategyResult;
import io.latexium.core.parser.LatexParser;
import io.latexium.core.render.LatexRenderer;
import io.latexium.core.simplify.Simplifier;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Integrator")
class IntegratorTest {

    private final Simplifier simplifier = new Simplifier();

    /** An engine whose only strategy never succeeds, so every call falls through to legacy. */
    private IntegrationEngine failingEngine() {
        IntegrationStrategy never = new IntegrationStrategy() {
            @Override
            public String name() {
                return "never";
            }

            @Override
            public int priority() {
                return 1;
            }

            @Override
            public boolean canHandle(AstNode node, IntegrationContext context) {
                return true;
            }

            @Override
            public StrategyResult integrate(AstNode node, IntegrationContext context) {
                return StrategyResult.failure("never matches");
            }
        };
        return new IntegrationEngine(List.of(never), simplifier, 3);
    }

    @Nested
    @DisplayName("legacy fallback")
    class Fallback {

        @Test
        void engineSuccessIsReturnedAsIs() {
            Integrator integrator =
                    new Integrator(new IntegrationEngine(simplifier), new LegacyIntegrator(), simplifier, true);

            StrategyResult result = integrator.integrate(LatexParser.parse("\\cos x"), "x");

            assertThat(LatexRenderer.render(result.result())).isEqualTo("\\sin(x)");
            assertThat(result.steps()).doesNotContain("Strategy search failed; used the legacy rule table");
        }

        @Test
        void legacyRunsWhenEngineFails() {
            Integrator integrator = new Integrator(failingEngine(), new LegacyIntegrator(), simplifier, true);

            StrategyResult result = integrator.integrate(LatexParser.parse("3x^2"), "x");

            assertThat(result.success()).isTrue();
            assertThat(LatexRenderer.render(result.result())).isEqualTo("x^{3}");
            assertThat(result.steps()).containsExactly("Strategy search failed; used the legacy rule table");
        }

        @Test
        void disabledFallbackSurfacesEngineFailure() {
            Integrator integrator = new Integrator(failingEngine(), new LegacyIntegrator(), simplifier, false);

            assertThatThrownBy(() -> integrator.integrate(LatexParser.parse("3x^2"), "x"))
                    .isInstanceOf(IntegrationFailedException.class)
                    .hasMessageContaining("never matches");
        }

        @Test
        void bothFailing() {
            Integrator integrator = new Integrator(failingEngine(), new LegacyIntegrator(), simplifier, true);

            assertThatThrownBy(() -> integrator.integrate(LatexParser.parse("e^{x^2}"), "x"))
                    .isInstanceOf(IntegrationFailedException.class)
                    .hasMessageStartingWith("Unable to integrate");
        }
    }

    @Test
    void evaluatesBounds() {
        Integrator integrator =
                new Integrator(new IntegrationEngine(simplifier), new LegacyIntegrator(), simplifier, true);
        AstNode antiderivative = integrator.integrate(LatexParser.parse("x"), "x").result();

        AstNode value = integrator.evaluateBounds(antiderivative, "x", Nodes.num(0), Nodes.num(2));

        assertThat(LatexRenderer.render(value)).isEqualTo("2");
    }
}
