package io.latexium.core.integrate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.latexium.core.ast.AstNode;
import io.latexium.core.ast.Nodes;
import io.latexium.core.calculus.Differentiator;
import io.latexium.core.error.StrategyRegistrationException;
import io.latexium.core.evaluate.Evaluator;
import io.latexium.core.model.StrategyResult;
import io.latexium.core.parser.LatexParser;
import io.latexium.core.render.LatexRenderer;
import io.latexium.core.simplify.Simplifier;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.slf4j.LoggerFactory;

@DisplayName("IntegrationEngine")
class IntegrationEngineTest {

    private final Simplifier simplifier = new Simplifier();
    private final Differentiator differentiator = new Differentiator(simplifier);
    private final IntegrationEngine engine = new IntegrationEngine(simplifier);
    private final Evaluator evaluator = new Evaluator();

    private static IntegrationStrategy strategy(String name, int priority, StrategyResult outcome) {
        return new IntegrationStrategy() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public int priority() {
                return priority;
            }

            @Override
            public boolean canHandle(AstNode node, IntegrationContext context) {
                return true;
            }

            @Override
            public StrategyResult integrate(AstNode node, IntegrationContext context) {
                return outcome;
            }
        };
    }

    @Nested
    @DisplayName("antiderivatives")
    class Antiderivatives {

        @Test
        void reciprocalGivesLogOfAbsoluteValue() {
            StrategyResult result = engine.integrate(LatexParser.parse("\\frac{1}{x}"), "x");

            assertThat(result.success()).isTrue();
            assertThat(LatexRenderer.render(result.result())).isEqualTo("\\ln|x|");
        }

        /** The derivative of each antiderivative must give back the integrand. */
        @ParameterizedTest
        @ValueSource(strings = {
            "x^2 + 3x",
            "\\cos x",
            "e^{2x}",
            "2x \\cdot \\cos(x^2)",
            "x \\cdot e^{x}",
            "\\frac{1}{x^2 - 1}",
            "\\sin^2 x",
            "\\frac{2x}{x^2 + 1}"
        })
        void derivativeRecoversIntegrand(String latex) {
            AstNode integrand = LatexParser.parse(latex);
            StrategyResult result = engine.integrate(integrand, "x");
            assertThat(result.success()).as("integrating %s: %s", latex, result.steps()).isTrue();

            AstNode derivative = differentiator.differentiate(result.result(), "x");
            for (double x : new double[] {1.5, 2.5, 3.2}) {
                assertThat(evaluator.evaluate(derivative, Map.of("x", x)))
                        .as("%s at x = %s", latex, x)
                        .isCloseTo(evaluator.evaluate(integrand, Map.of("x", x)), within(1e-6));
            }
        }

        @Test
        void failureListsTriedStrategies() {
            StrategyResult result = engine.integrate(LatexParser.parse("e^{x^2}"), "x");

            assertThat(result.success()).isFalse();
            assertThat(result.steps().get(0)).isEqualTo("No suitable integration strategy found");
        }
    }

    @Nested
    @DisplayName("search")
    class Search {

        @Test
        void trustedStrategyEndsTheSearch() {
            AtomicInteger laterCalls = new AtomicInteger();
            IntegrationStrategy later = new IntegrationStrategy() {
                @Override
                public String name() {
                    return "later";
                }

                @Override
                public int priority() {
                    return 3;
                }

                @Override
                public boolean canHandle(AstNode node, IntegrationContext context) {
                    return true;
                }

                @Override
                public StrategyResult integrate(AstNode node, IntegrationContext context) {
                    laterCalls.incrementAndGet();
                    return StrategyResult.success(Nodes.num(0), "later");
                }
            };
            IntegrationEngine custom = new IntegrationEngine(
                    List.of(later, strategy("first", 1, StrategyResult.success(Nodes.var("x"), "first"))),
                    simplifier,
                    3);

            StrategyResult result = custom.integrate(Nodes.num(1), "x");

            assertThat(result.steps()).containsExactly("first");
            assertThat(laterCalls).hasValue(0);
        }

        @Test
        void lowerComplexityWinsAmongUntrusted() {
            AstNode bulky = LatexParser.parse("x^2 + \\sin x + \\cos x");
            IntegrationEngine custom = new IntegrationEngine(
                    List.of(
                            strategy("bulky", 3, StrategyResult.success(bulky, "bulky")),
                            strategy("lean", 4, StrategyResult.success(Nodes.var("x"), "lean"))),
                    simplifier,
                    3);

            assertThat(custom.integrate(Nodes.num(1), "x").steps()).containsExactly("lean");
        }

        @Test
        void earlierFailuresPrecedeTheWinningSteps() {
            IntegrationEngine custom = new IntegrationEngine(
                    List.of(
                            strategy("picky", 1, StrategyResult.failure("not my shape")),
                            strategy("general", 3, StrategyResult.success(Nodes.var("x"), "general rule"))),
                    simplifier,
                    3);

            StrategyResult result = custom.integrate(Nodes.num(1), "x");

            assertThat(result.success()).isTrue();
            assertThat(result.steps()).containsExactly("picky: not my shape", "general rule");
        }

        @Test
        void recursionStopsAtMaxDepth() {
            AtomicInteger deepest = new AtomicInteger(-1);
            IntegrationStrategy deepening = new IntegrationStrategy() {
                @Override
                public String name() {
                    return "deepening";
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
                    deepest.accumulateAndGet(context.depth(), Math::max);
                    return context.recurse(Nodes.mul(Nodes.num(2), node));
                }
            };
            IntegrationEngine custom = new IntegrationEngine(List.of(deepening), simplifier, 2);

            StrategyResult result = custom.integrate(Nodes.var("x"), "x");

            assertThat(result.success()).isFalse();
            assertThat(deepest).hasValue(2);
            assertThat(String.join("\n", result.steps())).contains("Maximum integration depth 2 exceeded");
        }

        @Test
        void throwingStrategyCountsAsFailure() {
            IntegrationStrategy broken = new IntegrationStrategy() {
                @Override
                public String name() {
                    return "broken";
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
                    throw new IllegalStateException("boom");
                }
            };
            IntegrationEngine custom = new IntegrationEngine(List.of(broken), simplifier, 3);

            StrategyResult result = custom.integrate(Nodes.var("x"), "x");

            assertThat(result.success()).isFalse();
            assertThat(result.steps()).contains("broken: Strategy error: boom");
        }
    }

    @Nested
    @DisplayName("registration")
    class Registration {

        @Test
        void defaultsAreSortedByPriority() {
            assertThat(engine.strategyNames())
                    .containsExactly("basic", "trigonometric", "substitution", "rational", "by-parts");
            assertThat(engine.maxDepth()).isEqualTo(IntegrationEngine.DEFAULT_MAX_DEPTH);
        }

        @Test
        void rejectsEmptyList() {
            assertThatThrownBy(() -> new IntegrationEngine(List.of(), simplifier, 3))
                    .isInstanceOf(StrategyRegistrationException.class);
        }

        @Test
        void rejectsDuplicateName() {
            StrategyResult none = StrategyResult.failure("none");
            assertThatThrownBy(() -> new IntegrationEngine(
                            List.of(strategy("same", 1, none), strategy("same", 2, none)), simplifier, 3))
                    .isInstanceOf(StrategyRegistrationException.class)
                    .hasMessage("Duplicate integration strategy: 'same'");
        }

        @Test
        void rejectsNonPositivePriority() {
            assertThatThrownBy(() -> new IntegrationEngine(
                            List.of(strategy("zero", 0, StrategyResult.failure("none"))), simplifier, 3))
                    .isInstanceOf(StrategyRegistrationException.class)
                    .hasMessageContaining("invalid priority 0");
        }

        @Test
        void rejectsNegativeDepth() {
            assertThatThrownBy(() -> new IntegrationEngine(simplifier, -1))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("logging")
    class Logging {

        private Logger engineLogger;
        private ListAppender<ILoggingEvent> logAppender;
        private Level previousLevel;

        @BeforeEach
        void attach() {
            engineLogger = (Logger) LoggerFactory.getLogger(IntegrationEngine.class);
            previousLevel = engineLogger.getLevel();
            engineLogger.setLevel(Level.DEBUG);
            logAppender = new ListAppender<>();
            logAppender.start();
            engineLogger.addAppender(logAppender);
        }

        @AfterEach
        void detach() {
            engineLogger.detachAppender(logAppender);
            engineLogger.setLevel(previousLevel);
            logAppender.stop();
        }

        @Test
        void acceptedStrategyIsLoggedAtDebug() {
            engine.integrate(LatexParser.parse("x^2"), "x");

            assertThat(logAppender.list)
                    .anySatisfy(event -> {
                        assertThat(event.getLevel()).isEqualTo(Level.DEBUG);
                        assertThat(event.getFormattedMessage()).isEqualTo("integrate.strategy name=basic depth=0 outcome=accepted");
                    });
        }
    }
}
