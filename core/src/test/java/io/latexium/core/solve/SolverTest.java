package io.latexium.core.solve;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.latexium.core.ast.AstNode;
import io.latexium.core.error.UnsupportedConstructException;
import io.latexium.core.evaluate.Evaluator;
import io.latexium.core.parser.LatexParser;
import io.latexium.core.render.LatexRenderer;
import io.latexium.core.simplify.Simplifier;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Solver")
class SolverTest {

    private final Solver solver = new Solver(new Simplifier());
    private final Evaluator evaluator = new Evaluator();

    private Solution solve(String latex) {
        return solver.solve(LatexParser.parse(latex), "x");
    }

    private List<String> rendered(Solution solution) {
        return solution.roots().stream().map(LatexRenderer::render).toList();
    }

    private double value(AstNode node) {
        return evaluator.evaluate(node, Map.of());
    }

    @Nested
    @DisplayName("linear")
    class Linear {

        @Test
        void singleRoot() {
            Solution solution = solve("2x + 4 = 0");

            assertThat(solution.type()).isEqualTo(Solution.Type.ROOTS);
            assertThat(rendered(solution)).containsExactly("-2");
            assertThat(solution.steps()).startsWith("Solving for x", "Polynomial of degree 1");
        }

        @Test
        void fractionalRoot() {
            Solution solution = solve("2x = 3");
            assertThat(value(solution.roots().get(0))).isCloseTo(1.5, within(1e-12));
        }
    }

    @Nested
    @DisplayName("quadratic")
    class Quadratic {

        @Test
        void rationalRootsAscending() {
            assertThat(rendered(solve("x^2 - 5x + 6 = 0"))).containsExactly("2", "3");
        }

        @Test
        void rootsAscendingWithNegativeLeadingCoefficient() {
            assertThat(rendered(solve("-x^2 + x + 6 = 0"))).containsExactly("-2", "3");
        }

        @Test
        void repeatedRoot() {
            Solution solution = solve("x^2 - 2x + 1");

            assertThat(rendered(solution)).containsExactly("1");
            assertThat(solution.steps()).contains("Repeated root");
        }

        @Test
        void irrationalRootsStaySymbolic() {
            Solution solution = solve("x^2 - 2 = 0");

            assertThat(rendered(solution)).allMatch(root -> root.contains("\\sqrt"));
            assertThat(value(solution.roots().get(0))).isCloseTo(-Math.sqrt(2), within(1e-12));
            assertThat(value(solution.roots().get(1))).isCloseTo(Math.sqrt(2), within(1e-12));
        }

        @Test
        void radicalIsReducedBeforeDividing() {
            assertThat(rendered(solve("x^2 - 2 = 0"))).containsExactly("-\\sqrt{2}", "\\sqrt{2}");
            assertThat(rendered(solve("x^2 - 12 = 0"))).containsExactly("-2\\sqrt{3}", "2\\sqrt{3}");
        }

        @Test
        void negativeDiscriminantHasNoRealRoots() {
            Solution solution = solve("x^2 + 1 = 0");

            assertThat(solution.type()).isEqualTo(Solution.Type.NONE);
            assertThat(solution.roots()).isEmpty();
            assertThat(solution.steps()).contains("No real solutions");
        }
    }

    @Nested
    @DisplayName("degenerate equations")
    class Degenerate {

        @Test
        void identity() {
            assertThat(solve("x + 1 = x + 1").type()).isEqualTo(Solution.Type.ALL);
        }

        @Test
        void contradiction() {
            assertThat(solve("x = x + 1").type()).isEqualTo(Solution.Type.NONE);
        }
    }

    @Nested
    @DisplayName("rejected input")
    class Rejected {

        @Test
        void inequality() {
            assertThatThrownBy(() -> solve("x < 3"))
                    .isInstanceOf(UnsupportedConstructException.class)
                    .hasMessage("Inequalities cannot be solved");
        }

        @Test
        void cubic() {
            assertThatThrownBy(() -> solve("x^3 - 1 = 0"))
                    .isInstanceOf(UnsupportedConstructException.class)
                    .hasMessage("Equations of degree 3 are not supported");
        }

        @Test
        void transcendental() {
            assertThatThrownBy(() -> solve("\\sin x = 0")).isInstanceOf(UnsupportedConstructException.class);
        }
    }
}
