package io.latexium.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

/** Two-tier structure, common fields and URNs of the exception types. */
class ExceptionHierarchyTest {

    // --- Hierarchy structure ---

    @Test
    void latexiumExceptionIsAbstractAndRoot() {
        assertThat(LatexiumException.class).isAbstract();
        assertThat(LatexiumException.class.getSuperclass()).isEqualTo(RuntimeException.class);
    }

    @Test
    void loadAndEvalTiersAreAbstract() {
        assertThat(LatexiumLoadException.class).isAbstract();
        assertThat(LatexiumLoadException.class.getSuperclass()).isEqualTo(LatexiumException.class);
        assertThat(LatexiumEvalException.class).isAbstract();
        assertThat(LatexiumEvalException.class.getSuperclass()).isEqualTo(LatexiumException.class);
    }

    // --- Load-time exceptions ---

    @Test
    void parseExceptionCarriesPosition() {
        var ex = new LatexParseException("Unexpected token", 7);

        assertThat(ex).isInstanceOf(LatexiumLoadException.class);
        assertThat(ex.phase()).isEqualTo(LatexiumException.Phase.LOAD);
        assertThat(ex.position()).isEqualTo(7);
        assertThat(ex.detail()).isEqualTo("Unexpected token");
        assertThat(ex.urn()).isEqualTo("urn:latexium:error:parse-failed");
    }

    @Test
    void parseExceptionWithCauseHasNoPosition() {
        var cause = new IllegalArgumentException("bad");
        var ex = new LatexParseException("Invalid AST document", cause);

        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.position()).isEqualTo(-1);
    }

    @Test
    void strategyRegistrationIsLoadTime() {
        var ex = new StrategyRegistrationException("Duplicate integration strategy: 'basic'");

        assertThat(ex).isInstanceOf(LatexiumLoadException.class);
        assertThat(ex.phase()).isEqualTo(LatexiumException.Phase.LOAD);
    }

    // --- Evaluation-time exceptions ---

    @Test
    void evaluationExceptions() {
        List<LatexiumEvalException> all = List.of(
                new UnsupportedConstructException("Equations of degree 3 are not supported"),
                new ArithmeticEvalException("Division by zero"),
                new IntegrationFailedException("Unable to integrate"));

        assertThat(all).allSatisfy(ex -> assertThat(ex.phase()).isEqualTo(LatexiumException.Phase.EVALUATION));
    }

    @Test
    void integrationFailureKeepsCause() {
        var cause = new UnsupportedConstructException("no rule");
        var ex = new IntegrationFailedException("Unable to integrate: no rule", cause);

        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.detail()).isEqualTo("Unable to integrate: no rule");
    }

    @Test
    void urnsAreDistinct() {
        List<String> urns = List.of(
                LatexParseException.URN,
                StrategyRegistrationException.URN,
                UnsupportedConstructException.URN,
                ArithmeticEvalException.URN,
                IntegrationFailedException.URN);

        assertThat(urns).doesNotHaveDuplicates().allMatch(urn -> urn.startsWith("urn:latexium:error:"));
    }
}
