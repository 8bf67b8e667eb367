package io.latexium.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.latexium.core.ast.Nodes;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("AnalysisResult")
class AnalysisResultTest {

    @Nested
    @DisplayName("states")
    class States {

        @Test
        void success() {
            AnalysisResult result = AnalysisResult.success(List.of(), "2x", ValueType.SYMBOLIC, Nodes.var("x"));

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.isError()).isFalse();
            assertThat(result.error()).isNull();
            assertThat(result.toString()).isEqualTo("AnalysisResult[symbolic, value=2x]");
        }

        @Test
        void error() {
            AnalysisResult result = AnalysisResult.error(List.of(StepTree.leaf("Parsing")), "boom");

            assertThat(result.isError()).isTrue();
            assertThat(result.value()).isNull();
            assertThat(result.valueType()).isNull();
            assertThat(result.ast()).isNull();
            assertThat(result.steps()).hasSize(1);
        }

        @Test
        void successRequiresValue() {
            assertThatThrownBy(() -> AnalysisResult.success(List.of(), null, ValueType.EXACT, null))
                    .isInstanceOf(NullPointerException.class);
            assertThatThrownBy(() -> AnalysisResult.success(List.of(), "1", null, null))
                    .isInstanceOf(NullPointerException.class);
            assertThatThrownBy(() -> AnalysisResult.success(List.of(), "1", ValueType.EXACT, null))
                    .isInstanceOf(NullPointerException.class)
                    .hasMessage("ast must not be null for a successful result");
        }

        @Test
        void errorRequiresMessage() {
            assertThatThrownBy(() -> AnalysisResult.error(List.of(), null)).isInstanceOf(NullPointerException.class);
        }
    }

    @Nested
    @DisplayName("JSON form")
    class Json {

        @Test
        void nestedStepsBecomeNestedArrays() {
            List<StepTree> steps = new StepTrace()
                    .add("Integrating with respect to x")
                    .nest(List.of("Applied power rule"))
                    .add("Integral: x^{2} + C")
                    .build();
            ObjectNode json = AnalysisResult.success(steps, "x^{2} + C", ValueType.SYMBOLIC, Nodes.var("x"))
                    .toJson();

            assertThat(json.get("steps").size()).isEqualTo(3);
            assertThat(json.at("/steps/1").isArray()).isTrue();
            assertThat(json.at("/steps/1/0").asText()).isEqualTo("Applied power rule");
            assertThat(json.get("valueType").asText()).isEqualTo("symbolic");
            assertThat(json.at("/ast/type").asText()).isEqualTo("identifier");
            assertThat(json.get("error").isNull()).isTrue();
        }

        @Test
        void errorHasNullValueAndAst() {
            ObjectNode json = AnalysisResult.error(List.of(), "Input is empty").toJson();

            assertThat(json.get("value").isNull()).isTrue();
            assertThat(json.get("valueType").isNull()).isTrue();
            assertThat(json.get("ast").isNull()).isTrue();
            assertThat(json.get("error").asText()).isEqualTo("Input is empty");
        }
    }

    @Test
    void emptyNestIsDropped() {
        assertThat(new StepTrace().add("a").nest(List.of()).build()).containsExactly(StepTree.leaf("a"));
    }
}
