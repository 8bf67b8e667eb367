package io.latexium.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import io.latexium.core.ast.AstNode;
import io.latexium.core.ast.Identifier;
import io.latexium.core.ast.Integral;
import io.latexium.core.ast.Sum;
import io.latexium.core.error.LatexParseException;
import io.latexium.core.parser.LatexParser;
import io.latexium.core.render.LatexRenderer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("AstJson")
class AstJsonTest {

    @Nested
    @DisplayName("writing")
    class Writing {

        @Test
        void binaryWithIntegerNumber() {
            JsonNode json = AstJson.toJson(LatexParser.parse("x + 2"));

            assertThat(json.get("type").asText()).isEqualTo("binary");
            assertThat(json.get("operator").asText()).isEqualTo("+");
            assertThat(json.at("/left/type").asText()).isEqualTo("identifier");
            assertThat(json.at("/left/scope").asText()).isEqualTo("free");
            assertThat(json.at("/left/uniqueId").asText()).isEqualTo("free_x");
            assertThat(json.at("/right/value").isIntegralNumber()).isTrue();
        }

        @Test
        void boundIdentifierCarriesBindingData() {
            JsonNode json = AstJson.toJson(LatexParser.parse("\\int_0^1 t dt"));

            assertThat(json.get("type").asText()).isEqualTo("integral");
            assertThat(json.get("variable").asText()).isEqualTo("t");
            assertThat(json.at("/integrand/scope").asText()).isEqualTo("bound");
            assertThat(json.at("/integrand/bindingDepth").asInt()).isEqualTo(1);
            assertThat(json.at("/integrand/bindingContext").asText()).isEqualTo("integral");
            assertThat(json.has("lowerBound")).isTrue();
        }

        @Test
        void indefiniteBinderOmitsBounds() {
            JsonNode json = AstJson.toJson(LatexParser.parse("\\int x dx"));
            assertThat(json.has("lowerBound")).isFalse();
            assertThat(json.has("upperBound")).isFalse();
        }
    }

    @Nested
    @DisplayName("reading")
    class Reading {

        @Test
        void resolvesScopesOfReadTree() {
            AstNode node = AstJson.fromJson("""
                    {
                      "type": "sum",
                      "expression": {"type": "identifier", "name": "k"},
                      "variable": "k",
                      "lowerBound": {"type": "number", "value": 1},
                      "upperBound": {"type": "number", "value": 3}
                    }
                    """);

            assertThat(LatexRenderer.render(node)).isEqualTo("\\sum_{k=1}^{3} k");
            assertThat(((Sum) node).body())
                    .isInstanceOfSatisfying(Identifier.class, id -> assertThat(id.isFree()).isFalse());
        }

        @Test
        void writtenTreeReadsBack() {
            AstNode original = LatexParser.parse("\\int_0^{\\pi} \\sin(x) \\cdot x^2 dx + \\frac{y}{2}");
            AstNode read = AstJson.fromJson(AstJson.toJson(original));

            assertThat(read).isInstanceOf(original.getClass());
            assertThat(LatexRenderer.render(read)).isEqualTo(LatexRenderer.render(original));
        }

        @Test
        void integralFromJson() {
            AstNode node = AstJson.fromJson("""
                    {"type": "integral", "integrand": {"type": "identifier", "name": "x"}, "variable": "x"}
                    """);
            assertThat(node).isInstanceOf(Integral.class);
        }
    }

    @Nested
    @DisplayName("schema validation")
    class Validation {

        @Test
        void unknownType() {
            assertThatThrownBy(() -> AstJson.fromJson("{\"type\": \"matrix\"}"))
                    .isInstanceOf(LatexParseException.class)
                    .hasMessageStartingWith("AST document does not match schema");
        }

        @Test
        void missingOperand() {
            assertThatThrownBy(() -> AstJson.fromJson("""
                            {"type": "binary", "operator": "+", "left": {"type": "number", "value": 1}}
                            """))
                    .isInstanceOf(LatexParseException.class)
                    .hasMessageContaining("right");
        }

        @Test
        void singleBound() {
            assertThatThrownBy(() -> AstJson.fromJson("""
                            {
                              "type": "integral",
                              "integrand": {"type": "number", "value": 1},
                              "variable": "x",
                              "lowerBound": {"type": "number", "value": 0}
                            }
                            """))
                    .isInstanceOf(LatexParseException.class);
        }

        @Test
        void malformedJson() {
            assertThatThrownBy(() -> AstJson.fromJson("{\"type\": "))
                    .isInstanceOf(LatexParseException.class)
                    .hasMessageStartingWith("AST document is not valid JSON");
        }

        @Test
        void unknownOperatorSymbol() {
            assertThatThrownBy(() -> AstJson.fromJson("""
                            {"type": "unary", "operator": "*", "operand": {"type": "number", "value": 1}}
                            """))
                    .isInstanceOf(LatexParseException.class);
        }
    }
}
