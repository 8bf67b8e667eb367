package io.latexium.core.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import io.latexium.core.ast.AstNode;
import io.latexium.core.ast.BinaryExpression;
import io.latexium.core.ast.BinaryOperator;
import io.latexium.core.ast.Fraction;
import io.latexium.core.ast.FunctionCall;
import io.latexium.core.ast.Identifier;
import io.latexium.core.ast.Integral;
import io.latexium.core.ast.NumberLiteral;
import io.latexium.core.ast.Product;
import io.latexium.core.ast.Sum;
import io.latexium.core.ast.UnaryExpression;
import io.latexium.core.error.LatexParseException;
import io.latexium.core.render.LatexRenderer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("LatexParser")
class LatexParserTest {

    @Nested
    @DisplayName("precedence")
    class Precedence {

        @Test
        void multiplicationBindsTighterThanAddition() {
            AstNode node = LatexParser.parse("1 + 2 \\cdot 3");

            assertThat(node).isInstanceOf(BinaryExpression.class);
            BinaryExpression sum = (BinaryExpression) node;
            assertThat(sum.operator()).isEqualTo(BinaryOperator.ADD);
            assertThat(sum.right()).isInstanceOfSatisfying(BinaryExpression.class,
                    product -> assertThat(product.operator()).isEqualTo(BinaryOperator.MULTIPLY));
        }

        @Test
        void powerIsRightAssociative() {
            BinaryExpression node = (BinaryExpression) LatexParser.parse("2^3^2");

            assertThat(node.operator()).isEqualTo(BinaryOperator.POWER);
            assertThat(node.left()).isEqualTo(new NumberLiteral(2));
            assertThat(node.right()).isInstanceOf(BinaryExpression.class);
        }

        @Test
        void unaryMinusAppliesToPower() {
            AstNode node = LatexParser.parse("-x^2");
            assertThat(node).isInstanceOfSatisfying(UnaryExpression.class,
                    u -> assertThat(u.operand()).isInstanceOf(BinaryExpression.class));
        }

        @Test
        void comparisonIsLoosest() {
            BinaryExpression node = (BinaryExpression) LatexParser.parse("x + 1 \\le 2x");
            assertThat(node.operator()).isEqualTo(BinaryOperator.LESS_EQUAL);
        }
    }

    @Nested
    @DisplayName("implicit multiplication")
    class Implicit {

        @ParameterizedTest
        @CsvSource(delimiter = '|', value = {
            "2x                | 2x",
            "2xy               | 2x \\cdot y",
            "3(x + 1)          | 3(x + 1)",
            "(x + 1)(x - 1)    | (x + 1) \\cdot (x - 1)",
            "x \\sin x         | x \\cdot \\sin(x)"
        })
        void juxtapositionMultiplies(String input, String rendered) {
            assertThat(LatexRenderer.render(LatexParser.parse(input))).isEqualTo(rendered);
        }

        @Test
        void functionArgumentTakesJuxtaposedFactors() {
            FunctionCall call = (FunctionCall) LatexParser.parse("\\sin 2x");
            assertThat(LatexRenderer.render(call.arg())).isEqualTo("2x");
        }
    }

    @Nested
    @DisplayName("constructs")
    class Constructs {

        @Test
        void fraction() {
            assertThat(LatexParser.parse("\\frac{x}{2}")).isInstanceOf(Fraction.class);
        }

        @Test
        void squareRootAndNthRoot() {
            assertThat(LatexParser.parse("\\sqrt{x}")).isInstanceOfSatisfying(FunctionCall.class,
                    f -> assertThat(f.name()).isEqualTo("sqrt"));
            BinaryExpression cubeRoot = (BinaryExpression) LatexParser.parse("\\sqrt[3]{x}");
            assertThat(cubeRoot.operator()).isEqualTo(BinaryOperator.POWER);
            assertThat(cubeRoot.right()).isInstanceOf(Fraction.class);
        }

        @Test
        void absoluteValue() {
            assertThat(LatexParser.parse("|x - 1|")).isInstanceOfSatisfying(FunctionCall.class,
                    f -> assertThat(f.name()).isEqualTo("abs"));
        }

        @Test
        void logWithBase() {
            assertThat(LatexParser.parse("\\log_2 x")).isInstanceOf(Fraction.class);
        }

        @Test
        void functionPower() {
            BinaryExpression node = (BinaryExpression) LatexParser.parse("\\sin^2 x");
            assertThat(node.operator()).isEqualTo(BinaryOperator.POWER);
            assertThat(node.left()).isInstanceOf(FunctionCall.class);
        }

        @Test
        void subscriptedIdentifier() {
            assertThat(LatexParser.parse("a_{n}")).isInstanceOfSatisfying(Identifier.class,
                    id -> assertThat(id.name()).isEqualTo("a_n"));
        }

        @Test
        void indefiniteIntegral() {
            Integral integral = (Integral) LatexParser.parse("\\int x^2 dx");

            assertThat(integral.variable().name()).isEqualTo("x");
            assertThat(integral.lower()).isNull();
            assertThat(integral.upper()).isNull();
        }

        @Test
        void definiteIntegralWithBounds() {
            Integral integral = (Integral) LatexParser.parse("\\int_{0}^{1} t dt");

            assertThat(integral.lower()).isEqualTo(new NumberLiteral(0));
            assertThat(integral.upper()).isEqualTo(new NumberLiteral(1));
            assertThat(integral.body()).isInstanceOfSatisfying(Identifier.class,
                    id -> assertThat(id.isFree()).isFalse());
        }

        @Test
        void bareDifferential() {
            Integral integral = (Integral) LatexParser.parse("\\int dx");
            assertThat(integral.body()).isEqualTo(NumberLiteral.ONE);
        }

        @Test
        void sumAndProduct() {
            assertThat(LatexParser.parse("\\sum_{i=1}^{n} i")).isInstanceOf(Sum.class);
            assertThat(LatexParser.parse("\\prod_{k=1}^{3} k")).isInstanceOf(Product.class);
        }

        @Test
        void sumBodyIsOneTerm() {
            BinaryExpression node = (BinaryExpression) LatexParser.parse("\\sum_{i=1}^{3} i + 1");

            assertThat(node.operator()).isEqualTo(BinaryOperator.ADD);
            assertThat(node.left()).isInstanceOf(Sum.class);
        }
    }

    @Nested
    @DisplayName("errors")
    class Errors {

        @Test
        void emptyInput() {
            LatexParseException e = catchThrowableOfType(() -> LatexParser.parse("   "), LatexParseException.class);

            assertThat(e.getMessage()).isEqualTo("Input is empty");
            assertThat(e.position()).isZero();
        }

        @Test
        void unclosedParenthesisReportsPosition() {
            LatexParseException e = catchThrowableOfType(() -> LatexParser.parse("(x + 1"), LatexParseException.class);

            assertThat(e.getMessage()).isEqualTo("Expected ')' at position 6, found end of input");
            assertThat(e.position()).isEqualTo(6);
        }

        @Test
        void danglingOperator() {
            assertThatThrownBy(() -> LatexParser.parse("x +"))
                    .isInstanceOf(LatexParseException.class)
                    .hasMessageStartingWith("Unexpected end of input");
        }

        @Test
        void integralWithoutDifferential() {
            assertThatThrownBy(() -> LatexParser.parse("\\int x^2"))
                    .isInstanceOf(LatexParseException.class)
                    .hasMessageStartingWith("Expected d<variable> after integrand");
        }

        @Test
        void integralWithOneBound() {
            assertThatThrownBy(() -> LatexParser.parse("\\int_0 x dx"))
                    .isInstanceOf(LatexParseException.class)
                    .hasMessage("Definite integral needs both bounds");
        }

        @Test
        void unknownCommand() {
            assertThatThrownBy(() -> LatexParser.parse("\\alpha + 1"))
                    .isInstanceOf(LatexParseException.class)
                    .hasMessage("Unknown command \\alpha");
        }

        @Test
        void strayClosingBrace() {
            assertThatThrownBy(() -> LatexParser.parse("x + 1)"))
                    .isInstanceOf(LatexParseException.class)
                    .hasMessageStartingWith("Unexpected token at position 5");
        }
    }
}
