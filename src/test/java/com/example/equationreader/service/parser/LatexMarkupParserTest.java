package com.example.equationreader.service.parser;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LatexMarkupParserTest {

    private final LatexMarkupParser parser = new LatexMarkupParser();

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "\\frac{1}{2}x | 1/2*x",
            "\\frac12 | 1/2",
            "x^2 + 2x + 1 | x**2 + 2*x + 1",
            "\\sqrt[3]{x} | x**(1/3)",
            "\\log_{2}(8) | log(8, 2)",
            "'|x - 1|' | Abs(x - 1)",
            "3! | factorial(3)",
            "\\alpha + \\varphi | alpha + phi",
            "\\left( x + 1 \\right) \\cdot 2 | (x + 1)*2",
            "-x^2 | -x**2",
            "2^{-1} | 2**(-1)",
            "a - (b - c) | a - (b - c)",
            "p_{\\mathit{h}}(r) | p_h(r)"
    })
    void shouldRenderMarkup(String markup, String expected) throws ExpressionParseException {
        assertThat(parser.parse(markup).render()).isEqualTo(expected);
    }

    @Test
    void shouldParseEquationWithFunctionPowers() throws ExpressionParseException {
        Expression parsed = parser.parse("\\sin^2 x + \\cos^2 x = 1");

        assertThat(parsed).isInstanceOf(Expression.Equation.class);
        assertThat(parsed.render()).isEqualTo("Eq(sin(x)**2 + cos(x)**2, 1)");
    }

    @Test
    void shouldParseCalculusConstructs() throws ExpressionParseException {
        assertThat(parser.parse("\\int_{0}^{1} x^2 dx").render()).isEqualTo("Integral(x**2, (x, 0, 1))");
        assertThat(parser.parse("\\lim_{x \\to 0} \\frac{\\sin x}{x}").render()).isEqualTo("Limit(sin(x)/x, x, 0)");
        assertThat(parser.parse("\\sum_{i=1}^{n} i^2").render()).isEqualTo("Sum(i**2, (i, 1, n))");
    }

    @Test
    void shouldParseCorrectedChiScenario() throws ExpressionParseException {
        Expression parsed = parser.parse("x(p_{\\mathit{h}}(r)-0.0)=\\frac{27}{128}(r-r_{\\mathit{star}})^{-2}");

        assertThat(parsed.render()).isEqualTo("Eq(x*(p_h(r) - 0.0), 27/128*(r - r_star)**(-2))");
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "f(x, y)",
            "\\mathrm{x}",
            "(x + 1",
            "\\sum_{i=1} i",
            "\\int x",
            "x = y = z",
            "\\chi(p_{\\mathit{h}}(r)-0,0)"
    })
    void shouldRejectMalformedMarkup(String markup) {
        assertThatThrownBy(() -> parser.parse(markup)).isInstanceOf(ExpressionParseException.class);
    }

    @Test
    void shouldRejectEmptyInput() {
        assertThatThrownBy(() -> parser.parse("")).isInstanceOf(ExpressionParseException.class);
        assertThatThrownBy(() -> parser.parse(null)).isInstanceOf(ExpressionParseException.class);
    }

    @Test
    void shouldRejectRunawayNestingInsteadOfOverflowingTheStack() {
        String markup = "(".repeat(300) + "x" + ")".repeat(300);

        assertThatThrownBy(() -> parser.parse(markup))
                .isInstanceOf(ExpressionParseException.class)
                .hasMessageContaining("Nesting too deep");
    }

    @Test
    void shouldAcceptModerateNesting() throws Exception {
        String markup = "\\sqrt{".repeat(20) + "x" + "}".repeat(20);

        assertThat(parser.parse(markup).render()).contains("x");
    }

    @Test
    void shouldRejectOverlongMarkup() {
        String markup = "x+".repeat(600) + "x";

        assertThatThrownBy(() -> parser.parse(markup))
                .isInstanceOf(ExpressionParseException.class)
                .hasMessageContaining("Markup too long");
    }
}
