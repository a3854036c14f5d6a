package com.example.equationreader.service.correction;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CorrectionRuleTableTest {

    private final CorrectionRuleTable table = CorrectionRuleTable.standard();

    static Stream<Arguments> examples() {
        return Stream.of(
                Arguments.of("spacing-commands", "a\\,b\\quad c", "a b  c"),
                Arguments.of("decorative-wrappers", "\\mathrm{d}x + \\mathbf{\\frac{1}{2}}", "dx + \\frac{1}{2}"),
                Arguments.of("double-braces", "{{x}}+{{{y}}}", "{x}+{y}"),
                Arguments.of("bare-braces-to-parens", "{x+1}^{2}+\\frac{a}{b}", "(x+1)^{2}+\\frac{a}{b}"),
                Arguments.of("fragmented-theta", "2 t h e t a + 1", "2 \\theta + 1"),
                Arguments.of("fragmented-alpha", "A L P H A", "\\alpha"),
                Arguments.of("fragmented-beta", "b e t a", "\\beta"),
                Arguments.of("fragmented-lambda", "l a m b d a", "\\lambda"),
                Arguments.of("fragmented-sigma", "s i g m a", "\\sigma"),
                Arguments.of("fragmented-delta", "d e l t a", "\\delta"),
                Arguments.of("fragmented-omega", "o m e g a", "\\omega"),
                Arguments.of("fragmented-gamma", "g a m m a", "\\gamma"),
                Arguments.of("ocr-function-hallucinations", "s i n x + c0s x", "\\sin x + \\cos x"),
                Arguments.of("greek-escape", "2pi r + Theta", "2\\pi r + \\theta"),
                Arguments.of("chi-to-x", "\\chi(t)+\\chi", "x(t)+x"),
                Arguments.of("letter-o-to-zero", "1O + O5 + 2o3 + cos", "10 + 05 + 203 + cos"),
                Arguments.of("multiplication-symbols", "2\\times3\\cdot{x}×y", "2*3*{x}*y"),
                Arguments.of("letter-x-as-times", "3 x 4 = a x b", "3*4 = a*b"),
                Arguments.of("digit-join", "1 2 3 + 4 5", "123 + 45"),
                Arguments.of("decimal-separator", "0,5 + 2:5 + 3 . 1", "0.5 + 2.5 + 3.1"),
                Arguments.of("function-escapes", "SIN(x)+log x+\\cos y+sqrt{2}", "\\sin(x)+\\log x+\\cos y+\\sqrt{2}"),
                Arguments.of("fragmented-functions", "l o g(x) + c o s h(y)", "\\log(x) + \\cosh(y)"),
                Arguments.of("ln-hallucination", "In(x) + \\In y", "\\ln(x) + \\ln y"),
                Arguments.of("integral-differential", "\\int_{0}^{1} x^2", "\\int_{0}^{1} x^2 dx"),
                Arguments.of("limit-arrows", "\\lim _ {x->0} \\frac{\\sin x}{x}", "\\lim_{x \\to 0} \\frac{\\sin x}{x}"),
                Arguments.of("nested-parens", "(((x+1)))*2", "(x+1)*2"),
                Arguments.of("function-brace-args", "\\sin{x}+\\ln {2y}", "\\sin(x)+\\ln(2y)"),
                Arguments.of("braced-single-command", "x^{\\pi}+{\\alpha}", "x^\\pi+\\alpha"),
                Arguments.of("whitespace-normalize", "  a   +\tb ", "a + b"),
                Arguments.of("command-space-before-delimiter", "\\sin (x) + \\sqrt {2}", "\\sin(x) + \\sqrt{2}"));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("examples")
    void shouldRewriteKnownOcrArtifact(String ruleName, String input, String expected) {
        assertThat(table.rule(ruleName).apply(input)).isEqualTo(expected);
    }

    @Test
    void shouldHaveAnExampleForEveryRule() {
        Set<String> covered = examples()
                .map(arguments -> (String) arguments.get()[0])
                .collect(Collectors.toSet());

        assertThat(table.rules()).extracting(CleaningRule::name).allMatch(covered::contains);
    }

    @Test
    void shouldKeepRulesOrderedByGroup() {
        List<CleaningRule> rules = table.rules();
        for (int i = 1; i < rules.size(); i++) {
            assertThat(rules.get(i).group()).as(rules.get(i).name())
                    .isGreaterThanOrEqualTo(rules.get(i - 1).group());
        }
    }

    @Test
    void shouldHaveUniqueNamesAndRationales() {
        assertThat(table.rules()).extracting(CleaningRule::name).doesNotHaveDuplicates();
        assertThat(table.rules()).allSatisfy(rule -> assertThat(rule.rationale()).isNotBlank());
    }

    @Test
    void shouldRejectUnknownRuleName() {
        assertThatThrownBy(() -> table.rule("no-such-rule"))
                .isInstanceOf(NoSuchElementException.class)
                .hasMessageContaining("no-such-rule");
    }

    @Test
    void shouldLeaveHyperbolicFunctionsToTheFragmentRule() {
        assertThat(table.rule("ocr-function-hallucinations").apply("c o s h(y)")).isEqualTo("c o s h(y)");
    }

    @Test
    void shouldNotTouchWordsContainingX() {
        assertThat(table.rule("letter-x-as-times").apply("exp x max")).isEqualTo("exp x max");
    }

    @Test
    void shouldKeepSpacedArgumentListsApart() {
        CleaningRule rule = table.rule("decimal-separator");

        assertThat(rule.apply("f(1, 2)")).isEqualTo("f(1, 2)");
        assertThat(rule.apply("(0,0) + g(3 : 4)")).isEqualTo("(0.0) + g(3 : 4)");
    }

    @Test
    void shouldKeepExistingDifferential() {
        assertThat(table.rule("integral-differential").apply("\\int_{0}^{1} x^2 dx"))
                .isEqualTo("\\int_{0}^{1} x^2 dx");
    }
}
