package com.example.equationreader.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StructuralCleanerTest {

    @Test
    void shouldReturnEmptyForBlankInput() {
        assertThat(StructuralCleaner.clean(null)).isEmpty();
        assertThat(StructuralCleaner.clean("   \n")).isEmpty();
    }

    @Test
    void shouldRemoveArrayWrapperAndAlignmentSpecifier() {
        assertThat(StructuralCleaner.clean("\\begin{array}{l}x^2 + 2x + 1}\\end{array}"))
                .isEqualTo("x^2 + 2x + 1}");
    }

    @Test
    void shouldPickTheEquationRowOverShortTextRows() {
        assertThat(StructuralCleaner.clean("\\mathrm{Tie} \\\\ x + 1 = 2")).isEqualTo("x + 1 = 2");
    }

    @Test
    void shouldPreferFirstRowOnTies() {
        assertThat(StructuralCleaner.clean("a + b \\\\ c + d")).isEqualTo("a + b");
    }

    @Test
    void shouldRewriteCongruenceSubscriptsAndStarSuperscript() {
        assertThat(StructuralCleaner.clean("\\chi(p_{h}(r)-0,0)\\cong\\frac{27}{128}(r-r^{*})^{-2}"))
                .isEqualTo("\\chi(p_{\\mathit{h}}(r)-0,0)=\\frac{27}{128}(r-r_{\\mathit{star}})^{-2}");
    }

    @Test
    void shouldNormalizeApproximationToEquality() {
        assertThat(StructuralCleaner.clean("a \\approx b")).isEqualTo("a = b");
    }

    @Test
    void shouldKeepDecorativeContentAndDropAnnotations() {
        assertThat(StructuralCleaner.clean("\\mathbf{x} + \\text{ where } y")).isEqualTo("x +  y");
    }

    @Test
    void shouldRemoveHallucinatedFragment() {
        assertThat(StructuralCleaner.clean("\\mathrm{Tie x = 1")).isEqualTo("x = 1");
    }

    @Test
    void shouldNormalizeSizedDelimiters() {
        assertThat(StructuralCleaner.clean("\\left( x \\right)")).isEqualTo("( x )");
    }

    @Test
    void shouldStripDoubledOuterBracesOnlyWhenTheySpanEverything() {
        assertThat(StructuralCleaner.clean("{{x+1}}")).isEqualTo("x+1");
        assertThat(StructuralCleaner.clean("{{a}+{b}}")).isEqualTo("{{a}+{b}}");
    }

    @Test
    void shouldBeIdempotentOnCleanedOutput() {
        String[] inputs = {
                "\\sin(x)**2 + \\cos(x)**2 - 1",
                "x^2 + 2x + 1",
                "\\chi(p_{h}(r)-0,0)\\cong\\frac{27}{128}(r-r^{*})^{-2}"
        };
        for (String input : inputs) {
            String once = StructuralCleaner.clean(input);
            assertThat(StructuralCleaner.clean(once)).isEqualTo(once);
        }
    }
}
