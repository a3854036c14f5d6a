package com.example.equationreader.service.pipeline;

import com.example.equationreader.service.correction.SemanticCorrector;
import com.example.equationreader.service.parser.Expression.Symbol;
import com.example.equationreader.service.parser.ExpressionParseException;
import com.example.equationreader.service.parser.GenericExpressionParser;
import com.example.equationreader.service.parser.InfixExpressionParser;
import com.example.equationreader.service.parser.LatexMarkupParser;
import com.example.equationreader.service.parser.StructuredMarkupParser;
import com.example.equationreader.util.StructuralCleaner;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class TieredCanonicalizerTest {

    private final LatexMarkupParser markupParser = new LatexMarkupParser();
    private final InfixExpressionParser expressionParser = new InfixExpressionParser();
    private final SemanticCorrector corrector = new SemanticCorrector();

    private final TieredCanonicalizer canonicalizer =
            new TieredCanonicalizer(markupParser, expressionParser, corrector);

    @Test
    void shouldAcceptCleanMarkupAtPrimaryTier() {
        CanonicalizationOutcome outcome = canonicalizer.canonicalize("x^2 + 2x + 1}");

        assertThat(outcome.validated()).isTrue();
        assertThat(outcome.tier()).isEqualTo(Tier.PRIMARY);
        assertThat(outcome.expression()).isEqualTo("x^2 + 2*x + 1");
        assertThat(outcome.rawExpression()).isEqualTo("x^2 + 2x + 1");
        assertThat(outcome.attempts()).hasSize(1);
    }

    @Test
    void shouldEscalateToHeuristicTierWhenCorrectionsAreNeeded() {
        String cleaned = "\\chi(p_{\\mathit{h}}(r)-0,0)=\\frac{27}{128}(r-r_{\\mathit{star}})^{-2}";

        CanonicalizationOutcome outcome = canonicalizer.canonicalize(cleaned);

        assertThat(outcome.validated()).isTrue();
        assertThat(outcome.tier()).isEqualTo(Tier.HEURISTIC);
        assertThat(outcome.expression()).isEqualTo("x*(ph(r) - 0.0) = 27/128*(r - rstar)^(-2)");
        assertThat(outcome.rawExpression()).isEqualTo(cleaned);
        assertThat(outcome.refinedExpression())
                .isEqualTo("x(p_{\\mathit{h}}(r)-0.0)=\\frac{27}{128}(r-r_{\\mathit{star}})^{-2}");
        assertThat(outcome.attempts()).extracting(ParseAttempt::tier).containsExactly(Tier.PRIMARY, Tier.HEURISTIC);
        assertThat(outcome.attempts().get(0).failureReason()).isNotBlank();
    }

    @Test
    void shouldUseCorrectedTextWhenPrimaryParserRejects() {
        TieredCanonicalizer withRejectingPrimary = new TieredCanonicalizer(
                rejecting(Set.of("2 x 3")), expressionParser, corrector);

        CanonicalizationOutcome outcome = withRejectingPrimary.canonicalize("2 x 3");

        assertThat(outcome.tier()).isEqualTo(Tier.HEURISTIC);
        assertThat(outcome.expression()).isEqualTo("2*3");
    }

    @Test
    void shouldFallBackToDeepCleanWhenMarkupParserRejectsEverything() {
        TieredCanonicalizer canonicalizer = new TieredCanonicalizer(
                markup -> {
                    throw new ExpressionParseException("rejected");
                },
                expressionParser, corrector);

        CanonicalizationOutcome outcome = canonicalizer.canonicalize("\\alpha x + 1");

        assertThat(outcome.validated()).isTrue();
        assertThat(outcome.tier()).isEqualTo(Tier.DEEP_CLEAN);
        assertThat(outcome.expression()).isEqualTo("x + 1");
        assertThat(outcome.attempts().get(2).input()).isEqualTo("x + 1");
    }

    @Test
    void shouldReachRawFallbackWhenDeepCleanedTextIsRejected() {
        GenericExpressionParser acceptingAllButDeepClean = text -> {
            if (text.equals("x + 1")) {
                throw new ExpressionParseException("rejected");
            }
            return new Symbol(text);
        };
        TieredCanonicalizer canonicalizer = new TieredCanonicalizer(
                markup -> {
                    throw new ExpressionParseException("rejected");
                },
                acceptingAllButDeepClean, corrector);

        CanonicalizationOutcome outcome = canonicalizer.canonicalize("\\alpha x + 1");

        assertThat(outcome.tier()).isEqualTo(Tier.RAW_FALLBACK);
        assertThat(outcome.expression()).isEqualTo("\\alpha x + 1");
        assertThat(outcome.attempts()).hasSize(4);
    }

    @Test
    void shouldReportBalancedCleanedTextWhenEveryTierFails() {
        TieredCanonicalizer canonicalizer = new TieredCanonicalizer(
                markup -> {
                    throw new ExpressionParseException("rejected");
                },
                text -> {
                    throw new ExpressionParseException("rejected");
                },
                corrector);

        CanonicalizationOutcome outcome = canonicalizer.canonicalize("(x");

        assertThat(outcome.validated()).isFalse();
        assertThat(outcome.tier()).isNull();
        assertThat(outcome.expression()).isEqualTo("(x)");
        assertThat(outcome.attempts()).extracting(ParseAttempt::tier)
                .containsExactly(Tier.PRIMARY, Tier.HEURISTIC, Tier.DEEP_CLEAN, Tier.RAW_FALLBACK);
        assertThat(outcome.attempts()).noneMatch(ParseAttempt::succeeded);
    }

    @Test
    void shouldReportGarbageUnvalidated() {
        CanonicalizationOutcome outcome = canonicalizer.canonicalize("?!;:");

        assertThat(outcome.validated()).isFalse();
        assertThat(outcome.tier()).isNull();
        assertThat(outcome.expression()).isEqualTo("?!;:");
    }

    @Test
    void shouldRequireFormattedOutputToParseAgain() {
        StructuredMarkupParser producingUnverifiable = markup -> new Symbol("bad");
        GenericExpressionParser rejectingBad = text -> {
            if (text.equals("bad")) {
                throw new ExpressionParseException("rejected");
            }
            return new Symbol(text);
        };
        TieredCanonicalizer canonicalizer = new TieredCanonicalizer(producingUnverifiable, rejectingBad, corrector);

        CanonicalizationOutcome outcome = canonicalizer.canonicalize("y");

        assertThat(outcome.tier()).isEqualTo(Tier.DEEP_CLEAN);
        assertThat(outcome.expression()).isEqualTo("y");
        assertThat(outcome.attempts().get(0).succeeded()).isFalse();
    }

    @Test
    void shouldPreferStandardizedCandidateAtPrimaryTier() {
        CanonicalizationOutcome outcome = canonicalizer.canonicalize("garbage?", "x + 1");

        assertThat(outcome.tier()).isEqualTo(Tier.PRIMARY);
        assertThat(outcome.expression()).isEqualTo("x + 1");
        assertThat(outcome.rawExpression()).isEqualTo("garbage?");
    }

    @Test
    void shouldTreatUnexpectedParserErrorsAsRejection() {
        TieredCanonicalizer canonicalizer = new TieredCanonicalizer(
                markup -> {
                    throw new IllegalStateException("parser bug");
                },
                expressionParser, corrector);

        CanonicalizationOutcome outcome = canonicalizer.canonicalize("x + 1");

        assertThat(outcome.tier()).isEqualTo(Tier.DEEP_CLEAN);
        assertThat(outcome.attempts().get(0).failureReason()).contains("IllegalStateException");
    }

    @Test
    void shouldFailEveryTierOnEmptyInput() {
        CanonicalizationOutcome outcome = canonicalizer.canonicalize(null);

        assertThat(outcome.validated()).isFalse();
        assertThat(outcome.expression()).isEmpty();
        assertThat(outcome.attempts()).allMatch(attempt -> "Empty input".equals(attempt.failureReason()));
    }

    @Test
    void shouldReportDeeplyNestedInputUnvalidated() {
        String cleaned = StructuralCleaner.clean("(".repeat(20000) + "x");

        CanonicalizationOutcome outcome = canonicalizer.canonicalize(cleaned);

        assertThat(outcome.validated()).isFalse();
        assertThat(outcome.tier()).isNull();
        assertThat(outcome.attempts()).hasSize(Tier.values().length)
                .noneMatch(ParseAttempt::succeeded);
    }

    private StructuredMarkupParser rejecting(Set<String> inputs) {
        return markup -> {
            if (inputs.contains(markup)) {
                throw new ExpressionParseException("rejected");
            }
            return markupParser.parse(markup);
        };
    }
}
