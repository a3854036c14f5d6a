package com.example.equationreader.service.pipeline;

import java.util.List;

/**
 * Terminal state of the canonicalizer.
 *
 * @param expression        accepted expression, or the balanced cleaned markup when every tier failed
 * @param validated         whether a parser accepted {@code expression} verbatim
 * @param tier              tier that produced {@code expression}, {@code null} on failure
 * @param rawExpression     least corrected candidate (balanced cleaned markup)
 * @param refinedExpression most corrected markup candidate (rule table plus balancing)
 * @param attempts          every tier tried, in order
 */
public record CanonicalizationOutcome(
        String expression,
        boolean validated,
        Tier tier,
        String rawExpression,
        String refinedExpression,
        List<ParseAttempt> attempts) {

    public CanonicalizationOutcome {
        attempts = List.copyOf(attempts);
    }
}
