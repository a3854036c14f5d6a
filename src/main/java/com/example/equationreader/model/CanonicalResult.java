package com.example.equationreader.model;

/**
 * Result of the text pipeline for one markup string. Immutable and never persisted.
 *
 * @param expression          canonical expression when validated, else the balanced cleaned markup
 * @param latex               structurally cleaned markup
 * @param canonicalExpression tier output, or the balanced cleaned markup when no tier succeeded
 * @param rawExpression       least corrected candidate
 * @param refinedExpression   most corrected candidate
 * @param validated           whether a parser accepted {@code expression} verbatim
 * @param confidence          heuristic score in [0, 1]
 * @param tier                label of the accepting tier, {@code null} when unvalidated
 * @param llmUsed             whether the standardizer supplied the primary candidate
 */
public record CanonicalResult(
        String expression,
        String latex,
        String canonicalExpression,
        String rawExpression,
        String refinedExpression,
        boolean validated,
        double confidence,
        String tier,
        boolean llmUsed) {
}
