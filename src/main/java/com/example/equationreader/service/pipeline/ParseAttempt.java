package com.example.equationreader.service.pipeline;

/**
 * Outcome of one tier: the exact text handed to a parser and either the formatted expression it
 * accepted or the reason it was rejected.
 */
public record ParseAttempt(Tier tier, String input, String expression, String failureReason) {

    public static ParseAttempt success(Tier tier, String input, String expression) {
        return new ParseAttempt(tier, input, expression, null);
    }

    public static ParseAttempt failure(Tier tier, String input, String failureReason) {
        return new ParseAttempt(tier, input, null, failureReason);
    }

    public boolean succeeded() {
        return expression != null;
    }
}
