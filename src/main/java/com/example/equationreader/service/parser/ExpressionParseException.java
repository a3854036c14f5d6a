package com.example.equationreader.service.parser;

/**
 * Raised by a parser collaborator when its input is not an acceptable expression. Parse
 * failures are an expected outcome of canonicalization and are handled tier by tier; the
 * offending position, when known, is folded into the message recorded for the attempt.
 */
public class ExpressionParseException extends Exception {

    public ExpressionParseException(String message, int position) {
        super(position >= 0 ? message + " at position " + position : message);
    }

    public ExpressionParseException(String message) {
        super(message);
    }
}
