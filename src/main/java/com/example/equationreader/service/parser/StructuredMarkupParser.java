package com.example.equationreader.service.parser;

/**
 * Parses LaTeX-style markup (superscripts, fractions, escaped function names) into an
 * {@link Expression}.
 */
public interface StructuredMarkupParser {

    Expression parse(String markup) throws ExpressionParseException;
}
