package com.example.equationreader.service.parser;

/**
 * Parses plain infix algebra without markup semantics. Calls to functions it does not know
 * ({@code name(args)}) are kept as opaque function symbols instead of failing.
 */
public interface GenericExpressionParser {

    Expression parse(String text) throws ExpressionParseException;
}
