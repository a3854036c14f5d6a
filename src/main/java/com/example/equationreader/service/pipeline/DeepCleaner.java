package com.example.equationreader.service.pipeline;

import com.example.equationreader.util.BracketBalancer;

import java.util.regex.Pattern;

/**
 * Aggressive last-resort stripping ahead of the generic parser: every markup command goes,
 * every bracket becomes a parenthesis and only arithmetic characters survive.
 */
final class DeepCleaner {

    private static final Pattern COMMAND = Pattern.compile("\\\\[A-Za-z]+");
    private static final Pattern ESCAPED_CHARACTER = Pattern.compile("\\\\.");
    private static final Pattern DISALLOWED = Pattern.compile("[^0-9A-Za-z+\\-*/^().=\\s]");
    private static final Pattern SPLIT_DIGITS = Pattern.compile("(\\d)\\s+(?=\\d)");
    private static final Pattern EMPTY_PARENS = Pattern.compile("\\(\\s*\\)");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private DeepCleaner() {
    }

    static String clean(String text) {
        String result = COMMAND.matcher(text).replaceAll(" ");
        result = ESCAPED_CHARACTER.matcher(result).replaceAll(" ");
        result = result.replace("\\", "");
        result = result.replace('{', '(').replace('}', ')').replace('[', '(').replace(']', ')');
        result = DISALLOWED.matcher(result).replaceAll("");
        result = SPLIT_DIGITS.matcher(result).replaceAll("$1");
        String previous;
        do {
            previous = result;
            result = EMPTY_PARENS.matcher(result).replaceAll("");
        } while (!result.equals(previous));
        result = WHITESPACE.matcher(result).replaceAll(" ").strip();
        return BracketBalancer.balance(result);
    }
}
