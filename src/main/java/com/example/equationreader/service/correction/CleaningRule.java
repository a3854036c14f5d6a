package com.example.equationreader.service.correction;

import java.util.Objects;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * One pure rewrite step of the correction table.
 *
 * @param name      stable identifier, used in logs and tests
 * @param group     stage the rule belongs to
 * @param rationale the recognizer failure the rule repairs
 * @param transform total function over strings
 */
public record CleaningRule(String name, RuleGroup group, String rationale, UnaryOperator<String> transform) {

    public CleaningRule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(group, "group");
        Objects.requireNonNull(transform, "transform");
    }

    public String apply(String text) {
        return transform.apply(text);
    }

    static CleaningRule replacing(String name, RuleGroup group, String rationale, String regex, String replacement) {
        Pattern pattern = Pattern.compile(regex);
        return new CleaningRule(name, group, rationale, text -> pattern.matcher(text).replaceAll(replacement));
    }

    /**
     * Applies the replacement a fixed number of times, for rewrites whose output can form new
     * matches.
     */
    static CleaningRule repeating(String name, RuleGroup group, String rationale, String regex, String replacement, int passes) {
        Pattern pattern = Pattern.compile(regex);
        return new CleaningRule(name, group, rationale, text -> {
            String current = text;
            for (int pass = 0; pass < passes; pass++) {
                current = pattern.matcher(current).replaceAll(replacement);
            }
            return current;
        });
    }
}
