package com.example.equationreader.service.correction;

/**
 * Stages of the correction table, in the order they run.
 */
public enum RuleGroup {
    WHITESPACE_NOISE,
    WRAPPER_UNWRAPPING,
    BRACE_NORMALIZATION,
    HALLUCINATION_MAPPING,
    GREEK_ESCAPES,
    CHI_AS_X,
    DIGIT_LETTER_DISAMBIGUATION,
    OPERATOR_NORMALIZATION,
    DIGIT_JOINING,
    FUNCTION_NAMES,
    NATURAL_LOG,
    DIFFERENTIALS,
    LIMIT_NOTATION,
    NESTED_PARENTHESES,
    FUNCTION_ARGUMENTS,
    FINAL_WHITESPACE
}
