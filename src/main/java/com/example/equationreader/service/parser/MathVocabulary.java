package com.example.equationreader.service.parser;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Names shared by the parsers and the correction rules.
 */
public final class MathVocabulary {

    /** Lower-case Greek letter names, longest first so alternations prefer the full name. */
    public static final List<String> GREEK_LETTERS = List.of(
            "upsilon", "epsilon", "omicron", "lambda", "alpha", "gamma", "delta", "theta", "kappa",
            "sigma", "omega", "beta", "zeta", "iota", "eta", "rho", "tau", "phi", "chi", "psi",
            "mu", "nu", "xi", "pi");

    public static final Set<String> UPPER_GREEK_LETTERS = Set.of(
            "Gamma", "Delta", "Theta", "Lambda", "Xi", "Pi", "Sigma", "Upsilon", "Phi", "Psi", "Omega");

    public static final Set<String> VARIANT_GREEK_LETTERS = Set.of(
            "varepsilon", "vartheta", "varpi", "varrho", "varsigma", "varphi");

    /** Function names whose escape prefix OCR tends to drop, longest first. */
    public static final List<String> FUNCTION_NAMES = List.of(
            "arcsin", "arccos", "arctan", "sinh", "cosh", "tanh", "sqrt", "sin", "cos", "tan",
            "cot", "sec", "csc", "log", "exp", "lim", "det", "max", "min", "ln");

    /** Markup function commands and the name the expression tree uses for them. */
    public static final Map<String, String> MARKUP_FUNCTIONS = Map.ofEntries(
            Map.entry("sin", "sin"),
            Map.entry("cos", "cos"),
            Map.entry("tan", "tan"),
            Map.entry("cot", "cot"),
            Map.entry("sec", "sec"),
            Map.entry("csc", "csc"),
            Map.entry("arcsin", "asin"),
            Map.entry("arccos", "acos"),
            Map.entry("arctan", "atan"),
            Map.entry("sinh", "sinh"),
            Map.entry("cosh", "cosh"),
            Map.entry("tanh", "tanh"),
            Map.entry("exp", "exp"),
            Map.entry("ln", "ln"),
            Map.entry("log", "log"),
            Map.entry("det", "det"),
            Map.entry("max", "Max"),
            Map.entry("min", "Min"));

    /** Functions the generic parser applies even without parentheses ({@code sin x}). */
    public static final Set<String> KNOWN_FUNCTIONS = Set.of(
            "sin", "cos", "tan", "cot", "sec", "csc", "asin", "acos", "atan", "arcsin", "arccos",
            "arctan", "sinh", "cosh", "tanh", "log", "ln", "exp", "sqrt", "Abs", "abs", "factorial");

    private MathVocabulary() {
    }

    public static boolean isGreekCommand(String command) {
        return GREEK_LETTERS.contains(command)
                || UPPER_GREEK_LETTERS.contains(command)
                || VARIANT_GREEK_LETTERS.contains(command);
    }

    /**
     * Symbol name for a Greek command, with {@code var} variants folded onto the base letter.
     */
    public static String greekSymbolName(String command) {
        return command.startsWith("var") ? command.substring(3) : command;
    }
}
