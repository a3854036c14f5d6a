package com.example.equationreader.service.correction;

import com.example.equationreader.service.parser.MathVocabulary;
import com.example.equationreader.util.BraceGroups;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static com.example.equationreader.service.correction.CleaningRule.repeating;
import static com.example.equationreader.service.correction.CleaningRule.replacing;

/**
 * Ordered table of OCR repair rules. Later rules rely on the normalization done by earlier ones
 * (function escapes are inserted before spacing in front of delimiters is removed, braces become
 * parentheses before parenthesis runs are collapsed), so the order is part of the contract.
 */
public final class CorrectionRuleTable {

    private static final List<String> DECORATIVE_WRAPPERS = List.of(
            "mathrm", "mathbf", "mathsf", "mathtt", "boldsymbol", "bm", "bold",
            "textbf", "textit", "textrm", "text", "operatorname");
    private static final List<String> FRAGMENTED_GREEK = List.of(
            "theta", "alpha", "beta", "lambda", "sigma", "delta", "omega", "gamma");
    private static final String BRACE_ARGUMENT_FUNCTIONS =
            "sin|cos|tan|cot|sec|csc|arcsin|arccos|arctan|sinh|cosh|tanh|exp|ln|log";

    private static final Pattern GREEK_WORD = Pattern.compile(
            "(?<![A-Za-z\\\\])(" + String.join("|", MathVocabulary.GREEK_LETTERS) + ")(?![A-Za-z])",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern FUNCTION_WORD = Pattern.compile(
            "(?<![A-Za-z\\\\])(" + String.join("|", MathVocabulary.FUNCTION_NAMES) + ")(?![A-Za-z])",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern DIFFERENTIAL = Pattern.compile("(?<![A-Za-z\\\\])d\\s*[A-Za-z](?![A-Za-z])");
    private static final Pattern LEADING_BOUNDS = Pattern.compile("^\\s*(?:[_^]\\s*(?:\\{[^{}]*\\}|\\S)\\s*){0,2}");
    private static final Pattern BARE_LETTER = Pattern.compile("(?<![A-Za-z\\\\])([A-Za-z])(?![A-Za-z])");
    private static final Pattern BRACED_COMMAND = Pattern.compile("\\{(\\\\[A-Za-z]+)\\}");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final CorrectionRuleTable STANDARD = new CorrectionRuleTable(standardRules());

    private final List<CleaningRule> rules;

    public CorrectionRuleTable(List<CleaningRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static CorrectionRuleTable standard() {
        return STANDARD;
    }

    public List<CleaningRule> rules() {
        return rules;
    }

    public CleaningRule rule(String name) {
        return rules.stream()
                .filter(rule -> rule.name().equals(name))
                .findFirst()
                .orElseThrow(() -> new NoSuchElementException("No correction rule named " + name));
    }

    private static List<CleaningRule> standardRules() {
        List<CleaningRule> rules = new ArrayList<>();

        rules.add(replacing("spacing-commands", RuleGroup.WHITESPACE_NOISE,
                "thin and wide space commands carry no math",
                "\\\\[,;:! ]|\\\\q?quad(?![A-Za-z])|\\\\hspace\\*?\\{[^{}]*\\}", " "));

        rules.add(new CleaningRule("decorative-wrappers", RuleGroup.WRAPPER_UNWRAPPING,
                "font and text wrappers hide plain content; \\mathit identifiers are kept",
                CorrectionRuleTable::unwrapDecorations));

        rules.add(repeating("double-braces", RuleGroup.BRACE_NORMALIZATION,
                "the recognizer doubles braces around plain groups",
                "\\{\\{([^{}]*)\\}\\}", "{$1}", 3));
        rules.add(new CleaningRule("bare-braces-to-parens", RuleGroup.BRACE_NORMALIZATION,
                "a brace group that is not a command argument or script is a parenthesis",
                CorrectionRuleTable::bareBracesToParentheses));

        for (String letter : FRAGMENTED_GREEK) {
            rules.add(fragmentRule("fragmented-" + letter, RuleGroup.HALLUCINATION_MAPPING, letter));
        }
        rules.add(new CleaningRule("ocr-function-hallucinations", RuleGroup.HALLUCINATION_MAPPING,
                "sine, cosine and tangent read letter by letter or with look-alike glyphs",
                chain(
                        ignoreCaseReplacer("(?<![A-Za-z\\\\])s\\s+i\\s+n(?![A-Za-z])(?!\\s+h(?![A-Za-z]))", "\\sin"),
                        ignoreCaseReplacer("(?<![A-Za-z\\\\])c\\s+o\\s+s(?![A-Za-z])(?!\\s+h(?![A-Za-z]))", "\\cos"),
                        ignoreCaseReplacer("(?<![A-Za-z\\\\])t\\s+a\\s+n(?![A-Za-z])(?!\\s+h(?![A-Za-z]))", "\\tan"),
                        replacer("(?<![A-Za-z\\\\])sln(?![A-Za-z])", "\\sin"),
                        replacer("(?<![A-Za-z\\\\])c0s(?![A-Za-z])", "\\cos"),
                        replacer("(?<![A-Za-z\\\\])Iog(?![A-Za-z])", "\\log"))));

        rules.add(new CleaningRule("greek-escape", RuleGroup.GREEK_ESCAPES,
                "bare Greek letter names lost their backslash",
                text -> GREEK_WORD.matcher(text)
                        .replaceAll(match -> Matcher.quoteReplacement("\\" + match.group(1).toLowerCase(Locale.ROOT)))));

        rules.add(replacing("chi-to-x", RuleGroup.CHI_AS_X,
                "a handwritten or italic x is recognized as chi",
                "\\\\chi(?![A-Za-z])", "x"));

        rules.add(replacing("letter-o-to-zero", RuleGroup.DIGIT_LETTER_DISAMBIGUATION,
                "o next to digits is a zero",
                "(?<=\\d)[oO](?![A-Za-z])|(?<![A-Za-z\\\\])[oO](?=\\d)", "0"));

        rules.add(replacing("multiplication-symbols", RuleGroup.OPERATOR_NORMALIZATION,
                "times, dots and stars all mean multiplication",
                "\\\\(?:times|cdot|ast|star)(?![A-Za-z])|[×·∙∗⋅]", "*"));
        rules.add(new CleaningRule("letter-x-as-times", RuleGroup.OPERATOR_NORMALIZATION,
                "a spaced x between two numbers or two single letters is a times sign",
                chain(
                        replacer("(\\d)\\s+[xX]\\s+(?=\\d)", "$1*"),
                        replacer("(?<![A-Za-z\\\\])([a-wyzA-WYZ])\\s+x\\s+(?=[a-wyzA-WYZ](?![A-Za-z]))", "$1*"))));

        rules.add(repeating("digit-join", RuleGroup.DIGIT_JOINING,
                "digits of one number come back space separated",
                "(\\d)\\s+(\\d)", "$1$2", 3));
        rules.add(replacing("decimal-separator", RuleGroup.DIGIT_JOINING,
                "unspaced comma or colon, or a possibly spaced period, between digits is a decimal point",
                "(\\d)(?:[,:]|\\s*\\.\\s*)(\\d)", "$1.$2"));

        rules.add(new CleaningRule("function-escapes", RuleGroup.FUNCTION_NAMES,
                "function names lost their backslash or came back upper case",
                text -> FUNCTION_WORD.matcher(text)
                        .replaceAll(match -> Matcher.quoteReplacement("\\" + match.group(1).toLowerCase(Locale.ROOT)))));
        rules.add(new CleaningRule("fragmented-functions", RuleGroup.FUNCTION_NAMES,
                "function names read letter by letter",
                chain(MathVocabulary.FUNCTION_NAMES.stream()
                        .map(function -> fragmentReplacer(function))
                        .toList())));

        rules.add(replacing("ln-hallucination", RuleGroup.NATURAL_LOG,
                "lower-case l read as capital I",
                "(?<![A-Za-z\\\\])\\\\?In(?![A-Za-z])", Matcher.quoteReplacement("\\ln")));

        rules.add(new CleaningRule("integral-differential", RuleGroup.DIFFERENTIALS,
                "the differential after an integral is often dropped",
                CorrectionRuleTable::appendMissingDifferential));

        rules.add(new CleaningRule("limit-arrows", RuleGroup.LIMIT_NOTATION,
                "limit arrows come back as ASCII or in other arrow styles",
                chain(
                        replacer("\\s*(?:->|\\\\rightarrow|\\\\longrightarrow|\\\\Rightarrow|→)\\s*", " \\to "),
                        replacer("\\\\lim\\s*_\\s*", "\\lim_"))));

        rules.add(repeating("nested-parens", RuleGroup.NESTED_PARENTHESES,
                "parenthesis runs around one group are redundant",
                "\\(\\(([^()]*)\\)\\)", "($1)", 3));

        rules.add(replacing("function-brace-args", RuleGroup.FUNCTION_ARGUMENTS,
                "function arguments written as brace groups",
                "(\\\\(?:" + BRACE_ARGUMENT_FUNCTIONS + "))\\s*\\{([^{}]*)\\}", "$1($2)"));
        rules.add(new CleaningRule("braced-single-command", RuleGroup.FUNCTION_ARGUMENTS,
                "braces around a lone command are noise unless they are an argument",
                CorrectionRuleTable::unbraceSingleCommands));

        rules.add(new CleaningRule("whitespace-normalize", RuleGroup.FINAL_WHITESPACE,
                "collapse whitespace left behind by earlier rules",
                text -> WHITESPACE.matcher(text).replaceAll(" ").strip()));
        rules.add(replacing("command-space-before-delimiter", RuleGroup.FINAL_WHITESPACE,
                "a command binds directly to its argument",
                "(\\\\[A-Za-z]+) (?=[(\\[{])", "$1"));

        return rules;
    }

    private static String unwrapDecorations(String text) {
        String result = text;
        for (String wrapper : DECORATIVE_WRAPPERS) {
            result = BraceGroups.unwrap(result, wrapper, true);
        }
        return result;
    }

    static String bareBracesToParentheses(String text) {
        StringBuilder builder = new StringBuilder(text.replace("\\{", "(").replace("\\}", ")"));
        for (int i = 0; i < builder.length(); i++) {
            if (builder.charAt(i) != '{' || isAttached(builder, i)) {
                continue;
            }
            int close = BraceGroups.matchingBrace(builder.toString(), i);
            if (close > i) {
                builder.setCharAt(i, '(');
                builder.setCharAt(close, ')');
            }
        }
        return builder.toString();
    }

    /**
     * Whether the brace at {@code index} is a script, a command argument or a follow-on
     * argument such as the denominator of a fraction.
     */
    private static boolean isAttached(CharSequence text, int index) {
        int previous = index - 1;
        while (previous >= 0 && text.charAt(previous) == ' ') {
            previous--;
        }
        if (previous < 0) {
            return false;
        }
        char c = text.charAt(previous);
        if (c == '^' || c == '_' || c == '}' || c == ']') {
            return true;
        }
        if (!Character.isLetter(c)) {
            return false;
        }
        int start = previous;
        while (start > 0 && Character.isLetter(text.charAt(start - 1))) {
            start--;
        }
        return start > 0 && text.charAt(start - 1) == '\\';
    }

    static String appendMissingDifferential(String text) {
        int integral = text.lastIndexOf("\\int");
        if (integral < 0) {
            return text;
        }
        String tail = text.substring(integral + "\\int".length());
        if (DIFFERENTIAL.matcher(tail).find()) {
            return text;
        }
        String integrand = LEADING_BOUNDS.matcher(tail).replaceFirst("");
        Set<String> variables = new LinkedHashSet<>();
        Matcher letters = BARE_LETTER.matcher(integrand);
        while (letters.find()) {
            variables.add(letters.group(1));
        }
        if (variables.size() != 1) {
            return text;
        }
        return text.stripTrailing() + " d" + variables.iterator().next();
    }

    static String unbraceSingleCommands(String text) {
        Matcher matcher = BRACED_COMMAND.matcher(text);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            int previous = matcher.start() - 1;
            while (previous >= 0 && text.charAt(previous) == ' ') {
                previous--;
            }
            boolean argument = previous >= 0
                    && (Character.isLetter(text.charAt(previous)) || text.charAt(previous) == '}');
            String replacement = argument ? matcher.group() : matcher.group(1);
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private static CleaningRule fragmentRule(String name, RuleGroup group, String word) {
        return new CleaningRule(name, group, "'" + word + "' read letter by letter", fragmentReplacer(word));
    }

    private static UnaryOperator<String> fragmentReplacer(String word) {
        String spaced = word.chars()
                .mapToObj(c -> String.valueOf((char) c))
                .collect(Collectors.joining("\\s+"));
        return ignoreCaseReplacer("(?<![A-Za-z\\\\])" + spaced + "(?![A-Za-z])", "\\" + word);
    }

    private static UnaryOperator<String> replacer(String regex, String literal) {
        Pattern pattern = Pattern.compile(regex);
        String replacement = literal.indexOf('$') >= 0 ? literal : Matcher.quoteReplacement(literal);
        return text -> pattern.matcher(text).replaceAll(replacement);
    }

    private static UnaryOperator<String> ignoreCaseReplacer(String regex, String literal) {
        Pattern pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        String replacement = Matcher.quoteReplacement(literal);
        return text -> pattern.matcher(text).replaceAll(replacement);
    }

    @SafeVarargs
    private static UnaryOperator<String> chain(UnaryOperator<String>... steps) {
        return chain(List.of(steps));
    }

    private static UnaryOperator<String> chain(List<UnaryOperator<String>> steps) {
        return text -> {
            String current = text;
            for (UnaryOperator<String> step : steps) {
                current = step.apply(current);
            }
            return current;
        };
    }
}
