package com.example.equationreader.util;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * First repair step applied to recognizer output: drops environment wrappers, keeps the most
 * equation-like row of multi-row output and strips styling commands and known hallucinated
 * fragments. Never throws; blank input yields an empty string.
 */
public final class StructuralCleaner {

    private static final Pattern MATH_DELIMITERS = Pattern.compile("\\$\\$?|\\\\(?:displaystyle|textstyle)(?![A-Za-z])");
    private static final Pattern ARRAY_BEGIN = Pattern.compile("\\\\begin\\{array\\}\\s*(?:\\{[^{}]*\\})?");
    private static final Pattern ENVIRONMENT_BEGIN =
            Pattern.compile("\\\\begin\\{(?:aligned|gathered|split|align\\*?|equation\\*?|eqnarray\\*?)\\}");
    private static final Pattern ENVIRONMENT_END = Pattern.compile("\\\\end\\{[^{}]*\\}");
    private static final Pattern ROW_BREAK = Pattern.compile("\\\\\\\\(?:\\[[^\\]]*\\])?");
    private static final Pattern EQUALITY_LIKE = Pattern.compile("=|\\\\(?:cong|approx|simeq|equiv)(?![A-Za-z])");
    private static final List<String> HALLUCINATIONS = List.of("\\mathrm{Tie", "\\mathrm{The", "\\text{Tie");
    private static final Pattern EMPTY_WRAPPER =
            Pattern.compile("\\{\\{\\\\mathrm\\{\\s*\\}\\}\\}|\\\\(?:mathrm|text|mathbf|mathsf|operatorname)\\{\\s*\\}");
    private static final Pattern CONGRUENCE = Pattern.compile("\\\\(?:cong|simeq|approx|sim|equiv)(?![A-Za-z])");
    private static final Pattern BRACED_SUBSCRIPT = Pattern.compile("_\\{([a-zA-Z0-9]+)\\}");
    private static final Pattern STAR_SUPERSCRIPT =
            Pattern.compile("\\^\\{\\s*(?:\\*|\\\\ast|\\\\star)\\s*\\}|\\^\\*|\\^\\\\(?:ast|star)(?![A-Za-z])");
    private static final List<String> KEPT_WRAPPERS = List.of("mathbf", "mathrm", "mathsf", "bold", "boldsymbol", "textbf");
    private static final List<String> DISCARDED_WRAPPERS = List.of("text", "textrm", "mbox");
    private static final Pattern SIZED_DELIMITER =
            Pattern.compile("\\\\(?:left|right|bigl|bigr|Bigl|Bigr)\\s*([()\\[\\]|])");
    private static final Pattern INVISIBLE_DELIMITER = Pattern.compile("\\\\(?:left|right)\\s*\\.");

    private StructuralCleaner() {
    }

    public static String clean(String markup) {
        if (markup == null || markup.isBlank()) {
            return "";
        }
        String cleaned = MATH_DELIMITERS.matcher(markup.strip()).replaceAll("");

        cleaned = ARRAY_BEGIN.matcher(cleaned).replaceAll("");
        cleaned = ENVIRONMENT_BEGIN.matcher(cleaned).replaceAll("");
        cleaned = ENVIRONMENT_END.matcher(cleaned).replaceAll("");

        if (cleaned.contains("\\\\")) {
            cleaned = bestRow(cleaned);
        }
        cleaned = cleaned.replace("&", "");

        for (String hallucination : HALLUCINATIONS) {
            cleaned = cleaned.replace(hallucination, "");
        }
        cleaned = EMPTY_WRAPPER.matcher(cleaned).replaceAll("");
        cleaned = CONGRUENCE.matcher(cleaned).replaceAll("=");

        // subscripts become \mathit identifiers so p_{h} stays one symbol
        cleaned = BRACED_SUBSCRIPT.matcher(cleaned).replaceAll("_{\\\\mathit{$1}}");
        cleaned = STAR_SUPERSCRIPT.matcher(cleaned).replaceAll("_{\\\\mathit{star}}");

        for (String wrapper : KEPT_WRAPPERS) {
            cleaned = BraceGroups.unwrap(cleaned, wrapper, true);
        }
        for (String wrapper : DISCARDED_WRAPPERS) {
            cleaned = BraceGroups.unwrap(cleaned, wrapper, false);
        }

        cleaned = SIZED_DELIMITER.matcher(cleaned).replaceAll("$1");
        cleaned = INVISIBLE_DELIMITER.matcher(cleaned).replaceAll("");

        return stripDoubledOuterBraces(cleaned.strip()).strip();
    }

    static String bestRow(String text) {
        List<String> rows = Arrays.stream(ROW_BREAK.split(text))
                .map(String::strip)
                .filter(row -> !row.isEmpty())
                .toList();
        if (rows.isEmpty()) {
            return "";
        }
        String best = rows.get(0);
        int bestScore = Integer.MIN_VALUE;
        for (String row : rows) {
            int score = scoreRow(row);
            if (score > bestScore) {
                bestScore = score;
                best = row;
            }
        }
        return best;
    }

    static int scoreRow(String row) {
        int score = 0;
        if (EQUALITY_LIKE.matcher(row).find()) {
            score += 5;
        }
        if ((row.contains("\\mathrm{") || row.contains("\\text{")) && row.length() < 20) {
            score -= 5;
        }
        if (row.length() < 3) {
            score -= 5;
        }
        return score;
    }

    private static String stripDoubledOuterBraces(String text) {
        int length = text.length();
        if (length >= 4 && text.startsWith("{{") && text.endsWith("}}")
                && BraceGroups.matchingBrace(text, 0) == length - 1
                && BraceGroups.matchingBrace(text, 1) == length - 2) {
            return text.substring(2, length - 2);
        }
        return text;
    }
}
