package com.example.equationreader.util;

/**
 * Heuristic confidence over cleaned markup. It looks only at the text, never at what the
 * parsers made of it; the validation outcome is folded in afterwards.
 */
public final class ConfidenceEstimator {

    static final double BASE_SCORE = 0.9;
    static final double VALIDATED_BONUS = 0.1;
    static final double UNVALIDATED_PENALTY = 0.15;

    private ConfidenceEstimator() {
    }

    public static double estimate(String text) {
        String value = text == null ? "" : text;
        double score = BASE_SCORE;
        if (value.length() < 2) {
            score -= 0.3;
        }
        if (value.length() > 200) {
            score -= 0.2;
        }
        if (!value.isEmpty() && (double) countNonAscii(value) / value.length() > 0.3) {
            score -= 0.2;
        }
        if (count(value, '{') != count(value, '}')) {
            score -= 0.3;
        }
        if (count(value, '(') != count(value, ')')) {
            score -= 0.2;
        }
        return clamp(score);
    }

    public static double adjustForValidation(double base, boolean validated) {
        return clamp(validated ? base + VALIDATED_BONUS : base - UNVALIDATED_PENALTY);
    }

    public static double round(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }

    private static double clamp(double score) {
        return Math.max(0.0, Math.min(1.0, score));
    }

    private static long countNonAscii(String value) {
        return value.chars().filter(c -> c > 127).count();
    }

    private static long count(String value, char target) {
        return value.chars().filter(c -> c == target).count();
    }
}
