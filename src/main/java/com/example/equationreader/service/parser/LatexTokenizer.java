package com.example.equationreader.service.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits LaTeX markup into numbers, single letters, commands and symbols. Escaped set braces
 * become parentheses and common Unicode operators are folded onto their ASCII form.
 */
final class LatexTokenizer {

    enum Kind {
        NUMBER,
        LETTER,
        COMMAND,
        SYMBOL
    }

    record Token(Kind kind, String text, int position) {
    }

    private LatexTokenizer() {
    }

    static List<Token> tokenize(String markup) throws ExpressionParseException {
        List<Token> tokens = new ArrayList<>();
        int length = markup.length();
        int i = 0;
        while (i < length) {
            char c = markup.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            if (isDigit(c) || (c == '.' && i + 1 < length && isDigit(markup.charAt(i + 1)))) {
                int start = i;
                while (i < length && isDigit(markup.charAt(i))) {
                    i++;
                }
                if (i + 1 < length && markup.charAt(i) == '.' && isDigit(markup.charAt(i + 1))) {
                    i++;
                    while (i < length && isDigit(markup.charAt(i))) {
                        i++;
                    }
                }
                tokens.add(new Token(Kind.NUMBER, markup.substring(start, i), start));
                continue;
            }
            if (isLetter(c)) {
                tokens.add(new Token(Kind.LETTER, String.valueOf(c), i));
                i++;
                continue;
            }
            if (c == '\\') {
                int start = i++;
                if (i >= length) {
                    throw new ExpressionParseException("Dangling backslash", start);
                }
                if (isLetter(markup.charAt(i))) {
                    while (i < length && isLetter(markup.charAt(i))) {
                        i++;
                    }
                    tokens.add(new Token(Kind.COMMAND, markup.substring(start + 1, i), start));
                } else {
                    char escaped = markup.charAt(i++);
                    switch (escaped) {
                        case '{' -> tokens.add(new Token(Kind.SYMBOL, "(", start));
                        case '}' -> tokens.add(new Token(Kind.SYMBOL, ")", start));
                        case '|' -> tokens.add(new Token(Kind.SYMBOL, "|", start));
                        default -> tokens.add(new Token(Kind.COMMAND, String.valueOf(escaped), start));
                    }
                }
                continue;
            }
            if (c == '*' && i + 1 < length && markup.charAt(i + 1) == '*') {
                tokens.add(new Token(Kind.SYMBOL, "**", i));
                i += 2;
                continue;
            }
            tokens.add(new Token(Kind.SYMBOL, foldSymbol(c), i));
            i++;
        }
        return tokens;
    }

    private static String foldSymbol(char c) {
        return switch (c) {
            case '×', '·', '⋅', '∗' -> "*";
            case '−', '–' -> "-";
            case '÷' -> "/";
            default -> String.valueOf(c);
        };
    }

    static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    static boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
