package com.example.equationreader.util;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;

/**
 * Nested-brace aware helpers for markup commands that take a braced argument.
 */
public final class BraceGroups {

    private BraceGroups() {
    }

    /**
     * Removes every {@code \command{...}} wrapper, keeping or dropping the wrapped content.
     * Commands that only share a prefix ({@code \text} vs {@code \textbf}) are left alone. A
     * wrapper whose closing brace is missing loses the command and its opening brace.
     */
    public static String unwrap(String text, String command, boolean keepContents) {
        String marker = "\\" + command;
        boolean[] removed = new boolean[text.length()];
        int[] closing = closingBraces(text);
        int cursor = 0;
        while (cursor < text.length()) {
            int found = text.indexOf(marker, cursor);
            if (found < 0) {
                break;
            }
            int afterMarker = found + marker.length();
            int brace = skipSpaces(text, afterMarker);
            boolean longerCommand = afterMarker < text.length() && Character.isLetter(text.charAt(afterMarker));
            if (longerCommand || brace >= text.length() || text.charAt(brace) != '{') {
                cursor = afterMarker;
                continue;
            }
            int close = closing[brace];
            if (close < 0 || keepContents) {
                // nested wrappers inside kept contents are found as the scan moves on
                mark(removed, found, brace + 1);
                if (close >= 0) {
                    removed[close] = true;
                }
                cursor = brace + 1;
            } else {
                mark(removed, found, close + 1);
                cursor = close + 1;
            }
        }
        StringBuilder result = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            if (!removed[i]) {
                result.append(text.charAt(i));
            }
        }
        return result.toString();
    }

    /**
     * Closing index for every opening brace in one pass, -1 where unclosed. Agrees with
     * {@link #matchingBrace(String, int)} at each opening brace.
     */
    private static int[] closingBraces(String text) {
        int[] closing = new int[text.length()];
        Arrays.fill(closing, -1);
        Deque<Integer> open = new ArrayDeque<>();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == '{') {
                open.push(i);
            } else if (c == '}' && !open.isEmpty()) {
                closing[open.pop()] = i;
            }
        }
        return closing;
    }

    private static void mark(boolean[] removed, int from, int to) {
        for (int i = from; i < to; i++) {
            removed[i] = true;
        }
    }

    /**
     * Index of the brace closing the one at {@code open}, or -1. Escaped braces are skipped.
     */
    public static int matchingBrace(String text, int open) {
        int depth = 0;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private static int skipSpaces(String text, int from) {
        int index = from;
        while (index < text.length() && text.charAt(index) == ' ') {
            index++;
        }
        return index;
    }
}
