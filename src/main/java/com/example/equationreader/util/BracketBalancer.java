package com.example.equationreader.util;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Stack based repair of unmatched {@code ()}, {@code []} and {@code {}}. Orphan closers are
 * deleted, then closers for openers still pending at the end are appended innermost first.
 * The result always has equal open and close counts for each bracket kind.
 */
public final class BracketBalancer {

    private static final String OPENERS = "([{";
    private static final String CLOSERS = ")]}";

    private BracketBalancer() {
    }

    public static String balance(String text) {
        if (text == null || text.isEmpty()) {
            return text == null ? "" : text;
        }
        String pruned = removeOrphanClosers(text);
        return appendMissingClosers(pruned);
    }

    private static String removeOrphanClosers(String text) {
        Deque<Character> stack = new ArrayDeque<>();
        List<Integer> orphans = new ArrayList<>();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (OPENERS.indexOf(c) >= 0) {
                stack.push(c);
            } else if (CLOSERS.indexOf(c) >= 0) {
                if (!stack.isEmpty() && stack.peek() == openerFor(c)) {
                    stack.pop();
                } else {
                    orphans.add(i);
                }
            }
        }
        if (orphans.isEmpty()) {
            return text;
        }
        StringBuilder builder = new StringBuilder(text);
        for (int i = orphans.size() - 1; i >= 0; i--) {
            builder.deleteCharAt(orphans.get(i));
        }
        return builder.toString();
    }

    private static String appendMissingClosers(String text) {
        Deque<Character> stack = new ArrayDeque<>();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (OPENERS.indexOf(c) >= 0) {
                stack.push(c);
            } else if (CLOSERS.indexOf(c) >= 0 && !stack.isEmpty() && stack.peek() == openerFor(c)) {
                stack.pop();
            }
        }
        if (stack.isEmpty()) {
            return text;
        }
        StringBuilder builder = new StringBuilder(text);
        while (!stack.isEmpty()) {
            builder.append(closerFor(stack.pop()));
        }
        return builder.toString();
    }

    private static char openerFor(char closer) {
        return OPENERS.charAt(CLOSERS.indexOf(closer));
    }

    private static char closerFor(char opener) {
        return CLOSERS.charAt(OPENERS.indexOf(opener));
    }
}
