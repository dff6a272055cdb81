/**
 * Set Tree Library
 * Copyright (c) 2026 Set Tree Project.
 * All rights reserved.
 */

package com.settree.parser;

import java.util.ArrayDeque;
import java.util.Deque;

import com.settree.BraceMismatchException;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Checks the braces of set expressions.
 */
public final class BraceEvaluator {
    private BraceEvaluator() {}

    /**
     * Returns {@code true} if the expression is a single brace group: it
     * starts with an opening brace whose matching closing brace is the last
     * character, and all braces in between are balanced.
     */
    public static boolean isSingleGroup(String expression) {
        checkNotNull(expression);
        return expression.startsWith("{") && matchingBrace(expression, 0) == expression.length() - 1;
    }

    /**
     * Returns {@code true} if the braces of the expression are correct.
     *
     * @see #check(String)
     */
    public static boolean areBracesCorrect(String expression) {
        try {
            check(expression);
            return true;
        } catch (BraceMismatchException ex) {
            return false;
        }
    }

    /**
     * Verifies that the expression is enclosed in a pair of braces and that
     * every brace inside it is matched.
     *
     * @throws BraceMismatchException if the braces are not correct
     */
    public static void check(String expression) {
        checkNotNull(expression);

        boolean opening = expression.startsWith("{");
        boolean closing = expression.endsWith("}") && expression.length() > 1;
        if (!opening && !closing) {
            throw new BraceMismatchException("Missing the outer braces.",
                MissingBrace.BOTH, expression, -1);
        }
        if (!opening) {
            throw new BraceMismatchException("Missing an opening brace at the start of the expression.",
                MissingBrace.OPENING, expression, 0);
        }
        if (!closing) {
            throw new BraceMismatchException("Missing a closing brace at the end of the expression.",
                MissingBrace.CLOSING, expression, expression.length());
        }

        Deque<Integer> open = new ArrayDeque<>();
        for (int i = 0; i < expression.length(); i++) {
            char ch = expression.charAt(i);
            if (ch == '{') {
                open.push(i);
            } else if (ch == '}') {
                if (open.isEmpty()) {
                    throw new BraceMismatchException("Encountered a closing brace without an opening brace.",
                        MissingBrace.OPENING, expression, i);
                }
                open.pop();
                if (open.isEmpty() && i != expression.length() - 1) {
                    // e.g. {1,2},{3,4}
                    throw new BraceMismatchException("The outer set is closed before the end of the expression.",
                        MissingBrace.OPENING, expression, i);
                }
            }
        }

        if (!open.isEmpty()) {
            throw new BraceMismatchException(
                "Encountered " + open.size() + " opening brace(s) without closing braces.",
                MissingBrace.CLOSING, expression, open.peek());
        }
    }

    /**
     * Returns the position of the brace that closes the opening brace at the
     * given position, or -1 if it is never closed.
     */
    static int matchingBrace(String expression, int start) {
        int depth = 0;
        for (int i = start; i < expression.length(); i++) {
            char ch = expression.charAt(i);
            if (ch == '{') {
                depth++;
            } else if (ch == '}') {
                if (--depth == 0)
                    return i;
            }
        }
        return -1;
    }
}
