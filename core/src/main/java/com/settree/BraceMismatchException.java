/**
 * Set Tree Library
 * Copyright (c) 2026 Set Tree Project.
 * All rights reserved.
 */

package com.settree;

import com.settree.parser.MissingBrace;

/**
 * Thrown when the braces of a set expression are not balanced.
 */
public class BraceMismatchException extends SetsException {
    private static final long serialVersionUID = -1532280477315402386L;

    private final MissingBrace missingBrace;
    private final String expression;
    private final int position;

    public BraceMismatchException(String message, MissingBrace missingBrace, String expression, int position) {
        super(message, pinpoint(expression, position));
        this.missingBrace = missingBrace;
        this.expression = expression;
        this.position = position;
    }

    /**
     * Returns which brace is missing.
     */
    public MissingBrace getMissingBrace() {
        return missingBrace;
    }

    /**
     * Returns the expression, or the fragment of it, that failed.
     */
    public String getExpression() {
        return expression;
    }

    /**
     * Returns the offset of the offending character in the expression, or -1
     * if the error is not bound to a single character.
     */
    public int getPosition() {
        return position;
    }

    private static String pinpoint(String expression, int position) {
        if (position < 0 || position > expression.length()) {
            return expression;
        }

        StringBuilder buf = new StringBuilder(expression).append('\n');
        for (int i = 0; i < position; i++) {
            buf.append(' ');
        }
        return buf.append('^').toString();
    }
}
