/**
 * Set Tree Library
 * Copyright (c) 2026 Set Tree Project.
 * All rights reserved.
 */

package com.settree.parser;

/**
 * Tells which brace is missing from a malformed set expression.
 */
public enum MissingBrace {
    /**
     * The braces are balanced but enclose only part of an element or leave
     * text outside the outermost set.
     */
    NONE,

    /**
     * A closing brace has no matching opening brace.
     */
    OPENING,

    /**
     * An opening brace has no matching closing brace.
     */
    CLOSING,

    /**
     * The expression has neither the opening nor the closing outer brace.
     */
    BOTH
}
