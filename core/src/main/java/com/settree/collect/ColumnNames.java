/**
 * Set Tree Library
 * Copyright (c) 2026 Set Tree Project.
 * All rights reserved.
 */

package com.settree.collect;

import com.google.common.base.CharMatcher;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Generates spreadsheet column style names: {@code A, B, ..., Z, AA, AB, ...,
 * AZ, BA, ..., ZZ, AAA, ...}.
 */
public final class ColumnNames {
    private ColumnNames() {}

    private static final CharMatcher LETTERS = CharMatcher.inRange('A', 'Z');

    /**
     * The first name of the sequence.
     */
    public static final String FIRST = "A";

    /**
     * Returns {@code true} if the given string is a valid name in the sequence.
     */
    public static boolean isValid(String name) {
        return name != null && !name.isEmpty() && LETTERS.matchesAllOf(name);
    }

    /**
     * Returns the name following the given one.
     *
     * @throws IllegalArgumentException if the name is not made of capital letters
     */
    public static String next(String name) {
        checkNotNull(name, "name");
        checkArgument(isValid(name), "Invalid column name: '%s'", name);

        char[] chars = name.toCharArray();
        int i = chars.length - 1;
        while (i >= 0 && chars[i] == 'Z') {
            chars[i--] = 'A';
        }
        if (i < 0) {
            // ZZ..Z rolls over to one more letter
            return "A" + new String(chars);
        }
        chars[i]++;
        return new String(chars);
    }

    /**
     * Returns the name at the given zero-based position: 0 is {@code A},
     * 25 is {@code Z}, 26 is {@code AA}.
     */
    public static String nameAt(int index) {
        checkArgument(index >= 0, "negative index: %s", index);
        StringBuilder buf = new StringBuilder();
        int n = index + 1;
        while (n > 0) {
            n--;
            buf.append((char)('A' + n % 26));
            n /= 26;
        }
        return buf.reverse().toString();
    }
}
