/**
 * Set Tree Library
 * Copyright (c) 2026 Set Tree Project.
 * All rights reserved.
 */

package com.settree.algebra;

/**
 * The relation of one set to another.
 *
 * @see StructuredSet#isSubsetOf(StructuredSet)
 */
public enum SetResultType {
    /** Both sets have the same elements and subsets. */
    SAME_SET,

    /** Every member is in the other set, which has further members. */
    PROPER_SUBSET,

    NOT_A_SUBSET;

    /**
     * Returns {@code true} for {@link #SAME_SET} and {@link #PROPER_SUBSET}.
     */
    public boolean isSubset() {
        return this != NOT_A_SUBSET;
    }
}
