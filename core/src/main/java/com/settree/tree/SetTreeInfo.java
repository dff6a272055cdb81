/**
 * Set Tree Library
 * Copyright (c) 2026 Set Tree Project.
 * All rights reserved.
 */

package com.settree.tree;

import java.io.Serializable;

import com.google.common.base.MoreObjects;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Diagnostics about a set tree: whether it is empty and how many empty
 * elements were met while it was parsed. Diagnostics take no part in the
 * comparison of trees.
 */
public final class SetTreeInfo implements Serializable {
    private static final long serialVersionUID = 2740815153964215917L;

    private final boolean empty;
    private final int nullElementCount;

    public SetTreeInfo(boolean empty, int nullElementCount) {
        checkArgument(nullElementCount >= 0, "negative null element count: %s", nullElementCount);
        this.empty = empty;
        this.nullElementCount = nullElementCount;
    }

    /**
     * Returns {@code true} if the tree had neither root elements nor subsets.
     */
    public boolean isEmpty() {
        return empty;
    }

    /**
     * Returns {@code true} if empty elements were met while parsing the tree.
     */
    public boolean hasNullElements() {
        return nullElementCount > 0;
    }

    public int getNullElementCount() {
        return nullElementCount;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof SetTreeInfo))
            return false;
        SetTreeInfo other = (SetTreeInfo)obj;
        return empty == other.empty && nullElementCount == other.nullElementCount;
    }

    @Override
    public int hashCode() {
        return 31 * Boolean.hashCode(empty) + nullElementCount;
    }

    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("empty", empty)
            .add("hasNullElements", hasNullElements())
            .add("nullElementCount", nullElementCount)
            .toString();
    }
}
