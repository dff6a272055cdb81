/**
 * Set Tree Library
 * Copyright (c) 2026 Set Tree Project.
 * All rights reserved.
 */

package com.settree.algebra;

/**
 * Creates sets of one kind. Every {@link StructuredSet} carries the factory
 * that builds the results of its operations.
 *
 * @param <T> the type of elements
 */
public interface SetFactory<T> {
    /**
     * Returns a new empty set.
     */
    StructuredSet<T> newSet();

    /**
     * Returns a new set parsed from the given set expression.
     *
     * @throws com.settree.SetsException if the expression is malformed
     */
    StructuredSet<T> newSet(String expression);
}
