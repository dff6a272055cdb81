/**
 * Set Tree Library
 * Copyright (c) 2026 Set Tree Project.
 * All rights reserved.
 */

package com.settree.algebra;

import com.settree.tree.SetTree;

/**
 * A mathematical set whose members are elements and nested sets.
 *
 * @param <T> the type of elements
 */
public interface StructuredSet<T> {
    /**
     * Returns the number of elements and subsets in this set.
     */
    int cardinality();

    boolean contains(T element);

    boolean contains(SetTree<T> subset);

    boolean addElement(T element);

    /**
     * Adds a copy of the given tree as a subset.
     */
    boolean addSubset(SetTree<T> subset);

    /**
     * Parses the expression with this set's factory and adds the result as
     * a subset.
     */
    boolean addSubsetAsString(String expression);

    boolean removeElement(T element);

    boolean removeSubset(SetTree<T> subset);

    void clear();

    /**
     * Returns {@code true} if this set is one of the subsets of the given set.
     */
    boolean isElementOf(StructuredSet<T> other);

    /**
     * Tells whether every member of this set is a member of the given set.
     */
    SetResultType isSubsetOf(StructuredSet<T> other);

    /**
     * Returns a new set holding the members of both sets.
     */
    StructuredSet<T> mergeWith(StructuredSet<T> other);

    /**
     * Returns a new set holding the members of this set that are not members
     * of the given set.
     */
    StructuredSet<T> without(StructuredSet<T> other);

    Iterable<T> elements();

    Iterable<SetTree<T>> subsets();

    /**
     * Returns the tree that holds the members of this set.
     */
    SetTree<T> tree();

    SetFactory<T> factory();

    /**
     * Returns the canonical form of this set.
     */
    String render();
}
