/**
 * Set Tree Library
 * Copyright (c) 2026 Set Tree Project.
 * All rights reserved.
 */

package com.settree.tree;

import java.util.Comparator;

import com.settree.config.SetsConfiguration;

/**
 * <p>The canonical form of a set: a sorted collection of unique root elements
 * and a sorted collection of unique subsets, each of which is itself a set
 * tree. Trees are ordered among themselves by {@link SetTreeOrdering}.</p>
 *
 * <p>Positions in a tree form a single index space in which all root
 * elements come first, followed by all subsets.</p>
 *
 * <p>A tree owns its subsets. The subsets returned by {@link #subtreeAt(int)}
 * and {@link #subtrees()} are read-only views; use {@link #copy()} to get a
 * modifiable tree.</p>
 *
 * @param <T> the type of elements
 */
public interface SetTree<T> extends Comparable<SetTree<T>> {
    // Query Operations

    /**
     * Returns the number of root elements plus the number of subsets.
     */
    int count();

    /**
     * Returns the number of root elements.
     */
    int elementCount();

    /**
     * Returns the number of subsets.
     */
    int subtreeCount();

    /**
     * Returns the root element at the given position.
     *
     * @throws IndexOutOfBoundsException if the index is not in {@code [0, elementCount())}
     */
    T elementAt(int index);

    /**
     * Returns the subset at the given position among the subsets.
     *
     * @throws IndexOutOfBoundsException if the index is not in {@code [0, subtreeCount())}
     */
    SetTree<T> subtreeAt(int index);

    /**
     * Returns the position of a root element, or -1 if it is not present.
     *
     * @throws NullPointerException if the element is null
     */
    int indexOf(T element);

    /**
     * Returns the position of a subset, offset by the number of root elements,
     * or -1 if it is not present.
     *
     * @throws NullPointerException if the subset is null
     */
    int indexOf(SetTree<T> subtree);

    boolean containsElement(T element);

    boolean containsSubtree(SetTree<T> subtree);

    /**
     * Returns a view of the root elements in ascending order.
     */
    Iterable<T> elements();

    /**
     * Returns a view of the subsets in ascending order.
     */
    Iterable<SetTree<T>> subtrees();

    /**
     * Returns the diagnostics recorded while this tree was built.
     */
    SetTreeInfo info();

    /**
     * Returns the configuration used to render this tree.
     */
    SetsConfiguration configuration();

    /**
     * Returns the comparator ordering the root elements.
     */
    Comparator<? super T> elementComparator();

    // Modification Operations

    /**
     * Adds a root element unless an equal element is already present.
     *
     * @return {@code true} if the element was added
     * @throws NullPointerException if the element is null
     */
    boolean addElement(T element);

    /**
     * Adds a copy of the given tree as a subset unless an equal subset is
     * already present.
     *
     * @return {@code true} if the subset was added
     * @throws NullPointerException if the subset is null
     */
    boolean addSubtree(SetTree<T> subtree);

    /**
     * Adds all given root elements. Nothing is added if any element is null.
     *
     * @throws NullPointerException if the iterable or any element is null
     */
    void addElements(Iterable<? extends T> elements);

    /**
     * Adds copies of all given subsets. Nothing is added if any subset is
     * null or is this tree.
     *
     * @throws NullPointerException if the iterable or any subset is null
     * @throws IllegalArgumentException if any subset is this tree
     */
    void addSubtrees(Iterable<? extends SetTree<T>> subtrees);

    boolean removeElement(T element);

    boolean removeSubtree(SetTree<T> subtree);

    /**
     * Removes all root elements and subsets.
     */
    void clear();

    // Construction

    /**
     * Returns a deep copy of this tree. The copy shares no subsets with
     * this tree.
     */
    SetTree<T> copy();

    /**
     * Returns a new empty tree with the same configuration and element order.
     */
    SetTree<T> newEmpty();

    // Rendering

    /**
     * Returns the canonical string form of this tree: the root elements and
     * then the subsets, both in ascending order, separated by the row
     * terminator and enclosed in braces.
     */
    String render();

    /**
     * Compares trees by {@link SetTreeOrdering}.
     */
    @Override
    default int compareTo(SetTree<T> other) {
        return SetTreeOrdering.compare(this, other);
    }
}
