/**
 * Set Tree Library
 * Copyright (c) 2026 Set Tree Project.
 * All rights reserved.
 */

package com.settree.view;

import com.settree.tree.SetTree;
import com.settree.tree.UnmodifiableSetTree;

import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Positional access to a set tree. Root elements and subsets share one
 * index space in which the elements come first:
 *
 * <pre>
 *   {1,3,{},{2}}
 *    0 1 2  3
 * </pre>
 *
 * <p>The view reads through to the tree, so changes to the tree are visible
 * in the view.</p>
 *
 * @param <T> the type of elements
 */
public class IndexedSetView<T> {
    private final SetTree<T> tree;

    public IndexedSetView(SetTree<T> tree) {
        this.tree = checkNotNull(tree, "tree");
    }

    public static <T> IndexedSetView<T> of(SetTree<T> tree) {
        return new IndexedSetView<>(tree);
    }

    /**
     * Returns the tree being viewed.
     */
    public SetTree<T> tree() {
        return tree;
    }

    public int count() {
        return tree.count();
    }

    public int elementCount() {
        return tree.elementCount();
    }

    public int subtreeCount() {
        return tree.subtreeCount();
    }

    /**
     * Returns the element at the given position among the root elements.
     *
     * @throws IndexOutOfBoundsException if the index is not less than
     *         {@link #elementCount()}
     */
    public T elementAt(int index) {
        checkElementIndex(index, tree.elementCount());
        return tree.elementAt(index);
    }

    /**
     * Returns the subset at the given position among the subsets.
     *
     * @throws IndexOutOfBoundsException if the index is not less than
     *         {@link #subtreeCount()}
     */
    public SetTree<T> subtreeAt(int index) {
        checkElementIndex(index, tree.subtreeCount());
        return UnmodifiableSetTree.of(tree.subtreeAt(index));
    }

    /**
     * Returns the subset at the given position of the unified index space.
     *
     * @throws IndexOutOfBoundsException if the index does not denote a subset
     */
    public SetTree<T> subtreeAtUnified(int index) {
        checkElementIndex(index, tree.count());
        if (index < tree.elementCount()) {
            throw new IndexOutOfBoundsException(
                "index " + index + " denotes an element, subsets start at " + tree.elementCount());
        }
        return UnmodifiableSetTree.of(tree.subtreeAt(index - tree.elementCount()));
    }

    public boolean isElementIndex(int index) {
        return index >= 0 && index < tree.elementCount();
    }

    public boolean isSubtreeIndex(int index) {
        return index >= tree.elementCount() && index < tree.count();
    }

    /**
     * Returns the unified index of the element, or -1.
     */
    public int indexOf(T element) {
        return tree.indexOf(element);
    }

    /**
     * Returns the unified index of the subset, or -1.
     */
    public int indexOf(SetTree<T> subtree) {
        return tree.indexOf(subtree);
    }

    /**
     * Removes all elements and subsets from the tree.
     */
    public void clear() {
        tree.clear();
    }

    public String render() {
        return tree.render();
    }

    public String toString() {
        return tree.render();
    }
}
