/**
 * Set Tree Library
 * Copyright (c) 2026 Set Tree Project.
 * All rights reserved.
 */

package com.settree.tree;

import java.util.Comparator;

import com.google.common.collect.Iterables;

import com.settree.config.SetsConfiguration;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A read-only view of a set tree. Query operations read through to the
 * backing tree and return read-only views of its subsets; modification
 * operations throw {@link UnsupportedOperationException}. {@link #copy()}
 * returns a modifiable deep copy.
 *
 * @param <T> the type of elements
 */
public final class UnmodifiableSetTree<T> implements SetTree<T> {
    private final SetTree<T> tree;

    private UnmodifiableSetTree(SetTree<T> tree) {
        this.tree = tree;
    }

    /**
     * Returns a read-only view of the given tree.
     */
    public static <T> SetTree<T> of(SetTree<T> tree) {
        checkNotNull(tree, "tree");
        return tree instanceof UnmodifiableSetTree ? tree : new UnmodifiableSetTree<>(tree);
    }

    // Query Operations

    @Override
    public int count() {
        return tree.count();
    }

    @Override
    public int elementCount() {
        return tree.elementCount();
    }

    @Override
    public int subtreeCount() {
        return tree.subtreeCount();
    }

    @Override
    public T elementAt(int index) {
        return tree.elementAt(index);
    }

    @Override
    public SetTree<T> subtreeAt(int index) {
        return of(tree.subtreeAt(index));
    }

    @Override
    public int indexOf(T element) {
        return tree.indexOf(element);
    }

    @Override
    public int indexOf(SetTree<T> subtree) {
        return tree.indexOf(subtree);
    }

    @Override
    public boolean containsElement(T element) {
        return tree.containsElement(element);
    }

    @Override
    public boolean containsSubtree(SetTree<T> subtree) {
        return tree.containsSubtree(subtree);
    }

    @Override
    public Iterable<T> elements() {
        return Iterables.unmodifiableIterable(tree.elements());
    }

    @Override
    public Iterable<SetTree<T>> subtrees() {
        return Iterables.transform(tree.subtrees(), UnmodifiableSetTree::of);
    }

    @Override
    public SetTreeInfo info() {
        return tree.info();
    }

    @Override
    public SetsConfiguration configuration() {
        return tree.configuration();
    }

    @Override
    public Comparator<? super T> elementComparator() {
        return tree.elementComparator();
    }

    // Modification Operations

    @Override
    public boolean addElement(T element) {
        throw new UnsupportedOperationException();
    }

    @Override
    public boolean addSubtree(SetTree<T> subtree) {
        throw new UnsupportedOperationException();
    }

    @Override
    public void addElements(Iterable<? extends T> elements) {
        throw new UnsupportedOperationException();
    }

    @Override
    public void addSubtrees(Iterable<? extends SetTree<T>> subtrees) {
        throw new UnsupportedOperationException();
    }

    @Override
    public boolean removeElement(T element) {
        throw new UnsupportedOperationException();
    }

    @Override
    public boolean removeSubtree(SetTree<T> subtree) {
        throw new UnsupportedOperationException();
    }

    @Override
    public void clear() {
        throw new UnsupportedOperationException();
    }

    // Construction

    @Override
    public SetTree<T> copy() {
        return tree.copy();
    }

    @Override
    public SetTree<T> newEmpty() {
        return tree.newEmpty();
    }

    @Override
    public String render() {
        return tree.render();
    }

    @Override
    public boolean equals(Object obj) {
        return obj == this || tree.equals(obj);
    }

    @Override
    public int hashCode() {
        return tree.hashCode();
    }

    public String toString() {
        return tree.toString();
    }
}
