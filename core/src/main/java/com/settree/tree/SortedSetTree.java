/**
 * Set Tree Library
 * Copyright (c) 2026 Set Tree Project.
 * All rights reserved.
 */

package com.settree.tree;

import java.util.Comparator;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;

import com.settree.collect.IndexedRedBlackTree;
import com.settree.collect.SortedCollection;
import com.settree.config.SetsConfiguration;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A set tree whose root elements and subsets are kept in
 * {@link IndexedRedBlackTree}s, so that positional access, lookup and
 * modification all take logarithmic time.
 *
 * <p>This class is not thread-safe.</p>
 *
 * @param <T> the type of elements
 */
public class SortedSetTree<T> implements SetTree<T> {
    private final SetsConfiguration configuration;
    private final Comparator<? super T> elementComparator;
    private final SortedCollection<T> elements;
    private final SortedCollection<SetTree<T>> subsets;
    private int nullElementCount;

    /**
     * Construct an empty tree whose elements are sorted according to their
     * natural ordering.
     */
    public static <T extends Comparable<? super T>> SortedSetTree<T> create(SetsConfiguration configuration) {
        return new SortedSetTree<>(configuration, Comparator.naturalOrder());
    }

    /**
     * Construct an empty tree.
     *
     * @param configuration the configuration used to render the tree
     * @param elementComparator the comparator that orders the root elements
     * @throws NullPointerException if any argument is null
     */
    public SortedSetTree(SetsConfiguration configuration, Comparator<? super T> elementComparator) {
        this.configuration = checkNotNull(configuration, "configuration");
        this.elementComparator = checkNotNull(elementComparator, "elementComparator");
        this.elements = new IndexedRedBlackTree<>(elementComparator);
        this.subsets = new IndexedRedBlackTree<>(SetTreeOrdering.ordering());
    }

    /**
     * Construct a tree holding the given root elements.
     */
    public SortedSetTree(SetsConfiguration configuration, Comparator<? super T> elementComparator,
                         Iterable<? extends T> elements) {
        this(configuration, elementComparator);
        addElements(elements);
    }

    // Query Operations

    @Override
    public int count() {
        return elements.size() + subsets.size();
    }

    @Override
    public int elementCount() {
        return elements.size();
    }

    @Override
    public int subtreeCount() {
        return subsets.size();
    }

    @Override
    public T elementAt(int index) {
        return elements.get(index);
    }

    @Override
    public SetTree<T> subtreeAt(int index) {
        return UnmodifiableSetTree.of(subsets.get(index));
    }

    @Override
    public int indexOf(T element) {
        return elements.indexOf(checkNotNull(element, "element"));
    }

    @Override
    public int indexOf(SetTree<T> subtree) {
        int index = subsets.indexOf(checkNotNull(subtree, "subtree"));
        return index < 0 ? -1 : elements.size() + index;
    }

    @Override
    public boolean containsElement(T element) {
        return elements.contains(checkNotNull(element, "element"));
    }

    @Override
    public boolean containsSubtree(SetTree<T> subtree) {
        return subsets.contains(checkNotNull(subtree, "subtree"));
    }

    @Override
    public Iterable<T> elements() {
        return Iterables.unmodifiableIterable(elements);
    }

    @Override
    public Iterable<SetTree<T>> subtrees() {
        return Iterables.transform(Iterables.unmodifiableIterable(subsets), UnmodifiableSetTree::of);
    }

    @Override
    public SetTreeInfo info() {
        return new SetTreeInfo(count() == 0, nullElementCount);
    }

    @Override
    public SetsConfiguration configuration() {
        return configuration;
    }

    @Override
    public Comparator<? super T> elementComparator() {
        return elementComparator;
    }

    // Modification Operations

    @Override
    public boolean addElement(T element) {
        return elements.addIfAbsent(checkNotNull(element, "element"));
    }

    @Override
    public boolean addSubtree(SetTree<T> subtree) {
        checkNotNull(subtree, "subtree");
        checkArgument(subtree != this, "A set tree cannot be a subset of itself");
        if (subsets.contains(subtree))
            return false;
        return subsets.addIfAbsent(subtree.copy());
    }

    @Override
    public void addElements(Iterable<? extends T> elements) {
        // rejects null elements before anything is added
        ImmutableList<T> all = ImmutableList.copyOf(checkNotNull(elements, "elements"));
        this.elements.addAll(all);
    }

    @Override
    public void addSubtrees(Iterable<? extends SetTree<T>> subtrees) {
        ImmutableList<SetTree<T>> all = ImmutableList.copyOf(checkNotNull(subtrees, "subtrees"));
        for (SetTree<T> t : all) {
            checkArgument(t != this, "A set tree cannot be a subset of itself");
        }
        for (SetTree<T> t : all) {
            addSubtree(t);
        }
    }

    @Override
    public boolean removeElement(T element) {
        return elements.remove(checkNotNull(element, "element"));
    }

    @Override
    public boolean removeSubtree(SetTree<T> subtree) {
        return subsets.remove(checkNotNull(subtree, "subtree"));
    }

    @Override
    public void clear() {
        elements.clear();
        subsets.clear();
        nullElementCount = 0;
    }

    /**
     * Records the number of empty elements met while parsing this tree.
     */
    public void recordNullElements(int count) {
        checkArgument(count >= 0, "negative count: %s", count);
        nullElementCount = count;
    }

    // Construction

    @Override
    public SortedSetTree<T> copy() {
        SortedSetTree<T> t = newEmpty();
        t.elements.addAll(elements);
        for (SetTree<T> s : subsets) {
            t.subsets.addIfAbsent(s.copy());
        }
        t.nullElementCount = nullElementCount;
        return t;
    }

    @Override
    public SortedSetTree<T> newEmpty() {
        return new SortedSetTree<>(configuration, elementComparator);
    }

    // Rendering

    @Override
    public String render() {
        StringBuilder buf = new StringBuilder();
        render(this, configuration.getRowTerminator(), buf);
        return buf.toString();
    }

    private static <T> void render(SetTree<T> tree, String delimiter, StringBuilder buf) {
        buf.append('{');
        boolean first = true;
        for (T e : tree.elements()) {
            if (!first)
                buf.append(delimiter);
            buf.append(e);
            first = false;
        }
        for (SetTree<T> s : tree.subtrees()) {
            if (!first)
                buf.append(delimiter);
            render(s, delimiter, buf);
            first = false;
        }
        buf.append('}');
    }

    @Override
    @SuppressWarnings("unchecked")
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof SetTree))
            return false;
        try {
            return compareTo((SetTree<T>)obj) == 0;
        } catch (ClassCastException unused) {
            return false;
        }
    }

    @Override
    public int hashCode() {
        // must agree with the ordering, which may equate elements that differ by equals()
        int h = 31 * elements.size() + subsets.size();
        for (SetTree<T> s : subsets) {
            h = 31 * h + s.hashCode();
        }
        return h;
    }

    public String toString() {
        return render();
    }
}
