/**
 * Set Tree Library
 * Copyright (c) 2026 Set Tree Project.
 * All rights reserved.
 */

package com.settree.algebra;

import java.util.Comparator;

import com.settree.config.SetsConfiguration;
import com.settree.parser.ElementConverter;
import com.settree.parser.SetTreeParser;
import com.settree.tree.SetTree;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A structured set that keeps its members in a {@link SetTree}.
 *
 * @param <T> the type of elements
 */
public class TreeBackedSet<T> implements StructuredSet<T> {
    private final SetTree<T> tree;
    private final SetFactory<T> factory;

    /**
     * Construct a set over the given tree, which the set takes ownership of.
     */
    public TreeBackedSet(SetTree<T> tree, SetFactory<T> factory) {
        this.tree = checkNotNull(tree, "tree");
        this.factory = checkNotNull(factory, "factory");
    }

    /**
     * Returns a factory of sets parsed by the given parser.
     */
    public static <T> SetFactory<T> factory(SetTreeParser<T> parser) {
        return new ParsingFactory<>(parser);
    }

    /**
     * Returns a factory of sets whose elements are in their natural ordering.
     */
    public static <T extends Comparable<? super T>> SetFactory<T>
    factory(SetsConfiguration configuration, ElementConverter<? extends T> converter) {
        return factory(SetTreeParser.<T>of(configuration, converter));
    }

    private static class ParsingFactory<T> implements SetFactory<T> {
        private final SetTreeParser<T> parser;

        ParsingFactory(SetTreeParser<T> parser) {
            this.parser = checkNotNull(parser, "parser");
        }

        @Override
        public StructuredSet<T> newSet() {
            return new TreeBackedSet<>(parser.emptyTree(), this);
        }

        @Override
        public StructuredSet<T> newSet(String expression) {
            return new TreeBackedSet<>(parser.parse(expression), this);
        }

        public String toString() {
            return "SetFactory[" + parser + "]";
        }
    }

    @Override
    public int cardinality() {
        return tree.count();
    }

    @Override
    public boolean contains(T element) {
        return tree.containsElement(element);
    }

    @Override
    public boolean contains(SetTree<T> subset) {
        return tree.containsSubtree(subset);
    }

    @Override
    public boolean addElement(T element) {
        return tree.addElement(element);
    }

    @Override
    public boolean addSubset(SetTree<T> subset) {
        return tree.addSubtree(subset);
    }

    @Override
    public boolean addSubsetAsString(String expression) {
        return tree.addSubtree(factory.newSet(expression).tree());
    }

    @Override
    public boolean removeElement(T element) {
        return tree.removeElement(element);
    }

    @Override
    public boolean removeSubset(SetTree<T> subset) {
        return tree.removeSubtree(subset);
    }

    @Override
    public void clear() {
        tree.clear();
    }

    @Override
    public boolean isElementOf(StructuredSet<T> other) {
        return checkNotNull(other, "other").contains(tree);
    }

    @Override
    public SetResultType isSubsetOf(StructuredSet<T> other) {
        checkNotNull(other, "other");
        if (cardinality() > other.cardinality())
            return SetResultType.NOT_A_SUBSET;

        for (T e : tree.elements()) {
            if (!other.contains(e))
                return SetResultType.NOT_A_SUBSET;
        }
        for (SetTree<T> s : tree.subtrees()) {
            if (!other.contains(s))
                return SetResultType.NOT_A_SUBSET;
        }

        return cardinality() == other.cardinality()
            ? SetResultType.SAME_SET
            : SetResultType.PROPER_SUBSET;
    }

    @Override
    public StructuredSet<T> mergeWith(StructuredSet<T> other) {
        checkNotNull(other, "other");
        StructuredSet<T> result = factory.newSet();
        addAll(result, this);
        addAll(result, other);
        return result;
    }

    private static <T> void addAll(StructuredSet<T> target, StructuredSet<T> source) {
        for (T e : source.elements())
            target.addElement(e);
        for (SetTree<T> s : source.subsets())
            target.addSubset(s);
    }

    @Override
    public StructuredSet<T> without(StructuredSet<T> other) {
        checkNotNull(other, "other");
        StructuredSet<T> result = factory.newSet();
        for (T e : tree.elements()) {
            if (!other.contains(e))
                result.addElement(e);
        }
        for (SetTree<T> s : tree.subtrees()) {
            if (!other.contains(s))
                result.addSubset(s);
        }
        return result;
    }

    @Override
    public Iterable<T> elements() {
        return tree.elements();
    }

    @Override
    public Iterable<SetTree<T>> subsets() {
        return tree.subtrees();
    }

    @Override
    public SetTree<T> tree() {
        return tree;
    }

    @Override
    public SetFactory<T> factory() {
        return factory;
    }

    @Override
    public String render() {
        return tree.render();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof TreeBackedSet))
            return false;
        return tree.equals(((TreeBackedSet<?>)obj).tree);
    }

    @Override
    public int hashCode() {
        return tree.hashCode();
    }

    public String toString() {
        return render();
    }
}
