/**
 * Set Tree Library
 * Copyright (c) 2026 Set Tree Project.
 * All rights reserved.
 */

package com.settree.algebra;

import java.util.logging.Level;
import java.util.logging.Logger;

import com.settree.SetsOperationException;
import com.settree.tree.SetTree;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Static methods that combine structured sets. The operands are never
 * modified; every result is a new set built by the factory of the first
 * operand.
 */
public final class SetOperations {
    private static final Logger logger = Logger.getLogger(SetOperations.class.getName());

    private SetOperations() {}

    /**
     * Returns the set of members of either set.
     */
    public static <T> StructuredSet<T> union(StructuredSet<T> a, StructuredSet<T> b) {
        checkNotNull(a, "a");
        checkNotNull(b, "b");
        try {
            return a.mergeWith(b);
        } catch (RuntimeException ex) {
            throw failure("union", ex);
        }
    }

    /**
     * Returns the set of members common to both sets.
     */
    public static <T> StructuredSet<T> intersection(StructuredSet<T> a, StructuredSet<T> b) {
        checkNotNull(a, "a");
        checkNotNull(b, "b");
        try {
            StructuredSet<T> result = a.factory().newSet();
            for (T e : a.elements()) {
                if (b.contains(e))
                    result.addElement(e);
            }
            for (SetTree<T> s : a.subsets()) {
                if (b.contains(s))
                    result.addSubset(s);
            }
            return result;
        } catch (RuntimeException ex) {
            throw failure("intersection", ex);
        }
    }

    /**
     * Returns the set of members of {@code a} that are not members of {@code b}.
     */
    public static <T> StructuredSet<T> difference(StructuredSet<T> a, StructuredSet<T> b) {
        checkNotNull(a, "a");
        checkNotNull(b, "b");
        try {
            return a.without(b);
        } catch (RuntimeException ex) {
            throw failure("difference", ex);
        }
    }

    /**
     * Returns the set of members of exactly one of the sets.
     */
    public static <T> StructuredSet<T> symmetricDifference(StructuredSet<T> a, StructuredSet<T> b) {
        checkNotNull(a, "a");
        checkNotNull(b, "b");
        try {
            return a.without(b).mergeWith(b.without(a));
        } catch (RuntimeException ex) {
            throw failure("symmetric difference", ex);
        }
    }

    /**
     * Returns the members of the universal set that are not members of {@code a}.
     *
     * @throws SetsOperationException if {@code a} has more members than the universal set
     */
    public static <T> StructuredSet<T> complement(StructuredSet<T> a, StructuredSet<T> universal) {
        checkNotNull(a, "a");
        checkNotNull(universal, "universal");
        if (a.cardinality() > universal.cardinality()) {
            throw new SetsOperationException(
                "The cardinality of the set must not exceed the cardinality of the universal set.",
                "The set has " + a.cardinality() + " members but the universal set has "
                + universal.cardinality() + ".");
        }
        try {
            return universal.without(a);
        } catch (RuntimeException ex) {
            throw failure("complement", ex);
        }
    }

    /**
     * Returns {@code true} if the sets have no member in common. Two empty
     * sets are disjoint.
     */
    public static <T> boolean isDisjoint(StructuredSet<T> a, StructuredSet<T> b) {
        checkNotNull(a, "a");
        checkNotNull(b, "b");
        try {
            for (T e : a.elements()) {
                if (b.contains(e))
                    return false;
            }
            for (SetTree<T> s : a.subsets()) {
                if (b.contains(s))
                    return false;
            }
            return true;
        } catch (RuntimeException ex) {
            throw failure("disjoint check", ex);
        }
    }

    private static SetsOperationException failure(String operation, RuntimeException cause) {
        logger.log(Level.FINE, "Failed to compute the " + operation, cause);
        return new SetsOperationException("An error occurred while performing the " + operation + ".",
            "Error during the " + operation + " of two sets.", cause);
    }
}
