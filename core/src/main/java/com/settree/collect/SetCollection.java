/**
 * Set Tree Library
 * Copyright (c) 2026 Set Tree Project.
 * All rights reserved.
 */

package com.settree.collect;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.logging.Logger;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterators;
import com.google.common.collect.Maps;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A container that stores sets under generated names. Each added set is
 * given the next spreadsheet column style name ({@code A}, {@code B}, ...,
 * {@code Z}, {@code AA}, ...), and the sets are kept in insertion order.
 *
 * @param <S> the type of stored sets
 */
public class SetCollection<S> implements Iterable<Map.Entry<String, S>> {
    private static final Logger logger = Logger.getLogger(SetCollection.class.getName());

    private final Map<String, S> sets = new LinkedHashMap<>();
    private String lastName;

    /**
     * Construct an empty collection.
     */
    public SetCollection() {}

    /**
     * Construct a collection holding the given sets, named in iteration order.
     */
    public SetCollection(Iterable<? extends S> sets) {
        addAll(sets);
    }

    public int size() {
        return sets.size();
    }

    public boolean isEmpty() {
        return sets.isEmpty();
    }

    /**
     * Adds a set and returns the name assigned to it.
     *
     * @throws NullPointerException if the set is null
     */
    public String add(S set) {
        checkNotNull(set, "set");
        String name = lastName == null ? ColumnNames.FIRST : ColumnNames.next(lastName);
        sets.put(name, set);
        lastName = name;
        logger.fine(() -> "Added set " + name + " = " + set);
        return name;
    }

    /**
     * Adds all given sets, returning the assigned names in the same order.
     */
    public List<String> addAll(Iterable<? extends S> sets) {
        checkNotNull(sets, "sets");
        List<String> names = new ArrayList<>();
        for (S set : sets) {
            names.add(add(set));
        }
        return names;
    }

    /**
     * Returns the set stored under the given name.
     *
     * @throws NoSuchElementException if no set has this name
     */
    public S get(String name) {
        S set = sets.get(checkName(name));
        if (set == null)
            throw new NoSuchElementException("No set named " + name);
        return set;
    }

    public boolean contains(String name) {
        return sets.containsKey(checkName(name));
    }

    public boolean containsValue(S set) {
        return sets.containsValue(checkNotNull(set, "set"));
    }

    /**
     * Removes the set stored under the given name. The names of the
     * remaining sets are not changed; use {@link #reset()} to close gaps.
     *
     * @return {@code true} if a set was removed
     */
    public boolean remove(String name) {
        return sets.remove(checkName(name)) != null;
    }

    /**
     * Renames all stored sets from {@code A} in their current order.
     */
    public void reset() {
        List<S> values = new ArrayList<>(sets.values());
        clear();
        addAll(values);
    }

    public void clear() {
        sets.clear();
        lastName = null;
    }

    /**
     * Returns the names of the stored sets in insertion order.
     */
    public Set<String> names() {
        return ImmutableSet.copyOf(sets.keySet());
    }

    @Override
    public Iterator<Map.Entry<String, S>> iterator() {
        return Iterators.transform(
            Iterators.unmodifiableIterator(sets.entrySet().iterator()),
            e -> Maps.immutableEntry(e.getKey(), e.getValue()));
    }

    private static String checkName(String name) {
        checkArgument(!Strings.isNullOrEmpty(name) && !name.trim().isEmpty(),
                      "The set name must not be blank");
        return name.trim();
    }

    public String toString() {
        return sets.toString();
    }
}
