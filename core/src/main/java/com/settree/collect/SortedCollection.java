/**
 * Set Tree Library
 * Copyright (c) 2026 Set Tree Project.
 * All rights reserved.
 */

package com.settree.collect;

import java.util.Comparator;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * A collection that keeps its elements unique and sorted in ascending order,
 * and gives positional access to them. Two elements are the same if the
 * collection's comparator returns zero for them, regardless of identity
 * or {@code equals}.
 *
 * <p>Null elements are not permitted.</p>
 *
 * @param <E> the type of collection elements
 */
public interface SortedCollection<E> extends Iterable<E> {
    // Query Operations

    /**
     * Returns the number of elements in this collection.
     */
    int size();

    /**
     * Returns {@code true} if this collection contains no elements.
     */
    boolean isEmpty();

    /**
     * Returns the element at the specified position, counted in ascending order.
     *
     * @param index the zero-based position of the element
     * @return the element at the specified position
     * @throws IndexOutOfBoundsException if the index is not in {@code [0, size())}
     */
    E get(int index);

    /**
     * Returns the position of the specified element, or -1 if the collection
     * does not contain it.
     *
     * @throws NullPointerException if the element is null
     */
    int indexOf(E e);

    /**
     * Returns {@code true} if this collection contains the specified element.
     *
     * @throws NullPointerException if the element is null
     */
    boolean contains(E e);

    /**
     * Returns the lowest element.
     *
     * @throws java.util.NoSuchElementException if the collection is empty
     */
    E min();

    /**
     * Returns the highest element.
     *
     * @throws java.util.NoSuchElementException if the collection is empty
     */
    E max();

    /**
     * Returns the comparator used to order this collection.
     */
    Comparator<? super E> comparator();

    // Modification Operations

    /**
     * Adds the specified element unless an equal element is already present.
     *
     * @param e the element to add
     * @return {@code true} if the element was added
     * @throws NullPointerException if the element is null
     */
    boolean addIfAbsent(E e);

    /**
     * Adds all given elements that are not already present.
     *
     * @return {@code true} if this collection changed
     * @throws NullPointerException if the iterable or any of its elements is null
     */
    boolean addAll(Iterable<? extends E> elements);

    /**
     * Removes the specified element if it is present.
     *
     * @return {@code true} if the element was removed
     * @throws NullPointerException if the element is null
     */
    boolean remove(E e);

    /**
     * Removes the element at the specified position.
     *
     * @return the removed element
     * @throws IndexOutOfBoundsException if the index is not in {@code [0, size())}
     */
    E removeAt(int index);

    /**
     * Removes all of the elements from this collection.
     */
    void clear();

    // Views

    /**
     * Returns a sequential stream of the elements in ascending order.
     */
    default Stream<E> stream() {
        return StreamSupport.stream(
            Spliterators.spliterator(iterator(), size(),
                Spliterator.ORDERED | Spliterator.DISTINCT | Spliterator.NONNULL),
            false);
    }
}
