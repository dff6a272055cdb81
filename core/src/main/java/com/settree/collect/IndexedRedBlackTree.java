/**
 * Set Tree Library
 * Copyright (c) 2026 Set Tree Project.
 * All rights reserved.
 */

package com.settree.collect;

import java.util.Comparator;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.NoSuchElementException;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;

import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * <p>A sorted collection implemented as a red-black tree in which every node
 * also records the size of its subtree. The sizes make positional access
 * and rank queries run in O(log n), in addition to the usual logarithmic
 * insertion, removal and lookup.</p>
 *
 * <p>The implementation follows the algorithms described in:</p>
 *
 * <ul>
 * <li>T. H. Cormen, C. E. Leiserson, R. L. Rivest and C. Stein,
 *     "Introduction to Algorithms", chapters 13 (Red-Black Trees) and 14.1
 *     (Dynamic order statistics).</li>
 * </ul>
 *
 * <p>This class is not thread-safe.</p>
 *
 * @param <E> the type of collection elements
 */
public class IndexedRedBlackTree<E> implements SortedCollection<E> {
    private static final boolean RED = false;
    private static final boolean BLACK = true;

    static final class Node<E> {
        E value;
        Node<E> left, right, parent;
        boolean color;
        int size;

        Node(E value, boolean color, int size) {
            this.value = value;
            this.color = color;
            this.size = size;
        }
    }

    private final Comparator<? super E> comparator;

    /**
     * The sentinel that stands for every leaf and for the parent of the root.
     * It is always black and its size is always zero.
     */
    private final Node<E> nil;

    private Node<E> root;
    private int modCount;

    /**
     * Construct an empty collection, sorted according to the natural ordering
     * of its elements.
     */
    public static <E extends Comparable<? super E>> IndexedRedBlackTree<E> naturalOrder() {
        return new IndexedRedBlackTree<>(Comparator.naturalOrder());
    }

    /**
     * Construct an empty collection, sorted according to the specified comparator.
     *
     * @param comparator the comparator that will be used to order this collection
     * @throws NullPointerException if <tt>comparator</tt> is null
     */
    public IndexedRedBlackTree(Comparator<? super E> comparator) {
        this.comparator = checkNotNull(comparator, "comparator");
        this.nil = new Node<>(null, BLACK, 0);
        nil.left = nil.right = nil.parent = nil;
        this.root = nil;
    }

    /**
     * Construct a collection containing the given elements, sorted according
     * to the specified comparator. Duplicates are dropped.
     */
    public IndexedRedBlackTree(Comparator<? super E> comparator, Iterable<? extends E> elements) {
        this(comparator);
        addAll(elements);
    }

    // Query Operations

    @Override
    public int size() {
        return root.size;
    }

    @Override
    public boolean isEmpty() {
        return root == nil;
    }

    @Override
    public Comparator<? super E> comparator() {
        return comparator;
    }

    @Override
    public E get(int index) {
        return nodeAt(index).value;
    }

    @Override
    public int indexOf(E e) {
        checkNotNull(e);
        int rank = 0;
        Node<E> x = root;
        while (x != nil) {
            int c = comparator.compare(e, x.value);
            if (c < 0) {
                x = x.left;
            } else if (c > 0) {
                rank += x.left.size + 1;
                x = x.right;
            } else {
                return rank + x.left.size;
            }
        }
        return -1;
    }

    @Override
    public boolean contains(E e) {
        return find(checkNotNull(e)) != nil;
    }

    @Override
    public E min() {
        if (root == nil)
            throw new NoSuchElementException("Cannot return the minimal element of an empty collection");
        return minimum(root).value;
    }

    @Override
    public E max() {
        if (root == nil)
            throw new NoSuchElementException("Cannot return the maximal element of an empty collection");
        return maximum(root).value;
    }

    // Modification Operations

    @Override
    public boolean addIfAbsent(E e) {
        checkNotNull(e);

        Node<E> y = nil, x = root;
        int c = 0;
        while (x != nil) {
            y = x;
            c = comparator.compare(e, x.value);
            if (c == 0)
                return false;
            x = c < 0 ? x.left : x.right;
        }

        Node<E> z = new Node<>(e, RED, 1);
        z.left = z.right = nil;
        z.parent = y;
        if (y == nil) {
            root = z;
        } else if (c < 0) {
            y.left = z;
        } else {
            y.right = z;
        }

        for (Node<E> p = y; p != nil; p = p.parent) {
            p.size++;
        }

        insertFixup(z);
        modCount++;
        return true;
    }

    @Override
    public boolean addAll(Iterable<? extends E> elements) {
        // rejects null elements before the tree is touched
        ImmutableList<E> all = ImmutableList.copyOf(checkNotNull(elements));
        boolean changed = false;
        for (E e : all) {
            changed |= addIfAbsent(e);
        }
        return changed;
    }

    @Override
    public boolean remove(E e) {
        Node<E> z = find(checkNotNull(e));
        if (z == nil)
            return false;
        delete(z);
        return true;
    }

    @Override
    public E removeAt(int index) {
        Node<E> z = nodeAt(index);
        E value = z.value;
        delete(z);
        return value;
    }

    @Override
    public void clear() {
        root = nil;
        modCount++;
    }

    // Views

    @Override
    public Iterator<E> iterator() {
        return new TreeIterator();
    }

    private class TreeIterator implements Iterator<E> {
        private Node<E> next = root == nil ? nil : minimum(root);
        private Node<E> lastReturned = nil;
        private int expectedModCount = modCount;

        @Override
        public boolean hasNext() {
            return next != nil;
        }

        @Override
        public E next() {
            if (next == nil)
                throw new NoSuchElementException();
            if (modCount != expectedModCount)
                throw new ConcurrentModificationException();
            lastReturned = next;
            next = successor(next);
            return lastReturned.value;
        }

        @Override
        public void remove() {
            checkState(lastReturned != nil, "next() has not been called");
            if (modCount != expectedModCount)
                throw new ConcurrentModificationException();
            delete(lastReturned);
            lastReturned = nil;
            expectedModCount = modCount;
        }
    }

    // Internals

    private Node<E> nodeAt(int index) {
        checkElementIndex(index, size());
        Node<E> x = root;
        while (true) {
            int l = x.left.size;
            if (index < l) {
                x = x.left;
            } else if (index > l) {
                index -= l + 1;
                x = x.right;
            } else {
                return x;
            }
        }
    }

    private Node<E> find(E e) {
        Node<E> x = root;
        while (x != nil) {
            int c = comparator.compare(e, x.value);
            if (c == 0)
                return x;
            x = c < 0 ? x.left : x.right;
        }
        return nil;
    }

    private Node<E> minimum(Node<E> x) {
        while (x.left != nil)
            x = x.left;
        return x;
    }

    private Node<E> maximum(Node<E> x) {
        while (x.right != nil)
            x = x.right;
        return x;
    }

    private Node<E> successor(Node<E> x) {
        if (x.right != nil)
            return minimum(x.right);
        Node<E> y = x.parent;
        while (y != nil && x == y.right) {
            x = y;
            y = y.parent;
        }
        return y;
    }

    private void rotateLeft(Node<E> x) {
        Node<E> y = x.right;
        x.right = y.left;
        if (y.left != nil)
            y.left.parent = x;
        y.parent = x.parent;
        if (x.parent == nil) {
            root = y;
        } else if (x == x.parent.left) {
            x.parent.left = y;
        } else {
            x.parent.right = y;
        }
        y.left = x;
        x.parent = y;

        y.size = x.size;
        x.size = x.left.size + x.right.size + 1;
    }

    private void rotateRight(Node<E> x) {
        Node<E> y = x.left;
        x.left = y.right;
        if (y.right != nil)
            y.right.parent = x;
        y.parent = x.parent;
        if (x.parent == nil) {
            root = y;
        } else if (x == x.parent.right) {
            x.parent.right = y;
        } else {
            x.parent.left = y;
        }
        y.right = x;
        x.parent = y;

        y.size = x.size;
        x.size = x.left.size + x.right.size + 1;
    }

    private void insertFixup(Node<E> z) {
        while (z.parent.color == RED) {
            Node<E> g = z.parent.parent;
            if (z.parent == g.left) {
                Node<E> uncle = g.right;
                if (uncle.color == RED) {
                    z.parent.color = BLACK;
                    uncle.color = BLACK;
                    g.color = RED;
                    z = g;
                } else {
                    if (z == z.parent.right) {
                        z = z.parent;
                        rotateLeft(z);
                    }
                    z.parent.color = BLACK;
                    z.parent.parent.color = RED;
                    rotateRight(z.parent.parent);
                }
            } else {
                Node<E> uncle = g.left;
                if (uncle.color == RED) {
                    z.parent.color = BLACK;
                    uncle.color = BLACK;
                    g.color = RED;
                    z = g;
                } else {
                    if (z == z.parent.left) {
                        z = z.parent;
                        rotateRight(z);
                    }
                    z.parent.color = BLACK;
                    z.parent.parent.color = RED;
                    rotateLeft(z.parent.parent);
                }
            }
        }
        root.color = BLACK;
    }

    private void transplant(Node<E> u, Node<E> v) {
        if (u.parent == nil) {
            root = v;
        } else if (u == u.parent.left) {
            u.parent.left = v;
        } else {
            u.parent.right = v;
        }
        v.parent = u.parent;
    }

    private void delete(Node<E> z) {
        // the node that leaves the tree physically
        Node<E> removed = (z.left == nil || z.right == nil) ? z : minimum(z.right);
        for (Node<E> p = removed.parent; p != nil; p = p.parent) {
            p.size--;
        }

        Node<E> y = z, x;
        boolean originalColor = y.color;

        if (z.left == nil) {
            x = z.right;
            transplant(z, z.right);
        } else if (z.right == nil) {
            x = z.left;
            transplant(z, z.left);
        } else {
            y = removed;
            originalColor = y.color;
            x = y.right;
            if (y.parent == z) {
                x.parent = y;
            } else {
                transplant(y, y.right);
                y.right = z.right;
                y.right.parent = y;
            }
            transplant(z, y);
            y.left = z.left;
            y.left.parent = y;
            y.color = z.color;
            y.size = z.size;
        }

        if (originalColor == BLACK)
            deleteFixup(x);

        z.left = z.right = z.parent = null;
        nil.parent = nil;
        modCount++;
    }

    private void deleteFixup(Node<E> x) {
        while (x != root && x.color == BLACK) {
            if (x == x.parent.left) {
                Node<E> w = x.parent.right;
                if (w.color == RED) {
                    w.color = BLACK;
                    x.parent.color = RED;
                    rotateLeft(x.parent);
                    w = x.parent.right;
                }
                if (w.left.color == BLACK && w.right.color == BLACK) {
                    w.color = RED;
                    x = x.parent;
                } else {
                    if (w.right.color == BLACK) {
                        w.left.color = BLACK;
                        w.color = RED;
                        rotateRight(w);
                        w = x.parent.right;
                    }
                    w.color = x.parent.color;
                    x.parent.color = BLACK;
                    w.right.color = BLACK;
                    rotateLeft(x.parent);
                    x = root;
                }
            } else {
                Node<E> w = x.parent.left;
                if (w.color == RED) {
                    w.color = BLACK;
                    x.parent.color = RED;
                    rotateRight(x.parent);
                    w = x.parent.left;
                }
                if (w.right.color == BLACK && w.left.color == BLACK) {
                    w.color = RED;
                    x = x.parent;
                } else {
                    if (w.left.color == BLACK) {
                        w.right.color = BLACK;
                        w.color = RED;
                        rotateLeft(w);
                        w = x.parent.left;
                    }
                    w.color = x.parent.color;
                    x.parent.color = BLACK;
                    w.left.color = BLACK;
                    rotateRight(x.parent);
                    x = root;
                }
            }
        }
        x.color = BLACK;
    }

    // Assertions

    /**
     * Checks the internal structure of the tree: the binary search order,
     * the red-black coloring rules, the parent links and the subtree sizes.
     */
    public boolean valid() {
        return nil.color == BLACK && nil.size == 0
            && root.color == BLACK
            && (root == nil || root.parent == nil)
            && blackHeight(root) >= 0
            && ordered(root, null, null)
            && validsize(root);
    }

    private int blackHeight(Node<E> x) {
        if (x == nil)
            return 1;
        if (x.color == RED && (x.left.color == RED || x.right.color == RED))
            return -1;
        if ((x.left != nil && x.left.parent != x) || (x.right != nil && x.right.parent != x))
            return -1;
        int l = blackHeight(x.left), r = blackHeight(x.right);
        if (l < 0 || r < 0 || l != r)
            return -1;
        return l + (x.color == BLACK ? 1 : 0);
    }

    private boolean ordered(Node<E> x, E lo, E hi) {
        if (x == nil)
            return true;
        if (lo != null && comparator.compare(x.value, lo) <= 0)
            return false;
        if (hi != null && comparator.compare(x.value, hi) >= 0)
            return false;
        return ordered(x.left, lo, x.value) && ordered(x.right, x.value, hi);
    }

    private boolean validsize(Node<E> x) {
        if (x == nil)
            return true;
        return x.size == x.left.size + x.right.size + 1
            && validsize(x.left) && validsize(x.right);
    }

    /**
     * Returns a textual drawing of the internal tree structure, one node per
     * line with its color and subtree size.
     */
    public String showTree() {
        StringBuilder buf = new StringBuilder();
        showTree(buf, root, "");
        return buf.toString();
    }

    private void showTree(StringBuilder buf, Node<E> x, String bars) {
        buf.append(bars.isEmpty() ? "" : bars.substring(0, bars.length() - 3) + "+--");
        if (x == nil) {
            buf.append("|\n");
            return;
        }
        buf.append(x.value)
           .append(x.color == RED ? " (R," : " (B,")
           .append(x.size).append(")\n");
        if (x.left != nil || x.right != nil) {
            showTree(buf, x.right, bars + "|  ");
            showTree(buf, x.left, bars + "   ");
        }
    }

    public String toString() {
        return Iterables.toString(this);
    }
}
