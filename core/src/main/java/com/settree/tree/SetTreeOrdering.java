/**
 * Set Tree Library
 * Copyright (c) 2026 Set Tree Project.
 * All rights reserved.
 */

package com.settree.tree;

import java.util.Comparator;
import java.util.Iterator;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The total order of set trees. Trees are compared by:
 *
 * <ol>
 * <li>the total number of root elements and subsets,</li>
 * <li>the number of root elements,</li>
 * <li>the root elements, pairwise in ascending order,</li>
 * <li>the subsets, pairwise in ascending order, recursively.</li>
 * </ol>
 *
 * <p>The same comparison orders the subsets inside every tree, so the
 * order of siblings and the order of whole trees cannot diverge.</p>
 */
public final class SetTreeOrdering {
    private SetTreeOrdering() {}

    @SuppressWarnings("rawtypes")
    private static final Comparator ORDERING = (a, b) -> compare((SetTree)a, (SetTree)b);

    /**
     * Returns the comparator for set trees.
     */
    @SuppressWarnings("unchecked")
    public static <T> Comparator<SetTree<T>> ordering() {
        return (Comparator<SetTree<T>>)ORDERING;
    }

    /**
     * Compares two trees. The root elements are compared with the element
     * comparator of the first tree.
     *
     * @throws NullPointerException if either tree is null
     */
    public static <T> int compare(SetTree<T> a, SetTree<T> b) {
        checkNotNull(a);
        checkNotNull(b);
        if (a == b)
            return 0;

        int c = Integer.compare(a.count(), b.count());
        if (c != 0)
            return c;

        c = Integer.compare(a.elementCount(), b.elementCount());
        if (c != 0)
            return c;

        Comparator<? super T> cmp = a.elementComparator();
        Iterator<T> ea = a.elements().iterator(), eb = b.elements().iterator();
        while (ea.hasNext() && eb.hasNext()) {
            c = cmp.compare(ea.next(), eb.next());
            if (c != 0)
                return c;
        }

        Iterator<SetTree<T>> sa = a.subtrees().iterator(), sb = b.subtrees().iterator();
        while (sa.hasNext() && sb.hasNext()) {
            c = compare(sa.next(), sb.next());
            if (c != 0)
                return c;
        }

        return 0;
    }
}
