/**
 * Set Tree Library
 * Copyright (c) 2026 Set Tree Project.
 * All rights reserved.
 */

package com.settree.tree;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.junit.Before;
import org.junit.Test;
import static java.util.Comparator.*;
import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import com.settree.config.SetsConfiguration;

public class SetTreeOrderingTest
{
    private static final SetsConfiguration CONFIG = SetsConfiguration.of(",");

    private List<SetTree<Integer>> samples;

    @Before
    public void initialize() {
        Random rnd = new Random(2024);
        samples = new ArrayList<>();
        for (int i = 0; i < 60; i++) {
            samples.add(random(rnd, 2));
        }
        samples.add(tree());
        samples.add(tree(1));
    }

    private static SortedSetTree<Integer> tree(Integer... elements) {
        return new SortedSetTree<>(CONFIG, naturalOrder(), Arrays.asList(elements));
    }

    private static SortedSetTree<Integer> random(Random rnd, int depth) {
        SortedSetTree<Integer> t = tree();
        int n = rnd.nextInt(4);
        for (int i = 0; i < n; i++) {
            t.addElement(rnd.nextInt(5));
        }
        if (depth > 0) {
            int m = rnd.nextInt(3);
            for (int i = 0; i < m; i++) {
                t.addSubtree(random(rnd, depth - 1));
            }
        }
        return t;
    }

    private static int sign(int x) {
        return Integer.signum(x);
    }

    @Test
    public void by_count_first() {
        assertTrue(SetTreeOrdering.compare(tree(), tree(9)) < 0);
        assertTrue(SetTreeOrdering.compare(tree(9), tree(1, 2)) < 0);
    }

    @Test
    public void subsets_before_elements_with_same_count() {
        SortedSetTree<Integer> withSubset = tree();
        withSubset.addSubtree(tree());
        // {{}} has fewer root elements than {1}
        assertTrue(SetTreeOrdering.compare(withSubset, tree(1)) < 0);
    }

    @Test
    public void by_elements_then_subsets() {
        assertTrue(SetTreeOrdering.compare(tree(1, 2), tree(1, 3)) < 0);

        SortedSetTree<Integer> a = tree(1), b = tree(1);
        a.addSubtree(tree(2));
        b.addSubtree(tree(3));
        assertTrue(SetTreeOrdering.compare(a, b) < 0);
        assertTrue(SetTreeOrdering.compare(b, a) > 0);
    }

    @Test
    public void equal_structures() {
        SortedSetTree<Integer> a = tree(2, 1), b = tree(1, 2);
        a.addSubtree(tree(3));
        b.addSubtree(tree(3));
        assertThat(SetTreeOrdering.compare(a, b), is(0));
        assertThat(a.compareTo(b), is(0));
    }

    @Test
    public void antisymmetric() {
        for (SetTree<Integer> a : samples) {
            for (SetTree<Integer> b : samples) {
                assertThat(a + " vs " + b, sign(a.compareTo(b)), is(-sign(b.compareTo(a))));
            }
        }
    }

    @Test
    public void transitive() {
        for (SetTree<Integer> a : samples) {
            for (SetTree<Integer> b : samples) {
                for (SetTree<Integer> c : samples) {
                    if (a.compareTo(b) <= 0 && b.compareTo(c) <= 0) {
                        assertTrue(a + " <= " + c, a.compareTo(c) <= 0);
                    }
                }
            }
        }
    }

    @Test
    public void equal_iff_same_rendering() {
        for (SetTree<Integer> a : samples) {
            for (SetTree<Integer> b : samples) {
                assertThat(a.compareTo(b) == 0, is(a.render().equals(b.render())));
            }
        }
    }

    @Test
    public void sorting_is_stable_under_shuffle() {
        List<SetTree<Integer>> sorted = new ArrayList<>(samples);
        Collections.sort(sorted, SetTreeOrdering.ordering());

        List<SetTree<Integer>> shuffled = new ArrayList<>(samples);
        Collections.shuffle(shuffled, new Random(5));
        Collections.sort(shuffled, SetTreeOrdering.ordering());

        for (int i = 0; i < sorted.size(); i++) {
            assertThat(shuffled.get(i).compareTo(sorted.get(i)), is(0));
        }
    }
}
