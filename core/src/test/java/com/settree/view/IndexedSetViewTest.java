/**
 * Set Tree Library
 * Copyright (c) 2026 Set Tree Project.
 * All rights reserved.
 */

package com.settree.view;

import org.junit.Before;
import org.junit.Test;
import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import com.settree.config.SetsConfiguration;
import com.settree.parser.ElementConverters;
import com.settree.parser.SetTreeParser;
import com.settree.tree.SetTree;

public class IndexedSetViewTest
{
    private SetTreeParser<Integer> parser;
    private IndexedSetView<Integer> view;

    @Before
    public void initialize() {
        parser = SetTreeParser.of(SetsConfiguration.of(","), ElementConverters.integers());
        view = IndexedSetView.of(parser.parse("{3,1,{2},{}}"));
    }

    @Test
    public void counts() {
        assertThat(view.count(), is(4));
        assertThat(view.elementCount(), is(2));
        assertThat(view.subtreeCount(), is(2));
    }

    @Test
    public void elements_and_subsets() {
        assertThat(view.elementAt(0), is(1));
        assertThat(view.elementAt(1), is(3));
        assertThat(view.subtreeAt(0).render(), is("{}"));
        assertThat(view.subtreeAt(1).render(), is("{2}"));
    }

    @Test
    public void unified_index_space() {
        assertTrue(view.isElementIndex(0));
        assertTrue(view.isElementIndex(1));
        assertFalse(view.isElementIndex(2));
        assertTrue(view.isSubtreeIndex(2));
        assertTrue(view.isSubtreeIndex(3));
        assertFalse(view.isSubtreeIndex(4));
        assertFalse(view.isSubtreeIndex(1));
        assertFalse(view.isElementIndex(-1));

        assertThat(view.subtreeAtUnified(2).render(), is("{}"));
        assertThat(view.subtreeAtUnified(3).render(), is("{2}"));
    }

    @Test
    public void indexOf() {
        assertThat(view.indexOf(3), is(1));
        assertThat(view.indexOf(parser.parse("{2}")), is(3));
        assertThat(view.indexOf(parser.parse("{}")), is(2));
        assertThat(view.indexOf(9), is(-1));
        assertThat(view.indexOf(parser.parse("{9}")), is(-1));
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void element_index_out_of_range() {
        view.elementAt(2);
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void subtree_index_out_of_range() {
        view.subtreeAt(2);
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void unified_index_of_element() {
        view.subtreeAtUnified(1);
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void unified_index_out_of_range() {
        view.subtreeAtUnified(4);
    }

    @Test
    public void reads_through() {
        SetTree<Integer> tree = view.tree();
        tree.addElement(0);
        assertThat(view.elementAt(0), is(0));
        assertThat(view.render(), is("{0,1,3,{},{2}}"));
    }

    @Test
    public void clear() {
        view.clear();
        assertThat(view.count(), is(0));
        assertThat(view.render(), is("{}"));
        assertFalse(view.isSubtreeIndex(0));
    }

    @Test
    public void subsets_are_read_only() {
        try {
            view.subtreeAt(1).addElement(5);
            fail("subset should be read-only");
        } catch (UnsupportedOperationException ex) {
            // ok
        }
        try {
            view.subtreeAtUnified(3).clear();
            fail("subset should be read-only");
        } catch (UnsupportedOperationException ex) {
            // ok
        }
        assertThat(view.tree().render(), is("{1,3,{},{2}}"));
    }
}
