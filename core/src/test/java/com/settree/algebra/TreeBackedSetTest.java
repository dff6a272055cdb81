/**
 * Set Tree Library
 * Copyright (c) 2026 Set Tree Project.
 * All rights reserved.
 */

package com.settree.algebra;

import org.junit.Before;
import org.junit.Test;
import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import com.settree.BraceMismatchException;
import com.settree.config.SetsConfiguration;
import com.settree.parser.ElementConverters;
import com.settree.parser.SetTreeParser;

public class TreeBackedSetTest
{
    private SetTreeParser<Integer> parser;
    private SetFactory<Integer> factory;
    private StructuredSet<Integer> set;

    @Before
    public void initialize() {
        parser = SetTreeParser.of(SetsConfiguration.of(","), ElementConverters.integers());
        factory = TreeBackedSet.factory(parser);
        set = factory.newSet("{1,2,{3}}");
    }

    @Test
    public void cardinality() {
        assertThat(set.cardinality(), is(3));
        assertThat(factory.newSet().cardinality(), is(0));
    }

    @Test
    public void membership() {
        assertTrue(set.contains(1));
        assertFalse(set.contains(3));
        assertTrue(set.contains(parser.parse("{3}")));
        assertFalse(set.contains(parser.parse("{1}")));
    }

    @Test
    public void modification() {
        assertTrue(set.addElement(0));
        assertFalse(set.addElement(0));
        assertTrue(set.addSubset(parser.parse("{5,4}")));
        assertTrue(set.addSubsetAsString("{{}}"));
        assertFalse(set.addSubsetAsString("{3}"));
        assertThat(set.render(), is("{0,1,2,{{}},{3},{4,5}}"));

        assertTrue(set.removeElement(1));
        assertTrue(set.removeSubset(parser.parse("{3}")));
        assertFalse(set.removeSubset(parser.parse("{3}")));
        assertThat(set.render(), is("{0,2,{{}},{4,5}}"));

        set.clear();
        assertThat(set.render(), is("{}"));
    }

    @Test(expected = BraceMismatchException.class)
    public void malformed_subset_expression() {
        set.addSubsetAsString("{1,2");
    }

    @Test
    public void isSubsetOf() {
        assertThat(set.isSubsetOf(factory.newSet("{2,1,{3}}")), is(SetResultType.SAME_SET));
        assertThat(set.isSubsetOf(factory.newSet("{0,1,2,{3}}")), is(SetResultType.PROPER_SUBSET));
        assertThat(set.isSubsetOf(factory.newSet("{1,2,{4},{5}}")), is(SetResultType.NOT_A_SUBSET));
        assertThat(set.isSubsetOf(factory.newSet("{1,2}")), is(SetResultType.NOT_A_SUBSET));
        assertThat(factory.newSet().isSubsetOf(set), is(SetResultType.PROPER_SUBSET));
        assertFalse(SetResultType.NOT_A_SUBSET.isSubset());
    }

    @Test
    public void isElementOf() {
        StructuredSet<Integer> three = factory.newSet("{3}");
        assertTrue(three.isElementOf(set));
        assertFalse(set.isElementOf(three));
    }

    @Test
    public void mergeWith() {
        StructuredSet<Integer> merged = set.mergeWith(factory.newSet("{2,7,{3},{}}"));
        assertThat(merged.render(), is("{1,2,7,{},{3}}"));
        assertThat(merged.factory(), is(sameInstance(factory)));
        assertThat(set.render(), is("{1,2,{3}}"));
    }

    @Test
    public void without() {
        StructuredSet<Integer> rest = set.without(factory.newSet("{2,{3}}"));
        assertThat(rest.render(), is("{1}"));
    }

    @Test
    public void equality() {
        assertThat(set, is(factory.newSet("{{3},2,1}")));
        assertThat(set.hashCode(), is(factory.newSet("{{3},2,1}").hashCode()));
        assertThat(set, is(not(factory.newSet("{1,2}"))));
    }

    @Test
    public void views() {
        assertThat(set.elements().iterator().next(), is(1));
        assertThat(set.subsets().iterator().next().render(), is("{3}"));
        assertThat(set.tree().count(), is(3));
    }
}
