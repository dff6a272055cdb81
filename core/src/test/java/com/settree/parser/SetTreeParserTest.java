/**
 * Set Tree Library
 * Copyright (c) 2026 Set Tree Project.
 * All rights reserved.
 */

package com.settree.parser;

import java.math.BigDecimal;
import java.util.Random;

import org.junit.Test;
import static java.util.Comparator.*;
import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import com.settree.BraceMismatchException;
import com.settree.SetsOperationException;
import com.settree.config.SetsConfiguration;
import com.settree.tree.SetTree;
import com.settree.tree.SortedSetTree;

public class SetTreeParserTest
{
    private static final SetsConfiguration KEEP_EMPTY = SetsConfiguration.of(",", false, false);
    private static final SetsConfiguration IGNORE_EMPTY = SetsConfiguration.of(",", false, true);
    private static final SetsConfiguration AUTO_WRAP = SetsConfiguration.of(",", true, false);

    private static SetTree<Integer> parse(String text, SetsConfiguration config) {
        return SetTreeParser.parse(text, config, ElementConverters.integers());
    }

    @Test
    public void duplicates_and_empty_elements() {
        SetTree<Integer> t = parse("{1,,2,1,3,4,1,,8, ,6}", KEEP_EMPTY);
        assertThat(t.render(), is("{1,2,3,4,6,8,{}}"));
        assertThat(t.info().getNullElementCount(), is(3));
        assertTrue(t.info().hasNullElements());
    }

    @Test
    public void consecutive_empty_elements_give_one_empty_subset() {
        SetTree<Integer> t = parse("{1,,,,,,2}", KEEP_EMPTY);
        assertThat(t.render(), is("{1,2,{}}"));
        assertThat(t.info().getNullElementCount(), is(5));
    }

    @Test
    public void ignored_empty_elements_are_still_counted() {
        SetTree<Integer> t = parse("{1,,2,3,{,}}", IGNORE_EMPTY);
        assertThat(t.render(), is("{1,2,3,{}}"));
        assertThat(t.info().getNullElementCount(), is(1));
        assertThat(t.subtreeAt(0).info().getNullElementCount(), is(2));
    }

    @Test
    public void trailing_delimiter() {
        SetTree<Integer> t = parse("{5,6,,8,}", KEEP_EMPTY);
        assertThat(t.render(), is("{5,6,8,{}}"));
        assertThat(t.elementCount(), is(3));
        assertThat(t.subtreeCount(), is(1));
        assertThat(t.info().getNullElementCount(), is(2));
    }

    @Test
    public void empty_text_with_auto_wrap() {
        SetTree<Integer> t = parse("", AUTO_WRAP);
        assertThat(t.render(), is("{}"));
        assertTrue(t.info().isEmpty());
        assertFalse(t.info().hasNullElements());
        assertThat(parse(null, AUTO_WRAP).render(), is("{}"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void empty_text_without_auto_wrap() {
        parse("", KEEP_EMPTY);
    }

    @Test(expected = IllegalArgumentException.class)
    public void blank_text_without_auto_wrap() {
        parse("   ", KEEP_EMPTY);
    }

    @Test(expected = NullPointerException.class)
    public void null_text_without_auto_wrap() {
        parse(null, KEEP_EMPTY);
    }

    @Test
    public void empty_set() {
        SetTree<Integer> t = parse("{ }", KEEP_EMPTY);
        assertThat(t.count(), is(0));
        assertFalse(t.info().hasNullElements());
    }

    @Test
    public void explicit_empty_subset_with_empty_elements() {
        SetTree<Integer> t = parse("{,}", KEEP_EMPTY);
        assertThat(t.render(), is("{{}}"));
        assertThat(t.info().getNullElementCount(), is(2));
    }

    @Test
    public void nested_sets() {
        SetTree<Integer> t = parse("{ {3,{2}}, 1, {}, {1,0} , {}}", KEEP_EMPTY);
        // subsets with the same count are ordered by their number of elements
        assertThat(t.render(), is("{1,{},{3,{2}},{0,1}}"));
        assertThat(t.subtreeAt(1).subtreeAt(0).render(), is("{2}"));
    }

    @Test
    public void auto_wrap() {
        assertThat(parse("3,1,{2},1", AUTO_WRAP).render(), is("{1,3,{2}}"));
        assertThat(parse("{1,2}", AUTO_WRAP).render(), is("{1,2}"));
        assertThat(parse("  {2,1}  ", AUTO_WRAP).render(), is("{1,2}"));
        assertThat(parse("{1},{2}", AUTO_WRAP).render(), is("{{1},{2}}"));
    }

    @Test
    public void missing_braces_without_auto_wrap() {
        try {
            parse("1,2", KEEP_EMPTY);
            fail();
        } catch (BraceMismatchException ex) {
            assertThat(ex.getMissingBrace(), is(MissingBrace.BOTH));
        }
    }

    @Test
    public void unbalanced_braces() {
        try {
            parse("{1,{2}", AUTO_WRAP);
            fail();
        } catch (BraceMismatchException ex) {
            assertThat(ex.getMissingBrace(), is(MissingBrace.CLOSING));
        }
    }

    @Test
    public void text_after_closing_brace() {
        try {
            parse("{{1}2,3}", KEEP_EMPTY);
            fail();
        } catch (BraceMismatchException ex) {
            assertThat(ex.getMissingBrace(), is(MissingBrace.NONE));
            assertThat(ex.getExpression(), is("{1}2"));
            assertThat(ex.getPosition(), is(3));
        }
    }

    @Test
    public void brace_inside_element() {
        try {
            parse("{1,2{3}}", KEEP_EMPTY);
            fail();
        } catch (BraceMismatchException ex) {
            assertThat(ex.getMissingBrace(), is(MissingBrace.NONE));
            assertThat(ex.getPosition(), is(1));
        }
    }

    @Test
    public void conversion_failure() {
        try {
            parse("{1,a}", KEEP_EMPTY);
            fail();
        } catch (SetsOperationException ex) {
            assertThat(ex.getCause(), is(instanceOf(NumberFormatException.class)));
            assertThat(ex.getDetails(), containsString("'a'"));
        }
    }

    @Test
    public void converter_returning_null() {
        try {
            SetTreeParser.parse("{1}", KEEP_EMPTY, ElementConverters.<Integer>of(s -> null));
            fail();
        } catch (SetsOperationException ex) {
            assertThat(ex.getDetails(), containsString("null"));
        }
    }

    @Test
    public void strings() {
        SetTree<String> t = SetTreeParser.parse("{ pear , apple,{fig}}", KEEP_EMPTY, ElementConverters.strings());
        assertThat(t.render(), is("{apple,pear,{fig}}"));
    }

    @Test
    public void decimals() {
        SetTree<BigDecimal> t = SetTreeParser.parse("{1.0,1.00,0.5}", KEEP_EMPTY, ElementConverters.bigDecimals());
        assertThat(t.elementCount(), is(2));
        assertThat(t.elementAt(0), is(new BigDecimal("0.5")));
    }

    @Test
    public void custom_comparator() {
        SetTreeParser<Integer> parser = new SetTreeParser<>(KEEP_EMPTY, ElementConverters.integers(), reverseOrder());
        assertThat(parser.parse("{1,3,2}").render(), is("{3,2,1}"));
    }

    @Test
    public void multi_character_delimiter() {
        SetsConfiguration config = SetsConfiguration.of("::");
        assertThat(parse("{1::2::{3::4}::}", config).render(), is("{1::2::{}::{3::4}}"));
    }

    @Test
    public void multi_field_records() {
        SetsConfiguration config = SetsConfiguration.of(";", "|");
        ElementConverter<String> pairs = ElementConverters.ofFields(f -> f.get(0) + "=" + f.get(1));
        SetTree<String> t = SetTreeParser.parse("{b; 2| a ;1| ; |{c;3}}", config, pairs);
        assertThat(t.render(), is("{a=1|b=2|{c=3}}"));
        assertThat(t.info().getNullElementCount(), is(1));
    }

    @Test
    public void round_trip() {
        Random rnd = new Random(99);
        SetTreeParser<Integer> parser = SetTreeParser.of(KEEP_EMPTY, ElementConverters.integers());
        for (int i = 0; i < 100; i++) {
            SetTree<Integer> t = random(rnd, 3);
            String rendered = t.render();
            assertThat(parser.parse(rendered).render(), is(rendered));
            assertThat(parser.parse(rendered), is(t));
        }
    }

    private static SetTree<Integer> random(Random rnd, int depth) {
        SortedSetTree<Integer> t = new SortedSetTree<>(KEEP_EMPTY, naturalOrder());
        int n = rnd.nextInt(5);
        for (int i = 0; i < n; i++) {
            t.addElement(rnd.nextInt(20) - 10);
        }
        if (depth > 0) {
            int m = rnd.nextInt(3);
            for (int i = 0; i < m; i++) {
                t.addSubtree(random(rnd, depth - 1));
            }
        }
        return t;
    }

    @Test
    public void flat_list_with_auto_wrap() {
        SetTree<Integer> t = parse("1,2,3", AUTO_WRAP);
        assertThat(t.render(), is("{1,2,3}"));
        assertThat(t.elementCount(), is(3));
        assertThat(t.subtreeCount(), is(0));
    }

    @Test
    public void elements_and_one_subset() {
        SetTree<Integer> t = parse("{1,2,{3,4}}", KEEP_EMPTY);
        assertThat(t.elementCount(), is(2));
        assertThat(t.subtreeCount(), is(1));
        assertThat(t.subtreeAt(0).render(), is("{3,4}"));
    }

    @Test
    public void unclosed_outer_brace_without_auto_wrap() {
        try {
            parse("{1,2,{3,4}", KEEP_EMPTY);
            fail("missing closing brace should be reported");
        } catch (BraceMismatchException ex) {
            assertThat(ex.getMissingBrace(), is(MissingBrace.CLOSING));
            assertThat(ex.getPosition(), is(0));
        }
    }

    @Test
    public void empty_element_kept() {
        SetTree<Integer> t = parse("{1,,3}", KEEP_EMPTY);
        assertThat(t.render(), is("{1,3,{}}"));
        assertThat(t.elementCount(), is(2));
        assertTrue(t.info().hasNullElements());
    }

    @Test
    public void empty_element_ignored() {
        SetTree<Integer> t = parse("{1,,3}", IGNORE_EMPTY);
        assertThat(t.render(), is("{1,3}"));
        assertThat(t.elementCount(), is(2));
        assertThat(t.subtreeCount(), is(0));
        assertTrue(t.info().hasNullElements());
    }

    @Test
    public void duplicates_with_auto_wrap() {
        SetTree<Integer> t = parse("2,2,1,3,1", AUTO_WRAP);
        assertThat(t.render(), is("{1,2,3}"));
        assertThat(t.elementAt(0), is(1));
        assertThat(t.elementAt(2), is(3));
    }
}
