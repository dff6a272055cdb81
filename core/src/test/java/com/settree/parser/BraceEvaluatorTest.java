/**
 * Set Tree Library
 * Copyright (c) 2026 Set Tree Project.
 * All rights reserved.
 */

package com.settree.parser;

import org.junit.Test;
import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import com.settree.BraceMismatchException;

public class BraceEvaluatorTest
{
    @Test
    public void balanced() {
        BraceEvaluator.check("{}");
        BraceEvaluator.check("{1,2,{3,{4}},{}}");
        assertTrue(BraceEvaluator.areBracesCorrect("{{},{{}}}"));
    }

    @Test
    public void missing_both() {
        expect("1,2,3", MissingBrace.BOTH, -1);
    }

    @Test
    public void missing_opening() {
        expect("1,2}", MissingBrace.OPENING, 0);
        expect("{1,2}},{3}", MissingBrace.OPENING, 4);
    }

    @Test
    public void missing_closing() {
        expect("{1,2", MissingBrace.CLOSING, 4);
        expect("{1,{2,{3}", MissingBrace.CLOSING, 3);
        expect("{", MissingBrace.CLOSING, 1);
    }

    @Test
    public void closed_early() {
        expect("{1,2},{3,4}", MissingBrace.OPENING, 4);
    }

    @Test
    public void single_group() {
        assertTrue(BraceEvaluator.isSingleGroup("{1,{2}}"));
        assertTrue(BraceEvaluator.isSingleGroup("{}"));
        assertFalse(BraceEvaluator.isSingleGroup("{1},{2}"));
        assertFalse(BraceEvaluator.isSingleGroup("1,2"));
        assertFalse(BraceEvaluator.isSingleGroup("{1,2"));
        assertFalse(BraceEvaluator.isSingleGroup(""));
    }

    @Test
    public void details_point_at_position() {
        try {
            BraceEvaluator.check("{1,2");
            fail();
        } catch (BraceMismatchException ex) {
            assertThat(ex.getDetails(), is("{1,2\n    ^"));
            assertThat(ex.getMessage(), containsString(" - Details: {1,2"));
        }
    }

    private static void expect(String expression, MissingBrace missing, int position) {
        try {
            BraceEvaluator.check(expression);
            fail("Unbalanced braces accepted: " + expression);
        } catch (BraceMismatchException ex) {
            assertThat(ex.getMissingBrace(), is(missing));
            assertThat(ex.getPosition(), is(position));
            assertThat(ex.getExpression(), is(expression));
        }
        assertFalse(BraceEvaluator.areBracesCorrect(expression));
    }
}
