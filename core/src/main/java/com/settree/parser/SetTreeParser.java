/**
 * Set Tree Library
 * Copyright (c) 2026 Set Tree Project.
 * All rights reserved.
 */

package com.settree.parser;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.base.CharMatcher;

import com.settree.BraceMismatchException;
import com.settree.SetsOperationException;
import com.settree.config.SetsConfiguration;
import com.settree.tree.SetTree;
import com.settree.tree.SortedSetTree;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Parses set expressions such as {@code {1,2,{3,{}}}} into set trees.
 *
 * <p>Elements are separated by the row terminator of the configuration and
 * converted by an {@link ElementConverter}. A token that is empty or holds
 * only blank fields is an <em>empty element</em>: it is counted in the
 * {@link com.settree.tree.SetTreeInfo diagnostics} of the enclosing tree and,
 * unless empty fields are ignored, contributes an empty subset.</p>
 *
 * <p>Parsers are immutable and may be shared between threads.</p>
 *
 * @param <T> the type of elements
 */
public class SetTreeParser<T> {
    private static final Logger logger = Logger.getLogger(SetTreeParser.class.getName());

    private static final CharMatcher BRACES = CharMatcher.anyOf("{}");

    private final SetsConfiguration configuration;
    private final ElementConverter<? extends T> converter;
    private final Comparator<? super T> comparator;

    /**
     * Construct a parser.
     *
     * @param configuration the terminators and parsing options
     * @param converter converts element tokens
     * @param comparator orders the elements of parsed trees
     * @throws NullPointerException if any argument is null
     */
    public SetTreeParser(SetsConfiguration configuration,
                         ElementConverter<? extends T> converter,
                         Comparator<? super T> comparator) {
        this.configuration = checkNotNull(configuration, "configuration");
        this.converter = checkNotNull(converter, "converter");
        this.comparator = checkNotNull(comparator, "comparator");
    }

    /**
     * Returns a parser for elements in their natural ordering.
     */
    public static <T extends Comparable<? super T>> SetTreeParser<T>
    of(SetsConfiguration configuration, ElementConverter<? extends T> converter) {
        return new SetTreeParser<>(configuration, converter, Comparator.naturalOrder());
    }

    /**
     * Parses the text with a parser for elements in their natural ordering.
     *
     * @see #parse(String)
     */
    public static <T extends Comparable<? super T>> SetTree<T>
    parse(String text, SetsConfiguration configuration, ElementConverter<? extends T> converter) {
        return SetTreeParser.<T>of(configuration, converter).parse(text);
    }

    public SetsConfiguration configuration() {
        return configuration;
    }

    /**
     * Returns a new empty tree with the configuration and ordering of this parser.
     */
    public SetTree<T> emptyTree() {
        return new SortedSetTree<>(configuration, comparator);
    }

    /**
     * Parses a set expression.
     *
     * @param text the set expression
     * @return a new tree owned by the caller
     * @throws NullPointerException if text is null and braces are not added automatically
     * @throws IllegalArgumentException if text is blank and braces are not added automatically
     * @throws BraceMismatchException if the braces are not balanced or
     *         do not enclose whole elements
     * @throws SetsOperationException if an element cannot be converted
     */
    public SetTree<T> parse(String text) {
        String expression = prepare(text);
        BraceEvaluator.check(expression);

        SortedSetTree<T> tree = parseGroup(expression);
        logger.fine(() -> "Parsed " + expression + " into " + tree.render());
        return tree;
    }

    private String prepare(String text) {
        if (configuration.isAutoWrapBraces()) {
            String expression = text == null ? "" : text.trim();
            return BraceEvaluator.isSingleGroup(expression) ? expression : "{" + expression + "}";
        }

        checkNotNull(text, "text");
        String expression = text.trim();
        checkArgument(!expression.isEmpty(), "The set expression is blank");
        return expression;
    }

    // the group is a balanced {...}
    private SortedSetTree<T> parseGroup(String group) {
        SortedSetTree<T> tree = new SortedSetTree<>(configuration, comparator);
        String body = group.substring(1, group.length() - 1);
        if (body.trim().isEmpty()) {
            return tree;
        }

        int empty = 0;
        for (String raw : split(body)) {
            String token = raw.trim();
            if (token.startsWith("{")) {
                int end = BraceEvaluator.matchingBrace(token, 0);
                if (end != token.length() - 1) {
                    throw new BraceMismatchException("Unexpected characters after a closing brace.",
                        MissingBrace.NONE, token, end + 1);
                }
                tree.addSubtree(parseGroup(token));
            } else if (isEmptyElement(token)) {
                empty++;
                if (!configuration.isIgnoreEmptyFields()) {
                    tree.addSubtree(tree.newEmpty());
                }
            } else {
                int brace = BRACES.indexIn(token);
                if (brace != -1) {
                    throw new BraceMismatchException("Braces must enclose whole elements.",
                        MissingBrace.NONE, token, brace);
                }
                tree.addElement(convert(token));
            }
        }

        tree.recordNullElements(empty);
        return tree;
    }

    /**
     * Splits the body of a group on the row terminator, skipping terminators
     * inside nested groups.
     */
    private List<String> split(String body) {
        String delimiter = configuration.getRowTerminator();
        List<String> tokens = new ArrayList<>();
        int depth = 0, start = 0, i = 0;
        while (i < body.length()) {
            char ch = body.charAt(i);
            if (ch == '{') {
                depth++;
            } else if (ch == '}') {
                depth--;
            } else if (depth == 0 && body.startsWith(delimiter, i)) {
                tokens.add(body.substring(start, i));
                i += delimiter.length();
                start = i;
                continue;
            }
            i++;
        }
        tokens.add(body.substring(start));
        return tokens;
    }

    private boolean isEmptyElement(String token) {
        if (token.isEmpty())
            return true;
        for (String field : configuration.fields(token)) {
            if (!field.isEmpty())
                return false;
        }
        return true;
    }

    private T convert(String token) {
        T value;
        try {
            value = converter.toObject(token, configuration);
        } catch (RuntimeException ex) {
            logger.log(Level.FINE, "Failed to convert '" + token + "'", ex);
            throw new SetsOperationException("Conversion failed due to an invalid format.",
                "Failed to convert the string '" + token + "' with " + converter + ".", ex);
        }

        if (value == null) {
            throw new SetsOperationException("Unable to complete the conversion, check the configuration.",
                "The string '" + token + "' was converted to null by " + converter + ".");
        }
        return value;
    }

    public String toString() {
        return "SetTreeParser[" + configuration + "]";
    }
}
