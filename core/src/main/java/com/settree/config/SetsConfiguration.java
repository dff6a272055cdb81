/**
 * Set Tree Library
 * Copyright (c) 2026 Set Tree Project.
 * All rights reserved.
 */

package com.settree.config;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

import com.google.common.base.CharMatcher;
import com.google.common.base.MoreObjects;
import com.google.common.base.Splitter;

import com.settree.SetsConfigurationException;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The immutable settings used to parse and render set expressions.
 *
 * <p>The <em>row terminator</em> separates the elements of a set, and the
 * <em>field terminator</em> separates the fields of a single element record
 * when elements are built from several values. Neither terminator may be
 * empty or contain a brace, and they must differ from each other.</p>
 */
public final class SetsConfiguration implements Serializable {
    private static final long serialVersionUID = -6152904826341073381L;

    /**
     * Characters that have a structural meaning in set expressions.
     */
    public static final String RESERVED_CHARACTERS = "{}";

    /**
     * The field terminator used when only an element delimiter is given.
     */
    public static final String DEFAULT_FIELD_TERMINATOR = "\t";

    public static final String DEFAULT_ROW_TERMINATOR = ",";

    private static final CharMatcher RESERVED = CharMatcher.anyOf(RESERVED_CHARACTERS);

    private final String fieldTerminator;
    private final String rowTerminator;
    private final boolean ignoreEmptyFields;
    private final boolean autoWrapBraces;

    private SetsConfiguration(Builder b) {
        validate(b.fieldTerminator, b.rowTerminator);
        this.fieldTerminator = b.fieldTerminator;
        this.rowTerminator = b.rowTerminator;
        this.ignoreEmptyFields = b.ignoreEmptyFields;
        this.autoWrapBraces = b.autoWrapBraces;
    }

    /**
     * Creates a configuration with the given element delimiter, without
     * automatic braces and keeping empty fields.
     */
    public static SetsConfiguration of(String elementDelimiter) {
        return of(elementDelimiter, false, false);
    }

    /**
     * Creates a configuration with the given element delimiter and the
     * default field terminator.
     *
     * @param elementDelimiter the string separating elements
     * @param autoWrapBraces whether expressions without outer braces are wrapped
     * @param ignoreEmptyFields whether empty elements are dropped from the tree
     * @throws SetsConfigurationException if the delimiter is invalid
     */
    public static SetsConfiguration of(String elementDelimiter, boolean autoWrapBraces, boolean ignoreEmptyFields) {
        return builder()
            .rowTerminator(elementDelimiter)
            .autoWrapBraces(autoWrapBraces)
            .ignoreEmptyFields(ignoreEmptyFields)
            .build();
    }

    /**
     * Creates a configuration for multi-field elements. Empty fields are
     * ignored and braces are not added automatically.
     */
    public static SetsConfiguration of(String fieldTerminator, String rowTerminator) {
        return of(fieldTerminator, rowTerminator, true, false);
    }

    /**
     * Creates a configuration for multi-field elements.
     *
     * @throws SetsConfigurationException if a terminator is invalid
     */
    public static SetsConfiguration of(String fieldTerminator, String rowTerminator,
                                       boolean ignoreEmptyFields, boolean autoWrapBraces) {
        return builder()
            .fieldTerminator(fieldTerminator)
            .rowTerminator(rowTerminator)
            .ignoreEmptyFields(ignoreEmptyFields)
            .autoWrapBraces(autoWrapBraces)
            .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder initialized with the settings of this configuration.
     */
    public Builder toBuilder() {
        return new Builder()
            .fieldTerminator(fieldTerminator)
            .rowTerminator(rowTerminator)
            .ignoreEmptyFields(ignoreEmptyFields)
            .autoWrapBraces(autoWrapBraces);
    }

    public static final class Builder {
        private String fieldTerminator = DEFAULT_FIELD_TERMINATOR;
        private String rowTerminator = DEFAULT_ROW_TERMINATOR;
        private boolean ignoreEmptyFields;
        private boolean autoWrapBraces;

        Builder() {}

        public Builder fieldTerminator(String fieldTerminator) {
            this.fieldTerminator = fieldTerminator;
            return this;
        }

        public Builder rowTerminator(String rowTerminator) {
            this.rowTerminator = rowTerminator;
            return this;
        }

        public Builder ignoreEmptyFields(boolean ignoreEmptyFields) {
            this.ignoreEmptyFields = ignoreEmptyFields;
            return this;
        }

        public Builder autoWrapBraces(boolean autoWrapBraces) {
            this.autoWrapBraces = autoWrapBraces;
            return this;
        }

        /**
         * Validates the settings and creates the configuration.
         *
         * @throws NullPointerException if a terminator is null
         * @throws SetsConfigurationException if a terminator is invalid
         */
        public SetsConfiguration build() {
            return new SetsConfiguration(this);
        }
    }

    private static void validate(String fieldTerminator, String rowTerminator) {
        checkNotNull(fieldTerminator, "fieldTerminator");
        checkNotNull(rowTerminator, "rowTerminator");

        if (fieldTerminator.isEmpty() || rowTerminator.isEmpty()) {
            throw new SetsConfigurationException("Terminators cannot be empty.");
        }

        if (fieldTerminator.equals(rowTerminator)) {
            throw new SetsConfigurationException("Terminators cannot be the same.",
                "Both terminators are '" + rowTerminator + "'.");
        }

        checkReserved("field terminator", fieldTerminator);
        checkReserved("row terminator", rowTerminator);
    }

    private static void checkReserved(String what, String terminator) {
        int i = RESERVED.indexIn(terminator);
        if (i != -1) {
            throw new SetsConfigurationException("Cannot use reserved characters.",
                "The characters " + RESERVED_CHARACTERS + " cannot be used in any of the terminators."
                + "\nThe " + what + " contains a reserved character at index " + i + ".");
        }
    }

    public String getFieldTerminator() {
        return fieldTerminator;
    }

    /**
     * Returns the string that separates the elements of a set.
     */
    public String getRowTerminator() {
        return rowTerminator;
    }

    /**
     * Returns whether empty elements are left out of parsed trees. Empty
     * elements are still counted in the tree diagnostics.
     */
    public boolean isIgnoreEmptyFields() {
        return ignoreEmptyFields;
    }

    /**
     * Returns whether expressions not enclosed in braces are wrapped in a
     * pair of braces before parsing.
     */
    public boolean isAutoWrapBraces() {
        return autoWrapBraces;
    }

    /**
     * Splits an element record into its fields. Each field is trimmed.
     */
    public List<String> fields(String record) {
        return Splitter.on(fieldTerminator).trimResults().splitToList(checkNotNull(record));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof SetsConfiguration))
            return false;
        SetsConfiguration other = (SetsConfiguration)obj;
        return fieldTerminator.equals(other.fieldTerminator)
            && rowTerminator.equals(other.rowTerminator)
            && ignoreEmptyFields == other.ignoreEmptyFields
            && autoWrapBraces == other.autoWrapBraces;
    }

    @Override
    public int hashCode() {
        return Objects.hash(fieldTerminator, rowTerminator, ignoreEmptyFields, autoWrapBraces);
    }

    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("fieldTerminator", fieldTerminator)
            .add("rowTerminator", rowTerminator)
            .add("ignoreEmptyFields", ignoreEmptyFields)
            .add("autoWrapBraces", autoWrapBraces)
            .toString();
    }
}
