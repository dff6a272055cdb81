/**
 * Set Tree Library
 * Copyright (c) 2026 Set Tree Project.
 * All rights reserved.
 */

package com.settree.parser;

import java.math.BigDecimal;
import java.util.List;
import java.util.function.Function;

import com.settree.config.SetsConfiguration;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Static factory methods for common {@link ElementConverter}s.
 */
public final class ElementConverters {
    private ElementConverters() {}

    private static final ElementConverter<Integer> INTEGERS = of("Integer", Integer::valueOf);
    private static final ElementConverter<Long> LONGS = of("Long", Long::valueOf);
    private static final ElementConverter<Double> DOUBLES = of("Double", Double::valueOf);
    private static final ElementConverter<BigDecimal> BIG_DECIMALS = of("BigDecimal", BigDecimal::new);
    private static final ElementConverter<String> STRINGS = of("String", Function.identity());
    private static final ElementConverter<Boolean> BOOLEANS = of("Boolean", ElementConverters::parseBoolean);

    public static ElementConverter<Integer> integers() {
        return INTEGERS;
    }

    public static ElementConverter<Long> longs() {
        return LONGS;
    }

    public static ElementConverter<Double> doubles() {
        return DOUBLES;
    }

    public static ElementConverter<BigDecimal> bigDecimals() {
        return BIG_DECIMALS;
    }

    public static ElementConverter<String> strings() {
        return STRINGS;
    }

    public static ElementConverter<Boolean> booleans() {
        return BOOLEANS;
    }

    /**
     * Returns a converter that applies the given function to the trimmed token.
     */
    public static <T> ElementConverter<T> of(Function<String, ? extends T> f) {
        return of("custom", f);
    }

    /**
     * Returns a converter that splits the token on the field terminator and
     * applies the given function to the trimmed fields.
     */
    public static <T> ElementConverter<T> ofFields(Function<List<String>, ? extends T> f) {
        checkNotNull(f);
        return new ElementConverter<T>() {
            @Override
            public T toObject(String token, SetsConfiguration config) {
                return f.apply(config.fields(token));
            }

            public String toString() {
                return "ElementConverter[fields]";
            }
        };
    }

    private static <T> ElementConverter<T> of(String name, Function<String, ? extends T> f) {
        checkNotNull(f);
        return new ElementConverter<T>() {
            @Override
            public T toObject(String token, SetsConfiguration config) {
                return f.apply(token.trim());
            }

            public String toString() {
                return "ElementConverter[" + name + "]";
            }
        };
    }

    private static Boolean parseBoolean(String s) {
        if ("true".equalsIgnoreCase(s))
            return Boolean.TRUE;
        if ("false".equalsIgnoreCase(s))
            return Boolean.FALSE;
        throw new IllegalArgumentException("Not a boolean: " + s);
    }
}
