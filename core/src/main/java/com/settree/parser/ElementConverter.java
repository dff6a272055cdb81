/**
 * Set Tree Library
 * Copyright (c) 2026 Set Tree Project.
 * All rights reserved.
 */

package com.settree.parser;

import com.settree.config.SetsConfiguration;

/**
 * Converts the text of one element into an element value.
 *
 * @param <T> the type of elements
 * @see ElementConverters
 */
@FunctionalInterface
public interface ElementConverter<T> {
    /**
     * Converts an element token. The token is trimmed and is never empty.
     * Multi-field records can be split with {@link SetsConfiguration#fields}.
     *
     * @param token the element text
     * @param config the configuration in effect
     * @return the element, never {@code null}
     * @throws RuntimeException if the token cannot be converted
     */
    T toObject(String token, SetsConfiguration config);
}
