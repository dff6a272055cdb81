/**
 * Set Tree Library
 * Copyright (c) 2026 Set Tree Project.
 * All rights reserved.
 */

package com.settree;

/**
 * Thrown when a set configuration is invalid: a terminator is empty, both
 * terminators are the same, or a terminator contains a reserved character.
 */
public class SetsConfigurationException extends SetsException {
    private static final long serialVersionUID = -3384750920016372211L;

    public SetsConfigurationException(String message) {
        super(message);
    }

    public SetsConfigurationException(String message, String details) {
        super(message, details);
    }

    public SetsConfigurationException(String message, String details, Throwable cause) {
        super(message, details, cause);
    }
}
