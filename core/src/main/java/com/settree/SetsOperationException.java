/**
 * Set Tree Library
 * Copyright (c) 2026 Set Tree Project.
 * All rights reserved.
 */

package com.settree;

/**
 * Thrown when an operation on sets fails, including the conversion of a
 * token into an element. The original failure is kept as the cause.
 */
public class SetsOperationException extends SetsException {
    private static final long serialVersionUID = 8815170523365730196L;

    public SetsOperationException(String message, String details) {
        super(message, details);
    }

    public SetsOperationException(String message, String details, Throwable cause) {
        super(message, details, cause);
    }
}
