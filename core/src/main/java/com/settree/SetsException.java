/**
 * Set Tree Library
 * Copyright (c) 2026 Set Tree Project.
 * All rights reserved.
 */

package com.settree;

/**
 * The root of the exceptions raised by the set tree library. Besides the
 * message, an exception may carry additional details which are appended to
 * the message to help locating the offending input.
 */
public class SetsException extends RuntimeException {
    private static final long serialVersionUID = 4125904718374952761L;

    private final String details;

    public SetsException(String message) {
        this(message, null, null);
    }

    public SetsException(String message, String details) {
        this(message, details, null);
    }

    public SetsException(String message, String details, Throwable cause) {
        super(message, cause);
        this.details = details;
    }

    /**
     * Returns the details of this exception, or {@code null} if there are none.
     */
    public String getDetails() {
        return details;
    }

    @Override
    public String getMessage() {
        String message = super.getMessage();
        return details == null || details.isEmpty()
            ? message
            : message + "\n - Details: " + details;
    }
}
