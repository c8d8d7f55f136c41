// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.simplestream;

/**
 * Base class for exceptions thrown throughout this library. Errors raised by a {@link ByteSource} are not wrapped;
 * they propagate as the {@link java.io.IOException} the source threw.
 */
public class SimpleStreamException extends RuntimeException
{
    private static final long serialVersionUID = 3126093516580164721L;

    public SimpleStreamException() { super(); }
    public SimpleStreamException(String message) { super(message); }
    public SimpleStreamException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Constructs a new exception with the given cause, copying the message
     * from the cause into this instance.
     * @param cause
     *     the root cause of the exception; must not be null.
     */
    public SimpleStreamException(Throwable cause) { super(cause.getMessage(), cause); }
}
