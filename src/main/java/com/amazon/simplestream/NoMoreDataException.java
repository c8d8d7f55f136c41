// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.simplestream;

/**
 * Thrown when the source reaches its end while an exact-size read still needs more bytes. Bytes pulled before the
 * end was detected stay buffered, so the reader's position does not change and a smaller read may still succeed.
 */
public class NoMoreDataException extends SimpleStreamException {

    private static final long serialVersionUID = -1937301646457010735L;

    public NoMoreDataException(int requested, int available) {
        super(String.format(
            "Reached the end of the data after %d of the %d requested bytes.",
            available,
            requested
        ));
    }
}
