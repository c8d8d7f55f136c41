// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.simplestream;

/**
 * Thrown when an exact-size read would need to pull more bytes from the source than the configured read size limit
 * allows. No bytes are pulled from the source when this is thrown, and the reader's position does not change.
 */
public class ReadSizeLimitExceededException extends SimpleStreamException {

    private static final long serialVersionUID = 2394755260612785430L;

    public ReadSizeLimitExceededException(long requested, long remaining) {
        super(String.format(
            "Reading %d more bytes from the source would exceed the read size limit (%d bytes remaining).",
            requested,
            remaining
        ));
    }
}
