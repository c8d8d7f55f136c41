// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.simplestream;

/**
 * Thrown when the end of the data (or of the data allowed to be read, see {@link ReadSizeLimit}) is reached while
 * searching for one or more delimiters, none of which occurred. The bytes that were scanned are not consumed; they
 * remain available to the next read.
 */
public class DelimitersNotFoundException extends SimpleStreamException {

    private static final long serialVersionUID = -6248171937655130364L;

    public DelimitersNotFoundException() {
        super("Reached the end of the data without finding any of the requested delimiters.");
    }
}
