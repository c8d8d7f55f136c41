// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.simplestream;

/**
 * A copy of the bytes read up to a delimiter, along with the delimiter that ended them.
 */
public final class DelimitedBytes {

    private final byte[] data;
    private final int delimiterIndex;
    private final byte[] delimiter;

    DelimitedBytes(byte[] data, int delimiterIndex, byte[] delimiter) {
        this.data = data;
        this.delimiterIndex = delimiterIndex;
        this.delimiter = delimiter;
    }

    /**
     * @return the bytes read, including the delimiter only if it was requested.
     */
    public byte[] getData() {
        return data;
    }

    /**
     * @return the index of the matched delimiter in the requested list, or -1 if the data runs to the end of the
     *  source.
     */
    public int getDelimiterIndex() {
        return delimiterIndex;
    }

    /**
     * @return the matched delimiter, or an empty array if the data runs to the end of the source.
     */
    public byte[] getDelimiter() {
        return delimiter;
    }
}
