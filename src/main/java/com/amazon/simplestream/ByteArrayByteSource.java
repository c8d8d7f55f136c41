// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.simplestream;

/**
 * An in-memory {@link ByteSource}. A maximum chunk size may be given to deliver the bytes in small pieces, which
 * simulates a slow or fragmented source such as a socket.
 */
public final class ByteArrayByteSource implements ByteSource {

    private final byte[] bytes;
    private final int end;
    private final int maximumChunkSize;
    private int position;
    private int numberOfFills = 0;

    public ByteArrayByteSource(byte[] bytes) {
        this(bytes, 0, bytes.length, Integer.MAX_VALUE);
    }

    public ByteArrayByteSource(byte[] bytes, int maximumChunkSize) {
        this(bytes, 0, bytes.length, maximumChunkSize);
    }

    /**
     * @param bytes the bytes to deliver. Not copied; must not be modified while in use.
     * @param offset the index of the first byte to deliver.
     * @param length the number of bytes to deliver.
     * @param maximumChunkSize the maximum number of bytes delivered by a single call to {@link #fill}.
     */
    public ByteArrayByteSource(byte[] bytes, int offset, int length, int maximumChunkSize) {
        if (offset < 0 || length < 0 || offset + length > bytes.length) {
            throw new IllegalArgumentException("Invalid region for a byte array of length " + bytes.length + ".");
        }
        if (maximumChunkSize < 1) {
            throw new IllegalArgumentException("Maximum chunk size must be at least 1.");
        }
        this.bytes = bytes;
        this.position = offset;
        this.end = offset + length;
        this.maximumChunkSize = maximumChunkSize;
    }

    @Override
    public int fill(byte[] buffer, int offset, int maxLength) {
        numberOfFills++;
        int length = Math.min(Math.min(maxLength, maximumChunkSize), end - position);
        System.arraycopy(bytes, position, buffer, offset, length);
        position += length;
        return length;
    }

    /**
     * @return the number of bytes that have not been delivered yet.
     */
    public int remaining() {
        return end - position;
    }

    /**
     * @return the number of times {@link #fill} has been called, including calls that reported the end of the data.
     */
    public int getNumberOfFills() {
        return numberOfFills;
    }
}
