// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.simplestream;

import java.io.IOException;

/**
 * A source of bytes that a {@link BufferedSourceReader} pulls from. Implementations may block until data is
 * available; the reader performs no timeouts or cancellation of its own.
 *
 * @see InputStreamByteSource
 * @see ReadableByteChannelByteSource
 * @see ByteArrayByteSource
 */
public interface ByteSource {

    /**
     * Reads at most `maxLength` bytes into the given buffer.
     * @param buffer the destination buffer.
     * @param offset the index in `buffer` at which to write the first byte.
     * @param maxLength the maximum number of bytes to write. Always greater than zero.
     * @return the number of bytes actually written, between 0 and `maxLength`. Zero means that the end of the data
     *  has been reached.
     * @throws IOException if the source fails. The exception is propagated to the reader's caller unchanged.
     */
    int fill(byte[] buffer, int offset, int maxLength) throws IOException;
}
