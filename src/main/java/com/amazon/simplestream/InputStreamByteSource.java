// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.simplestream;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;

/**
 * A {@link ByteSource} over a blocking {@link InputStream}. The stream is referenced, not owned; closing it remains
 * the caller's responsibility.
 */
public final class InputStreamByteSource implements ByteSource {

    private final InputStream inputStream;

    /**
     * @param inputStream the stream to read from. Must not be null.
     */
    public InputStreamByteSource(InputStream inputStream) {
        if (inputStream == null) {
            throw new NullPointerException("inputStream");
        }
        this.inputStream = inputStream;
    }

    @Override
    public int fill(byte[] buffer, int offset, int maxLength) throws IOException {
        int numberOfBytesRead;
        try {
            numberOfBytesRead = inputStream.read(buffer, offset, maxLength);
        } catch (EOFException e) {
            // Certain InputStream implementations (e.g. GZIPInputStream) throw EOFException if more bytes are requested
            // than are available (e.g. if a trailer is incomplete).
            return 0;
        }
        return numberOfBytesRead < 0 ? 0 : numberOfBytesRead;
    }
}
