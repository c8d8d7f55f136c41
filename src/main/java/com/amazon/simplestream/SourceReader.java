// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.simplestream;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Collections;
import java.util.List;

/**
 * Reads a source sequentially, either a given number of bytes at a time or up to a delimiter. Bytes are delivered
 * to a handler as a view into the reader's buffer, which avoids copying them.
 * <p>
 * Implementations are not thread-safe.
 */
public interface SourceReader {

    /**
     * Reads exactly `size` bytes.
     * @param size the number of bytes to read. Must not be negative.
     * @param handler the handler that receives the bytes.
     * @param <T> the type of the handler's result.
     * @param <E> the type of exception the handler may throw.
     * @return the handler's result.
     * @throws NoMoreDataException if the source ends before `size` bytes are available.
     * @throws ReadSizeLimitExceededException if the read would exceed the read size limit.
     * @throws IOException if thrown by the source.
     * @throws E if thrown by the handler.
     */
    <T, E extends Exception> T readData(int size, ByteViewHandler<T, E> handler) throws IOException, E;

    /**
     * Reads up to and including the earliest occurrence of any of the given delimiters. The delimiter is always
     * consumed; the next read begins after it.
     * @param delimiters the delimiters, none of which may be empty. If the list is empty, all bytes up to the end of
     *                   the source (or of the read size limit) are read.
     * @param matchingMode decides between delimiters that occur at the same offset.
     * @param includeDelimiter whether the delimiter bytes are included in the data given to the handler.
     * @param handler the handler that receives the bytes.
     * @param <T> the type of the handler's result.
     * @param <E> the type of exception the handler may throw.
     * @return the handler's result.
     * @throws DelimitersNotFoundException if the source ends without any delimiter occurring. Nothing is consumed.
     * @throws IOException if thrown by the source.
     * @throws E if thrown by the handler.
     */
    <T, E extends Exception> T readData(
        List<byte[]> delimiters,
        DelimiterMatchingMode matchingMode,
        boolean includeDelimiter,
        DelimitedViewHandler<T, E> handler
    ) throws IOException, E;

    /**
     * @return the number of bytes consumed from this reader so far, i.e. the offset in the source of the next byte to
     *  be read.
     */
    long getCurrentReadPosition();

    /**
     * @return the number of bytes pulled from the source so far. This is greater than the read position when bytes
     *  have been buffered ahead.
     */
    long getTotalBytesRead();

    /**
     * Reads exactly `size` bytes into a new array.
     * @param size the number of bytes to read.
     * @return the bytes.
     * @throws IOException if thrown by the source.
     * @see #readData(int, ByteViewHandler)
     */
    default byte[] readBytes(int size) throws IOException {
        return readData(size, SourceReader::copy);
    }

    /**
     * Reads up to the earliest occurrence of any of the given delimiters, copying the bytes.
     * @param delimiters the delimiters.
     * @param matchingMode decides between delimiters that occur at the same offset.
     * @param includeDelimiter whether the delimiter bytes are included in the returned data.
     * @return the bytes and the matched delimiter.
     * @throws IOException if thrown by the source.
     * @see #readData(List, DelimiterMatchingMode, boolean, DelimitedViewHandler)
     */
    default DelimitedBytes readBytes(
        List<byte[]> delimiters,
        DelimiterMatchingMode matchingMode,
        boolean includeDelimiter
    ) throws IOException {
        return readData(
            delimiters,
            matchingMode,
            includeDelimiter,
            (data, delimiterIndex, delimiter) -> new DelimitedBytes(copy(data), delimiterIndex, delimiter)
        );
    }

    /**
     * Reads all remaining bytes up to the end of the source, or up to the read size limit.
     * @return the bytes; empty if none remain.
     * @throws IOException if thrown by the source.
     */
    default byte[] readToEnd() throws IOException {
        return readData(
            Collections.<byte[]>emptyList(),
            DelimiterMatchingMode.FIRST_IN_LIST,
            false,
            (data, delimiterIndex, delimiter) -> copy(data)
        );
    }

    /**
     * Consumes exactly `size` bytes without delivering them.
     * @param size the number of bytes to skip.
     * @throws IOException if thrown by the source.
     */
    default void skip(int size) throws IOException {
        readData(size, data -> null);
    }

    static byte[] copy(ByteBuffer view) {
        byte[] bytes = new byte[view.remaining()];
        view.get(bytes);
        return bytes;
    }
}
