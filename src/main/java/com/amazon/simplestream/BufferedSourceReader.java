// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.simplestream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.List;

/**
 * A {@link SourceReader} that pulls from a {@link ByteSource} into a single reusable buffer. Bytes are pulled only
 * when the buffer does not already hold enough of them, and as many as fit are pulled at once to reduce calls to the
 * source.
 * <p>
 * The source is referenced, not owned. This class is not thread-safe: the buffer is modified in place by every read,
 * so concurrent use requires external synchronization.
 */
public final class BufferedSourceReader implements SourceReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(BufferedSourceReader.class);

    private static final byte[] NO_DELIMITER = new byte[0];

    private final ByteSource source;

    private final ReadBuffer buffer;

    private final SourceReaderConfiguration.DataHandler dataHandler;

    /**
     * The maximum total number of bytes that may be pulled from the source.
     */
    private long readSizeLimit;

    private long currentReadPosition = 0;

    private long totalBytesRead = 0;

    /**
     * Constructs a reader with the {@link SourceReaderConfiguration#DEFAULT default} configuration.
     * @param source the source to read from.
     */
    public BufferedSourceReader(ByteSource source) {
        this(source, SourceReaderConfiguration.DEFAULT);
    }

    /**
     * @param source the source to read from.
     * @param configuration the buffer sizes, read size limit, and data handler to use.
     */
    public BufferedSourceReader(ByteSource source, SourceReaderConfiguration configuration) {
        if (source == null) {
            throw new NullPointerException("source");
        }
        this.source = source;
        this.buffer = new ReadBuffer(configuration.getInitialBufferSize(), configuration.getBufferSizeIncrement());
        this.readSizeLimit = configuration.getReadSizeLimit();
        this.dataHandler = configuration.getDataHandler();
    }

    @Override
    public <T, E extends Exception> T readData(int size, ByteViewHandler<T, E> handler) throws IOException, E {
        if (size < 0) {
            throw new IllegalArgumentException("Cannot read a negative number of bytes: " + size);
        }
        buffer.prepareFor(size);
        if (buffer.length() < size) {
            // Fail before pulling anything if the limit cannot accommodate the shortfall.
            ReadSizeLimit.require(totalBytesRead, readSizeLimit, size - buffer.length());
            do {
                // Fill all the free space allowed, not just the shortfall; this reduces calls to the source.
                if (pull(ReadSizeLimit.allowed(totalBytesRead, readSizeLimit, buffer.freeSpace())) == 0) {
                    throw new NoMoreDataException(size, buffer.length());
                }
            } while (buffer.length() < size);
        }
        ByteBuffer data = buffer.view(0, size);
        buffer.consume(size);
        currentReadPosition += size;
        return handler.handle(data);
    }

    @Override
    public <T, E extends Exception> T readData(
        List<byte[]> delimiters,
        DelimiterMatchingMode matchingMode,
        boolean includeDelimiter,
        DelimitedViewHandler<T, E> handler
    ) throws IOException, E {
        DelimiterMatcher matcher = new DelimiterMatcher(delimiters, matchingMode);
        int searchOffset = 0;
        while (true) {
            DelimiterMatcher.Match match = matcher.find(
                buffer.array(), buffer.start(), buffer.length(), searchOffset, false
            );
            if (match != null) {
                return deliver(match, delimiters, includeDelimiter, handler);
            }
            searchOffset = matcher.nextSearchOffset(buffer.length());
            buffer.makeRoom();
            int allowed = ReadSizeLimit.allowed(totalBytesRead, readSizeLimit, buffer.freeSpace());
            if (allowed == 0) {
                LOGGER.debug("Read size limit of {} bytes reached while searching for delimiters.", readSizeLimit);
                break;
            }
            if (pull(allowed) == 0) {
                break;
            }
        }
        // No more bytes will arrive; delimiters cut off by the end of the window can no longer match.
        DelimiterMatcher.Match match = matcher.find(buffer.array(), buffer.start(), buffer.length(), searchOffset, true);
        if (match != null) {
            return deliver(match, delimiters, includeDelimiter, handler);
        }
        if (!matcher.isEmpty()) {
            throw new DelimitersNotFoundException();
        }
        int length = buffer.length();
        ByteBuffer data = buffer.view(0, length);
        buffer.consume(length);
        currentReadPosition += length;
        return handler.handle(data, -1, NO_DELIMITER);
    }

    private <T, E extends Exception> T deliver(
        DelimiterMatcher.Match match,
        List<byte[]> delimiters,
        boolean includeDelimiter,
        DelimitedViewHandler<T, E> handler
    ) throws E {
        int consumed = match.offset + match.delimiterLength;
        ByteBuffer data = buffer.view(0, includeDelimiter ? consumed : match.offset);
        buffer.consume(consumed);
        currentReadPosition += consumed;
        return handler.handle(data, match.delimiterIndex, delimiters.get(match.delimiterIndex));
    }

    /**
     * Pulls up to `maxLength` bytes from the source into the buffer.
     * @param maxLength the maximum number of bytes to pull. Must be positive and fit in the buffer's free space.
     * @return the number of bytes pulled; zero at the end of the data.
     * @throws IOException if thrown by the source.
     */
    private int pull(int maxLength) throws IOException {
        int numberOfBytesPulled = buffer.fill(source, maxLength);
        LOGGER.trace("Pulled {} of {} requested bytes from the source.", numberOfBytesPulled, maxLength);
        if (numberOfBytesPulled > 0) {
            totalBytesRead += numberOfBytesPulled;
            dataHandler.onData(numberOfBytesPulled);
        }
        return numberOfBytesPulled;
    }

    @Override
    public long getCurrentReadPosition() {
        return currentReadPosition;
    }

    @Override
    public long getTotalBytesRead() {
        return totalBytesRead;
    }

    /**
     * @return the maximum total number of bytes that may be pulled from the source, or
     *  {@link ReadSizeLimit#UNLIMITED}.
     */
    public long getReadSizeLimit() {
        return readSizeLimit;
    }

    /**
     * Changes the maximum total number of bytes that may be pulled from the source. A limit lower than
     * {@link #getTotalBytesRead()} prevents any further pull.
     * @param readSizeLimit the new limit, or {@link ReadSizeLimit#UNLIMITED}.
     */
    public void setReadSizeLimit(long readSizeLimit) {
        if (readSizeLimit < 0) {
            throw new IllegalArgumentException("Read size limit must not be negative.");
        }
        this.readSizeLimit = readSizeLimit;
    }

    ReadBuffer getBuffer() {
        return buffer;
    }
}
