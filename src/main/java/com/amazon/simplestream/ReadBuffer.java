// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.simplestream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * Manages the single contiguous byte region used by a {@link BufferedSourceReader}, along with the window of bytes
 * that have been pulled from the source but not yet consumed. All compaction and reallocation of the region happens
 * here.
 * <p>
 * Two growth policies are supported:
 * <ol>
 *     <li>When the number of bytes needed is known (see {@link #prepareFor(int)}), the region is sized to fit that
 *     number exactly, and shrinks back to its default capacity as soon as a later request fits in it again.</li>
 *     <li>When the number of bytes needed is unknown (see {@link #makeRoom()}), the window is consolidated to the
 *     start of the region, and the region grows by a fixed increment only if it is already full from its start.</li>
 * </ol>
 */
final class ReadBuffer {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReadBuffer.class);

    /**
     * The preferred capacity of the region.
     */
    private final int defaultCapacity;

    /**
     * The number of bytes added to the capacity each time {@link #makeRoom()} must grow the region.
     */
    private final int capacityIncrement;

    /**
     * The region. Its length is the current capacity.
     */
    private byte[] buffer;

    /**
     * The index of the first unconsumed byte.
     */
    private int start = 0;

    /**
     * The number of unconsumed bytes, starting at `start`.
     */
    private int length = 0;

    private int numberOfAllocations = 1;

    ReadBuffer(int defaultCapacity, int capacityIncrement) {
        if (defaultCapacity < 1) {
            throw new IllegalArgumentException("Buffer capacity must be at least 1.");
        }
        if (capacityIncrement < 1) {
            throw new IllegalArgumentException("Buffer capacity increment must be at least 1.");
        }
        this.defaultCapacity = defaultCapacity;
        this.capacityIncrement = capacityIncrement;
        this.buffer = new byte[defaultCapacity];
    }

    /**
     * Ensures that `size` bytes can be held in the region from the start of the window, consolidating the window
     * to the start of the region or reallocating the region if necessary.
     * <ul>
     *     <li>If `size` bytes fit after the current start of the window, nothing changes.</li>
     *     <li>Otherwise, if `size` fits in the default capacity, the window is moved to the start of a region of the
     *     default capacity, releasing any larger region.</li>
     *     <li>Otherwise, if `size` fits in the current capacity, the window is moved to the start of the region.</li>
     *     <li>Otherwise, the window is moved to a new region of exactly `size` bytes.</li>
     * </ul>
     * @param size the number of bytes the window must be able to hold.
     */
    void prepareFor(int size) {
        int capacity = buffer.length;
        if (size <= capacity - start) {
            return;
        }
        if (size <= defaultCapacity) {
            if (capacity != defaultCapacity) {
                LOGGER.debug("Shrinking read buffer from {} to its default capacity of {} bytes.", capacity, defaultCapacity);
                moveWindowToStartOf(new byte[defaultCapacity]);
            } else {
                moveWindowToStartOf(buffer);
            }
        } else if (size <= capacity) {
            moveWindowToStartOf(buffer);
        } else {
            LOGGER.debug("Growing read buffer from {} to {} bytes to hold a single read.", capacity, size);
            moveWindowToStartOf(new byte[size]);
        }
    }

    /**
     * Ensures that there is free space after the window when the required amount is unknown. If the region is full
     * up to its end, the window is moved to the start of the region when it does not already begin there; otherwise
     * the region grows by the configured increment.
     */
    void makeRoom() {
        if (start + length < buffer.length) {
            return;
        }
        if (start > 0) {
            moveWindowToStartOf(buffer);
        } else {
            int newCapacity = buffer.length + capacityIncrement;
            if (newCapacity < 0) {
                throw new SimpleStreamException("The read buffer cannot grow beyond " + buffer.length + " bytes.");
            }
            LOGGER.debug("Growing read buffer from {} to {} bytes while searching for delimiters.", buffer.length, newCapacity);
            moveWindowToStartOf(new byte[newCapacity]);
        }
    }

    /**
     * Moves the window to index 0 of the destination, which may be the current region or a new one. A new region
     * replaces the current one.
     * @param destination the destination region.
     */
    private void moveWindowToStartOf(byte[] destination) {
        if (length > 0 && (destination != buffer || start > 0)) {
            System.arraycopy(buffer, start, destination, 0, length);
        }
        if (destination != buffer) {
            buffer = destination;
            numberOfAllocations++;
        }
        start = 0;
    }

    /**
     * Pulls up to `maxLength` bytes from the source into the free space after the window. The window only changes
     * if the pull succeeds.
     * @param source the source.
     * @param maxLength the maximum number of bytes to pull. Must be positive and no greater than
     *  {@link #freeSpace()}.
     * @return the number of bytes pulled; zero at the end of the data.
     * @throws IOException if thrown by the source.
     */
    int fill(ByteSource source, int maxLength) throws IOException {
        int numberOfBytesFilled = source.fill(buffer, start + length, maxLength);
        if (numberOfBytesFilled < 0 || numberOfBytesFilled > maxLength) {
            throw new IllegalStateException(String.format(
                "The source reported %d bytes read when at most %d were requested.", numberOfBytesFilled, maxLength
            ));
        }
        length += numberOfBytesFilled;
        return numberOfBytesFilled;
    }

    /**
     * @return the number of bytes that can be pulled into the region after the window without moving it.
     */
    int freeSpace() {
        return buffer.length - (start + length);
    }

    /**
     * Removes bytes from the beginning of the window.
     * @param numberOfBytes the number of bytes to remove; no greater than {@link #length()}.
     */
    void consume(int numberOfBytes) {
        start += numberOfBytes;
        length -= numberOfBytes;
    }

    /**
     * @param offset the offset from the start of the window.
     * @param numberOfBytes the number of bytes to view.
     * @return a read-only view of the given bytes, positioned at zero. Only valid until the window next changes.
     */
    ByteBuffer view(int offset, int numberOfBytes) {
        return ByteBuffer.wrap(buffer, start + offset, numberOfBytes).slice().asReadOnlyBuffer();
    }

    /**
     * @return the region. Window bytes begin at {@link #start()}.
     */
    byte[] array() {
        return buffer;
    }

    int start() {
        return start;
    }

    int length() {
        return length;
    }

    int capacity() {
        return buffer.length;
    }

    int defaultCapacity() {
        return defaultCapacity;
    }

    /**
     * @return the number of regions allocated over this buffer's lifetime, including the initial one.
     */
    int numberOfAllocations() {
        return numberOfAllocations;
    }
}
