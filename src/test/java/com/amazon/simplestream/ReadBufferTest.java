// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.simplestream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;

import static com.amazon.simplestream.SourceReaderTestUtilities.ALL_AT_ONCE;
import static com.amazon.simplestream.SourceReaderTestUtilities.bufferSize;
import static com.amazon.simplestream.SourceReaderTestUtilities.bytes;
import static com.amazon.simplestream.SourceReaderTestUtilities.delimiters;
import static com.amazon.simplestream.SourceReaderTestUtilities.reader;
import static com.amazon.simplestream.SourceReaderTestUtilities.string;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ReadBufferTest {

    private static final String ALPHABET = "abcdefghijklmnopqrstuvwxyz";

    private static String window(ReadBuffer buffer) {
        return string(SourceReader.copy(buffer.view(0, buffer.length())));
    }

    @Test
    public void prepareForAppliesSizingPolicy() throws IOException {
        ByteArrayByteSource source = new ByteArrayByteSource(bytes(ALPHABET));
        ReadBuffer buffer = new ReadBuffer(8, 4);
        assertEquals(8, buffer.fill(source, 8));
        buffer.consume(6);
        assertEquals(6, buffer.start());

        // Fits after the current start: nothing moves.
        buffer.prepareFor(2);
        assertEquals(6, buffer.start());

        // Fits in the default capacity: consolidated in place.
        buffer.prepareFor(4);
        assertEquals(0, buffer.start());
        assertEquals(8, buffer.capacity());
        assertEquals(1, buffer.numberOfAllocations());
        assertEquals("gh", window(buffer));

        // Too large for the current capacity: reallocated to fit exactly.
        buffer.prepareFor(12);
        assertEquals(12, buffer.capacity());
        assertEquals(2, buffer.numberOfAllocations());
        assertEquals("gh", window(buffer));
        assertEquals(10, buffer.freeSpace());
        assertEquals(10, buffer.fill(source, buffer.freeSpace()));
        assertEquals("ghijklmnopqr", window(buffer));

        // Fits in the current (oversized) capacity only: consolidated in place.
        buffer.consume(3);
        buffer.prepareFor(10);
        assertEquals(0, buffer.start());
        assertEquals(12, buffer.capacity());
        assertEquals(2, buffer.numberOfAllocations());
        assertEquals("jklmnopqr", window(buffer));

        // Fits in the default capacity again: shrinks back.
        buffer.consume(9);
        buffer.prepareFor(5);
        assertEquals(8, buffer.capacity());
        assertEquals(8, buffer.defaultCapacity());
        assertEquals(3, buffer.numberOfAllocations());
        assertEquals(0, buffer.length());
    }

    @Test
    public void makeRoomConsolidatesBeforeGrowing() throws IOException {
        ByteArrayByteSource source = new ByteArrayByteSource(bytes(ALPHABET));
        ReadBuffer buffer = new ReadBuffer(4, 3);
        buffer.makeRoom();
        assertEquals(4, buffer.capacity());

        buffer.fill(source, 4);
        buffer.makeRoom();
        assertEquals(7, buffer.capacity());
        assertEquals(2, buffer.numberOfAllocations());
        assertEquals("abcd", window(buffer));

        buffer.consume(2);
        assertEquals(3, buffer.fill(source, buffer.freeSpace()));
        buffer.makeRoom();
        assertEquals(0, buffer.start());
        assertEquals(7, buffer.capacity());
        assertEquals(2, buffer.numberOfAllocations());
        assertEquals("cdefg", window(buffer));
        assertEquals(2, buffer.freeSpace());
    }

    @Test
    public void invalidCapacitiesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ReadBuffer(0, 1));
        assertThrows(IllegalArgumentException.class, () -> new ReadBuffer(1, 0));
    }

    @ParameterizedTest(name = "chunkSize={0}")
    @ValueSource(ints = {1, 2, 4, ALL_AT_ONCE})
    public void oversizedExactReadReallocatesOnceThenShrinks(int chunkSize) throws IOException {
        BufferedSourceReader reader = reader(ALPHABET + ALPHABET, chunkSize, bufferSize(8));
        ReadBuffer buffer = reader.getBuffer();
        assertEquals(8, buffer.capacity());

        assertEquals(ALPHABET.substring(0, 20), string(reader.readBytes(20)));
        assertEquals(20, buffer.capacity());
        assertEquals(2, buffer.numberOfAllocations());

        assertEquals(ALPHABET.substring(20, 24), string(reader.readBytes(4)));
        assertEquals(8, buffer.capacity());
        assertEquals(3, buffer.numberOfAllocations());
    }

    @ParameterizedTest(name = "chunkSize={0}")
    @ValueSource(ints = {1, 2, 4, ALL_AT_ONCE})
    public void delimiterSearchGrowsByIncrement(int chunkSize) throws IOException {
        SourceReaderConfiguration configuration = SourceReaderConfiguration.Builder.standard()
            .withInitialBufferSize(4)
            .withBufferSizeIncrement(3)
            .build();
        BufferedSourceReader reader = reader("0123456789\n", chunkSize, configuration);
        DelimitedBytes line = reader.readBytes(delimiters("\n"), DelimiterMatchingMode.FIRST_IN_LIST, false);
        assertEquals("0123456789", string(line.getData()));
        assertEquals(13, reader.getBuffer().capacity());
        assertEquals(4, reader.getBuffer().numberOfAllocations());
    }

    @ParameterizedTest(name = "chunkSize={0}")
    @ValueSource(ints = {1, 2, 4, ALL_AT_ONCE})
    public void delimiterSearchConsolidatesInsteadOfGrowing(int chunkSize) throws IOException {
        BufferedSourceReader reader = reader("abc\ndefghij\n", chunkSize, bufferSize(8));
        assertEquals("abc", string(reader.readBytes(delimiters("\n"), DelimiterMatchingMode.FIRST_IN_LIST, false).getData()));
        assertEquals("defghij", string(reader.readBytes(delimiters("\n"), DelimiterMatchingMode.FIRST_IN_LIST, false).getData()));
        assertEquals(8, reader.getBuffer().capacity());
        assertEquals(1, reader.getBuffer().numberOfAllocations());
    }
}
