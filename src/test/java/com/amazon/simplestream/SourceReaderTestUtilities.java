// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.simplestream;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Helpers shared by the reader tests.
 */
public class SourceReaderTestUtilities {

    /**
     * The chunk sizes with which sources deliver bytes in parameterized tests. The last delivers everything at once.
     */
    public static final int ALL_AT_ONCE = Integer.MAX_VALUE;

    private SourceReaderTestUtilities() {
        // Not instantiable.
    }

    public static byte[] bytes(String ascii) {
        return ascii.getBytes(StandardCharsets.US_ASCII);
    }

    public static String string(byte[] bytes) {
        return new String(bytes, StandardCharsets.US_ASCII);
    }

    public static List<byte[]> delimiters(String... delimiters) {
        List<byte[]> list = new ArrayList<>(delimiters.length);
        for (String delimiter : delimiters) {
            list.add(bytes(delimiter));
        }
        return list;
    }

    public static SourceReaderConfiguration bufferSize(int initialBufferSize) {
        return SourceReaderConfiguration.Builder.standard()
            .withInitialBufferSize(initialBufferSize)
            .build();
    }

    public static BufferedSourceReader reader(String data, int chunkSize) {
        return reader(data, chunkSize, SourceReaderConfiguration.DEFAULT);
    }

    public static BufferedSourceReader reader(String data, int chunkSize, SourceReaderConfiguration configuration) {
        return new BufferedSourceReader(new ByteArrayByteSource(bytes(data), chunkSize), configuration);
    }
}
