// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.simplestream;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;

@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(1)
@Warmup(iterations = 3, time = 10, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 10, timeUnit = TimeUnit.SECONDS)
@State(Scope.Benchmark)
public class BufferedSourceReaderBenchmark {

    private static final int DATA_SIZE = 1024 * 1024;
    private static final int RECORD_SIZE = 100;
    private static final List<byte[]> DELIMITERS = Arrays.asList(
        "\r\n".getBytes(StandardCharsets.US_ASCII),
        "\n".getBytes(StandardCharsets.US_ASCII)
    );

    @Param({"512", "4096", "65536"})
    public int chunkSize;

    @Param({"FIRST_IN_LIST", "LONGEST"})
    public DelimiterMatchingMode matchingMode;

    private byte[] data;
    private SourceReaderConfiguration configuration;

    @Setup
    public void setup() {
        // Lines of 1 to 2 * RECORD_SIZE printable bytes, alternating line endings.
        Random random = new Random(42);
        data = new byte[DATA_SIZE];
        int i = 0;
        boolean crlf = false;
        while (i < DATA_SIZE) {
            int lineLength = 1 + random.nextInt(2 * RECORD_SIZE);
            for (int j = 0; j < lineLength && i < DATA_SIZE; j++) {
                data[i++] = (byte) ('a' + random.nextInt(26));
            }
            if (crlf && i < DATA_SIZE) {
                data[i++] = '\r';
            }
            if (i < DATA_SIZE) {
                data[i++] = '\n';
            }
            crlf = !crlf;
        }
        configuration = SourceReaderConfiguration.Builder.standard()
            .withInitialBufferSize(8 * 1024)
            .build();
    }

    private SourceReader newReader() {
        return new BufferedSourceReader(new ByteArrayByteSource(data, chunkSize), configuration);
    }

    @Benchmark
    public long readExact() throws IOException {
        SourceReader reader = newReader();
        long sum = 0;
        for (int i = 0; i < DATA_SIZE / RECORD_SIZE; i++) {
            sum += reader.readData(RECORD_SIZE, bytes -> bytes.get(0));
        }
        return sum;
    }

    @Benchmark
    public void readDelimited(Blackhole bh) throws IOException {
        SourceReader reader = newReader();
        while (true) {
            try {
                bh.consume(reader.readData(DELIMITERS, matchingMode, false, (bytes, index, delimiter) -> bytes.remaining()));
            } catch (DelimitersNotFoundException e) {
                bh.consume(reader.readToEnd());
                return;
            }
        }
    }
}
