// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.simplestream.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class SimpleStreamCliTest {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String input, String... args) {
        return SimpleStreamCli.run(
            args,
            new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)),
            new PrintStream(out, true),
            new PrintStream(err, true)
        );
    }

    private String stdout() {
        return new String(out.toByteArray(), StandardCharsets.UTF_8);
    }

    private String stderr() {
        return new String(err.toByteArray(), StandardCharsets.UTF_8);
    }

    @Test
    public void splitWritesEachRecordFollowedBySeparator() {
        assertEquals(SimpleStreamCli.SUCCESS_EXIT_CODE, run("a,b,,c", "split", "-d", ",", "-s", "|"));
        assertThat(stdout(), equalTo("a|b||c|"));
    }

    @Test
    public void splitCanIncludeDelimiters() {
        assertEquals(SimpleStreamCli.SUCCESS_EXIT_CODE, run("a,b,,c", "split", "-d", ",", "-s", "|", "-i"));
        assertThat(stdout(), equalTo("a,|b,|,|c|"));
    }

    @Test
    public void splitOnSeveralEscapedDelimiters() {
        assertEquals(SimpleStreamCli.SUCCESS_EXIT_CODE,
            run("a\r\nb\nc", "split", "-d", "\\r\\n", "-d", "\\n", "--separator", "|"));
        assertThat(stdout(), equalTo("a|b|c|"));
    }

    @Test
    public void splitWithLongestMatchingMode() {
        assertEquals(SimpleStreamCli.SUCCESS_EXIT_CODE,
            run("a\r\nb", "split", "-d", "\\r", "-d", "\\r\\n", "-m", "longest", "-s", "|"));
        assertThat(stdout(), equalTo("a|b|"));
    }

    @Test
    public void countReportsRecordsAndPosition() {
        assertEquals(SimpleStreamCli.SUCCESS_EXIT_CODE, run("a,b,,c", "count", "-d", ","));
        assertThat(stdout(), equalTo("-\t4\t6\n"));
    }

    @Test
    public void emptyInputHasNoRecords() {
        assertEquals(SimpleStreamCli.SUCCESS_EXIT_CODE, run("", "split"));
        assertThat(stdout(), equalTo(""));
    }

    @Test
    public void readLimitTruncatesInput() {
        assertEquals(SimpleStreamCli.SUCCESS_EXIT_CODE, run("abcdef", "split", "-l", "3"));
        assertThat(stdout(), equalTo("abc\n"));
    }

    @Test
    public void smallBufferGrowsForLongRecords() {
        assertEquals(SimpleStreamCli.SUCCESS_EXIT_CODE,
            run("a long record\nshort\n", "split", "-b", "2", "--buffer-increment", "3", "-s", "|"));
        assertThat(stdout(), equalTo("a long record|short|"));
    }

    @Test
    public void readsAndWritesFiles(@TempDir Path directory) throws IOException {
        Path first = directory.resolve("first.txt");
        Path second = directory.resolve("second.txt");
        Path output = directory.resolve("out.txt");
        Files.write(first, "1\n2\n".getBytes(StandardCharsets.UTF_8));
        Files.write(second, "3".getBytes(StandardCharsets.UTF_8));
        assertEquals(SimpleStreamCli.SUCCESS_EXIT_CODE,
            run("", "split", "-o", output.toString(), first.toString(), second.toString()));
        assertThat(new String(Files.readAllBytes(output), StandardCharsets.UTF_8), equalTo("1\n2\n3\n"));
        assertThat(stdout(), equalTo(""));
    }

    @Test
    public void countsEachFile(@TempDir Path directory) throws IOException {
        Path first = directory.resolve("lines.txt");
        Path second = directory.resolve("unterminated.txt");
        Files.write(first, "x\ny\nz\n".getBytes(StandardCharsets.UTF_8));
        Files.write(second, "q\nr".getBytes(StandardCharsets.UTF_8));
        assertEquals(SimpleStreamCli.SUCCESS_EXIT_CODE, run("ignored", "count", first.toString(), second.toString()));
        assertThat(stdout(), equalTo(first + "\t3\t6\n" + second + "\t2\t3\n"));
    }

    @Test
    public void version() {
        assertEquals(SimpleStreamCli.SUCCESS_EXIT_CODE, run("", "-v"));
        assertThat(stderr(), containsString("1.0"));
    }

    @Test
    public void help() {
        assertEquals(SimpleStreamCli.SUCCESS_EXIT_CODE, run("", "--help"));
        assertThat(stderr(), containsString("Usage:"));
    }

    @Test
    public void usageErrors() {
        assertEquals(SimpleStreamCli.USAGE_ERROR_EXIT_CODE, run("", "split", "-m", "fastest"));
        assertEquals(SimpleStreamCli.USAGE_ERROR_EXIT_CODE, run("", "explode"));
        assertEquals(SimpleStreamCli.USAGE_ERROR_EXIT_CODE, run(""));
        assertEquals(SimpleStreamCli.USAGE_ERROR_EXIT_CODE, run("", "split", "-d", "\\q"));
        assertEquals(SimpleStreamCli.USAGE_ERROR_EXIT_CODE, run("", "split", "-b", "0"));
        assertEquals(SimpleStreamCli.USAGE_ERROR_EXIT_CODE, run("", "split", "--unknown"));
        assertThat(stderr(), containsString("Usage:"));
    }

    @Test
    public void missingInputIsAnIOError(@TempDir Path directory) {
        String missing = directory.resolve("missing.txt").toString();
        assertEquals(SimpleStreamCli.IO_ERROR_EXIT_CODE, run("", "split", missing));
        assertThat(stderr(), containsString("Error: "));
    }
}
