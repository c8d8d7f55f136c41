// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.simplestream.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class EscapesTest {

    @Test
    public void plainTextIsUtf8() {
        assertArrayEquals("é,".getBytes(StandardCharsets.UTF_8), Escapes.unescape("é,"));
        assertArrayEquals(new byte[0], Escapes.unescape(""));
    }

    @Test
    public void escapes() {
        assertArrayEquals(new byte[] {'\r', '\n', '\t', 0, '\\'}, Escapes.unescape("\\r\\n\\t\\0\\\\"));
        assertArrayEquals(new byte[] {'a', (byte) 0xFF, 'b', 0x1f}, Escapes.unescape("a\\xffb\\x1F"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"\\", "a\\", "\\q", "\\x", "\\x1", "\\x+1", "\\xzz"})
    public void invalidEscapesAreRejected(String text) {
        assertThrows(IllegalArgumentException.class, () -> Escapes.unescape(text));
    }
}
