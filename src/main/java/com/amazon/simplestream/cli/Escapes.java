// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.simplestream.cli;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Converts command-line text into bytes, interpreting backslash escapes.
 */
final class Escapes {

    private Escapes() {
        // Not instantiable.
    }

    /**
     * Supported escapes: \n, \r, \t, \0, \\ and \xHH (exactly two hex digits). Other characters are encoded as UTF-8.
     * @param text the text.
     * @return the bytes.
     * @throws IllegalArgumentException if the text contains an unknown or incomplete escape.
     */
    static byte[] unescape(String text) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(text.length());
        int literalStart = 0;
        int i = 0;
        while (i < text.length()) {
            if (text.charAt(i) != '\\') {
                i++;
                continue;
            }
            byte[] literal = text.substring(literalStart, i).getBytes(StandardCharsets.UTF_8);
            bytes.write(literal, 0, literal.length);
            if (i + 1 >= text.length()) {
                throw new IllegalArgumentException("Incomplete escape at the end of \"" + text + "\"");
            }
            char escaped = text.charAt(i + 1);
            i += 2;
            switch (escaped) {
                case 'n':
                    bytes.write('\n');
                    break;
                case 'r':
                    bytes.write('\r');
                    break;
                case 't':
                    bytes.write('\t');
                    break;
                case '0':
                    bytes.write(0);
                    break;
                case '\\':
                    bytes.write('\\');
                    break;
                case 'x':
                    if (i + 2 > text.length()) {
                        throw new IllegalArgumentException("Incomplete \\x escape in \"" + text + "\"");
                    }
                    int high = Character.digit(text.charAt(i), 16);
                    int low = Character.digit(text.charAt(i + 1), 16);
                    if (high < 0 || low < 0) {
                        throw new IllegalArgumentException("Invalid \\x escape in \"" + text + "\"");
                    }
                    bytes.write((high << 4) | low);
                    i += 2;
                    break;
                default:
                    throw new IllegalArgumentException("Unknown escape \\" + escaped + " in \"" + text + "\"");
            }
            literalStart = i;
        }
        byte[] literal = text.substring(literalStart).getBytes(StandardCharsets.UTF_8);
        bytes.write(literal, 0, literal.length);
        return bytes.toByteArray();
    }
}
