// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.simplestream;

import java.util.List;

/**
 * Searches a window of bytes that is revealed incrementally for the earliest occurrence of any of a list of
 * delimiters. A match is only reported once no delimiter whose end has not been received yet could still win.
 */
final class DelimiterMatcher {

    /**
     * The winning occurrence of a delimiter.
     */
    static final class Match {

        /**
         * Offset of the first delimiter byte from the start of the window.
         */
        final int offset;

        /**
         * Index of the delimiter in the caller's list.
         */
        final int delimiterIndex;

        final int delimiterLength;

        Match(int offset, int delimiterIndex, int delimiterLength) {
            this.offset = offset;
            this.delimiterIndex = delimiterIndex;
            this.delimiterLength = delimiterLength;
        }
    }

    private final byte[][] delimiters;
    private final DelimiterMatchingMode matchingMode;
    private final int maximumLength;

    /**
     * @param delimiters the delimiters. May be empty, in which case nothing ever matches. Each delimiter is copied.
     * @param matchingMode the policy applied when several delimiters occur at the same offset.
     * @throws IllegalArgumentException if any delimiter is empty.
     */
    DelimiterMatcher(List<byte[]> delimiters, DelimiterMatchingMode matchingMode) {
        if (matchingMode == null) {
            throw new NullPointerException("matchingMode");
        }
        this.delimiters = new byte[delimiters.size()][];
        int max = 0;
        for (int i = 0; i < this.delimiters.length; i++) {
            byte[] delimiter = delimiters.get(i);
            if (delimiter == null) {
                throw new NullPointerException("Delimiter " + i + " is null.");
            }
            if (delimiter.length == 0) {
                throw new IllegalArgumentException("Delimiter " + i + " is empty.");
            }
            this.delimiters[i] = delimiter.clone();
            max = Math.max(max, delimiter.length);
        }
        this.matchingMode = matchingMode;
        this.maximumLength = max;
    }

    boolean isEmpty() {
        return delimiters.length == 0;
    }

    /**
     * @param windowLength the number of bytes in a window that contains no winning match.
     * @return the lowest offset at which an occurrence could still start once more bytes are appended to the window.
     *  Every offset before it has been compared against every delimiter in full.
     */
    int nextSearchOffset(int windowLength) {
        return Math.min(windowLength, Math.max(0, windowLength - maximumLength + 1));
    }

    /**
     * Searches the window from the given offset.
     * @param data the region holding the window.
     * @param windowStart the index of the first window byte in `data`.
     * @param windowLength the number of bytes in the window.
     * @param searchOffset the offset, relative to the window, at which to begin. No occurrence may start before it.
     * @param endOfData true if no more bytes will be appended to the window. Delimiters that are cut off by the end of
     *  the window can then never match.
     * @return the winning match, or null if there is none yet (or none at all, if `endOfData`).
     */
    Match find(byte[] data, int windowStart, int windowLength, int searchOffset, boolean endOfData) {
        for (int offset = searchOffset; offset < windowLength; offset++) {
            int available = windowLength - offset;
            int position = windowStart + offset;
            int winner = -1;
            int lowestPendingIndex = -1;
            for (int i = 0; i < delimiters.length; i++) {
                byte[] delimiter = delimiters[i];
                if (delimiter.length <= available) {
                    if (regionMatches(data, position, delimiter, delimiter.length)
                        && (winner < 0 || matchingMode.prefers(delimiter.length, delimiters[winner].length))) {
                        winner = i;
                    }
                } else if (!endOfData && lowestPendingIndex < 0 && regionMatches(data, position, delimiter, available)) {
                    lowestPendingIndex = i;
                }
            }
            if (lowestPendingIndex >= 0) {
                // A delimiter may start here but its end has not arrived; nothing after this offset can win yet, and a
                // match here is only final if the pending delimiter cannot outrank it.
                if (winner < 0 || matchingMode.canBeOutrankedByLongerDelimiter(winner, lowestPendingIndex)) {
                    return null;
                }
            }
            if (winner >= 0) {
                return new Match(offset, winner, delimiters[winner].length);
            }
        }
        return null;
    }

    private static boolean regionMatches(byte[] data, int position, byte[] delimiter, int numberOfBytes) {
        for (int i = 0; i < numberOfBytes; i++) {
            if (data[position + i] != delimiter[i]) {
                return false;
            }
        }
        return true;
    }
}
