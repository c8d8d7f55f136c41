// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.simplestream;

/**
 * Decides which delimiter wins when several of them occur at the same offset. An occurrence that starts at a smaller
 * offset always wins over one that starts later, regardless of the mode.
 */
public enum DelimiterMatchingMode {

    /**
     * The delimiter that appears first in the list of delimiters wins.
     */
    FIRST_IN_LIST {
        @Override
        boolean prefers(int candidateLength, int currentLength) {
            return false;
        }

        @Override
        boolean canBeOutrankedByLongerDelimiter(int candidateIndex, int lowestPendingIndex) {
            return lowestPendingIndex < candidateIndex;
        }
    },

    /**
     * The shortest delimiter wins. Delimiters of equal length are ranked by their order in the list.
     */
    SHORTEST {
        @Override
        boolean prefers(int candidateLength, int currentLength) {
            return candidateLength < currentLength;
        }

        @Override
        boolean canBeOutrankedByLongerDelimiter(int candidateIndex, int lowestPendingIndex) {
            return false;
        }
    },

    /**
     * The longest delimiter wins. Delimiters of equal length are ranked by their order in the list.
     */
    LONGEST {
        @Override
        boolean prefers(int candidateLength, int currentLength) {
            return candidateLength > currentLength;
        }

        @Override
        boolean canBeOutrankedByLongerDelimiter(int candidateIndex, int lowestPendingIndex) {
            return true;
        }
    };

    /**
     * @param candidateLength the length of a delimiter that matched, later in the list than the current winner.
     * @param currentLength the length of the current winner, which matched at the same offset.
     * @return true if the candidate replaces the current winner.
     */
    abstract boolean prefers(int candidateLength, int currentLength);

    /**
     * Determines whether a confirmed match may still lose to a delimiter that starts at the same offset but whose
     * end has not been received yet. Such a pending delimiter is necessarily longer than the confirmed one.
     * @param candidateIndex the list index of the confirmed delimiter.
     * @param lowestPendingIndex the lowest list index among the pending delimiters.
     * @return true if more data is needed before the confirmed match can be declared the winner.
     */
    abstract boolean canBeOutrankedByLongerDelimiter(int candidateIndex, int lowestPendingIndex);
}
