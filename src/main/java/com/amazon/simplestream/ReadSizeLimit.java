// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.simplestream;

/**
 * Policy bounding the total number of bytes pulled from a source.
 */
public final class ReadSizeLimit {

    /**
     * Disables the limit.
     */
    public static final long UNLIMITED = Long.MAX_VALUE;

    private ReadSizeLimit() {
        // Not instantiable.
    }

    /**
     * @param totalBytesRead the number of bytes already pulled from the source.
     * @param limit the maximum total number of bytes that may be pulled, or {@link #UNLIMITED}.
     * @return the number of bytes that may still be pulled; zero if the limit is reached or already exceeded.
     */
    public static long remaining(long totalBytesRead, long limit) {
        return Math.max(0, limit - totalBytesRead);
    }

    /**
     * @param totalBytesRead the number of bytes already pulled from the source.
     * @param limit the maximum total number of bytes that may be pulled, or {@link #UNLIMITED}.
     * @param requested the number of bytes that would be pulled next.
     * @return the number of bytes that may be pulled next, between zero and `requested`. Zero means that the limit
     *  has been reached; callers scanning for delimiters treat this as the end of the data.
     */
    public static int allowed(long totalBytesRead, long limit, int requested) {
        return (int) Math.min(requested, remaining(totalBytesRead, limit));
    }

    /**
     * @param totalBytesRead the number of bytes already pulled from the source.
     * @param limit the maximum total number of bytes that may be pulled, or {@link #UNLIMITED}.
     * @param required the number of bytes that must be pulled to satisfy a read.
     * @throws ReadSizeLimitExceededException if pulling `required` bytes would exceed the limit.
     */
    public static void require(long totalBytesRead, long limit, long required) {
        long remaining = remaining(totalBytesRead, limit);
        if (totalBytesRead > limit || required > remaining) {
            throw new ReadSizeLimitExceededException(required, remaining);
        }
    }
}
