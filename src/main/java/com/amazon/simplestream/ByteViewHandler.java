// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.simplestream;

import java.nio.ByteBuffer;

/**
 * Receives the bytes delivered by an exact-size read.
 * @param <T> the type of value produced from the bytes.
 * @param <E> the type of exception the handler may throw.
 */
@FunctionalInterface
public interface ByteViewHandler<T, E extends Exception> {

    /**
     * @param data a read-only view of the bytes, positioned at zero. The view is backed by the reader's internal
     *             buffer and must not be used after this method returns; copy the bytes to keep them.
     * @return a value, returned by the read method to its caller.
     * @throws E if handler logic fails. Propagates to the read method's caller unchanged.
     */
    T handle(ByteBuffer data) throws E;
}
