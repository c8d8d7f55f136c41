// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.simplestream;

import java.nio.ByteBuffer;

/**
 * Receives the bytes delivered by a read up to a delimiter.
 * @param <T> the type of value produced from the bytes.
 * @param <E> the type of exception the handler may throw.
 */
@FunctionalInterface
public interface DelimitedViewHandler<T, E extends Exception> {

    /**
     * @param data a read-only view of the bytes, positioned at zero, including the delimiter if so requested. The
     *             view is backed by the reader's internal buffer and must not be used after this method returns.
     * @param delimiterIndex the index of the matched delimiter in the requested list, or -1 if the list was empty and
     *                       the data runs to the end of the source.
     * @param delimiter the matched delimiter, as given by the caller, or an empty array if `delimiterIndex` is -1.
     * @return a value, returned by the read method to its caller.
     * @throws E if handler logic fails. Propagates to the read method's caller unchanged.
     */
    T handle(ByteBuffer data, int delimiterIndex, byte[] delimiter) throws E;
}
