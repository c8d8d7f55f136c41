// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.simplestream;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.ReadableByteChannel;
import java.nio.channels.SelectableChannel;

/**
 * A {@link ByteSource} over a {@link ReadableByteChannel}, e.g. a {@link java.nio.channels.FileChannel} or a
 * {@link java.nio.channels.SocketChannel}. The channel must be in blocking mode. The channel is referenced, not owned.
 */
public final class ReadableByteChannelByteSource implements ByteSource {

    private final ReadableByteChannel channel;

    /**
     * @param channel the channel to read from. Must not be null.
     * @throws IllegalArgumentException if the channel is selectable and configured in non-blocking mode, because
     *  a non-blocking read that returns no bytes would be indistinguishable from the end of the data.
     */
    public ReadableByteChannelByteSource(ReadableByteChannel channel) {
        if (channel == null) {
            throw new NullPointerException("channel");
        }
        if (channel instanceof SelectableChannel && !((SelectableChannel) channel).isBlocking()) {
            throw new IllegalArgumentException("The channel must be in blocking mode.");
        }
        this.channel = channel;
    }

    @Override
    public int fill(byte[] buffer, int offset, int maxLength) throws IOException {
        int numberOfBytesRead;
        ByteBuffer destination = ByteBuffer.wrap(buffer, offset, maxLength);
        do {
            numberOfBytesRead = channel.read(destination);
        } while (numberOfBytesRead == 0);
        return numberOfBytesRead < 0 ? 0 : numberOfBytesRead;
    }
}
