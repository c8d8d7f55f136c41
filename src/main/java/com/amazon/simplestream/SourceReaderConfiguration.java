// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.simplestream;

/**
 * Configures {@link BufferedSourceReader} instances.
 */
public final class SourceReaderConfiguration {

    /**
     * Functional interface for reporting bytes pulled from the source.
     */
    public interface DataHandler {
        /**
         * Invoked after each successful pull from the source.
         * @param numberOfBytes the number of bytes pulled. Always greater than zero.
         */
        void onData(int numberOfBytes);
    }

    /**
     * Builds SourceReaderConfiguration instances.
     */
    public static final class Builder {

        /**
         * Large enough that most messages fit without growing the buffer.
         */
        static final int DEFAULT_INITIAL_BUFFER_SIZE = 32 * 1024; // bytes

        /**
         * A DataHandler that does nothing.
         */
        private static final DataHandler NO_OP_DATA_HANDLER = new DataHandler() {

            @Override
            public void onData(int numberOfBytes) {
                // Do nothing.
            }
        };

        private int initialBufferSize = DEFAULT_INITIAL_BUFFER_SIZE;

        /**
         * Zero means "same as the initial buffer size".
         */
        private int bufferSizeIncrement = 0;

        private long readSizeLimit = ReadSizeLimit.UNLIMITED;

        private DataHandler dataHandler = null;

        private Builder() {
            // Must be publicly instantiated via the factory method.
        }

        /**
         * Provides the standard builder with the default initial buffer size, a buffer size increment equal to the
         * initial buffer size, no read size limit, and a data handler that does nothing.
         * @return a standard Builder.
         */
        public static Builder standard() {
            return new Builder();
        }

        /**
         * Provides a new builder that would build SourceReaderConfiguration instances with configuration identical to
         * the given configuration.
         * @param existingConfiguration an existing configuration.
         * @return a new mutable builder.
         */
        public static Builder from(SourceReaderConfiguration existingConfiguration) {
            return standard()
                .withInitialBufferSize(existingConfiguration.getInitialBufferSize())
                .withBufferSizeIncrement(existingConfiguration.getBufferSizeIncrement())
                .withReadSizeLimit(existingConfiguration.getReadSizeLimit())
                .onData(existingConfiguration.getDataHandler());
        }

        /**
         * Sets the size of the buffer used to read from the source. More memory is allocated temporarily when a
         * single read needs more than this; the buffer shrinks back to this size afterward. Default: 32KB.
         * @param initialBufferSizeInBytes the value.
         * @return this builder.
         */
        public Builder withInitialBufferSize(final int initialBufferSizeInBytes) {
            initialBufferSize = initialBufferSizeInBytes;
            return this;
        }

        public int getInitialBufferSize() {
            return initialBufferSize;
        }

        /**
         * Sets the number of bytes by which the buffer grows when a delimiter search fills it entirely. Default:
         * the initial buffer size.
         * @param bufferSizeIncrementInBytes the value.
         * @return this builder.
         */
        public Builder withBufferSizeIncrement(final int bufferSizeIncrementInBytes) {
            bufferSizeIncrement = bufferSizeIncrementInBytes;
            return this;
        }

        public int getBufferSizeIncrement() {
            return bufferSizeIncrement == 0 ? initialBufferSize : bufferSizeIncrement;
        }

        /**
         * Sets the maximum total number of bytes that will ever be pulled from the source. Default:
         * {@link ReadSizeLimit#UNLIMITED}.
         * @param readSizeLimitInBytes the value.
         * @return this builder.
         */
        public Builder withReadSizeLimit(final long readSizeLimitInBytes) {
            readSizeLimit = readSizeLimitInBytes;
            return this;
        }

        public long getReadSizeLimit() {
            return readSizeLimit;
        }

        /**
         * Sets the handler that will be notified each time bytes are pulled from the source. May be null, in which
         * case nothing is reported.
         * @param handler the handler.
         * @return this builder.
         */
        public Builder onData(final DataHandler handler) {
            dataHandler = handler;
            return this;
        }

        public DataHandler getDataHandler() {
            return dataHandler;
        }

        /**
         * Creates a new SourceReaderConfiguration from the Builder's current settings.
         * @return a new instance.
         * @throws IllegalArgumentException if any setting is out of range.
         */
        public SourceReaderConfiguration build() {
            return new SourceReaderConfiguration(this);
        }
    }

    /**
     * The standard configuration.
     */
    public static final SourceReaderConfiguration DEFAULT = Builder.standard().build();

    private final int initialBufferSize;
    private final int bufferSizeIncrement;
    private final long readSizeLimit;
    private final DataHandler dataHandler;

    private SourceReaderConfiguration(Builder builder) {
        initialBufferSize = builder.getInitialBufferSize();
        bufferSizeIncrement = builder.getBufferSizeIncrement();
        readSizeLimit = builder.getReadSizeLimit();
        if (initialBufferSize < 1) {
            throw new IllegalArgumentException("Initial buffer size must be at least 1.");
        }
        if (bufferSizeIncrement < 1) {
            throw new IllegalArgumentException("Buffer size increment must be at least 1.");
        }
        if (readSizeLimit < 0) {
            throw new IllegalArgumentException("Read size limit must not be negative.");
        }
        dataHandler = builder.getDataHandler() == null ? Builder.NO_OP_DATA_HANDLER : builder.getDataHandler();
    }

    /**
     * @return the preferred size of the buffer, in bytes.
     */
    public int getInitialBufferSize() {
        return initialBufferSize;
    }

    /**
     * @return the number of bytes by which the buffer grows during delimiter searches.
     */
    public int getBufferSizeIncrement() {
        return bufferSizeIncrement;
    }

    /**
     * @return the maximum total number of bytes that will be pulled from the source, or
     *  {@link ReadSizeLimit#UNLIMITED}.
     */
    public long getReadSizeLimit() {
        return readSizeLimit;
    }

    /**
     * @return the handler that will be notified when bytes are pulled from the source.
     */
    public DataHandler getDataHandler() {
        return dataHandler;
    }
}
