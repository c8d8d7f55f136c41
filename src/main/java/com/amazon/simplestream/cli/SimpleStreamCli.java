// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.simplestream.cli;

import com.amazon.simplestream.BufferedSourceReader;
import com.amazon.simplestream.DelimiterMatchingMode;
import com.amazon.simplestream.DelimitersNotFoundException;
import com.amazon.simplestream.InputStreamByteSource;
import com.amazon.simplestream.ReadSizeLimit;
import com.amazon.simplestream.SimpleStreamException;
import com.amazon.simplestream.SourceReader;
import com.amazon.simplestream.SourceReaderConfiguration;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.FileInputStream;
import java.io.FilterInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.WritableByteChannel;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits files into records on one or more delimiters.
 */
public class SimpleStreamCli {
    private static final Logger LOGGER = LoggerFactory.getLogger(SimpleStreamCli.class);

    private static final String VERSION = "1.0";
    private static final int CONSOLE_WIDTH = 120; // Only used for formatting the USAGE message
    static final int SUCCESS_EXIT_CODE = 0;
    static final int USAGE_ERROR_EXIT_CODE = 1;
    static final int IO_ERROR_EXIT_CODE = 2;
    private static final int OUTPUT_BUFFER_SIZE = 128 * 1024;
    private static final String STANDARD_INPUT = "-";

    public static void main(final String[] args) {
        System.exit(run(args, System.in, System.out, System.err));
    }

    /**
     * Runs the tool.
     * @param args the command line.
     * @param stdin the stream read when no input file is given.
     * @param stdout the stream written when no output file is given.
     * @param stderr the stream on which errors and usage are reported.
     * @return the process exit code.
     */
    static int run(final String[] args, InputStream stdin, PrintStream stdout, PrintStream stderr) {
        CommandArgs parsedArgs = new CommandArgs();
        CmdLineParser parser = new CmdLineParser(parsedArgs);
        parser.getProperties().withUsageWidth(CONSOLE_WIDTH);
        CommandType commandType;
        List<byte[]> delimiters;
        SourceReaderConfiguration configuration;

        try {
            parser.parseArgument(args);
            if (parsedArgs.isVersion()) {
                stderr.println(VERSION);
                return SUCCESS_EXIT_CODE;
            }
            if (parsedArgs.isHelp()) {
                printHelpText(null, parser, stderr);
                return SUCCESS_EXIT_CODE;
            }
            commandType = parsedArgs.getCommand();
            delimiters = parsedArgs.getDelimiters();
            parsedArgs.getSeparator();
            configuration = parsedArgs.getConfiguration();
        } catch (CmdLineException | IllegalArgumentException e) {
            printHelpText(e.getMessage(), parser, stderr);
            return USAGE_ERROR_EXIT_CODE;
        }
        LOGGER.debug(
            "Running {} with {} delimiter(s), mode {}, buffer size {}, read size limit {}.",
            commandType,
            delimiters.size(),
            parsedArgs.getMatchingMode(),
            configuration.getInitialBufferSize(),
            configuration.getReadSizeLimit()
        );

        try (OutputStream outputStream = initOutputStream(parsedArgs, stdout)) {
            for (String input : parsedArgs.getInputFiles()) {
                try (InputStream inputStream = openInput(input, stdin)) {
                    SourceReader reader = new BufferedSourceReader(new InputStreamByteSource(inputStream), configuration);
                    if (commandType == CommandType.SPLIT) {
                        split(reader, delimiters, parsedArgs, outputStream);
                    } else {
                        long records = split(reader, delimiters, parsedArgs, null);
                        String line = input + "\t" + records + "\t" + reader.getCurrentReadPosition() + "\n";
                        outputStream.write(line.getBytes(StandardCharsets.UTF_8));
                    }
                }
            }
        } catch (IOException | SimpleStreamException e) {
            LOGGER.debug("Processing failed.", e);
            stderr.println("Error: " + e.getMessage());
            return IO_ERROR_EXIT_CODE;
        }
        return SUCCESS_EXIT_CODE;
    }

    /**
     * Reads delimited records until the end of the input. Trailing bytes that are not followed by a delimiter form a
     * final record.
     * @param outputStream where each record is written followed by the separator, or null to only count them.
     * @return the number of records.
     */
    private static long split(SourceReader reader,
                              List<byte[]> delimiters,
                              CommandArgs args,
                              OutputStream outputStream) throws IOException {
        WritableByteChannel channel = outputStream == null ? null : Channels.newChannel(outputStream);
        byte[] separator = args.getSeparator();
        long records = 0;
        while (true) {
            try {
                reader.readData(delimiters, args.getMatchingMode(), args.isIncludeDelimiter(),
                    (data, delimiterIndex, delimiter) -> writeRecord(channel, data, separator));
                records++;
            } catch (DelimitersNotFoundException e) {
                boolean hasTrailingRecord = reader.readData(
                    Collections.<byte[]>emptyList(),
                    DelimiterMatchingMode.FIRST_IN_LIST,
                    false,
                    (data, delimiterIndex, delimiter) -> data.hasRemaining() && writeRecord(channel, data, separator)
                );
                if (hasTrailingRecord) {
                    records++;
                }
                return records;
            }
        }
    }

    private static boolean writeRecord(WritableByteChannel channel,
                                       ByteBuffer data,
                                       byte[] separator) throws IOException {
        if (channel != null) {
            while (data.hasRemaining()) {
                channel.write(data);
            }
            channel.write(ByteBuffer.wrap(separator));
        }
        return true;
    }

    private static InputStream openInput(String input, InputStream stdin) throws IOException {
        if (STANDARD_INPUT.equals(input)) {
            return new NoCloseInputStream(stdin);
        }
        return new FileInputStream(input);
    }

    private static OutputStream initOutputStream(CommandArgs args, PrintStream stdout) throws IOException {
        String outputFile = args.getOutputFile();
        if (outputFile != null && outputFile.length() != 0) {
            return new BufferedOutputStream(new FileOutputStream(outputFile), OUTPUT_BUFFER_SIZE);
        }
        return new NoCloseOutputStream(new BufferedOutputStream(stdout, OUTPUT_BUFFER_SIZE));
    }

    private static void printHelpText(String msg, CmdLineParser parser, PrintStream stderr) {
        if (msg != null) {
            stderr.println(msg + "\n");
        }
        stderr.println("Usage:\n");
        stderr.println("simple-stream (split | count) [--delimiter <bytes>]... [--matching-mode (first-in-list | \n"
            + "shortest | longest)] [--include-delimiter] [--buffer-size <n>] [--buffer-increment <n>] \n"
            + "[--read-limit <n>] [--output <file>] [--separator <bytes>] [<input_file>]...\n");
        stderr.println("\"split\" writes each record of the inputs followed by the separator; \"count\" writes the \n"
            + "number of records and bytes of each input. Standard input is read when no input file is given. \n"
            + "Delimiters and the separator accept the escapes \\n, \\r, \\t, \\0, \\\\ and \\xHH.\n");
        stderr.println("Options:\n");
        parser.printUsage(stderr);
    }

    /**
     * Closes nothing, so that standard input stays open across inputs.
     */
    private static final class NoCloseInputStream extends FilterInputStream {
        NoCloseInputStream(InputStream in) {
            super(in);
        }

        @Override
        public void close() {
            // Standard input is owned by the process.
        }
    }

    static class CommandArgs {
        private static final String DEFAULT_DELIMITER = "\\n";
        private static final String DEFAULT_SEPARATOR = "\\n";
        private static final String DEFAULT_MATCHING_MODE = "first-in-list";

        @Option(name = "--delimiter",
                aliases = {"-d"},
                metaVar = "BYTES",
                usage = "A delimiter ending each record. May be repeated. Default: \\n")
        private List<String> delimiters = new ArrayList<>();

        @Option(name = "--matching-mode",
                aliases = {"-m"},
                metaVar = "MODE",
                usage = "Which delimiter wins when several start at the same offset, from the set\n"
                        + "(first-in-list | shortest | longest).")
        private String matchingMode = DEFAULT_MATCHING_MODE;

        @Option(name = "--include-delimiter",
                aliases = {"-i"},
                usage = "Include the delimiter at the end of each record.")
        private boolean includeDelimiter = false;

        @Option(name = "--buffer-size",
                aliases = {"-b"},
                metaVar = "BYTES",
                usage = "Size of the read buffer.")
        private int bufferSize = SourceReaderConfiguration.DEFAULT.getInitialBufferSize();

        @Option(name = "--buffer-increment",
                metaVar = "BYTES",
                usage = "Number of bytes by which the read buffer grows for long records. Default: the buffer size.")
        private int bufferIncrement = 0;

        @Option(name = "--read-limit",
                aliases = {"-l"},
                metaVar = "BYTES",
                usage = "Maximum number of bytes read from each input.")
        private long readLimit = ReadSizeLimit.UNLIMITED;

        @Option(name = "--output",
                aliases = {"-o"},
                metaVar = "FILE",
                usage = "Output file")
        private String outputFile;

        @Option(name = "--separator",
                aliases = {"-s"},
                metaVar = "BYTES",
                usage = "Written after each record by 'split'. Default: \\n")
        private String separator = DEFAULT_SEPARATOR;

        @Option(name = "--help",
                aliases = {"-h"},
                help = true,
                usage = "Print the help message and exit.")
        private boolean help = false;

        @Option(name = "--version",
                aliases = {"-v"},
                help = true,
                usage = "Print the command's version number and exit.")
        private boolean version = false;

        @Argument
        private List<String> inputs = new ArrayList<>();

        public CommandType getCommand() {
            if (inputs.isEmpty()) {
                throw new IllegalArgumentException("Missing command: expected 'split' or 'count'.");
            }
            return CommandType.valueOf(inputs.get(0).toUpperCase());
        }

        public List<String> getInputFiles() {
            if (inputs.size() < 2) {
                return Collections.singletonList(STANDARD_INPUT);
            }
            return this.inputs.subList(1, inputs.size());
        }

        public List<byte[]> getDelimiters() {
            List<String> texts = delimiters.isEmpty() ? Collections.singletonList(DEFAULT_DELIMITER) : delimiters;
            List<byte[]> bytes = new ArrayList<>(texts.size());
            for (String text : texts) {
                byte[] delimiter = Escapes.unescape(text);
                if (delimiter.length == 0) {
                    throw new IllegalArgumentException("Delimiters must not be empty.");
                }
                bytes.add(delimiter);
            }
            return bytes;
        }

        public DelimiterMatchingMode getMatchingMode() throws IllegalArgumentException {
            return DelimiterMatchingMode.valueOf(matchingMode.replace('-', '_').toUpperCase());
        }

        public SourceReaderConfiguration getConfiguration() {
            // Validate the mode along with the other settings, before any input is opened.
            getMatchingMode();
            return SourceReaderConfiguration.Builder.standard()
                .withInitialBufferSize(bufferSize)
                .withBufferSizeIncrement(bufferIncrement)
                .withReadSizeLimit(readLimit)
                .build();
        }

        public byte[] getSeparator() {
            return Escapes.unescape(separator);
        }

        public boolean isIncludeDelimiter() { return includeDelimiter; }
        public String getOutputFile() { return outputFile; }
        public boolean isHelp() { return help; }
        public boolean isVersion() { return version; }
    }
}
