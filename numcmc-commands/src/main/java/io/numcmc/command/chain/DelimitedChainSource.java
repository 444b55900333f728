package io.numcmc.command.chain;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.numcmc.posterior.sample.BatchCursor;
import io.numcmc.posterior.sample.PhysicalParameter;
import io.numcmc.posterior.sample.SampleBatch;
import io.numcmc.posterior.sample.SampleSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.regex.Pattern;

/// Reads a chain from a delimited text file.
///
/// ## Format
///
/// ```
///   # comment lines and blank lines are skipped
///   DeltaCP, Theta13, Theta23, Theta12, Deltam2_32, Deltam2_21[, extra...]
///   -1.57,   0.148,   0.78,    0.58,    2.5e-3,     7.4e-5
///   ...
/// ```
///
/// The first non-comment line names the columns and must include the six physical
/// parameters; additional columns become chain-provided variables. Fields are
/// separated by commas, whitespace, or both. `nan` and `inf` are accepted in any
/// case.
///
/// Each [#open(int)] re-reads the file from the start with its own reader, which is
/// closed at the end of the file, on an error, or when the cursor is closed. Read and
/// format errors surface as [UncheckedIOException] wrapping a [ChainFormatException]
/// or the underlying [IOException].
public final class DelimitedChainSource implements SampleSource {

    private static final Logger logger = LogManager.getLogger(DelimitedChainSource.class);

    private static final Pattern SEPARATOR = Pattern.compile("\\s*,\\s*|\\s+");

    private final Path file;
    private final List<String> columns;
    private int openReaders;

    /// Opens a chain file and reads its header.
    ///
    /// @param file the chain file
    /// @throws ChainFormatException if the header is missing, repeats a column, or lacks
    ///     a physical parameter
    /// @throws IOException if the file cannot be read
    public DelimitedChainSource(Path file) throws IOException {
        this.file = file;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            long lineNumber = 0;
            String header = null;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (!isSkipped(line)) {
                    header = line;
                    break;
                }
            }
            if (header == null) {
                throw new ChainFormatException(file, 0, "no header row");
            }
            this.columns = List.of(split(header));
            if (columns.stream().distinct().count() != columns.size()) {
                throw new ChainFormatException(file, lineNumber, "repeated column name in " + columns);
            }
            for (String name : PhysicalParameter.columnNames()) {
                if (!columns.contains(name)) {
                    throw new ChainFormatException(file, lineNumber,
                        "compulsory variable '" + name + "' not found in columns " + columns);
                }
            }
        }
        logger.debug("Chain {} has columns {}", file, columns);
    }

    @Override
    public List<String> columnNames() {
        return columns;
    }

    @Override
    public String getId() {
        return file.toString();
    }

    @Override
    public BatchCursor open(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive, got " + batchSize);
        }
        return new FileBatchCursor(batchSize);
    }

    /// Returns the number of passes whose reader is still open.
    int openReaderCount() {
        return openReaders;
    }

    private static boolean isSkipped(String line) {
        String trimmed = line.trim();
        return trimmed.isEmpty() || trimmed.startsWith("#");
    }

    private static String[] split(String line) {
        return SEPARATOR.split(line.trim());
    }

    private double parse(String token, long lineNumber) throws ChainFormatException {
        try {
            return Double.parseDouble(token);
        } catch (NumberFormatException e) {
            switch (token.toLowerCase()) {
                case "nan" -> {
                    return Double.NaN;
                }
                case "inf", "+inf", "infinity", "+infinity" -> {
                    return Double.POSITIVE_INFINITY;
                }
                case "-inf", "-infinity" -> {
                    return Double.NEGATIVE_INFINITY;
                }
                default -> throw new ChainFormatException(file, lineNumber, "'" + token + "' is not a number");
            }
        }
    }

    private final class FileBatchCursor implements BatchCursor {

        private final int batchSize;
        private BufferedReader reader;
        private long lineNumber;
        private boolean headerSkipped;
        private SampleBatch next;
        private boolean exhausted;

        FileBatchCursor(int batchSize) {
            this.batchSize = batchSize;
        }

        @Override
        public boolean hasNext() {
            if (next == null && !exhausted) {
                try {
                    next = readBatch();
                } catch (IOException e) {
                    release();
                    throw new UncheckedIOException(e);
                }
            }
            return next != null;
        }

        @Override
        public SampleBatch next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            SampleBatch batch = next;
            next = null;
            return batch;
        }

        private SampleBatch readBatch() throws IOException {
            if (reader == null) {
                reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
                openReaders++;
            }
            int width = columns.size();
            double[][] values = new double[width][batchSize];
            int rows = 0;
            String line;
            while (rows < batchSize && (line = reader.readLine()) != null) {
                lineNumber++;
                if (isSkipped(line)) {
                    continue;
                }
                if (!headerSkipped) {
                    headerSkipped = true;
                    continue;
                }
                String[] tokens = split(line);
                if (tokens.length != width) {
                    throw new ChainFormatException(file, lineNumber,
                        "expected " + width + " fields, found " + tokens.length);
                }
                for (int c = 0; c < width; c++) {
                    values[c][rows] = parse(tokens[c], lineNumber);
                }
                rows++;
            }
            if (rows < batchSize) {
                exhausted = true;
                release();
            }
            if (rows == 0) {
                return null;
            }
            Map<String, double[]> batch = new LinkedHashMap<>();
            for (int c = 0; c < width; c++) {
                batch.put(columns.get(c), rows == batchSize ? values[c] : Arrays.copyOf(values[c], rows));
            }
            return new SampleBatch(batch);
        }

        @Override
        public void close() {
            exhausted = true;
            next = null;
            release();
        }

        private void release() {
            if (reader == null) {
                return;
            }
            try {
                reader.close();
            } catch (IOException e) {
                logger.warn("Failed to close {}: {}", file, e.getMessage());
            }
            reader = null;
            openReaders--;
        }
    }

    @Override
    public String toString() {
        return "DelimitedChainSource[" + file + ", columns=" + columns + "]";
    }
}
