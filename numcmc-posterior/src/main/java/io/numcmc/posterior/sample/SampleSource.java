package io.numcmc.posterior.sample;

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

import java.util.List;
import java.util.function.BiConsumer;

/**
 * A chain of samples that can be streamed in column batches.
 *
 * <h2>Purpose</h2>
 *
 * <p>Decouples the posterior engine from the storage a chain is released in. The
 * engine only needs the column names, to validate plot variables up front, and an
 * ordered pass over the rows in bounded batches.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * SampleSource source = ArraySampleSource.of(samples);
 *
 * for (SampleBatch batch : source.batches(100_000)) {
 *     stack.fill(batch);
 * }
 *
 * // A pass that may stop early
 * try (BatchCursor cursor = source.open(100_000)) {
 *     while (cursor.hasNext() && !done) {
 *         stack.fill(cursor.next());
 *     }
 * }
 *
 * // Or with the row offset of each batch
 * source.forEachBatch(100_000, (batch, start) ->
 *     logger.info("rows {} to {}", start, start + batch.size()));
 * }</pre>
 *
 * <p>Every batch carries the six physical columns. Each call to {@link #open(int)} or
 * {@link #batches(int)} starts a new pass from the first row. The iterable form only
 * releases the source's resources when iterated to the end; callers that may stop early
 * use {@link #open(int)} with try-with-resources.
 *
 * @see ArraySampleSource
 */
public interface SampleSource {

    /**
     * Returns the column names available in the chain, physical ones included.
     *
     * @return the column names
     */
    List<String> columnNames();

    /**
     * Starts a pass over the chain as consecutive batches.
     *
     * <p>Each batch holds at most {@code batchSize} rows; only the last may be smaller.
     *
     * @param batchSize the maximum number of rows per batch
     * @return a cursor to close once the caller is done with it
     * @throws IllegalArgumentException if {@code batchSize} is not positive
     */
    BatchCursor open(int batchSize);

    /**
     * Returns the chain as consecutive batches, for passes that run to the end.
     *
     * @param batchSize the maximum number of rows per batch
     * @return an iterable over batches, restarting at the first row on each iteration
     * @throws IllegalArgumentException if {@code batchSize} is not positive
     */
    default Iterable<SampleBatch> batches(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive, got " + batchSize);
        }
        return () -> open(batchSize);
    }

    /**
     * Iterates batches with a callback that receives the batch and its first row index.
     *
     * @param batchSize the maximum number of rows per batch
     * @param consumer callback receiving (batch, startRow) for each batch
     */
    default void forEachBatch(int batchSize, BiConsumer<SampleBatch, Long> consumer) {
        long start = 0;
        try (BatchCursor cursor = open(batchSize)) {
            while (cursor.hasNext()) {
                SampleBatch batch = cursor.next();
                consumer.accept(batch, start);
                start += batch.size();
            }
        }
    }

    /**
     * Returns the number of rows, or -1 if it is not known before a full pass.
     *
     * @return the row count
     */
    default long size() {
        return -1;
    }

    /**
     * Returns an identifier for logging.
     *
     * @return an identifier, or "anonymous" if not set
     */
    default String getId() {
        return "anonymous";
    }
}
