package io.numcmc.command.common;

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

import io.numcmc.posterior.plot.PlotStack;
import picocli.CommandLine;

/**
 * Shared options controlling how a chain is streamed.
 * All supporting types are inner classes for self-contained encapsulation.
 */
public class StreamingOption {

    /**
     * Immutable streaming configuration.
     *
     * @param batchSize rows read per batch
     * @param maxSteps  maximum chain steps to read, negative for all
     */
    public record StreamConfig(int batchSize, long maxSteps) {

        /**
         * Compact constructor with validation.
         */
        public StreamConfig {
            if (batchSize <= 0) {
                throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
            }
        }

        /**
         * Checks if the step limit is enabled.
         */
        public boolean isLimited() {
            return maxSteps >= 0;
        }

        @Override
        public String toString() {
            return "batchSize=" + batchSize + ", maxSteps=" + (isLimited() ? String.valueOf(maxSteps) : "all");
        }
    }

    @CommandLine.Option(
        names = {"--batch-size"},
        description = "Rows read per batch (default: ${DEFAULT-VALUE})",
        defaultValue = "" + PlotStack.DEFAULT_BATCH_SIZE
    )
    private int batchSize = PlotStack.DEFAULT_BATCH_SIZE;

    @CommandLine.Option(
        names = {"--max-steps"},
        description = "Read at most this many chain steps (default: all)",
        defaultValue = "-1"
    )
    private long maxSteps = -1;

    /**
     * Gets the streaming configuration constructed from the options.
     */
    public StreamConfig getStreamConfig() {
        return new StreamConfig(batchSize, maxSteps);
    }

    /**
     * Validates the options.
     *
     * @throws IllegalArgumentException if the batch size is not positive
     */
    public void validate() {
        getStreamConfig(); // Will throw if invalid
    }
}
