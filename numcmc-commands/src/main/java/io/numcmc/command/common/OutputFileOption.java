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

import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Shared optional output file option with force overwrite flag.
 * All supporting types are inner classes for self-contained encapsulation.
 */
public class OutputFileOption {

    /**
     * Immutable output file specification with force-overwrite flag.
     *
     * @param path  the output file path (never null)
     * @param force whether to force overwrite if file exists
     */
    public record OutputFile(Path path, boolean force) {

        /**
         * Compact constructor with validation.
         */
        public OutputFile {
            if (path == null) {
                throw new IllegalArgumentException("Output path cannot be null");
            }
        }

        /**
         * Checks if the output file exists and force is not set.
         */
        public boolean existsWithoutForce() {
            return Files.exists(path) && !force;
        }

        @Override
        public String toString() {
            return force ? path + " (force)" : path.toString();
        }
    }

    @CommandLine.Option(
        names = {"-o", "--output"},
        description = "Write the JSON result to this file"
    )
    private Path outputPath;

    @CommandLine.Option(
        names = {"-f", "--force"},
        description = "Force overwrite if output file already exists"
    )
    private boolean force = false;

    /**
     * Gets the output file, if one was requested.
     */
    public Optional<OutputFile> getOutputFile() {
        return outputPath == null ? Optional.empty() : Optional.of(new OutputFile(outputPath, force));
    }
}
