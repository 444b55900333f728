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

import java.io.IOException;
import java.nio.file.Path;

/// Thrown when a delimited chain file cannot be read as a chain: a missing header or
/// physical column, a row of the wrong width, or an unparseable number.
public class ChainFormatException extends IOException {

    private final Path file;
    private final long line;

    public ChainFormatException(Path file, long line, String message) {
        super(file + (line > 0 ? ":" + line : "") + ": " + message);
        this.file = file;
        this.line = line;
    }

    public Path getFile() {
        return file;
    }

    /// Returns the 1-based line number, or 0 when the error is not tied to a line.
    public long getLine() {
        return line;
    }
}
