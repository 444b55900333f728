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

import java.util.Iterator;

/**
 * One pass over a {@link SampleSource}, holding whatever the source keeps open while
 * reading, such as a file handle.
 *
 * <p>A pass that runs to the end releases its resources by itself; a pass stopped early
 * must be closed. Closing twice is harmless, and a closed cursor has no further batches.
 */
public interface BatchCursor extends Iterator<SampleBatch>, AutoCloseable {

    /**
     * Releases the resources of this pass.
     */
    @Override
    void close();
}
