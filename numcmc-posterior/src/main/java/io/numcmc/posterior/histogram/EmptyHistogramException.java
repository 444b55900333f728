package io.numcmc.posterior.histogram;

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

/// Thrown when a histogram with no in-range weight is normalized.
public class EmptyHistogramException extends IllegalStateException {

    private final long outOfRangeCount;
    private final long rejectedCount;

    public EmptyHistogramException(String message, long outOfRangeCount, long rejectedCount) {
        super(message + " (out of range: " + outOfRangeCount + ", rejected: " + rejectedCount + ")");
        this.outOfRangeCount = outOfRangeCount;
        this.rejectedCount = rejectedCount;
    }

    public long getOutOfRangeCount() {
        return outOfRangeCount;
    }

    public long getRejectedCount() {
        return rejectedCount;
    }
}
