package io.numcmc.posterior.region;

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

/// What a credible level is measured against.
public enum MassBasis {

    /// Coverage relative to the weight that fell inside the plot range. Every level
    /// below 1 is reachable.
    IN_RANGE,

    /// Coverage relative to all accepted weight, so weight lost outside the plot range
    /// counts against the region. Levels above the in-range fraction cannot be reached.
    ALL_SAMPLES
}
