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

import io.numcmc.posterior.sample.MassOrdering;

/// Which part of a posterior a credible region was built from.
public enum RegionScope {

    /// All samples, orderings not distinguished.
    COMBINED,
    /// Normal-ordering samples, normalized on their own.
    NORMAL,
    /// Inverted-ordering samples, normalized on their own.
    INVERTED,
    /// Bins of both orderings ranked on one density scale.
    JOINT;

    public static RegionScope of(MassOrdering ordering) {
        return ordering == MassOrdering.NORMAL ? NORMAL : INVERTED;
    }
}
