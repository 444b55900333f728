package io.numcmc.posterior.constraint;

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

/// The mass orderings an external constraint was derived for.
public enum OrderingScope {

    NORMAL_ONLY,
    INVERTED_ONLY,
    BOTH;

    /// Returns whether samples of an ordering fall under this scope.
    public boolean includes(MassOrdering ordering) {
        return switch (this) {
            case NORMAL_ONLY -> ordering == MassOrdering.NORMAL;
            case INVERTED_ONLY -> ordering == MassOrdering.INVERTED;
            case BOTH -> true;
        };
    }
}
