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

/// Neutrino mass ordering, read off the sign of Δm²₃₂.
public enum MassOrdering {

    NORMAL("NO"),
    INVERTED("IO");

    private final String label;

    MassOrdering(String label) {
        this.label = label;
    }

    /// Returns the short label, `NO` or `IO`.
    public String label() {
        return label;
    }

    /// Classifies a sample by its Δm²₃₂.
    ///
    /// A splitting of exactly zero is assigned to [#NORMAL]. NaN is also assigned to
    /// [#NORMAL]; such samples are rejected by the histogram before their ordering matters.
    ///
    /// @param deltaM2_32 the Δm²₃₂ value
    /// @return the mass ordering
    public static MassOrdering of(double deltaM2_32) {
        return deltaM2_32 < 0 ? INVERTED : NORMAL;
    }

    @Override
    public String toString() {
        return label;
    }
}
