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

import java.util.Map;

/// One chain step: the six physical parameters plus any derived values.
///
/// Streaming code works on [SampleBatch] columns; this row view is for single-sample
/// evaluation and diagnostics.
///
/// @param deltaCP δCP in radians
/// @param theta13 θ₁₃ in radians
/// @param theta23 θ₂₃ in radians
/// @param theta12 θ₁₂ in radians
/// @param deltaM2_32 Δm²₃₂ in eV²
/// @param deltaM2_21 Δm²₂₁ in eV²
/// @param derived derived values by variable name
public record Sample(double deltaCP, double theta13, double theta23, double theta12,
                     double deltaM2_32, double deltaM2_21, Map<String, Double> derived) {

    public Sample {
        derived = derived == null ? Map.of() : Map.copyOf(derived);
    }

    /// Creates a sample with no derived values.
    public Sample(double deltaCP, double theta13, double theta23, double theta12,
                  double deltaM2_32, double deltaM2_21) {
        this(deltaCP, theta13, theta23, theta12, deltaM2_32, deltaM2_21, Map.of());
    }

    /// Returns the value of a physical parameter.
    public double get(PhysicalParameter parameter) {
        return switch (parameter) {
            case DELTA_CP -> deltaCP;
            case THETA_13 -> theta13;
            case THETA_23 -> theta23;
            case THETA_12 -> theta12;
            case DELTA_M2_32 -> deltaM2_32;
            case DELTA_M2_21 -> deltaM2_21;
        };
    }

    /// Returns the value of a physical or derived variable.
    ///
    /// @param name a variable name
    /// @return its value for this sample
    /// @throws IllegalArgumentException if the sample has no such variable
    public double get(String name) {
        var physical = PhysicalParameter.fromColumnName(name);
        if (physical.isPresent()) {
            return get(physical.get());
        }
        Double value = derived.get(name);
        if (value == null) {
            throw new IllegalArgumentException("Sample has no variable '" + name + "'. Derived: " + derived.keySet());
        }
        return value;
    }

    /// Returns the mass ordering implied by Δm²₃₂.
    public MassOrdering massOrdering() {
        return MassOrdering.of(deltaM2_32);
    }
}
