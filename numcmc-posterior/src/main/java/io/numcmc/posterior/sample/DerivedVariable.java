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

/// A pure function of the six physical parameters, registered by name in a
/// [VariableRegistry].
///
/// ```java
/// DerivedVariable sinSqTheta23 = (dcp, th13, th23, th12, dm32, dm21) ->
///     Math.pow(Math.sin(th23), 2);
/// ```
@FunctionalInterface
public interface DerivedVariable {

    /// Evaluates the variable for one sample.
    ///
    /// @param deltaCP δCP in radians
    /// @param theta13 θ₁₃ in radians
    /// @param theta23 θ₂₃ in radians
    /// @param theta12 θ₁₂ in radians
    /// @param deltaM2_32 Δm²₃₂ in eV²
    /// @param deltaM2_21 Δm²₂₁ in eV²
    /// @return the derived value
    double evaluate(double deltaCP, double theta13, double theta23,
                    double theta12, double deltaM2_32, double deltaM2_21);
}
