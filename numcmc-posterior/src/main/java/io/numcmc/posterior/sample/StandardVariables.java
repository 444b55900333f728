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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/// Derived variables commonly plotted from oscillation chains.
///
/// | Name | Definition |
/// |------|------------|
/// | `SinSqTheta23` | sin²θ₂₃ |
/// | `SinSq2Theta13` | sin²2θ₁₃ |
/// | `SinSq2Theta12` | sin²2θ₁₂ |
/// | `AbsDm2_32` | \|Δm²₃₂\| |
/// | `AbsSinDeltaCP` | \|sin δCP\| |
/// | `AbsUe3` | \|U_e3\| = \|sin θ₁₃ e^(−iδCP)\| = \|sin θ₁₃\| |
/// | `JarlskogInvariant` | c₁₂ s₁₂ c₂₃ s₂₃ c₁₃² s₁₃ sin δCP |
public final class StandardVariables {

    public static final String SIN_SQ_THETA23 = "SinSqTheta23";
    public static final String SIN_SQ_2THETA13 = "SinSq2Theta13";
    public static final String SIN_SQ_2THETA12 = "SinSq2Theta12";
    public static final String ABS_DM2_32 = "AbsDm2_32";
    public static final String ABS_SIN_DELTA_CP = "AbsSinDeltaCP";
    public static final String ABS_UE3 = "AbsUe3";
    public static final String JARLSKOG_INVARIANT = "JarlskogInvariant";

    private static final Map<String, DerivedVariable> ALL;

    static {
        Map<String, DerivedVariable> all = new LinkedHashMap<>();
        all.put(SIN_SQ_THETA23, (dcp, th13, th23, th12, dm32, dm21) -> sinSquared(th23));
        all.put(SIN_SQ_2THETA13, (dcp, th13, th23, th12, dm32, dm21) -> sinSquared(2 * th13));
        all.put(SIN_SQ_2THETA12, (dcp, th13, th23, th12, dm32, dm21) -> sinSquared(2 * th12));
        all.put(ABS_DM2_32, (dcp, th13, th23, th12, dm32, dm21) -> Math.abs(dm32));
        all.put(ABS_SIN_DELTA_CP, (dcp, th13, th23, th12, dm32, dm21) -> Math.abs(Math.sin(dcp)));
        all.put(ABS_UE3, (dcp, th13, th23, th12, dm32, dm21) -> Math.abs(Math.sin(th13)));
        all.put(JARLSKOG_INVARIANT, StandardVariables::jarlskog);
        ALL = Collections.unmodifiableMap(all);
    }

    private StandardVariables() {
    }

    /// Returns the standard variables by name, in table order.
    public static Map<String, DerivedVariable> all() {
        return ALL;
    }

    /// The Jarlskog invariant J = c₁₂ s₁₂ c₂₃ s₂₃ c₁₃² s₁₃ sin δCP.
    static double jarlskog(double deltaCP, double theta13, double theta23,
                           double theta12, double deltaM2_32, double deltaM2_21) {
        double c13 = Math.cos(theta13);
        return Math.cos(theta12) * Math.sin(theta12)
            * Math.cos(theta23) * Math.sin(theta23)
            * c13 * c13 * Math.sin(theta13)
            * Math.sin(deltaCP);
    }

    private static double sinSquared(double angle) {
        double s = Math.sin(angle);
        return s * s;
    }
}
