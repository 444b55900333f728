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

import java.util.List;
import java.util.Optional;

/// The six oscillation parameters every chain must provide, in sample order.
///
/// Angles are in radians and mass splittings in eV². The column names are the ones
/// used by the common chain release format and are reserved in every
/// [VariableRegistry].
public enum PhysicalParameter {

    DELTA_CP("DeltaCP"),
    THETA_13("Theta13"),
    THETA_23("Theta23"),
    THETA_12("Theta12"),
    DELTA_M2_32("Deltam2_32"),
    DELTA_M2_21("Deltam2_21");

    private static final List<String> NAMES = List.of(
        DELTA_CP.columnName, THETA_13.columnName, THETA_23.columnName,
        THETA_12.columnName, DELTA_M2_32.columnName, DELTA_M2_21.columnName);

    private final String columnName;

    PhysicalParameter(String columnName) {
        this.columnName = columnName;
    }

    /// Returns the chain column name, e.g. `Theta23`.
    public String columnName() {
        return columnName;
    }

    /// Looks up a parameter by column name.
    ///
    /// @param name a column name
    /// @return the parameter, or empty if the name is not one of the six
    public static Optional<PhysicalParameter> fromColumnName(String name) {
        for (PhysicalParameter p : values()) {
            if (p.columnName.equals(name)) {
                return Optional.of(p);
            }
        }
        return Optional.empty();
    }

    /// Returns whether a name is one of the six reserved column names.
    public static boolean isPhysical(String name) {
        return NAMES.contains(name);
    }

    /// Returns the six column names in sample order.
    public static List<String> columnNames() {
        return NAMES;
    }

    @Override
    public String toString() {
        return columnName;
    }
}
