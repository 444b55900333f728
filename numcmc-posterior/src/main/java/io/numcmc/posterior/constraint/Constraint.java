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

/// An external likelihood over one or two variables, multiplied into sample weights.
///
/// Implementations are immutable and evaluate to a non-negative, unnormalized density.
///
/// @see ConstraintSpec
public interface Constraint {

    /// Returns the number of variables the constraint is defined over, 1 or 2.
    int dimensions();

    /// Evaluates the constraint density.
    ///
    /// @param values one value per dimension, in the order of the owning spec's variables
    /// @return the non-negative density
    /// @throws IllegalArgumentException if the number of values differs from [#dimensions()]
    double density(double... values);

    /// Checks the argument count against [#dimensions()].
    default void checkArity(double[] values) {
        if (values.length != dimensions()) {
            throw new IllegalArgumentException(getClass().getSimpleName() + " is " + dimensions()
                + "-dimensional but was given " + values.length + " values");
        }
    }
}
