package io.numcmc.posterior.prior;

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

import java.util.Arrays;

/// Thrown when a prior family is constructed with parameters it cannot accept:
/// the wrong number of values, a non-positive width, a bias outside [0, 100], or
/// non-finite numbers.
public class InvalidPriorParametersException extends IllegalArgumentException {

    private final String family;
    private final double[] parameters;

    public InvalidPriorParametersException(String family, double[] parameters, String reason) {
        super("Invalid parameters for " + family + " prior " + Arrays.toString(parameters) + ": " + reason);
        this.family = family;
        this.parameters = parameters == null ? new double[0] : parameters.clone();
    }

    public String getFamily() {
        return family;
    }

    public double[] getParameters() {
        return parameters.clone();
    }
}
