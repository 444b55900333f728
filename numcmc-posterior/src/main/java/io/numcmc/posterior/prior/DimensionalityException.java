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

import java.util.List;

/// Thrown when a prior replacement would need more than one dimension: several
/// variables replaced at once, a prior over a derived variable, or a replacement on a
/// plotted axis of a two-dimensional plot. Prior changes are only supported one
/// physical variable at a time.
public class DimensionalityException extends IllegalArgumentException {

    private final List<String> variables;

    public DimensionalityException(String message, List<String> variables) {
        super(message + " " + variables);
        this.variables = List.copyOf(variables);
    }

    public List<String> getVariables() {
        return variables;
    }
}
