package io.numcmc.posterior.config;

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

import com.google.gson.annotations.SerializedName;
import io.numcmc.posterior.constraint.Constraint;
import io.numcmc.posterior.constraint.ConstraintSpec;
import io.numcmc.posterior.constraint.GaussianConstraint;
import io.numcmc.posterior.constraint.OrderingScope;
import io.numcmc.posterior.constraint.TabulatedConstraint;

import java.util.List;

/// JSON layout of one external constraint. Exactly one of `gaussian` and
/// `tabulated` must be present.
///
/// ```json
/// {
///   "name": "reactor",
///   "variables": ["SinSq2Theta13"],
///   "scope": "BOTH",
///   "auto_apply": true,
///   "gaussian": { "mean": [0.0853], "sigma": [0.0027] }
/// }
/// ```
///
/// A tabulated constraint gives the histogram axes and contents, row-major:
///
/// ```json
/// "tabulated": { "lower": [0.0], "upper": [1.0], "bins": [4],
///                "values": [0, 1, 1, 0, 0, 0], "flow_bins": true }
/// ```
public final class ConstraintConfig {

    @SerializedName("name")
    private String name;

    @SerializedName("variables")
    private List<String> variables;

    @SerializedName("scope")
    private OrderingScope scope = OrderingScope.BOTH;

    @SerializedName("auto_apply")
    private boolean autoApply;

    @SerializedName("gaussian")
    private Gaussian gaussian;

    @SerializedName("tabulated")
    private Tabulated tabulated;

    /// Parametric form.
    public static final class Gaussian {
        @SerializedName("mean")
        double[] mean;
        @SerializedName("sigma")
        double[] sigma;
        @SerializedName("correlation")
        double correlation;
    }

    /// Histogram form.
    public static final class Tabulated {
        @SerializedName("lower")
        double[] lower;
        @SerializedName("upper")
        double[] upper;
        @SerializedName("bins")
        int[] bins;
        @SerializedName("values")
        double[] values;
        @SerializedName("flow_bins")
        boolean flowBins;
    }

    /// Builds the constraint spec.
    ///
    /// @throws IllegalArgumentException if the layout is incomplete or inconsistent
    public ConstraintSpec toSpec() {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Constraint without a name");
        }
        if (variables == null || variables.isEmpty()) {
            throw new IllegalArgumentException("Constraint '" + name + "' names no variables");
        }
        if ((gaussian == null) == (tabulated == null)) {
            throw new IllegalArgumentException("Constraint '" + name
                + "' must define exactly one of 'gaussian' and 'tabulated'");
        }
        Constraint constraint = gaussian != null ? gaussian() : tabulated();
        return new ConstraintSpec(name, constraint, variables, scope, autoApply);
    }

    private Constraint gaussian() {
        if (gaussian.mean == null || gaussian.sigma == null) {
            throw new IllegalArgumentException("Gaussian constraint '" + name + "' needs 'mean' and 'sigma'");
        }
        return new GaussianConstraint(gaussian.mean, gaussian.sigma, gaussian.correlation);
    }

    private Constraint tabulated() {
        Tabulated t = tabulated;
        if (t.lower == null || t.upper == null || t.bins == null || t.values == null) {
            throw new IllegalArgumentException("Tabulated constraint '" + name
                + "' needs 'lower', 'upper', 'bins' and 'values'");
        }
        return TabulatedConstraint.histogram(t.lower, t.upper, t.bins, t.values, t.flowBins);
    }
}
