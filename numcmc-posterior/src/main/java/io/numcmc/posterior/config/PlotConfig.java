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
import io.numcmc.posterior.plot.PlotDefinition;
import io.numcmc.posterior.prior.PriorSpecParser;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/// JSON layout of one plot definition.
///
/// ```json
/// {
///   "name": "th23 flat in sin2",
///   "variables": ["Theta23"],
///   "axes": [ { "bins": 50, "lower": 0.0, "upper": 1.5708 } ],
///   "priors": ["Uniform:sin^2(Theta23)"],
///   "constraints": ["reactor"],
///   "separate_orderings": true,
///   "joint_region": false
/// }
/// ```
///
/// An axis gives either `bins`/`lower`/`upper` or explicit `edges`. Prior
/// overrides name their variable inside the transform, e.g. `sin^2(Theta23)`.
public final class PlotConfig {

    @SerializedName("name")
    private String name;

    @SerializedName("variables")
    private List<String> variables = new ArrayList<>();

    @SerializedName("axes")
    private List<Axis> axes = new ArrayList<>();

    @SerializedName("priors")
    private List<String> priors = new ArrayList<>();

    @SerializedName("constraints")
    private List<String> constraints = new ArrayList<>();

    @SerializedName("separate_orderings")
    private boolean separateOrderings;

    @SerializedName("joint_region")
    private boolean jointRegion;

    /// One axis binning.
    public static final class Axis {
        @SerializedName("bins")
        int bins;
        @SerializedName("lower")
        double lower;
        @SerializedName("upper")
        double upper;
        @SerializedName("edges")
        double[] edges;
    }

    public String getName() {
        return name;
    }

    public List<String> getVariables() {
        return variables == null ? List.of() : variables;
    }

    /// Builds the definition.
    ///
    /// @param knownVariables names a prior override may refer to
    /// @return the definition
    /// @throws IllegalArgumentException on an incomplete axis or unparseable prior
    public PlotDefinition toDefinition(Collection<String> knownVariables) {
        PlotDefinition.Builder builder = PlotDefinition.builder(getVariables().toArray(new String[0]));
        if (name != null) {
            builder.name(name);
        }
        if (axes != null) {
            for (Axis axis : axes) {
                if (axis.edges != null) {
                    builder.edges(axis.edges);
                } else {
                    builder.bins(axis.bins, axis.lower, axis.upper);
                }
            }
        }
        if (priors != null) {
            for (String prior : priors) {
                builder.prior(PriorSpecParser.parse(prior, knownVariables));
            }
        }
        if (constraints != null) {
            constraints.forEach(builder::constraint);
        }
        return builder.separateOrderings(separateOrderings).jointRegion(jointRegion).build();
    }
}
