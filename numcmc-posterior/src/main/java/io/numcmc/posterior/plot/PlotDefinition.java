package io.numcmc.posterior.plot;

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

import io.numcmc.posterior.histogram.BinAxis;
import io.numcmc.posterior.prior.PriorSpec;

import java.util.ArrayList;
import java.util.List;

/// What to plot: one or two variables with their binning, optional prior
/// replacements, the constraints to apply beyond the auto-applied ones, and whether
/// to split by mass ordering.
///
/// ## Usage
///
/// ```java
/// PlotDefinition th23 = PlotDefinition.builder("Theta23")
///     .bins(50, 0, Math.PI / 2)
///     .prior(PriorSpecParser.parse("Theta23", "Uniform:sin^2(x)"))
///     .build();
///
/// PlotDefinition joint = PlotDefinition.builder("SinSqTheta23", "AbsDm2_32")
///     .bins(50, 0.35, 0.65)
///     .bins(50, 2.2e-3, 2.8e-3)
///     .separateOrderings(true)
///     .jointRegion(true)
///     .build();
/// ```
///
/// Immutable. Whether the variables, constraints and priors fit together is checked
/// when the definition is added to a [PlotStack].
public final class PlotDefinition {

    private final String name;
    private final List<String> variables;
    private final List<BinAxis> axes;
    private final List<PriorSpec> priorOverrides;
    private final List<String> constraintNames;
    private final boolean separateOrderings;
    private final boolean jointRegion;

    private PlotDefinition(Builder builder) {
        this.variables = List.copyOf(builder.variables);
        this.axes = List.copyOf(builder.axes);
        this.priorOverrides = List.copyOf(builder.priorOverrides);
        this.constraintNames = List.copyOf(builder.constraintNames);
        this.separateOrderings = builder.separateOrderings || builder.jointRegion;
        this.jointRegion = builder.jointRegion;
        this.name = builder.name != null ? builder.name : String.join(" vs ", variables);
    }

    /// Starts a 1-D or 2-D definition.
    ///
    /// @param variables one or two variable names
    /// @return a builder
    public static Builder builder(String... variables) {
        return new Builder(List.of(variables));
    }

    public String getName() {
        return name;
    }

    public List<String> getVariables() {
        return variables;
    }

    public int dimensions() {
        return variables.size();
    }

    public List<BinAxis> getAxes() {
        return axes;
    }

    public List<PriorSpec> getPriorOverrides() {
        return priorOverrides;
    }

    public List<String> getConstraintNames() {
        return constraintNames;
    }

    public boolean separatesOrderings() {
        return separateOrderings;
    }

    /// Returns whether a region spanning both orderings is requested; implies ordering
    /// separation.
    public boolean wantsJointRegion() {
        return jointRegion;
    }

    @Override
    public String toString() {
        return "PlotDefinition[" + name + ", axes=" + axes
            + (priorOverrides.isEmpty() ? "" : ", priors=" + priorOverrides)
            + (constraintNames.isEmpty() ? "" : ", constraints=" + constraintNames)
            + (separateOrderings ? ", by ordering" : "")
            + (jointRegion ? ", joint" : "") + "]";
    }

    public static final class Builder {

        private final List<String> variables;
        private final List<BinAxis> axes = new ArrayList<>();
        private final List<PriorSpec> priorOverrides = new ArrayList<>();
        private final List<String> constraintNames = new ArrayList<>();
        private String name;
        private boolean separateOrderings;
        private boolean jointRegion;

        private Builder(List<String> variables) {
            if (variables.isEmpty() || variables.size() > 2) {
                throw new IllegalArgumentException("Plots have 1 or 2 variables, got " + variables);
            }
            if (variables.size() == 2 && variables.get(0).equals(variables.get(1))) {
                throw new IllegalArgumentException("A 2-D plot needs two different variables, got " + variables);
            }
            this.variables = variables;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        /// Adds equal-width binning for the next axis.
        public Builder bins(int count, double lower, double upper) {
            return axis(BinAxis.uniform(count, lower, upper));
        }

        /// Adds explicit edges for the next axis.
        public Builder edges(double... edges) {
            return axis(BinAxis.ofEdges(edges));
        }

        public Builder axis(BinAxis axis) {
            if (axes.size() == variables.size()) {
                throw new IllegalArgumentException("Plot of " + variables + " already has " + axes.size() + " axes");
            }
            axes.add(axis);
            return this;
        }

        /// Adds a replacement prior.
        public Builder prior(PriorSpec spec) {
            priorOverrides.add(spec);
            return this;
        }

        /// Names a chain constraint to apply to this plot.
        public Builder constraint(String constraintName) {
            constraintNames.add(constraintName);
            return this;
        }

        public Builder separateOrderings(boolean separate) {
            this.separateOrderings = separate;
            return this;
        }

        public Builder jointRegion(boolean joint) {
            this.jointRegion = joint;
            return this;
        }

        /// @throws IllegalArgumentException if an axis is missing
        public PlotDefinition build() {
            if (axes.size() != variables.size()) {
                throw new IllegalArgumentException("Plot of " + variables + " needs " + variables.size()
                    + " axes, got " + axes.size());
            }
            return new PlotDefinition(this);
        }
    }
}
