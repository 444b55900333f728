package io.numcmc.posterior.reweight;

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

import io.numcmc.posterior.constraint.ConstraintSpec;
import io.numcmc.posterior.sample.MassOrdering;
import io.numcmc.posterior.sample.PhysicalParameter;
import io.numcmc.posterior.sample.SampleBatch;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/// Per-sample total weight of a plot: the prior weight times the density of every
/// constraint that applies to the plot.
///
/// ```
///   w_i = reweighter.weight(x_i) · Π_c  c.factor(ordering_i, vars_i)
/// ```
public final class SampleWeigher {

    private final PriorReweighter reweighter;
    private final List<ConstraintSpec> constraints;

    public SampleWeigher(PriorReweighter reweighter, List<ConstraintSpec> constraints) {
        this.reweighter = reweighter;
        this.constraints = List.copyOf(constraints);
    }

    public PriorReweighter getReweighter() {
        return reweighter;
    }

    public List<ConstraintSpec> getConstraints() {
        return constraints;
    }

    /// Returns the variables a batch must carry for [#weights(SampleBatch)].
    public Set<String> requiredVariables() {
        Set<String> names = new LinkedHashSet<>();
        reweighter.variable().ifPresent(names::add);
        for (ConstraintSpec c : constraints) {
            names.addAll(c.getVariables());
        }
        return names;
    }

    /// Computes the weight of every row of a batch.
    ///
    /// @param batch a batch carrying [#requiredVariables()]
    /// @return one weight per row
    /// @throws DegeneratePriorException if the chain prior vanishes at a sample
    public double[] weights(SampleBatch batch) {
        double[] weights = new double[batch.size()];
        Arrays.fill(weights, 1.0);
        reweighter.applyTo(batch, weights);
        if (constraints.isEmpty()) {
            return weights;
        }
        double[] dm32 = batch.column(PhysicalParameter.DELTA_M2_32);
        for (ConstraintSpec c : constraints) {
            List<String> vars = c.getVariables();
            double[] first = batch.column(vars.get(0));
            double[] second = vars.size() > 1 ? batch.column(vars.get(1)) : null;
            for (int i = 0; i < weights.length; i++) {
                MassOrdering ordering = MassOrdering.of(dm32[i]);
                if (!c.appliesTo(ordering)) {
                    continue;
                }
                weights[i] *= second == null
                    ? c.getConstraint().density(first[i])
                    : c.getConstraint().density(first[i], second[i]);
            }
        }
        return weights;
    }
}
