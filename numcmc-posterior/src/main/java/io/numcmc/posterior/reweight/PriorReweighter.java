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

import io.numcmc.posterior.prior.DimensionalityException;
import io.numcmc.posterior.prior.PriorSpec;
import io.numcmc.posterior.sample.PhysicalParameter;
import io.numcmc.posterior.sample.SampleBatch;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Importance weights that move a chain from the prior it was sampled under to a
/// replacement prior on one physical variable.
///
/// ```
///   weight(x) = density_new(x) / density_old(x)
/// ```
///
/// Both densities already carry their transform Jacobians, so a change such as
/// "flat in θ₂₃" to "flat in sin²θ₂₃" is weighted by |sin 2θ₂₃|.
///
/// A reweighter is pure and immutable; [#NONE] weights every sample by 1.
public final class PriorReweighter {

    /// The reweighter of a plot without prior overrides.
    public static final PriorReweighter NONE = new PriorReweighter();

    private final PriorSpec oldPrior;
    private final PriorSpec newPrior;
    private final boolean identity;

    private PriorReweighter() {
        this.oldPrior = null;
        this.newPrior = null;
        this.identity = true;
    }

    /// Creates a reweighter between two priors on the same variable.
    ///
    /// @param oldPrior the prior the chain was sampled under
    /// @param newPrior the requested prior
    /// @throws DimensionalityException if the priors target different variables
    public PriorReweighter(PriorSpec oldPrior, PriorSpec newPrior) {
        if (!oldPrior.getVariable().equals(newPrior.getVariable())) {
            throw new DimensionalityException("Old and new priors must target the same variable:",
                List.of(oldPrior.getVariable(), newPrior.getVariable()));
        }
        this.oldPrior = oldPrior;
        this.newPrior = newPrior;
        this.identity = oldPrior.equals(newPrior);
    }

    /// Builds the reweighter for a plot from its requested overrides.
    ///
    /// @param plotVariables the plotted variables
    /// @param overrides replacement priors, at most one
    /// @param chainPriors the chain's priors by physical variable
    /// @return [#NONE] without overrides, otherwise a reweighter for the single override
    /// @throws DimensionalityException if more than one override is given, an override
    ///     targets a derived variable, or a 2-D plot overrides one of its own axes
    public static PriorReweighter forPlot(List<String> plotVariables,
                                          Collection<PriorSpec> overrides,
                                          Map<String, PriorSpec> chainPriors) {
        if (overrides == null || overrides.isEmpty()) {
            return NONE;
        }
        if (overrides.size() > 1) {
            List<String> targets = new ArrayList<>();
            for (PriorSpec spec : overrides) {
                targets.add(spec.getVariable());
            }
            throw new DimensionalityException("Only one prior may be replaced per plot; requested:", targets);
        }
        PriorSpec replacement = overrides.iterator().next();
        String variable = replacement.getVariable();
        if (!PhysicalParameter.isPhysical(variable)) {
            throw new DimensionalityException(
                "Priors can only be replaced on physical parameters, not derived variables:", List.of(variable));
        }
        if (plotVariables.size() > 1 && plotVariables.contains(variable)) {
            throw new DimensionalityException(
                "A two-dimensional plot cannot replace the prior of one of its own axes:", plotVariables);
        }
        PriorSpec original = chainPriors.get(variable);
        if (original == null) {
            original = PriorSpec.uniform(variable);
        }
        return new PriorReweighter(original, replacement);
    }

    /// Returns the reweighted variable, empty for [#NONE].
    public Optional<String> variable() {
        return Optional.ofNullable(newPrior).map(PriorSpec::getVariable);
    }

    public Optional<PriorSpec> getOldPrior() {
        return Optional.ofNullable(oldPrior);
    }

    public Optional<PriorSpec> getNewPrior() {
        return Optional.ofNullable(newPrior);
    }

    /// Returns true when every weight is 1: no override, or an override equal to the
    /// chain's own prior.
    public boolean isIdentity() {
        return identity;
    }

    /// Returns the importance weight for one physical value.
    ///
    /// @param x the value of [#variable()]
    /// @return density_new(x) / density_old(x)
    /// @throws DegeneratePriorException if the old density is exactly 0
    public double weight(double x) {
        if (identity) {
            return 1.0;
        }
        double old = oldPrior.density(x);
        if (old == 0.0) {
            throw new DegeneratePriorException(oldPrior, x);
        }
        return newPrior.density(x) / old;
    }

    /// Multiplies the weights of a batch into an accumulator array.
    ///
    /// @param batch the batch
    /// @param weights per-row weights, updated in place
    public void applyTo(SampleBatch batch, double[] weights) {
        if (identity) {
            return;
        }
        double[] x = batch.column(newPrior.getVariable());
        for (int i = 0; i < weights.length; i++) {
            weights[i] *= weight(x[i]);
        }
    }

    @Override
    public String toString() {
        return identity && oldPrior == null ? "PriorReweighter[none]"
            : "PriorReweighter[" + oldPrior + " -> " + newPrior.toExpression() + "]";
    }
}
