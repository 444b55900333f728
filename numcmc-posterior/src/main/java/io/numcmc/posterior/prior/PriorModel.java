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

/// A prior family evaluated on a transformed coordinate.
///
/// ## Purpose
///
/// A PriorModel is the shape of a prior, expressed on whatever coordinate `y` the
/// prior was stated in. It knows nothing about the physical variable or the transform;
/// binding both is the job of [PriorSpec], which turns `density(y)` into a density on
/// the physical value by multiplying the transform's Jacobian.
///
/// ## Families
///
/// | Family | Parameters | density(y) ∝ |
/// |--------|------------|--------------|
/// | [UniformPrior] | [lower, upper] | 1 inside the bounds |
/// | [GaussianPrior] | mean, sigma | N(y; mean, sigma) |
/// | [BimodalGaussianPrior] | mean1, sigma1, mean2, sigma2, [bias%] | b·N₁ + (1−b)·N₂ |
/// | [StepPrior] | bias%, [boundary] | bias/100 below the boundary, (100−bias)/100 above |
///
/// Densities are unnormalized: only ratios between two priors on the same sample are
/// ever used.
///
/// ## Validation
///
/// Implementations reject malformed parameters eagerly, in their constructors, with
/// [InvalidPriorParametersException]. [#validate()] repeats the same checks for
/// instances materialized without a constructor call (JSON deserialization).
///
/// @see PriorSpec
/// @see PriorModelTypeAdapterFactory
public interface PriorModel {

    /// Returns the family tag, e.g. `"Gaussian"`.
    String getFamily();

    /// Evaluates the unnormalized family density on the transformed coordinate.
    ///
    /// @param y the transformed coordinate
    /// @return a non-negative density value
    double density(double y);

    /// Returns the family parameters in textual order.
    double[] getParameters();

    /// Re-checks the family parameters.
    ///
    /// @throws InvalidPriorParametersException if the parameters are malformed
    void validate();

    /// Renders this family in the textual prior form, without the transform.
    ///
    /// @return e.g. `"Gaussian(0.55, 0.01)"` or `"Uniform"`
    default String toExpression() {
        double[] parameters = getParameters();
        if (parameters.length == 0) {
            return getFamily();
        }
        StringBuilder sb = new StringBuilder(getFamily()).append('(');
        for (int i = 0; i < parameters.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(parameters[i]);
        }
        return sb.append(')').toString();
    }
}
