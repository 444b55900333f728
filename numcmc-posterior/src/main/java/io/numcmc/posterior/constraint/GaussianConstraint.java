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

import java.util.Arrays;

/// A Gaussian external measurement, 1-D or 2-D with correlation.
///
/// ```
///   1-D:  exp(−z²/2)
///   2-D:  exp(−(z₁² − 2ρ z₁ z₂ + z₂²) / (2(1 − ρ²)))     z = (v − mean) / sigma
/// ```
///
/// The peak value is 1; normalization constants cancel once the histogram is
/// normalized.
public final class GaussianConstraint implements Constraint {

    private final double[] mean;
    private final double[] sigma;
    private final double correlation;

    /// Creates a one-dimensional constraint.
    public GaussianConstraint(double mean, double sigma) {
        this(new double[]{mean}, new double[]{sigma}, 0.0);
    }

    /// Creates a constraint of one or two dimensions.
    ///
    /// @param mean per-dimension means
    /// @param sigma per-dimension widths, positive
    /// @param correlation correlation coefficient in (−1, 1); ignored in one dimension
    public GaussianConstraint(double[] mean, double[] sigma, double correlation) {
        if (mean.length != sigma.length || mean.length < 1 || mean.length > 2) {
            throw new IllegalArgumentException("Gaussian constraint needs 1 or 2 mean/sigma pairs, got "
                + mean.length + " means and " + sigma.length + " sigmas");
        }
        for (int i = 0; i < mean.length; i++) {
            if (!Double.isFinite(mean[i]) || !(sigma[i] > 0) || Double.isInfinite(sigma[i])) {
                throw new IllegalArgumentException("Gaussian constraint needs a finite mean and positive sigma, got mean="
                    + mean[i] + ", sigma=" + sigma[i]);
            }
        }
        if (!(correlation > -1.0 && correlation < 1.0)) {
            throw new IllegalArgumentException("Correlation must lie in (-1, 1), got " + correlation);
        }
        this.mean = mean.clone();
        this.sigma = sigma.clone();
        this.correlation = correlation;
    }

    @Override
    public int dimensions() {
        return mean.length;
    }

    @Override
    public double density(double... values) {
        checkArity(values);
        double z1 = (values[0] - mean[0]) / sigma[0];
        if (mean.length == 1) {
            return Math.exp(-0.5 * z1 * z1);
        }
        double z2 = (values[1] - mean[1]) / sigma[1];
        double q = (z1 * z1 - 2 * correlation * z1 * z2 + z2 * z2) / (1 - correlation * correlation);
        return Math.exp(-0.5 * q);
    }

    public double[] getMean() {
        return mean.clone();
    }

    public double[] getSigma() {
        return sigma.clone();
    }

    public double getCorrelation() {
        return correlation;
    }

    @Override
    public String toString() {
        return "GaussianConstraint[mean=" + Arrays.toString(mean) + ", sigma=" + Arrays.toString(sigma)
            + (mean.length == 2 ? ", rho=" + correlation : "") + "]";
    }
}
