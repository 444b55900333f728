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

import com.google.gson.annotations.SerializedName;

import java.util.Objects;

/**
 * Gaussian prior on the transformed coordinate, e.g. a reactor measurement of
 * sin²(2θ₁₃) written as {@code Gaussian(0.085, 0.003):sin^2(2x)}.
 *
 * <p>The density is the normal PDF N(y; mean, sigma). The normalization constant is
 * kept so that {@link BimodalGaussianPrior} mixtures weight their components by
 * probability mass.
 */
@PriorFamily(GaussianPrior.FAMILY)
public class GaussianPrior implements PriorModel {

    public static final String FAMILY = "Gaussian";

    private static final double SQRT_TWO_PI = Math.sqrt(2 * Math.PI);

    @SerializedName("mean")
    private final double mean;

    @SerializedName("sigma")
    private final double sigma;

    /**
     * Constructs a Gaussian prior.
     *
     * @param mean the mean on the transformed coordinate
     * @param sigma the standard deviation; must be positive
     * @throws InvalidPriorParametersException if sigma is not positive or a value is not finite
     */
    public GaussianPrior(double mean, double sigma) {
        this.mean = mean;
        this.sigma = sigma;
        validate();
    }

    /**
     * Evaluates the normal PDF.
     *
     * @param y the point
     * @param mean the mean
     * @param sigma the standard deviation
     * @return N(y; mean, sigma)
     */
    static double normalPdf(double y, double mean, double sigma) {
        double z = (y - mean) / sigma;
        return Math.exp(-0.5 * z * z) / (sigma * SQRT_TWO_PI);
    }

    /**
     * Checks a mean/sigma pair.
     */
    static void checkMeanSigma(String family, double[] parameters, double mean, double sigma) {
        if (!Double.isFinite(mean) || !Double.isFinite(sigma)) {
            throw new InvalidPriorParametersException(family, parameters, "mean and sigma must be finite");
        }
        if (sigma <= 0) {
            throw new InvalidPriorParametersException(family, parameters, "sigma must be positive, got " + sigma);
        }
    }

    @Override
    public String getFamily() {
        return FAMILY;
    }

    @Override
    public double density(double y) {
        return normalPdf(y, mean, sigma);
    }

    @Override
    public double[] getParameters() {
        return new double[]{mean, sigma};
    }

    @Override
    public void validate() {
        checkMeanSigma(FAMILY, getParameters(), mean, sigma);
    }

    public double getMean() {
        return mean;
    }

    public double getSigma() {
        return sigma;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GaussianPrior)) return false;
        GaussianPrior that = (GaussianPrior) o;
        return Double.compare(mean, that.mean) == 0 && Double.compare(sigma, that.sigma) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(mean, sigma);
    }

    @Override
    public String toString() {
        return toExpression();
    }
}
