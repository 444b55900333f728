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
 * Two-component Gaussian mixture on the transformed coordinate.
 *
 * <p>Typical use is an octant-symmetric θ₂₃ measurement, where the data constrain
 * sin²(2θ₂₃) and leave two solutions in sin²(θ₂₃).
 *
 * <p>density(y) = b·N(y; mean1, sigma1) + (1 − b)·N(y; mean2, sigma2), where
 * b = bias / 100. The bias is given in percent and defaults to 50.
 *
 * <pre>{@code
 * // "BimodalGaussian(0.45, 0.02, 0.57, 0.02, 70):sin^2(x)"
 * BimodalGaussianPrior prior = new BimodalGaussianPrior(0.45, 0.02, 0.57, 0.02, 70);
 * }</pre>
 */
@PriorFamily(BimodalGaussianPrior.FAMILY)
public class BimodalGaussianPrior implements PriorModel {

    public static final String FAMILY = "BimodalGaussian";

    /// Default share of the first component, in percent.
    public static final double DEFAULT_BIAS = 50.0;

    @SerializedName("mean1")
    private final double mean1;

    @SerializedName("sigma1")
    private final double sigma1;

    @SerializedName("mean2")
    private final double mean2;

    @SerializedName("sigma2")
    private final double sigma2;

    @SerializedName("bias")
    private final double bias;

    /**
     * Constructs an evenly weighted mixture.
     */
    public BimodalGaussianPrior(double mean1, double sigma1, double mean2, double sigma2) {
        this(mean1, sigma1, mean2, sigma2, DEFAULT_BIAS);
    }

    /**
     * Constructs a mixture.
     *
     * @param mean1 mean of the first component
     * @param sigma1 width of the first component; must be positive
     * @param mean2 mean of the second component
     * @param sigma2 width of the second component; must be positive
     * @param bias share of the first component in percent, within [0, 100]
     * @throws InvalidPriorParametersException on a non-positive width or a bias outside [0, 100]
     */
    public BimodalGaussianPrior(double mean1, double sigma1, double mean2, double sigma2, double bias) {
        this.mean1 = mean1;
        this.sigma1 = sigma1;
        this.mean2 = mean2;
        this.sigma2 = sigma2;
        this.bias = bias;
        validate();
    }

    @Override
    public String getFamily() {
        return FAMILY;
    }

    @Override
    public double density(double y) {
        double b = bias / 100.0;
        return b * GaussianPrior.normalPdf(y, mean1, sigma1)
            + (1.0 - b) * GaussianPrior.normalPdf(y, mean2, sigma2);
    }

    @Override
    public double[] getParameters() {
        return new double[]{mean1, sigma1, mean2, sigma2, bias};
    }

    @Override
    public void validate() {
        double[] parameters = getParameters();
        GaussianPrior.checkMeanSigma(FAMILY, parameters, mean1, sigma1);
        GaussianPrior.checkMeanSigma(FAMILY, parameters, mean2, sigma2);
        StepPrior.checkBias(FAMILY, parameters, bias);
    }

    public double getMean1() {
        return mean1;
    }

    public double getSigma1() {
        return sigma1;
    }

    public double getMean2() {
        return mean2;
    }

    public double getSigma2() {
        return sigma2;
    }

    public double getBias() {
        return bias;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BimodalGaussianPrior)) return false;
        BimodalGaussianPrior that = (BimodalGaussianPrior) o;
        return Double.compare(mean1, that.mean1) == 0
            && Double.compare(sigma1, that.sigma1) == 0
            && Double.compare(mean2, that.mean2) == 0
            && Double.compare(sigma2, that.sigma2) == 0
            && Double.compare(bias, that.bias) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(mean1, sigma1, mean2, sigma2, bias);
    }

    @Override
    public String toString() {
        return toExpression();
    }
}
