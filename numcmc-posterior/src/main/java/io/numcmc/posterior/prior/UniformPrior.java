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
 * Flat prior on the transformed coordinate.
 *
 * <p>Without bounds the prior covers the natural range of its transform (the whole
 * image of the physical domain), so {@link #density(double)} is constant and the
 * physical-space density reduces to the Jacobian alone. Optional bounds restrict the
 * support; the density is zero outside {@code [lower, upper]}.
 *
 * <pre>{@code
 * // "Uniform:sin^2(x)"
 * UniformPrior natural = UniformPrior.natural();
 *
 * // "Uniform(0.3, 0.7):sin^2(x)"
 * UniformPrior bounded = new UniformPrior(0.3, 0.7);
 * }</pre>
 */
@PriorFamily(UniformPrior.FAMILY)
public class UniformPrior implements PriorModel {

    public static final String FAMILY = "Uniform";

    @SerializedName("lower")
    private final double lower;

    @SerializedName("upper")
    private final double upper;

    /**
     * Constructs a bounded uniform prior.
     *
     * @param lower the lower bound on the transformed coordinate
     * @param upper the upper bound on the transformed coordinate
     * @throws InvalidPriorParametersException if lower is not below upper
     */
    public UniformPrior(double lower, double upper) {
        this.lower = lower;
        this.upper = upper;
        validate();
    }

    /**
     * Returns a uniform prior over the transform's natural range.
     *
     * @return an unbounded uniform prior
     */
    public static UniformPrior natural() {
        return new UniformPrior(Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);
    }

    @Override
    public String getFamily() {
        return FAMILY;
    }

    @Override
    public double density(double y) {
        if (y < lower || y > upper) {
            return 0.0;
        }
        return 1.0;
    }

    @Override
    public double[] getParameters() {
        if (isNatural()) {
            return new double[0];
        }
        return new double[]{lower, upper};
    }

    @Override
    public void validate() {
        if (Double.isNaN(lower) || Double.isNaN(upper)) {
            throw new InvalidPriorParametersException(FAMILY, new double[]{lower, upper}, "bounds must be numbers");
        }
        if (lower >= upper) {
            throw new InvalidPriorParametersException(FAMILY, new double[]{lower, upper},
                "lower bound must be less than upper bound");
        }
    }

    /**
     * Returns whether this prior spans the transform's natural range.
     *
     * @return true if both bounds are infinite
     */
    public boolean isNatural() {
        return Double.isInfinite(lower) && Double.isInfinite(upper);
    }

    public double getLower() {
        return lower;
    }

    public double getUpper() {
        return upper;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UniformPrior)) return false;
        UniformPrior that = (UniformPrior) o;
        return Double.compare(lower, that.lower) == 0 && Double.compare(upper, that.upper) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(lower, upper);
    }

    @Override
    public String toString() {
        return toExpression();
    }
}
