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
 * Two-level prior that favours one side of a boundary on the transformed coordinate.
 *
 * <p>density(y) = bias/100 for y below the boundary and (100 − bias)/100 at or above
 * it. With the default boundary of 0 on Δm²₃₂ this expresses a preference between
 * the two mass orderings, e.g. {@code Step(75):x}.
 */
@PriorFamily(StepPrior.FAMILY)
public class StepPrior implements PriorModel {

    public static final String FAMILY = "Step";

    public static final double DEFAULT_BOUNDARY = 0.0;

    @SerializedName("bias")
    private final double bias;

    @SerializedName("boundary")
    private final double boundary;

    /**
     * Constructs a step prior at the default boundary.
     *
     * @param bias weight below the boundary, in percent
     */
    public StepPrior(double bias) {
        this(bias, DEFAULT_BOUNDARY);
    }

    /**
     * Constructs a step prior.
     *
     * @param bias weight below the boundary, in percent within [0, 100]
     * @param boundary the step location on the transformed coordinate
     * @throws InvalidPriorParametersException if bias is outside [0, 100] or boundary is not finite
     */
    public StepPrior(double bias, double boundary) {
        this.bias = bias;
        this.boundary = boundary;
        validate();
    }

    static void checkBias(String family, double[] parameters, double bias) {
        if (Double.isNaN(bias) || bias < 0.0 || bias > 100.0) {
            throw new InvalidPriorParametersException(family, parameters,
                "bias must be a percentage within [0, 100], got " + bias);
        }
    }

    @Override
    public String getFamily() {
        return FAMILY;
    }

    @Override
    public double density(double y) {
        if (y < boundary) {
            return bias / 100.0;
        }
        return (100.0 - bias) / 100.0;
    }

    @Override
    public double[] getParameters() {
        return new double[]{bias, boundary};
    }

    @Override
    public void validate() {
        checkBias(FAMILY, getParameters(), bias);
        if (!Double.isFinite(boundary)) {
            throw new InvalidPriorParametersException(FAMILY, getParameters(), "boundary must be finite");
        }
    }

    public double getBias() {
        return bias;
    }

    public double getBoundary() {
        return boundary;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StepPrior)) return false;
        StepPrior that = (StepPrior) o;
        return Double.compare(bias, that.bias) == 0 && Double.compare(boundary, that.boundary) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(bias, boundary);
    }

    @Override
    public String toString() {
        return toExpression();
    }
}
