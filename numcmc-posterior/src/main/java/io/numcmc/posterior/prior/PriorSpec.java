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
import io.numcmc.posterior.transform.Transform;

import java.util.Objects;

/// A prior family bound to a variable and to the coordinate it is stated in.
///
/// ## Density on the physical value
///
/// ```
///   x (physical)  ──f──►  y = f(x)  ──model──►  p(y)
///
///   density(x) = p(f(x)) · |df/dx|
/// ```
///
/// A chain carries one PriorSpec per physical variable, describing the prior it was
/// sampled under. A plot may supply a replacement spec for the same variable; the
/// ratio of the two densities is the importance weight.
///
/// ## Textual form
///
/// [#toExpression()] renders `Family[(params)]:transform`, the same form accepted by
/// [PriorSpecParser], e.g. `Gaussian(0.55, 0.01):sin^2(x)`.
///
/// Instances are immutable and safe to share between plots.
public final class PriorSpec {

    @SerializedName("variable")
    private final String variable;

    @SerializedName("prior")
    private final PriorModel model;

    @SerializedName("transform")
    private final Transform transform;

    public PriorSpec(String variable, PriorModel model, Transform transform) {
        this.variable = Objects.requireNonNull(variable, "variable");
        this.model = Objects.requireNonNull(model, "model");
        this.transform = Objects.requireNonNull(transform, "transform");
    }

    /// Returns a flat prior in the variable itself, the form a chain is assumed to be
    /// sampled in when its metadata says nothing else.
    ///
    /// @param variable the variable name
    /// @return `Uniform:x` for the variable
    public static PriorSpec uniform(String variable) {
        return new PriorSpec(variable, UniformPrior.natural(), Transform.IDENTITY);
    }

    /// Evaluates the unnormalized prior density at a physical value.
    ///
    /// @param x the physical value of [#getVariable()]
    /// @return the family density at f(x) times |df/dx|
    public double density(double x) {
        double jacobian = transform.jacobian(x);
        if (jacobian == 0.0) {
            return 0.0;
        }
        return model.density(transform.apply(x)) * jacobian;
    }

    public String getVariable() {
        return variable;
    }

    public PriorModel getModel() {
        return model;
    }

    public Transform getTransform() {
        return transform;
    }

    /// Renders the textual prior form.
    ///
    /// @return e.g. `Gaussian(0.55, 0.01):sin^2(x)`
    public String toExpression() {
        return model.toExpression() + ":" + transform.tag();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PriorSpec)) return false;
        PriorSpec that = (PriorSpec) o;
        return variable.equals(that.variable)
            && model.equals(that.model)
            && transform == that.transform;
    }

    @Override
    public int hashCode() {
        return Objects.hash(variable, model, transform);
    }

    @Override
    public String toString() {
        return variable + "=" + toExpression();
    }
}
