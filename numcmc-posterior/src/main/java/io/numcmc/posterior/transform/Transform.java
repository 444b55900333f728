package io.numcmc.posterior.transform;

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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.DoubleUnaryOperator;

/// Closed catalog of coordinate transforms a prior may be stated in.
///
/// ## Purpose
///
/// A prior such as "uniform in sin²(θ₂₃)" is a statement about the transformed
/// coordinate `y = f(x)`, not about the physical angle `x` stored in the chain.
/// Re-expressing it as a density in `x` needs the Jacobian `|dy/dx|`, which every
/// entry here provides analytically.
///
/// ## Catalog
///
/// | Tag | y = f(x) | dy/dx |
/// |-----|----------|-------|
/// | `x` | x | 1 |
/// | `sin(x)` | sin x | cos x |
/// | `sin^2(x)` | sin²x | sin 2x |
/// | `cos(x)` | cos x | −sin x |
/// | `cos^2(x)` | cos²x | −sin 2x |
/// | `cos^4(x)` | cos⁴x | −4 cos³x sin x |
/// | `2x` | 2x | 2 |
/// | `sin(2x)` | sin 2x | 2 cos 2x |
/// | `sin^2(2x)` | sin²2x | 2 sin 4x |
/// | `cos(2x)` | cos 2x | −2 sin 2x |
/// | `cos^2(2x)` | cos²2x | −2 sin 4x |
/// | `cos^4(2x)` | cos⁴2x | −8 cos³2x sin 2x |
/// | `exp(-ix)` | phase of e^(−ix) | modulus 1 |
/// | `exp(ix)` | phase of e^(ix) | modulus 1 |
/// | `abs(ix)` | \|e^(ix)\| = 1 | 0 |
///
/// The unit-circle entries describe a cyclic angle (δCP) through its embedding in the
/// complex plane. Their real coordinate is the phase wrapped to (−π, π]; the map is a
/// rotation, so the Jacobian modulus is one. `abs(ix)` is the modulus of the same
/// embedding, a constant, and therefore carries a zero Jacobian.
///
/// ## Parsing
///
/// Tags are resolved once, by [#fromTag(String)], so an unknown transform is rejected
/// when a prior is parsed rather than when a sample is evaluated.
///
/// @see io.numcmc.posterior.prior.PriorModel
public enum Transform {

    IDENTITY("x", x -> x, x -> 1.0),
    SIN("sin(x)", Math::sin, Math::cos),
    SIN_SQUARED("sin^2(x)", x -> square(Math.sin(x)), x -> Math.sin(2 * x)),
    COS("cos(x)", Math::cos, x -> -Math.sin(x)),
    COS_SQUARED("cos^2(x)", x -> square(Math.cos(x)), x -> -Math.sin(2 * x)),
    COS_FOURTH("cos^4(x)", x -> square(square(Math.cos(x))),
        x -> -4 * cube(Math.cos(x)) * Math.sin(x)),
    DOUBLE("2x", x -> 2 * x, x -> 2.0),
    SIN_DOUBLE("sin(2x)", x -> Math.sin(2 * x), x -> 2 * Math.cos(2 * x)),
    SIN_SQUARED_DOUBLE("sin^2(2x)", x -> square(Math.sin(2 * x)), x -> 2 * Math.sin(4 * x)),
    COS_DOUBLE("cos(2x)", x -> Math.cos(2 * x), x -> -2 * Math.sin(2 * x)),
    COS_SQUARED_DOUBLE("cos^2(2x)", x -> square(Math.cos(2 * x)), x -> -2 * Math.sin(4 * x)),
    COS_FOURTH_DOUBLE("cos^4(2x)", x -> square(square(Math.cos(2 * x))),
        x -> -8 * cube(Math.cos(2 * x)) * Math.sin(2 * x)),
    EXP_MINUS_IX("exp(-ix)", x -> wrapPhase(-x), x -> 1.0),
    EXP_IX("exp(ix)", Transform::wrapPhase, x -> 1.0),
    ABS_IX("abs(ix)", x -> 1.0, x -> 0.0);

    private static final Map<String, Transform> BY_TAG;

    static {
        Map<String, Transform> byTag = new LinkedHashMap<>();
        for (Transform t : values()) {
            byTag.put(t.tag, t);
        }
        BY_TAG = Collections.unmodifiableMap(byTag);
    }

    private final String tag;
    private final DoubleUnaryOperator forward;
    private final DoubleUnaryOperator derivative;

    Transform(String tag, DoubleUnaryOperator forward, DoubleUnaryOperator derivative) {
        this.tag = tag;
        this.forward = forward;
        this.derivative = derivative;
    }

    /// Returns the canonical tag, e.g. `sin^2(2x)`.
    public String tag() {
        return tag;
    }

    /// Maps a physical value to the transformed coordinate.
    ///
    /// @param x the physical value
    /// @return y = f(x)
    public double apply(double x) {
        return forward.applyAsDouble(x);
    }

    /// Returns the Jacobian magnitude |dy/dx| at a physical value.
    ///
    /// @param x the physical value
    /// @return the non-negative Jacobian magnitude
    public double jacobian(double x) {
        return Math.abs(derivative.applyAsDouble(x));
    }

    /// Returns true when this transform is the identity.
    public boolean isIdentity() {
        return this == IDENTITY;
    }

    /// Resolves a canonical tag.
    ///
    /// Whitespace is ignored and the superscripts `²` and `⁴` are accepted in place of
    /// `^2` and `^4`.
    ///
    /// @param tag the transform tag, e.g. `"sin^2(x)"`
    /// @return the matching catalog entry
    /// @throws UnsupportedTransformException if the tag is not in the catalog
    public static Transform fromTag(String tag) {
        if (tag == null) {
            throw new UnsupportedTransformException("null", tags());
        }
        String normalized = normalize(tag);
        Transform transform = BY_TAG.get(normalized);
        if (transform == null) {
            throw new UnsupportedTransformException(tag, tags());
        }
        return transform;
    }

    /// Resolves a tag in which the argument is written as a variable name.
    ///
    /// `sin^2(2Theta13)` with variable `Theta13` resolves to [#SIN_SQUARED_DOUBLE],
    /// and a bare variable name resolves to [#IDENTITY].
    ///
    /// @param tag the transform expression
    /// @param variable the variable name standing for `x`
    /// @return the matching catalog entry
    /// @throws UnsupportedTransformException if the substituted tag is not in the catalog
    public static Transform fromExpression(String tag, String variable) {
        if (tag == null || variable == null || variable.isEmpty()) {
            return fromTag(tag);
        }
        String normalized = normalize(tag);
        if (normalized.contains(variable)) {
            String substituted = normalized.replace(variable, "x");
            Transform transform = BY_TAG.get(substituted);
            if (transform == null) {
                throw new UnsupportedTransformException(tag, tags());
            }
            return transform;
        }
        return fromTag(tag);
    }

    /// Returns every supported tag, in catalog order.
    public static Collection<String> tags() {
        return BY_TAG.keySet();
    }

    @Override
    public String toString() {
        return tag;
    }

    private static String normalize(String tag) {
        return tag.replaceAll("\\s+", "")
            .replace("²", "^2")
            .replace("⁴", "^4")
            .replace("**", "^");
    }

    private static double square(double v) {
        return v * v;
    }

    private static double cube(double v) {
        return v * v * v;
    }

    /// Wraps an angle to (−π, π].
    static double wrapPhase(double angle) {
        double wrapped = Math.IEEEremainder(angle, 2 * Math.PI);
        if (wrapped <= -Math.PI) {
            wrapped += 2 * Math.PI;
        }
        return wrapped;
    }
}
