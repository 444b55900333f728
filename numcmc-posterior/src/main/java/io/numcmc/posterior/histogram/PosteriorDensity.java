package io.numcmc.posterior.histogram;

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
import io.numcmc.posterior.sample.MassOrdering;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// The normalized posterior of one plot.
///
/// Always holds the combined density. When the source histogram separated mass
/// orderings it also holds, for each ordering with in-range weight:
///
/// | Member | Normalized by | Integrates to |
/// |--------|---------------|---------------|
/// | [#density(MassOrdering)] | the ordering's own in-range weight | 1 |
/// | [#jointDensity(MassOrdering)] | the combined in-range weight | the ordering's probability |
/// | [#orderingProbability(MassOrdering)] | | its share of in-range weight |
///
/// Joint densities put both orderings on one scale, which is what a region spanning
/// both orderings ranks bins by.
///
/// Immutable.
public final class PosteriorDensity {

    @SerializedName("combined")
    private final Density combined;

    @SerializedName("by_ordering")
    private final Map<MassOrdering, Density> byOrdering;

    @SerializedName("joint_by_ordering")
    private final Map<MassOrdering, Density> jointByOrdering;

    @SerializedName("ordering_probability")
    private final Map<MassOrdering, Double> orderingProbability;

    @SerializedName("in_range_weight")
    private final double inRangeWeight;

    @SerializedName("out_of_range_weight")
    private final double outOfRangeWeight;

    private final transient Map<MassOrdering, Double> inRangeFractionByOrdering;

    PosteriorDensity(Density combined,
                     Map<MassOrdering, Density> byOrdering,
                     Map<MassOrdering, Density> jointByOrdering,
                     Map<MassOrdering, Double> orderingProbability,
                     Map<MassOrdering, Double> inRangeFractionByOrdering,
                     double inRangeWeight,
                     double outOfRangeWeight) {
        this.combined = combined;
        this.byOrdering = unmodifiable(byOrdering);
        this.jointByOrdering = unmodifiable(jointByOrdering);
        this.orderingProbability = unmodifiable(orderingProbability);
        this.inRangeFractionByOrdering = unmodifiable(inRangeFractionByOrdering);
        this.inRangeWeight = inRangeWeight;
        this.outOfRangeWeight = outOfRangeWeight;
    }

    private static <V> Map<MassOrdering, V> unmodifiable(Map<MassOrdering, V> map) {
        return map.isEmpty() ? Map.of() : Collections.unmodifiableMap(new EnumMap<>(map));
    }

    public Density combined() {
        return combined;
    }

    /// Returns whether per-ordering densities were produced.
    public boolean isSeparated() {
        return !orderingProbability.isEmpty();
    }

    /// Returns the orderings that received in-range weight.
    public Set<MassOrdering> orderings() {
        return byOrdering.keySet();
    }

    /// Returns the density of one ordering, normalized on its own.
    ///
    /// @return the density, or empty if the ordering received no in-range weight or
    ///     orderings were not separated
    public Optional<Density> density(MassOrdering ordering) {
        return Optional.ofNullable(byOrdering.get(ordering));
    }

    /// Returns the density of one ordering on the combined scale.
    public Optional<Density> jointDensity(MassOrdering ordering) {
        return Optional.ofNullable(jointByOrdering.get(ordering));
    }

    /// Returns the share of in-range weight that fell in an ordering.
    ///
    /// @throws IllegalStateException if orderings were not separated
    public double orderingProbability(MassOrdering ordering) {
        if (!isSeparated()) {
            throw new IllegalStateException("Posterior was not separated by mass ordering");
        }
        return orderingProbability.getOrDefault(ordering, 0.0);
    }

    public double inRangeWeight() {
        return inRangeWeight;
    }

    public double outOfRangeWeight() {
        return outOfRangeWeight;
    }

    /// Returns in-range weight over all accepted weight.
    public double inRangeFraction() {
        return inRangeWeight / (inRangeWeight + outOfRangeWeight);
    }

    /// Returns in-range weight over accepted weight within one ordering.
    public double inRangeFraction(MassOrdering ordering) {
        return inRangeFractionByOrdering.getOrDefault(ordering, 0.0);
    }
}
