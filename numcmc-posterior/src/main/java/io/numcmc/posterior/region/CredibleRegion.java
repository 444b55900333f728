package io.numcmc.posterior.region;

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

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/// A highest-posterior-density region: the smallest set of bins, taken in order of
/// decreasing density, whose mass reaches a credible level.
///
/// Bin indices are flat indices into the density's bins, sorted ascending. For a
/// [RegionScope#JOINT] region the bins are the union over orderings and
/// [#bins(MassOrdering)] gives each ordering's part.
///
/// Immutable.
public final class CredibleRegion {

    @SerializedName("level")
    private final double level;

    @SerializedName("scope")
    private final RegionScope scope;

    @SerializedName("threshold")
    private final double threshold;

    @SerializedName("achieved_mass")
    private final double achievedMass;

    @SerializedName("saturated")
    private final boolean saturated;

    @SerializedName("bins")
    private final int[] bins;

    @SerializedName("bins_by_ordering")
    private final Map<MassOrdering, int[]> binsByOrdering;

    CredibleRegion(double level, RegionScope scope, double threshold, double achievedMass,
                   boolean saturated, int[] bins, Map<MassOrdering, int[]> binsByOrdering) {
        this.level = level;
        this.scope = scope;
        this.threshold = threshold;
        this.achievedMass = achievedMass;
        this.saturated = saturated;
        this.bins = bins;
        this.binsByOrdering = binsByOrdering.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new EnumMap<>(binsByOrdering));
    }

    /// Returns the requested credible level.
    public double level() {
        return level;
    }

    public RegionScope scope() {
        return scope;
    }

    /// Returns the density of the lowest-density group included.
    public double threshold() {
        return threshold;
    }

    /// Returns the mass covered, at least [#level()] unless [#isSaturated()].
    public double achievedMass() {
        return achievedMass;
    }

    /// Returns true when the level could not be reached and every bin was included.
    public boolean isSaturated() {
        return saturated;
    }

    /// Returns the included flat bin indices, ascending.
    public int[] bins() {
        return bins.clone();
    }

    /// Returns one ordering's share of a joint region.
    ///
    /// @throws IllegalStateException if the region is not joint
    public int[] bins(MassOrdering ordering) {
        if (scope != RegionScope.JOINT) {
            throw new IllegalStateException("Region of scope " + scope + " has no per-ordering bins");
        }
        int[] b = binsByOrdering.get(ordering);
        return b == null ? new int[0] : b.clone();
    }

    public int size() {
        return bins.length;
    }

    public boolean contains(int bin) {
        return Arrays.binarySearch(bins, bin) >= 0;
    }

    @Override
    public String toString() {
        return "CredibleRegion[" + scope + " " + level + ": " + bins.length + " bins, threshold=" + threshold
            + ", mass=" + achievedMass + (saturated ? ", saturated" : "") + "]";
    }
}
