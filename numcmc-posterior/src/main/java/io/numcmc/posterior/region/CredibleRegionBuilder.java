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

import io.numcmc.posterior.histogram.Density;
import io.numcmc.posterior.histogram.PosteriorDensity;
import io.numcmc.posterior.sample.MassOrdering;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/// Builds highest-posterior-density credible regions from normalized densities.
///
/// ## Algorithm
///
/// ```
///   1. rank bins by density, highest first (ties: lower flat index first)
///   2. group bins of exactly equal density
///   3. add whole groups until cumulative mass ≥ level
/// ```
///
/// A group is never split, so a region may overshoot its level when several bins
/// share the boundary density. Each level is evaluated independently against the
/// same ranking, hence a lower level always yields a subset of a higher one.
///
/// ## Unreachable levels
///
/// Under [MassBasis#ALL_SAMPLES] the available mass is the in-range fraction, which
/// may be below the requested level. Such a level yields the region of all bins,
/// flagged saturated and logged at WARN.
///
/// Stateless apart from its mass basis; instances may be shared.
public final class CredibleRegionBuilder {

    private static final Logger logger = LogManager.getLogger(CredibleRegionBuilder.class);

    // cumulative sums of normalized masses land within rounding of 1
    private static final double MASS_TOLERANCE = 1e-12;

    private final MassBasis basis;

    public CredibleRegionBuilder() {
        this(MassBasis.IN_RANGE);
    }

    public CredibleRegionBuilder(MassBasis basis) {
        this.basis = basis;
    }

    public MassBasis getBasis() {
        return basis;
    }

    /// Builds the region of a single density at one level, relative to its own mass.
    ///
    /// @param density a normalized density
    /// @param level a credible level in (0, 1)
    /// @return the region
    public CredibleRegion build(Density density, double level) {
        checkLevel(level);
        return Ranking.of(density, 1.0).regionAt(level, RegionScope.COMBINED);
    }

    /// Builds regions of a posterior at several levels.
    ///
    /// @param posterior the normalized posterior
    /// @param scope the part of the posterior to use
    /// @param levels credible levels in (0, 1)
    /// @return one region per level, in the given order
    /// @throws IllegalArgumentException if a level lies outside (0, 1) or the posterior
    ///     has no density for the requested scope
    public List<CredibleRegion> build(PosteriorDensity posterior, RegionScope scope, double... levels) {
        for (double level : levels) {
            checkLevel(level);
        }
        Ranking ranking;
        MassOrdering[] elementOrdering = null;
        int[] elementBin = null;
        switch (scope) {
            case COMBINED -> ranking = Ranking.of(posterior.combined(),
                basis == MassBasis.ALL_SAMPLES ? posterior.inRangeFraction() : 1.0);
            case NORMAL, INVERTED -> {
                MassOrdering ordering = scope == RegionScope.NORMAL ? MassOrdering.NORMAL : MassOrdering.INVERTED;
                Density density = posterior.density(ordering).orElseThrow(() ->
                    new IllegalArgumentException("Posterior has no density for " + ordering + " samples"));
                ranking = Ranking.of(density,
                    basis == MassBasis.ALL_SAMPLES ? posterior.inRangeFraction(ordering) : 1.0);
            }
            case JOINT -> {
                if (!posterior.isSeparated()) {
                    throw new IllegalArgumentException("A joint region needs a posterior separated by mass ordering");
                }
                List<Density> parts = new ArrayList<>();
                List<MassOrdering> owners = new ArrayList<>();
                for (MassOrdering ordering : posterior.orderings()) {
                    posterior.jointDensity(ordering).ifPresent(d -> {
                        parts.add(d);
                        owners.add(ordering);
                    });
                }
                int bins = parts.get(0).binCount();
                elementOrdering = new MassOrdering[bins * parts.size()];
                elementBin = new int[elementOrdering.length];
                double[] densities = new double[elementOrdering.length];
                double[] masses = new double[elementOrdering.length];
                double coverage = basis == MassBasis.ALL_SAMPLES ? posterior.inRangeFraction() : 1.0;
                for (int p = 0; p < parts.size(); p++) {
                    Density d = parts.get(p);
                    for (int b = 0; b < bins; b++) {
                        int e = p * bins + b;
                        elementOrdering[e] = owners.get(p);
                        elementBin[e] = b;
                        densities[e] = d.value(b);
                        masses[e] = d.mass(b) * coverage;
                    }
                }
                ranking = new Ranking(densities, masses);
            }
            default -> throw new IllegalArgumentException("Unknown scope " + scope);
        }
        List<CredibleRegion> regions = new ArrayList<>(levels.length);
        for (double level : levels) {
            regions.add(scope == RegionScope.JOINT
                ? ranking.jointRegionAt(level, elementOrdering, elementBin)
                : ranking.regionAt(level, scope));
        }
        return regions;
    }

    private static void checkLevel(double level) {
        if (!(level > 0.0 && level < 1.0)) {
            throw new IllegalArgumentException("Credible level must lie in (0, 1), got " + level);
        }
    }

    /// The leading ranked elements that make up a region.
    private record Cut(int count, double mass, double threshold, boolean saturated) {
    }

    /// Elements ranked by density, highest first.
    private static final class Ranking {

        private final double[] densities;
        private final double[] masses;
        private final int[] order;

        Ranking(double[] densities, double[] masses) {
            this.densities = densities;
            this.masses = masses;
            Integer[] boxed = new Integer[densities.length];
            for (int i = 0; i < boxed.length; i++) {
                boxed[i] = i;
            }
            Arrays.sort(boxed, (a, b) -> {
                int c = Double.compare(densities[b], densities[a]);
                return c != 0 ? c : Integer.compare(a, b);
            });
            this.order = new int[boxed.length];
            for (int i = 0; i < boxed.length; i++) {
                order[i] = boxed[i];
            }
        }

        static Ranking of(Density density, double coverage) {
            int n = density.binCount();
            double[] densities = new double[n];
            double[] masses = new double[n];
            for (int b = 0; b < n; b++) {
                densities[b] = density.value(b);
                masses[b] = density.mass(b) * coverage;
            }
            return new Ranking(densities, masses);
        }

        private Cut cut(double level) {
            double cumulative = 0;
            int i = 0;
            double threshold = Double.NaN;
            while (i < order.length) {
                double groupDensity = densities[order[i]];
                int j = i;
                while (j < order.length && densities[order[j]] == groupDensity) {
                    cumulative += masses[order[j]];
                    j++;
                }
                threshold = groupDensity;
                i = j;
                if (cumulative >= level - MASS_TOLERANCE) {
                    return new Cut(i, cumulative, threshold, false);
                }
            }
            return new Cut(order.length, cumulative, threshold, true);
        }

        CredibleRegion regionAt(double level, RegionScope scope) {
            Cut cut = cut(level);
            int[] bins = new int[cut.count()];
            for (int k = 0; k < bins.length; k++) {
                bins[k] = order[k];
            }
            Arrays.sort(bins);
            return finish(level, scope, cut, bins, Map.of());
        }

        CredibleRegion jointRegionAt(double level, MassOrdering[] elementOrdering, int[] elementBin) {
            Cut cut = cut(level);
            Map<MassOrdering, TreeSet<Integer>> byOrdering = new EnumMap<>(MassOrdering.class);
            TreeSet<Integer> union = new TreeSet<>();
            for (int k = 0; k < cut.count(); k++) {
                int e = order[k];
                byOrdering.computeIfAbsent(elementOrdering[e], o -> new TreeSet<>()).add(elementBin[e]);
                union.add(elementBin[e]);
            }
            Map<MassOrdering, int[]> perOrdering = new EnumMap<>(MassOrdering.class);
            for (Map.Entry<MassOrdering, TreeSet<Integer>> entry : byOrdering.entrySet()) {
                perOrdering.put(entry.getKey(), toArray(entry.getValue()));
            }
            return finish(level, RegionScope.JOINT, cut, toArray(union), perOrdering);
        }

        private static CredibleRegion finish(double level, RegionScope scope, Cut cut, int[] bins,
                                             Map<MassOrdering, int[]> perOrdering) {
            if (cut.saturated()) {
                logger.warn("Credible level {} unreachable for {} region: only {} of the mass is available; "
                    + "reporting all {} bins", level, scope, cut.mass(), bins.length);
            }
            return new CredibleRegion(level, scope, cut.threshold(), cut.mass(), cut.saturated(), bins, perOrdering);
        }

        private static int[] toArray(TreeSet<Integer> values) {
            int[] out = new int[values.size()];
            int k = 0;
            for (int v : values) {
                out[k++] = v;
            }
            return out;
        }
    }
}
