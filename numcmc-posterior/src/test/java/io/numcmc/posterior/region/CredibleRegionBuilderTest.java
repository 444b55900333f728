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

import io.numcmc.posterior.histogram.BinAxis;
import io.numcmc.posterior.histogram.DensityNormalizer;
import io.numcmc.posterior.histogram.PosteriorDensity;
import io.numcmc.posterior.histogram.WeightedHistogram;
import io.numcmc.posterior.sample.MassOrdering;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
public class CredibleRegionBuilderTest {

    private static final double TOLERANCE = 1e-12;

    private final CredibleRegionBuilder builder = new CredibleRegionBuilder();

    @Test
    void takesHighestDensityBinsFirst() {
        PosteriorDensity posterior = posterior(1, 4, 3, 2);

        List<CredibleRegion> regions = builder.build(posterior, RegionScope.COMBINED, 0.5, 0.9);

        CredibleRegion half = regions.get(0);
        assertThat(half.bins()).containsExactly(1, 2);
        assertEquals(0.7, half.achievedMass(), TOLERANCE);
        assertEquals(0.3, half.threshold(), TOLERANCE);
        assertFalse(half.isSaturated());

        assertThat(regions.get(1).bins()).containsExactly(1, 2, 3);
    }

    @Test
    void equalDensityGroupsAreNeverSplit() {
        PosteriorDensity posterior = posterior(2, 2, 1, 5);

        CredibleRegion region = builder.build(posterior.combined(), 0.6);

        assertThat(region.bins()).containsExactly(0, 1, 3);
        assertEquals(0.9, region.achievedMass(), TOLERANCE);
    }

    @Test
    void regionsAreNestedInLevel() {
        Random random = new Random(7);
        double[] weights = new double[40];
        for (int i = 0; i < weights.length; i++) {
            weights[i] = random.nextInt(20);
        }
        PosteriorDensity posterior = posterior(weights);

        double[] levels = {0.1, 0.3, 0.5, 0.6827, 0.9, 0.9545, 0.99};
        List<CredibleRegion> regions = builder.build(posterior, RegionScope.COMBINED, levels);

        for (int i = 1; i < regions.size(); i++) {
            for (int bin : regions.get(i - 1).bins()) {
                assertTrue(regions.get(i).contains(bin), "level " + levels[i] + " misses bin " + bin);
            }
            assertThat(regions.get(i).achievedMass()).isGreaterThanOrEqualTo(levels[i] - TOLERANCE);
        }
    }

    @Test
    void rankingIsDeterministic() {
        PosteriorDensity posterior = posterior(3, 1, 3, 1, 3);

        CredibleRegion first = builder.build(posterior.combined(), 0.5);
        CredibleRegion second = builder.build(posterior.combined(), 0.5);

        assertThat(first.bins()).containsExactly(0, 2, 4).isEqualTo(second.bins());
    }

    @Test
    void allSamplesBasisSaturatesWhenMassIsMissing() {
        WeightedHistogram h = new WeightedHistogram(BinAxis.uniform(2, 0, 2));
        h.add(0.5, 1.0, 1e-3);
        h.add(1.5, 1.0, 1e-3);
        h.add(5.0, 2.0, 1e-3);
        PosteriorDensity posterior = DensityNormalizer.normalize(h);

        CredibleRegion inRange = new CredibleRegionBuilder(MassBasis.IN_RANGE)
            .build(posterior, RegionScope.COMBINED, 0.68).get(0);
        CredibleRegion allSamples = new CredibleRegionBuilder(MassBasis.ALL_SAMPLES)
            .build(posterior, RegionScope.COMBINED, 0.68).get(0);

        assertFalse(inRange.isSaturated());
        assertTrue(allSamples.isSaturated());
        assertEquals(2, allSamples.size());
        assertEquals(0.5, allSamples.achievedMass(), TOLERANCE);
    }

    @Test
    void levelsOutsideUnitIntervalAreRejected() {
        PosteriorDensity posterior = posterior(1, 1);
        assertThatThrownBy(() -> builder.build(posterior, RegionScope.COMBINED, 0.0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.build(posterior, RegionScope.COMBINED, 1.0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.build(posterior.combined(), Double.NaN))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void orderingScopesUseTheirOwnDensity() {
        PosteriorDensity posterior = separated();

        CredibleRegion normal = builder.build(posterior, RegionScope.NORMAL, 0.7).get(0);
        CredibleRegion inverted = builder.build(posterior, RegionScope.INVERTED, 0.7).get(0);

        assertThat(normal.bins()).containsExactly(0);
        assertThat(inverted.bins()).containsExactly(1);
        assertThatThrownBy(() -> normal.bins(MassOrdering.NORMAL)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void jointRegionRanksBothOrderingsTogether() {
        PosteriorDensity posterior = separated();

        CredibleRegion joint = builder.build(posterior, RegionScope.JOINT, 0.8).get(0);

        assertThat(joint.bins(MassOrdering.INVERTED)).containsExactly(1);
        assertThat(joint.bins(MassOrdering.NORMAL)).containsExactly(0);
        assertThat(joint.bins()).containsExactly(0, 1);
        assertEquals(0.875, joint.achievedMass(), TOLERANCE);
        assertEquals(0.375, joint.threshold(), TOLERANCE);
    }

    @Test
    void jointRegionNeedsSeparation() {
        assertThatThrownBy(() -> builder.build(posterior(1, 2), RegionScope.JOINT, 0.5))
            .isInstanceOf(IllegalArgumentException.class);
    }

    /// NO weights [3, 1], IO weights [0, 4] on two unit bins.
    private static PosteriorDensity separated() {
        WeightedHistogram h = new WeightedHistogram(List.of(BinAxis.uniform(2, 0, 2)), true);
        h.add(0.5, 3.0, 2.5e-3);
        h.add(1.5, 1.0, 2.5e-3);
        h.add(1.5, 4.0, -2.5e-3);
        return DensityNormalizer.normalize(h);
    }

    private static PosteriorDensity posterior(double... weights) {
        WeightedHistogram h = new WeightedHistogram(BinAxis.uniform(weights.length, 0, weights.length));
        for (int b = 0; b < weights.length; b++) {
            if (weights[b] > 0) {
                h.add(b + 0.5, weights[b], 1e-3);
            }
        }
        return DensityNormalizer.normalize(h);
    }
}
