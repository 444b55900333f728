package io.numcmc.posterior.constraint;

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

import io.numcmc.posterior.sample.MassOrdering;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

@Tag("unit")
public class TabulatedConstraintTest {

    private static final double TOLERANCE = 1e-12;

    @Test
    void interpolatesLinearlyBetweenBinCenters() {
        TabulatedConstraint c = TabulatedConstraint.histogram(0.0, 4.0, new double[]{0, 2, 4, 2});

        assertArrayEquals(new double[]{0.5, 1.5, 2.5, 3.5}, c.gridPoints(0), TOLERANCE);
        assertEquals(2.0, c.density(1.5), TOLERANCE);
        assertEquals(1.0, c.density(1.0), TOLERANCE);
        assertEquals(3.0, c.density(3.0), TOLERANCE);
        assertEquals(2.0, c.density(3.5), TOLERANCE);
    }

    @Test
    void vanishesOutsideTheGrid() {
        TabulatedConstraint c = TabulatedConstraint.histogram(0.0, 4.0, new double[]{1, 1, 1, 1});

        assertEquals(0.0, c.density(0.2));
        assertEquals(0.0, c.density(3.9));
        assertEquals(0.0, c.density(Double.NaN));
    }

    @Test
    void flowBinsExtendTheGridByHalfABin() {
        TabulatedConstraint c = TabulatedConstraint.withFlowBins(
            new double[]{0.0}, new double[]{1.0}, new int[]{2}, new double[]{0, 1, 3, 0});

        assertArrayEquals(new double[]{-0.25, 0.25, 0.75, 1.25}, c.gridPoints(0), TOLERANCE);
        assertEquals(0.5, c.density(0.0), TOLERANCE);
        assertEquals(2.0, c.density(0.5), TOLERANCE);
    }

    @Test
    void bilinearInterpolationIn2d() {
        TabulatedConstraint c = TabulatedConstraint.onGrid(
            new double[][]{{0, 1}, {0, 1}},
            new double[]{0, 1, 2, 3});

        assertEquals(2, c.dimensions());
        assertEquals(0.0, c.density(0, 0), TOLERANCE);
        assertEquals(1.0, c.density(0, 1), TOLERANCE);
        assertEquals(2.0, c.density(1, 0), TOLERANCE);
        assertEquals(1.5, c.density(0.5, 0.5), TOLERANCE);
        assertEquals(0.0, c.density(0.5, 1.5));
    }

    @Test
    void histogram2dIsRowMajor() {
        TabulatedConstraint c = TabulatedConstraint.histogram(0, 2, 0, 2,
            new double[][]{{1, 2}, {3, 4}});

        assertEquals(2.0, c.density(0.5, 1.5), TOLERANCE);
        assertEquals(3.0, c.density(1.5, 0.5), TOLERANCE);
    }

    @Test
    void invalidTablesAreRejected() {
        assertThatThrownBy(() -> TabulatedConstraint.onGrid(new double[][]{{0, 0}}, new double[]{1, 1}))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TabulatedConstraint.onGrid(new double[][]{{0, 1}}, new double[]{1, -1}))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TabulatedConstraint.onGrid(new double[][]{{0, 1}}, new double[]{1}))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TabulatedConstraint.histogram(0, 1, new double[]{1}))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void arityIsChecked() {
        TabulatedConstraint c = TabulatedConstraint.histogram(0.0, 4.0, new double[]{1, 1, 1, 1});
        assertThatThrownBy(() -> c.density(1, 2)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void gaussianPeaksAtOne() {
        GaussianConstraint g = new GaussianConstraint(0.085, 0.003);
        assertEquals(1.0, g.density(0.085), TOLERANCE);
        assertEquals(Math.exp(-2), g.density(0.091), 1e-9);

        GaussianConstraint correlated = new GaussianConstraint(new double[]{0, 0}, new double[]{1, 1}, 0.5);
        assertEquals(Math.exp(-0.5 * (1 - 1 + 1) / 0.75), correlated.density(1, 1), TOLERANCE);
        assertThatThrownBy(() -> new GaussianConstraint(new double[]{0, 0}, new double[]{1, 1}, 1.0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void specAppliesOnlyWithinItsScope() {
        ConstraintSpec spec = new ConstraintSpec("io-only", new GaussianConstraint(0, 1),
            List.of("Theta13"), OrderingScope.INVERTED_ONLY, false);

        assertEquals(1.0, spec.factor(MassOrdering.NORMAL, 3.0));
        assertEquals(Math.exp(-4.5), spec.factor(MassOrdering.INVERTED, 3.0), TOLERANCE);
        assertThatThrownBy(() -> new ConstraintSpec("bad", new GaussianConstraint(0, 1),
            List.of("Theta13", "Theta12"), null, false))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(new ConstraintSpec("default", new GaussianConstraint(0, 1), List.of("Theta13"), null, true)
            .getScope()).isEqualTo(OrderingScope.BOTH);
    }
}
