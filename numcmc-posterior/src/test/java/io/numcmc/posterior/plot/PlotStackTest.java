package io.numcmc.posterior.plot;

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

import io.numcmc.posterior.constraint.ConstraintSpec;
import io.numcmc.posterior.constraint.GaussianConstraint;
import io.numcmc.posterior.constraint.OrderingScope;
import io.numcmc.posterior.histogram.BinAxis;
import io.numcmc.posterior.histogram.Density;
import io.numcmc.posterior.histogram.PosteriorDensity;
import io.numcmc.posterior.prior.DimensionalityException;
import io.numcmc.posterior.prior.PriorSpec;
import io.numcmc.posterior.prior.PriorSpecParser;
import io.numcmc.posterior.region.CredibleRegionBuilder;
import io.numcmc.posterior.region.RegionScope;
import io.numcmc.posterior.reweight.DegeneratePriorException;
import io.numcmc.posterior.sample.ArraySampleSource;
import io.numcmc.posterior.sample.BatchCursor;
import io.numcmc.posterior.sample.MassOrdering;
import io.numcmc.posterior.sample.Sample;
import io.numcmc.posterior.sample.SampleBatch;
import io.numcmc.posterior.sample.SampleSource;
import io.numcmc.posterior.sample.StandardVariables;
import io.numcmc.posterior.sample.VariableRegistry;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

@Tag("unit")
public class PlotStackTest {

    private static final double HALF_PI = Math.PI / 2;

    @Test
    void flatTheta23ReweightedToFlatSinSquaredFollowsSin2Theta() {
        PlotStack stack = new PlotStack(theta23Grid(1000), ChainMetadata.uniformPriors(), new VariableRegistry());
        Plot plot = stack.addPlot(PlotDefinition.builder("Theta23")
            .bins(50, 0, HALF_PI)
            .prior(PriorSpecParser.parse("Theta23", "Uniform:sin^2(x)"))
            .build());

        assertEquals(1000, stack.run());

        Density density = plot.density().orElseThrow().combined();
        BinAxis axis = density.axes().get(0);
        assertEquals(1.0, density.integral(), 1e-12);
        for (int b = 0; b < axis.binCount(); b++) {
            assertEquals(Math.sin(2 * axis.center(b)), density.value(b), 5e-3, "bin " + b);
        }
        assertThat(plot.histogram().counts()).containsOnly(20L);
    }

    @Test
    void separatedOrderingsKeepTheirSampleCounts() {
        List<Sample> samples = new ArrayList<>();
        for (int i = 0; i < 500; i++) {
            double th23 = 0.6 + 0.4 * i / 500.0;
            samples.add(new Sample(0, 0.15, th23, 0.59, 2.5e-3, 7.4e-5));
            samples.add(new Sample(0, 0.15, th23, 0.59, -2.4e-3, 7.4e-5));
        }
        PlotStack stack = new PlotStack(ArraySampleSource.of(samples), ChainMetadata.uniformPriors(), new VariableRegistry())
            .withBatchSize(64);
        Plot plot = stack.addPlot(PlotDefinition.builder("Theta23")
            .bins(20, 0.5, 1.1)
            .separateOrderings(true)
            .build());
        stack.run();

        assertEquals(500, sum(plot.histogram().counts(MassOrdering.NORMAL)));
        assertEquals(500, sum(plot.histogram().counts(MassOrdering.INVERTED)));
        PosteriorDensity posterior = plot.density().orElseThrow();
        assertEquals(0.5, posterior.orderingProbability(MassOrdering.NORMAL), 1e-12);

        PlotRegions regions = plot.regions(0.6827, 0.9545);
        assertThat(regions.byScope().keySet())
            .containsExactly(RegionScope.COMBINED, RegionScope.NORMAL, RegionScope.INVERTED);
        assertThat(regions.get(RegionScope.NORMAL)).hasSize(2);
    }

    @Test
    void resultDoesNotDependOnBatchSize() {
        long[] reference = null;
        for (int batchSize : new int[]{1, 7, 100, 100_000}) {
            PlotStack stack = new PlotStack(theta23Grid(300), ChainMetadata.uniformPriors(),
                new VariableRegistry().registerStandardVariables()).withBatchSize(batchSize);
            Plot plot = stack.addPlot(PlotDefinition.builder(StandardVariables.SIN_SQ_THETA23).bins(10, 0, 1).build());
            stack.run();
            long[] counts = plot.histogram().counts();
            if (reference == null) {
                reference = counts;
            } else {
                assertArrayEquals(reference, counts, "batch size " + batchSize);
            }
        }
    }

    @Test
    void twoDimensionalDerivedPlotWithJointRegion() {
        List<Sample> samples = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            double th23 = 0.7 + 0.002 * i;
            samples.add(new Sample(0, 0.15, th23, 0.59, 2.45e-3 + 1e-6 * (i % 10), 7.4e-5));
            if (i % 4 == 0) {
                samples.add(new Sample(0, 0.15, th23, 0.59, -2.45e-3 - 1e-6 * (i % 10), 7.4e-5));
            }
        }
        PlotStack stack = new PlotStack(ArraySampleSource.of(samples), ChainMetadata.uniformPriors(),
            new VariableRegistry().registerStandardVariables());
        Plot plot = stack.addPlot(PlotDefinition.builder(StandardVariables.SIN_SQ_THETA23, StandardVariables.ABS_DM2_32)
            .bins(10, 0.3, 0.8)
            .bins(10, 2.4e-3, 2.5e-3)
            .jointRegion(true)
            .build());
        assertThat(plot.requiredVariables()).contains(StandardVariables.SIN_SQ_THETA23, StandardVariables.ABS_DM2_32);

        stack.run();

        assertThat(plot.definition().separatesOrderings()).isTrue();
        assertEquals(250, plot.histogram().inRangeCount());
        Map<Plot, PlotRegions> regions = stack.regions(new CredibleRegionBuilder(), 0.9);
        assertThat(regions.get(plot).get(RegionScope.JOINT)).hasSize(1);
        assertEquals(0.8, plot.density().orElseThrow().orderingProbability(MassOrdering.NORMAL), 1e-12);
    }

    @Test
    void maxStepsTruncatesTheChain() {
        PlotStack stack = new PlotStack(theta23Grid(1000), ChainMetadata.uniformPriors(), new VariableRegistry())
            .withBatchSize(100)
            .withMaxSteps(250);
        Plot plot = stack.addPlot(PlotDefinition.builder("Theta23").bins(10, 0, HALF_PI).build());

        assertEquals(250, stack.run());
        assertEquals(250, plot.histogram().inRangeCount());
    }

    @Test
    void passIsClosedWhenTheStepLimitStopsIt() {
        ClosingSource source = new ClosingSource(theta23Grid(1000));
        PlotStack stack = new PlotStack(source, ChainMetadata.uniformPriors(), new VariableRegistry())
            .withBatchSize(100)
            .withMaxSteps(250);
        stack.addPlot(PlotDefinition.builder("Theta23").bins(10, 0, HALF_PI).build());

        assertEquals(250, stack.run());
        assertEquals(1, source.opened);
        assertEquals(1, source.closed);
        assertThat(source.batchesRead).isEqualTo(3);
    }

    @Test
    void passIsClosedAfterAFullRun() {
        ClosingSource source = new ClosingSource(theta23Grid(95));
        PlotStack stack = new PlotStack(source, ChainMetadata.uniformPriors(), new VariableRegistry())
            .withBatchSize(10);
        stack.addPlot(PlotDefinition.builder("Theta23").bins(10, 0, HALF_PI).build());

        assertEquals(95, stack.run());
        assertEquals(1, source.closed);
        assertEquals(10, source.batchesRead);
    }

    @Test
    void namedAndAutoAppliedConstraintsWeightSamples() {
        ConstraintSpec reactor = new ConstraintSpec("reactor", new GaussianConstraint(0.15, 0.01),
            List.of("Theta13"), OrderingScope.BOTH, true);
        ConstraintSpec solar = new ConstraintSpec("solar", new GaussianConstraint(0.59, 0.02),
            List.of("Theta12"), OrderingScope.BOTH, false);
        ConstraintSpec custom = new ConstraintSpec("custom", new GaussianConstraint(0, 1),
            List.of("NotInChain"), OrderingScope.BOTH, true);
        ChainMetadata metadata = new ChainMetadata(Map.of(), List.of(reactor, solar, custom), null);

        List<Sample> samples = List.of(
            new Sample(0, 0.15, 0.8, 0.59, 2.5e-3, 7.4e-5),
            new Sample(0, 0.16, 0.8, 0.59, 2.5e-3, 7.4e-5));
        PlotStack stack = new PlotStack(ArraySampleSource.of(samples), metadata, new VariableRegistry());
        Plot plot = stack.addPlot(PlotDefinition.builder("Theta13").bins(2, 0.14, 0.17).constraint("solar").build());

        assertThat(plot.weigher().getConstraints()).extracting(ConstraintSpec::getName)
            .containsExactly("reactor", "solar");

        stack.run();
        double[] w = plot.histogram().weights();
        assertEquals(1.0, w[0], 1e-12);
        assertEquals(Math.exp(-0.5), w[1], 1e-9);
    }

    @Test
    void invalidDefinitionsAreRejectedWhenAdded() {
        PlotStack stack = new PlotStack(theta23Grid(10), ChainMetadata.uniformPriors(), new VariableRegistry());

        assertThatThrownBy(() -> stack.addPlot(PlotDefinition.builder("SinSqTheta23").bins(10, 0, 1).build()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("unknown variable");
        assertThatThrownBy(() -> stack.addPlot(PlotDefinition.builder("Theta23").bins(10, 0, 1).constraint("nope").build()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("nope");
        assertThatThrownBy(() -> stack.addPlot(PlotDefinition.builder("Theta23", "DeltaCP")
            .bins(10, 0, 1).bins(10, -4, 4)
            .prior(PriorSpecParser.parse("Theta23", "Uniform:sin^2(x)"))
            .build()))
            .isInstanceOf(DimensionalityException.class);
        assertThatThrownBy(() -> PlotDefinition.builder("Theta23").build())
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void degeneratePriorStopsOnlyItsPlot() {
        PriorSpec restricted = PriorSpecParser.parse("Theta23", "Uniform(0.3, 0.7):sin^2(x)");
        ChainMetadata metadata = new ChainMetadata(Map.of("Theta23", restricted), List.of(), "test chain");
        PlotStack stack = new PlotStack(theta23Grid(100), metadata, new VariableRegistry());

        Plot reweighted = stack.addPlot(PlotDefinition.builder("DeltaCP")
            .bins(4, -4, 4)
            .prior(PriorSpecParser.parse("Theta23", "Uniform:x"))
            .build());
        Plot plain = stack.addPlot(PlotDefinition.builder("Theta23").bins(10, 0, HALF_PI).build());

        stack.run();

        assertThat(reweighted.failure()).containsInstanceOf(DegeneratePriorException.class);
        assertThat(reweighted.density()).isEmpty();
        assertThat(plain.density()).isPresent();
        assertThat(stack.regions(new CredibleRegionBuilder(), 0.5)).containsOnlyKeys(plain);
        assertThat(metadata.citation()).contains("test chain");
    }

    @Test
    void finishedPlotRejectsMoreSamples() {
        PlotStack stack = new PlotStack(theta23Grid(10), ChainMetadata.uniformPriors(), new VariableRegistry());
        Plot plot = stack.addPlot(PlotDefinition.builder("Theta23").bins(10, 0, HALF_PI).build());
        stack.run();

        assertThat(plot.isFinished()).isTrue();
        assertThat(plot.finish()).isSameAs(plot.density().orElseThrow());
        assertThatThrownBy(() -> plot.fill(theta23Grid(10).batches(10).iterator().next()))
            .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(stack::run).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void emptyPlotFailsWithoutStoppingTheStack() {
        PlotStack stack = new PlotStack(theta23Grid(10), ChainMetadata.uniformPriors(), new VariableRegistry());
        Plot outside = stack.addPlot(PlotDefinition.builder("Theta23").bins(5, 10, 20).build());
        Plot inside = stack.addPlot(PlotDefinition.builder("Theta23").name("inside").bins(5, 0, HALF_PI).build());

        stack.run();

        assertThat(outside.failure()).isPresent();
        assertThat(inside.density()).isPresent();
        assertEquals("Theta23", outside.name());
    }

    /// Theta23 on a midpoint grid over [0, pi/2]; every other parameter fixed, normal ordering.
    private static ArraySampleSource theta23Grid(int n) {
        List<Sample> samples = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            samples.add(new Sample(0.0, 0.15, (i + 0.5) * HALF_PI / n, 0.59, 2.5e-3, 7.4e-5));
        }
        return ArraySampleSource.of(samples);
    }

    /// Counts the passes opened over a source and how many of them were closed.
    private static final class ClosingSource implements SampleSource {
        private final SampleSource delegate;
        int opened;
        int closed;
        int batchesRead;

        ClosingSource(SampleSource delegate) {
            this.delegate = delegate;
        }

        @Override
        public List<String> columnNames() {
            return delegate.columnNames();
        }

        @Override
        public BatchCursor open(int batchSize) {
            BatchCursor cursor = delegate.open(batchSize);
            opened++;
            return new BatchCursor() {
                @Override
                public boolean hasNext() {
                    return cursor.hasNext();
                }

                @Override
                public SampleBatch next() {
                    batchesRead++;
                    return cursor.next();
                }

                @Override
                public void close() {
                    closed++;
                    cursor.close();
                }
            };
        }
    }

    private static long sum(long[] values) {
        long total = 0;
        for (long v : values) {
            total += v;
        }
        return total;
    }
}
