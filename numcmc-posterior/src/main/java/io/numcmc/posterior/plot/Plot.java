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

import io.numcmc.posterior.histogram.DensityNormalizer;
import io.numcmc.posterior.histogram.PosteriorDensity;
import io.numcmc.posterior.histogram.WeightedHistogram;
import io.numcmc.posterior.region.CredibleRegion;
import io.numcmc.posterior.region.CredibleRegionBuilder;
import io.numcmc.posterior.region.RegionScope;
import io.numcmc.posterior.reweight.SampleWeigher;
import io.numcmc.posterior.sample.MassOrdering;
import io.numcmc.posterior.sample.SampleBatch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// One posterior plot: a histogram filled with weighted samples, then normalized.
///
/// ## Lifecycle
///
/// ```
///   create ──► fill(batch)* ──► finish() ──► regions(levels)*
///                                   │
///                                   └──► fill() now throws IllegalStateException
/// ```
///
/// A plot owns its histogram and weigher. A structural failure while filling, such as
/// a chain prior vanishing at a sample, stops the plot: the cause is kept in
/// [#failure()] and later fills are ignored.
///
/// This class is NOT thread-safe.
public final class Plot {

    private final PlotDefinition definition;
    private final SampleWeigher weigher;
    private final WeightedHistogram histogram;
    private final Set<String> requiredVariables;
    private PosteriorDensity density;
    private RuntimeException failure;
    private boolean finished;

    /// Creates a plot; normally called by [PlotStack#addPlot(PlotDefinition)], which
    /// checks the definition against the chain first.
    ///
    /// @param definition what to plot
    /// @param weigher the per-sample weight of this plot
    public Plot(PlotDefinition definition, SampleWeigher weigher) {
        this.definition = definition;
        this.weigher = weigher;
        this.histogram = new WeightedHistogram(definition.getAxes(), definition.separatesOrderings());
        Set<String> required = new LinkedHashSet<>(definition.getVariables());
        required.addAll(weigher.requiredVariables());
        this.requiredVariables = Collections.unmodifiableSet(required);
    }

    public PlotDefinition definition() {
        return definition;
    }

    public String name() {
        return definition.getName();
    }

    public SampleWeigher weigher() {
        return weigher;
    }

    /// Returns the variables a batch must carry to fill this plot.
    public Set<String> requiredVariables() {
        return requiredVariables;
    }

    /// Returns the histogram; read-only use is expected.
    public WeightedHistogram histogram() {
        return histogram;
    }

    /// Bins one batch.
    ///
    /// @param batch a batch carrying [#requiredVariables()]
    /// @throws IllegalStateException if the plot is finished
    /// @throws io.numcmc.posterior.reweight.DegeneratePriorException if the chain prior
    ///     vanishes at a sample; the plot is marked failed
    public void fill(SampleBatch batch) {
        if (finished) {
            throw new IllegalStateException("Plot '" + name() + "' is finished; it cannot be filled again");
        }
        if (failure != null) {
            return;
        }
        try {
            double[] weights = weigher.weights(batch);
            histogram.fill(batch, definition.getVariables(), weights);
        } catch (ArithmeticException | IllegalArgumentException e) {
            failure = e;
            throw e;
        }
    }

    /// Normalizes the histogram. Calling again returns the same density.
    ///
    /// @return the posterior density
    /// @throws io.numcmc.posterior.histogram.EmptyHistogramException if nothing fell in range
    /// @throws IllegalStateException if filling failed
    public PosteriorDensity finish() {
        finished = true;
        if (density != null) {
            return density;
        }
        if (failure != null) {
            throw new IllegalStateException("Plot '" + name() + "' failed while filling", failure);
        }
        try {
            density = DensityNormalizer.normalize(histogram);
        } catch (RuntimeException e) {
            failure = e;
            throw e;
        }
        return density;
    }

    public boolean isFinished() {
        return finished;
    }

    /// Returns the normalized density once [#finish()] succeeded.
    public Optional<PosteriorDensity> density() {
        return Optional.ofNullable(density);
    }

    /// Returns the error that stopped this plot, if any.
    public Optional<RuntimeException> failure() {
        return Optional.ofNullable(failure);
    }

    /// Builds the regions of every applicable scope at the given levels.
    ///
    /// @param builder the region builder, carrying the mass basis
    /// @param levels credible levels in (0, 1)
    /// @return the regions
    /// @throws IllegalStateException if the plot is not finished or failed
    public PlotRegions regions(CredibleRegionBuilder builder, double... levels) {
        if (density == null) {
            throw new IllegalStateException("Plot '" + name() + "' has no density; finish() it first"
                + (failure != null ? " (failed: " + failure.getMessage() + ")" : ""));
        }
        Map<RegionScope, List<CredibleRegion>> byScope = new EnumMap<>(RegionScope.class);
        byScope.put(RegionScope.COMBINED, builder.build(density, RegionScope.COMBINED, levels));
        if (density.isSeparated()) {
            for (MassOrdering ordering : density.orderings()) {
                RegionScope scope = RegionScope.of(ordering);
                byScope.put(scope, builder.build(density, scope, levels));
            }
            if (definition.wantsJointRegion()) {
                byScope.put(RegionScope.JOINT, builder.build(density, RegionScope.JOINT, levels));
            }
        }
        List<Double> levelList = new ArrayList<>(levels.length);
        for (double level : levels) {
            levelList.add(level);
        }
        return new PlotRegions(name(), levelList, byScope);
    }

    /// Builds regions relative to in-range mass.
    public PlotRegions regions(double... levels) {
        return regions(new CredibleRegionBuilder(), levels);
    }

    @Override
    public String toString() {
        return "Plot[" + definition + ", " + histogram + "]";
    }
}
