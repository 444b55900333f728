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
import io.numcmc.posterior.region.CredibleRegionBuilder;
import io.numcmc.posterior.reweight.PriorReweighter;
import io.numcmc.posterior.reweight.SampleWeigher;
import io.numcmc.posterior.sample.BatchCursor;
import io.numcmc.posterior.sample.SampleBatch;
import io.numcmc.posterior.sample.SampleSource;
import io.numcmc.posterior.sample.VariableRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Runs a set of plots over one chain in a single streamed pass.
///
/// ## Flow
///
/// ```
///   addPlot(def)*          validate variables, constraints and prior overrides
///        │
///        ▼
///   run()                  for each batch (≤ batchSize rows, ≤ maxSteps in total):
///        │                    evaluate the derived variables any plot needs, once
///        │                    fill every live plot
///        ▼                  finish every plot
///   regions(levels)        HPD regions per plot
/// ```
///
/// The pass over the source is closed when filling stops, including at the step limit.
///
/// A plot that fails while filling or finishing is stopped and reported through
/// [Plot#failure()]; the other plots carry on. Validation errors in [#addPlot] are
/// thrown immediately.
///
/// The registry is frozen when the stack is created. This class is NOT thread-safe.
public final class PlotStack {

    private static final Logger logger = LogManager.getLogger(PlotStack.class);

    /// Rows per batch unless configured otherwise.
    public static final int DEFAULT_BATCH_SIZE = 100_000;

    private final SampleSource source;
    private final ChainMetadata metadata;
    private final VariableRegistry registry;
    private final Set<String> sourceColumns;
    private final List<Plot> plots = new ArrayList<>();
    private int batchSize = DEFAULT_BATCH_SIZE;
    private long maxSteps = -1;
    private long stepsProcessed;
    private boolean ran;

    public PlotStack(SampleSource source, ChainMetadata metadata, VariableRegistry registry) {
        this.source = source;
        this.metadata = metadata;
        this.registry = registry.freeze();
        this.sourceColumns = new HashSet<>(source.columnNames());
    }

    /// Sets the number of rows streamed per batch.
    public PlotStack withBatchSize(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive, got " + batchSize);
        }
        this.batchSize = batchSize;
        return this;
    }

    /// Limits the number of chain steps read; a negative value reads the whole chain.
    public PlotStack withMaxSteps(long maxSteps) {
        this.maxSteps = maxSteps;
        return this;
    }

    public ChainMetadata metadata() {
        return metadata;
    }

    /// Validates a definition against the chain and adds its plot.
    ///
    /// @param definition the plot definition
    /// @return the new plot
    /// @throws IllegalArgumentException if a plotted variable or named constraint is unknown
    /// @throws io.numcmc.posterior.prior.DimensionalityException if the prior overrides
    ///     cannot be applied one-dimensionally
    /// @throws IllegalStateException if the stack already ran
    public Plot addPlot(PlotDefinition definition) {
        if (ran) {
            throw new IllegalStateException("Plots cannot be added after the stack has run");
        }
        for (String variable : definition.getVariables()) {
            requireVariable(variable, "Plot '" + definition.getName() + "'");
        }
        PriorReweighter reweighter = PriorReweighter.forPlot(
            definition.getVariables(), definition.getPriorOverrides(), metadata.priors());

        Map<String, ConstraintSpec> applied = new LinkedHashMap<>();
        for (ConstraintSpec c : metadata.autoApplyConstraints()) {
            if (c.getVariables().stream().allMatch(this::isAvailable)) {
                applied.put(c.getName(), c);
            } else {
                logger.warn("Ignoring auto-applied constraint '{}' for plot '{}': variables {} not available",
                    c.getName(), definition.getName(), c.getVariables());
            }
        }
        for (String name : definition.getConstraintNames()) {
            ConstraintSpec c = metadata.constraint(name).orElseThrow(() -> new IllegalArgumentException(
                "Plot '" + definition.getName() + "' names unknown constraint '" + name + "'"));
            for (String variable : c.getVariables()) {
                requireVariable(variable, "Constraint '" + name + "'");
            }
            applied.put(name, c);
        }

        Plot plot = new Plot(definition, new SampleWeigher(reweighter, new ArrayList<>(applied.values())));
        plots.add(plot);
        logger.debug("Added plot '{}': axes={}, reweight={}, constraints={}, separateOrderings={}",
            definition.getName(), definition.getAxes(), reweighter, applied.keySet(),
            definition.separatesOrderings());
        return plot;
    }

    public List<Plot> plots() {
        return Collections.unmodifiableList(plots);
    }

    /// Streams the chain through every plot and finishes them.
    ///
    /// @return the number of chain steps processed
    /// @throws IllegalStateException if called twice
    public long run() {
        if (ran) {
            throw new IllegalStateException("Plot stack has already run");
        }
        ran = true;
        Set<String> needed = new LinkedHashSet<>();
        for (Plot plot : plots) {
            needed.addAll(plot.requiredVariables());
        }
        long total = source.size();
        logger.info("Filling {} plots from {} ({} rows, batch size {}{})", plots.size(), source.getId(),
            total < 0 ? "unknown" : total, batchSize, maxSteps >= 0 ? ", max steps " + maxSteps : "");

        try (BatchCursor cursor = source.open(batchSize)) {
            while (cursor.hasNext()) {
                SampleBatch batch = cursor.next();
                if (maxSteps >= 0 && stepsProcessed + batch.size() > maxSteps) {
                    batch = batch.slice(0, (int) (maxSteps - stepsProcessed));
                }
                if (batch.size() == 0) {
                    break;
                }
                SampleBatch evaluated = registry.evaluate(batch, needed);
                for (Plot plot : plots) {
                    fill(plot, evaluated);
                }
                stepsProcessed += batch.size();
                logger.info("Processed {} steps", stepsProcessed);
                if (maxSteps >= 0 && stepsProcessed >= maxSteps) {
                    break;
                }
            }
        }

        for (Plot plot : plots) {
            if (plot.failure().isPresent()) {
                continue;
            }
            try {
                plot.finish();
                logger.info("Finished plot '{}': {}", plot.name(), plot.histogram());
            } catch (RuntimeException e) {
                logger.error("Plot '{}' could not be normalized: {}", plot.name(), e.getMessage());
            }
        }
        return stepsProcessed;
    }

    /// Builds the regions of every finished plot at common levels. Failed plots are
    /// skipped.
    ///
    /// @param builder the region builder
    /// @param levels credible levels in (0, 1)
    /// @return regions keyed by plot, in plot order
    public Map<Plot, PlotRegions> regions(CredibleRegionBuilder builder, double... levels) {
        Map<Plot, PlotRegions> regions = new LinkedHashMap<>();
        for (Plot plot : plots) {
            if (plot.density().isPresent()) {
                regions.put(plot, plot.regions(builder, levels));
            }
        }
        return regions;
    }

    public long stepsProcessed() {
        return stepsProcessed;
    }

    private void fill(Plot plot, SampleBatch batch) {
        if (plot.failure().isPresent()) {
            return;
        }
        try {
            plot.fill(batch);
        } catch (ArithmeticException | IllegalArgumentException e) {
            logger.error("Plot '{}' stopped after {} steps: {}", plot.name(), stepsProcessed, e.getMessage());
        }
    }

    private boolean isAvailable(String variable) {
        return sourceColumns.contains(variable) || registry.contains(variable);
    }

    private void requireVariable(String variable, String owner) {
        if (!isAvailable(variable)) {
            throw new IllegalArgumentException(owner + " uses unknown variable '" + variable
                + "'. Chain columns: " + sourceColumns + ", registered: " + registry.names());
        }
    }
}
