package io.numcmc.command.posterior;

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
import io.numcmc.posterior.config.PosteriorGsonConfig;
import io.numcmc.posterior.constraint.ConstraintSpec;
import io.numcmc.posterior.histogram.PosteriorDensity;
import io.numcmc.posterior.histogram.WeightedHistogram;
import io.numcmc.posterior.plot.Plot;
import io.numcmc.posterior.plot.PlotRegions;
import io.numcmc.posterior.plot.PlotStack;
import io.numcmc.posterior.region.CredibleRegion;
import io.numcmc.posterior.region.MassBasis;
import io.numcmc.posterior.region.RegionScope;
import io.numcmc.posterior.reweight.PriorReweighter;
import io.numcmc.posterior.sample.MassOrdering;

import java.io.IOException;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/// Result of a posterior run: one entry per plot with its counters, density and
/// regions, written as JSON and summarized as a terminal table.
///
/// ## JSON layout
///
/// ```json
/// {
///   "samples": "chain.csv",
///   "steps": 1000,
///   "levels": [0.6827, 0.9545],
///   "mass_basis": "IN_RANGE",
///   "plots": [
///     { "name": "Theta23", "variables": ["Theta23"],
///       "reweight": "Theta23=Uniform:x -> Uniform:sin^2(x)",
///       "in_range_count": 1000, "out_of_range_count": 0, "rejected_count": 0,
///       "density": { ... }, "regions": { "COMBINED": [ ... ] } }
///   ]
/// }
/// ```
public final class PosteriorReport {

    @SerializedName("samples")
    private final String samples;

    @SerializedName("citation")
    private final String citation;

    @SerializedName("steps")
    private final long steps;

    @SerializedName("levels")
    private final double[] levels;

    @SerializedName("mass_basis")
    private final MassBasis massBasis;

    @SerializedName("plots")
    private final List<PlotReport> plots;

    /// Per-plot section of the report.
    static final class PlotReport {
        @SerializedName("name")
        String name;
        @SerializedName("variables")
        List<String> variables;
        @SerializedName("reweight")
        String reweight;
        @SerializedName("constraints")
        List<String> constraints;
        @SerializedName("in_range_count")
        long inRangeCount;
        @SerializedName("out_of_range_count")
        long outOfRangeCount;
        @SerializedName("rejected_count")
        long rejectedCount;
        @SerializedName("in_range_weight")
        double inRangeWeight;
        @SerializedName("out_of_range_weight")
        double outOfRangeWeight;
        @SerializedName("density")
        PosteriorDensity density;
        @SerializedName("regions")
        Map<RegionScope, List<CredibleRegion>> regions;
        @SerializedName("error")
        String error;

        // summary only
        transient WeightedHistogram histogram;
    }

    private PosteriorReport(String samples, String citation, long steps, double[] levels,
                            MassBasis massBasis, List<PlotReport> plots) {
        this.samples = samples;
        this.citation = citation;
        this.steps = steps;
        this.levels = levels;
        this.massBasis = massBasis;
        this.plots = plots;
    }

    /// Collects the report of a stack that has run.
    ///
    /// @param samples the chain identifier
    /// @param stack the stack, after [PlotStack#run()]
    /// @param regions regions per finished plot
    /// @param levels the levels the regions were built at
    /// @param basis the mass basis of the regions
    /// @return the report
    public static PosteriorReport of(String samples, PlotStack stack, Map<Plot, PlotRegions> regions,
                                     double[] levels, MassBasis basis) {
        List<PlotReport> plots = new ArrayList<>();
        for (Plot plot : stack.plots()) {
            PlotReport r = new PlotReport();
            WeightedHistogram h = plot.histogram();
            r.name = plot.name();
            r.variables = plot.definition().getVariables();
            PriorReweighter reweighter = plot.weigher().getReweighter();
            if (!reweighter.isIdentity()) {
                r.reweight = reweighter.getOldPrior().orElseThrow() + " -> "
                    + reweighter.getNewPrior().orElseThrow().toExpression();
            }
            r.constraints = new ArrayList<>();
            for (ConstraintSpec c : plot.weigher().getConstraints()) {
                r.constraints.add(c.getName());
            }
            r.inRangeCount = h.inRangeCount();
            r.outOfRangeCount = h.outOfRangeCount();
            r.rejectedCount = h.rejectedCount();
            r.inRangeWeight = h.inRangeWeight();
            r.outOfRangeWeight = h.outOfRangeWeight();
            r.density = plot.density().orElse(null);
            PlotRegions pr = regions.get(plot);
            r.regions = pr == null ? null : pr.byScope();
            r.error = plot.failure().map(Throwable::getMessage).orElse(null);
            r.histogram = h;
            plots.add(r);
        }
        return new PosteriorReport(samples, stack.metadata().citation().orElse(null), stack.stepsProcessed(),
            levels.clone(), basis, plots);
    }

    /// Returns whether any plot failed.
    public boolean hasFailures() {
        return plots.stream().anyMatch(p -> p.error != null);
    }

    /// Writes the report as pretty-printed JSON.
    public void writeJson(Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            PosteriorGsonConfig.gson().toJson(this, writer);
        }
    }

    /// Returns the report as pretty-printed JSON.
    public String toJson() {
        return PosteriorGsonConfig.gson().toJson(this);
    }

    /// Prints a summary table: per plot and scope, the sample counters and the size
    /// and threshold of every region.
    public void printSummary(PrintStream out) {
        out.printf("Chain: %s (%,d steps)%n", samples, steps);
        if (citation != null) {
            out.printf("Citation: %s%n", citation);
        }
        for (PlotReport plot : plots) {
            out.println();
            out.printf("Plot: %s%n", plot.name);
            if (plot.reweight != null) {
                out.printf("  reweighted: %s%n", plot.reweight);
            }
            if (!plot.constraints.isEmpty()) {
                out.printf("  constraints: %s%n", String.join(", ", plot.constraints));
            }
            if (plot.error != null) {
                out.printf("  FAILED: %s%n", plot.error);
                continue;
            }
            out.println("  ┌──────────┬────────────┬──────────────┬──────────┬─────────┬────────┬────────┬──────────────┐");
            out.println("  │ Scope    │  In range  │ Out of range │ Rejected │ P(ord.) │ Level  │  Bins  │  Threshold   │");
            out.println("  ├──────────┼────────────┼──────────────┼──────────┼─────────┼────────┼────────┼──────────────┤");
            for (Map.Entry<RegionScope, List<CredibleRegion>> e : plot.regions.entrySet()) {
                RegionScope scope = e.getKey();
                String inRange = "";
                String outOfRange = "";
                String rejected = "";
                String probability = "";
                switch (scope) {
                    case COMBINED -> {
                        inRange = String.format("%,d", plot.inRangeCount);
                        outOfRange = String.format("%,d", plot.outOfRangeCount);
                        rejected = String.format("%,d", plot.rejectedCount);
                    }
                    case NORMAL, INVERTED -> {
                        MassOrdering ordering = scope == RegionScope.NORMAL ? MassOrdering.NORMAL : MassOrdering.INVERTED;
                        inRange = String.format("%,d", plot.histogram.inRangeCount(ordering));
                        outOfRange = String.format("%,d", plot.histogram.outOfRangeCount(ordering));
                        probability = String.format("%.4f", plot.density.orderingProbability(ordering));
                    }
                    default -> {
                    }
                }
                boolean first = true;
                for (CredibleRegion region : e.getValue()) {
                    out.printf("  │ %-8s │ %10s │ %12s │ %8s │ %7s │ %6.4f │ %6d │ %12.5g │%s%n",
                        first ? scope : "", first ? inRange : "", first ? outOfRange : "",
                        first ? rejected : "", first ? probability : "",
                        region.level(), region.size(), region.threshold(),
                        region.isSaturated() ? " saturated" : "");
                    first = false;
                }
            }
            out.println("  └──────────┴────────────┴──────────────┴──────────┴─────────┴────────┴────────┴──────────────┘");
        }
    }
}
