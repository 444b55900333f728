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

import io.numcmc.posterior.sample.MassOrdering;
import io.numcmc.posterior.sample.PhysicalParameter;
import io.numcmc.posterior.sample.SampleBatch;

import java.util.List;

/// Weighted 1-D or 2-D histogram filled incrementally from streamed batches.
///
/// ## Purpose
///
/// Accumulates per-bin weight sums (and entry counts) of the plotted coordinate(s).
/// Filling is purely additive, so the result does not depend on how the chain was cut
/// into batches, and shards filled separately can be combined with [#merge].
///
/// ## Mass-ordering separation
///
/// When created with ordering separation, two parallel arrays are kept and every
/// accepted sample is routed to exactly one of them by the sign of Δm²₃₂:
///
/// ```
///   sample ──► coordinates in range? ──no──► out-of-range (count, weight)
///                     │ yes
///                     ▼
///            Δm²₃₂ ≥ 0 ? ──► NO array
///                     └────► IO array
/// ```
///
/// ## Accounting
///
/// | Counter | Meaning |
/// |---------|---------|
/// | in-range weight | sum of binned weights |
/// | out-of-range weight | weight of samples with a coordinate outside the edges |
/// | rejected | samples with a non-finite coordinate, a non-finite or negative weight, or, when separating, a NaN Δm²₃₂ |
///
/// In-range plus out-of-range weight equals the weight of every accepted sample.
/// Rejected samples are counted but contribute no weight.
///
/// ## Thread Safety
///
/// This class is NOT thread-safe. Fill shards in separate instances and merge them.
public final class WeightedHistogram {

    private final BinAxis[] axes;
    private final boolean separateOrderings;
    private final int binCount;

    // [partition][flat bin]; partition is the ordering ordinal when separating, else 0
    private final double[][] weights;
    private final long[][] counts;
    private final double[] outOfRangeWeight;
    private final long[] outOfRangeCount;
    private long rejectedCount;

    /// Creates an empty 1-D histogram without ordering separation.
    public WeightedHistogram(BinAxis axis) {
        this(List.of(axis), false);
    }

    /// Creates an empty histogram.
    ///
    /// @param axes one axis for a 1-D histogram, two for a 2-D one
    /// @param separateOrderings whether to keep one array per mass ordering
    public WeightedHistogram(List<BinAxis> axes, boolean separateOrderings) {
        if (axes.isEmpty() || axes.size() > 2) {
            throw new IllegalArgumentException("Histograms are 1-D or 2-D, got " + axes.size() + " axes");
        }
        this.axes = axes.toArray(new BinAxis[0]);
        this.separateOrderings = separateOrderings;
        int bins = 1;
        for (BinAxis axis : this.axes) {
            bins *= axis.binCount();
        }
        this.binCount = bins;
        int partitions = separateOrderings ? MassOrdering.values().length : 1;
        this.weights = new double[partitions][bins];
        this.counts = new long[partitions][bins];
        this.outOfRangeWeight = new double[partitions];
        this.outOfRangeCount = new long[partitions];
    }

    /// Returns 1 or 2.
    public int dimensions() {
        return axes.length;
    }

    public BinAxis axis(int dimension) {
        return axes[dimension];
    }

    public List<BinAxis> axes() {
        return List.of(axes);
    }

    public boolean separatesOrderings() {
        return separateOrderings;
    }

    /// Returns the number of bins per partition, the product of the axis bin counts.
    public int binCount() {
        return binCount;
    }

    /// Returns the flat index of a 2-D bin; the second axis varies fastest.
    public int flatIndex(int xBin, int yBin) {
        return xBin * axes[1].binCount() + yBin;
    }

    /// Adds one 1-D sample.
    ///
    /// @param x the coordinate
    /// @param weight the sample weight
    /// @param deltaM2_32 the sample's Δm²₃₂, used only when separating orderings
    public void add(double x, double weight, double deltaM2_32) {
        requireDimensions(1);
        if (!accept(weight, deltaM2_32) || !Double.isFinite(x)) {
            rejectedCount++;
            return;
        }
        int p = partition(deltaM2_32);
        int bin = axes[0].binOf(x);
        if (bin < 0) {
            outOfRange(p, weight);
            return;
        }
        weights[p][bin] += weight;
        counts[p][bin]++;
    }

    /// Adds one 2-D sample.
    public void add(double x, double y, double weight, double deltaM2_32) {
        requireDimensions(2);
        if (!accept(weight, deltaM2_32) || !Double.isFinite(x) || !Double.isFinite(y)) {
            rejectedCount++;
            return;
        }
        int p = partition(deltaM2_32);
        int xb = axes[0].binOf(x);
        int yb = axes[1].binOf(y);
        if (xb < 0 || yb < 0) {
            outOfRange(p, weight);
            return;
        }
        int bin = flatIndex(xb, yb);
        weights[p][bin] += weight;
        counts[p][bin]++;
    }

    /// Bins every row of a batch.
    ///
    /// @param batch the batch, carrying the plotted variables
    /// @param variables the plotted variable per axis
    /// @param sampleWeights one weight per row
    public void fill(SampleBatch batch, List<String> variables, double[] sampleWeights) {
        if (variables.size() != axes.length) {
            throw new IllegalArgumentException("Histogram has " + axes.length + " axes but "
                + variables.size() + " variables were given: " + variables);
        }
        if (sampleWeights.length != batch.size()) {
            throw new IllegalArgumentException("Got " + sampleWeights.length + " weights for "
                + batch.size() + " rows");
        }
        double[] dm32 = batch.column(PhysicalParameter.DELTA_M2_32);
        double[] x = batch.column(variables.get(0));
        if (axes.length == 1) {
            for (int i = 0; i < x.length; i++) {
                add(x[i], sampleWeights[i], dm32[i]);
            }
        } else {
            double[] y = batch.column(variables.get(1));
            for (int i = 0; i < x.length; i++) {
                add(x[i], y[i], sampleWeights[i], dm32[i]);
            }
        }
    }

    /// Adds another histogram's contents bin-wise.
    ///
    /// @param other a histogram with identical axes and separation
    /// @return this histogram
    /// @throws IllegalArgumentException if the layouts differ
    public WeightedHistogram merge(WeightedHistogram other) {
        if (!axes().equals(other.axes()) || separateOrderings != other.separateOrderings) {
            throw new IllegalArgumentException("Cannot merge histograms with different layouts: "
                + this + " and " + other);
        }
        for (int p = 0; p < weights.length; p++) {
            for (int b = 0; b < binCount; b++) {
                weights[p][b] += other.weights[p][b];
                counts[p][b] += other.counts[p][b];
            }
            outOfRangeWeight[p] += other.outOfRangeWeight[p];
            outOfRangeCount[p] += other.outOfRangeCount[p];
        }
        rejectedCount += other.rejectedCount;
        return this;
    }

    /// Returns the combined weight per bin, summed over orderings.
    public double[] weights() {
        double[] sum = weights[0].clone();
        for (int p = 1; p < weights.length; p++) {
            for (int b = 0; b < binCount; b++) {
                sum[b] += weights[p][b];
            }
        }
        return sum;
    }

    /// Returns the weight per bin of one ordering.
    ///
    /// @throws IllegalStateException if the histogram does not separate orderings
    public double[] weights(MassOrdering ordering) {
        return weights[partitionOf(ordering)].clone();
    }

    /// Returns the combined entry count per bin.
    public long[] counts() {
        long[] sum = counts[0].clone();
        for (int p = 1; p < counts.length; p++) {
            for (int b = 0; b < binCount; b++) {
                sum[b] += counts[p][b];
            }
        }
        return sum;
    }

    /// Returns the entry count per bin of one ordering.
    public long[] counts(MassOrdering ordering) {
        return counts[partitionOf(ordering)].clone();
    }

    public double inRangeWeight() {
        double total = 0;
        for (double[] partition : weights) {
            total += sum(partition);
        }
        return total;
    }

    public double inRangeWeight(MassOrdering ordering) {
        return sum(weights[partitionOf(ordering)]);
    }

    public long inRangeCount() {
        long total = 0;
        for (long[] partition : counts) {
            for (long c : partition) {
                total += c;
            }
        }
        return total;
    }

    public long inRangeCount(MassOrdering ordering) {
        long total = 0;
        for (long c : counts[partitionOf(ordering)]) {
            total += c;
        }
        return total;
    }

    public double outOfRangeWeight() {
        return sum(outOfRangeWeight);
    }

    public double outOfRangeWeight(MassOrdering ordering) {
        return outOfRangeWeight[partitionOf(ordering)];
    }

    public long outOfRangeCount() {
        long total = 0;
        for (long c : outOfRangeCount) {
            total += c;
        }
        return total;
    }

    public long outOfRangeCount(MassOrdering ordering) {
        return outOfRangeCount[partitionOf(ordering)];
    }

    /// Returns the weight of every accepted sample, in range or not.
    public double totalWeight() {
        return inRangeWeight() + outOfRangeWeight();
    }

    public long rejectedCount() {
        return rejectedCount;
    }

    private boolean accept(double weight, double deltaM2_32) {
        if (!Double.isFinite(weight) || weight < 0) {
            return false;
        }
        return !separateOrderings || !Double.isNaN(deltaM2_32);
    }

    private int partition(double deltaM2_32) {
        return separateOrderings ? MassOrdering.of(deltaM2_32).ordinal() : 0;
    }

    private int partitionOf(MassOrdering ordering) {
        if (!separateOrderings) {
            throw new IllegalStateException("Histogram does not separate mass orderings");
        }
        return ordering.ordinal();
    }

    private void outOfRange(int partition, double weight) {
        outOfRangeWeight[partition] += weight;
        outOfRangeCount[partition]++;
    }

    private void requireDimensions(int n) {
        if (axes.length != n) {
            throw new IllegalArgumentException("Histogram is " + axes.length + "-D, got a " + n + "-D sample");
        }
    }

    private static double sum(double[] values) {
        double total = 0;
        for (double v : values) {
            total += v;
        }
        return total;
    }

    @Override
    public String toString() {
        return "WeightedHistogram[" + axes() + (separateOrderings ? ", by ordering" : "")
            + ", inRange=" + inRangeCount() + ", outOfRange=" + outOfRangeCount()
            + ", rejected=" + rejectedCount + "]";
    }
}
