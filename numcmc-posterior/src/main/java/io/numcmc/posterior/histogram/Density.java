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

import java.util.List;

/// A probability density over the bins of a 1-D or 2-D histogram.
///
/// Values are densities, not masses: the mass of a bin is its value times its area.
/// For a normalized density the masses sum to 1. Flat bin indices follow
/// [WeightedHistogram#flatIndex(int, int)].
///
/// Immutable.
public final class Density {

    @SerializedName("axes")
    private final List<BinAxis> axes;

    @SerializedName("values")
    private final double[] values;

    // derived from the axes; absent after Gson materialization until first use
    private transient double[] areas;

    Density(List<BinAxis> axes, double[] values) {
        this.axes = List.copyOf(axes);
        this.values = values;
        this.areas = binAreas(this.axes);
        if (areas.length != values.length) {
            throw new IllegalArgumentException("Density has " + values.length + " values for " + areas.length + " bins");
        }
    }

    private double[] areas() {
        if (areas == null) {
            areas = binAreas(axes);
        }
        return areas;
    }

    /// Creates a density from per-bin weights divided by a normalizing total.
    ///
    /// @param axes the histogram axes
    /// @param weights per-bin weights
    /// @param total the weight that should integrate to 1
    /// @return the density weight / (total × area)
    static Density fromWeights(List<BinAxis> axes, double[] weights, double total) {
        double[] areas = binAreas(axes);
        double[] values = new double[weights.length];
        for (int b = 0; b < values.length; b++) {
            values[b] = weights[b] / (total * areas[b]);
        }
        return new Density(axes, values);
    }

    static double[] binAreas(List<BinAxis> axes) {
        BinAxis x = axes.get(0);
        if (axes.size() == 1) {
            double[] areas = new double[x.binCount()];
            for (int i = 0; i < areas.length; i++) {
                areas[i] = x.width(i);
            }
            return areas;
        }
        BinAxis y = axes.get(1);
        double[] areas = new double[x.binCount() * y.binCount()];
        for (int i = 0; i < x.binCount(); i++) {
            for (int j = 0; j < y.binCount(); j++) {
                areas[i * y.binCount() + j] = x.width(i) * y.width(j);
            }
        }
        return areas;
    }

    public List<BinAxis> axes() {
        return axes;
    }

    public int dimensions() {
        return axes.size();
    }

    public int binCount() {
        return values.length;
    }

    /// Returns the density of a bin by flat index.
    public double value(int bin) {
        return values[bin];
    }

    /// Returns the density of a 2-D bin.
    public double value(int xBin, int yBin) {
        return values[xBin * axes.get(1).binCount() + yBin];
    }

    /// Returns a copy of all values.
    public double[] values() {
        return values.clone();
    }

    public double area(int bin) {
        return areas()[bin];
    }

    /// Returns the probability mass of a bin, value times area.
    public double mass(int bin) {
        return values[bin] * areas()[bin];
    }

    /// Returns the sum of all bin masses.
    public double integral() {
        double total = 0;
        for (int b = 0; b < values.length; b++) {
            total += mass(b);
        }
        return total;
    }
}
