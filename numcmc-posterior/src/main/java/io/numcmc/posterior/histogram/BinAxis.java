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

import java.util.Arrays;

/// Bin edges of one histogram axis.
///
/// ## Binning rule
///
/// Bins are half-open except the last, which is closed:
///
/// ```
///   [e0, e1)  [e1, e2)  ...  [e(n-1), en]
/// ```
///
/// A value equal to the upper edge falls in the last bin; anything below the first
/// edge, above the last, or NaN is out of range.
///
/// Immutable.
public final class BinAxis {

    @SerializedName("edges")
    private final double[] edges;

    private BinAxis(double[] edges) {
        if (edges.length < 2) {
            throw new IllegalArgumentException("An axis needs at least 2 edges, got " + edges.length);
        }
        for (int i = 0; i < edges.length; i++) {
            if (!Double.isFinite(edges[i])) {
                throw new IllegalArgumentException("Bin edges must be finite, got " + edges[i]);
            }
            if (i > 0 && !(edges[i] > edges[i - 1])) {
                throw new IllegalArgumentException("Bin edges must be strictly increasing: "
                    + edges[i - 1] + " then " + edges[i]);
            }
        }
        this.edges = edges;
    }

    /// Creates an axis of equal-width bins.
    ///
    /// @param bins the number of bins, at least 1
    /// @param lower the lower edge
    /// @param upper the upper edge, greater than lower
    /// @return the axis
    public static BinAxis uniform(int bins, double lower, double upper) {
        if (bins < 1) {
            throw new IllegalArgumentException("Bin count must be positive, got " + bins);
        }
        if (!(upper > lower)) {
            throw new IllegalArgumentException("Axis range [" + lower + ", " + upper + "] is empty");
        }
        double[] edges = new double[bins + 1];
        double width = (upper - lower) / bins;
        for (int i = 0; i < bins; i++) {
            edges[i] = lower + i * width;
        }
        edges[bins] = upper;
        return new BinAxis(edges);
    }

    /// Creates an axis from explicit edges.
    ///
    /// @param edges strictly increasing, finite edges
    /// @return the axis
    public static BinAxis ofEdges(double... edges) {
        return new BinAxis(edges.clone());
    }

    /// Returns the number of bins.
    public int binCount() {
        return edges.length - 1;
    }

    public double lower() {
        return edges[0];
    }

    public double upper() {
        return edges[edges.length - 1];
    }

    /// Returns a copy of the edges.
    public double[] edges() {
        return edges.clone();
    }

    public double width(int bin) {
        return edges[bin + 1] - edges[bin];
    }

    public double center(int bin) {
        return 0.5 * (edges[bin] + edges[bin + 1]);
    }

    /// Returns the bin holding a value.
    ///
    /// @param x the value
    /// @return the bin index, or -1 if x is out of range or NaN
    public int binOf(double x) {
        if (!(x >= edges[0] && x <= edges[edges.length - 1])) {
            return -1;
        }
        int last = edges.length - 2;
        if (x == edges[last + 1]) {
            return last;
        }
        int pos = Arrays.binarySearch(edges, x);
        return pos >= 0 ? pos : -pos - 2;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BinAxis)) return false;
        return Arrays.equals(edges, ((BinAxis) o).edges);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(edges);
    }

    @Override
    public String toString() {
        return "BinAxis[" + binCount() + " bins on [" + lower() + ", " + upper() + "]]";
    }
}
