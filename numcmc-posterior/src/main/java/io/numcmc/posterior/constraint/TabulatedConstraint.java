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

import java.util.Arrays;

/// A constraint tabulated on a regular 1-D or 2-D grid and evaluated by (bi)linear
/// interpolation between grid points. Outside the grid the density is 0.
///
/// ## Histogram layouts
///
/// Published constraints usually come as histograms. Their contents are placed at bin
/// centers, so the interpolation grid is the set of centers:
///
/// ```
///   bins:        |  b0  |  b1  |  b2  |
///   points:         *      *      *          histogram(...)
///
///   with flow:  u |  b0  |  b1  |  b2  | o
///   points:  *      *      *      *      *   withFlowBins(...)
/// ```
///
/// In the flow layout the underflow and overflow contents sit half a bin outside the
/// nominal range, which extends the evaluable range by half a bin on each side.
///
/// Values are stored row-major with the last axis varying fastest.
public final class TabulatedConstraint implements Constraint {

    private final double[][] points;
    private final double[] values;

    private TabulatedConstraint(double[][] points, double[] values) {
        if (points.length < 1 || points.length > 2) {
            throw new IllegalArgumentException("Tabulated constraints support 1 or 2 dimensions, got " + points.length);
        }
        int expected = 1;
        for (int axis = 0; axis < points.length; axis++) {
            double[] p = points[axis];
            if (p.length < 2) {
                throw new IllegalArgumentException("Axis " + axis + " needs at least 2 grid points, got " + p.length);
            }
            for (int i = 1; i < p.length; i++) {
                if (!(p[i] > p[i - 1])) {
                    throw new IllegalArgumentException("Grid points of axis " + axis + " must be strictly increasing");
                }
            }
            expected *= p.length;
        }
        if (values.length != expected) {
            throw new IllegalArgumentException("Grid has " + expected + " points but " + values.length + " values");
        }
        for (double v : values) {
            if (!Double.isFinite(v) || v < 0) {
                throw new IllegalArgumentException("Constraint values must be finite and non-negative, got " + v);
            }
        }
        this.points = points;
        this.values = values;
    }

    /// Creates a constraint from explicit grid points.
    ///
    /// @param points strictly increasing grid coordinates per axis
    /// @param values values at the grid points, row-major
    /// @return the constraint
    public static TabulatedConstraint onGrid(double[][] points, double[] values) {
        double[][] copy = new double[points.length][];
        for (int i = 0; i < points.length; i++) {
            copy[i] = points[i].clone();
        }
        return new TabulatedConstraint(copy, values.clone());
    }

    /// Creates a 1-D constraint from histogram contents over [lower, upper].
    public static TabulatedConstraint histogram(double lower, double upper, double[] contents) {
        return new TabulatedConstraint(new double[][]{centers(lower, upper, contents.length, false)},
            contents.clone());
    }

    /// Creates a 2-D constraint from histogram contents.
    ///
    /// @param contents contents indexed [bin of axis 0][bin of axis 1]
    public static TabulatedConstraint histogram(double lower0, double upper0,
                                                double lower1, double upper1,
                                                double[][] contents) {
        int n0 = contents.length;
        int n1 = n0 == 0 ? 0 : contents[0].length;
        double[] flat = new double[n0 * n1];
        for (int i = 0; i < n0; i++) {
            if (contents[i].length != n1) {
                throw new IllegalArgumentException("Row " + i + " has " + contents[i].length + " bins, expected " + n1);
            }
            System.arraycopy(contents[i], 0, flat, i * n1, n1);
        }
        return new TabulatedConstraint(new double[][]{
            centers(lower0, upper0, n0, false),
            centers(lower1, upper1, n1, false)}, flat);
    }

    /// Creates a constraint from a histogram stored with underflow and overflow bins.
    ///
    /// @param lower nominal lower edge per axis
    /// @param upper nominal upper edge per axis
    /// @param bins regular bin count per axis, without flow bins
    /// @param data row-major contents including flow bins, (bins + 2) per axis
    /// @return the constraint
    public static TabulatedConstraint withFlowBins(double[] lower, double[] upper, int[] bins, double[] data) {
        return histogram(lower, upper, bins, data, true);
    }

    /// Creates a constraint from row-major histogram contents of any supported rank.
    ///
    /// @param lower nominal lower edge per axis
    /// @param upper nominal upper edge per axis
    /// @param bins regular bin count per axis
    /// @param data row-major contents; with flow bins, (bins + 2) per axis
    /// @param flowBins whether data includes underflow and overflow bins
    /// @return the constraint
    public static TabulatedConstraint histogram(double[] lower, double[] upper, int[] bins,
                                                double[] data, boolean flowBins) {
        if (lower.length != upper.length || lower.length != bins.length) {
            throw new IllegalArgumentException("lower, upper and bins must have one entry per axis");
        }
        double[][] points = new double[bins.length][];
        for (int axis = 0; axis < bins.length; axis++) {
            points[axis] = centers(lower[axis], upper[axis], bins[axis], flowBins);
        }
        return new TabulatedConstraint(points, data.clone());
    }

    private static double[] centers(double lower, double upper, int bins, boolean flow) {
        if (bins < 1 || !(upper > lower)) {
            throw new IllegalArgumentException("Invalid histogram axis: " + bins + " bins on [" + lower + ", " + upper + "]");
        }
        double width = (upper - lower) / bins;
        int n = flow ? bins + 2 : bins;
        double first = flow ? lower - width / 2 : lower + width / 2;
        double[] c = new double[n];
        for (int i = 0; i < n; i++) {
            c[i] = first + i * width;
        }
        return c;
    }

    @Override
    public int dimensions() {
        return points.length;
    }

    @Override
    public double density(double... at) {
        checkArity(at);
        int i0 = cell(points[0], at[0]);
        if (i0 < 0) {
            return 0.0;
        }
        double t0 = fraction(points[0], i0, at[0]);
        if (points.length == 1) {
            return (1 - t0) * values[i0] + t0 * values[i0 + 1];
        }
        int i1 = cell(points[1], at[1]);
        if (i1 < 0) {
            return 0.0;
        }
        double t1 = fraction(points[1], i1, at[1]);
        int n1 = points[1].length;
        double v00 = values[i0 * n1 + i1];
        double v01 = values[i0 * n1 + i1 + 1];
        double v10 = values[(i0 + 1) * n1 + i1];
        double v11 = values[(i0 + 1) * n1 + i1 + 1];
        return (1 - t0) * (1 - t1) * v00
            + (1 - t0) * t1 * v01
            + t0 * (1 - t1) * v10
            + t0 * t1 * v11;
    }

    /// Returns the index of the grid cell [p[i], p[i+1]] holding x, or -1 outside the grid.
    private static int cell(double[] p, double x) {
        if (!(x >= p[0] && x <= p[p.length - 1])) {
            return -1;
        }
        int pos = Arrays.binarySearch(p, x);
        int i = pos >= 0 ? pos : -pos - 2;
        return Math.min(i, p.length - 2);
    }

    private static double fraction(double[] p, int i, double x) {
        return (x - p[i]) / (p[i + 1] - p[i]);
    }

    /// Returns the grid coordinates of an axis.
    public double[] gridPoints(int axis) {
        return points[axis].clone();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("TabulatedConstraint[");
        for (int axis = 0; axis < points.length; axis++) {
            double[] p = points[axis];
            sb.append(axis == 0 ? "" : " x ").append(p.length).append(" points on [")
                .append(p[0]).append(", ").append(p[p.length - 1]).append(']');
        }
        return sb.append(']').toString();
    }
}
