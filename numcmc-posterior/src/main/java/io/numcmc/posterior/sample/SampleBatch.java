package io.numcmc.posterior.sample;

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
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/// A contiguous run of chain steps stored column by column.
///
/// ## Layout
///
/// ```
///            row 0   row 1   ...   row n-1
///   DeltaCP  [  .      .             .   ]
///   Theta13  [  .      .             .   ]
///   ...
///   <derived>[  .      .             .   ]
/// ```
///
/// Every batch holds the six [PhysicalParameter] columns; derived columns are added by
/// [VariableRegistry#evaluate] through [#withColumn], which returns a new batch.
/// Column arrays are never modified after construction and are not copied on read;
/// callers must treat them as read-only.
public final class SampleBatch {

    private final int size;
    private final Map<String, double[]> columns;

    /// Creates a batch from named columns.
    ///
    /// @param columns column arrays by name; all must have the same length
    /// @throws IllegalArgumentException if a physical column is missing or lengths differ
    public SampleBatch(Map<String, double[]> columns) {
        this(new LinkedHashMap<>(columns), true);
    }

    private SampleBatch(LinkedHashMap<String, double[]> columns, boolean validate) {
        int n = -1;
        for (Map.Entry<String, double[]> e : columns.entrySet()) {
            if (e.getValue() == null) {
                throw new IllegalArgumentException("Column '" + e.getKey() + "' is null");
            }
            if (n < 0) {
                n = e.getValue().length;
            } else if (e.getValue().length != n) {
                throw new IllegalArgumentException("Column '" + e.getKey() + "' has " + e.getValue().length
                    + " rows, expected " + n);
            }
        }
        if (validate) {
            for (String name : PhysicalParameter.columnNames()) {
                if (!columns.containsKey(name)) {
                    throw new IllegalArgumentException("Compulsory variable '" + name
                        + "' not found in batch columns " + columns.keySet());
                }
            }
        }
        this.size = Math.max(n, 0);
        this.columns = Collections.unmodifiableMap(columns);
    }

    /// Returns the number of rows.
    public int size() {
        return size;
    }

    /// Returns whether the batch carries a column.
    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    /// Returns the column names in insertion order.
    public Set<String> columnNames() {
        return columns.keySet();
    }

    /// Returns a column.
    ///
    /// @param name the column name
    /// @return the column values, not to be modified
    /// @throws IllegalArgumentException if the column is absent
    public double[] column(String name) {
        double[] values = columns.get(name);
        if (values == null) {
            throw new IllegalArgumentException("Batch has no column '" + name + "'. Columns: " + columns.keySet());
        }
        return values;
    }

    /// Returns a physical column.
    public double[] column(PhysicalParameter parameter) {
        return column(parameter.columnName());
    }

    /// Returns a new batch with one more column.
    ///
    /// @param name the new column name
    /// @param values the column values; length must equal [#size()]
    /// @return a batch sharing this batch's columns plus the new one
    public SampleBatch withColumn(String name, double[] values) {
        if (values.length != size) {
            throw new IllegalArgumentException("Column '" + name + "' has " + values.length
                + " rows, batch has " + size);
        }
        LinkedHashMap<String, double[]> extended = new LinkedHashMap<>(columns);
        extended.put(name, values);
        return new SampleBatch(extended, false);
    }

    /// Returns rows `[from, to)` as a new batch.
    public SampleBatch slice(int from, int to) {
        if (from < 0 || to > size || from > to) {
            throw new IndexOutOfBoundsException("slice [" + from + ", " + to + ") of batch with " + size + " rows");
        }
        LinkedHashMap<String, double[]> sliced = new LinkedHashMap<>();
        for (Map.Entry<String, double[]> e : columns.entrySet()) {
            sliced.put(e.getKey(), Arrays.copyOfRange(e.getValue(), from, to));
        }
        return new SampleBatch(sliced, false);
    }

    /// Returns the mass ordering of one row.
    public MassOrdering massOrdering(int row) {
        return MassOrdering.of(column(PhysicalParameter.DELTA_M2_32)[row]);
    }

    /// Returns one row as a [Sample].
    public Sample row(int row) {
        Map<String, Double> derived = new HashMap<>();
        for (Map.Entry<String, double[]> e : columns.entrySet()) {
            if (!PhysicalParameter.isPhysical(e.getKey())) {
                derived.put(e.getKey(), e.getValue()[row]);
            }
        }
        return new Sample(
            column(PhysicalParameter.DELTA_CP)[row],
            column(PhysicalParameter.THETA_13)[row],
            column(PhysicalParameter.THETA_23)[row],
            column(PhysicalParameter.THETA_12)[row],
            column(PhysicalParameter.DELTA_M2_32)[row],
            column(PhysicalParameter.DELTA_M2_21)[row],
            derived);
    }

    @Override
    public String toString() {
        return "SampleBatch[rows=" + size + ", columns=" + columns.keySet() + "]";
    }
}
