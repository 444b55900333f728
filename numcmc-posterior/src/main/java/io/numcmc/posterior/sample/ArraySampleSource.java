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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/// An in-memory [SampleSource] backed by column arrays.
///
/// The arrays are held as given; each batch copies its own row range.
public final class ArraySampleSource implements SampleSource {

    private final SampleBatch all;
    private final String id;

    /// Creates a source over named columns.
    ///
    /// @param columns column arrays by name; must include the six physical columns
    public ArraySampleSource(Map<String, double[]> columns) {
        this(columns, "memory");
    }

    /// Creates a source over named columns with an identifier.
    ///
    /// @param columns column arrays by name; must include the six physical columns
    /// @param id identifier for logging
    public ArraySampleSource(Map<String, double[]> columns, String id) {
        this.all = new SampleBatch(columns);
        this.id = id;
    }

    /// Creates a source from rows. Derived values carried by the first sample become
    /// columns; later samples must carry the same ones.
    ///
    /// @param samples the rows in chain order
    /// @return the source
    public static ArraySampleSource of(List<Sample> samples) {
        int n = samples.size();
        Map<String, double[]> columns = new LinkedHashMap<>();
        for (PhysicalParameter p : PhysicalParameter.values()) {
            double[] values = new double[n];
            for (int i = 0; i < n; i++) {
                values[i] = samples.get(i).get(p);
            }
            columns.put(p.columnName(), values);
        }
        if (n > 0) {
            for (String name : samples.get(0).derived().keySet()) {
                double[] values = new double[n];
                for (int i = 0; i < n; i++) {
                    values[i] = samples.get(i).get(name);
                }
                columns.put(name, values);
            }
        }
        return new ArraySampleSource(columns);
    }

    @Override
    public List<String> columnNames() {
        return new ArrayList<>(all.columnNames());
    }

    @Override
    public BatchCursor open(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive, got " + batchSize);
        }
        return new BatchCursor() {
            private int next = 0;
            private boolean closed;

            @Override
            public boolean hasNext() {
                return !closed && next < all.size();
            }

            @Override
            public SampleBatch next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                int end = Math.min(next + batchSize, all.size());
                SampleBatch batch = all.slice(next, end);
                next = end;
                return batch;
            }

            @Override
            public void close() {
                closed = true;
            }
        };
    }

    @Override
    public long size() {
        return all.size();
    }

    @Override
    public String getId() {
        return id;
    }
}
