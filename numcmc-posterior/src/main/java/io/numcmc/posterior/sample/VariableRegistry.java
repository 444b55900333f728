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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Named variables available to plots: the six physical parameters plus derived
/// variables registered as pure functions of them.
///
/// ## Lifecycle
///
/// ```
///   new VariableRegistry()  ──register()*──►  freeze()  ──►  evaluate(batch, names)*
/// ```
///
/// Names are unique and the physical names are reserved. Once frozen the registry is
/// read-only, so every plot of a stack sees the same variable set.
///
/// ## Evaluation
///
/// [#evaluate(SampleBatch, Collection)] adds one column per requested derived variable
/// that the batch does not already carry. A column present in the chain itself wins
/// over a registered function of the same name, which lets a chain ship precomputed
/// derived quantities.
///
/// Not thread-safe during registration; a frozen registry may be shared.
public final class VariableRegistry {

    private static final Logger logger = LogManager.getLogger(VariableRegistry.class);

    private final Map<String, DerivedVariable> derived = new LinkedHashMap<>();
    private boolean frozen;

    /// Registers a derived variable.
    ///
    /// @param name the variable name
    /// @param function its derivation from the six physical parameters
    /// @return this registry
    /// @throws IllegalArgumentException if the name is blank, reserved or already registered
    /// @throws IllegalStateException if the registry is frozen
    public VariableRegistry register(String name, DerivedVariable function) {
        if (frozen) {
            throw new IllegalStateException("Variable registry is frozen; cannot register '" + name + "'");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Variable name must not be blank");
        }
        if (function == null) {
            throw new IllegalArgumentException("Variable '" + name + "' has no derivation function");
        }
        if (PhysicalParameter.isPhysical(name)) {
            throw new IllegalArgumentException("Variable name '" + name + "' is reserved for a physical parameter");
        }
        if (derived.containsKey(name)) {
            throw new IllegalArgumentException("Variable '" + name + "' is already registered");
        }
        derived.put(name, function);
        logger.debug("Registered derived variable {}", name);
        return this;
    }

    /// Registers every variable of [StandardVariables] that is not yet present.
    ///
    /// @return this registry
    public VariableRegistry registerStandardVariables() {
        for (Map.Entry<String, DerivedVariable> e : StandardVariables.all().entrySet()) {
            if (!derived.containsKey(e.getKey())) {
                register(e.getKey(), e.getValue());
            }
        }
        return this;
    }

    /// Makes the registry read-only.
    public VariableRegistry freeze() {
        frozen = true;
        return this;
    }

    public boolean isFrozen() {
        return frozen;
    }

    /// Returns whether a name is a physical parameter or a registered derived variable.
    public boolean contains(String name) {
        return PhysicalParameter.isPhysical(name) || derived.containsKey(name);
    }

    /// Returns whether a name is a registered derived variable.
    public boolean isDerived(String name) {
        return derived.containsKey(name);
    }

    /// Returns all known names, physical first, then derived in registration order.
    public List<String> names() {
        List<String> names = new ArrayList<>(PhysicalParameter.columnNames());
        names.addAll(derived.keySet());
        return Collections.unmodifiableList(names);
    }

    /// Returns the derived variable names in registration order.
    public Collection<String> derivedNames() {
        return Collections.unmodifiableSet(derived.keySet());
    }

    /// Evaluates a derived variable for one sample.
    ///
    /// @param name a physical or derived variable name
    /// @param sample the sample
    /// @return the value
    public double evaluate(String name, Sample sample) {
        if (PhysicalParameter.isPhysical(name)) {
            return sample.get(name);
        }
        DerivedVariable function = derived.get(name);
        if (function == null) {
            throw new IllegalArgumentException("Unknown variable '" + name + "'. Known: " + names());
        }
        return function.evaluate(sample.deltaCP(), sample.theta13(), sample.theta23(),
            sample.theta12(), sample.deltaM2_32(), sample.deltaM2_21());
    }

    /// Adds the requested derived columns a batch does not already carry.
    ///
    /// @param batch the batch
    /// @param names the variables needed downstream
    /// @return the batch itself if nothing was missing, otherwise an extended batch
    /// @throws IllegalArgumentException if a name is neither in the batch nor registered
    public SampleBatch evaluate(SampleBatch batch, Collection<String> names) {
        SampleBatch result = batch;
        for (String name : names) {
            if (result.hasColumn(name)) {
                continue;
            }
            DerivedVariable function = derived.get(name);
            if (function == null) {
                throw new IllegalArgumentException("Unknown variable '" + name + "'. Known: " + names());
            }
            result = result.withColumn(name, evaluateColumn(function, result));
        }
        return result;
    }

    private static double[] evaluateColumn(DerivedVariable function, SampleBatch batch) {
        double[] dcp = batch.column(PhysicalParameter.DELTA_CP);
        double[] th13 = batch.column(PhysicalParameter.THETA_13);
        double[] th23 = batch.column(PhysicalParameter.THETA_23);
        double[] th12 = batch.column(PhysicalParameter.THETA_12);
        double[] dm32 = batch.column(PhysicalParameter.DELTA_M2_32);
        double[] dm21 = batch.column(PhysicalParameter.DELTA_M2_21);
        double[] values = new double[batch.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = function.evaluate(dcp[i], th13[i], th23[i], th12[i], dm32[i], dm21[i]);
        }
        return values;
    }
}
