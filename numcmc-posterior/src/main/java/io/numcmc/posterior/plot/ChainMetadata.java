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
import io.numcmc.posterior.prior.PriorSpec;
import io.numcmc.posterior.sample.PhysicalParameter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// What a chain release says about itself: the prior each physical parameter was
/// sampled under, the external constraints published with it, and a citation.
///
/// A physical parameter without a declared prior is taken as flat in itself
/// (`Uniform:x`) and logged at WARN.
///
/// Immutable.
public final class ChainMetadata {

    private static final Logger logger = LogManager.getLogger(ChainMetadata.class);

    private final Map<String, PriorSpec> priors;
    private final Map<String, ConstraintSpec> constraints;
    private final String citation;

    /// Creates chain metadata.
    ///
    /// @param priors declared priors, keyed by physical parameter name
    /// @param constraints published constraints, with unique names
    /// @param citation free text, passed through untouched; may be null
    /// @throws IllegalArgumentException if a prior is keyed by a non-physical name or
    ///     its spec targets a different variable, or constraint names repeat
    public ChainMetadata(Map<String, PriorSpec> priors, Collection<ConstraintSpec> constraints, String citation) {
        Map<String, PriorSpec> resolved = new LinkedHashMap<>();
        for (Map.Entry<String, PriorSpec> e : priors.entrySet()) {
            if (!PhysicalParameter.isPhysical(e.getKey())) {
                throw new IllegalArgumentException("Chain priors are declared for physical parameters only, got '"
                    + e.getKey() + "'");
            }
            if (!e.getValue().getVariable().equals(e.getKey())) {
                throw new IllegalArgumentException("Prior " + e.getValue() + " is declared under '" + e.getKey() + "'");
            }
        }
        for (String name : PhysicalParameter.columnNames()) {
            PriorSpec spec = priors.get(name);
            if (spec == null) {
                logger.warn("No prior declared for {}; assuming Uniform:x", name);
                spec = PriorSpec.uniform(name);
            }
            resolved.put(name, spec);
        }
        Map<String, ConstraintSpec> byName = new LinkedHashMap<>();
        for (ConstraintSpec c : constraints) {
            if (byName.put(c.getName(), c) != null) {
                throw new IllegalArgumentException("Duplicate constraint name '" + c.getName() + "'");
            }
        }
        this.priors = Collections.unmodifiableMap(resolved);
        this.constraints = Collections.unmodifiableMap(byName);
        this.citation = citation;
    }

    /// Returns metadata declaring flat priors in every physical parameter and no constraints.
    public static ChainMetadata uniformPriors() {
        Map<String, PriorSpec> priors = new LinkedHashMap<>();
        for (String name : PhysicalParameter.columnNames()) {
            priors.put(name, PriorSpec.uniform(name));
        }
        return new ChainMetadata(priors, List.of(), null);
    }

    /// Returns the six priors keyed by physical parameter name, in sample order.
    public Map<String, PriorSpec> priors() {
        return priors;
    }

    /// Returns the declared prior of a physical parameter.
    public PriorSpec prior(String variable) {
        PriorSpec spec = priors.get(variable);
        if (spec == null) {
            throw new IllegalArgumentException("'" + variable + "' is not a physical parameter");
        }
        return spec;
    }

    public Collection<ConstraintSpec> constraints() {
        return constraints.values();
    }

    public Optional<ConstraintSpec> constraint(String name) {
        return Optional.ofNullable(constraints.get(name));
    }

    /// Returns the constraints applied to every plot.
    public List<ConstraintSpec> autoApplyConstraints() {
        List<ConstraintSpec> auto = new ArrayList<>();
        for (ConstraintSpec c : constraints.values()) {
            if (c.isAutoApply()) {
                auto.add(c);
            }
        }
        return auto;
    }

    public Optional<String> citation() {
        return Optional.ofNullable(citation);
    }
}
