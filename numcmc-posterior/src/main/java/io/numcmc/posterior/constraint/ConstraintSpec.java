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

import io.numcmc.posterior.sample.MassOrdering;

import java.util.List;
import java.util.Objects;

/// A named external constraint bound to the variables it is evaluated on.
///
/// A spec with `autoApply` set is multiplied into the weight of every plot; others
/// apply only to plots that name them. Samples whose mass ordering lies outside the
/// spec's [OrderingScope] receive a factor of 1.
///
/// Instances are immutable and shared by reference between plots.
public final class ConstraintSpec {

    private final String name;
    private final Constraint constraint;
    private final List<String> variables;
    private final OrderingScope scope;
    private final boolean autoApply;

    public ConstraintSpec(String name, Constraint constraint, List<String> variables,
                          OrderingScope scope, boolean autoApply) {
        this.name = Objects.requireNonNull(name, "name");
        this.constraint = Objects.requireNonNull(constraint, "constraint");
        this.variables = List.copyOf(variables);
        this.scope = scope == null ? OrderingScope.BOTH : scope;
        this.autoApply = autoApply;
        if (this.variables.size() != constraint.dimensions()) {
            throw new IllegalArgumentException("Constraint '" + name + "' is " + constraint.dimensions()
                + "-dimensional but names variables " + this.variables);
        }
    }

    public String getName() {
        return name;
    }

    public Constraint getConstraint() {
        return constraint;
    }

    /// Returns the variables the constraint is evaluated on, in argument order.
    public List<String> getVariables() {
        return variables;
    }

    public OrderingScope getScope() {
        return scope;
    }

    public boolean isAutoApply() {
        return autoApply;
    }

    /// Returns whether the constraint applies to samples of an ordering.
    public boolean appliesTo(MassOrdering ordering) {
        return scope.includes(ordering);
    }

    /// Returns the weight factor for one sample.
    ///
    /// @param ordering the sample's mass ordering
    /// @param values the sample's values of [#getVariables()]
    /// @return the constraint density, or 1 outside the spec's scope
    public double factor(MassOrdering ordering, double... values) {
        return appliesTo(ordering) ? constraint.density(values) : 1.0;
    }

    @Override
    public String toString() {
        return "ConstraintSpec[" + name + " on " + variables + ", scope=" + scope
            + (autoApply ? ", auto" : "") + ", " + constraint + "]";
    }
}
