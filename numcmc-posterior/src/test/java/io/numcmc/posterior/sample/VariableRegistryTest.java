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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

@Tag("unit")
public class VariableRegistryTest {

    private static final double TOLERANCE = 1e-12;

    private static final Sample SAMPLE = new Sample(-1.6, 0.15, 0.8, 0.59, -2.45e-3, 7.4e-5);

    @Test
    void physicalParametersAreAlwaysKnown() {
        VariableRegistry registry = new VariableRegistry();

        assertThat(registry.names()).containsExactly(
            "DeltaCP", "Theta13", "Theta23", "Theta12", "Deltam2_32", "Deltam2_21");
        assertEquals(0.8, registry.evaluate("Theta23", SAMPLE));
        assertThat(registry.isDerived("Theta23")).isFalse();
    }

    @Test
    void standardVariablesMatchTheirFormulas() {
        VariableRegistry registry = new VariableRegistry().registerStandardVariables();

        assertEquals(Math.pow(Math.sin(0.8), 2), registry.evaluate(StandardVariables.SIN_SQ_THETA23, SAMPLE), TOLERANCE);
        assertEquals(Math.pow(Math.sin(0.3), 2), registry.evaluate(StandardVariables.SIN_SQ_2THETA13, SAMPLE), TOLERANCE);
        assertEquals(2.45e-3, registry.evaluate(StandardVariables.ABS_DM2_32, SAMPLE), TOLERANCE);
        assertEquals(Math.abs(Math.sin(-1.6)), registry.evaluate(StandardVariables.ABS_SIN_DELTA_CP, SAMPLE), TOLERANCE);
        assertEquals(Math.sin(0.15), registry.evaluate(StandardVariables.ABS_UE3, SAMPLE), TOLERANCE);
        assertThat(registry.derivedNames()).hasSize(StandardVariables.all().size());
    }

    @Test
    void jarlskogVanishesWithoutCpViolation() {
        assertEquals(0.0, StandardVariables.jarlskog(0.0, 0.15, 0.8, 0.59, 2.5e-3, 7.4e-5), TOLERANCE);
        double maximal = StandardVariables.jarlskog(Math.PI / 2, 0.15, 0.8, 0.59, 2.5e-3, 7.4e-5);
        assertThat(maximal).isBetween(0.03, 0.04);
    }

    @Test
    void customVariablesAreEvaluatedPerBatch() {
        VariableRegistry registry = new VariableRegistry()
            .register("Theta23Degrees", (dcp, th13, th23, th12, dm32, dm21) -> Math.toDegrees(th23));

        SampleBatch batch = new SampleBatch(columns(new double[]{0.5, 1.0}));
        SampleBatch evaluated = registry.evaluate(batch, List.of("Theta23", "Theta23Degrees"));

        assertThat(evaluated.hasColumn("Theta23Degrees")).isTrue();
        assertEquals(Math.toDegrees(1.0), evaluated.column("Theta23Degrees")[1], TOLERANCE);
        assertThat(batch.hasColumn("Theta23Degrees")).isFalse();
    }

    @Test
    void chainProvidedColumnsAreKept() {
        VariableRegistry registry = new VariableRegistry().registerStandardVariables();
        Map<String, double[]> columns = columns(new double[]{0.5});
        columns.put(StandardVariables.SIN_SQ_THETA23, new double[]{42.0});

        SampleBatch evaluated = registry.evaluate(new SampleBatch(columns), List.of(StandardVariables.SIN_SQ_THETA23));

        assertEquals(42.0, evaluated.column(StandardVariables.SIN_SQ_THETA23)[0]);
    }

    @Test
    void registrationIsValidated() {
        VariableRegistry registry = new VariableRegistry().register("X", (a, b, c, d, e, f) -> a);

        assertThatThrownBy(() -> registry.register("X", (a, b, c, d, e, f) -> b))
            .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("already registered");
        assertThatThrownBy(() -> registry.register("Theta23", (a, b, c, d, e, f) -> b))
            .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("reserved");
        assertThatThrownBy(() -> registry.register(" ", (a, b, c, d, e, f) -> b))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void frozenRegistryRejectsRegistration() {
        VariableRegistry registry = new VariableRegistry();
        assertSame(registry, registry.freeze());

        assertThatThrownBy(() -> registry.register("Late", (a, b, c, d, e, f) -> a))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void unknownVariableIsReported() {
        VariableRegistry registry = new VariableRegistry();
        SampleBatch batch = new SampleBatch(columns(new double[]{0.5}));

        assertThatThrownBy(() -> registry.evaluate(batch, List.of("Nope")))
            .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("Nope");
    }

    @Test
    void massOrderingFollowsSignOfDm32() {
        assertEquals(MassOrdering.INVERTED, SAMPLE.massOrdering());
        assertEquals(MassOrdering.NORMAL, MassOrdering.of(0.0));
        assertEquals(MassOrdering.NORMAL, MassOrdering.of(Double.NaN));
    }

    @Test
    void batchRequiresPhysicalColumns() {
        Map<String, double[]> columns = columns(new double[]{0.5});
        columns.remove("Deltam2_21");

        assertThatThrownBy(() -> new SampleBatch(columns))
            .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("Deltam2_21");
    }

    private static Map<String, double[]> columns(double[] theta23) {
        int n = theta23.length;
        Map<String, double[]> columns = new LinkedHashMap<>();
        columns.put("DeltaCP", new double[n]);
        columns.put("Theta13", new double[n]);
        columns.put("Theta23", theta23);
        columns.put("Theta12", new double[n]);
        columns.put("Deltam2_32", new double[n]);
        columns.put("Deltam2_21", new double[n]);
        return columns;
    }
}
