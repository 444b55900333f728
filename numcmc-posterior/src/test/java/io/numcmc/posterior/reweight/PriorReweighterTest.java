package io.numcmc.posterior.reweight;

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
import io.numcmc.posterior.constraint.GaussianConstraint;
import io.numcmc.posterior.constraint.OrderingScope;
import io.numcmc.posterior.prior.DimensionalityException;
import io.numcmc.posterior.prior.PriorSpec;
import io.numcmc.posterior.prior.PriorSpecParser;
import io.numcmc.posterior.sample.SampleBatch;
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
public class PriorReweighterTest {

    private static final double TOLERANCE = 1e-12;

    @Test
    void identicalPriorsGiveUnitWeight() {
        PriorSpec prior = PriorSpecParser.parse("Theta23", "Uniform(0.3, 0.7):sin^2(x)");
        PriorReweighter reweighter = new PriorReweighter(prior, prior);

        assertThat(reweighter.isIdentity()).isTrue();
        // outside the old prior's support, but identical specs are never evaluated
        assertEquals(1.0, reweighter.weight(0.01));
    }

    @Test
    void flatToSinSquaredWeightsByJacobian() {
        PriorReweighter reweighter = new PriorReweighter(
            PriorSpec.uniform("Theta23"), PriorSpecParser.parse("Theta23", "Uniform:sin^2(x)"));

        for (double x : new double[]{0.1, 0.5, 0.785, 1.2}) {
            assertEquals(Math.sin(2 * x), reweighter.weight(x), TOLERANCE);
        }
    }

    @Test
    void gaussianReplacementIsRatioOfDensities() {
        PriorSpec old = PriorSpecParser.parse("Theta13", "Uniform:sin^2(2x)");
        PriorSpec replacement = PriorSpecParser.parse("Theta13", "Gaussian(0.085, 0.003):sin^2(2x)");
        PriorReweighter reweighter = new PriorReweighter(old, replacement);

        double x = 0.15;
        assertEquals(replacement.density(x) / old.density(x), reweighter.weight(x), TOLERANCE);
    }

    @Test
    void vanishingOldPriorIsDegenerate() {
        PriorReweighter reweighter = new PriorReweighter(
            PriorSpecParser.parse("Theta23", "Uniform(0.3, 0.7):sin^2(x)"),
            PriorSpec.uniform("Theta23"));

        assertThatThrownBy(() -> reweighter.weight(0.05))
            .isInstanceOf(DegeneratePriorException.class)
            .hasMessageContaining("Theta23=0.05");
    }

    @Test
    void mismatchedVariablesAreRejected() {
        assertThatThrownBy(() -> new PriorReweighter(PriorSpec.uniform("Theta23"), PriorSpec.uniform("Theta13")))
            .isInstanceOf(DimensionalityException.class);
    }

    @Test
    void forPlotWithoutOverridesIsNone() {
        assertSame(PriorReweighter.NONE, PriorReweighter.forPlot(List.of("Theta23"), List.of(), Map.of()));
        assertThat(PriorReweighter.NONE.variable()).isEmpty();
    }

    @Test
    void forPlotUsesChainPriorOrFlatDefault() {
        PriorSpec chainPrior = PriorSpecParser.parse("Theta13", "Uniform:sin^2(2x)");
        PriorSpec replacement = PriorSpecParser.parse("Theta13", "Uniform:x");

        PriorReweighter declared = PriorReweighter.forPlot(List.of("Theta23"), List.of(replacement),
            Map.of("Theta13", chainPrior));
        assertThat(declared.getOldPrior()).contains(chainPrior);

        PriorReweighter undeclared = PriorReweighter.forPlot(List.of("Theta23"),
            List.of(PriorSpecParser.parse("Theta13", "Uniform:sin^2(2x)")), Map.of());
        assertThat(undeclared.getOldPrior()).contains(PriorSpec.uniform("Theta13"));
        assertThat(undeclared.variable()).contains("Theta13");
    }

    @Test
    void forPlotRejectsSeveralOverrides() {
        assertThatThrownBy(() -> PriorReweighter.forPlot(List.of("Theta23"),
            List.of(PriorSpec.uniform("Theta13"), PriorSpec.uniform("Theta12")), Map.of()))
            .isInstanceOf(DimensionalityException.class);
    }

    @Test
    void forPlotRejectsDerivedTarget() {
        PriorSpec derived = PriorSpecParser.parse("SinSqTheta23", "Uniform");
        assertThatThrownBy(() -> PriorReweighter.forPlot(List.of("Theta23"), List.of(derived), Map.of()))
            .isInstanceOf(DimensionalityException.class)
            .hasMessageContaining("derived");
    }

    @Test
    void forPlotRejectsOverrideOfOwnAxisIn2d() {
        PriorSpec replacement = PriorSpecParser.parse("Theta23", "Uniform:sin^2(x)");
        assertThatThrownBy(() -> PriorReweighter.forPlot(List.of("Theta23", "DeltaCP"), List.of(replacement), Map.of()))
            .isInstanceOf(DimensionalityException.class);
        // a 1-D plot may replace its own axis
        assertThat(PriorReweighter.forPlot(List.of("Theta23"), List.of(replacement), Map.of()).isIdentity()).isFalse();
    }

    @Test
    void weigherMultipliesPriorAndApplicableConstraints() {
        PriorReweighter reweighter = new PriorReweighter(
            PriorSpec.uniform("Theta23"), PriorSpecParser.parse("Theta23", "Uniform:sin^2(x)"));
        ConstraintSpec normalOnly = new ConstraintSpec("no-only", new GaussianConstraint(0.15, 0.01),
            List.of("Theta13"), OrderingScope.NORMAL_ONLY, false);
        SampleWeigher weigher = new SampleWeigher(reweighter, List.of(normalOnly));

        SampleBatch batch = batch(new double[]{0.5, 0.5}, new double[]{0.16, 0.16}, new double[]{2.5e-3, -2.5e-3});
        double[] weights = weigher.weights(batch);

        double gauss = Math.exp(-0.5);
        assertEquals(Math.sin(1.0) * gauss, weights[0], TOLERANCE);
        assertEquals(Math.sin(1.0), weights[1], TOLERANCE);
        assertThat(weigher.requiredVariables()).containsExactly("Theta23", "Theta13");
    }

    private static SampleBatch batch(double[] theta23, double[] theta13, double[] dm32) {
        int n = theta23.length;
        Map<String, double[]> columns = new LinkedHashMap<>();
        columns.put("DeltaCP", new double[n]);
        columns.put("Theta13", theta13);
        columns.put("Theta23", theta23);
        columns.put("Theta12", new double[n]);
        columns.put("Deltam2_32", dm32);
        columns.put("Deltam2_21", new double[n]);
        return new SampleBatch(columns);
    }
}
