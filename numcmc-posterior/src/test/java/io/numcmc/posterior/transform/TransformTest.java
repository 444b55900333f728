package io.numcmc.posterior.transform;

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
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

@Tag("unit")
public class TransformTest {

    private static final double TOLERANCE = 1e-9;

    @Test
    void catalogHasFifteenTags() {
        assertThat(Transform.tags()).hasSize(15)
            .contains("x", "sin^2(x)", "sin^2(2x)", "cos^4(2x)", "exp(-ix)", "exp(ix)", "abs(ix)");
    }

    @Test
    void sinSquaredAndItsJacobian() {
        double x = 0.7;
        assertEquals(Math.sin(x) * Math.sin(x), Transform.SIN_SQUARED.apply(x), TOLERANCE);
        assertEquals(Math.sin(2 * x), Transform.SIN_SQUARED.jacobian(x), TOLERANCE);
        assertEquals(Math.abs(2 * Math.sin(4 * x)), Transform.SIN_SQUARED_DOUBLE.jacobian(x), TOLERANCE);
    }

    @Test
    void jacobianIsAbsoluteValue() {
        // cos^2 is decreasing on (0, pi/2)
        assertThat(Transform.COS_SQUARED.jacobian(0.4)).isPositive();
        assertEquals(Math.sin(0.8), Transform.COS_SQUARED.jacobian(0.4), TOLERANCE);
    }

    @ParameterizedTest
    @EnumSource(value = Transform.class, names = {"EXP_MINUS_IX", "EXP_IX", "ABS_IX"}, mode = EnumSource.Mode.EXCLUDE)
    void jacobianMatchesNumericalDerivative(Transform transform) {
        double h = 1e-6;
        for (double x = 0.1; x < 1.5; x += 0.2) {
            double numeric = Math.abs(transform.apply(x + h) - transform.apply(x - h)) / (2 * h);
            assertEquals(numeric, transform.jacobian(x), 1e-5, transform + " at " + x);
        }
    }

    @Test
    void phaseTransformsWrapOntoCircle() {
        assertEquals(-Math.PI / 2, Transform.EXP_IX.apply(3 * Math.PI / 2), TOLERANCE);
        assertEquals(Math.PI / 2, Transform.EXP_MINUS_IX.apply(3 * Math.PI / 2), TOLERANCE);
        assertEquals(Math.PI, Transform.wrapPhase(-Math.PI), TOLERANCE);
        assertEquals(1.0, Transform.EXP_IX.jacobian(2.0));
        assertEquals(0.0, Transform.ABS_IX.jacobian(2.0));
    }

    @Test
    void tagsAreNormalized() {
        assertSame(Transform.SIN_SQUARED, Transform.fromTag("sin^2(x)"));
        assertSame(Transform.SIN_SQUARED, Transform.fromTag(" sin²( x ) "));
        assertSame(Transform.COS_FOURTH_DOUBLE, Transform.fromTag("cos**4(2x)"));
    }

    @Test
    void expressionsMayNameTheVariable() {
        assertSame(Transform.SIN_SQUARED_DOUBLE, Transform.fromExpression("sin^2(2Theta13)", "Theta13"));
        assertSame(Transform.IDENTITY, Transform.fromExpression("DeltaCP", "DeltaCP"));
        assertSame(Transform.SIN, Transform.fromExpression("sin(x)", "Theta23"));
    }

    @Test
    void unknownTagIsRejected() {
        assertThatThrownBy(() -> Transform.fromTag("tan(x)"))
            .isInstanceOf(UnsupportedTransformException.class)
            .hasMessageContaining("tan(x)");
        assertThatThrownBy(() -> Transform.fromExpression("tan(Theta23)", "Theta23"))
            .isInstanceOf(UnsupportedTransformException.class);
    }
}
