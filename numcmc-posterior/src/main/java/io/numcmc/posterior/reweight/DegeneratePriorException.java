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

import io.numcmc.posterior.prior.PriorSpec;

/// Thrown when the prior a chain was sampled under has zero density at a sample, so
/// the importance weight new/old is undefined.
public class DegeneratePriorException extends ArithmeticException {

    private final transient PriorSpec oldPrior;
    private final double value;

    public DegeneratePriorException(PriorSpec oldPrior, double value) {
        super("Chain prior " + oldPrior + " has zero density at " + oldPrior.getVariable() + "=" + value
            + "; cannot reweight this sample");
        this.oldPrior = oldPrior;
        this.value = value;
    }

    public PriorSpec getOldPrior() {
        return oldPrior;
    }

    /// Returns the physical value at which the old prior vanished.
    public double getValue() {
        return value;
    }
}
