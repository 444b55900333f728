package io.numcmc.posterior.prior;

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

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the family tag of a {@link PriorModel} implementation.
 *
 * <p>The tag is used both in the textual prior form ({@code Gaussian(0.55, 0.01):sin^2(x)})
 * and as the {@code "family"} discriminator in JSON:
 *
 * <pre>{@code
 * {
 *   "family": "Gaussian",
 *   "mean": 0.55,
 *   "sigma": 0.01
 * }
 * }</pre>
 *
 * @see PriorModelTypeAdapterFactory
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface PriorFamily {
    /**
     * The family tag, unique across all PriorModel implementations.
     *
     * @return the family tag
     */
    String value();
}
