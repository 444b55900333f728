package io.numcmc.posterior.config;

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

import com.google.gson.annotations.SerializedName;
import io.numcmc.posterior.constraint.ConstraintSpec;
import io.numcmc.posterior.plot.ChainMetadata;
import io.numcmc.posterior.prior.PriorSpec;
import io.numcmc.posterior.prior.PriorSpecParser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// JSON layout of chain metadata.
///
/// ```json
/// {
///   "citation": "T2K collaboration, 2023 release",
///   "priors": {
///     "Theta23": "Uniform:sin^2(x)",
///     "Theta13": "Gaussian(0.0853, 0.0027):sin^2(2x)",
///     "DeltaCP": "Uniform:x"
///   },
///   "constraints": [ ... see ConstraintConfig ... ]
/// }
/// ```
///
/// Prior values use the textual form of [PriorSpecParser]; the map key names the
/// variable. Parameters left out default to `Uniform:x`.
public final class ChainMetadataConfig {

    @SerializedName("citation")
    private String citation;

    @SerializedName("priors")
    private Map<String, String> priors = new LinkedHashMap<>();

    @SerializedName("constraints")
    private List<ConstraintConfig> constraints = new ArrayList<>();

    public ChainMetadataConfig() {
    }

    public ChainMetadataConfig(String citation, Map<String, String> priors, List<ConstraintConfig> constraints) {
        this.citation = citation;
        this.priors = new LinkedHashMap<>(priors);
        this.constraints = new ArrayList<>(constraints);
    }

    public String getCitation() {
        return citation;
    }

    public Map<String, String> getPriors() {
        return priors == null ? Map.of() : priors;
    }

    public List<ConstraintConfig> getConstraints() {
        return constraints == null ? List.of() : constraints;
    }

    /// Builds the metadata, parsing every prior and constraint.
    public ChainMetadata toMetadata() {
        Map<String, PriorSpec> specs = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : getPriors().entrySet()) {
            specs.put(e.getKey(), PriorSpecParser.parse(e.getKey(), e.getValue()));
        }
        List<ConstraintSpec> constraintSpecs = new ArrayList<>();
        for (ConstraintConfig c : getConstraints()) {
            constraintSpecs.add(c.toSpec());
        }
        return new ChainMetadata(specs, constraintSpecs, citation);
    }
}
