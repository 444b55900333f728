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

import java.util.ArrayList;
import java.util.List;

/// JSON layout of a plot file: the plots plus optional default credible levels.
///
/// ```json
/// { "levels": [0.6827, 0.9545], "plots": [ { ... see PlotConfig ... } ] }
/// ```
public final class PlotsConfig {

    @SerializedName("levels")
    private List<Double> levels = new ArrayList<>();

    @SerializedName("plots")
    private List<PlotConfig> plots = new ArrayList<>();

    public List<Double> getLevels() {
        return levels == null ? List.of() : levels;
    }

    public List<PlotConfig> getPlots() {
        return plots == null ? List.of() : plots;
    }
}
