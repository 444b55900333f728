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

import io.numcmc.posterior.region.CredibleRegion;
import io.numcmc.posterior.region.RegionScope;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/// Credible regions of one plot, per scope and in level order.
///
/// @param plotName the plot's name
/// @param levels the requested levels
/// @param byScope regions per scope; COMBINED always, NORMAL/INVERTED for each
///     ordering with in-range weight when separated, JOINT when requested
public record PlotRegions(String plotName, List<Double> levels, Map<RegionScope, List<CredibleRegion>> byScope) {

    public PlotRegions {
        levels = List.copyOf(levels);
        Map<RegionScope, List<CredibleRegion>> copy = new EnumMap<>(RegionScope.class);
        byScope.forEach((scope, regions) -> copy.put(scope, List.copyOf(regions)));
        byScope = Collections.unmodifiableMap(copy);
    }

    /// Returns the regions of a scope, or an empty list if it was not built.
    public List<CredibleRegion> get(RegionScope scope) {
        return byScope.getOrDefault(scope, List.of());
    }
}
