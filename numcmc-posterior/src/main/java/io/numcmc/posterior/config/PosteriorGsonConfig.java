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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import io.numcmc.posterior.plot.ChainMetadata;
import io.numcmc.posterior.prior.PriorModelTypeAdapterFactory;
import io.numcmc.posterior.transform.Transform;

import java.io.Reader;

/// Centralized Gson configuration for posterior inputs and results.
///
/// ## Purpose
///
/// Provides a configured [Gson] instance for:
///
/// - [io.numcmc.posterior.prior.PriorModel] implementations (polymorphic on `family`)
/// - [Transform] tags
/// - chain metadata and plot definitions ([ChainMetadataConfig], [PlotsConfig])
/// - densities and credible regions in result files
///
/// ## Usage
///
/// ```java
/// Gson gson = PosteriorGsonConfig.gson();
///
/// String json = gson.toJson(new GaussianPrior(0.55, 0.01), PriorModel.class);
/// // {"family":"Gaussian","mean":0.55,"sigma":0.01}
///
/// PriorModel restored = gson.fromJson(json, PriorModel.class);
/// ```
///
/// ## Configuration
///
/// | Feature | Setting | Purpose |
/// |---------|---------|---------|
/// | Pretty printing | Enabled | Readable result files |
/// | Serialize nulls | Disabled | Compact output |
/// | HTML escaping | Disabled | Keeps `<` and `=` in expressions |
/// | Special float values | Enabled | Unbounded priors and saturated thresholds |
/// | PriorModel adapter | Registered | Polymorphic prior families |
/// | Transform adapter | Registered | Tags instead of enum constant names |
///
/// ## Thread Safety
///
/// The [Gson] instance is thread-safe and can be shared across threads.
public final class PosteriorGsonConfig {

    private static final Gson INSTANCE = builder().create();

    private PosteriorGsonConfig() {
    }

    /// Returns the shared, pretty-printing Gson instance.
    public static Gson gson() {
        return INSTANCE;
    }

    /// Creates a new GsonBuilder with the posterior defaults.
    ///
    /// @return a builder with all posterior type adapters registered
    public static GsonBuilder builder() {
        return compactBuilder().setPrettyPrinting();
    }

    /// Creates a compact (single-line) Gson instance.
    public static Gson compactGson() {
        return compactBuilder().create();
    }

    private static GsonBuilder compactBuilder() {
        return new GsonBuilder()
            .disableHtmlEscaping()
            .serializeSpecialFloatingPointValues()
            .registerTypeAdapterFactory(PriorModelTypeAdapterFactory.create())
            .registerTypeAdapter(Transform.class, new TransformTypeAdapter());
    }

    /// Reads chain metadata.
    ///
    /// @param reader JSON in the [ChainMetadataConfig] layout
    /// @return the metadata
    /// @throws JsonParseException on malformed JSON
    /// @throws IllegalArgumentException on invalid priors or constraints
    public static ChainMetadata readMetadata(Reader reader) {
        ChainMetadataConfig config = INSTANCE.fromJson(reader, ChainMetadataConfig.class);
        if (config == null) {
            throw new JsonParseException("Chain metadata is empty");
        }
        return config.toMetadata();
    }

    /// Reads plot definitions.
    ///
    /// @param reader JSON in the [PlotsConfig] layout
    /// @return the parsed configuration; definitions are built against a registry later
    /// @throws JsonParseException on malformed JSON
    public static PlotsConfig readPlots(Reader reader) {
        PlotsConfig config = INSTANCE.fromJson(reader, PlotsConfig.class);
        if (config == null || config.getPlots().isEmpty()) {
            throw new JsonParseException("Plot configuration defines no plots");
        }
        return config;
    }
}
