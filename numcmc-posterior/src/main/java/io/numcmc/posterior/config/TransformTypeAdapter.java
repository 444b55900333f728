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

import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import io.numcmc.posterior.transform.Transform;

import java.io.IOException;

/// Writes a [Transform] as its catalog tag and reads it back through
/// [Transform#fromTag(String)], so unknown tags fail while the JSON is read.
public final class TransformTypeAdapter extends TypeAdapter<Transform> {

    @Override
    public void write(JsonWriter out, Transform value) throws IOException {
        if (value == null) {
            out.nullValue();
            return;
        }
        out.value(value.tag());
    }

    @Override
    public Transform read(JsonReader in) throws IOException {
        if (in.peek() == JsonToken.NULL) {
            in.nextNull();
            return null;
        }
        return Transform.fromTag(in.nextString());
    }
}
