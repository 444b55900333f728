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

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.internal.Streams;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.HashMap;
import java.util.Map;

/**
 * GSON TypeAdapterFactory for polymorphic {@link PriorModel} serialization.
 *
 * <pre>{@code
 *  SERIALIZE                              DESERIALIZE
 *  ─────────                              ───────────
 *  GaussianPrior                          { "family": "Gaussian", ... }
 *        │                                         │
 *        ▼                                         ▼
 *  1. Get @PriorFamily("Gaussian")        1. Read "family" field
 *  2. Serialize family fields             2. Lookup registered class
 *  3. Add "family" field first            3. Deserialize with delegate
 *        │                                4. Re-validate parameters
 *        ▼                                         │
 *  { "family": "Gaussian",                         ▼
 *    "mean": 0.55, "sigma": 0.01 }         GaussianPrior
 * }</pre>
 *
 * <p>Gson materializes objects without running their constructors, so every model read
 * is passed through {@link PriorModel#validate()}; malformed JSON parameters fail with
 * {@link InvalidPriorParametersException} exactly as malformed text does.
 *
 * @see PriorFamily
 */
public final class PriorModelTypeAdapterFactory implements TypeAdapterFactory {

    private static final String FAMILY_FIELD = "family";

    private final Map<String, Class<? extends PriorModel>> familyToClass = new HashMap<>();
    private final Map<Class<? extends PriorModel>, String> classToFamily = new HashMap<>();

    private PriorModelTypeAdapterFactory() {
    }

    /**
     * Creates a new factory with all prior families registered.
     *
     * @return a configured factory
     */
    public static PriorModelTypeAdapterFactory create() {
        PriorModelTypeAdapterFactory factory = new PriorModelTypeAdapterFactory();
        factory.registerType(UniformPrior.class);
        factory.registerType(GaussianPrior.class);
        factory.registerType(BimodalGaussianPrior.class);
        factory.registerType(StepPrior.class);
        return factory;
    }

    /**
     * Registers a PriorModel implementation.
     *
     * @param modelClass the model class, annotated with {@link PriorFamily}
     * @throws IllegalArgumentException if the annotation is missing or the family is already registered
     */
    public void registerType(Class<? extends PriorModel> modelClass) {
        PriorFamily annotation = modelClass.getAnnotation(PriorFamily.class);
        if (annotation == null) {
            throw new IllegalArgumentException("Class " + modelClass.getName() + " has no @PriorFamily annotation");
        }
        String family = annotation.value();
        if (familyToClass.containsKey(family)) {
            throw new IllegalArgumentException(
                "Family '" + family + "' is already registered to " + familyToClass.get(family).getName());
        }
        familyToClass.put(family, modelClass);
        classToFamily.put(modelClass, family);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> TypeAdapter<T> create(Gson gson, TypeToken<T> type) {
        if (!PriorModel.class.isAssignableFrom(type.getRawType())) {
            return null;
        }

        return new TypeAdapter<T>() {
            @Override
            public void write(JsonWriter out, T value) throws IOException {
                if (value == null) {
                    out.nullValue();
                    return;
                }

                PriorModel model = (PriorModel) value;
                String family = classToFamily.get(value.getClass());
                if (family == null) {
                    family = model.getFamily();
                }

                TypeAdapter<T> concreteDelegate = (TypeAdapter<T>) gson.getDelegateAdapter(
                    PriorModelTypeAdapterFactory.this,
                    TypeToken.get(value.getClass())
                );

                // Unbounded uniform priors carry infinite bounds
                StringWriter stringWriter = new StringWriter();
                JsonWriter lenientWriter = new JsonWriter(stringWriter);
                lenientWriter.setLenient(true);
                concreteDelegate.write(lenientWriter, value);
                lenientWriter.close();

                JsonObject fields = JsonParser.parseString(stringWriter.toString()).getAsJsonObject();
                JsonObject result = new JsonObject();
                result.addProperty(FAMILY_FIELD, family);
                for (Map.Entry<String, JsonElement> entry : fields.entrySet()) {
                    if (!FAMILY_FIELD.equals(entry.getKey())) {
                        result.add(entry.getKey(), entry.getValue());
                    }
                }

                boolean wasLenient = out.isLenient();
                out.setLenient(true);
                try {
                    Streams.write(result, out);
                } finally {
                    out.setLenient(wasLenient);
                }
            }

            @Override
            public T read(JsonReader in) throws IOException {
                JsonElement element = JsonParser.parseReader(in);
                if (element.isJsonNull()) {
                    return null;
                }

                JsonObject obj = element.getAsJsonObject();
                if (!obj.has(FAMILY_FIELD)) {
                    throw new IllegalArgumentException("Missing '" + FAMILY_FIELD + "' field in JSON: " + obj);
                }

                String family = obj.get(FAMILY_FIELD).getAsString();
                Class<? extends PriorModel> targetClass = familyToClass.get(family);
                if (targetClass == null) {
                    throw new IllegalArgumentException(
                        "Unknown prior family: '" + family + "'. Known families: " + familyToClass.keySet());
                }

                TypeAdapter<? extends PriorModel> targetAdapter =
                    gson.getDelegateAdapter(PriorModelTypeAdapterFactory.this, TypeToken.get(targetClass));

                JsonReader lenientReader = new JsonReader(new StringReader(obj.toString()));
                lenientReader.setLenient(true);
                PriorModel model = targetAdapter.read(lenientReader);
                model.validate();
                return (T) model;
            }
        };
    }

    /**
     * Returns the family tag registered for a model class.
     *
     * @param modelClass the model class
     * @return the family tag, or null if not registered
     */
    public String getFamily(Class<? extends PriorModel> modelClass) {
        return classToFamily.get(modelClass);
    }
}
