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

import java.util.Collection;
import java.util.List;

/// Thrown when a prior names a coordinate transform that is not in the [Transform] catalog.
public class UnsupportedTransformException extends IllegalArgumentException {

    private final String requestedTag;
    private final List<String> supportedTags;

    public UnsupportedTransformException(String requestedTag, Collection<String> supportedTags) {
        super("Unsupported transform '" + requestedTag + "'. Supported transforms: " + supportedTags);
        this.requestedTag = requestedTag;
        this.supportedTags = List.copyOf(supportedTags);
    }

    public String getRequestedTag() {
        return requestedTag;
    }

    public List<String> getSupportedTags() {
        return supportedTags;
    }
}
