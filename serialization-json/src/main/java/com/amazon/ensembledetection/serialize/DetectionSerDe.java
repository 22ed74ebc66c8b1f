/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.ensembledetection.serialize;

import lombok.Getter;

import com.amazon.ensembledetection.orchestration.DataProfile;
import com.amazon.ensembledetection.orchestration.DetectionRequest;
import com.amazon.ensembledetection.orchestration.DetectionResult;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * JSON serialization of detection requests, results and data profiles. The
 * {@link DetectionStateMapper} converts between model objects and state
 * objects, and <a href="https://github.com/google/gson">Gson</a> writes and
 * reads the state objects. The Gson instance is exposed so callers can
 * customize the output (e.g., by enabling pretty printing).
 */
@Getter
public class DetectionSerDe {

    private final DetectionStateMapper mapper;

    private final Gson gson;

    /**
     * Uses a Gson instance that writes NaN and infinite scores instead of
     * rejecting them.
     */
    public DetectionSerDe() {
        this(new DetectionStateMapper(), new GsonBuilder().serializeSpecialFloatingPointValues().create());
    }

    /**
     * @param mapper converts model objects to state objects and back
     * @param gson   writes and reads the state objects
     */
    public DetectionSerDe(DetectionStateMapper mapper, Gson gson) {
        this.mapper = mapper;
        this.gson = gson;
    }

    public String toJson(DetectionRequest request) {
        return gson.toJson(mapper.toState(request));
    }

    public String toJson(DetectionResult result) {
        return gson.toJson(mapper.toState(result));
    }

    public String toJson(DataProfile profile) {
        return gson.toJson(mapper.toState(profile));
    }

    /**
     * Reads a request. Payload numbers are read as doubles and payload objects
     * as string keyed maps, which the orchestrator interprets when the request
     * is detected.
     *
     * @param json a JSON object in the shape of {@link DetectionRequestState}
     * @return the request
     * @throws com.google.gson.JsonSyntaxException if the text is not valid JSON
     *                                             for a request
     * @throws IllegalArgumentException            if a field holds an invalid
     *                                             value
     */
    public DetectionRequest requestFromJson(String json) {
        DetectionRequestState state = gson.fromJson(json, DetectionRequestState.class);
        if (state == null) {
            throw new IllegalArgumentException("empty request document");
        }
        return mapper.toModel(state);
    }

    /**
     * Reads a result written by {@link #toJson(DetectionResult)} into its state
     * form. Results are not turned back into model objects.
     */
    public DetectionResultState resultFromJson(String json) {
        return gson.fromJson(json, DetectionResultState.class);
    }
}
