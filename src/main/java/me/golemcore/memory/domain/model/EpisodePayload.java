/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.memory.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Content of an episode: free text plus optional structured fields.
 *
 * <p>
 * Well-known fields drive skill bookkeeping during consolidation:
 * {@link #FIELD_SKILL}, {@link #FIELD_OUTCOME}, {@link #FIELD_FAILURE_MODE},
 * {@link #FIELD_STEPS} and {@link #FIELD_PRECONDITIONS}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EpisodePayload {

    public static final String FIELD_SKILL = "skill";
    public static final String FIELD_OUTCOME = "outcome";
    public static final String FIELD_FAILURE_MODE = "failure_mode";
    public static final String FIELD_STEPS = "steps";
    public static final String FIELD_PRECONDITIONS = "preconditions";

    public static final String OUTCOME_SUCCESS = "success";
    public static final String OUTCOME_FAILURE = "failure";

    private String text;

    @Builder.Default
    private Map<String, String> fields = new LinkedHashMap<>();

    /**
     * Marks the payload as verified ground truth. Beliefs mined from a verified
     * payload may carry full confidence.
     */
    private boolean verified;

    public static EpisodePayload ofText(String text) {
        return EpisodePayload.builder().text(text).build();
    }

    public String field(String name) {
        return fields != null ? fields.get(name) : null;
    }

    public EpisodePayload copy() {
        return EpisodePayload.builder()
                .text(text)
                .fields(fields != null ? new LinkedHashMap<>(fields) : new LinkedHashMap<>())
                .verified(verified)
                .build();
    }
}
