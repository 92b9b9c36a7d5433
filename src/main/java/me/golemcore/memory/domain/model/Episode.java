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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Timestamped record of something the operator observed or did.
 *
 * <p>
 * The payload is immutable once written. Pruning drops the payload but keeps
 * the id, timestamp and content hash so that beliefs can still show where their
 * evidence came from.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Episode {

    public enum Kind {
        ACTION, OBSERVATION, PERCEPTION, SYSTEM
    }

    public enum PrivacyLevel {
        PUBLIC, INTERNAL, RESTRICTED
    }

    private long id;
    private Instant timestamp;
    private Kind kind;
    private EpisodePayload payload;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    @Builder.Default
    private PrivacyLevel privacyLevel = PrivacyLevel.INTERNAL;

    private double initialSalience;
    private double salience;
    private String contentHash;
    private boolean pruned;
    private Instant prunedAt;
    private Instant createdAt;
    private Instant updatedAt;

    @JsonIgnore
    public String getText() {
        return payload != null ? payload.getText() : null;
    }

    public Episode copy() {
        return Episode.builder()
                .id(id)
                .timestamp(timestamp)
                .kind(kind)
                .payload(payload != null ? payload.copy() : null)
                .tags(tags != null ? new ArrayList<>(tags) : new ArrayList<>())
                .privacyLevel(privacyLevel)
                .initialSalience(initialSalience)
                .salience(salience)
                .contentHash(contentHash)
                .pruned(pruned)
                .prunedAt(prunedAt)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .build();
    }
}
