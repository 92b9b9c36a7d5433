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
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Semantic claim with a confidence and a dispute-aware lifecycle.
 *
 * <p>
 * Conflict links and evidence are identifier sets resolved through the store,
 * never object references, so cyclic conflict graphs need no cleanup.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Belief {

    public enum Status {
        PROPOSED, CONFIRMED, DISPUTED, RETRACTED, ARCHIVED
    }

    public enum Polarity {
        POSITIVE, NEGATIVE;

        public Polarity opposite() {
            return this == POSITIVE ? NEGATIVE : POSITIVE;
        }
    }

    private long id;
    private String statement;

    /**
     * Normalized topic the statement is about, e.g. {@code lo-fi music}.
     */
    private String subject;

    /**
     * Normalized relation to the subject, e.g. {@code likes}.
     */
    private String stance;

    @Builder.Default
    private Polarity polarity = Polarity.POSITIVE;

    private double confidence;

    @Builder.Default
    private Status status = Status.PROPOSED;

    @Builder.Default
    private Set<Long> evidenceIds = new LinkedHashSet<>();

    @Builder.Default
    private Set<Long> conflictsWithIds = new LinkedHashSet<>();

    private boolean verified;
    private String scope;
    private float[] embedding;
    private Instant lastConfirmedAt;
    private Instant lastDecayedAt;
    private Instant createdAt;
    private Instant updatedAt;

    /**
     * Whether this belief still takes part in conflicts and ranking.
     */
    @JsonIgnore
    public boolean isLive() {
        return status != Status.RETRACTED && status != Status.ARCHIVED;
    }

    public Belief copy() {
        return Belief.builder()
                .id(id)
                .statement(statement)
                .subject(subject)
                .stance(stance)
                .polarity(polarity)
                .confidence(confidence)
                .status(status)
                .evidenceIds(evidenceIds != null ? new LinkedHashSet<>(evidenceIds) : new LinkedHashSet<>())
                .conflictsWithIds(conflictsWithIds != null
                        ? new LinkedHashSet<>(conflictsWithIds)
                        : new LinkedHashSet<>())
                .verified(verified)
                .scope(scope)
                .embedding(embedding != null ? embedding.clone() : null)
                .lastConfirmedAt(lastConfirmedAt)
                .lastDecayedAt(lastDecayedAt)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .build();
    }
}
