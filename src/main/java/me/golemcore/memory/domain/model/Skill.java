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

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Procedural memory: a named routine with its observed success rate.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Skill {

    private long id;
    private String name;

    @Builder.Default
    private List<String> preconditions = new ArrayList<>();

    @Builder.Default
    private List<String> steps = new ArrayList<>();

    @Builder.Default
    private Set<String> failureModes = new LinkedHashSet<>();

    private int attempts;
    private int successes;
    private double successRate;

    @Builder.Default
    private List<Double> successRateHistory = new ArrayList<>();

    @Builder.Default
    private Set<Long> evidenceIds = new LinkedHashSet<>();

    private Instant lastUsed;
    private Instant createdAt;
    private Instant updatedAt;

    public Skill copy() {
        return Skill.builder()
                .id(id)
                .name(name)
                .preconditions(preconditions != null ? new ArrayList<>(preconditions) : new ArrayList<>())
                .steps(steps != null ? new ArrayList<>(steps) : new ArrayList<>())
                .failureModes(failureModes != null ? new LinkedHashSet<>(failureModes) : new LinkedHashSet<>())
                .attempts(attempts)
                .successes(successes)
                .successRate(successRate)
                .successRateHistory(successRateHistory != null
                        ? new ArrayList<>(successRateHistory)
                        : new ArrayList<>())
                .evidenceIds(evidenceIds != null ? new LinkedHashSet<>(evidenceIds) : new LinkedHashSet<>())
                .lastUsed(lastUsed)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .build();
    }
}
