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

import lombok.Getter;

import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Working copies and change tracking for one consolidation run. Nothing here
 * is visible to readers until the batch built from it commits.
 */
@Getter
public class ConsolidationWorkspace {

    private final Instant now;
    private final Map<Long, Belief> beliefs = new TreeMap<>();
    private final Map<Long, Skill> skills = new TreeMap<>();
    private final Map<Long, Hypothesis> hypotheses = new TreeMap<>();

    private final Set<Long> createdBeliefIds = new LinkedHashSet<>();
    private final Set<Long> corroboratedBeliefIds = new LinkedHashSet<>();
    private final Set<Long> disputedBeliefIds = new LinkedHashSet<>();
    private final Set<Long> retractedBeliefIds = new LinkedHashSet<>();
    private final Set<Long> confirmedBeliefIds = new LinkedHashSet<>();
    private final Set<Long> updatedSkillIds = new LinkedHashSet<>();
    private final Set<Long> promotedHypothesisIds = new LinkedHashSet<>();

    public ConsolidationWorkspace(Instant now, List<Belief> beliefs, List<Skill> skills,
            List<Hypothesis> hypotheses) {
        this.now = now;
        beliefs.forEach(belief -> this.beliefs.put(belief.getId(), belief.copy()));
        skills.forEach(skill -> this.skills.put(skill.getId(), skill.copy()));
        hypotheses.forEach(hypothesis -> this.hypotheses.put(hypothesis.getId(), hypothesis.copy()));
    }

    /**
     * Beliefs created or corroborated in this run.
     */
    public Set<Long> getTouchedBeliefIds() {
        Set<Long> touched = new LinkedHashSet<>(createdBeliefIds);
        touched.addAll(corroboratedBeliefIds);
        return touched;
    }

    public List<Belief> liveBeliefs() {
        return beliefs.values().stream()
                .filter(Belief::isLive)
                .sorted(Comparator.comparingLong(Belief::getId))
                .toList();
    }
}
