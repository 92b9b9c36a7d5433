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

package me.golemcore.memory.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.exception.ValidationFailureException;
import me.golemcore.memory.domain.model.Belief;
import me.golemcore.memory.domain.model.ConsolidationReport;
import me.golemcore.memory.domain.model.ConsolidationState;
import me.golemcore.memory.domain.model.Episode;
import me.golemcore.memory.domain.model.EpisodePayload;
import me.golemcore.memory.domain.model.EvidenceProvenance;
import me.golemcore.memory.domain.model.Goal;
import me.golemcore.memory.domain.model.Hypothesis;
import me.golemcore.memory.domain.model.MemoryQuery;
import me.golemcore.memory.domain.model.ScoredMemory;
import me.golemcore.memory.domain.model.SelfModelEntry;
import me.golemcore.memory.domain.model.Skill;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.MemoryStorePort;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for the control loop: episode ingestion, retrieval, read access
 * to every memory relation, goal and hypothesis management and on-demand
 * consolidation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MemoryService {

    private final MemoryStorePort memoryStore;
    private final MemoryRetrievalService memoryRetrievalService;
    private final ConsolidationService consolidationService;
    private final GoalService goalService;
    private final HypothesisService hypothesisService;
    private final MemoryProperties properties;

    public long appendEpisode(Episode.Kind kind, String text, Map<String, String> fields, Double salience,
            List<String> tags, Episode.PrivacyLevel privacyLevel, boolean verified) {
        if (text == null || text.isBlank()) {
            throw new ValidationFailureException("Episode text is required");
        }
        double resolvedSalience = salience != null ? salience : properties.getForgetting().getDefaultSalience();
        if (Double.isNaN(resolvedSalience) || resolvedSalience < 0.0) {
            throw new ValidationFailureException("Salience must be >= 0: " + resolvedSalience);
        }
        EpisodePayload payload = EpisodePayload.builder()
                .text(text)
                .fields(fields != null ? new LinkedHashMap<>(fields) : new LinkedHashMap<>())
                .verified(verified)
                .build();
        return memoryStore.appendEpisode(kind != null ? kind : Episode.Kind.OBSERVATION, payload, resolvedSalience,
                tags, privacyLevel);
    }

    public List<ScoredMemory> queryMemory(MemoryQuery query) {
        return memoryRetrievalService.retrieve(query);
    }

    public ConsolidationReport consolidate() {
        return consolidationService.consolidate();
    }

    public ConsolidationState getConsolidationState() {
        return consolidationService.getState();
    }

    public long getWatermark() {
        return memoryStore.getWatermark();
    }

    public Optional<Episode> getEpisode(long id) {
        return memoryStore.getEpisode(id);
    }

    public Optional<EvidenceProvenance> getEvidenceProvenance(long episodeId) {
        return memoryStore.getEvidenceProvenance(episodeId);
    }

    public Optional<Belief> getBelief(long id) {
        return memoryStore.getBelief(id);
    }

    public List<Belief> listBeliefs() {
        return memoryStore.listBeliefs();
    }

    public Optional<Skill> getSkill(long id) {
        return memoryStore.getSkill(id);
    }

    public List<Skill> listSkills() {
        return memoryStore.listSkills();
    }

    public Optional<SelfModelEntry> getSelfModelEntry(String capability) {
        return memoryStore.getSelfModelEntry(capability);
    }

    public List<SelfModelEntry> listSelfModel() {
        return memoryStore.listSelfModel();
    }

    public Optional<Goal> getGoal(long id) {
        return memoryStore.getGoal(id);
    }

    public List<Goal> listGoals() {
        return memoryStore.listGoals();
    }

    public Goal createGoal(String description, Integer priority, Instant deadline, List<String> subgoals,
            String completionCriteria) {
        return goalService.createGoal(description, priority, deadline, subgoals, completionCriteria);
    }

    public Goal updateGoalProgress(long goalId, double progress) {
        return goalService.updateGoalProgress(goalId, progress);
    }

    public Goal updateGoalStatus(long goalId, Goal.GoalStatus status) {
        return goalService.updateGoalStatus(goalId, status);
    }

    public Optional<Hypothesis> getHypothesis(long id) {
        return memoryStore.getHypothesis(id);
    }

    public List<Hypothesis> listHypotheses() {
        return memoryStore.listHypotheses();
    }

    public Hypothesis registerHypothesis(String claim, String verificationPlan, double confidence,
            String riskIfWrong, String nextVerificationAction) {
        return hypothesisService.registerHypothesis(claim, verificationPlan, confidence, riskIfWrong,
                nextVerificationAction);
    }

    public Hypothesis resolveHypothesis(long hypothesisId, boolean verified, String evidence) {
        return hypothesisService.resolveHypothesis(hypothesisId, verified, evidence);
    }
}
