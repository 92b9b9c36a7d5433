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

import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.exception.ValidationFailureException;
import me.golemcore.memory.domain.model.Belief;
import me.golemcore.memory.domain.model.Episode;
import me.golemcore.memory.domain.model.Goal;
import me.golemcore.memory.domain.model.Hypothesis;
import me.golemcore.memory.domain.model.MemoryEntityType;
import me.golemcore.memory.domain.model.MemoryQuery;
import me.golemcore.memory.domain.model.MemoryRef;
import me.golemcore.memory.domain.model.ScoredMemory;
import me.golemcore.memory.domain.model.SelfModelEntry;
import me.golemcore.memory.domain.model.Skill;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.EmbeddingPort;
import me.golemcore.memory.port.outbound.MemoryStorePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Retrieves and ranks memories across every relation for a query.
 *
 * <p>
 * Each candidate is scored from lexical overlap, recency, confidence and,
 * when both sides have vectors, embedding similarity. Without a vector term
 * the remaining weights are renormalized. An active goal adds a flat boost to
 * candidates that share vocabulary with it. Reads only.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MemoryRetrievalService {

    private static final double NEUTRAL_LEXICAL = 0.20;
    private static final double NEUTRAL_RECENCY = 0.30;
    private static final double GOAL_CONFIDENCE = 1.0;

    private final MemoryStorePort memoryStore;
    private final EmbeddingPort embeddingPort;
    private final MemoryProperties properties;
    private final Clock clock;

    public List<ScoredMemory> retrieve(MemoryQuery query) {
        MemoryQuery source = query != null ? query : new MemoryQuery();
        int topK = resolveTopK(source.getTopK());
        Set<MemoryEntityType> types = source.getTypes() == null || source.getTypes().isEmpty()
                ? EnumSet.allOf(MemoryEntityType.class)
                : EnumSet.copyOf(source.getTypes());

        Set<String> queryTokens = MemoryTextSupport.tokenize(source.getQueryText());
        float[] queryVector = resolveQueryVector(source);
        Set<String> goalTokens = resolveGoalTokens(source.getActiveGoalId());
        Instant now = clock.instant();

        List<ScoredMemory> scored = new ArrayList<>();
        for (Candidate candidate : loadCandidates(types)) {
            scored.add(ScoredMemory.builder()
                    .ref(candidate.ref())
                    .text(candidate.text())
                    .score(score(candidate, queryTokens, queryVector, goalTokens, now))
                    .updatedAt(candidate.updatedAt())
                    .build());
        }

        scored.sort(Comparator
                .comparingDouble(ScoredMemory::getScore)
                .reversed()
                .thenComparing(ScoredMemory::getUpdatedAt, Comparator.nullsLast(Comparator.reverseOrder()))
                .thenComparingLong((ScoredMemory item) -> item.getRef().id())
                .thenComparing(item -> item.getRef().key() != null ? item.getRef().key() : ""));

        List<ScoredMemory> result = scored.size() > topK ? new ArrayList<>(scored.subList(0, topK)) : scored;
        log.debug("[MemoryRetrieval] {} candidate(s), returning {}", scored.size(), result.size());
        return result;
    }

    private int resolveTopK(Integer requested) {
        if (requested == null) {
            return Math.max(1, properties.getRetrieval().getDefaultTopK());
        }
        if (requested <= 0) {
            throw new ValidationFailureException("topK must be positive: " + requested);
        }
        return requested;
    }

    private float[] resolveQueryVector(MemoryQuery query) {
        if (query.getQueryVector() != null) {
            return query.getQueryVector();
        }
        if (query.getQueryText() == null || query.getQueryText().isBlank() || !embeddingPort.isAvailable()) {
            return null;
        }
        try {
            return embeddingPort.embed(query.getQueryText()).join();
        } catch (RuntimeException e) {
            log.warn("[MemoryRetrieval] Query embedding failed, ranking without vectors: {}", e.getMessage());
            return null;
        }
    }

    private Set<String> resolveGoalTokens(Long activeGoalId) {
        if (activeGoalId == null) {
            return Set.of();
        }
        return memoryStore.getGoal(activeGoalId)
                .filter(goal -> !goal.isTerminal())
                .map(goal -> MemoryTextSupport.tokenize(goal.getDescription()))
                .orElse(Set.of());
    }

    private List<Candidate> loadCandidates(Set<MemoryEntityType> types) {
        List<Candidate> candidates = new ArrayList<>();
        if (types.contains(MemoryEntityType.EPISODE)) {
            for (Episode episode : memoryStore.listEpisodes()) {
                if (episode.isPruned() || episode.getPayload() == null) {
                    continue;
                }
                candidates.add(Candidate.builder()
                        .ref(MemoryRef.of(MemoryEntityType.EPISODE, episode.getId()))
                        .text(episode.getText())
                        .confidence(clamp(episode.getSalience()))
                        .updatedAt(episode.getTimestamp())
                        .build());
            }
        }
        if (types.contains(MemoryEntityType.BELIEF)) {
            for (Belief belief : memoryStore.listBeliefs()) {
                if (belief.getStatus() == Belief.Status.ARCHIVED) {
                    continue;
                }
                candidates.add(Candidate.builder()
                        .ref(MemoryRef.of(MemoryEntityType.BELIEF, belief.getId()))
                        .text(belief.getStatement())
                        .confidence(clamp(belief.getConfidence()))
                        .embedding(belief.getEmbedding())
                        .updatedAt(belief.getUpdatedAt())
                        .build());
            }
        }
        if (types.contains(MemoryEntityType.SKILL)) {
            for (Skill skill : memoryStore.listSkills()) {
                candidates.add(Candidate.builder()
                        .ref(MemoryRef.of(MemoryEntityType.SKILL, skill.getId()))
                        .text(skill.getName() + " " + String.join(" ", skill.getSteps()))
                        .confidence(clamp(skill.getSuccessRate()))
                        .updatedAt(skill.getUpdatedAt())
                        .build());
            }
        }
        if (types.contains(MemoryEntityType.SELF_MODEL)) {
            for (SelfModelEntry entry : memoryStore.listSelfModel()) {
                candidates.add(Candidate.builder()
                        .ref(MemoryRef.ofKey(MemoryEntityType.SELF_MODEL, entry.getCapability()))
                        .text(entry.getCapability() + " " + String.join(" ", entry.getLimitations()))
                        .confidence(clamp(entry.getReliabilityScore()))
                        .updatedAt(entry.getUpdatedAt())
                        .build());
            }
        }
        if (types.contains(MemoryEntityType.HYPOTHESIS)) {
            for (Hypothesis hypothesis : memoryStore.listHypotheses()) {
                candidates.add(Candidate.builder()
                        .ref(MemoryRef.of(MemoryEntityType.HYPOTHESIS, hypothesis.getId()))
                        .text(hypothesis.getClaim())
                        .confidence(clamp(hypothesis.getConfidence()))
                        .updatedAt(hypothesis.getUpdatedAt())
                        .build());
            }
        }
        if (types.contains(MemoryEntityType.GOAL)) {
            for (Goal goal : memoryStore.listGoals()) {
                candidates.add(Candidate.builder()
                        .ref(MemoryRef.of(MemoryEntityType.GOAL, goal.getId()))
                        .text(goal.getDescription())
                        .confidence(GOAL_CONFIDENCE)
                        .updatedAt(goal.getUpdatedAt())
                        .build());
            }
        }
        return candidates;
    }

    private double score(Candidate candidate, Set<String> queryTokens, float[] queryVector, Set<String> goalTokens,
            Instant now) {
        MemoryProperties.RetrievalProperties config = properties.getRetrieval();
        double lexical = queryTokens.isEmpty()
                ? NEUTRAL_LEXICAL
                : MemoryTextSupport.overlapShare(queryTokens, candidate.text());
        double recency = recencyScore(candidate.updatedAt(), now);

        double weighted = lexical * config.getLexicalWeight()
                + recency * config.getRecencyWeight()
                + candidate.confidence() * config.getConfidenceWeight();
        double totalWeight = config.getLexicalWeight() + config.getRecencyWeight() + config.getConfidenceWeight();

        if (queryVector != null && candidate.embedding() != null
                && queryVector.length == candidate.embedding().length) {
            double cosine = embeddingPort.cosineSimilarity(queryVector, candidate.embedding());
            weighted += ((cosine + 1.0) / 2.0) * config.getVectorWeight();
            totalWeight += config.getVectorWeight();
        }

        double score = totalWeight > 0.0 ? weighted / totalWeight : 0.0;
        if (!goalTokens.isEmpty() && MemoryTextSupport.overlapShare(goalTokens, candidate.text()) > 0.0) {
            score += config.getGoalBoost();
        }
        return score;
    }

    private double recencyScore(Instant updatedAt, Instant now) {
        if (updatedAt == null) {
            return NEUTRAL_RECENCY;
        }
        double halfLifeHours = properties.getRetrieval().getRecencyHalfLifeHours();
        double ageHours = Math.max(0L, Duration.between(updatedAt, now).getSeconds()) / 3600.0;
        if (halfLifeHours <= 0.0) {
            return ageHours == 0.0 ? 1.0 : 0.0;
        }
        return Math.pow(0.5, ageHours / halfLifeHours);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    @Builder
    private record Candidate(MemoryRef ref, String text, double confidence, float[] embedding, Instant updatedAt) {
    }
}
