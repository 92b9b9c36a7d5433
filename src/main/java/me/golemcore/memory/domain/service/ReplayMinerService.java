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
import me.golemcore.memory.domain.model.Belief;
import me.golemcore.memory.domain.model.BeliefCandidate;
import me.golemcore.memory.domain.model.ConsolidationWorkspace;
import me.golemcore.memory.domain.model.Episode;
import me.golemcore.memory.domain.model.EpisodePayload;
import me.golemcore.memory.domain.model.Hypothesis;
import me.golemcore.memory.domain.model.MemoryEntityType;
import me.golemcore.memory.domain.model.Skill;
import me.golemcore.memory.domain.model.SkillOutcome;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.BeliefExtractionPort;
import me.golemcore.memory.port.outbound.MemoryStorePort;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Replays a window of episodes into belief, skill and hypothesis updates on a
 * {@link ConsolidationWorkspace}.
 *
 * <p>
 * A candidate matching a live belief on subject, stance family and effective
 * polarity corroborates it asymptotically instead of creating a duplicate. An
 * episode already cited by the matched belief or skill is not counted twice,
 * which keeps a replay of the same window a no-op.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReplayMinerService {

    private static final int EXTRACTION_CHUNK_SIZE = 25;
    private static final String LIST_SEPARATOR = "\\s*[;\\n]\\s*";

    private final MemoryStorePort memoryStore;
    private final BeliefExtractionPort beliefExtractionPort;
    private final HeuristicBeliefExtractor heuristicBeliefExtractor;
    private final MemoryProperties properties;

    public void mine(List<Episode> window, ConsolidationWorkspace workspace) {
        List<Episode> replayable = window.stream()
                .filter(episode -> !episode.isPruned() && episode.getPayload() != null)
                .toList();

        for (BeliefCandidate candidate : extractCandidates(replayable)) {
            applyCandidate(candidate, workspace);
        }
        for (Episode episode : replayable) {
            toSkillOutcome(episode).ifPresent(outcome -> applySkillOutcome(outcome, workspace));
        }
        promoteHypotheses(workspace);

        log.debug("[ReplayMiner] Mined {} episode(s): created={}, corroborated={}, skills={}",
                replayable.size(), workspace.getCreatedBeliefIds().size(),
                workspace.getCorroboratedBeliefIds().size(), workspace.getUpdatedSkillIds().size());
    }

    /**
     * Recurring tags over the window, most frequent first.
     */
    public Map<String, Integer> countRecurringTags(List<Episode> window) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Episode episode : window) {
            if (episode.getTags() == null) {
                continue;
            }
            for (String tag : new LinkedHashSet<>(episode.getTags())) {
                counts.merge(tag, 1, Integer::sum);
            }
        }
        Map<String, Integer> recurring = new LinkedHashMap<>();
        counts.entrySet().stream()
                .filter(entry -> entry.getValue() >= 2)
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .forEach(entry -> recurring.put(entry.getKey(), entry.getValue()));
        return recurring;
    }

    private List<BeliefCandidate> extractCandidates(List<Episode> episodes) {
        if (episodes.isEmpty()) {
            return List.of();
        }
        if (!beliefExtractionPort.isAvailable()) {
            return heuristicBeliefExtractor.extract(episodes);
        }

        List<BeliefCandidate> candidates = new ArrayList<>();
        for (int start = 0; start < episodes.size(); start += EXTRACTION_CHUNK_SIZE) {
            List<Episode> chunk = episodes.subList(start, Math.min(episodes.size(), start + EXTRACTION_CHUNK_SIZE));
            Optional<List<BeliefCandidate>> extracted = beliefExtractionPort.extract(chunk);
            if (extracted.isPresent()) {
                candidates.addAll(extracted.get());
            } else {
                log.warn("[ReplayMiner] Unparseable extraction answer, using heuristics for {} episode(s)",
                        chunk.size());
                candidates.addAll(heuristicBeliefExtractor.extract(chunk));
            }
        }
        return candidates;
    }

    private void applyCandidate(BeliefCandidate candidate, ConsolidationWorkspace workspace) {
        if (candidate.getStatement() == null || candidate.getStatement().isBlank()
                || candidate.getSubject() == null || candidate.getSubject().isBlank()) {
            return;
        }
        MemoryProperties.ConsolidationProperties config = properties.getConsolidation();
        String subject = MemoryTextSupport.normalizeSubject(candidate.getSubject());
        MemoryTextSupport.StanceKey key = MemoryTextSupport.normalizeStance(candidate.getStance(),
                candidate.getPolarity());
        Instant now = workspace.getNow();

        Optional<Belief> match = findMatching(workspace, subject, key);
        if (match.isPresent()) {
            Belief belief = match.get();
            if (belief.getEvidenceIds().contains(candidate.getEvidenceEpisodeId())) {
                return;
            }
            boolean verified = belief.isVerified() || candidate.isVerified();
            double cap = verified ? 1.0 : config.getMaxReplayConfidence();
            double old = belief.getConfidence();
            belief.setConfidence(Math.min(cap, Math.max(old, old + (1.0 - old) * config.getCorroborationGain())));
            belief.getEvidenceIds().add(candidate.getEvidenceEpisodeId());
            belief.setVerified(verified);
            belief.setUpdatedAt(now);
            if (!workspace.getCreatedBeliefIds().contains(belief.getId())) {
                workspace.getCorroboratedBeliefIds().add(belief.getId());
            }
            return;
        }

        double confidence = candidate.getConfidence() > 0.0 ? candidate.getConfidence()
                : config.getInitialConfidence();
        if (!candidate.isVerified()) {
            confidence = Math.min(confidence, config.getMaxReplayConfidence());
        }
        Belief belief = Belief.builder()
                .id(memoryStore.nextId(MemoryEntityType.BELIEF))
                .statement(candidate.getStatement().trim())
                .subject(subject)
                .stance(candidate.getStance() != null
                        ? candidate.getStance().trim().toLowerCase(Locale.ROOT)
                        : "is")
                .polarity(candidate.getPolarity() != null ? candidate.getPolarity() : Belief.Polarity.POSITIVE)
                .confidence(Math.max(0.0, Math.min(1.0, confidence)))
                .verified(candidate.isVerified())
                .scope(candidate.getScope() != null ? candidate.getScope() : config.getDefaultScope())
                .createdAt(now)
                .updatedAt(now)
                .build();
        belief.getEvidenceIds().add(candidate.getEvidenceEpisodeId());
        workspace.getBeliefs().put(belief.getId(), belief);
        workspace.getCreatedBeliefIds().add(belief.getId());
    }

    private Optional<Belief> findMatching(ConsolidationWorkspace workspace, String subject,
            MemoryTextSupport.StanceKey key) {
        return workspace.liveBeliefs().stream()
                .filter(belief -> subject.equals(MemoryTextSupport.normalizeSubject(belief.getSubject())))
                .filter(belief -> key.equals(MemoryTextSupport.normalizeStance(belief.getStance(),
                        belief.getPolarity())))
                .findFirst();
    }

    private Optional<SkillOutcome> toSkillOutcome(Episode episode) {
        EpisodePayload payload = episode.getPayload();
        String skillName = payload.field(EpisodePayload.FIELD_SKILL);
        String outcome = payload.field(EpisodePayload.FIELD_OUTCOME);
        if (skillName == null || skillName.isBlank() || outcome == null) {
            return Optional.empty();
        }
        boolean success;
        if (EpisodePayload.OUTCOME_SUCCESS.equalsIgnoreCase(outcome.trim())) {
            success = true;
        } else if (EpisodePayload.OUTCOME_FAILURE.equalsIgnoreCase(outcome.trim())) {
            success = false;
        } else {
            log.debug("[ReplayMiner] Ignoring unknown outcome '{}' in episode {}", outcome, episode.getId());
            return Optional.empty();
        }
        return Optional.of(new SkillOutcome(
                skillName.trim(),
                success,
                payload.field(EpisodePayload.FIELD_FAILURE_MODE),
                splitList(payload.field(EpisodePayload.FIELD_STEPS)),
                splitList(payload.field(EpisodePayload.FIELD_PRECONDITIONS)),
                episode.getId(),
                episode.getTimestamp()));
    }

    private void applySkillOutcome(SkillOutcome outcome, ConsolidationWorkspace workspace) {
        Instant now = workspace.getNow();
        Skill skill = workspace.getSkills().values().stream()
                .filter(existing -> outcome.skillName().equalsIgnoreCase(existing.getName()))
                .findFirst()
                .orElseGet(() -> {
                    Skill created = Skill.builder()
                            .id(memoryStore.nextId(MemoryEntityType.SKILL))
                            .name(outcome.skillName())
                            .createdAt(now)
                            .build();
                    workspace.getSkills().put(created.getId(), created);
                    return created;
                });
        if (skill.getEvidenceIds().contains(outcome.episodeId())) {
            return;
        }

        skill.setAttempts(skill.getAttempts() + 1);
        if (outcome.success()) {
            skill.setSuccesses(skill.getSuccesses() + 1);
        }
        double rate = (double) skill.getSuccesses() / (double) skill.getAttempts();
        skill.setSuccessRate(rate);
        skill.getSuccessRateHistory().add(rate);
        int historySize = Math.max(1, properties.getConsolidation().getSuccessRateHistorySize());
        while (skill.getSuccessRateHistory().size() > historySize) {
            skill.getSuccessRateHistory().remove(0);
        }
        if (!outcome.success() && outcome.failureMode() != null && !outcome.failureMode().isBlank()) {
            skill.getFailureModes().add(outcome.failureMode().trim());
        }
        if (!outcome.steps().isEmpty()) {
            skill.setSteps(new ArrayList<>(outcome.steps()));
        }
        if (!outcome.preconditions().isEmpty()) {
            skill.setPreconditions(new ArrayList<>(outcome.preconditions()));
        }
        skill.getEvidenceIds().add(outcome.episodeId());
        if (skill.getLastUsed() == null || outcome.timestamp().isAfter(skill.getLastUsed())) {
            skill.setLastUsed(outcome.timestamp());
        }
        skill.setUpdatedAt(now);
        workspace.getUpdatedSkillIds().add(skill.getId());
    }

    private void promoteHypotheses(ConsolidationWorkspace workspace) {
        List<Hypothesis> verified = workspace.getHypotheses().values().stream()
                .filter(hypothesis -> hypothesis.getStatus() == Hypothesis.HypothesisStatus.VERIFIED)
                .filter(hypothesis -> hypothesis.getPromotedBeliefId() == null)
                .sorted(Comparator.comparingLong(Hypothesis::getId))
                .toList();
        Instant now = workspace.getNow();

        for (Hypothesis hypothesis : verified) {
            BeliefCandidate derived = heuristicBeliefExtractor.deriveCandidate(hypothesis.getClaim())
                    .orElseGet(() -> BeliefCandidate.builder()
                            .statement(hypothesis.getClaim())
                            .subject(hypothesis.getClaim())
                            .stance("is")
                            .build());
            String subject = MemoryTextSupport.normalizeSubject(derived.getSubject());
            MemoryTextSupport.StanceKey key = MemoryTextSupport.normalizeStance(derived.getStance(),
                    derived.getPolarity());
            double confidence = Math.max(0.0, Math.min(1.0, hypothesis.getConfidence()));

            Belief belief = findMatching(workspace, subject, key).orElse(null);
            if (belief != null) {
                belief.setVerified(true);
                belief.setConfidence(Math.max(belief.getConfidence(), confidence));
                belief.setUpdatedAt(now);
                if (!workspace.getCreatedBeliefIds().contains(belief.getId())) {
                    workspace.getCorroboratedBeliefIds().add(belief.getId());
                }
            } else {
                belief = Belief.builder()
                        .id(memoryStore.nextId(MemoryEntityType.BELIEF))
                        .statement(hypothesis.getClaim().trim())
                        .subject(subject)
                        .stance(derived.getStance())
                        .polarity(derived.getPolarity())
                        .confidence(confidence)
                        .verified(true)
                        .scope(properties.getConsolidation().getDefaultScope())
                        .createdAt(now)
                        .updatedAt(now)
                        .build();
                workspace.getBeliefs().put(belief.getId(), belief);
                workspace.getCreatedBeliefIds().add(belief.getId());
            }
            hypothesis.setPromotedBeliefId(belief.getId());
            hypothesis.setUpdatedAt(now);
            workspace.getPromotedHypothesisIds().add(hypothesis.getId());
            log.info("[ReplayMiner] Promoted hypothesis {} to belief {}", hypothesis.getId(), belief.getId());
        }
    }

    private static List<String> splitList(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.trim().split(LIST_SEPARATOR))
                .filter(item -> !item.isBlank())
                .toList();
    }
}
