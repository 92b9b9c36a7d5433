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
import me.golemcore.memory.domain.model.ConsolidationWorkspace;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Detects contradictions between beliefs and re-evaluates the dispute
 * lifecycle of every live belief once per consolidation run.
 *
 * <p>
 * Two beliefs contradict when they share a subject and stance family, their
 * effective polarities differ and their statements are topically similar.
 * Conflict links are kept symmetric; the dispute penalty applies only when a
 * link is first made, so repeated runs over the same state are stable.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContradictionResolverService {

    private final MemoryProperties properties;

    public void resolve(ConsolidationWorkspace workspace) {
        detectContradictions(workspace);
        reevaluate(workspace);
    }

    /**
     * Whether two beliefs contradict each other.
     */
    public boolean contradicts(Belief left, Belief right) {
        if (left.getId() == right.getId()) {
            return false;
        }
        String leftSubject = MemoryTextSupport.normalizeSubject(left.getSubject());
        if (leftSubject.isEmpty() || !leftSubject.equals(MemoryTextSupport.normalizeSubject(right.getSubject()))) {
            return false;
        }
        MemoryTextSupport.StanceKey leftKey = MemoryTextSupport.normalizeStance(left.getStance(),
                left.getPolarity());
        MemoryTextSupport.StanceKey rightKey = MemoryTextSupport.normalizeStance(right.getStance(),
                right.getPolarity());
        if (!leftKey.stance().equals(rightKey.stance()) || leftKey.polarity() == rightKey.polarity()) {
            return false;
        }
        double similarity = MemoryTextSupport.topicalSimilarity(left.getStatement(), right.getStatement());
        return similarity >= properties.getConsolidation().getContradictionSimilarityThreshold();
    }

    private void detectContradictions(ConsolidationWorkspace workspace) {
        Map<Long, Belief> beliefs = workspace.getBeliefs();
        for (Long touchedId : workspace.getTouchedBeliefIds()) {
            Belief belief = beliefs.get(touchedId);
            if (belief == null || !belief.isLive()) {
                continue;
            }
            for (Belief other : workspace.liveBeliefs()) {
                if (contradicts(belief, other)) {
                    link(belief, other, workspace);
                }
            }
        }
    }

    private void link(Belief left, Belief right, ConsolidationWorkspace workspace) {
        boolean addedLeft = left.getConflictsWithIds().add(right.getId());
        boolean addedRight = right.getConflictsWithIds().add(left.getId());
        if (!addedLeft && !addedRight) {
            return;
        }
        double penalty = properties.getConsolidation().getDisputePenalty();
        for (Belief belief : List.of(left, right)) {
            belief.setConfidence(Math.max(0.0, belief.getConfidence() - penalty));
            if (belief.getStatus() != Belief.Status.DISPUTED) {
                belief.setStatus(Belief.Status.DISPUTED);
                workspace.getDisputedBeliefIds().add(belief.getId());
            }
            belief.setUpdatedAt(workspace.getNow());
        }
        log.info("[Contradiction] Beliefs {} and {} now dispute each other", left.getId(), right.getId());
    }

    private void reevaluate(ConsolidationWorkspace workspace) {
        MemoryProperties.ConsolidationProperties config = properties.getConsolidation();
        Instant now = workspace.getNow();
        Set<Long> touched = workspace.getTouchedBeliefIds();

        for (Belief belief : workspace.liveBeliefs()) {
            if (!touched.contains(belief.getId()) && isStale(belief, now)) {
                double decayed = belief.getConfidence() * config.getBeliefDecayFactor();
                double floor = Math.min(belief.getConfidence(), config.getBeliefDecayFloor());
                belief.setConfidence(Math.max(decayed, floor));
                belief.setLastDecayedAt(now);
            }
        }

        List<Belief> superseded = new ArrayList<>();
        for (Belief belief : workspace.liveBeliefs()) {
            if (belief.getStatus() == Belief.Status.DISPUTED
                    && belief.getConfidence() < config.getSupersedeThreshold()
                    && liveConflicts(belief, workspace).stream()
                            .anyMatch(other -> other.getConfidence() >= config.getSupersedeThreshold())) {
                superseded.add(belief);
            }
        }
        for (Belief belief : superseded) {
            belief.setStatus(Belief.Status.RETRACTED);
            belief.setUpdatedAt(now);
            workspace.getRetractedBeliefIds().add(belief.getId());
            log.info("[Contradiction] Belief {} retracted at confidence {}", belief.getId(),
                    belief.getConfidence());
        }

        for (Belief belief : workspace.liveBeliefs()) {
            if (belief.getStatus() == Belief.Status.DISPUTED && liveConflicts(belief, workspace).isEmpty()) {
                belief.setStatus(Belief.Status.PROPOSED);
                belief.setUpdatedAt(now);
            }
        }

        for (Belief belief : workspace.liveBeliefs()) {
            if (belief.getStatus() == Belief.Status.PROPOSED
                    && belief.getConfidence() > config.getConfirmThreshold()
                    && liveConflicts(belief, workspace).isEmpty()) {
                belief.setStatus(Belief.Status.CONFIRMED);
                belief.setLastConfirmedAt(now);
                belief.setUpdatedAt(now);
                workspace.getConfirmedBeliefIds().add(belief.getId());
            }
        }

        archiveRetracted(workspace, now);
    }

    private void archiveRetracted(ConsolidationWorkspace workspace, Instant now) {
        Duration retention = Duration.ofDays(properties.getForgetting().getRetentionDays());
        for (Belief belief : workspace.getBeliefs().values()) {
            if (belief.getStatus() == Belief.Status.RETRACTED && belief.getUpdatedAt() != null
                    && !belief.getUpdatedAt().plus(retention).isAfter(now)) {
                belief.setStatus(Belief.Status.ARCHIVED);
                belief.setUpdatedAt(now);
                log.debug("[Contradiction] Archived retracted belief {}", belief.getId());
            }
        }
    }

    private boolean isStale(Belief belief, Instant now) {
        if (belief.getStatus() != Belief.Status.PROPOSED && belief.getStatus() != Belief.Status.DISPUTED) {
            return false;
        }
        Instant last = belief.getUpdatedAt();
        if (belief.getLastDecayedAt() != null && (last == null || belief.getLastDecayedAt().isAfter(last))) {
            last = belief.getLastDecayedAt();
        }
        if (last == null) {
            return false;
        }
        Duration interval = Duration.ofDays(properties.getConsolidation().getBeliefDecayIntervalDays());
        return !last.plus(interval).isAfter(now);
    }

    private List<Belief> liveConflicts(Belief belief, ConsolidationWorkspace workspace) {
        List<Belief> conflicts = new ArrayList<>();
        for (Long otherId : belief.getConflictsWithIds()) {
            Belief other = workspace.getBeliefs().get(otherId);
            if (other != null && other.isLive()) {
                conflicts.add(other);
            }
        }
        return conflicts;
    }
}
