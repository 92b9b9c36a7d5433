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
import me.golemcore.memory.domain.exception.ConsolidationAbortedException;
import me.golemcore.memory.domain.model.Belief;
import me.golemcore.memory.domain.model.ConsolidationBatch;
import me.golemcore.memory.domain.model.ConsolidationReport;
import me.golemcore.memory.domain.model.ConsolidationState;
import me.golemcore.memory.domain.model.ConsolidationWorkspace;
import me.golemcore.memory.domain.model.Episode;
import me.golemcore.memory.domain.model.ForgettingPlan;
import me.golemcore.memory.domain.model.Hypothesis;
import me.golemcore.memory.domain.model.SelfModelEntry;
import me.golemcore.memory.domain.model.Skill;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.EmbeddingPort;
import me.golemcore.memory.port.outbound.MemoryStorePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Runs the dream cycle: replays unconsolidated episodes into beliefs and
 * skills, resolves contradictions, refreshes the self-model and plans
 * forgetting, then commits everything as one batch.
 *
 * <p>
 * State machine: IDLE -> RUNNING -> COMMITTING -> IDLE on success, RUNNING or
 * COMMITTING -> ABORTED -> IDLE on failure. Only one run may be active; a
 * trigger while a run is active returns a {@code REJECTED_CONCURRENT} report
 * and changes nothing. Episodes appended after the run starts are above its
 * snapshot watermark and wait for the next run.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConsolidationService {

    private final MemoryStorePort memoryStore;
    private final ReplayMinerService replayMinerService;
    private final ContradictionResolverService contradictionResolverService;
    private final ForgettingPolicyService forgettingPolicyService;
    private final EmbeddingPort embeddingPort;
    private final MemoryProperties properties;
    private final Clock clock;

    private final AtomicReference<ConsolidationState> state = new AtomicReference<>(ConsolidationState.IDLE);

    public ConsolidationState getState() {
        return state.get();
    }

    public ConsolidationReport consolidate() {
        if (!state.compareAndSet(ConsolidationState.IDLE, ConsolidationState.RUNNING)) {
            log.info("[Consolidation] Run already in progress ({}), trigger rejected", state.get());
            return ConsolidationReport.rejected(memoryStore.getWatermark());
        }

        long priorWatermark = memoryStore.getWatermark();
        boolean completed = false;
        try {
            ConsolidationReport report = run(priorWatermark);
            completed = true;
            return report;
        } catch (RuntimeException e) {
            log.warn("[Consolidation] Run aborted at watermark {}: {}", priorWatermark, e.getMessage());
            throw new ConsolidationAbortedException(describe(e), priorWatermark, e);
        } finally {
            if (!completed) {
                state.set(ConsolidationState.ABORTED);
            }
            // errors propagate as-is but must not leave the run slot taken
            state.set(ConsolidationState.IDLE);
        }
    }

    private ConsolidationReport run(long priorWatermark) {
        Instant now = clock.instant();
        long snapshotWatermark = memoryStore.getHighestEpisodeId();
        int batchSize = Math.max(1, properties.getConsolidation().getBatchSize());
        List<Episode> window = memoryStore.listEpisodesInRange(priorWatermark, snapshotWatermark, batchSize);
        long newWatermark = window.size() >= batchSize
                ? window.stream().mapToLong(Episode::getId).max().orElse(priorWatermark)
                : Math.max(priorWatermark, snapshotWatermark);
        log.info("[Consolidation] Started: window ({}, {}], {} episode(s)", priorWatermark, newWatermark,
                window.size());

        List<Belief> originalBeliefs = memoryStore.listBeliefs();
        List<Skill> originalSkills = memoryStore.listSkills();
        List<Hypothesis> originalHypotheses = memoryStore.listHypotheses();
        ConsolidationWorkspace workspace = new ConsolidationWorkspace(now, originalBeliefs, originalSkills,
                originalHypotheses);

        replayMinerService.mine(window, workspace);
        contradictionResolverService.resolve(workspace);
        embedNewBeliefs(workspace);

        List<Belief> beliefUpserts = changed(workspace.getBeliefs().values(), originalBeliefs, Belief::getId);
        List<Skill> skillUpserts = changed(workspace.getSkills().values(), originalSkills, Skill::getId);
        List<Hypothesis> hypothesisUpserts = changed(workspace.getHypotheses().values(), originalHypotheses,
                Hypothesis::getId);
        List<SelfModelEntry> selfModelUpserts = refreshSelfModel(workspace, now);
        ForgettingPlan forgettingPlan = forgettingPolicyService.plan(memoryStore.listEpisodes(),
                workspace.getBeliefs().values(), workspace.getSkills().values(), newWatermark, now);

        ConsolidationBatch batch = ConsolidationBatch.builder()
                .watermark(newWatermark)
                .beliefUpserts(beliefUpserts)
                .skillUpserts(skillUpserts)
                .selfModelUpserts(selfModelUpserts)
                .hypothesisUpserts(hypothesisUpserts)
                .salienceUpdates(forgettingPlan.salienceUpdates())
                .prunes(forgettingPlan.prunes())
                .build();

        state.set(ConsolidationState.COMMITTING);
        if (isNoOp(batch, priorWatermark)) {
            log.debug("[Consolidation] Nothing to commit");
        } else {
            memoryStore.applyConsolidationBatch(batch);
        }

        Set<Long> updated = new LinkedHashSet<>(beliefUpserts.stream().map(Belief::getId).toList());
        updated.removeAll(workspace.getCreatedBeliefIds());
        ConsolidationReport report = ConsolidationReport.builder()
                .outcome(ConsolidationReport.Outcome.COMMITTED)
                .episodesProcessed(window.size())
                .beliefsCreated(workspace.getCreatedBeliefIds().size())
                .beliefsUpdated(updated.size())
                .beliefsDisputed(workspace.getDisputedBeliefIds().size())
                .beliefsRetracted(workspace.getRetractedBeliefIds().size())
                .beliefsConfirmed(workspace.getConfirmedBeliefIds().size())
                .skillsUpdated(workspace.getUpdatedSkillIds().size())
                .hypothesesPromoted(workspace.getPromotedHypothesisIds().size())
                .episodesPruned(forgettingPlan.prunes().size())
                .priorWatermark(priorWatermark)
                .watermark(newWatermark)
                .tagCounts(replayMinerService.countRecurringTags(window))
                .build();
        log.info("[Consolidation] Committed: created={}, updated={}, disputed={}, retracted={}, confirmed={}, "
                + "skills={}, pruned={}, watermark={}",
                report.getBeliefsCreated(), report.getBeliefsUpdated(), report.getBeliefsDisputed(),
                report.getBeliefsRetracted(), report.getBeliefsConfirmed(), report.getSkillsUpdated(),
                report.getEpisodesPruned(), newWatermark);
        return report;
    }

    private void embedNewBeliefs(ConsolidationWorkspace workspace) {
        if (workspace.getCreatedBeliefIds().isEmpty() || !embeddingPort.isAvailable()) {
            return;
        }
        List<Belief> created = workspace.getCreatedBeliefIds().stream()
                .map(workspace.getBeliefs()::get)
                .toList();
        List<float[]> vectors;
        try {
            vectors = embeddingPort.embedBatch(created.stream().map(Belief::getStatement).toList()).join();
        } catch (RuntimeException e) {
            log.warn("[Consolidation] Failed to embed {} new belief(s): {}", created.size(), e.getMessage());
            return;
        }
        for (int i = 0; i < created.size() && i < vectors.size(); i++) {
            created.get(i).setEmbedding(vectors.get(i));
        }
    }

    private List<SelfModelEntry> refreshSelfModel(ConsolidationWorkspace workspace, Instant now) {
        List<SelfModelEntry> upserts = new ArrayList<>();
        for (Long skillId : workspace.getUpdatedSkillIds()) {
            Skill skill = workspace.getSkills().get(skillId);
            double reliability = skill.getSuccessRateHistory().stream()
                    .mapToDouble(Double::doubleValue)
                    .average()
                    .orElse(skill.getSuccessRate());
            Optional<SelfModelEntry> existing = memoryStore.getSelfModelEntry(skill.getName());
            SelfModelEntry entry = existing.orElseGet(() -> SelfModelEntry.builder()
                    .capability(skill.getName())
                    .createdAt(now)
                    .build());
            entry.setReliabilityScore(Math.max(0.0, Math.min(1.0, reliability)));
            entry.setLimitations(new LinkedHashSet<>(skill.getFailureModes()));
            entry.setUpdatedAt(now);
            upserts.add(entry);
        }
        return upserts;
    }

    private static <T> List<T> changed(Collection<T> working, List<T> originals,
            Function<T, Long> idOf) {
        Map<Long, T> byId = originals.stream().collect(Collectors.toMap(idOf, Function.identity()));
        List<T> result = new ArrayList<>();
        for (T candidate : working) {
            if (!Objects.equals(candidate, byId.get(idOf.apply(candidate)))) {
                result.add(candidate);
            }
        }
        return result;
    }

    private static boolean isNoOp(ConsolidationBatch batch, long priorWatermark) {
        return batch.getWatermark() == priorWatermark
                && batch.getBeliefUpserts().isEmpty()
                && batch.getSkillUpserts().isEmpty()
                && batch.getSelfModelUpserts().isEmpty()
                && batch.getHypothesisUpserts().isEmpty()
                && batch.getSalienceUpdates().isEmpty()
                && batch.getPrunes().isEmpty();
    }

    private static String describe(RuntimeException e) {
        String message = e.getMessage();
        return e.getClass().getSimpleName() + (message != null ? ": " + message : "");
    }
}
