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

package me.golemcore.memory.adapter.outbound.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.exception.StorageUnavailableException;
import me.golemcore.memory.domain.exception.ValidationFailureException;
import me.golemcore.memory.domain.model.Belief;
import me.golemcore.memory.domain.model.ConsolidationBatch;
import me.golemcore.memory.domain.model.Episode;
import me.golemcore.memory.domain.model.EpisodePayload;
import me.golemcore.memory.domain.model.EvidenceProvenance;
import me.golemcore.memory.domain.model.Goal;
import me.golemcore.memory.domain.model.Hypothesis;
import me.golemcore.memory.domain.model.MemoryEntityType;
import me.golemcore.memory.domain.model.SelfModelEntry;
import me.golemcore.memory.domain.model.Skill;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.MemoryStorePort;
import me.golemcore.memory.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Memory store backed by the local workspace.
 *
 * <p>
 * Layout inside the configured memory directory:
 * <ul>
 * <li>{@code episodes.jsonl} - append-only episode journal, compacted after
 * prunes</li>
 * <li>{@code state.json} - atomic snapshot of beliefs, skills, goals,
 * self-model, hypotheses, the watermark and per-episode salience/prune
 * overlays</li>
 * </ul>
 *
 * <p>
 * The snapshot is authoritative for everything except episode payloads, so a
 * consolidation batch commits with one atomic file write.
 *
 * <p>
 * Writers serialize on the mutation lock and do their file I/O under it only.
 * The read/write lock guards the in-memory maps: readers hold it while copying
 * their result, and a writer takes it just to publish state that is already on
 * disk.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalMemoryStoreAdapter implements MemoryStorePort {

    private static final String EPISODES_FILE = "episodes.jsonl";
    private static final String STATE_FILE = "state.json";
    private static final String STATE_BACKUP_FILE = "state.json.bak";

    private final StoragePort storagePort;
    private final MemoryProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final ReentrantLock mutationLock = new ReentrantLock();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final TreeMap<Long, Episode> episodes = new TreeMap<>();
    private final Map<Long, Belief> beliefs = new TreeMap<>();
    private final Map<Long, Skill> skills = new TreeMap<>();
    private final Map<Long, Goal> goals = new TreeMap<>();
    private final Map<String, SelfModelEntry> selfModel = new TreeMap<>();
    private final Map<Long, Hypothesis> hypotheses = new TreeMap<>();
    private final Map<MemoryEntityType, AtomicLong> sequences = new EnumMap<>(MemoryEntityType.class);
    private long watermark;

    @PostConstruct
    public void init() {
        for (MemoryEntityType type : MemoryEntityType.values()) {
            sequences.put(type, new AtomicLong());
        }
        await(() -> storagePort.ensureDirectory(getMemoryDirectory()), "init");

        lock.writeLock().lock();
        try {
            StoreSnapshot snapshot = loadSnapshot();
            loadEpisodes(snapshot.getEpisodeOverlays());
            restoreState(snapshot);
            log.info("[MemoryStore] Loaded {} episode(s), {} belief(s), {} skill(s), watermark={}",
                    episodes.size(), beliefs.size(), skills.size(), watermark);
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ==================== EPISODES ====================

    @Override
    public long appendEpisode(Episode.Kind kind, EpisodePayload payload, double salience, List<String> tags,
            Episode.PrivacyLevel privacyLevel) {
        validateEpisode(kind, payload, salience);

        mutationLock.lock();
        try {
            long id = sequences.get(MemoryEntityType.EPISODE).get() + 1;
            Instant now = clock.instant();
            EpisodePayload storedPayload = payload.copy();
            Episode episode = Episode.builder()
                    .id(id)
                    .timestamp(now)
                    .kind(kind)
                    .payload(storedPayload)
                    .tags(tags != null ? new ArrayList<>(tags) : new ArrayList<>())
                    .privacyLevel(privacyLevel != null ? privacyLevel : Episode.PrivacyLevel.INTERNAL)
                    .initialSalience(salience)
                    .salience(salience)
                    .contentHash(computeContentHash(kind, storedPayload))
                    .createdAt(now)
                    .updatedAt(now)
                    .build();

            String line = toJson(episode) + "\n";
            await(() -> storagePort.appendText(getMemoryDirectory(), EPISODES_FILE, line), "append episode");

            publish(() -> {
                sequences.get(MemoryEntityType.EPISODE).set(id);
                episodes.put(id, episode);
            });
            log.debug("[MemoryStore] Appended episode {} ({})", id, kind);
            return id;
        } finally {
            mutationLock.unlock();
        }
    }

    @Override
    public Optional<Episode> getEpisode(long id) {
        return read(() -> Optional.ofNullable(episodes.get(id)).map(Episode::copy));
    }

    @Override
    public List<Episode> listEpisodes() {
        return read(() -> episodes.values().stream().map(Episode::copy).toList());
    }

    @Override
    public List<Episode> listEpisodesInRange(long afterId, long upToId, int limit) {
        if (upToId <= afterId || limit <= 0) {
            return List.of();
        }
        List<Episode> window = read(() -> episodes.subMap(afterId, false, upToId, true).values().stream()
                .limit(limit)
                .map(Episode::copy)
                .toList());
        List<Episode> ordered = new ArrayList<>(window);
        ordered.sort(Comparator.comparing(Episode::getTimestamp).thenComparingLong(Episode::getId));
        return ordered;
    }

    @Override
    public long getHighestEpisodeId() {
        return read(() -> episodes.isEmpty() ? 0L : episodes.lastKey());
    }

    @Override
    public Optional<EvidenceProvenance> getEvidenceProvenance(long episodeId) {
        return read(() -> Optional.ofNullable(episodes.get(episodeId))
                .map(episode -> new EvidenceProvenance(episode.getId(), episode.getContentHash(),
                        episode.getTimestamp(), episode.isPruned())));
    }

    @Override
    public long getWatermark() {
        return read(() -> watermark);
    }

    // ==================== BELIEFS / SKILLS / SELF-MODEL ====================

    @Override
    public Optional<Belief> getBelief(long id) {
        return read(() -> Optional.ofNullable(beliefs.get(id)).map(Belief::copy));
    }

    @Override
    public List<Belief> listBeliefs() {
        return read(() -> beliefs.values().stream().map(Belief::copy).toList());
    }

    @Override
    public Optional<Skill> getSkill(long id) {
        return read(() -> Optional.ofNullable(skills.get(id)).map(Skill::copy));
    }

    @Override
    public Optional<Skill> findSkillByName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return read(() -> skills.values().stream()
                .filter(skill -> name.equalsIgnoreCase(skill.getName()))
                .findFirst()
                .map(Skill::copy));
    }

    @Override
    public List<Skill> listSkills() {
        return read(() -> skills.values().stream().map(Skill::copy).toList());
    }

    @Override
    public Optional<SelfModelEntry> getSelfModelEntry(String capability) {
        return read(() -> Optional.ofNullable(selfModel.get(capability)).map(SelfModelEntry::copy));
    }

    @Override
    public List<SelfModelEntry> listSelfModel() {
        return read(() -> selfModel.values().stream().map(SelfModelEntry::copy).toList());
    }

    // ==================== GOALS / HYPOTHESES ====================

    @Override
    public Optional<Goal> getGoal(long id) {
        return read(() -> Optional.ofNullable(goals.get(id)).map(Goal::copy));
    }

    @Override
    public List<Goal> listGoals() {
        return read(() -> goals.values().stream().map(Goal::copy).toList());
    }

    @Override
    public Goal saveGoal(Goal goal) {
        if (goal == null) {
            throw new ValidationFailureException("goal is required");
        }
        Goal stored = goal.copy();
        if (stored.getId() <= 0) {
            stored.setId(nextId(MemoryEntityType.GOAL));
        }

        mutationLock.lock();
        try {
            Map<Long, Goal> nextGoals = new TreeMap<>(goals);
            nextGoals.put(stored.getId(), stored);
            writeSnapshot(buildSnapshot(beliefs, skills, nextGoals, selfModel, hypotheses, episodes, watermark));
            publish(() -> goals.put(stored.getId(), stored));
            return stored.copy();
        } finally {
            mutationLock.unlock();
        }
    }

    @Override
    public Optional<Hypothesis> getHypothesis(long id) {
        return read(() -> Optional.ofNullable(hypotheses.get(id)).map(Hypothesis::copy));
    }

    @Override
    public List<Hypothesis> listHypotheses() {
        return read(() -> hypotheses.values().stream().map(Hypothesis::copy).toList());
    }

    @Override
    public Hypothesis saveHypothesis(Hypothesis hypothesis) {
        if (hypothesis == null) {
            throw new ValidationFailureException("hypothesis is required");
        }
        validateUnitInterval("hypothesis confidence", hypothesis.getConfidence());
        Hypothesis stored = hypothesis.copy();
        if (stored.getId() <= 0) {
            stored.setId(nextId(MemoryEntityType.HYPOTHESIS));
        }

        mutationLock.lock();
        try {
            Map<Long, Hypothesis> nextHypotheses = new TreeMap<>(hypotheses);
            nextHypotheses.put(stored.getId(), stored);
            writeSnapshot(buildSnapshot(beliefs, skills, goals, selfModel, nextHypotheses, episodes, watermark));
            publish(() -> hypotheses.put(stored.getId(), stored));
            return stored.copy();
        } finally {
            mutationLock.unlock();
        }
    }

    @Override
    public long nextId(MemoryEntityType type) {
        return sequences.get(type).incrementAndGet();
    }

    // ==================== CONSOLIDATION BATCH ====================

    @Override
    public void applyConsolidationBatch(ConsolidationBatch batch) {
        if (batch == null) {
            throw new ValidationFailureException("batch is required");
        }
        batch.getBeliefUpserts().forEach(this::validateBelief);
        batch.getSkillUpserts().forEach(skill -> validateUnitInterval("skill success rate", skill.getSuccessRate()));
        batch.getSelfModelUpserts()
                .forEach(entry -> validateUnitInterval("reliability score", entry.getReliabilityScore()));

        mutationLock.lock();
        try {
            if (batch.getWatermark() < watermark) {
                throw new ValidationFailureException("Watermark cannot move backwards: "
                        + batch.getWatermark() + " < " + watermark);
            }
            long highest = episodes.isEmpty() ? 0L : episodes.lastKey();
            if (batch.getWatermark() > highest) {
                throw new ValidationFailureException("Watermark " + batch.getWatermark()
                        + " exceeds highest episode id " + highest);
            }

            Map<Long, Belief> nextBeliefs = new TreeMap<>(beliefs);
            batch.getBeliefUpserts().forEach(belief -> nextBeliefs.put(belief.getId(), belief.copy()));
            Map<Long, Skill> nextSkills = new TreeMap<>(skills);
            batch.getSkillUpserts().forEach(skill -> nextSkills.put(skill.getId(), skill.copy()));
            Map<String, SelfModelEntry> nextSelfModel = new TreeMap<>(selfModel);
            batch.getSelfModelUpserts().forEach(entry -> nextSelfModel.put(entry.getCapability(), entry.copy()));
            Map<Long, Hypothesis> nextHypotheses = new TreeMap<>(hypotheses);
            batch.getHypothesisUpserts().forEach(h -> nextHypotheses.put(h.getId(), h.copy()));

            validateConflictSymmetry(nextBeliefs);
            Map<Long, Episode> changedEpisodes = applyEpisodeChanges(batch, nextBeliefs, nextSkills);
            TreeMap<Long, Episode> nextEpisodes = new TreeMap<>(episodes);
            nextEpisodes.putAll(changedEpisodes);

            writeSnapshot(buildSnapshot(nextBeliefs, nextSkills, goals, nextSelfModel, nextHypotheses,
                    nextEpisodes, batch.getWatermark()));

            publish(() -> {
                replace(beliefs, nextBeliefs);
                replace(skills, nextSkills);
                replace(selfModel, nextSelfModel);
                replace(hypotheses, nextHypotheses);
                episodes.putAll(changedEpisodes);
                watermark = batch.getWatermark();
            });
            log.info("[MemoryStore] Committed batch: beliefs={}, skills={}, prunes={}, watermark={}",
                    batch.getBeliefUpserts().size(), batch.getSkillUpserts().size(), batch.getPrunes().size(),
                    batch.getWatermark());

            if (!batch.getPrunes().isEmpty()) {
                compactJournal();
            }
        } finally {
            mutationLock.unlock();
        }
    }

    private Map<Long, Episode> applyEpisodeChanges(ConsolidationBatch batch, Map<Long, Belief> nextBeliefs,
            Map<Long, Skill> nextSkills) {
        Set<Long> cited = new HashSet<>();
        nextBeliefs.values().stream()
                .filter(belief -> belief.getStatus() != Belief.Status.RETRACTED)
                .forEach(belief -> cited.addAll(belief.getEvidenceIds()));
        nextSkills.values().forEach(skill -> cited.addAll(skill.getEvidenceIds()));

        Instant now = clock.instant();
        Map<Long, Episode> changed = new LinkedHashMap<>();
        for (Map.Entry<Long, Double> update : batch.getSalienceUpdates().entrySet()) {
            Episode current = episodes.get(update.getKey());
            if (current == null) {
                continue;
            }
            if (update.getValue() == null || update.getValue() < 0.0) {
                throw new ValidationFailureException("Salience must be >= 0 for episode " + update.getKey());
            }
            Episode next = current.copy();
            next.setSalience(update.getValue());
            next.setUpdatedAt(now);
            changed.put(next.getId(), next);
        }
        for (Long prunedId : batch.getPrunes()) {
            if (cited.contains(prunedId)) {
                throw new ValidationFailureException("Episode " + prunedId + " is cited as evidence");
            }
            Episode current = changed.containsKey(prunedId) ? changed.get(prunedId) : episodes.get(prunedId);
            if (current == null || current.isPruned()) {
                continue;
            }
            Episode next = current.copy();
            next.setPayload(null);
            next.setPruned(true);
            next.setPrunedAt(now);
            next.setUpdatedAt(now);
            changed.put(next.getId(), next);
        }
        return changed;
    }

    private void compactJournal() {
        StringBuilder payload = new StringBuilder();
        for (Episode episode : episodes.values()) {
            payload.append(toJson(episode)).append("\n");
        }
        try {
            await(() -> storagePort.putTextAtomic(getMemoryDirectory(), EPISODES_FILE, payload.toString(), false),
                    "compact journal");
        } catch (StorageUnavailableException e) {
            // Overlays in the snapshot still strip pruned payloads on reload.
            log.warn("[MemoryStore] Journal compaction failed: {}", e.getMessage());
        }
    }

    // ==================== VALIDATION ====================

    private void validateEpisode(Episode.Kind kind, EpisodePayload payload, double salience) {
        if (kind == null) {
            throw new ValidationFailureException("episode kind is required");
        }
        if (payload == null || payload.getText() == null || payload.getText().isBlank()) {
            throw new ValidationFailureException("episode payload text is required");
        }
        if (Double.isNaN(salience) || Double.isInfinite(salience) || salience < 0.0) {
            throw new ValidationFailureException("salience must be a finite value >= 0");
        }
    }

    private void validateBelief(Belief belief) {
        if (belief.getId() <= 0) {
            throw new ValidationFailureException("belief id is required");
        }
        if (belief.getStatement() == null || belief.getStatement().isBlank()) {
            throw new ValidationFailureException("belief statement is required");
        }
        validateUnitInterval("belief confidence", belief.getConfidence());
        if (belief.getStatus() == Belief.Status.PROPOSED && !belief.isVerified() && belief.getConfidence() >= 1.0) {
            throw new ValidationFailureException("unverified proposed belief " + belief.getId()
                    + " cannot have full confidence");
        }
    }

    private void validateConflictSymmetry(Map<Long, Belief> nextBeliefs) {
        for (Belief belief : nextBeliefs.values()) {
            for (Long otherId : belief.getConflictsWithIds()) {
                Belief other = nextBeliefs.get(otherId);
                if (other == null || !other.getConflictsWithIds().contains(belief.getId())) {
                    throw new ValidationFailureException("Conflict link " + belief.getId() + " -> " + otherId
                            + " is not symmetric");
                }
            }
        }
    }

    private void validateUnitInterval(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new ValidationFailureException(name + " must be within [0, 1]: " + value);
        }
    }

    // ==================== PERSISTENCE ====================

    private StoreSnapshot loadSnapshot() {
        StoreSnapshot snapshot = readSnapshot(STATE_FILE);
        if (snapshot == null) {
            snapshot = readSnapshot(STATE_BACKUP_FILE);
            if (snapshot != null) {
                log.warn("[MemoryStore] Restored state from backup");
            }
        }
        return snapshot != null ? snapshot : new StoreSnapshot();
    }

    private StoreSnapshot readSnapshot(String file) {
        String content = await(() -> storagePort.getText(getMemoryDirectory(), file), "read " + file);
        if (content == null || content.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(content, StoreSnapshot.class);
        } catch (IOException e) {
            log.warn("[MemoryStore] Failed to parse {}: {}", file, e.getMessage());
            return null;
        }
    }

    private void loadEpisodes(Map<Long, EpisodeOverlay> overlays) {
        String content = await(() -> storagePort.getText(getMemoryDirectory(), EPISODES_FILE), "read journal");
        if (content == null || content.isBlank()) {
            return;
        }
        for (String line : content.split("\\R")) {
            if (line.isBlank()) {
                continue;
            }
            try {
                Episode episode = objectMapper.readValue(line, Episode.class);
                EpisodeOverlay overlay = overlays.get(episode.getId());
                if (overlay != null) {
                    episode.setSalience(overlay.getSalience());
                    episode.setUpdatedAt(overlay.getUpdatedAt());
                    if (overlay.isPruned()) {
                        episode.setPayload(null);
                        episode.setPruned(true);
                        episode.setPrunedAt(overlay.getPrunedAt());
                    }
                }
                episodes.put(episode.getId(), episode);
            } catch (IOException e) {
                log.trace("[MemoryStore] Skipping invalid journal line: {}", e.getMessage());
            }
        }
    }

    private void restoreState(StoreSnapshot snapshot) {
        snapshot.getBeliefs().forEach(belief -> beliefs.put(belief.getId(), belief));
        snapshot.getSkills().forEach(skill -> skills.put(skill.getId(), skill));
        snapshot.getGoals().forEach(goal -> goals.put(goal.getId(), goal));
        snapshot.getSelfModel().forEach(entry -> selfModel.put(entry.getCapability(), entry));
        snapshot.getHypotheses().forEach(hypothesis -> hypotheses.put(hypothesis.getId(), hypothesis));
        watermark = snapshot.getWatermark();

        raiseSequence(MemoryEntityType.EPISODE, episodes.isEmpty() ? 0L : episodes.lastKey());
        raiseSequence(MemoryEntityType.BELIEF, beliefs.keySet().stream().mapToLong(Long::longValue).max().orElse(0L));
        raiseSequence(MemoryEntityType.SKILL, skills.keySet().stream().mapToLong(Long::longValue).max().orElse(0L));
        raiseSequence(MemoryEntityType.GOAL, goals.keySet().stream().mapToLong(Long::longValue).max().orElse(0L));
        raiseSequence(MemoryEntityType.HYPOTHESIS,
                hypotheses.keySet().stream().mapToLong(Long::longValue).max().orElse(0L));
        snapshot.getSequences().forEach(this::raiseSequence);
    }

    private void raiseSequence(MemoryEntityType type, Long value) {
        if (value != null) {
            sequences.get(type).accumulateAndGet(value, Math::max);
        }
    }

    private StoreSnapshot buildSnapshot(Map<Long, Belief> beliefState, Map<Long, Skill> skillState,
            Map<Long, Goal> goalState, Map<String, SelfModelEntry> selfModelState,
            Map<Long, Hypothesis> hypothesisState, Map<Long, Episode> episodeState, long snapshotWatermark) {
        Map<Long, EpisodeOverlay> overlays = new TreeMap<>();
        for (Episode episode : episodeState.values()) {
            if (episode.isPruned() || Double.compare(episode.getSalience(), episode.getInitialSalience()) != 0) {
                overlays.put(episode.getId(), EpisodeOverlay.builder()
                        .salience(episode.getSalience())
                        .pruned(episode.isPruned())
                        .prunedAt(episode.getPrunedAt())
                        .updatedAt(episode.getUpdatedAt())
                        .build());
            }
        }
        Map<MemoryEntityType, Long> sequenceValues = new EnumMap<>(MemoryEntityType.class);
        sequences.forEach((type, value) -> sequenceValues.put(type, value.get()));

        return StoreSnapshot.builder()
                .watermark(snapshotWatermark)
                .beliefs(new ArrayList<>(beliefState.values()))
                .skills(new ArrayList<>(skillState.values()))
                .goals(new ArrayList<>(goalState.values()))
                .selfModel(new ArrayList<>(selfModelState.values()))
                .hypotheses(new ArrayList<>(hypothesisState.values()))
                .episodeOverlays(overlays)
                .sequences(sequenceValues)
                .build();
    }

    private void writeSnapshot(StoreSnapshot snapshot) {
        String payload = toJson(snapshot);
        await(() -> storagePort.putTextAtomic(getMemoryDirectory(), STATE_FILE, payload, true), "write state");
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize memory state: " + e.getMessage(), e);
        }
    }

    private <T> T await(Supplier<CompletableFuture<T>> operation, String description) {
        try {
            return operation.get().join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new StorageUnavailableException("Storage unavailable during " + description + ": "
                    + cause.getMessage(), cause);
        } catch (RuntimeException e) {
            throw new StorageUnavailableException("Storage unavailable during " + description + ": "
                    + e.getMessage(), e);
        }
    }

    private <T> T read(Supplier<T> reader) {
        lock.readLock().lock();
        try {
            return reader.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private void publish(Runnable swap) {
        lock.writeLock().lock();
        try {
            swap.run();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private static <K, V> void replace(Map<K, V> target, Map<K, V> source) {
        target.clear();
        target.putAll(source);
    }

    private String computeContentHash(Episode.Kind kind, EpisodePayload payload) {
        StringBuilder canonical = new StringBuilder();
        canonical.append(kind.name()).append('\n').append(payload.getText());
        new TreeMap<>(payload.getFields() != null ? payload.getFields() : Map.<String, String>of())
                .forEach((key, value) -> canonical.append('\n').append(key).append('=').append(value));
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical.toString().getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private String getMemoryDirectory() {
        String configured = properties.getStorage().getDirectory();
        if (configured == null || configured.isBlank()) {
            return "memory";
        }
        return configured;
    }

    /**
     * On-disk snapshot of everything except episode payloads.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class StoreSnapshot {
        private long watermark;

        @Builder.Default
        private List<Belief> beliefs = new ArrayList<>();

        @Builder.Default
        private List<Skill> skills = new ArrayList<>();

        @Builder.Default
        private List<Goal> goals = new ArrayList<>();

        @Builder.Default
        private List<SelfModelEntry> selfModel = new ArrayList<>();

        @Builder.Default
        private List<Hypothesis> hypotheses = new ArrayList<>();

        @Builder.Default
        private Map<Long, EpisodeOverlay> episodeOverlays = new TreeMap<>();

        @Builder.Default
        private Map<MemoryEntityType, Long> sequences = new EnumMap<>(MemoryEntityType.class);
    }

    /**
     * Mutable episode attributes tracked outside the append-only journal.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class EpisodeOverlay {
        private double salience;
        private boolean pruned;
        private Instant prunedAt;
        private Instant updatedAt;
    }
}
