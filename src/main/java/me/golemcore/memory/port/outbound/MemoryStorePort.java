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

package me.golemcore.memory.port.outbound;

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

import java.util.List;
import java.util.Optional;

/**
 * Durable keyed relations for every memory type plus the consolidation
 * watermark.
 *
 * <p>
 * The store exclusively owns entity state. Every accessor returns a
 * point-in-time copy; callers never hold a live reference. Episodes are
 * append-only; beliefs, skills, self-model entries and hypotheses change in
 * bulk only through {@link #applyConsolidationBatch(ConsolidationBatch)}.
 * Storage failures surface as
 * {@link me.golemcore.memory.domain.exception.StorageUnavailableException}.
 */
public interface MemoryStorePort {

    /**
     * Append an episode.
     *
     * @return the new episode id, strictly greater than every earlier one
     */
    long appendEpisode(Episode.Kind kind, EpisodePayload payload, double salience, List<String> tags,
            Episode.PrivacyLevel privacyLevel);

    Optional<Episode> getEpisode(long id);

    List<Episode> listEpisodes();

    /**
     * Episodes with {@code afterId < id <= upToId}, ordered by timestamp then
     * id, at most {@code limit} of them.
     */
    List<Episode> listEpisodesInRange(long afterId, long upToId, int limit);

    long getHighestEpisodeId();

    Optional<EvidenceProvenance> getEvidenceProvenance(long episodeId);

    long getWatermark();

    Optional<Belief> getBelief(long id);

    List<Belief> listBeliefs();

    Optional<Skill> getSkill(long id);

    Optional<Skill> findSkillByName(String name);

    List<Skill> listSkills();

    Optional<Goal> getGoal(long id);

    List<Goal> listGoals();

    /**
     * Insert or replace a goal. Goals are owned by the control loop and touch
     * state disjoint from consolidation.
     */
    Goal saveGoal(Goal goal);

    Optional<SelfModelEntry> getSelfModelEntry(String capability);

    List<SelfModelEntry> listSelfModel();

    Optional<Hypothesis> getHypothesis(long id);

    List<Hypothesis> listHypotheses();

    /**
     * Insert or replace a hypothesis registered or resolved by the control
     * loop.
     */
    Hypothesis saveHypothesis(Hypothesis hypothesis);

    /**
     * Reserve a fresh identifier in the given relation.
     */
    long nextId(MemoryEntityType type);

    /**
     * Apply a consolidation batch. Either every upsert and prune is applied and
     * the watermark advances, or nothing changes.
     */
    void applyConsolidationBatch(ConsolidationBatch batch);
}
