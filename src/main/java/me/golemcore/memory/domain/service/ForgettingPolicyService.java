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
import me.golemcore.memory.domain.model.Episode;
import me.golemcore.memory.domain.model.ForgettingPlan;
import me.golemcore.memory.domain.model.Skill;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Plans salience decay and pruning of consolidated episodes.
 *
 * <p>
 * Salience halves every {@code memory.forgetting.salience-half-life-days}. An
 * episode cited as evidence by a non-retracted belief or by a skill keeps its
 * salience and is never pruned. Episodes above the watermark have not been
 * consolidated yet and are left alone.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ForgettingPolicyService {

    private static final double SALIENCE_EPSILON = 1e-9;
    private static final double SECONDS_PER_DAY = 86_400.0;

    private final MemoryProperties properties;

    public ForgettingPlan plan(Collection<Episode> episodes, Collection<Belief> beliefs, Collection<Skill> skills,
            long watermark, Instant now) {
        MemoryProperties.ForgettingProperties config = properties.getForgetting();
        Set<Long> cited = citedEpisodeIds(beliefs, skills);

        Map<Long, Double> salienceUpdates = new LinkedHashMap<>();
        Set<Long> prunes = new LinkedHashSet<>();
        for (Episode episode : episodes) {
            if (episode.getId() > watermark || episode.isPruned() || cited.contains(episode.getId())) {
                continue;
            }
            double ageDays = ageDays(episode, now);
            double decayed = decayedSalience(episode.getInitialSalience(), ageDays, config.getSalienceHalfLifeDays());
            if (Math.abs(decayed - episode.getSalience()) > SALIENCE_EPSILON) {
                salienceUpdates.put(episode.getId(), decayed);
            }
            if (decayed < config.getPruneFloor() && ageDays > config.getRetentionDays()) {
                prunes.add(episode.getId());
            }
        }
        if (!prunes.isEmpty()) {
            log.info("[Forgetting] {} episode(s) scheduled for pruning", prunes.size());
        }
        return new ForgettingPlan(salienceUpdates, prunes);
    }

    public static double decayedSalience(double initial, double ageDays, double halfLifeDays) {
        if (halfLifeDays <= 0.0 || ageDays <= 0.0) {
            return initial;
        }
        return initial * Math.pow(0.5, ageDays / halfLifeDays);
    }

    private static double ageDays(Episode episode, Instant now) {
        if (episode.getTimestamp() == null) {
            return 0.0;
        }
        return Duration.between(episode.getTimestamp(), now).getSeconds() / SECONDS_PER_DAY;
    }

    private static Set<Long> citedEpisodeIds(Collection<Belief> beliefs, Collection<Skill> skills) {
        Set<Long> cited = new HashSet<>();
        for (Belief belief : beliefs) {
            if (belief.getStatus() != Belief.Status.RETRACTED) {
                cited.addAll(belief.getEvidenceIds());
            }
        }
        for (Skill skill : skills) {
            cited.addAll(skill.getEvidenceIds());
        }
        return cited;
    }
}
