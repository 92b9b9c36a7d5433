package me.golemcore.memory.domain.service;

import me.golemcore.memory.domain.model.Belief;
import me.golemcore.memory.domain.model.Episode;
import me.golemcore.memory.domain.model.EpisodePayload;
import me.golemcore.memory.domain.model.ForgettingPlan;
import me.golemcore.memory.domain.model.Skill;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ForgettingPolicyServiceTest {

    private static final Instant NOW = Instant.parse("2026-05-01T00:00:00Z");
    private static final double EPSILON = 1e-9;

    private ForgettingPolicyService policy;

    @BeforeEach
    void setUp() {
        policy = new ForgettingPolicyService(new MemoryProperties());
    }

    @Test
    void shouldHalveSalienceEveryHalfLife() {
        assertEquals(0.4, ForgettingPolicyService.decayedSalience(0.8, 7.0, 7.0), EPSILON);
        assertEquals(0.2, ForgettingPolicyService.decayedSalience(0.8, 14.0, 7.0), EPSILON);
        assertEquals(0.8, ForgettingPolicyService.decayedSalience(0.8, 0.0, 7.0), EPSILON);
    }

    @Test
    void shouldDecayWithoutPruningInsideRetention() {
        Episode episode = episode(1L, 0.4, Duration.ofDays(14));

        ForgettingPlan plan = policy.plan(List.of(episode), List.of(), List.of(), 1L, NOW);

        assertEquals(0.1, plan.salienceUpdates().get(1L), EPSILON);
        assertTrue(plan.prunes().isEmpty());
    }

    @Test
    void shouldPruneFadedEpisodeOlderThanRetention() {
        Episode episode = episode(1L, 0.5, Duration.ofDays(40));

        ForgettingPlan plan = policy.plan(List.of(episode), List.of(), List.of(), 1L, NOW);

        assertEquals(Set.of(1L), plan.prunes());
        assertTrue(plan.salienceUpdates().get(1L) < 0.1);
    }

    @Test
    void shouldNeverTouchEpisodesCitedByLiveBeliefsOrSkills() {
        Episode byBelief = episode(1L, 0.5, Duration.ofDays(60));
        Episode bySkill = episode(2L, 0.5, Duration.ofDays(60));
        Episode byRetracted = episode(3L, 0.5, Duration.ofDays(60));
        Belief live = Belief.builder().id(10L).status(Belief.Status.DISPUTED)
                .evidenceIds(new LinkedHashSet<>(List.of(1L))).build();
        Belief retracted = Belief.builder().id(11L).status(Belief.Status.RETRACTED)
                .evidenceIds(new LinkedHashSet<>(List.of(3L))).build();
        Skill skill = Skill.builder().id(20L).name("deploy")
                .evidenceIds(new LinkedHashSet<>(List.of(2L))).build();

        ForgettingPlan plan = policy.plan(List.of(byBelief, bySkill, byRetracted), List.of(live, retracted),
                List.of(skill), 3L, NOW);

        assertEquals(Set.of(3L), plan.prunes());
        assertFalse(plan.salienceUpdates().containsKey(1L));
        assertFalse(plan.salienceUpdates().containsKey(2L));
    }

    @Test
    void shouldKeepEvidenceOfArchivedBeliefsPinned() {
        Episode byArchived = episode(1L, 0.5, Duration.ofDays(90));
        Belief archived = Belief.builder().id(10L).status(Belief.Status.ARCHIVED)
                .evidenceIds(new LinkedHashSet<>(List.of(1L))).build();

        ForgettingPlan plan = policy.plan(List.of(byArchived), List.of(archived), List.of(), 1L, NOW);

        assertTrue(plan.isEmpty());
    }

    @Test
    void shouldSkipUnconsolidatedAndAlreadyPrunedEpisodes() {
        Episode pending = episode(5L, 0.5, Duration.ofDays(60));
        Episode pruned = episode(2L, 0.5, Duration.ofDays(60));
        pruned.setPruned(true);
        pruned.setPayload(null);

        ForgettingPlan plan = policy.plan(List.of(pending, pruned), List.of(), List.of(), 4L, NOW);

        assertTrue(plan.isEmpty());
    }

    @Test
    void shouldNotReportUnchangedSalience() {
        Episode fresh = episode(1L, 0.5, Duration.ZERO);

        ForgettingPlan plan = policy.plan(List.of(fresh), List.of(), List.of(), 1L, NOW);

        assertTrue(plan.isEmpty());
    }

    private static Episode episode(long id, double salience, Duration age) {
        return Episode.builder()
                .id(id)
                .timestamp(NOW.minus(age))
                .kind(Episode.Kind.OBSERVATION)
                .payload(EpisodePayload.ofText("episode " + id))
                .initialSalience(salience)
                .salience(salience)
                .build();
    }
}
