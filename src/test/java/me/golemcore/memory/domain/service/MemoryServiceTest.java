package me.golemcore.memory.domain.service;

import me.golemcore.memory.domain.exception.ValidationFailureException;
import me.golemcore.memory.domain.model.Belief;
import me.golemcore.memory.domain.model.ConsolidationReport;
import me.golemcore.memory.domain.model.ConsolidationState;
import me.golemcore.memory.domain.model.Episode;
import me.golemcore.memory.domain.model.Goal;
import me.golemcore.memory.domain.model.MemoryEntityType;
import me.golemcore.memory.domain.model.MemoryQuery;
import me.golemcore.memory.domain.model.ScoredMemory;
import me.golemcore.memory.testsupport.MemoryFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class MemoryServiceTest {

    @TempDir
    Path tempDir;

    private MemoryFixture fixture;
    private MemoryService memoryService;

    @BeforeEach
    void setUp() {
        fixture = new MemoryFixture(tempDir);
        MemoryRetrievalService retrievalService = new MemoryRetrievalService(fixture.store, fixture.embeddingPort,
                fixture.properties, fixture.clock);
        memoryService = new MemoryService(fixture.store, retrievalService, fixture.consolidationService,
                new GoalService(fixture.store, fixture.clock),
                new HypothesisService(fixture.store, fixture.clock),
                fixture.properties);
    }

    @Test
    void shouldAppendEpisodeWithDefaults() {
        long id = memoryService.appendEpisode(null, "Checked the build dashboard", Map.of("board", "ci"), null,
                List.of("ci"), null, true);

        Episode episode = memoryService.getEpisode(id).orElseThrow();
        assertEquals(Episode.Kind.OBSERVATION, episode.getKind());
        assertEquals(0.5, episode.getSalience());
        assertEquals(Episode.PrivacyLevel.INTERNAL, episode.getPrivacyLevel());
        assertEquals("ci", episode.getPayload().field("board"));
        assertTrue(episode.getPayload().isVerified());
        assertEquals(MemoryFixture.START, episode.getTimestamp());
    }

    @Test
    void shouldRejectInvalidEpisodes() {
        assertThrows(ValidationFailureException.class,
                () -> memoryService.appendEpisode(Episode.Kind.ACTION, " ", null, null, null, null, false));
        assertThrows(ValidationFailureException.class,
                () -> memoryService.appendEpisode(Episode.Kind.ACTION, "ran tests", null, -0.1, null, null,
                        false));
        assertTrue(fixture.store.listEpisodes().isEmpty());
    }

    @Test
    void shouldFindConsolidatedBeliefThroughQuery() {
        memoryService.appendEpisode(Episode.Kind.OBSERVATION, "User said: I love lo-fi music", null, null,
                null, null, false);
        fixture.clock.advance(Duration.ofMinutes(5));

        ConsolidationReport report = memoryService.consolidate();
        List<ScoredMemory> results = memoryService.queryMemory(MemoryQuery.builder()
                .queryText("lo-fi music")
                .types(Set.of(MemoryEntityType.BELIEF))
                .build());

        assertEquals(1, report.getBeliefsCreated());
        assertEquals(report.getWatermark(), memoryService.getWatermark());
        assertEquals(ConsolidationState.IDLE, memoryService.getConsolidationState());
        assertEquals(1, results.size());
        assertEquals("user likes lo-fi music", results.get(0).getText());
        Belief belief = memoryService.getBelief(results.get(0).getRef().id()).orElseThrow();
        assertEquals(Belief.Status.PROPOSED, belief.getStatus());
    }

    @Test
    void shouldExposeEvidenceProvenance() {
        long id = memoryService.appendEpisode(Episode.Kind.PERCEPTION, "Screen shows a red banner", null, null,
                null, Episode.PrivacyLevel.RESTRICTED, false);

        var provenance = memoryService.getEvidenceProvenance(id).orElseThrow();

        assertEquals(id, provenance.episodeId());
        assertNotNull(provenance.contentHash());
        assertFalse(provenance.pruned());
    }

    @Test
    void activeGoalShouldLiftRelatedMemories() {
        memoryService.appendEpisode(Episode.Kind.OBSERVATION, "Read about piano chords", null, null, null, null,
                false);
        memoryService.appendEpisode(Episode.Kind.OBSERVATION, "Watered the plants", null, null, null, null,
                false);
        Goal goal = memoryService.createGoal("practice piano daily", 8, null, null, null);

        List<ScoredMemory> results = memoryService.queryMemory(MemoryQuery.builder()
                .activeGoalId(goal.getId())
                .types(Set.of(MemoryEntityType.EPISODE))
                .build());

        assertEquals("Read about piano chords", results.get(0).getText());
    }

    @Test
    void shouldDelegateGoalAndHypothesisLifecycle() {
        Goal goal = memoryService.createGoal("practice piano daily", null, null, null, null);
        memoryService.updateGoalProgress(goal.getId(), 0.4);
        memoryService.updateGoalStatus(goal.getId(), Goal.GoalStatus.BLOCKED);
        var hypothesis = memoryService.registerHypothesis("Metronome is helpful", null, 0.5, null, null);
        memoryService.resolveHypothesis(hypothesis.getId(), false, null);

        assertEquals(Goal.GoalStatus.BLOCKED, memoryService.getGoal(goal.getId()).orElseThrow().getStatus());
        assertEquals(0.4, memoryService.listGoals().get(0).getProgress());
        assertEquals(1, memoryService.listHypotheses().size());
        assertTrue(memoryService.getHypothesis(hypothesis.getId()).isPresent());
    }
}
