package me.golemcore.memory.domain.service;

import me.golemcore.memory.domain.exception.ValidationFailureException;
import me.golemcore.memory.domain.model.Belief;
import me.golemcore.memory.domain.model.Episode;
import me.golemcore.memory.domain.model.EpisodePayload;
import me.golemcore.memory.domain.model.Goal;
import me.golemcore.memory.domain.model.MemoryEntityType;
import me.golemcore.memory.domain.model.MemoryQuery;
import me.golemcore.memory.domain.model.ScoredMemory;
import me.golemcore.memory.domain.model.Skill;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.EmbeddingPort;
import me.golemcore.memory.port.outbound.MemoryStorePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MemoryRetrievalServiceTest {

    private static final Instant NOW = Instant.parse("2026-04-01T12:00:00Z");
    private static final double EPSILON = 1e-9;

    private MemoryStorePort memoryStore;
    private EmbeddingPort embeddingPort;
    private MemoryRetrievalService retrievalService;

    @BeforeEach
    void setUp() {
        memoryStore = mock(MemoryStorePort.class);
        embeddingPort = mock(EmbeddingPort.class);
        when(embeddingPort.isAvailable()).thenReturn(false);
        when(embeddingPort.cosineSimilarity(any(), any())).thenCallRealMethod();
        retrievalService = new MemoryRetrievalService(memoryStore, embeddingPort, new MemoryProperties(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldRankMoreRecentBeliefFirstOnEqualMatch() {
        Belief yesterday = belief(1L, "user likes lo-fi music", 0.9, NOW.minus(Duration.ofDays(1)));
        Belief hourAgo = belief(2L, "user likes lo-fi music", 0.9, NOW.minus(Duration.ofHours(1)));
        when(memoryStore.listBeliefs()).thenReturn(List.of(yesterday, hourAgo));

        List<ScoredMemory> results = retrievalService.retrieve(query("lo-fi music"));

        assertEquals(2, results.size());
        assertEquals(2L, results.get(0).getRef().id());
        assertTrue(results.get(0).getScore() > results.get(1).getScore());
    }

    @Test
    void shouldScoreWithoutVectorsUsingRenormalizedWeights() {
        when(memoryStore.listBeliefs()).thenReturn(List.of(belief(1L, "user likes jazz", 0.9, NOW)));

        ScoredMemory result = retrievalService.retrieve(query("jazz")).get(0);

        assertEquals((0.35 + 0.20 + 0.9 * 0.25) / 0.80, result.getScore(), EPSILON);
    }

    @Test
    void shouldAddVectorTermOnlyForMatchingDimensions() {
        Belief aligned = belief(1L, "user likes jazz", 0.9, NOW);
        aligned.setEmbedding(new float[] { 1.0f, 0.0f });
        Belief opposite = belief(2L, "user likes jazz", 0.9, NOW);
        opposite.setEmbedding(new float[] { -1.0f, 0.0f });
        Belief mismatched = belief(3L, "user likes jazz", 0.9, NOW);
        mismatched.setEmbedding(new float[] { 1.0f, 0.0f, 0.0f });
        when(memoryStore.listBeliefs()).thenReturn(List.of(aligned, opposite, mismatched));

        MemoryQuery query = query("jazz");
        query.setQueryVector(new float[] { 1.0f, 0.0f });
        List<ScoredMemory> results = retrievalService.retrieve(query);

        assertEquals(List.of(1L, 3L, 2L), results.stream().map(item -> item.getRef().id()).toList());
        assertEquals(0.975, results.get(0).getScore(), EPSILON);
        assertEquals((0.35 + 0.20 + 0.9 * 0.25) / 0.80, results.get(1).getScore(), EPSILON);
        assertEquals(0.775, results.get(2).getScore(), EPSILON);
    }

    @Test
    void shouldEmbedQueryTextWhenProviderAvailable() {
        when(embeddingPort.isAvailable()).thenReturn(true);
        when(embeddingPort.embed(anyString()))
                .thenReturn(CompletableFuture.completedFuture(new float[] { 0.0f, 1.0f }));
        Belief belief = belief(1L, "user likes jazz", 0.9, NOW);
        belief.setEmbedding(new float[] { 0.0f, 1.0f });
        when(memoryStore.listBeliefs()).thenReturn(List.of(belief));

        ScoredMemory result = retrievalService.retrieve(query("jazz")).get(0);

        verify(embeddingPort).embed("jazz");
        assertEquals(0.975, result.getScore(), EPSILON);
    }

    @Test
    void shouldRankWithoutVectorsWhenQueryEmbeddingFails() {
        when(embeddingPort.isAvailable()).thenReturn(true);
        when(embeddingPort.embed(anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("quota")));
        when(memoryStore.listBeliefs()).thenReturn(List.of(belief(1L, "user likes jazz", 0.9, NOW)));

        ScoredMemory result = retrievalService.retrieve(query("jazz")).get(0);

        assertEquals((0.35 + 0.20 + 0.9 * 0.25) / 0.80, result.getScore(), EPSILON);
    }

    @Test
    void shouldBoostCandidatesRelatedToActiveGoal() {
        when(memoryStore.getGoal(5L)).thenReturn(Optional.of(Goal.builder()
                .id(5L)
                .description("learn jazz piano")
                .build()));
        when(memoryStore.listBeliefs()).thenReturn(List.of(
                belief(1L, "user likes tea", 0.9, NOW),
                belief(2L, "user likes jazz", 0.9, NOW)));

        MemoryQuery query = MemoryQuery.builder().activeGoalId(5L).types(Set.of(MemoryEntityType.BELIEF)).build();
        List<ScoredMemory> results = retrievalService.retrieve(query);

        assertEquals(2L, results.get(0).getRef().id());
        assertEquals(0.15, results.get(0).getScore() - results.get(1).getScore(), EPSILON);
    }

    @Test
    void shouldIgnoreTerminalGoal() {
        when(memoryStore.getGoal(5L)).thenReturn(Optional.of(Goal.builder()
                .id(5L)
                .description("learn jazz piano")
                .status(Goal.GoalStatus.COMPLETED)
                .build()));
        when(memoryStore.listBeliefs()).thenReturn(List.of(
                belief(1L, "user likes tea", 0.9, NOW),
                belief(2L, "user likes jazz", 0.9, NOW)));

        MemoryQuery query = MemoryQuery.builder().activeGoalId(5L).types(Set.of(MemoryEntityType.BELIEF)).build();
        List<ScoredMemory> results = retrievalService.retrieve(query);

        assertEquals(results.get(0).getScore(), results.get(1).getScore(), EPSILON);
        assertEquals(1L, results.get(0).getRef().id());
    }

    @Test
    void shouldExcludeArchivedBeliefsAndPrunedEpisodes() {
        Belief archived = belief(1L, "user likes jazz", 0.9, NOW);
        archived.setStatus(Belief.Status.ARCHIVED);
        Belief retracted = belief(2L, "user likes jazz", 0.2, NOW);
        retracted.setStatus(Belief.Status.RETRACTED);
        Episode pruned = Episode.builder().id(3L).timestamp(NOW).pruned(true).build();
        Episode kept = Episode.builder()
                .id(4L)
                .timestamp(NOW)
                .kind(Episode.Kind.OBSERVATION)
                .payload(EpisodePayload.ofText("played some jazz"))
                .salience(0.5)
                .build();
        when(memoryStore.listBeliefs()).thenReturn(List.of(archived, retracted));
        when(memoryStore.listEpisodes()).thenReturn(List.of(pruned, kept));

        List<ScoredMemory> results = retrievalService.retrieve(query("jazz"));

        assertEquals(2, results.size());
        assertTrue(results.stream().anyMatch(item -> item.getRef().type() == MemoryEntityType.EPISODE
                && item.getRef().id() == 4L));
        assertTrue(results.stream().anyMatch(item -> item.getRef().type() == MemoryEntityType.BELIEF
                && item.getRef().id() == 2L));
    }

    @Test
    void shouldRestrictToRequestedTypes() {
        when(memoryStore.listSkills()).thenReturn(List.of(Skill.builder()
                .id(1L)
                .name("deploy")
                .steps(List.of("build", "ship"))
                .successRate(0.5)
                .updatedAt(NOW)
                .build()));

        MemoryQuery query = MemoryQuery.builder().queryText("deploy").types(Set.of(MemoryEntityType.SKILL))
                .build();
        List<ScoredMemory> results = retrievalService.retrieve(query);

        assertEquals(1, results.size());
        assertEquals(MemoryEntityType.SKILL, results.get(0).getRef().type());
        verify(memoryStore, never()).listBeliefs();
    }

    @Test
    void shouldApplyTopK() {
        when(memoryStore.listBeliefs()).thenReturn(List.of(
                belief(1L, "user likes jazz", 0.9, NOW),
                belief(2L, "user likes tea", 0.8, NOW),
                belief(3L, "user likes chess", 0.7, NOW)));

        MemoryQuery query = query("jazz");
        query.setTopK(2);

        assertEquals(2, retrievalService.retrieve(query).size());
    }

    @Test
    void shouldRejectNonPositiveTopK() {
        MemoryQuery query = query("jazz");
        query.setTopK(0);

        assertThrows(ValidationFailureException.class, () -> retrievalService.retrieve(query));
    }

    private static MemoryQuery query(String text) {
        return MemoryQuery.builder().queryText(text).build();
    }

    private static Belief belief(long id, String statement, double confidence, Instant updatedAt) {
        return Belief.builder()
                .id(id)
                .statement(statement)
                .subject(statement)
                .stance("likes")
                .confidence(confidence)
                .createdAt(updatedAt)
                .updatedAt(updatedAt)
                .build();
    }
}
