package me.golemcore.memory.domain.service;

import me.golemcore.memory.domain.exception.ConsolidationAbortedException;
import me.golemcore.memory.domain.exception.StorageUnavailableException;
import me.golemcore.memory.domain.model.Belief;
import me.golemcore.memory.domain.model.ConsolidationReport;
import me.golemcore.memory.domain.model.ConsolidationState;
import me.golemcore.memory.domain.model.Episode;
import me.golemcore.memory.domain.model.EpisodePayload;
import me.golemcore.memory.domain.model.Hypothesis;
import me.golemcore.memory.domain.model.SelfModelEntry;
import me.golemcore.memory.domain.model.Skill;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.BeliefExtractionPort;
import me.golemcore.memory.port.outbound.EmbeddingPort;
import me.golemcore.memory.port.outbound.MemoryStorePort;
import me.golemcore.memory.testsupport.MemoryFixture;
import me.golemcore.memory.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ConsolidationServiceTest {

    private static final double EPSILON = 1e-9;

    @TempDir
    Path tempDir;

    private MemoryFixture fixture;
    private ConsolidationService service;

    @BeforeEach
    void setUp() {
        fixture = new MemoryFixture(tempDir);
        service = fixture.consolidationService;
    }

    @Test
    void shouldCreateProposedBeliefFromPreferenceEpisode() {
        long episodeId = fixture.append("User said: I love lo-fi music");

        ConsolidationReport report = service.consolidate();

        assertEquals(ConsolidationReport.Outcome.COMMITTED, report.getOutcome());
        assertEquals(1, report.getBeliefsCreated());
        assertEquals(episodeId, report.getWatermark());
        List<Belief> beliefs = fixture.store.listBeliefs();
        assertEquals(1, beliefs.size());
        Belief belief = beliefs.get(0);
        assertEquals("user likes lo-fi music", belief.getStatement());
        assertEquals(Belief.Status.PROPOSED, belief.getStatus());
        assertTrue(belief.getConfidence() > 0.0 && belief.getConfidence() < 1.0);
        assertTrue(belief.getEvidenceIds().contains(episodeId));
        assertEquals(episodeId, fixture.store.getWatermark());
    }

    @Test
    void shouldCorroborateRepeatedPreferenceUntilConfirmed() {
        for (int i = 0; i < 4; i++) {
            fixture.append("User said: I love lo-fi music");
        }

        ConsolidationReport report = service.consolidate();

        List<Belief> beliefs = fixture.store.listBeliefs();
        assertEquals(1, beliefs.size());
        Belief belief = beliefs.get(0);
        assertEquals(0.8628, belief.getConfidence(), EPSILON);
        assertEquals(4, belief.getEvidenceIds().size());
        assertEquals(Belief.Status.CONFIRMED, belief.getStatus());
        assertNotNull(belief.getLastConfirmedAt());
        assertEquals(1, report.getBeliefsConfirmed());
    }

    @Test
    void shouldDisputeConfirmedBeliefWhenContradicted() {
        for (int i = 0; i < 4; i++) {
            fixture.append("User said: I love lo-fi music");
        }
        service.consolidate();
        Belief confirmed = fixture.store.listBeliefs().get(0);
        assertEquals(Belief.Status.CONFIRMED, confirmed.getStatus());

        fixture.clock.advance(Duration.ofHours(1));
        fixture.append("User said: I hate lo-fi music");
        ConsolidationReport report = service.consolidate();

        List<Belief> beliefs = fixture.store.listBeliefs();
        assertEquals(2, beliefs.size());
        Belief likes = beliefs.get(0);
        Belief dislikes = beliefs.get(1);
        assertEquals("user dislikes lo-fi music", dislikes.getStatement());
        assertEquals(Belief.Status.DISPUTED, likes.getStatus());
        assertEquals(Belief.Status.DISPUTED, dislikes.getStatus());
        assertTrue(likes.getConflictsWithIds().contains(dislikes.getId()));
        assertTrue(dislikes.getConflictsWithIds().contains(likes.getId()));
        assertEquals(0.7628, likes.getConfidence(), EPSILON);
        assertEquals(0.5, dislikes.getConfidence(), EPSILON);
        assertEquals(2, report.getBeliefsDisputed());
    }

    @Test
    void shouldBeIdempotentWhenNoNewEpisodes() {
        for (int i = 0; i < 4; i++) {
            fixture.append("User said: I love lo-fi music");
        }
        service.consolidate();
        fixture.append("User said: I hate lo-fi music");
        service.consolidate();
        List<Belief> before = fixture.store.listBeliefs();
        long watermark = fixture.store.getWatermark();

        ConsolidationReport report = service.consolidate();

        assertEquals(before, fixture.store.listBeliefs());
        assertEquals(watermark, fixture.store.getWatermark());
        assertEquals(0, report.getEpisodesProcessed());
        assertEquals(0, report.getBeliefsCreated());
        assertEquals(0, report.getBeliefsUpdated());
        assertEquals(0, report.getBeliefsDisputed());
    }

    @Test
    void shouldAdvanceWatermarkInBatches() {
        fixture.properties.getConsolidation().setBatchSize(2);
        fixture.append("first observation");
        long second = fixture.append("second observation");
        long third = fixture.append("third observation");

        ConsolidationReport first = service.consolidate();
        ConsolidationReport next = service.consolidate();

        assertEquals(2, first.getEpisodesProcessed());
        assertEquals(second, first.getWatermark());
        assertEquals(1, next.getEpisodesProcessed());
        assertEquals(second, next.getPriorWatermark());
        assertEquals(third, next.getWatermark());
    }

    @Test
    void shouldAbortWithoutChangesWhenExtractionFails() {
        when(fixture.extractionPort.isAvailable()).thenReturn(true);
        when(fixture.extractionPort.extract(anyList())).thenThrow(new IllegalStateException("provider down"));
        fixture.append("User said: I love lo-fi music");

        ConsolidationAbortedException exception = assertThrows(ConsolidationAbortedException.class,
                () -> service.consolidate());

        assertTrue(exception.getMessage().contains("provider down"));
        assertEquals(0L, exception.getWatermark());
        assertEquals(0L, fixture.store.getWatermark());
        assertTrue(fixture.store.listBeliefs().isEmpty());
        assertEquals(ConsolidationState.IDLE, service.getState());
    }

    @Test
    void shouldFallBackToHeuristicsWhenExtractionAnswerIsUnparseable() {
        when(fixture.extractionPort.isAvailable()).thenReturn(true);
        when(fixture.extractionPort.extract(anyList())).thenReturn(Optional.empty());
        fixture.append("User said: I prefer dark roast coffee");

        service.consolidate();

        List<Belief> beliefs = fixture.store.listBeliefs();
        assertEquals(1, beliefs.size());
        assertEquals("user likes dark roast coffee", beliefs.get(0).getStatement());
    }

    @Test
    void shouldAbortWhenCommitFails() {
        MemoryStorePort store = mock(MemoryStorePort.class);
        MemoryProperties properties = new MemoryProperties();
        BeliefExtractionPort extractionPort = mock(BeliefExtractionPort.class);
        EmbeddingPort embeddingPort = mock(EmbeddingPort.class);
        Episode episode = Episode.builder()
                .id(1L)
                .timestamp(MemoryFixture.START)
                .kind(Episode.Kind.OBSERVATION)
                .payload(EpisodePayload.ofText("User said: I love lo-fi music"))
                .build();
        when(store.getWatermark()).thenReturn(0L);
        when(store.getHighestEpisodeId()).thenReturn(1L);
        when(store.listEpisodesInRange(anyLong(), anyLong(), anyInt())).thenReturn(List.of(episode));
        when(store.listEpisodes()).thenReturn(List.of(episode));
        when(store.listBeliefs()).thenReturn(List.of());
        when(store.listSkills()).thenReturn(List.of());
        when(store.listHypotheses()).thenReturn(List.of());
        when(store.nextId(any())).thenReturn(1L);
        doThrow(new StorageUnavailableException("disk full", null)).when(store).applyConsolidationBatch(any());
        ConsolidationService failing = new ConsolidationService(store,
                new ReplayMinerService(store, extractionPort, new HeuristicBeliefExtractor(properties), properties),
                new ContradictionResolverService(properties), new ForgettingPolicyService(properties),
                embeddingPort, properties, new MutableClock(MemoryFixture.START));

        ConsolidationAbortedException exception = assertThrows(ConsolidationAbortedException.class,
                failing::consolidate);

        assertTrue(exception.getMessage().contains("disk full"));
        assertEquals(ConsolidationState.IDLE, failing.getState());
    }

    @Test
    void shouldRejectConcurrentTrigger() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(fixture.extractionPort.isAvailable()).thenReturn(true);
        when(fixture.extractionPort.extract(anyList())).thenAnswer(invocation -> {
            entered.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
            return Optional.of(List.of());
        });
        fixture.append("an observation");

        CompletableFuture<ConsolidationReport> first = CompletableFuture.supplyAsync(service::consolidate);
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        ConsolidationReport second = service.consolidate();
        release.countDown();
        ConsolidationReport firstReport = first.get(5, TimeUnit.SECONDS);

        assertEquals(ConsolidationReport.Outcome.REJECTED_CONCURRENT, second.getOutcome());
        assertEquals(ConsolidationReport.Outcome.COMMITTED, firstReport.getOutcome());
        assertEquals(ConsolidationState.IDLE, service.getState());
    }

    @Test
    void shouldLearnSkillsAndSelfModelFromOutcomes() {
        fixture.appendAction("deployed service", Map.of(
                EpisodePayload.FIELD_SKILL, "deploy",
                EpisodePayload.FIELD_OUTCOME, "success",
                EpisodePayload.FIELD_STEPS, "build; push; restart"));
        fixture.appendAction("deploy failed", Map.of(
                EpisodePayload.FIELD_SKILL, "deploy",
                EpisodePayload.FIELD_OUTCOME, "failure",
                EpisodePayload.FIELD_FAILURE_MODE, "timeout"));

        ConsolidationReport report = service.consolidate();

        assertEquals(1, report.getSkillsUpdated());
        Skill skill = fixture.store.findSkillByName("deploy").orElseThrow();
        assertEquals(2, skill.getAttempts());
        assertEquals(1, skill.getSuccesses());
        assertEquals(0.5, skill.getSuccessRate(), EPSILON);
        assertEquals(List.of(1.0, 0.5), skill.getSuccessRateHistory());
        assertEquals(List.of("build", "push", "restart"), skill.getSteps());
        assertTrue(skill.getFailureModes().contains("timeout"));
        SelfModelEntry entry = fixture.store.getSelfModelEntry("deploy").orElseThrow();
        assertEquals(0.75, entry.getReliabilityScore(), EPSILON);
        assertTrue(entry.getLimitations().contains("timeout"));
    }

    @Test
    void shouldPromoteVerifiedHypothesisOnce() {
        Hypothesis hypothesis = fixture.store.saveHypothesis(Hypothesis.builder()
                .claim("the cache is stale")
                .confidence(0.9)
                .status(Hypothesis.HypothesisStatus.VERIFIED)
                .build());

        ConsolidationReport first = service.consolidate();
        ConsolidationReport second = service.consolidate();

        assertEquals(1, first.getHypothesesPromoted());
        assertEquals(0, second.getHypothesesPromoted());
        Hypothesis promoted = fixture.store.getHypothesis(hypothesis.getId()).orElseThrow();
        assertNotNull(promoted.getPromotedBeliefId());
        Belief belief = fixture.store.getBelief(promoted.getPromotedBeliefId()).orElseThrow();
        assertTrue(belief.isVerified());
        assertEquals("the cache is stale", belief.getStatement());
        assertEquals(0.9, belief.getConfidence(), EPSILON);
        assertEquals(1, fixture.store.listBeliefs().size());
    }

    @Test
    void shouldPruneForgottenEpisodeButKeepItsHash() {
        long episodeId = fixture.append("ran ls in the scratch directory", 0.05);
        String hash = fixture.store.getEpisode(episodeId).orElseThrow().getContentHash();
        fixture.clock.advance(Duration.ofDays(31));

        ConsolidationReport report = service.consolidate();

        assertEquals(1, report.getEpisodesPruned());
        Episode pruned = fixture.store.getEpisode(episodeId).orElseThrow();
        assertTrue(pruned.isPruned());
        assertNull(pruned.getPayload());
        assertEquals(hash, fixture.store.getEvidenceProvenance(episodeId).orElseThrow().contentHash());
    }

    @Test
    void shouldNeverPruneEpisodeCitedAsEvidence() {
        long episodeId = fixture.append("User said: I love jazz", 0.05);
        fixture.clock.advance(Duration.ofDays(31));

        ConsolidationReport report = service.consolidate();

        assertEquals(0, report.getEpisodesPruned());
        Episode episode = fixture.store.getEpisode(episodeId).orElseThrow();
        assertFalse(episode.isPruned());
        assertNotNull(episode.getPayload());
    }

    @Test
    void shouldEmbedNewBeliefsInOneBatchWhenEmbeddingAvailable() {
        when(fixture.embeddingPort.isAvailable()).thenReturn(true);
        when(fixture.embeddingPort.embedBatch(List.of("user likes lo-fi music")))
                .thenReturn(CompletableFuture.completedFuture(List.of(new float[] { 0.1f, 0.2f })));
        fixture.append("User said: I love lo-fi music");

        service.consolidate();

        Belief belief = fixture.store.listBeliefs().get(0);
        assertNotNull(belief.getEmbedding());
        assertEquals(2, belief.getEmbedding().length);
        verify(fixture.embeddingPort, never()).embed(anyString());
    }

    @Test
    void shouldCommitBeliefsWithoutVectorsWhenBatchEmbeddingFails() {
        when(fixture.embeddingPort.isAvailable()).thenReturn(true);
        when(fixture.embeddingPort.embedBatch(anyList()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("rate limited")));
        fixture.append("User said: I love lo-fi music");

        ConsolidationReport report = service.consolidate();

        assertEquals(1, report.getBeliefsCreated());
        assertNull(fixture.store.listBeliefs().get(0).getEmbedding());
    }

    @Test
    void shouldReleaseRunSlotWhenRunFailsWithError() {
        when(fixture.extractionPort.isAvailable()).thenReturn(true);
        when(fixture.extractionPort.extract(anyList())).thenThrow(new StackOverflowError());
        long episodeId = fixture.append("User said: I love lo-fi music");

        assertThrows(StackOverflowError.class, service::consolidate);

        assertEquals(ConsolidationState.IDLE, service.getState());
        assertEquals(0L, fixture.store.getWatermark());

        when(fixture.extractionPort.isAvailable()).thenReturn(false);
        ConsolidationReport retry = service.consolidate();

        assertEquals(ConsolidationReport.Outcome.COMMITTED, retry.getOutcome());
        assertEquals(episodeId, retry.getWatermark());
        assertEquals(1, retry.getBeliefsCreated());
    }

    @Test
    void shouldLeaveEpisodeAppendedDuringRunForNextRun() {
        long firstId = fixture.append("an observation");
        fixture.clock.advance(Duration.ofDays(1));
        AtomicLong lateId = new AtomicLong();
        when(fixture.extractionPort.isAvailable()).thenReturn(true);
        when(fixture.extractionPort.extract(anyList())).thenAnswer(invocation -> {
            lateId.set(fixture.append("User said: I love jazz"));
            return Optional.of(List.of());
        });

        ConsolidationReport first = service.consolidate();

        assertEquals(firstId, first.getWatermark());
        assertEquals(1, first.getEpisodesProcessed());
        assertEquals(firstId, fixture.store.getWatermark());
        assertTrue(fixture.store.getEpisode(firstId).orElseThrow().getSalience() < 0.5);
        Episode late = fixture.store.getEpisode(lateId.get()).orElseThrow();
        assertEquals(late.getInitialSalience(), late.getSalience(), EPSILON);
        assertEquals(late.getCreatedAt(), late.getUpdatedAt());
        assertTrue(fixture.store.listBeliefs().stream()
                .noneMatch(belief -> belief.getEvidenceIds().contains(lateId.get())));

        when(fixture.extractionPort.isAvailable()).thenReturn(false);
        ConsolidationReport second = service.consolidate();

        assertEquals(lateId.get(), second.getWatermark());
        assertEquals(1, second.getEpisodesProcessed());
        assertTrue(fixture.store.listBeliefs().stream()
                .anyMatch(belief -> belief.getEvidenceIds().contains(lateId.get())));
    }
}
