package me.golemcore.memory.adapter.outbound.llm;

import dev.langchain4j.model.chat.ChatModel;
import me.golemcore.memory.domain.model.Belief;
import me.golemcore.memory.domain.model.BeliefCandidate;
import me.golemcore.memory.domain.model.Episode;
import me.golemcore.memory.domain.model.EpisodePayload;
import me.golemcore.memory.infrastructure.config.AutoConfiguration;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class Langchain4jBeliefExtractionAdapterTest {

    private MemoryProperties properties;
    private ChatModel chatModel;
    private Langchain4jBeliefExtractionAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new MemoryProperties();
        properties.getLlm().setApiKey("test-key");
        chatModel = mock(ChatModel.class);
        adapter = new Langchain4jBeliefExtractionAdapter(properties, AutoConfiguration.objectMapper()) {
            @Override
            protected ChatModel createChatModel(MemoryProperties.LlmProperties config) {
                return chatModel;
            }
        };
    }

    @Test
    void shouldBeUnavailableWithoutApiKey() {
        properties.getLlm().setApiKey(" ");

        assertFalse(adapter.isAvailable());
        assertThrows(IllegalStateException.class, () -> adapter.extract(List.of(episode(1L, "hi", false))));
    }

    @Test
    void shouldParseCandidatesFromFencedAnswer() {
        when(chatModel.chat(anyString())).thenReturn("""
                Here you go:
                ```json
                [
                  {"statement": "user dislikes early meetings", "subject": "Early Meetings",
                   "stance": "Dislikes", "polarity": "positive", "confidence": 0.7, "episode_id": 2},
                  {"statement": "server is down", "subject": "server", "stance": "is",
                   "polarity": "negative", "episode_id": 3}
                ]
                ```
                """);

        Optional<List<BeliefCandidate>> result = adapter.extract(List.of(
                episode(2L, "I can't stand early meetings", false),
                episode(3L, "Server is not down anymore", true)));

        assertTrue(result.isPresent());
        List<BeliefCandidate> candidates = result.get();
        assertEquals(2, candidates.size());
        assertEquals("early meetings", candidates.get(0).getSubject());
        assertEquals("dislikes", candidates.get(0).getStance());
        assertEquals(0.7, candidates.get(0).getConfidence(), 1e-9);
        assertEquals(2L, candidates.get(0).getEvidenceEpisodeId());
        assertFalse(candidates.get(0).isVerified());
        assertEquals(Belief.Polarity.NEGATIVE, candidates.get(1).getPolarity());
        assertEquals(0.6, candidates.get(1).getConfidence(), 1e-9);
        assertTrue(candidates.get(1).isVerified());
    }

    @Test
    void shouldDropCandidatesCitingEpisodesOutsideWindow() {
        when(chatModel.chat(anyString())).thenReturn("""
                [{"statement": "user likes tea", "subject": "tea", "stance": "likes", "episode_id": 99}]
                """);

        Optional<List<BeliefCandidate>> result = adapter.extract(List.of(episode(1L, "I like tea", false)));

        assertTrue(result.isPresent());
        assertTrue(result.get().isEmpty());
    }

    @Test
    void shouldReturnEmptyForUnparseableAnswer() {
        when(chatModel.chat(anyString())).thenReturn("I could not find any durable facts.");

        assertTrue(adapter.extract(List.of(episode(1L, "hello", false))).isEmpty());
    }

    @Test
    void shouldReturnEmptyForBrokenJson() {
        when(chatModel.chat(anyString())).thenReturn("[{\"statement\": \"user likes tea\",]");

        assertTrue(adapter.extract(List.of(episode(1L, "hello", false))).isEmpty());
    }

    @Test
    void shouldPropagateProviderFailure() {
        when(chatModel.chat(anyString())).thenThrow(new RuntimeException("rate limited"));

        assertThrows(RuntimeException.class, () -> adapter.extract(List.of(episode(1L, "hello", false))));
    }

    @Test
    void promptShouldListEpisodesWithIds() {
        when(chatModel.chat(anyString())).thenReturn("[]");

        adapter.extract(List.of(episode(4L, "Deployed build 12", false)));

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(chatModel).chat(prompt.capture());
        assertTrue(prompt.getValue().contains("[4] (observation) Deployed build 12"));
    }

    private static Episode episode(long id, String text, boolean verified) {
        return Episode.builder()
                .id(id)
                .timestamp(Instant.parse("2026-03-01T10:00:00Z"))
                .kind(Episode.Kind.OBSERVATION)
                .payload(EpisodePayload.builder().text(text).verified(verified).build())
                .build();
    }
}
