package me.golemcore.memory.adapter.outbound.embedding;

import me.golemcore.memory.infrastructure.config.MemoryProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class Langchain4jEmbeddingAdapterTest {

    private MemoryProperties properties;
    private Langchain4jEmbeddingAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new MemoryProperties();
        adapter = new Langchain4jEmbeddingAdapter(properties);
    }

    @Test
    void shouldBeUnavailableWithoutApiKey() {
        assertFalse(adapter.isAvailable());
    }

    @Test
    void embedShouldFailWhenUnavailable() {
        CompletionException ex = assertThrows(CompletionException.class, () -> adapter.embed("jazz").join());
        assertTrue(ex.getCause() instanceof IllegalStateException);
    }

    @Test
    void embedBatchShouldFailWhenUnavailable() {
        CompletionException ex = assertThrows(CompletionException.class,
                () -> adapter.embedBatch(List.of("jazz", "lo-fi")).join());
        assertTrue(ex.getCause() instanceof IllegalStateException);
    }

    @Test
    void embedBatchShouldSkipProviderForEmptyInput() {
        assertTrue(adapter.embedBatch(List.of()).join().isEmpty());
    }

    @Test
    void shouldFallBackToDefaultModelName() {
        properties.getEmbedding().setModel(" ");
        assertEquals("text-embedding-3-small", adapter.resolveModelName());

        properties.getEmbedding().setModel("nomic-embed-text");
        assertEquals("nomic-embed-text", adapter.resolveModelName());
    }

    @Test
    void cosineSimilarityShouldHandleMismatchedVectors() {
        assertEquals(1.0, adapter.cosineSimilarity(new float[] { 1, 2 }, new float[] { 2, 4 }), 1e-6);
        assertEquals(-1.0, adapter.cosineSimilarity(new float[] { 1, 0 }, new float[] { -1, 0 }), 1e-6);
        assertEquals(0.0, adapter.cosineSimilarity(new float[] { 1, 0 }, new float[] { 1, 0, 0 }));
        assertEquals(0.0, adapter.cosineSimilarity(new float[] { 0, 0 }, new float[] { 1, 0 }));
        assertEquals(0.0, adapter.cosineSimilarity(null, new float[] { 1, 0 }));
    }
}
