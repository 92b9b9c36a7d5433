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

package me.golemcore.memory.adapter.outbound.embedding;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.EmbeddingPort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Embedding provider over an OpenAI-compatible endpoint.
 *
 * <p>
 * Reads {@code memory.embedding.api-key}, {@code base-url} and {@code model}.
 * Without an API key the adapter stays unavailable and retrieval ranks without
 * the vector term.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jEmbeddingAdapter implements EmbeddingPort {

    static final String DEFAULT_MODEL = "text-embedding-3-small";

    private final MemoryProperties properties;

    private volatile EmbeddingModel embeddingModel;
    private volatile boolean initialized = false;

    @Override
    public boolean isAvailable() {
        ensureInitialized();
        return embeddingModel != null;
    }

    @Override
    public CompletableFuture<float[]> embed(String text) {
        return CompletableFuture.supplyAsync(() -> requireModel().embed(text).content().vector());
    }

    @Override
    public CompletableFuture<List<float[]>> embedBatch(List<String> texts) {
        if (texts.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }
        return CompletableFuture.supplyAsync(() -> {
            List<Embedding> embeddings = requireModel()
                    .embedAll(texts.stream().map(TextSegment::from).toList())
                    .content();
            if (embeddings.size() != texts.size()) {
                throw new IllegalStateException("Embedding provider returned " + embeddings.size()
                        + " vector(s) for " + texts.size() + " text(s)");
            }
            return embeddings.stream().map(Embedding::vector).toList();
        });
    }

    String resolveModelName() {
        String model = properties.getEmbedding().getModel();
        return model != null && !model.isBlank() ? model : DEFAULT_MODEL;
    }

    private EmbeddingModel requireModel() {
        ensureInitialized();
        EmbeddingModel model = embeddingModel;
        if (model == null) {
            throw new IllegalStateException("Embedding model not available");
        }
        return model;
    }

    private synchronized void ensureInitialized() {
        if (initialized) {
            return;
        }
        initialized = true;

        MemoryProperties.EmbeddingProperties config = properties.getEmbedding();
        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            log.info("[Embedding] API key not configured, vector retrieval disabled");
            return;
        }
        try {
            var builder = OpenAiEmbeddingModel.builder()
                    .apiKey(config.getApiKey())
                    .modelName(resolveModelName());
            if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
                builder.baseUrl(config.getBaseUrl());
            }
            embeddingModel = builder.build();
            log.info("[Embedding] Model initialized: {}", resolveModelName());
        } catch (RuntimeException e) {
            log.error("[Embedding] Failed to initialize model", e);
        }
    }
}
