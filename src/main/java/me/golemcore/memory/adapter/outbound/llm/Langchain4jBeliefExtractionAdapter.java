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

package me.golemcore.memory.adapter.outbound.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.model.Belief;
import me.golemcore.memory.domain.model.BeliefCandidate;
import me.golemcore.memory.domain.model.Episode;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.BeliefExtractionPort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Belief extraction through a langchain4j chat model.
 *
 * <p>
 * The model receives the episode window as numbered lines and must answer with
 * a JSON array of candidate statements. Candidates citing episodes outside the
 * window are discarded. Provider errors propagate to the caller; an answer
 * that is not a JSON array yields an empty result.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jBeliefExtractionAdapter implements BeliefExtractionPort {

    private static final String PROMPT_HEADER = """
            You maintain the long-term memory of an autonomous agent.
            Read the episodes below and extract durable facts or preferences they state.
            Answer with a JSON array only. Each element must have the fields:
            "statement" (one sentence), "subject" (short lowercase topic),
            "stance" (short lowercase relation such as "likes", "dislikes", "is", "uses"),
            "polarity" ("positive" or "negative"), "confidence" (0..1),
            "episode_id" (id of the episode that supports it).
            Answer [] when nothing durable is stated.

            Episodes:
            """;

    private final MemoryProperties properties;
    private final ObjectMapper objectMapper;

    private volatile ChatModel chatModel;
    private volatile boolean initialized = false;

    private synchronized void ensureInitialized() {
        if (initialized)
            return;

        MemoryProperties.LlmProperties config = properties.getLlm();
        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            log.info("LLM API key not configured, heuristic belief extraction only");
            initialized = true;
            return;
        }

        try {
            chatModel = createChatModel(config);
            log.info("Belief extraction model initialized: {}", config.getModel());
        } catch (RuntimeException e) {
            log.warn("Failed to initialize belief extraction model: {}", e.getMessage());
        }
        initialized = true;
    }

    protected ChatModel createChatModel(MemoryProperties.LlmProperties config) {
        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(config.getModel())
                .temperature(0.0)
                .timeout(Duration.ofSeconds(config.getTimeoutSeconds()));

        if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    @Override
    public boolean isAvailable() {
        ensureInitialized();
        return chatModel != null;
    }

    @Override
    public Optional<List<BeliefCandidate>> extract(List<Episode> episodes) {
        ensureInitialized();
        if (chatModel == null) {
            throw new IllegalStateException("Belief extraction model not available");
        }
        if (episodes == null || episodes.isEmpty()) {
            return Optional.of(List.of());
        }

        String answer = chatModel.chat(buildPrompt(episodes));
        return parseCandidates(answer, episodes);
    }

    private String buildPrompt(List<Episode> episodes) {
        StringBuilder sb = new StringBuilder(PROMPT_HEADER);
        for (Episode episode : episodes) {
            sb.append('[').append(episode.getId()).append("] (")
                    .append(episode.getKind().name().toLowerCase(Locale.ROOT)).append(") ")
                    .append(episode.getText());
            Map<String, String> fields = episode.getPayload() != null ? episode.getPayload().getFields() : null;
            if (fields != null && !fields.isEmpty()) {
                sb.append(' ').append(fields);
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    private Optional<List<BeliefCandidate>> parseCandidates(String answer, List<Episode> episodes) {
        if (answer == null) {
            return Optional.empty();
        }
        int start = answer.indexOf('[');
        int end = answer.lastIndexOf(']');
        if (start < 0 || end <= start) {
            log.debug("[BeliefExtraction] Answer is not a JSON array");
            return Optional.empty();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(answer.substring(start, end + 1));
        } catch (IOException e) {
            log.debug("[BeliefExtraction] Failed to parse answer: {}", e.getMessage());
            return Optional.empty();
        }
        if (root == null || !root.isArray()) {
            return Optional.empty();
        }

        Set<Long> windowIds = new HashSet<>();
        Map<Long, Boolean> verifiedById = new HashMap<>();
        for (Episode episode : episodes) {
            windowIds.add(episode.getId());
            verifiedById.put(episode.getId(), episode.getPayload() != null && episode.getPayload().isVerified());
        }

        List<BeliefCandidate> candidates = new ArrayList<>();
        for (JsonNode node : root) {
            String statement = text(node, "statement");
            String subject = text(node, "subject");
            long episodeId = node.path("episode_id").asLong(-1);
            if (statement == null || subject == null || !windowIds.contains(episodeId)) {
                continue;
            }
            String stance = text(node, "stance");
            double confidence = node.path("confidence").asDouble(properties.getConsolidation().getInitialConfidence());
            candidates.add(BeliefCandidate.builder()
                    .statement(statement)
                    .subject(subject.toLowerCase(Locale.ROOT))
                    .stance(stance != null ? stance.toLowerCase(Locale.ROOT) : "is")
                    .polarity("negative".equalsIgnoreCase(text(node, "polarity"))
                            ? Belief.Polarity.NEGATIVE
                            : Belief.Polarity.POSITIVE)
                    .confidence(Math.max(0.0, Math.min(1.0, confidence)))
                    .verified(verifiedById.getOrDefault(episodeId, false))
                    .evidenceEpisodeId(episodeId)
                    .scope(properties.getConsolidation().getDefaultScope())
                    .build());
        }
        return Optional.of(candidates);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            return null;
        }
        return value.asText().trim();
    }
}
