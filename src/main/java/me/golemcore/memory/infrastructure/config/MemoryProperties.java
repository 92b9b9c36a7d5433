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

package me.golemcore.memory.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the memory runtime.
 *
 * <p>
 * All configuration lives under the {@code memory.*} prefix:
 * <ul>
 * <li>{@code storage} - workspace location of the journal and snapshot</li>
 * <li>{@code retrieval} - hybrid ranking weights</li>
 * <li>{@code consolidation} - replay, confidence and dispute policy</li>
 * <li>{@code forgetting} - episode salience decay and pruning</li>
 * <li>{@code llm}, {@code embedding} - optional providers</li>
 * <li>{@code schedule} - background dream cycle</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "memory")
@Data
public class MemoryProperties {

    private StorageProperties storage = new StorageProperties();
    private RetrievalProperties retrieval = new RetrievalProperties();
    private ConsolidationProperties consolidation = new ConsolidationProperties();
    private ForgettingProperties forgetting = new ForgettingProperties();
    private LlmProperties llm = new LlmProperties();
    private EmbeddingProperties embedding = new EmbeddingProperties();
    private ScheduleProperties schedule = new ScheduleProperties();

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.golemcore/workspace";
        private String directory = "memory";
    }

    @Data
    public static class RetrievalProperties {
        private int defaultTopK = 10;
        private double lexicalWeight = 0.35;
        private double recencyWeight = 0.20;
        private double confidenceWeight = 0.25;
        private double vectorWeight = 0.20;
        private double goalBoost = 0.15;
        private double recencyHalfLifeHours = 72.0;
    }

    @Data
    public static class ConsolidationProperties {
        private int batchSize = 200;
        private double initialConfidence = 0.6;
        private double corroborationGain = 0.3;
        private double maxReplayConfidence = 0.99;
        private double contradictionSimilarityThreshold = 0.6;
        private double disputePenalty = 0.1;
        private double confirmThreshold = 0.85;
        private double supersedeThreshold = 0.3;
        private double beliefDecayFactor = 0.95;
        private double beliefDecayFloor = 0.1;
        private int beliefDecayIntervalDays = 7;
        private int successRateHistorySize = 20;
        private String defaultScope = "global";
    }

    @Data
    public static class ForgettingProperties {
        private double defaultSalience = 0.5;
        private double salienceHalfLifeDays = 7.0;
        private double pruneFloor = 0.1;
        private int retentionDays = 30;
    }

    @Data
    public static class LlmProperties {
        private String apiKey;
        private String baseUrl;
        private String model = "gpt-4o-mini";
        private int timeoutSeconds = 60;
    }

    @Data
    public static class EmbeddingProperties {
        private String apiKey;
        private String baseUrl;
        private String model = "text-embedding-3-small";
    }

    @Data
    public static class ScheduleProperties {
        private boolean enabled = false;
        private int initialDelaySeconds = 60;
        private int intervalSeconds = 900;
    }
}
