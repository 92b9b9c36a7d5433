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

package me.golemcore.memory;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore Memory.
 *
 * <p>
 * GolemCore Memory is the long-term memory of an autonomous agent: an
 * append-only episode log, a dispute-aware belief store, skills and a
 * self-model learned from outcomes, goals and hypotheses, and a consolidation
 * engine (the dream cycle) that turns raw episodes into durable knowledge.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Input Layer        → MemoryController, DreamCycleScheduler
 * Domain Layer       → MemoryService, ConsolidationService, ReplayMiner, ...
 * Infrastructure     → Local storage, langchain4j extraction/embedding
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.yml} under the {@code memory.*}
 * prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class MemoryApplication {

    public static void main(String[] args) {
        SpringApplication.run(MemoryApplication.class, args);
    }

}
