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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Shared infrastructure beans and startup summary.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final MemoryProperties properties;

    @Bean
    public static Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        log.info("GolemCore Memory starting...");
        log.info("Storage Path: {}/{}", properties.getStorage().getBasePath(),
                properties.getStorage().getDirectory());
        log.info("Extraction Model: {}", hasText(properties.getLlm().getApiKey())
                ? properties.getLlm().getModel()
                : "heuristic");
        log.info("Embedding Model: {}", hasText(properties.getEmbedding().getApiKey())
                ? properties.getEmbedding().getModel()
                : "disabled");
        log.info("Dream cycle: {}", properties.getSchedule().isEnabled()
                ? "every " + properties.getSchedule().getIntervalSeconds() + "s"
                : "on demand");
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
