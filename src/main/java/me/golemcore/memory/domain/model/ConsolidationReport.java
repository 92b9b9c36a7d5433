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

package me.golemcore.memory.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Summary of a consolidation trigger.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ConsolidationReport {

    public enum Outcome {
        COMMITTED, REJECTED_CONCURRENT
    }

    private Outcome outcome;
    private int episodesProcessed;
    private int beliefsCreated;
    private int beliefsUpdated;
    private int beliefsDisputed;
    private int beliefsRetracted;
    private int beliefsConfirmed;
    private int skillsUpdated;
    private int hypothesesPromoted;
    private int episodesPruned;
    private long priorWatermark;
    private long watermark;

    /**
     * Recurring tags across the mined episodes.
     */
    @Builder.Default
    private Map<String, Integer> tagCounts = new LinkedHashMap<>();

    public static ConsolidationReport rejected(long watermark) {
        return ConsolidationReport.builder()
                .outcome(Outcome.REJECTED_CONCURRENT)
                .priorWatermark(watermark)
                .watermark(watermark)
                .build();
    }
}
