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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Everything one consolidation run wants to change, applied by the store as a
 * single all-or-nothing write.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ConsolidationBatch {

    private long watermark;

    @Builder.Default
    private List<Belief> beliefUpserts = new ArrayList<>();

    @Builder.Default
    private List<Skill> skillUpserts = new ArrayList<>();

    @Builder.Default
    private List<SelfModelEntry> selfModelUpserts = new ArrayList<>();

    @Builder.Default
    private List<Hypothesis> hypothesisUpserts = new ArrayList<>();

    /**
     * New salience per episode id.
     */
    @Builder.Default
    private Map<Long, Double> salienceUpdates = new LinkedHashMap<>();

    @Builder.Default
    private Set<Long> prunes = new LinkedHashSet<>();
}
