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

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Query context for hybrid memory retrieval.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MemoryQuery {

    private String queryText;

    /**
     * Optional query embedding. When absent the vector term is dropped.
     */
    private float[] queryVector;

    private Long activeGoalId;

    /**
     * Relations to search. Empty means all of them.
     */
    @Builder.Default
    private Set<MemoryEntityType> types = new LinkedHashSet<>();

    private Integer topK;
}
