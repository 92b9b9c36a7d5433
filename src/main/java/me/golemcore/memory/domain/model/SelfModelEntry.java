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

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * What the operator knows about one of its own capabilities. Keyed by
 * capability name; reliability is derived from skill history only.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SelfModelEntry {

    private String capability;
    private double reliabilityScore;

    @Builder.Default
    private Set<String> limitations = new LinkedHashSet<>();

    private Instant createdAt;
    private Instant updatedAt;

    public SelfModelEntry copy() {
        return SelfModelEntry.builder()
                .capability(capability)
                .reliabilityScore(reliabilityScore)
                .limitations(limitations != null ? new LinkedHashSet<>(limitations) : new LinkedHashSet<>())
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .build();
    }
}
