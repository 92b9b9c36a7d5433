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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Objective owned by the control loop. Consolidation reads goals but never
 * changes them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Goal {

    private long id;
    private String description;

    @Builder.Default
    private GoalStatus status = GoalStatus.ACTIVE;

    @Builder.Default
    private int priority = 5;

    private double progress;
    private Instant deadline;

    @Builder.Default
    private List<String> subgoals = new ArrayList<>();

    private String completionCriteria;
    private Instant createdAt;
    private Instant updatedAt;

    @JsonIgnore
    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    public Goal copy() {
        return Goal.builder()
                .id(id)
                .description(description)
                .status(status)
                .priority(priority)
                .progress(progress)
                .deadline(deadline)
                .subgoals(subgoals != null ? new ArrayList<>(subgoals) : new ArrayList<>())
                .completionCriteria(completionCriteria)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .build();
    }

    /**
     * Goal lifecycle states. COMPLETED and ABANDONED are final.
     */
    public enum GoalStatus {
        ACTIVE, BLOCKED, COMPLETED, ABANDONED;

        public boolean isTerminal() {
            return this == COMPLETED || this == ABANDONED;
        }
    }
}
