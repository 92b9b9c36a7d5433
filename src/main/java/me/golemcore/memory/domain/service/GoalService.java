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

package me.golemcore.memory.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.exception.MemoryEntityNotFoundException;
import me.golemcore.memory.domain.exception.ValidationFailureException;
import me.golemcore.memory.domain.model.Goal;
import me.golemcore.memory.port.outbound.MemoryStorePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Goal lifecycle owned by the control loop. Completed and abandoned goals are
 * terminal and reject further updates.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GoalService {

    private static final int MIN_PRIORITY = 1;
    private static final int MAX_PRIORITY = 10;

    private final MemoryStorePort memoryStore;
    private final Clock clock;

    public synchronized Goal createGoal(String description, Integer priority, Instant deadline,
            List<String> subgoals, String completionCriteria) {
        if (description == null || description.isBlank()) {
            throw new ValidationFailureException("Goal description is required");
        }
        int resolvedPriority = priority != null ? priority : 5;
        if (resolvedPriority < MIN_PRIORITY || resolvedPriority > MAX_PRIORITY) {
            throw new ValidationFailureException("Goal priority must be within [" + MIN_PRIORITY + ", "
                    + MAX_PRIORITY + "]: " + resolvedPriority);
        }

        Instant now = clock.instant();
        Goal goal = Goal.builder()
                .description(description.trim())
                .priority(resolvedPriority)
                .deadline(deadline)
                .subgoals(subgoals != null ? new ArrayList<>(subgoals) : new ArrayList<>())
                .completionCriteria(completionCriteria)
                .createdAt(now)
                .updatedAt(now)
                .build();
        Goal saved = memoryStore.saveGoal(goal);
        log.info("[Goals] Created goal {}: {}", saved.getId(), saved.getDescription());
        return saved;
    }

    public synchronized Goal updateGoalProgress(long goalId, double progress) {
        if (Double.isNaN(progress) || progress < 0.0 || progress > 1.0) {
            throw new ValidationFailureException("Goal progress must be within [0, 1]: " + progress);
        }
        Goal goal = requireActive(goalId);
        goal.setProgress(progress);
        if (progress >= 1.0) {
            goal.setStatus(Goal.GoalStatus.COMPLETED);
            log.info("[Goals] Goal {} completed", goalId);
        }
        goal.setUpdatedAt(clock.instant());
        return memoryStore.saveGoal(goal);
    }

    public synchronized Goal updateGoalStatus(long goalId, Goal.GoalStatus status) {
        if (status == null) {
            throw new ValidationFailureException("Goal status is required");
        }
        Goal goal = requireActive(goalId);
        goal.setStatus(status);
        if (status == Goal.GoalStatus.COMPLETED) {
            goal.setProgress(1.0);
        }
        goal.setUpdatedAt(clock.instant());
        log.info("[Goals] Goal {} -> {}", goalId, status);
        return memoryStore.saveGoal(goal);
    }

    private Goal requireActive(long goalId) {
        Goal goal = memoryStore.getGoal(goalId)
                .orElseThrow(() -> new MemoryEntityNotFoundException("Goal not found: " + goalId));
        if (goal.isTerminal()) {
            throw new ValidationFailureException("Goal " + goalId + " is " + goal.getStatus()
                    + " and cannot be updated");
        }
        return goal;
    }
}
