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
import me.golemcore.memory.domain.model.Hypothesis;
import me.golemcore.memory.port.outbound.MemoryStorePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Registers and resolves hypotheses. Verified hypotheses are promoted to
 * beliefs by the next consolidation run.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HypothesisService {

    private final MemoryStorePort memoryStore;
    private final Clock clock;

    public synchronized Hypothesis registerHypothesis(String claim, String verificationPlan, double confidence,
            String riskIfWrong, String nextVerificationAction) {
        if (claim == null || claim.isBlank()) {
            throw new ValidationFailureException("Hypothesis claim is required");
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new ValidationFailureException("Hypothesis confidence must be within [0, 1]: " + confidence);
        }

        Instant now = clock.instant();
        Hypothesis.HypothesisBuilder builder = Hypothesis.builder()
                .claim(claim.trim())
                .verificationPlan(verificationPlan)
                .confidence(confidence)
                .nextVerificationAction(nextVerificationAction)
                .createdAt(now)
                .updatedAt(now);
        if (riskIfWrong != null && !riskIfWrong.isBlank()) {
            builder.riskIfWrong(riskIfWrong);
        }
        Hypothesis saved = memoryStore.saveHypothesis(builder.build());
        log.info("[Hypotheses] Registered hypothesis {}: {}", saved.getId(), saved.getClaim());
        return saved;
    }

    public synchronized Hypothesis resolveHypothesis(long hypothesisId, boolean verified, String evidence) {
        Hypothesis hypothesis = memoryStore.getHypothesis(hypothesisId)
                .orElseThrow(() -> new MemoryEntityNotFoundException("Hypothesis not found: " + hypothesisId));
        if (hypothesis.getStatus() != Hypothesis.HypothesisStatus.OPEN) {
            throw new ValidationFailureException("Hypothesis " + hypothesisId + " is already "
                    + hypothesis.getStatus());
        }
        hypothesis.setStatus(verified ? Hypothesis.HypothesisStatus.VERIFIED : Hypothesis.HypothesisStatus.REJECTED);
        if (evidence != null && !evidence.isBlank()) {
            hypothesis.getEvidence().add(evidence.trim());
        }
        hypothesis.setNextVerificationAction(null);
        hypothesis.setUpdatedAt(clock.instant());
        log.info("[Hypotheses] Hypothesis {} resolved as {}", hypothesisId, hypothesis.getStatus());
        return memoryStore.saveHypothesis(hypothesis);
    }
}
