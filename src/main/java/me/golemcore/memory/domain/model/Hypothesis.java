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
import java.util.ArrayList;
import java.util.List;

/**
 * Open question in the uncertainty ledger.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Hypothesis {

    public enum HypothesisStatus {
        OPEN, VERIFIED, REJECTED
    }

    private long id;
    private String claim;
    private String verificationPlan;
    private double confidence;

    @Builder.Default
    private HypothesisStatus status = HypothesisStatus.OPEN;

    @Builder.Default
    private List<String> evidence = new ArrayList<>();

    @Builder.Default
    private String riskIfWrong = "unknown";

    private String nextVerificationAction;

    /**
     * Belief created from this hypothesis once verified, or {@code null}.
     */
    private Long promotedBeliefId;

    private Instant createdAt;
    private Instant updatedAt;

    public Hypothesis copy() {
        return Hypothesis.builder()
                .id(id)
                .claim(claim)
                .verificationPlan(verificationPlan)
                .confidence(confidence)
                .status(status)
                .evidence(evidence != null ? new ArrayList<>(evidence) : new ArrayList<>())
                .riskIfWrong(riskIfWrong)
                .nextVerificationAction(nextVerificationAction)
                .promotedBeliefId(promotedBeliefId)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .build();
    }
}
