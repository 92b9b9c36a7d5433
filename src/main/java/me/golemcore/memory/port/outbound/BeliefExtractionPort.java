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

package me.golemcore.memory.port.outbound;

import me.golemcore.memory.domain.model.BeliefCandidate;
import me.golemcore.memory.domain.model.Episode;

import java.util.List;
import java.util.Optional;

/**
 * Port for model-backed belief extraction from a window of episodes.
 *
 * <p>
 * A thrown exception means the provider failed and the consolidation run must
 * abort. An empty result means the provider answered but the answer could not
 * be interpreted; callers fall back to heuristic extraction.
 */
public interface BeliefExtractionPort {

    boolean isAvailable();

    Optional<List<BeliefCandidate>> extract(List<Episode> episodes);
}
