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

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Optional provider of dense text vectors. Retrieval embeds the query text;
 * consolidation embeds the beliefs it creates in one batch.
 */
public interface EmbeddingPort {

    boolean isAvailable();

    CompletableFuture<float[]> embed(String text);

    /**
     * Embed several texts in one provider call.
     *
     * @return vectors in the order of {@code texts}
     */
    CompletableFuture<List<float[]>> embedBatch(List<String> texts);

    /**
     * Cosine similarity in [-1, 1]; 0 when either vector is missing, has zero
     * norm, or the lengths differ.
     */
    default double cosineSimilarity(float[] a, float[] b) {
        if (a == null || b == null || a.length != b.length) {
            return 0;
        }

        double dotProduct = 0;
        double normA = 0;
        double normB = 0;

        for (int i = 0; i < a.length; i++) {
            dotProduct += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }

        if (normA == 0 || normB == 0) {
            return 0;
        }

        return dotProduct / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
