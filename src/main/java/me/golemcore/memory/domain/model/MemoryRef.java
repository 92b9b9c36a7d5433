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

/**
 * Reference to a memory entity by relation and identifier. Self-model entries
 * are keyed by capability name and use {@code key} instead of {@code id}.
 */
public record MemoryRef(MemoryEntityType type, long id, String key) {

    public static MemoryRef of(MemoryEntityType type, long id) {
        return new MemoryRef(type, id, null);
    }

    public static MemoryRef ofKey(MemoryEntityType type, String key) {
        return new MemoryRef(type, 0L, key);
    }
}
