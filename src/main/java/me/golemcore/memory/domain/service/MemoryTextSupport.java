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

import me.golemcore.memory.domain.model.Belief;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Shared helpers for tokenization, topical similarity and stance
 * normalization.
 */
public final class MemoryTextSupport {

    private static final Map<String, StanceKey> STANCE_FAMILIES = Map.ofEntries(
            Map.entry("like", new StanceKey("likes", Belief.Polarity.POSITIVE)),
            Map.entry("likes", new StanceKey("likes", Belief.Polarity.POSITIVE)),
            Map.entry("love", new StanceKey("likes", Belief.Polarity.POSITIVE)),
            Map.entry("loves", new StanceKey("likes", Belief.Polarity.POSITIVE)),
            Map.entry("enjoy", new StanceKey("likes", Belief.Polarity.POSITIVE)),
            Map.entry("enjoys", new StanceKey("likes", Belief.Polarity.POSITIVE)),
            Map.entry("prefer", new StanceKey("likes", Belief.Polarity.POSITIVE)),
            Map.entry("prefers", new StanceKey("likes", Belief.Polarity.POSITIVE)),
            Map.entry("dislike", new StanceKey("likes", Belief.Polarity.NEGATIVE)),
            Map.entry("dislikes", new StanceKey("likes", Belief.Polarity.NEGATIVE)),
            Map.entry("hate", new StanceKey("likes", Belief.Polarity.NEGATIVE)),
            Map.entry("hates", new StanceKey("likes", Belief.Polarity.NEGATIVE)));

    private static final Set<String> STANCE_AND_NEGATION_WORDS = Set.of(
            "like", "likes", "love", "loves", "enjoy", "enjoys", "prefer", "prefers",
            "dislike", "dislikes", "hate", "hates", "not", "don't", "doesn't", "never",
            "isn't", "aren't", "are", "does", "was", "wasn't");

    private MemoryTextSupport() {
    }

    public static Set<String> tokenize(String text) {
        Set<String> tokens = new LinkedHashSet<>();
        if (text == null || text.isBlank()) {
            return tokens;
        }
        String[] raw = text.toLowerCase(Locale.ROOT).split("[^a-zа-я0-9_./#'-]+");
        for (String token : raw) {
            String trimmed = stripEdgePunctuation(token);
            if (trimmed.length() >= 3) {
                tokens.add(trimmed);
            }
        }
        return tokens;
    }

    /**
     * Token Jaccard similarity of two statements with stance and negation words
     * removed, so "user likes jazz" and "user dislikes jazz" are topically
     * identical.
     */
    public static double topicalSimilarity(String left, String right) {
        Set<String> a = topicalTokens(left);
        Set<String> b = topicalTokens(right);
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        return (double) intersection.size() / (double) union.size();
    }

    /**
     * Share of query tokens present in the candidate text.
     */
    public static double overlapShare(Set<String> queryTokens, String text) {
        if (queryTokens == null || queryTokens.isEmpty()) {
            return 0.0;
        }
        Set<String> contentTokens = tokenize(text);
        if (contentTokens.isEmpty()) {
            return 0.0;
        }
        int matches = 0;
        for (String token : queryTokens) {
            if (contentTokens.contains(token)) {
                matches++;
            }
        }
        return (double) matches / (double) queryTokens.size();
    }

    /**
     * Canonical stance family and effective polarity, e.g. {@code dislikes} +
     * POSITIVE becomes {@code likes} + NEGATIVE.
     */
    public static StanceKey normalizeStance(String stance, Belief.Polarity polarity) {
        Belief.Polarity effective = polarity != null ? polarity : Belief.Polarity.POSITIVE;
        String normalized = stance != null ? stance.trim().toLowerCase(Locale.ROOT) : "is";
        StanceKey family = STANCE_FAMILIES.get(normalized);
        if (family == null) {
            return new StanceKey(normalized, effective);
        }
        Belief.Polarity combined = family.polarity() == Belief.Polarity.POSITIVE ? effective : effective.opposite();
        return new StanceKey(family.stance(), combined);
    }

    public static String normalizeSubject(String subject) {
        if (subject == null) {
            return "";
        }
        return subject.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }

    private static Set<String> topicalTokens(String text) {
        Set<String> tokens = tokenize(text);
        tokens.removeAll(STANCE_AND_NEGATION_WORDS);
        return tokens;
    }

    private static String stripEdgePunctuation(String token) {
        int start = 0;
        int end = token.length();
        while (start < end && !Character.isLetterOrDigit(token.charAt(start))) {
            start++;
        }
        while (end > start && !Character.isLetterOrDigit(token.charAt(end - 1))) {
            end--;
        }
        return token.substring(start, end);
    }

    /**
     * Stance family with its effective polarity.
     */
    public record StanceKey(String stance, Belief.Polarity polarity) {
    }
}
