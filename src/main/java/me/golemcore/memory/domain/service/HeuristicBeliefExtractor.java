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
import me.golemcore.memory.domain.model.Belief;
import me.golemcore.memory.domain.model.BeliefCandidate;
import me.golemcore.memory.domain.model.Episode;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern-based belief extraction used when no extraction model is available
 * or its answer cannot be interpreted.
 *
 * <p>
 * Recognized forms:
 * <ul>
 * <li>{@code I love/like/enjoy/prefer X} - user likes X</li>
 * <li>{@code I hate/dislike/can't stand X}, {@code I don't/do not/never like X}
 * - user dislikes X</li>
 * <li>{@code X is [not] Y} - X is [not] Y</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HeuristicBeliefExtractor {

    private static final Pattern NEGATED_PREFERENCE = Pattern.compile(
            "\\bI\\s+(?:really\\s+)?(?:don'?t|do\\s+not|never)\\s+(?:like|love|enjoy|prefer)\\s+(.+)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern DISLIKE = Pattern.compile(
            "\\bI\\s+(?:really\\s+)?(?:hate|dislike|detest|can'?t\\s+stand|cannot\\s+stand)\\s+(.+)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern LIKE = Pattern.compile(
            "\\bI\\s+(?:really\\s+)?(?:love|like|enjoy|prefer)\\s+(.+)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern FACT = Pattern.compile(
            "^(?:the\\s+)?([\\p{L}\\p{N}][\\p{L}\\p{N}\\s_-]{0,60}?)\\s+(?:is|are)\\s+(not\\s+)?(.+)$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern SPEAKER_PREFIX = Pattern.compile("^[\\p{L}\\s]{1,40}\\bsaid\\s*:\\s*",
            Pattern.CASE_INSENSITIVE);
    private static final Set<String> PRONOUNS = Set.of("it", "this", "that", "there", "i", "he", "she", "they",
            "what", "who", "which", "here");
    private static final String USER_SUBJECT = "user";

    private final MemoryProperties properties;

    public List<BeliefCandidate> extract(List<Episode> episodes) {
        List<BeliefCandidate> candidates = new ArrayList<>();
        for (Episode episode : episodes) {
            if (episode.isPruned() || episode.getPayload() == null) {
                continue;
            }
            deriveCandidate(episode.getText())
                    .map(derived -> {
                        derived.setEvidenceEpisodeId(episode.getId());
                        derived.setVerified(episode.getPayload().isVerified());
                        return derived;
                    })
                    .ifPresent(candidates::add);
        }
        log.debug("[HeuristicExtractor] {} candidate(s) from {} episode(s)", candidates.size(), episodes.size());
        return candidates;
    }

    /**
     * Derive a candidate from free text without evidence attached.
     */
    public Optional<BeliefCandidate> deriveCandidate(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String body = SPEAKER_PREFIX.matcher(text.trim()).replaceFirst("");

        Matcher matcher = NEGATED_PREFERENCE.matcher(body);
        if (matcher.find()) {
            return preference(matcher.group(1), "dislikes");
        }
        matcher = DISLIKE.matcher(body);
        if (matcher.find()) {
            return preference(matcher.group(1), "dislikes");
        }
        matcher = LIKE.matcher(body);
        if (matcher.find()) {
            return preference(matcher.group(1), "likes");
        }
        matcher = FACT.matcher(firstClause(body));
        if (matcher.matches()) {
            String subject = MemoryTextSupport.normalizeSubject(matcher.group(1));
            String object = cleanPhrase(matcher.group(3));
            if (subject.isEmpty() || object.isEmpty() || PRONOUNS.contains(subject)) {
                return Optional.empty();
            }
            boolean negated = matcher.group(2) != null;
            return Optional.of(candidate(
                    subject + (negated ? " is not " : " is ") + object,
                    subject,
                    "is",
                    negated ? Belief.Polarity.NEGATIVE : Belief.Polarity.POSITIVE));
        }
        return Optional.empty();
    }

    private Optional<BeliefCandidate> preference(String rawObject, String stance) {
        String subject = cleanPhrase(rawObject);
        if (subject.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(candidate(USER_SUBJECT + " " + stance + " " + subject, subject, stance,
                Belief.Polarity.POSITIVE));
    }

    private BeliefCandidate candidate(String statement, String subject, String stance, Belief.Polarity polarity) {
        MemoryProperties.ConsolidationProperties config = properties.getConsolidation();
        return BeliefCandidate.builder()
                .statement(statement)
                .subject(subject)
                .stance(stance)
                .polarity(polarity)
                .confidence(config.getInitialConfidence())
                .scope(config.getDefaultScope())
                .build();
    }

    private static String cleanPhrase(String raw) {
        return MemoryTextSupport.normalizeSubject(firstClause(raw));
    }

    private static String firstClause(String raw) {
        String clause = raw.split("[.!?;,\\n]", 2)[0];
        String[] connectors = { " because ", " but ", " when ", " although " };
        String lower = clause.toLowerCase(Locale.ROOT);
        for (String connector : connectors) {
            int index = lower.indexOf(connector);
            if (index > 0) {
                clause = clause.substring(0, index);
                lower = lower.substring(0, index);
            }
        }
        return clause.trim();
    }
}
