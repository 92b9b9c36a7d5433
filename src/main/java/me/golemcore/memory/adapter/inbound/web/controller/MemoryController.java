package me.golemcore.memory.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.memory.domain.model.Belief;
import me.golemcore.memory.domain.model.ConsolidationReport;
import me.golemcore.memory.domain.model.ConsolidationState;
import me.golemcore.memory.domain.model.Episode;
import me.golemcore.memory.domain.model.EvidenceProvenance;
import me.golemcore.memory.domain.model.Goal;
import me.golemcore.memory.domain.model.Hypothesis;
import me.golemcore.memory.domain.model.MemoryEntityType;
import me.golemcore.memory.domain.model.MemoryQuery;
import me.golemcore.memory.domain.model.ScoredMemory;
import me.golemcore.memory.domain.model.SelfModelEntry;
import me.golemcore.memory.domain.model.Skill;
import me.golemcore.memory.domain.service.MemoryService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Memory API: episode ingestion, retrieval, read access to every relation,
 * goals, hypotheses and on-demand consolidation.
 */
@RestController
@RequestMapping("/api/memory")
@RequiredArgsConstructor
public class MemoryController {

    private final MemoryService memoryService;

    // ==================== EPISODES ====================

    @PostMapping("/episodes")
    public Mono<ResponseEntity<EpisodeCreatedResponse>> appendEpisode(@RequestBody AppendEpisodeRequest request) {
        long id = memoryService.appendEpisode(request.kind(), request.text(), request.fields(), request.salience(),
                request.tags(), request.privacyLevel(), Boolean.TRUE.equals(request.verified()));
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(new EpisodeCreatedResponse(id)));
    }

    @GetMapping("/episodes/{id}")
    public Mono<ResponseEntity<Episode>> getEpisode(@PathVariable long id) {
        return Mono.just(ResponseEntity.ok(require(memoryService.getEpisode(id), "Episode", id)));
    }

    @GetMapping("/episodes/{id}/provenance")
    public Mono<ResponseEntity<EvidenceProvenance>> getProvenance(@PathVariable long id) {
        return Mono.just(ResponseEntity.ok(require(memoryService.getEvidenceProvenance(id), "Episode", id)));
    }

    // ==================== RETRIEVAL ====================

    @PostMapping("/query")
    public Mono<ResponseEntity<List<ScoredMemory>>> query(@RequestBody QueryRequest request) {
        MemoryQuery query = MemoryQuery.builder()
                .queryText(request.queryText())
                .queryVector(request.queryVector())
                .activeGoalId(request.activeGoalId())
                .types(request.types() != null ? new LinkedHashSet<>(request.types()) : new LinkedHashSet<>())
                .topK(request.topK())
                .build();
        return Mono.just(ResponseEntity.ok(memoryService.queryMemory(query)));
    }

    // ==================== BELIEFS / SKILLS / SELF-MODEL ====================

    @GetMapping("/beliefs")
    public Mono<ResponseEntity<List<Belief>>> listBeliefs() {
        return Mono.just(ResponseEntity.ok(memoryService.listBeliefs()));
    }

    @GetMapping("/beliefs/{id}")
    public Mono<ResponseEntity<Belief>> getBelief(@PathVariable long id) {
        return Mono.just(ResponseEntity.ok(require(memoryService.getBelief(id), "Belief", id)));
    }

    @GetMapping("/skills")
    public Mono<ResponseEntity<List<Skill>>> listSkills() {
        return Mono.just(ResponseEntity.ok(memoryService.listSkills()));
    }

    @GetMapping("/skills/{id}")
    public Mono<ResponseEntity<Skill>> getSkill(@PathVariable long id) {
        return Mono.just(ResponseEntity.ok(require(memoryService.getSkill(id), "Skill", id)));
    }

    @GetMapping("/self-model")
    public Mono<ResponseEntity<List<SelfModelEntry>>> listSelfModel() {
        return Mono.just(ResponseEntity.ok(memoryService.listSelfModel()));
    }

    @GetMapping("/self-model/{capability}")
    public Mono<ResponseEntity<SelfModelEntry>> getSelfModelEntry(@PathVariable String capability) {
        SelfModelEntry entry = memoryService.getSelfModelEntry(capability)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "Self-model entry not found: " + capability));
        return Mono.just(ResponseEntity.ok(entry));
    }

    // ==================== GOALS ====================

    @GetMapping("/goals")
    public Mono<ResponseEntity<List<Goal>>> listGoals() {
        return Mono.just(ResponseEntity.ok(memoryService.listGoals()));
    }

    @GetMapping("/goals/{id}")
    public Mono<ResponseEntity<Goal>> getGoal(@PathVariable long id) {
        return Mono.just(ResponseEntity.ok(require(memoryService.getGoal(id), "Goal", id)));
    }

    @PostMapping("/goals")
    public Mono<ResponseEntity<Goal>> createGoal(@RequestBody CreateGoalRequest request) {
        Goal goal = memoryService.createGoal(request.description(), request.priority(), request.deadline(),
                request.subgoals(), request.completionCriteria());
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(goal));
    }

    @PutMapping("/goals/{id}/progress")
    public Mono<ResponseEntity<Goal>> updateGoalProgress(@PathVariable long id,
            @RequestBody GoalProgressRequest request) {
        if (request.progress() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "progress is required");
        }
        return Mono.just(ResponseEntity.ok(memoryService.updateGoalProgress(id, request.progress())));
    }

    @PutMapping("/goals/{id}/status")
    public Mono<ResponseEntity<Goal>> updateGoalStatus(@PathVariable long id,
            @RequestBody GoalStatusRequest request) {
        return Mono.just(ResponseEntity.ok(memoryService.updateGoalStatus(id, request.status())));
    }

    // ==================== HYPOTHESES ====================

    @GetMapping("/hypotheses")
    public Mono<ResponseEntity<List<Hypothesis>>> listHypotheses() {
        return Mono.just(ResponseEntity.ok(memoryService.listHypotheses()));
    }

    @GetMapping("/hypotheses/{id}")
    public Mono<ResponseEntity<Hypothesis>> getHypothesis(@PathVariable long id) {
        return Mono.just(ResponseEntity.ok(require(memoryService.getHypothesis(id), "Hypothesis", id)));
    }

    @PostMapping("/hypotheses")
    public Mono<ResponseEntity<Hypothesis>> registerHypothesis(@RequestBody RegisterHypothesisRequest request) {
        if (request.confidence() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "confidence is required");
        }
        Hypothesis hypothesis = memoryService.registerHypothesis(request.claim(), request.verificationPlan(),
                request.confidence(), request.riskIfWrong(), request.nextVerificationAction());
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(hypothesis));
    }

    @PostMapping("/hypotheses/{id}/resolve")
    public Mono<ResponseEntity<Hypothesis>> resolveHypothesis(@PathVariable long id,
            @RequestBody ResolveHypothesisRequest request) {
        return Mono.just(ResponseEntity.ok(memoryService.resolveHypothesis(id,
                Boolean.TRUE.equals(request.verified()), request.evidence())));
    }

    // ==================== CONSOLIDATION ====================

    @PostMapping("/consolidate")
    public Mono<ResponseEntity<ConsolidationReport>> consolidate() {
        return Mono.just(ResponseEntity.ok(memoryService.consolidate()));
    }

    @GetMapping("/consolidation")
    public Mono<ResponseEntity<ConsolidationStatusResponse>> getConsolidationStatus() {
        return Mono.just(ResponseEntity.ok(new ConsolidationStatusResponse(
                memoryService.getConsolidationState(), memoryService.getWatermark())));
    }

    private static <T> T require(Optional<T> value, String type, long id) {
        return value.orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                type + " not found: " + id));
    }

    record AppendEpisodeRequest(Episode.Kind kind, String text, Map<String, String> fields, Double salience,
            List<String> tags, Episode.PrivacyLevel privacyLevel, Boolean verified) {
    }

    record EpisodeCreatedResponse(long id) {
    }

    record QueryRequest(String queryText, float[] queryVector, Long activeGoalId, Set<MemoryEntityType> types,
            Integer topK) {
    }

    record CreateGoalRequest(String description, Integer priority, Instant deadline, List<String> subgoals,
            String completionCriteria) {
    }

    record GoalProgressRequest(Double progress) {
    }

    record GoalStatusRequest(Goal.GoalStatus status) {
    }

    record RegisterHypothesisRequest(String claim, String verificationPlan, Double confidence, String riskIfWrong,
            String nextVerificationAction) {
    }

    record ResolveHypothesisRequest(Boolean verified, String evidence) {
    }

    record ConsolidationStatusResponse(ConsolidationState state, long watermark) {
    }
}
