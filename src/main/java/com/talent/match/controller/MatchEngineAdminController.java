package com.talent.match.controller;

import com.talent.match.dto.MatchEngineStats;
import com.talent.match.dto.QueueOperationResult;
import com.talent.match.dto.RecomputeRequest;
import com.talent.match.dto.SkillMappingRequest;
import com.talent.match.models.AthleticSkillMapping;
import com.talent.match.service.MatchEngineStatsService;
import com.talent.match.service.RecomputationQueueService;
import com.talent.match.service.SkillMappingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/match-engine/admin")
@Tag(name = "Match Engine Admin", description = "Statistics, skill mappings and queue operations")
public class MatchEngineAdminController {
    private final MatchEngineStatsService statsService;
    private final SkillMappingService skillMappingService;
    private final RecomputationQueueService queueService;

    @Operation(summary = "Score, queue and feedback statistics")
    @GetMapping("/stats")
    public ResponseEntity<MatchEngineStats> getStats() {
        return ResponseEntity.ok(statsService.getStats());
    }

    @Operation(summary = "List athletic skill mappings, optionally for one sport")
    @GetMapping("/skill-mappings")
    public ResponseEntity<List<AthleticSkillMapping>> listSkillMappings(@RequestParam(required = false) String sport) {
        return ResponseEntity.ok(skillMappingService.list(sport));
    }

    @Operation(summary = "Create an athletic skill mapping")
    @PostMapping("/skill-mappings")
    public ResponseEntity<AthleticSkillMapping> createSkillMapping(@Valid @RequestBody SkillMappingRequest request) {
        return new ResponseEntity<>(skillMappingService.create(request), HttpStatus.CREATED);
    }

    @Operation(summary = "Update an athletic skill mapping")
    @PutMapping("/skill-mappings/{mappingId}")
    public ResponseEntity<AthleticSkillMapping> updateSkillMapping(@PathVariable UUID mappingId,
                                                                   @Valid @RequestBody SkillMappingRequest request) {
        return ResponseEntity.ok(skillMappingService.update(mappingId, request));
    }

    @Operation(summary = "Move dead-lettered queue entries back to pending")
    @PostMapping("/queue/dead-letters/requeue")
    public ResponseEntity<QueueOperationResult> requeueDeadLetters() {
        int affected = queueService.requeueDeadLetters();
        return ResponseEntity.ok(QueueOperationResult.builder().operation("REQUEUE_DEAD_LETTERS").affected(affected).build());
    }

    @Operation(summary = "Queue a manual recomputation of one pair")
    @PostMapping("/queue/recompute")
    public ResponseEntity<QueueOperationResult> enqueueRecompute(@Valid @RequestBody RecomputeRequest request) {
        boolean created = queueService.enqueueManual(request.getStudentId(), request.getListingId());
        return new ResponseEntity<>(QueueOperationResult.builder().operation("ENQUEUE_MANUAL").affected(created ? 1 : 0).build(),
                HttpStatus.ACCEPTED);
    }
}
