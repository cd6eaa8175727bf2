package com.talent.match.controller;

import com.talent.match.dto.ChangeEvent;
import com.talent.match.dto.InvalidationResult;
import com.talent.match.service.InvalidationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Synchronous entry point for marketplace change events, equivalent to publishing them on the events topic.
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/match-engine/events")
@Tag(name = "Match Events")
public class MatchEventController {
    private final InvalidationService invalidationService;

    @Operation(summary = "Invalidate scores affected by a marketplace change")
    @PostMapping
    public ResponseEntity<InvalidationResult> handleEvent(@Valid @RequestBody ChangeEvent event) {
        return ResponseEntity.ok(invalidationService.handle(event));
    }
}
