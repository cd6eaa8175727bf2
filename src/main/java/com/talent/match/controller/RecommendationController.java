package com.talent.match.controller;

import com.talent.match.dto.PairScoreView;
import com.talent.match.dto.RecommendedListing;
import com.talent.match.dto.RecommendedStudent;
import com.talent.match.service.RecommendationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/match-engine")
@Tag(name = "Recommendations", description = "Ranked matches between students and listings")
public class RecommendationController {
    private final RecommendationService recommendationService;

    @Operation(summary = "Ranked listings for a student")
    @GetMapping("/students/{studentId}/recommendations")
    public ResponseEntity<List<RecommendedListing>> getRecommendedListings(@PathVariable UUID studentId,
                                                                           @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(recommendationService.getRecommendedListings(studentId, limit));
    }

    @Operation(summary = "Students who have not applied to a listing, ranked by skill match")
    @GetMapping("/listings/{listingId}/recommended-students")
    public ResponseEntity<List<RecommendedStudent>> getRecommendedStudents(@PathVariable UUID listingId,
                                                                           @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(recommendationService.getRecommendedStudents(listingId, limit));
    }

    @Operation(summary = "Score of a single student and listing pair")
    @GetMapping("/students/{studentId}/listings/{listingId}/score")
    public ResponseEntity<PairScoreView> getPairScore(@PathVariable UUID studentId, @PathVariable UUID listingId) {
        return ResponseEntity.ok(recommendationService.getPairScore(studentId, listingId));
    }
}
