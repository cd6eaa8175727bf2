package com.talent.match.service;

import com.talent.match.dto.PairScoreView;
import com.talent.match.dto.RecommendedListing;
import com.talent.match.dto.RecommendedStudent;

import java.util.List;
import java.util.UUID;

public interface RecommendationService {

    /**
     * Ranked listings for a student. Cached scores are served as they are; stale ones are queued for
     * background recomputation.
     */
    List<RecommendedListing> getRecommendedListings(UUID studentId, Integer limit);

    /**
     * Students who have not applied to the listing, ranked by skill match alone.
     */
    List<RecommendedStudent> getRecommendedStudents(UUID listingId, Integer limit);

    /**
     * Score of one pair, recomputed inline when stale or missing. Falls back to the cached value with
     * {@code degraded = true} when the inline computation does not finish in time.
     */
    PairScoreView getPairScore(UUID studentId, UUID listingId);
}
