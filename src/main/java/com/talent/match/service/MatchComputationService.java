package com.talent.match.service;

import com.talent.match.dto.MatchComputation;
import com.talent.match.dto.ScoreWriteResult;
import com.talent.match.dto.StudentMatchContext;
import com.talent.match.service.MarketplaceRecords.ListingSnapshot;

import java.util.UUID;

public interface MatchComputationService {

    StudentMatchContext loadStudentContext(UUID studentId);

    ListingSnapshot loadListing(UUID listingId);

    /**
     * Scores in memory without touching the store.
     */
    MatchComputation score(StudentMatchContext context, ListingSnapshot listing);

    /**
     * Reads fresh snapshots, scores the pair and writes the result stamped with {@code version}.
     */
    ScoreWriteResult recompute(UUID studentId, UUID listingId, long version);

    /**
     * Synchronous recompute bounded by {@code timeoutMs}. The computation keeps running and still writes
     * its result after a timeout; only the caller stops waiting.
     *
     * @throws com.talent.match.exceptions.ComputationTimeoutException when the budget is exceeded
     */
    MatchComputation recomputeWithTimeout(UUID studentId, UUID listingId, long timeoutMs);
}
