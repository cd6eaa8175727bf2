package com.talent.match.service;

import com.talent.match.dto.enums.RecomputeReason;
import com.talent.match.repo.RecomputationQueueRepositoryCustom.ClaimedEntry;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface RecomputationQueueService {

    /**
     * @return true when a new pending entry was created, false when an open one absorbed the request
     */
    boolean enqueue(UUID studentId, UUID listingId, RecomputeReason reason, long version);

    /**
     * @return number of new entries; the rest were deduplicated into open ones
     */
    int enqueueForStudent(UUID studentId, Collection<UUID> listingIds, RecomputeReason reason, long version);

    int enqueueForListing(UUID listingId, Collection<UUID> studentIds, RecomputeReason reason, long version);

    /**
     * Explicit request from an operator. Refused with a {@code QueueOverflowException} when the backlog is over
     * its threshold.
     */
    boolean enqueueManual(UUID studentId, UUID listingId);

    ClaimedEntry claim(UUID entryId, String workerId);

    /**
     * Claims up to one batch of due entries, highest priority and oldest staleness first. Entries lost to
     * another worker are skipped.
     */
    List<ClaimedEntry> claimBatch(String workerId);

    void complete(ClaimedEntry entry, String workerId);

    void fail(ClaimedEntry entry, String workerId, Throwable cause);

    long refreshBacklog();

    long getBacklog();

    boolean isOverflowing();

    void ensureCapacity();

    int requeueDeadLetters();

    int releaseExpiredClaims();

    int purgeProcessed();
}
