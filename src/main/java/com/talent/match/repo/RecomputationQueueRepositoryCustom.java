package com.talent.match.repo;

import com.talent.match.dto.enums.QueueEntryStatus;
import com.talent.match.dto.enums.RecomputeReason;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface RecomputationQueueRepositoryCustom {

    /**
     * Inserts a pending entry unless the pair already has an open (pending or claimed) one, in which
     * case the open entry only has its trigger version and priority raised.
     *
     * @return true when a new entry was created
     */
    boolean enqueue(UUID studentId, UUID listingId, RecomputeReason reason, long version, OffsetDateTime now);

    List<UUID> findDueEntryIds(int limit, OffsetDateTime now);

    /**
     * Conditional PENDING to CLAIMED transition. Only one concurrent caller can win.
     *
     * @return the trigger version the entry carried when claimed, or empty if another worker won
     */
    Optional<ClaimedEntry> claim(UUID entryId, String workerId, OffsetDateTime now);

    /**
     * @return the entry's current trigger version, which may have been raised while it was claimed
     */
    Optional<Long> markProcessed(UUID entryId, String workerId, OffsetDateTime now);

    boolean recordFailure(UUID entryId, String workerId, QueueEntryStatus nextStatus, OffsetDateTime nextAttemptAt, String error);

    int releaseExpiredClaims(OffsetDateTime claimedBefore, int maxAttempts);

    int purgeProcessed(OffsetDateTime processedBefore);

    int requeueDeadLetters(long version, OffsetDateTime now);

    record ClaimedEntry(UUID id, UUID studentId, UUID listingId, long triggerVersion, int attempts) {
    }
}
