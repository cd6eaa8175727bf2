package com.talent.match.repo;

import com.talent.match.dto.MatchComputation;
import com.talent.match.dto.ScoreWriteResult;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface MatchScoreRepositoryCustom {

    long nextEventVersion();

    /**
     * Inserts or overwrites the pair's score only when {@code version} is newer than the stored one.
     */
    ScoreWriteResult upsertIfNewer(MatchComputation computation, long version, int computationTimeMs,
                                   String engineVersion, OffsetDateTime computedAt);

    /**
     * @return ids of the students whose score rows for the listing were marked stale
     */
    List<UUID> markStaleByListing(UUID listingId, long version, OffsetDateTime now);

    /**
     * @return ids of the listings whose score rows for the student were marked stale
     */
    List<UUID> markStaleByStudent(UUID studentId, long version, OffsetDateTime now);

    /**
     * Marks every row owned by the given tenants stale. Used when athletic reference data changes.
     *
     * @return number of rows marked
     */
    int markStaleByTenants(Collection<UUID> tenantIds, long version, OffsetDateTime now);
}
