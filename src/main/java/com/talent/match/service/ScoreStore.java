package com.talent.match.service;

import com.talent.match.dto.MatchComputation;
import com.talent.match.dto.ScoreWriteResult;
import com.talent.match.models.MatchScoreEntity;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ScoreStore {

    /**
     * Next logical event version. Every invalidation and every computation is stamped with one.
     */
    long nextEventVersion();

    /**
     * Versioned upsert. A write carrying a version not newer than the stored one is rejected and leaves
     * the row untouched.
     */
    ScoreWriteResult write(MatchComputation computation, long version, int computationTimeMs);

    /**
     * @return listings whose score rows for the student were marked stale
     */
    List<UUID> markStaleByStudent(UUID studentId, long version);

    /**
     * @return students whose score rows for the listing were marked stale
     */
    List<UUID> markStaleByListing(UUID listingId, long version);

    Optional<MatchScoreEntity> find(UUID studentId, UUID listingId);

    List<MatchScoreEntity> findForStudent(UUID studentId, Collection<UUID> listingIds);
}
