package com.talent.match.repo;

import com.talent.match.models.MatchScoreHistory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface MatchScoreHistoryRepository extends JpaRepository<MatchScoreHistory, UUID> {
    List<MatchScoreHistory> findTop20ByStudentIdAndListingIdOrderByCreatedAtDesc(UUID studentId, UUID listingId);
}
