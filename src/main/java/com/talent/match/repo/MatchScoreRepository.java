package com.talent.match.repo;

import com.talent.match.models.MatchScoreEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface MatchScoreRepository extends JpaRepository<MatchScoreEntity, UUID>, MatchScoreRepositoryCustom {

    Optional<MatchScoreEntity> findByStudentIdAndListingId(UUID studentId, UUID listingId);

    List<MatchScoreEntity> findByStudentIdOrderByCompositeScoreDesc(UUID studentId, Pageable pageable);

    List<MatchScoreEntity> findByListingIdOrderBySkillMatchDescStudentIdAsc(UUID listingId, Pageable pageable);

    @Query("SELECT m FROM MatchScoreEntity m WHERE m.studentId = :studentId AND m.listingId IN :listingIds")
    List<MatchScoreEntity> findByStudentIdAndListingIds(@Param("studentId") UUID studentId,
                                                        @Param("listingIds") Collection<UUID> listingIds);

    @Query("""
           SELECT COUNT(m) AS totalScores,
                  SUM(CASE WHEN m.stale = true THEN 1 ELSE 0 END) AS staleScores,
                  AVG(m.compositeScore) AS averageScore,
                  MIN(m.compositeScore) AS minScore,
                  MAX(m.compositeScore) AS maxScore,
                  AVG(m.computationTimeMs) AS averageComputationTimeMs
           FROM MatchScoreEntity m
           """)
    ScoreAggregates aggregate();
}
