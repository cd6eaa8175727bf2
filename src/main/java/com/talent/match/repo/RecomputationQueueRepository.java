package com.talent.match.repo;

import com.talent.match.dto.enums.QueueEntryStatus;
import com.talent.match.models.RecomputationQueueEntry;
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
public interface RecomputationQueueRepository extends JpaRepository<RecomputationQueueEntry, UUID>, RecomputationQueueRepositoryCustom {

    long countByStatus(QueueEntryStatus status);

    @Query("SELECT e FROM RecomputationQueueEntry e WHERE e.studentId = :studentId AND e.listingId = :listingId AND e.status IN :statuses")
    Optional<RecomputationQueueEntry> findOpenEntry(@Param("studentId") UUID studentId,
                                                    @Param("listingId") UUID listingId,
                                                    @Param("statuses") Collection<QueueEntryStatus> statuses);

    @Query("SELECT e FROM RecomputationQueueEntry e WHERE e.status = :status ORDER BY e.queuedAt DESC")
    List<RecomputationQueueEntry> findByStatus(@Param("status") QueueEntryStatus status, Pageable pageable);
}
