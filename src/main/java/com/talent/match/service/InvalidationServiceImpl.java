package com.talent.match.service;

import com.talent.match.dto.ChangeEvent;
import com.talent.match.dto.InvalidationResult;
import com.talent.match.dto.enums.ChangeEventType;
import com.talent.match.dto.enums.RecomputeReason;
import com.talent.match.exceptions.BadRequestException;
import com.talent.match.repo.MarketplaceSnapshotRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;


@Slf4j
@Service
@RequiredArgsConstructor
public class InvalidationServiceImpl implements InvalidationService {

    private final ScoreStore scoreStore;
    private final RecomputationQueueService queueService;
    private final MarketplaceSnapshotRepository snapshotRepository;

    @Override
    @Transactional
    public InvalidationResult handle(ChangeEvent event) {
        if (event == null || event.getType() == null) {
            throw new BadRequestException("Change event type is required");
        }
        return switch (event.getType()) {
            case PROFILE_SKILLS_CHANGED, PROFILE_AVAILABILITY_CHANGED ->
                    invalidateStudent(event, RecomputeReason.PROFILE_UPDATE);
            case APPLICATION_STATUS_CHANGED -> invalidateStudent(event, RecomputeReason.APPLICATION_UPDATE);
            case FEEDBACK_SUBMITTED -> invalidateStudent(event, RecomputeReason.FEEDBACK);
            case LISTING_CHANGED -> invalidateListing(event);
        };
    }

    // affinity and success history are per student, so any of these events touches all the student's scores
    private InvalidationResult invalidateStudent(ChangeEvent event, RecomputeReason reason) {
        UUID studentId = require(event.getStudentId(), "studentId", event.getType());
        long version = scoreStore.nextEventVersion();
        List<UUID> scored = scoreStore.markStaleByStudent(studentId, version);
        Set<UUID> listingIds = new LinkedHashSet<>(scored);
        if (event.getListingId() != null) {
            listingIds.add(event.getListingId());
        }
        int created = queueService.enqueueForStudent(studentId, listingIds, reason, version);
        log.info("{} for studentId={}: version={}, staleScores={}, pairs={}, enqueued={}",
                event.getType(), studentId, version, scored.size(), listingIds.size(), created);
        return result(event.getType(), version, scored.size(), listingIds.size(), created);
    }

    private InvalidationResult invalidateListing(ChangeEvent event) {
        UUID listingId = require(event.getListingId(), "listingId", event.getType());
        long version = scoreStore.nextEventVersion();
        List<UUID> scored = scoreStore.markStaleByListing(listingId, version);
        Set<UUID> studentIds = new LinkedHashSet<>(scored);
        studentIds.addAll(snapshotRepository.findApplicantIds(listingId));
        int created = queueService.enqueueForListing(listingId, studentIds, RecomputeReason.LISTING_UPDATE, version);
        log.info("LISTING_CHANGED for listingId={}: version={}, staleScores={}, pairs={}, enqueued={}",
                listingId, version, scored.size(), studentIds.size(), created);
        return result(ChangeEventType.LISTING_CHANGED, version, scored.size(), studentIds.size(), created);
    }

    private static InvalidationResult result(ChangeEventType type, long version, int stale, int pairs, int created) {
        return InvalidationResult.builder()
                .type(type)
                .eventVersion(version)
                .scoresMarkedStale(stale)
                .pairsEnqueued(created)
                .pairsDeduplicated(pairs - created)
                .build();
    }

    private static UUID require(UUID id, String field, ChangeEventType type) {
        if (id == null) {
            throw new BadRequestException(field + " is required for " + type + " events");
        }
        return id;
    }
}
