package com.talent.match.service;

import com.talent.match.config.QueueConfig;
import com.talent.match.dto.enums.QueueEntryStatus;
import com.talent.match.dto.enums.RecomputeReason;
import com.talent.match.exceptions.PersistentComputeFailureException;
import com.talent.match.exceptions.QueueClaimConflictException;
import com.talent.match.exceptions.QueueOverflowException;
import com.talent.match.repo.RecomputationQueueRepository;
import com.talent.match.repo.RecomputationQueueRepositoryCustom.ClaimedEntry;
import com.talent.match.utils.basic.Constant;
import com.talent.match.utils.basic.DefaultValuesPopulator;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;


@Slf4j
@Service
public class RecomputationQueueServiceImpl implements RecomputationQueueService {

    private final RecomputationQueueRepository queueRepository;
    private final ScoreStore scoreStore;
    private final QueueConfig queueConfig;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final AtomicLong backlog = new AtomicLong();

    public RecomputationQueueServiceImpl(RecomputationQueueRepository queueRepository,
                                         ScoreStore scoreStore,
                                         QueueConfig queueConfig,
                                         MeterRegistry meterRegistry,
                                         Clock clock) {
        this.queueRepository = queueRepository;
        this.scoreStore = scoreStore;
        this.queueConfig = queueConfig;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        meterRegistry.gauge("match_queue_backlog", backlog);
    }

    @Override
    public boolean enqueue(UUID studentId, UUID listingId, RecomputeReason reason, long version) {
        boolean created = queueRepository.enqueue(studentId, listingId, reason, version, DefaultValuesPopulator.now(clock));
        if (created) {
            backlog.incrementAndGet();
        }
        log.debug("Enqueue studentId={}, listingId={}, reason={}, version={}, created={}",
                studentId, listingId, reason, version, created);
        return created;
    }

    @Override
    public int enqueueForStudent(UUID studentId, Collection<UUID> listingIds, RecomputeReason reason, long version) {
        int created = 0;
        for (UUID listingId : listingIds) {
            if (enqueue(studentId, listingId, reason, version)) {
                created++;
            }
        }
        return created;
    }

    @Override
    public int enqueueForListing(UUID listingId, Collection<UUID> studentIds, RecomputeReason reason, long version) {
        int created = 0;
        for (UUID studentId : studentIds) {
            if (enqueue(studentId, listingId, reason, version)) {
                created++;
            }
        }
        return created;
    }

    @Override
    public boolean enqueueManual(UUID studentId, UUID listingId) {
        ensureCapacity();
        return enqueue(studentId, listingId, RecomputeReason.MANUAL, scoreStore.nextEventVersion());
    }

    @Override
    public ClaimedEntry claim(UUID entryId, String workerId) {
        return queueRepository.claim(entryId, workerId, DefaultValuesPopulator.now(clock))
                .orElseThrow(() -> new QueueClaimConflictException(entryId));
    }

    @Override
    public List<ClaimedEntry> claimBatch(String workerId) {
        List<UUID> due = queueRepository.findDueEntryIds(queueConfig.getBatchSize(), DefaultValuesPopulator.now(clock));
        List<ClaimedEntry> claimed = new ArrayList<>(due.size());
        for (UUID entryId : due) {
            try {
                claimed.add(claim(entryId, workerId));
            } catch (QueueClaimConflictException e) {
                log.debug("Lost claim on entryId={} to another worker, moving on", e.getEntryId());
                meterRegistry.counter("match_queue_claim_conflicts").increment();
            }
        }
        if (!claimed.isEmpty()) {
            backlog.updateAndGet(current -> Math.max(0, current - claimed.size()));
        }
        return claimed;
    }

    @Override
    public void complete(ClaimedEntry entry, String workerId) {
        OffsetDateTime now = DefaultValuesPopulator.now(clock);
        Long currentVersion = queueRepository.markProcessed(entry.id(), workerId, now).orElse(null);
        if (currentVersion == null) {
            log.warn("Entry id={} for studentId={}, listingId={} was no longer held by worker={} on completion",
                    entry.id(), entry.studentId(), entry.listingId(), workerId);
            return;
        }
        meterRegistry.counter("match_queue_processed").increment();
        if (currentVersion > entry.triggerVersion()) {
            // a newer change arrived while this entry was being computed
            log.debug("studentId={}, listingId={} superseded: claimed version={}, current version={}",
                    entry.studentId(), entry.listingId(), entry.triggerVersion(), currentVersion);
            enqueue(entry.studentId(), entry.listingId(), RecomputeReason.VERSION_SUPERSEDED, currentVersion);
        }
    }

    @Override
    public void fail(ClaimedEntry entry, String workerId, Throwable cause) {
        OffsetDateTime now = DefaultValuesPopulator.now(clock);
        String error = StringUtils.defaultIfBlank(ExceptionUtils.getRootCauseMessage(cause), cause.getClass().getName());
        if (entry.attempts() >= queueConfig.getMaxAttempts()) {
            queueRepository.recordFailure(entry.id(), workerId, QueueEntryStatus.DEAD_LETTER, now, error);
            meterRegistry.counter("match_queue_dead_letters").increment();
            throw new PersistentComputeFailureException(entry.id(), entry.studentId(), entry.listingId(), entry.attempts(), cause);
        }
        long delayMs = queueConfig.backoffMillis(entry.attempts());
        OffsetDateTime nextAttemptAt = now.plusNanos(delayMs * 1_000_000L);
        if (queueRepository.recordFailure(entry.id(), workerId, QueueEntryStatus.PENDING, nextAttemptAt, error)) {
            backlog.incrementAndGet();
        }
        meterRegistry.counter("match_queue_retries", Constant.OUTCOME, "scheduled").increment();
        log.warn("Recompute of studentId={}, listingId={} failed on attempt {}/{}, retry at {}: {}",
                entry.studentId(), entry.listingId(), entry.attempts(), queueConfig.getMaxAttempts(), nextAttemptAt, error);
    }

    @Override
    public long refreshBacklog() {
        long pending = queueRepository.countByStatus(QueueEntryStatus.PENDING);
        backlog.set(pending);
        return pending;
    }

    @Override
    public long getBacklog() {
        return backlog.get();
    }

    @Override
    public boolean isOverflowing() {
        return backlog.get() > queueConfig.getBacklogThreshold();
    }

    @Override
    public void ensureCapacity() {
        long current = backlog.get();
        if (current > queueConfig.getBacklogThreshold()) {
            throw new QueueOverflowException(current, queueConfig.getBacklogThreshold());
        }
    }

    @Override
    public int requeueDeadLetters() {
        int requeued = queueRepository.requeueDeadLetters(scoreStore.nextEventVersion(), DefaultValuesPopulator.now(clock));
        backlog.addAndGet(requeued);
        log.info("Requeued {} dead-lettered entries", requeued);
        return requeued;
    }

    @Override
    public int releaseExpiredClaims() {
        OffsetDateTime claimedBefore = DefaultValuesPopulator.now(clock).minus(queueConfig.getClaimLease());
        return queueRepository.releaseExpiredClaims(claimedBefore, queueConfig.getMaxAttempts());
    }

    @Override
    public int purgeProcessed() {
        OffsetDateTime processedBefore = DefaultValuesPopulator.now(clock).minus(queueConfig.getRetention());
        int purged = queueRepository.purgeProcessed(processedBefore);
        if (purged > 0) {
            log.info("Purged {} processed queue entries older than {}", purged, processedBefore);
        }
        return purged;
    }
}
