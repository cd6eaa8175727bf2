package com.talent.match.scheduler;

import com.talent.match.exceptions.InvalidReferenceException;
import com.talent.match.exceptions.PersistentComputeFailureException;
import com.talent.match.repo.RecomputationQueueRepositoryCustom.ClaimedEntry;
import com.talent.match.service.MatchComputationService;
import com.talent.match.service.RecomputationQueueService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;


/**
 * Drains the recomputation queue. Each poll claims one batch, recomputes the claimed pairs on the
 * recompute pool and stamps every write with the trigger version the entry carried at claim time.
 */
@Slf4j
@Component
public class RecomputationWorker {

    private final RecomputationQueueService queueService;
    private final MatchComputationService computationService;
    private final ExecutorService recomputeExecutor;
    private final MeterRegistry meterRegistry;
    private final String workerId;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public RecomputationWorker(RecomputationQueueService queueService,
                               MatchComputationService computationService,
                               @Qualifier("recomputeExecutor") ExecutorService recomputeExecutor,
                               MeterRegistry meterRegistry) {
        this.queueService = queueService;
        this.computationService = computationService;
        this.recomputeExecutor = recomputeExecutor;
        this.meterRegistry = meterRegistry;
        this.workerId = resolveHostName() + "-" + UUID.randomUUID();
    }

    @Scheduled(fixedDelayString = "${match.queue.poll-interval-ms:2000}")
    public void poll() {
        if (!running.compareAndSet(false, true)) {
            log.debug("Previous batch still in flight, skipping poll");
            return;
        }

        try {
            drainBatch();
        } catch (Exception e) {
            log.error("Recomputation poll failed for worker {}", workerId, e);
        } finally {
            running.set(false);
        }
    }

    /**
     * @return number of entries claimed in this pass
     */
    int drainBatch() {
        List<ClaimedEntry> batch = queueService.claimBatch(workerId);
        if (batch.isEmpty()) {
            queueService.refreshBacklog();
            return 0;
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        List<CompletableFuture<Void>> futures = new ArrayList<>(batch.size());
        for (ClaimedEntry entry : batch) {
            futures.add(CompletableFuture.runAsync(() -> process(entry), recomputeExecutor));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        sample.stop(meterRegistry.timer("match_queue_batch_duration"));

        long backlog = queueService.refreshBacklog();
        log.info("Worker {} processed {} queue entries, backlog={}", workerId, batch.size(), backlog);
        return batch.size();
    }

    void process(ClaimedEntry entry) {
        try {
            computationService.recompute(entry.studentId(), entry.listingId(), entry.triggerVersion());
            queueService.complete(entry, workerId);
        } catch (InvalidReferenceException e) {
            log.warn("Dropping queue entry {}: {}", entry.id(), e.getMessage());
            queueService.complete(entry, workerId);
        } catch (Exception e) {
            failQuietly(entry, e);
        }
    }

    private void failQuietly(ClaimedEntry entry, Exception cause) {
        try {
            queueService.fail(entry, workerId, cause);
        } catch (PersistentComputeFailureException e) {
            log.error("Queue entry {} for student={} listing={} moved to dead letter: {}",
                    entry.id(), entry.studentId(), entry.listingId(), e.getMessage());
        }
    }

    String getWorkerId() {
        return workerId;
    }

    private static String resolveHostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "worker";
        }
    }
}
