package com.talent.match.scheduler;

import com.talent.match.service.RecomputationQueueService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class QueueMaintenanceJob {
    private final RecomputationQueueService queueService;
    private final MeterRegistry meterRegistry;

    @Scheduled(cron = "${match.queue.maintenance-cron:0 */5 * * * *}")
    public void runMaintenance() {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            int released = queueService.releaseExpiredClaims();
            int purged = queueService.purgeProcessed();
            long backlog = queueService.refreshBacklog();
            if (released > 0 || purged > 0) {
                log.info("Queue maintenance: released {} expired claims, purged {} processed entries, backlog={}",
                        released, purged, backlog);
            }
        } catch (Exception e) {
            log.warn("Queue maintenance failed", e);
            meterRegistry.counter("match_queue_maintenance_errors").increment();
        } finally {
            sample.stop(meterRegistry.timer("match_queue_maintenance_duration"));
        }
    }
}
