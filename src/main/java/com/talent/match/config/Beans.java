package com.talent.match.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;


@Configuration
@Slf4j
public class Beans {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public QueueConfig queueConfig(@Value("${match.queue.batch-size:50}") int batchSize,
                                   @Value("${match.queue.max-attempts:5}") int maxAttempts,
                                   @Value("${match.queue.base-backoff-ms:1000}") long baseBackoffMs,
                                   @Value("${match.queue.max-backoff-ms:300000}") long maxBackoffMs,
                                   @Value("${match.queue.backlog-threshold:10000}") long backlogThreshold,
                                   @Value("${match.queue.claim-lease-seconds:300}") long claimLeaseSeconds,
                                   @Value("${match.queue.retention-days:7}") long retentionDays) {
        return QueueConfig.builder()
                .batchSize(batchSize)
                .maxAttempts(maxAttempts)
                .baseBackoffMs(baseBackoffMs)
                .maxBackoffMs(maxBackoffMs)
                .backlogThreshold(backlogThreshold)
                .claimLease(Duration.ofSeconds(claimLeaseSeconds))
                .retention(Duration.ofDays(retentionDays))
                .build();
    }

    @Bean("recomputeExecutor")
    public ExecutorService recomputeExecutor(@Value("${match.queue.worker-threads:4}") int workerThreads,
                                             MeterRegistry meterRegistry) {
        ThreadFactory threadFactory = new ThreadFactoryBuilder().setNameFormat("recompute-%d").build();
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                workerThreads, workerThreads, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(500),
                threadFactory,
                new ThreadPoolExecutor.CallerRunsPolicy() {
                    @Override
                    public void rejectedExecution(Runnable r, ThreadPoolExecutor e) {
                        meterRegistry.counter("recompute_executor_rejections").increment();
                        log.warn("Recompute task rejected: queue size={}", e.getQueue().size());
                        super.rejectedExecution(r, e);
                    }
                }
        );
        meterRegistry.gauge("recompute_executor_active_threads", executor, ThreadPoolExecutor::getActiveCount);
        return executor;
    }

    @Bean("syncComputeExecutor")
    public ExecutorService syncComputeExecutor(MeterRegistry meterRegistry) {
        ThreadFactory threadFactory = new ThreadFactoryBuilder().setNameFormat("sync-compute-%d").build();
        return new ThreadPoolExecutor(
                4, 16, 60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(100),
                threadFactory,
                new ThreadPoolExecutor.AbortPolicy() {
                    @Override
                    public void rejectedExecution(Runnable r, ThreadPoolExecutor e) {
                        meterRegistry.counter("sync_compute_executor_rejections").increment();
                        super.rejectedExecution(r, e);
                    }
                }
        );
    }

    @Bean
    public RetryTemplate retryTemplate() {
        SimpleRetryPolicy retryPolicy = new SimpleRetryPolicy(3, Map.of(
                SQLException.class, true,
                DataIntegrityViolationException.class, false,
                DataAccessException.class, true
        ), true);
        ExponentialBackOffPolicy backOffPolicy = new ExponentialBackOffPolicy();
        backOffPolicy.setInitialInterval(200);
        backOffPolicy.setMultiplier(2.0);
        backOffPolicy.setMaxInterval(2000);
        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(retryPolicy);
        template.setBackOffPolicy(backOffPolicy);
        return template;
    }
}
