package com.talent.match.config;

import lombok.Builder;
import lombok.Getter;

import java.time.Duration;

/**
 * Tunables of the recomputation queue, resolved once from {@code match.queue.*}.
 */
@Getter
@Builder
public class QueueConfig {
    private final int batchSize;
    private final int maxAttempts;
    private final long baseBackoffMs;
    private final long maxBackoffMs;
    private final long backlogThreshold;
    private final Duration claimLease;
    private final Duration retention;

    public QueueConfig(int batchSize, int maxAttempts, long baseBackoffMs, long maxBackoffMs,
                       long backlogThreshold, Duration claimLease, Duration retention) {
        if (batchSize <= 0 || maxAttempts <= 0) {
            throw new IllegalArgumentException("batchSize and maxAttempts must be positive");
        }
        if (baseBackoffMs <= 0 || maxBackoffMs < baseBackoffMs) {
            throw new IllegalArgumentException("backoff must satisfy 0 < base <= max");
        }
        this.batchSize = batchSize;
        this.maxAttempts = maxAttempts;
        this.baseBackoffMs = baseBackoffMs;
        this.maxBackoffMs = maxBackoffMs;
        this.backlogThreshold = backlogThreshold;
        this.claimLease = claimLease == null ? Duration.ofMinutes(5) : claimLease;
        this.retention = retention == null ? Duration.ofDays(7) : retention;
    }

    /**
     * Delay before the next attempt after {@code attempts} failed ones: base doubled per attempt, capped.
     */
    public long backoffMillis(int attempts) {
        int exponent = Math.max(0, Math.min(attempts - 1, 30));
        long delay = baseBackoffMs << exponent;
        return delay <= 0 ? maxBackoffMs : Math.min(delay, maxBackoffMs);
    }
}
