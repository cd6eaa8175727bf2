package com.talent.match.exceptions;

import lombok.Getter;

import java.util.UUID;

/**
 * A synchronous recomputation did not finish inside its budget. Callers absorb it and serve the cached score.
 */
@Getter
public class ComputationTimeoutException extends RuntimeException {
    private final UUID studentId;
    private final UUID listingId;
    private final long timeoutMs;

    public ComputationTimeoutException(UUID studentId, UUID listingId, long timeoutMs) {
        super("Score computation for studentId=" + studentId + ", listingId=" + listingId
                + " exceeded " + timeoutMs + " ms");
        this.studentId = studentId;
        this.listingId = listingId;
        this.timeoutMs = timeoutMs;
    }
}
