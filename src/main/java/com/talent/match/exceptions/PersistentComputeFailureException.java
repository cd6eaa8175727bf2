package com.talent.match.exceptions;

import lombok.Getter;

import java.util.UUID;

/**
 * A queue entry ran out of attempts and was moved to the dead-letter state.
 */
@Getter
public class PersistentComputeFailureException extends RuntimeException {
    private final UUID entryId;
    private final UUID studentId;
    private final UUID listingId;
    private final int attempts;

    public PersistentComputeFailureException(UUID entryId, UUID studentId, UUID listingId, int attempts, Throwable cause) {
        super("Recomputation of studentId=" + studentId + ", listingId=" + listingId
                + " dead-lettered after " + attempts + " attempts", cause);
        this.entryId = entryId;
        this.studentId = studentId;
        this.listingId = listingId;
        this.attempts = attempts;
    }
}
