package com.talent.match.exceptions;

import lombok.Getter;

import java.util.UUID;

/**
 * Another worker claimed the entry first. Not a failure: the loser moves on to the next entry.
 */
@Getter
public class QueueClaimConflictException extends RuntimeException {
    private final UUID entryId;

    public QueueClaimConflictException(UUID entryId) {
        super("Queue entry " + entryId + " was claimed by another worker");
        this.entryId = entryId;
    }
}
