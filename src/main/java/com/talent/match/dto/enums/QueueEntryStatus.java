package com.talent.match.dto.enums;

public enum QueueEntryStatus {
    PENDING,
    CLAIMED,
    PROCESSED,
    DEAD_LETTER
}
