package com.talent.match.dto.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Why a pair was queued. Priority runs from 1 (background) to 10 (explicit request).
 */
@Getter
@RequiredArgsConstructor
public enum RecomputeReason {
    MANUAL(10),
    CACHE_MISS(7),
    STALE_READ(6),
    PROFILE_UPDATE(5),
    APPLICATION_UPDATE(5),
    FEEDBACK(4),
    LISTING_UPDATE(3),
    VERSION_SUPERSEDED(3),
    DEAD_LETTER_REQUEUE(2);

    private final int priority;
}
