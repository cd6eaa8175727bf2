package com.talent.match.service;

import com.talent.match.dto.ChangeEvent;
import com.talent.match.dto.InvalidationResult;

public interface InvalidationService {

    /**
     * Marks every score touched by the change stale and queues the affected pairs. Safe to call again
     * with the same event.
     */
    InvalidationResult handle(ChangeEvent event);
}
