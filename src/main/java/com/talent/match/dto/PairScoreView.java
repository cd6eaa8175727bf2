package com.talent.match.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Single-pair score. {@code degraded} means the value is the last cached one (possibly stale) because a
 * fresh computation could not be obtained in time; {@code pending} means nothing is cached yet and a
 * recomputation was queued.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PairScoreView {
    private UUID studentId;
    private UUID listingId;
    private Integer compositeScore;
    private ScoreBreakdown breakdown;
    private List<String> matchedSkills;
    private List<String> missingSkills;
    private List<String> transferredSkills;
    private boolean stale;
    private boolean degraded;
    private boolean pending;
    private OffsetDateTime computedAt;
}
