package com.talent.match.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MatchComputation {
    private UUID studentId;
    private UUID listingId;
    private UUID tenantId;
    private int compositeScore;
    private ScoreBreakdown breakdown;
    private List<String> matchedSkills;
    private List<String> missingSkills;
    private List<String> transferredSkills;
}
