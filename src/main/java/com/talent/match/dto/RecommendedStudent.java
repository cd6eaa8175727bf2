package com.talent.match.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

/**
 * Corporate-facing candidate. {@code compositeScore} is the skill-match score alone. {@code stale} is set when
 * the candidate was served from a stored score because the marketplace could not be read.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecommendedStudent {
    private UUID studentId;
    private String displayName;
    private String university;
    private int compositeScore;
    private List<String> matchedSkills;
    private List<String> missingSkills;
    private List<String> transferredSkills;
    private boolean stale;
}
