package com.talent.match.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecommendedListing {
    private UUID listingId;
    private String title;
    private String companyName;
    private String category;
    private Integer hoursPerWeek;
    private OffsetDateTime publishedAt;
    private int compositeScore;
    private ScoreBreakdown breakdown;
    private List<String> matchedSkills;
    private List<String> missingSkills;
    private List<String> transferredSkills;
    private boolean stale;
}
