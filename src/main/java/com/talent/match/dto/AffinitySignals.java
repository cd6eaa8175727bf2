package com.talent.match.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Per-student aggregates derived from application outcomes and explicit feedback.
 * Category keys are lower-cased.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AffinitySignals {
    private Map<String, Long> categoryApplications;
    private Map<String, Long> categoryAcceptances;
    private Map<String, Long> categoryPositiveFeedback;
    private long totalApplications;
    private long totalFeedback;
    private Set<String> successfulSkills;
    private Set<UUID> appliedListingIds;

    /**
     * Share of the student's activity that falls in {@code category}, in [0, 1].
     * The application share uses {@code max(totalApplications, 1)} as denominator; positive feedback
     * can lift the share above it but never below.
     */
    public double learnedShare(String category) {
        long applications = categoryApplications.getOrDefault(category, 0L);
        double applicationShare = Math.min((double) applications / Math.max(totalApplications, 1L), 1.0);
        long positive = categoryPositiveFeedback.getOrDefault(category, 0L);
        if (positive == 0) {
            return applicationShare;
        }
        double observed = (double) (applications + positive) / Math.max(totalApplications + totalFeedback, 1L);
        return Math.max(applicationShare, Math.min(observed, 1.0));
    }

    public boolean hasSuccessIn(String category) {
        return categoryAcceptances.getOrDefault(category, 0L) > 0;
    }

    public static AffinitySignals empty() {
        return AffinitySignals.builder()
                .categoryApplications(Map.of())
                .categoryAcceptances(Map.of())
                .categoryPositiveFeedback(Map.of())
                .successfulSkills(Set.of())
                .appliedListingIds(Set.of())
                .build();
    }
}
