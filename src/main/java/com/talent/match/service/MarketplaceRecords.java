package com.talent.match.service;

import com.talent.match.dto.enums.ApplicationStatus;
import com.talent.match.dto.enums.ListingStatus;
import com.talent.match.dto.enums.MarketplaceType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Read-only views of marketplace data owned by other services. Skill names are already
 * normalized (trimmed, lower-cased) when these objects are built.
 */
public interface MarketplaceRecords {

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    class StudentProfile {
        private UUID id;
        private UUID tenantId;
        private MarketplaceType marketplaceType;
        private String displayName;
        private String university;
        private List<String> skills;
        private Set<String> skillCategories;
        private Integer hoursPerWeek;
        private String sport;
        private String position;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    class ListingSnapshot {
        private UUID id;
        private UUID tenantId;
        private String title;
        private String companyName;
        private String category;
        private List<String> requiredSkills;
        private Integer hoursPerWeek;
        private OffsetDateTime publishedAt;
        private ListingStatus status;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    class ApplicationOutcome {
        private UUID studentId;
        private UUID listingId;
        private ApplicationStatus status;
        private String category;
        private List<String> requiredSkills;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    class FeedbackRecord {
        private UUID studentId;
        private UUID listingId;
        private String category;
        private int rating;
        private OffsetDateTime createdAt;
    }

    /**
     * Everything the learner and the exclusion rules need about one student's past activity.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    class StudentHistory {
        private List<ApplicationOutcome> applications;
        private List<FeedbackRecord> feedback;
        private Set<UUID> closedInviteListingIds;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    class SkillTransfer {
        private String professionalSkill;
        private double transferStrength;
        private String skillCategory;
        private String sport;
        private String position;
    }
}
