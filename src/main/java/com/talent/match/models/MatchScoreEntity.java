package com.talent.match.models;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "match_scores", indexes = {
        @Index(name = "idx_match_scores_listing", columnList = "listing_id"),
        @Index(name = "idx_match_scores_student_score", columnList = "student_id,composite_score")
}, uniqueConstraints = @UniqueConstraint(name = "uq_match_scores_pair", columnNames = {"student_id", "listing_id"}))
@Builder
@AllArgsConstructor
@NoArgsConstructor
@Data
public class MatchScoreEntity {
    @Id
    private UUID id;

    @Column(name = "student_id", nullable = false)
    private UUID studentId;

    @Column(name = "listing_id", nullable = false)
    private UUID listingId;

    @Column(name = "tenant_id")
    private UUID tenantId;

    @Column(name = "composite_score", nullable = false)
    private int compositeScore;

    @Column(name = "skill_match", nullable = false)
    private int skillMatch;

    @Column(name = "category_affinity", nullable = false)
    private int categoryAffinity;

    @Column(name = "availability", nullable = false)
    private int availability;

    @Column(name = "recency_boost", nullable = false)
    private int recencyBoost;

    @Column(name = "success_history", nullable = false)
    private int successHistory;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "matched_skills", columnDefinition = "jsonb")
    private List<String> matchedSkills;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "missing_skills", columnDefinition = "jsonb")
    private List<String> missingSkills;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "transferred_skills", columnDefinition = "jsonb")
    private List<String> transferredSkills;

    @Column(name = "is_stale", nullable = false)
    private boolean stale;

    @Column(name = "stale_since")
    private OffsetDateTime staleSince;

    @Column(name = "computed_version", nullable = false)
    private long computedVersion;

    @Column(name = "invalidated_version", nullable = false)
    private long invalidatedVersion;

    @Column(name = "computation_time_ms", nullable = false)
    private int computationTimeMs;

    @Column(name = "engine_version", nullable = false)
    private String engineVersion;

    @Column(name = "computed_at", nullable = false)
    private OffsetDateTime computedAt;
}
