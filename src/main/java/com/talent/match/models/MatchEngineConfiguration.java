package com.talent.match.models;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "match_engine_config")
@Builder
@AllArgsConstructor
@NoArgsConstructor
@Data
public class MatchEngineConfiguration {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, unique = true)
    private UUID tenantId;

    @Builder.Default
    @Column(name = "enable_athletic_transfer", nullable = false)
    private boolean enableAthleticTransfer = true;

    @Builder.Default
    @Column(name = "min_score_threshold", nullable = false)
    private int minScoreThreshold = 0;

    @Builder.Default
    @Column(name = "max_results_per_query", nullable = false)
    private int maxResultsPerQuery = 50;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    public static MatchEngineConfiguration defaults(UUID tenantId) {
        return MatchEngineConfiguration.builder().tenantId(tenantId).build();
    }
}
