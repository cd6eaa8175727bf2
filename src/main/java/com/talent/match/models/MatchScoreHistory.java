package com.talent.match.models;

import com.talent.match.dto.enums.ScoreChangeReason;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "match_score_history")
@Builder
@AllArgsConstructor
@NoArgsConstructor
@Data
public class MatchScoreHistory {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "student_id", nullable = false)
    private UUID studentId;

    @Column(name = "listing_id", nullable = false)
    private UUID listingId;

    @Column(name = "old_score")
    private Integer oldScore;

    @Column(name = "new_score", nullable = false)
    private int newScore;

    @Enumerated(EnumType.STRING)
    @Column(name = "change_reason", nullable = false)
    private ScoreChangeReason changeReason;

    @Column(name = "event_version", nullable = false)
    private long eventVersion;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;
}
