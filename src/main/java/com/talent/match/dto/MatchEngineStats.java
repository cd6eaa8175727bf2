package com.talent.match.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MatchEngineStats {
    private long totalScores;
    private long staleScores;
    private double averageScore;
    private int minScore;
    private int maxScore;
    private double averageComputationTimeMs;
    private long queuePending;
    private long queueClaimed;
    private long queueProcessed;
    private long queueDeadLetter;
    private boolean queueOverflowing;
    private long feedbackCount;
    private double averageFeedbackRating;
}
