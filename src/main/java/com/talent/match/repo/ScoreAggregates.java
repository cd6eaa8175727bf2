package com.talent.match.repo;

public interface ScoreAggregates {
    Long getTotalScores();
    Long getStaleScores();
    Double getAverageScore();
    Integer getMinScore();
    Integer getMaxScore();
    Double getAverageComputationTimeMs();
}
