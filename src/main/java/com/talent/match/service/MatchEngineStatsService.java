package com.talent.match.service;

import com.talent.match.dto.MatchEngineStats;
import com.talent.match.dto.enums.QueueEntryStatus;
import com.talent.match.repo.MarketplaceSnapshotRepository;
import com.talent.match.repo.MarketplaceSnapshotRepository.FeedbackStats;
import com.talent.match.repo.MatchScoreRepository;
import com.talent.match.repo.RecomputationQueueRepository;
import com.talent.match.repo.ScoreAggregates;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class MatchEngineStatsService {

    private final MatchScoreRepository matchScoreRepository;
    private final RecomputationQueueRepository queueRepository;
    private final MarketplaceSnapshotRepository snapshotRepository;
    private final RecomputationQueueService queueService;

    @Transactional(readOnly = true)
    public MatchEngineStats getStats() {
        ScoreAggregates aggregates = matchScoreRepository.aggregate();
        FeedbackStats feedback = snapshotRepository.findFeedbackStats();
        long pending = queueRepository.countByStatus(QueueEntryStatus.PENDING);
        return MatchEngineStats.builder()
                .totalScores(valueOf(aggregates.getTotalScores()))
                .staleScores(valueOf(aggregates.getStaleScores()))
                .averageScore(round(aggregates.getAverageScore()))
                .minScore(aggregates.getMinScore() == null ? 0 : aggregates.getMinScore())
                .maxScore(aggregates.getMaxScore() == null ? 0 : aggregates.getMaxScore())
                .averageComputationTimeMs(round(aggregates.getAverageComputationTimeMs()))
                .queuePending(pending)
                .queueClaimed(queueRepository.countByStatus(QueueEntryStatus.CLAIMED))
                .queueProcessed(queueRepository.countByStatus(QueueEntryStatus.PROCESSED))
                .queueDeadLetter(queueRepository.countByStatus(QueueEntryStatus.DEAD_LETTER))
                .queueOverflowing(queueService.isOverflowing())
                .feedbackCount(feedback.totalFeedback())
                .averageFeedbackRating(round(feedback.averageRating()))
                .build();
    }

    private static long valueOf(Long value) {
        return value == null ? 0L : value;
    }

    private static double round(Double value) {
        return value == null ? 0.0 : Math.round(value * 100.0) / 100.0;
    }
}
