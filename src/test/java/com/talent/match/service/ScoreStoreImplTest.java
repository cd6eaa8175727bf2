package com.talent.match.service;

import com.talent.match.dto.MatchComputation;
import com.talent.match.dto.ScoreBreakdown;
import com.talent.match.dto.ScoreWriteResult;
import com.talent.match.dto.enums.ScoreChangeReason;
import com.talent.match.exceptions.InternalServerErrorException;
import com.talent.match.models.MatchScoreHistory;
import com.talent.match.repo.MatchScoreHistoryRepository;
import com.talent.match.repo.MatchScoreRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScoreStoreImplTest {

    @Mock
    private MatchScoreRepository matchScoreRepository;

    @Mock
    private MatchScoreHistoryRepository historyRepository;

    @Mock
    private PlatformTransactionManager transactionManager;

    private SimpleMeterRegistry meterRegistry;
    private ScoreStoreImpl scoreStore;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        RetryTemplate retryTemplate = RetryTemplate.builder().maxAttempts(3).noBackoff().build();
        scoreStore = new ScoreStoreImpl(matchScoreRepository, historyRepository, retryTemplate,
                new TransactionTemplate(transactionManager), meterRegistry,
                Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC), "v1", 0.5);
    }

    @Test
    void firstWrite_recordsInitialHistory() {
        MatchComputation computation = computation(72);
        when(matchScoreRepository.upsertIfNewer(eq(computation), eq(9L), eq(12), eq("v1"), any()))
                .thenReturn(ScoreWriteResult.builder().applied(true).build());

        ScoreWriteResult result = scoreStore.write(computation, 9L, 12);

        assertThat(result.isApplied()).isTrue();
        ArgumentCaptor<MatchScoreHistory> history = ArgumentCaptor.forClass(MatchScoreHistory.class);
        verify(historyRepository).save(history.capture());
        assertThat(history.getValue().getChangeReason()).isEqualTo(ScoreChangeReason.INITIAL);
        assertThat(history.getValue().getOldScore()).isNull();
        assertThat(history.getValue().getNewScore()).isEqualTo(72);
        assertThat(history.getValue().getEventVersion()).isEqualTo(9L);
    }

    @Test
    void changedScore_recordsRecomputationHistory() {
        MatchComputation computation = computation(60);
        when(matchScoreRepository.upsertIfNewer(any(), anyLong(), anyInt(), anyString(), any()))
                .thenReturn(ScoreWriteResult.builder().applied(true).previousScore(72).build());

        scoreStore.write(computation, 10L, 5);

        ArgumentCaptor<MatchScoreHistory> history = ArgumentCaptor.forClass(MatchScoreHistory.class);
        verify(historyRepository).save(history.capture());
        assertThat(history.getValue().getChangeReason()).isEqualTo(ScoreChangeReason.RECOMPUTATION);
        assertThat(history.getValue().getOldScore()).isEqualTo(72);
    }

    @Test
    void unchangedScore_skipsHistory() {
        when(matchScoreRepository.upsertIfNewer(any(), anyLong(), anyInt(), anyString(), any()))
                .thenReturn(ScoreWriteResult.builder().applied(true).previousScore(60).build());

        scoreStore.write(computation(60), 10L, 5);

        verify(historyRepository, never()).save(any());
    }

    @Test
    void olderVersion_isRejectedWithoutHistory() {
        when(matchScoreRepository.upsertIfNewer(any(), anyLong(), anyInt(), anyString(), any()))
                .thenReturn(ScoreWriteResult.rejected());

        ScoreWriteResult result = scoreStore.write(computation(80), 3L, 5);

        assertThat(result.isApplied()).isFalse();
        verify(historyRepository, never()).save(any());
    }

    @Test
    void persistentStorageFailure_isRetriedThenSurfaced() {
        when(matchScoreRepository.upsertIfNewer(any(), anyLong(), anyInt(), anyString(), any()))
                .thenThrow(new QueryTimeoutException("statement timeout"));

        assertThatThrownBy(() -> scoreStore.write(computation(50), 4L, 5))
                .isInstanceOf(InternalServerErrorException.class);

        verify(matchScoreRepository, times(3)).upsertIfNewer(any(), anyLong(), anyInt(), anyString(), any());
        assertThat(meterRegistry.counter("match_score_write_failures").count()).isEqualTo(1.0);
    }

    @Test
    void findForStudent_skipsQueryWithoutCandidates() {
        assertThat(scoreStore.findForStudent(UUID.randomUUID(), List.of())).isEmpty();
        verify(matchScoreRepository, never()).findByStudentIdAndListingIds(any(), any());
    }

    private static MatchComputation computation(int score) {
        return MatchComputation.builder()
                .studentId(UUID.randomUUID())
                .listingId(UUID.randomUUID())
                .compositeScore(score)
                .breakdown(ScoreBreakdown.builder().skillMatch(score).build())
                .matchedSkills(List.of())
                .missingSkills(List.of())
                .transferredSkills(List.of())
                .build();
    }
}
