package com.talent.match.service;

import com.talent.match.dto.MatchComputation;
import com.talent.match.dto.ScoreWriteResult;
import com.talent.match.dto.enums.ScoreChangeReason;
import com.talent.match.exceptions.InternalServerErrorException;
import com.talent.match.models.MatchScoreEntity;
import com.talent.match.models.MatchScoreHistory;
import com.talent.match.repo.MatchScoreHistoryRepository;
import com.talent.match.repo.MatchScoreRepository;
import com.talent.match.utils.basic.DefaultValuesPopulator;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;


@Slf4j
@Service
public class ScoreStoreImpl implements ScoreStore {

    private final MatchScoreRepository matchScoreRepository;
    private final MatchScoreHistoryRepository historyRepository;
    private final RetryTemplate retryTemplate;
    private final TransactionTemplate transactionTemplate;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final String engineVersion;
    private final double historyMinDelta;

    public ScoreStoreImpl(MatchScoreRepository matchScoreRepository,
                          MatchScoreHistoryRepository historyRepository,
                          RetryTemplate retryTemplate,
                          TransactionTemplate transactionTemplate,
                          MeterRegistry meterRegistry,
                          Clock clock,
                          @Value("${match.engine-version:v1}") String engineVersion,
                          @Value("${match.history.min-delta:0.5}") double historyMinDelta) {
        this.matchScoreRepository = matchScoreRepository;
        this.historyRepository = historyRepository;
        this.retryTemplate = retryTemplate;
        this.transactionTemplate = transactionTemplate;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.engineVersion = engineVersion;
        this.historyMinDelta = historyMinDelta;
    }

    @Override
    public long nextEventVersion() {
        return matchScoreRepository.nextEventVersion();
    }

    @Override
    public ScoreWriteResult write(MatchComputation computation, long version, int computationTimeMs) {
        try {
            return retryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    log.warn("Retrying score write for studentId={}, listingId={}, attempt={}",
                            computation.getStudentId(), computation.getListingId(), context.getRetryCount() + 1);
                }
                return transactionTemplate.execute(status -> writeInTransaction(computation, version, computationTimeMs));
            });
        } catch (DataAccessException e) {
            meterRegistry.counter("match_score_write_failures").increment();
            throw new InternalServerErrorException("Failed to store score for studentId=" + computation.getStudentId()
                    + ", listingId=" + computation.getListingId(), e);
        }
    }

    private ScoreWriteResult writeInTransaction(MatchComputation computation, long version, int computationTimeMs) {
        OffsetDateTime now = DefaultValuesPopulator.now(clock);
        ScoreWriteResult result = matchScoreRepository.upsertIfNewer(computation, version, computationTimeMs, engineVersion, now);
        if (!result.isApplied()) {
            return result;
        }
        Integer previous = result.getPreviousScore();
        int current = computation.getCompositeScore();
        if (previous == null || Math.abs(current - previous) > historyMinDelta) {
            historyRepository.save(MatchScoreHistory.builder()
                    .studentId(computation.getStudentId())
                    .listingId(computation.getListingId())
                    .oldScore(previous)
                    .newScore(current)
                    .changeReason(previous == null ? ScoreChangeReason.INITIAL : ScoreChangeReason.RECOMPUTATION)
                    .eventVersion(version)
                    .createdAt(now)
                    .build());
        }
        if (result.isStillStale()) {
            log.debug("Score for studentId={}, listingId={} written at version={} but invalidated at version={}",
                    computation.getStudentId(), computation.getListingId(), version, result.getInvalidatedVersion());
        }
        return result;
    }

    @Override
    public List<UUID> markStaleByStudent(UUID studentId, long version) {
        return matchScoreRepository.markStaleByStudent(studentId, version, DefaultValuesPopulator.now(clock));
    }

    @Override
    public List<UUID> markStaleByListing(UUID listingId, long version) {
        return matchScoreRepository.markStaleByListing(listingId, version, DefaultValuesPopulator.now(clock));
    }

    @Override
    public Optional<MatchScoreEntity> find(UUID studentId, UUID listingId) {
        return matchScoreRepository.findByStudentIdAndListingId(studentId, listingId);
    }

    @Override
    public List<MatchScoreEntity> findForStudent(UUID studentId, Collection<UUID> listingIds) {
        if (listingIds == null || listingIds.isEmpty()) {
            return List.of();
        }
        return matchScoreRepository.findByStudentIdAndListingIds(studentId, listingIds);
    }
}
