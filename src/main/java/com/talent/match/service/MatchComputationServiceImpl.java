package com.talent.match.service;

import com.talent.match.dto.AffinitySignals;
import com.talent.match.dto.MatchComputation;
import com.talent.match.dto.ScoreWriteResult;
import com.talent.match.dto.StudentMatchContext;
import com.talent.match.exceptions.ComputationTimeoutException;
import com.talent.match.exceptions.InternalServerErrorException;
import com.talent.match.exceptions.InvalidReferenceException;
import com.talent.match.models.MatchEngineConfiguration;
import com.talent.match.repo.MarketplaceSnapshotRepository;
import com.talent.match.service.MarketplaceRecords.ListingSnapshot;
import com.talent.match.service.MarketplaceRecords.SkillTransfer;
import com.talent.match.service.MarketplaceRecords.StudentHistory;
import com.talent.match.service.MarketplaceRecords.StudentProfile;
import com.talent.match.utils.basic.DefaultValuesPopulator;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;


@Slf4j
@Service
public class MatchComputationServiceImpl implements MatchComputationService {

    private final MarketplaceSnapshotRepository snapshotRepository;
    private final AffinityLearner affinityLearner;
    private final SkillTransferMapper skillTransferMapper;
    private final MatchScoreCalculator calculator;
    private final EngineConfigService engineConfigService;
    private final ScoreStore scoreStore;
    private final ExecutorService syncComputeExecutor;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public MatchComputationServiceImpl(MarketplaceSnapshotRepository snapshotRepository,
                                       AffinityLearner affinityLearner,
                                       SkillTransferMapper skillTransferMapper,
                                       MatchScoreCalculator calculator,
                                       EngineConfigService engineConfigService,
                                       ScoreStore scoreStore,
                                       @Qualifier("syncComputeExecutor") ExecutorService syncComputeExecutor,
                                       MeterRegistry meterRegistry,
                                       Clock clock) {
        this.snapshotRepository = snapshotRepository;
        this.affinityLearner = affinityLearner;
        this.skillTransferMapper = skillTransferMapper;
        this.calculator = calculator;
        this.engineConfigService = engineConfigService;
        this.scoreStore = scoreStore;
        this.syncComputeExecutor = syncComputeExecutor;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    @Override
    public StudentMatchContext loadStudentContext(UUID studentId) {
        StudentProfile student = snapshotRepository.findStudent(studentId)
                .orElseThrow(() -> InvalidReferenceException.student(studentId));
        StudentHistory history = snapshotRepository.findHistory(studentId);
        AffinitySignals signals = affinityLearner.learn(history);
        MatchEngineConfiguration configuration = engineConfigService.getConfiguration(student.getTenantId());
        List<SkillTransfer> transfers = skillTransferMapper.resolve(student, configuration);
        return StudentMatchContext.builder()
                .student(student)
                .history(history)
                .signals(signals)
                .transfers(transfers)
                .configuration(configuration)
                .build();
    }

    @Override
    public ListingSnapshot loadListing(UUID listingId) {
        return snapshotRepository.findListing(listingId)
                .orElseThrow(() -> InvalidReferenceException.listing(listingId));
    }

    @Override
    public MatchComputation score(StudentMatchContext context, ListingSnapshot listing) {
        return calculator.compute(context.getStudent(), listing, context.getSignals(), context.getTransfers(),
                DefaultValuesPopulator.now(clock));
    }

    @Override
    public ScoreWriteResult recompute(UUID studentId, UUID listingId, long version) {
        Timer.Sample sample = Timer.start(meterRegistry);
        long start = System.nanoTime();
        StudentMatchContext context = loadStudentContext(studentId);
        ListingSnapshot listing = loadListing(listingId);
        MatchComputation computation = score(context, listing);
        int elapsedMs = (int) TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        ScoreWriteResult result = scoreStore.write(computation, version, elapsedMs);
        sample.stop(meterRegistry.timer("match_score_recompute_duration", "applied", String.valueOf(result.isApplied())));
        log.debug("Recomputed studentId={}, listingId={}, version={}, score={}, applied={}",
                studentId, listingId, version, computation.getCompositeScore(), result.isApplied());
        return result;
    }

    @Override
    public MatchComputation recomputeWithTimeout(UUID studentId, UUID listingId, long timeoutMs) {
        // drawn before the snapshots are read so a concurrent invalidation wins over this write
        long version = scoreStore.nextEventVersion();
        CompletableFuture<MatchComputation> future;
        try {
            future = CompletableFuture.supplyAsync(() -> {
                long start = System.nanoTime();
                StudentMatchContext context = loadStudentContext(studentId);
                MatchComputation computation = score(context, loadListing(listingId));
                int elapsedMs = (int) TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
                scoreStore.write(computation, version, elapsedMs);
                return computation;
            }, syncComputeExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("Sync compute pool saturated, studentId={}, listingId={} not scored inline", studentId, listingId);
            throw new ComputationTimeoutException(studentId, listingId, timeoutMs);
        }
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            meterRegistry.counter("match_sync_compute_timeouts").increment();
            throw new ComputationTimeoutException(studentId, listingId, timeoutMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InternalServerErrorException("Interrupted while scoring studentId=" + studentId
                    + ", listingId=" + listingId, e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new InternalServerErrorException("Failed scoring studentId=" + studentId + ", listingId=" + listingId, e.getCause());
        }
    }
}
