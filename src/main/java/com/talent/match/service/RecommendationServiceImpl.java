package com.talent.match.service;

import com.talent.match.dto.MatchComputation;
import com.talent.match.dto.PairScoreView;
import com.talent.match.dto.RecommendedListing;
import com.talent.match.dto.RecommendedStudent;
import com.talent.match.dto.ScoreBreakdown;
import com.talent.match.dto.SkillMatchResult;
import com.talent.match.dto.StudentMatchContext;
import com.talent.match.dto.enums.RecomputeReason;
import com.talent.match.exceptions.BadRequestException;
import com.talent.match.exceptions.ComputationTimeoutException;
import com.talent.match.exceptions.InvalidReferenceException;
import com.talent.match.models.MatchEngineConfiguration;
import com.talent.match.models.MatchScoreEntity;
import com.talent.match.repo.MarketplaceSnapshotRepository;
import com.talent.match.repo.MatchScoreRepository;
import com.talent.match.service.MarketplaceRecords.ListingSnapshot;
import com.talent.match.service.MarketplaceRecords.StudentProfile;
import com.talent.match.utils.basic.DefaultValuesPopulator;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;


@Slf4j
@Service
public class RecommendationServiceImpl implements RecommendationService {

    static final Comparator<RecommendedListing> LISTING_ORDER = Comparator
            .comparingInt(RecommendedListing::getCompositeScore).reversed()
            .thenComparing(RecommendedListing::getPublishedAt, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(RecommendedListing::getListingId);

    static final Comparator<RecommendedStudent> STUDENT_ORDER = Comparator
            .comparingInt(RecommendedStudent::getCompositeScore).reversed()
            .thenComparing(RecommendedStudent::getStudentId);

    private final MatchComputationService computationService;
    private final MatchScoreCalculator calculator;
    private final SkillTransferMapper skillTransferMapper;
    private final EngineConfigService engineConfigService;
    private final MarketplaceSnapshotRepository snapshotRepository;
    private final MatchScoreRepository matchScoreRepository;
    private final ScoreStore scoreStore;
    private final RecomputationQueueService queueService;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Value("${match.recommendations.listing-candidate-limit:100}")
    private int listingCandidateLimit;

    @Value("${match.recommendations.student-candidate-limit:200}")
    private int studentCandidateLimit;

    @Value("${match.recommendations.sync-compute-limit:20}")
    private int syncComputeLimit;

    @Value("${match.sync.timeout-ms:1500}")
    private long syncTimeoutMs;

    public RecommendationServiceImpl(MatchComputationService computationService,
                                     MatchScoreCalculator calculator,
                                     SkillTransferMapper skillTransferMapper,
                                     EngineConfigService engineConfigService,
                                     MarketplaceSnapshotRepository snapshotRepository,
                                     MatchScoreRepository matchScoreRepository,
                                     ScoreStore scoreStore,
                                     RecomputationQueueService queueService,
                                     MeterRegistry meterRegistry,
                                     Clock clock) {
        this.computationService = computationService;
        this.calculator = calculator;
        this.skillTransferMapper = skillTransferMapper;
        this.engineConfigService = engineConfigService;
        this.snapshotRepository = snapshotRepository;
        this.matchScoreRepository = matchScoreRepository;
        this.scoreStore = scoreStore;
        this.queueService = queueService;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    @Override
    public List<RecommendedListing> getRecommendedListings(UUID studentId, Integer limit) {
        validateLimit(limit);
        // drawn before any snapshot is read, see MatchComputationService#recomputeWithTimeout
        long version = scoreStore.nextEventVersion();
        StudentMatchContext context;
        List<ListingSnapshot> listings;
        try {
            context = computationService.loadStudentContext(studentId);
            listings = snapshotRepository.findPublishedListings(context.getStudent().getTenantId(), listingCandidateLimit);
        } catch (InvalidReferenceException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Marketplace snapshots unavailable for studentId={}, serving cached scores: {}", studentId, e.getMessage());
            meterRegistry.counter("match_recommendations_fallback", "view", "listings").increment();
            return cachedRecommendations(studentId, limit);
        }

        MatchEngineConfiguration configuration = context.getConfiguration();
        Set<UUID> excluded = context.excludedListingIds();
        List<ListingSnapshot> candidates = listings.stream()
                .filter(listing -> !excluded.contains(listing.getId()))
                .toList();
        Map<UUID, MatchScoreEntity> cached = scoreStore.findForStudent(studentId,
                        candidates.stream().map(ListingSnapshot::getId).toList()).stream()
                .collect(Collectors.toMap(MatchScoreEntity::getListingId, Function.identity(), (a, b) -> a));

        boolean overflowing = queueService.isOverflowing();
        List<RecommendedListing> results = new ArrayList<>(candidates.size());
        int persisted = 0;
        int staleServed = 0;
        for (ListingSnapshot listing : candidates) {
            MatchScoreEntity row = cached.get(listing.getId());
            if (row != null) {
                if (row.isStale()) {
                    staleServed++;
                    if (!overflowing) {
                        queueService.enqueue(studentId, listing.getId(), RecomputeReason.STALE_READ, row.getInvalidatedVersion());
                    }
                }
                results.add(toRecommendation(listing, row));
                continue;
            }
            long start = System.nanoTime();
            MatchComputation computation = computationService.score(context, listing);
            if (persisted < syncComputeLimit) {
                int elapsedMs = (int) ((System.nanoTime() - start) / 1_000_000);
                scoreStore.write(computation, version, elapsedMs);
                persisted++;
            } else if (!overflowing) {
                queueService.enqueue(studentId, listing.getId(), RecomputeReason.CACHE_MISS, version);
            }
            results.add(toRecommendation(listing, computation));
        }
        if (overflowing && staleServed > 0) {
            log.warn("Queue overflowing, served {} stale scores to studentId={} without enqueueing", staleServed, studentId);
            meterRegistry.counter("match_stale_served_without_enqueue").increment(staleServed);
        }

        int effectiveLimit = effectiveLimit(limit, configuration);
        return results.stream()
                .filter(recommendation -> recommendation.getCompositeScore() >= configuration.getMinScoreThreshold())
                .sorted(LISTING_ORDER)
                .limit(effectiveLimit)
                .toList();
    }

    @Override
    public List<RecommendedStudent> getRecommendedStudents(UUID listingId, Integer limit) {
        validateLimit(limit);
        ListingSnapshot listing;
        MatchEngineConfiguration listingConfiguration;
        List<StudentProfile> students;
        try {
            listing = computationService.loadListing(listingId);
            listingConfiguration = engineConfigService.getConfiguration(listing.getTenantId());
            students = snapshotRepository.findStudentsWithoutApplication(listingId, studentCandidateLimit);
        } catch (InvalidReferenceException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Candidate students unavailable for listingId={}, serving cached scores: {}", listingId, e.getMessage());
            meterRegistry.counter("match_recommendations_fallback", "view", "students").increment();
            return cachedCandidates(listingId, limit);
        }

        List<RecommendedStudent> results = new ArrayList<>(students.size());
        for (StudentProfile student : students) {
            MatchEngineConfiguration configuration = engineConfigService.getConfiguration(student.getTenantId());
            SkillMatchResult skills = calculator.computeSkillMatch(student.getSkills(), listing.getRequiredSkills(),
                    skillTransferMapper.resolve(student, configuration));
            results.add(RecommendedStudent.builder()
                    .studentId(student.getId())
                    .displayName(student.getDisplayName())
                    .university(student.getUniversity())
                    .compositeScore((int) Math.round(100 * skills.getFactor()))
                    .matchedSkills(skills.getMatchedSkills())
                    .missingSkills(skills.getMissingSkills())
                    .transferredSkills(skills.getTransferredSkills())
                    .build());
        }
        return results.stream()
                .sorted(STUDENT_ORDER)
                .limit(effectiveLimit(limit, listingConfiguration))
                .toList();
    }

    @Override
    public PairScoreView getPairScore(UUID studentId, UUID listingId) {
        Optional<MatchScoreEntity> cached = scoreStore.find(studentId, listingId);
        if (cached.isPresent() && !cached.get().isStale()) {
            return toView(cached.get(), false);
        }
        if (cached.isPresent() && queueService.isOverflowing()) {
            log.warn("Queue overflowing, serving stale score for studentId={}, listingId={}", studentId, listingId);
            return toView(cached.get(), true);
        }
        try {
            MatchComputation computation = computationService.recomputeWithTimeout(studentId, listingId, syncTimeoutMs);
            return toView(computation);
        } catch (ComputationTimeoutException e) {
            log.warn("Inline recompute timed out after {} ms for studentId={}, listingId={}",
                    e.getTimeoutMs(), studentId, listingId);
            return degraded(studentId, listingId, cached.orElse(null));
        } catch (InvalidReferenceException e) {
            throw e;
        } catch (RuntimeException e) {
            if (cached.isEmpty()) {
                throw e;
            }
            log.warn("Inline recompute failed for studentId={}, listingId={}, serving cached score: {}",
                    studentId, listingId, e.getMessage());
            return degraded(studentId, listingId, cached.get());
        }
    }

    private PairScoreView degraded(UUID studentId, UUID listingId, MatchScoreEntity cached) {
        meterRegistry.counter("match_degraded_responses").increment();
        if (!queueService.isOverflowing()) {
            long version = cached != null ? cached.getInvalidatedVersion() : scoreStore.nextEventVersion();
            queueService.enqueue(studentId, listingId, RecomputeReason.STALE_READ, version);
        }
        if (cached != null) {
            return toView(cached, true);
        }
        return PairScoreView.builder()
                .studentId(studentId)
                .listingId(listingId)
                .degraded(true)
                .pending(true)
                .build();
    }

    // stored rows carry no publish time, so equal scores fall through to the listing id
    private List<RecommendedListing> cachedRecommendations(UUID studentId, Integer limit) {
        List<MatchScoreEntity> rows = matchScoreRepository.findByStudentIdOrderByCompositeScoreDesc(studentId,
                PageRequest.of(0, listingCandidateLimit));
        MatchEngineConfiguration configuration = configurationOrDefaults(rows.isEmpty() ? null : rows.get(0).getTenantId());
        return rows.stream()
                .filter(row -> row.getCompositeScore() >= configuration.getMinScoreThreshold())
                .map(row -> RecommendedListing.builder()
                        .listingId(row.getListingId())
                        .compositeScore(row.getCompositeScore())
                        .breakdown(breakdownOf(row))
                        .matchedSkills(row.getMatchedSkills())
                        .missingSkills(row.getMissingSkills())
                        .transferredSkills(row.getTransferredSkills())
                        .stale(true)
                        .build())
                .sorted(LISTING_ORDER)
                .limit(effectiveLimit(limit, configuration))
                .toList();
    }

    private List<RecommendedStudent> cachedCandidates(UUID listingId, Integer limit) {
        int effectiveLimit = effectiveLimit(limit, MatchEngineConfiguration.defaults(null));
        return matchScoreRepository.findByListingIdOrderBySkillMatchDescStudentIdAsc(listingId,
                        PageRequest.of(0, effectiveLimit))
                .stream()
                .map(row -> RecommendedStudent.builder()
                        .studentId(row.getStudentId())
                        .compositeScore(row.getSkillMatch())
                        .matchedSkills(row.getMatchedSkills())
                        .missingSkills(row.getMissingSkills())
                        .transferredSkills(row.getTransferredSkills())
                        .stale(true)
                        .build())
                .sorted(STUDENT_ORDER)
                .toList();
    }

    private MatchEngineConfiguration configurationOrDefaults(UUID tenantId) {
        if (tenantId == null) {
            return MatchEngineConfiguration.defaults(null);
        }
        try {
            return engineConfigService.getConfiguration(tenantId);
        } catch (RuntimeException e) {
            log.warn("Engine configuration unavailable for tenantId={}, using defaults: {}", tenantId, e.getMessage());
            return MatchEngineConfiguration.defaults(tenantId);
        }
    }

    private static void validateLimit(Integer limit) {
        if (limit != null && limit < 1) {
            throw new BadRequestException("limit must be a positive number");
        }
    }

    private static int effectiveLimit(Integer requested, MatchEngineConfiguration configuration) {
        int max = configuration.getMaxResultsPerQuery();
        return requested == null ? max : Math.min(requested, max);
    }

    private static RecommendedListing toRecommendation(ListingSnapshot listing, MatchScoreEntity row) {
        return baseRecommendation(listing)
                .compositeScore(row.getCompositeScore())
                .breakdown(breakdownOf(row))
                .matchedSkills(row.getMatchedSkills())
                .missingSkills(row.getMissingSkills())
                .transferredSkills(row.getTransferredSkills())
                .stale(row.isStale())
                .build();
    }

    private static RecommendedListing toRecommendation(ListingSnapshot listing, MatchComputation computation) {
        return baseRecommendation(listing)
                .compositeScore(computation.getCompositeScore())
                .breakdown(computation.getBreakdown())
                .matchedSkills(computation.getMatchedSkills())
                .missingSkills(computation.getMissingSkills())
                .transferredSkills(computation.getTransferredSkills())
                .stale(false)
                .build();
    }

    private static RecommendedListing.RecommendedListingBuilder baseRecommendation(ListingSnapshot listing) {
        return RecommendedListing.builder()
                .listingId(listing.getId())
                .title(listing.getTitle())
                .companyName(listing.getCompanyName())
                .category(listing.getCategory())
                .hoursPerWeek(listing.getHoursPerWeek())
                .publishedAt(listing.getPublishedAt());
    }

    private static ScoreBreakdown breakdownOf(MatchScoreEntity row) {
        return ScoreBreakdown.builder()
                .skillMatch(row.getSkillMatch())
                .categoryAffinity(row.getCategoryAffinity())
                .availability(row.getAvailability())
                .recencyBoost(row.getRecencyBoost())
                .successHistory(row.getSuccessHistory())
                .build();
    }

    private static PairScoreView toView(MatchScoreEntity row, boolean degraded) {
        return PairScoreView.builder()
                .studentId(row.getStudentId())
                .listingId(row.getListingId())
                .compositeScore(row.getCompositeScore())
                .breakdown(breakdownOf(row))
                .matchedSkills(row.getMatchedSkills())
                .missingSkills(row.getMissingSkills())
                .transferredSkills(row.getTransferredSkills())
                .stale(row.isStale())
                .degraded(degraded)
                .computedAt(row.getComputedAt())
                .build();
    }

    private PairScoreView toView(MatchComputation computation) {
        OffsetDateTime now = DefaultValuesPopulator.now(clock);
        return PairScoreView.builder()
                .studentId(computation.getStudentId())
                .listingId(computation.getListingId())
                .compositeScore(computation.getCompositeScore())
                .breakdown(computation.getBreakdown())
                .matchedSkills(computation.getMatchedSkills())
                .missingSkills(computation.getMissingSkills())
                .transferredSkills(computation.getTransferredSkills())
                .computedAt(now)
                .build();
    }
}
