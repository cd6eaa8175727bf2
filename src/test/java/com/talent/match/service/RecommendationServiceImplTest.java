package com.talent.match.service;

import com.talent.match.dto.AffinitySignals;
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
import com.talent.match.models.MatchEngineConfiguration;
import com.talent.match.models.MatchScoreEntity;
import com.talent.match.repo.MarketplaceSnapshotRepository;
import com.talent.match.repo.MatchScoreRepository;
import com.talent.match.service.MarketplaceRecords.ListingSnapshot;
import com.talent.match.service.MarketplaceRecords.StudentHistory;
import com.talent.match.service.MarketplaceRecords.StudentProfile;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.domain.Pageable;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RecommendationServiceImplTest {

    private static final OffsetDateTime NOW = OffsetDateTime.of(2024, 5, 1, 12, 0, 0, 0, ZoneOffset.UTC);

    @Mock
    private MatchComputationService computationService;
    @Mock
    private MatchScoreCalculator calculator;
    @Mock
    private SkillTransferMapper skillTransferMapper;
    @Mock
    private EngineConfigService engineConfigService;
    @Mock
    private MarketplaceSnapshotRepository snapshotRepository;
    @Mock
    private MatchScoreRepository matchScoreRepository;
    @Mock
    private ScoreStore scoreStore;
    @Mock
    private RecomputationQueueService queueService;

    private RecommendationServiceImpl recommendationService;

    private final UUID studentId = UUID.randomUUID();
    private final UUID tenantId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        recommendationService = new RecommendationServiceImpl(computationService, calculator, skillTransferMapper,
                engineConfigService, snapshotRepository, matchScoreRepository, scoreStore, queueService,
                new SimpleMeterRegistry(), Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC));
        ReflectionTestUtils.setField(recommendationService, "listingCandidateLimit", 100);
        ReflectionTestUtils.setField(recommendationService, "studentCandidateLimit", 200);
        ReflectionTestUtils.setField(recommendationService, "syncComputeLimit", 20);
        ReflectionTestUtils.setField(recommendationService, "syncTimeoutMs", 1500L);
    }

    @Test
    void recommendations_rankServeStaleAndComputeMisses() {
        ListingSnapshot applied = listing(NOW);
        ListingSnapshot staleCached = listing(NOW.minusDays(2));
        ListingSnapshot missing = listing(NOW.minusDays(1));
        StudentMatchContext context = context(MatchEngineConfiguration.defaults(tenantId), applied.getId());
        when(scoreStore.nextEventVersion()).thenReturn(50L);
        when(computationService.loadStudentContext(studentId)).thenReturn(context);
        when(snapshotRepository.findPublishedListings(tenantId, 100)).thenReturn(List.of(applied, staleCached, missing));
        MatchScoreEntity row = row(staleCached.getId(), 40, true, 44L);
        when(scoreStore.findForStudent(eq(studentId), any())).thenReturn(List.of(row));
        MatchComputation computed = computation(missing.getId(), 75);
        when(computationService.score(context, missing)).thenReturn(computed);

        List<RecommendedListing> result = recommendationService.getRecommendedListings(studentId, null);

        assertThat(result).extracting(RecommendedListing::getListingId).containsExactly(missing.getId(), staleCached.getId());
        assertThat(result.get(1).isStale()).isTrue();
        verify(queueService).enqueue(studentId, staleCached.getId(), RecomputeReason.STALE_READ, 44L);
        verify(scoreStore).write(eq(computed), eq(50L), anyInt());
        verify(computationService, never()).score(context, applied);
    }

    @Test
    void recommendations_overflowServesStaleWithoutEnqueue() {
        ListingSnapshot staleCached = listing(NOW);
        StudentMatchContext context = context(MatchEngineConfiguration.defaults(tenantId));
        when(scoreStore.nextEventVersion()).thenReturn(50L);
        when(computationService.loadStudentContext(studentId)).thenReturn(context);
        when(snapshotRepository.findPublishedListings(tenantId, 100)).thenReturn(List.of(staleCached));
        when(scoreStore.findForStudent(eq(studentId), any())).thenReturn(List.of(row(staleCached.getId(), 40, true, 44L)));
        when(queueService.isOverflowing()).thenReturn(true);

        List<RecommendedListing> result = recommendationService.getRecommendedListings(studentId, 5);

        assertThat(result).hasSize(1);
        verify(queueService, never()).enqueue(any(), any(), any(), anyLong());
    }

    @Test
    void recommendations_applyThresholdAndLimit() {
        ListingSnapshot low = listing(NOW);
        ListingSnapshot high = listing(NOW);
        ListingSnapshot mid = listing(NOW);
        MatchEngineConfiguration configuration = MatchEngineConfiguration.builder()
                .tenantId(tenantId).minScoreThreshold(30).maxResultsPerQuery(1).build();
        StudentMatchContext context = context(configuration);
        when(scoreStore.nextEventVersion()).thenReturn(1L);
        when(computationService.loadStudentContext(studentId)).thenReturn(context);
        when(snapshotRepository.findPublishedListings(tenantId, 100)).thenReturn(List.of(low, high, mid));
        when(scoreStore.findForStudent(eq(studentId), any())).thenReturn(List.of(
                row(low.getId(), 10, false, 0L), row(high.getId(), 90, false, 0L), row(mid.getId(), 50, false, 0L)));

        List<RecommendedListing> result = recommendationService.getRecommendedListings(studentId, 10);

        assertThat(result).extracting(RecommendedListing::getListingId).containsExactly(high.getId());
    }

    @Test
    void recommendations_rejectNonPositiveLimit() {
        assertThatThrownBy(() -> recommendationService.getRecommendedListings(studentId, 0))
                .isInstanceOf(BadRequestException.class);
        verifyNoInteractions(scoreStore);
    }

    @Test
    void recommendations_fallBackToCachedScoresWhenSnapshotsFail() {
        when(scoreStore.nextEventVersion()).thenReturn(1L);
        when(computationService.loadStudentContext(studentId))
                .thenThrow(new DataAccessResourceFailureException("marketplace database down"));
        UUID listingId = UUID.randomUUID();
        when(matchScoreRepository.findByStudentIdOrderByCompositeScoreDesc(eq(studentId), any(Pageable.class)))
                .thenReturn(List.of(row(listingId, 66, false, 0L)));

        List<RecommendedListing> result = recommendationService.getRecommendedListings(studentId, 3);

        assertThat(result).extracting(RecommendedListing::getCompositeScore).containsExactly(66);
    }

    @Test
    void recommendedStudents_rankedBySkillMatch() {
        UUID listingId = UUID.randomUUID();
        ListingSnapshot listing = ListingSnapshot.builder().id(listingId).tenantId(tenantId)
                .requiredSkills(List.of("python")).build();
        StudentProfile weak = StudentProfile.builder().id(UUID.randomUUID()).tenantId(tenantId).skills(List.of()).build();
        StudentProfile strong = StudentProfile.builder().id(UUID.randomUUID()).tenantId(tenantId)
                .skills(List.of("python")).build();
        when(computationService.loadListing(listingId)).thenReturn(listing);
        when(engineConfigService.getConfiguration(tenantId)).thenReturn(MatchEngineConfiguration.defaults(tenantId));
        when(snapshotRepository.findStudentsWithoutApplication(listingId, 200)).thenReturn(List.of(weak, strong));
        when(skillTransferMapper.resolve(any(), any())).thenReturn(List.of());
        when(calculator.computeSkillMatch(eq(List.of()), any(), any())).thenReturn(skillMatch(0.0));
        when(calculator.computeSkillMatch(eq(List.of("python")), any(), any())).thenReturn(skillMatch(1.0));

        List<RecommendedStudent> result = recommendationService.getRecommendedStudents(listingId, null);

        assertThat(result).extracting(RecommendedStudent::getStudentId).containsExactly(strong.getId(), weak.getId());
        assertThat(result.get(0).getCompositeScore()).isEqualTo(100);
    }

    @Test
    void recommendations_equalScoresOrderedByPublishTimeThenListingId() {
        ListingSnapshot newest = listing(NOW);
        ListingSnapshot sameTimeA = listing(NOW.minusDays(1));
        ListingSnapshot sameTimeB = listing(NOW.minusDays(1));
        ListingSnapshot unpublished = listing(null);
        StudentMatchContext context = context(MatchEngineConfiguration.defaults(tenantId));
        when(scoreStore.nextEventVersion()).thenReturn(1L);
        when(computationService.loadStudentContext(studentId)).thenReturn(context);
        when(snapshotRepository.findPublishedListings(tenantId, 100))
                .thenReturn(List.of(unpublished, sameTimeB, newest, sameTimeA));
        when(scoreStore.findForStudent(eq(studentId), any())).thenReturn(List.of(
                row(unpublished.getId(), 60, false, 0L), row(sameTimeB.getId(), 60, false, 0L),
                row(newest.getId(), 60, false, 0L), row(sameTimeA.getId(), 60, false, 0L)));

        List<RecommendedListing> result = recommendationService.getRecommendedListings(studentId, null);

        List<UUID> sameTimeInIdOrder = Stream.of(sameTimeA.getId(), sameTimeB.getId()).sorted().toList();
        assertThat(result).extracting(RecommendedListing::getListingId).containsExactly(
                newest.getId(), sameTimeInIdOrder.get(0), sameTimeInIdOrder.get(1), unpublished.getId());
    }

    @Test
    void recommendations_excludeListingsWithClosedInvite() {
        ListingSnapshot declinedInvite = listing(NOW);
        ListingSnapshot open = listing(NOW);
        StudentMatchContext context = context(MatchEngineConfiguration.defaults(tenantId));
        context.getHistory().setClosedInviteListingIds(Set.of(declinedInvite.getId()));
        when(scoreStore.nextEventVersion()).thenReturn(1L);
        when(computationService.loadStudentContext(studentId)).thenReturn(context);
        when(snapshotRepository.findPublishedListings(tenantId, 100)).thenReturn(List.of(declinedInvite, open));
        when(scoreStore.findForStudent(eq(studentId), any())).thenReturn(List.of(
                row(declinedInvite.getId(), 95, false, 0L), row(open.getId(), 40, false, 0L)));

        List<RecommendedListing> result = recommendationService.getRecommendedListings(studentId, null);

        assertThat(result).extracting(RecommendedListing::getListingId).containsExactly(open.getId());
        verify(computationService, never()).score(context, declinedInvite);
    }

    @Test
    void recommendations_cachedFallbackAppliesTenantThresholdAndCap() {
        when(scoreStore.nextEventVersion()).thenReturn(1L);
        when(computationService.loadStudentContext(studentId))
                .thenThrow(new DataAccessResourceFailureException("marketplace database down"));
        MatchScoreEntity best = tenantRow(UUID.randomUUID(), 90);
        MatchScoreEntity good = tenantRow(UUID.randomUUID(), 70);
        MatchScoreEntity belowThreshold = tenantRow(UUID.randomUUID(), 20);
        when(matchScoreRepository.findByStudentIdOrderByCompositeScoreDesc(eq(studentId), any(Pageable.class)))
                .thenReturn(List.of(best, good, belowThreshold));
        when(engineConfigService.getConfiguration(tenantId)).thenReturn(MatchEngineConfiguration.builder()
                .tenantId(tenantId).minScoreThreshold(50).maxResultsPerQuery(1).build());

        List<RecommendedListing> result = recommendationService.getRecommendedListings(studentId, 10);

        assertThat(result).extracting(RecommendedListing::getListingId).containsExactly(best.getListingId());
        assertThat(result.get(0).isStale()).isTrue();
    }

    @Test
    void recommendedStudents_equalSkillMatchOrderedByStudentId() {
        UUID listingId = UUID.randomUUID();
        ListingSnapshot listing = ListingSnapshot.builder().id(listingId).tenantId(tenantId)
                .requiredSkills(List.of("python")).build();
        List<StudentProfile> students = Stream.generate(() -> StudentProfile.builder().id(UUID.randomUUID())
                .tenantId(tenantId).skills(List.of("python")).build()).limit(3).toList();
        when(computationService.loadListing(listingId)).thenReturn(listing);
        when(engineConfigService.getConfiguration(tenantId)).thenReturn(MatchEngineConfiguration.defaults(tenantId));
        when(snapshotRepository.findStudentsWithoutApplication(listingId, 200)).thenReturn(students);
        when(skillTransferMapper.resolve(any(), any())).thenReturn(List.of());
        when(calculator.computeSkillMatch(any(), any(), any())).thenReturn(skillMatch(0.5));

        List<RecommendedStudent> result = recommendationService.getRecommendedStudents(listingId, null);

        assertThat(result).extracting(RecommendedStudent::getStudentId)
                .containsExactlyElementsOf(students.stream().map(StudentProfile::getId).sorted().toList());
    }

    @Test
    void recommendedStudents_fallBackToCachedSkillMatchWhenCandidatesUnavailable() {
        UUID listingId = UUID.randomUUID();
        ListingSnapshot listing = ListingSnapshot.builder().id(listingId).tenantId(tenantId)
                .requiredSkills(List.of("python")).build();
        when(computationService.loadListing(listingId)).thenReturn(listing);
        when(engineConfigService.getConfiguration(tenantId)).thenReturn(MatchEngineConfiguration.defaults(tenantId));
        when(snapshotRepository.findStudentsWithoutApplication(listingId, 200))
                .thenThrow(new DataAccessResourceFailureException("marketplace database down"));
        UUID strong = UUID.randomUUID();
        UUID weak = UUID.randomUUID();
        when(matchScoreRepository.findByListingIdOrderBySkillMatchDescStudentIdAsc(eq(listingId), any(Pageable.class)))
                .thenReturn(List.of(cachedCandidate(strong, listingId, 100), cachedCandidate(weak, listingId, 30)));

        List<RecommendedStudent> result = recommendationService.getRecommendedStudents(listingId, 5);

        assertThat(result).extracting(RecommendedStudent::getStudentId).containsExactly(strong, weak);
        assertThat(result).extracting(RecommendedStudent::getCompositeScore).containsExactly(100, 30);
        assertThat(result).allMatch(RecommendedStudent::isStale);
    }

    @Test
    void recommendedStudents_fallBackWhenListingSnapshotUnavailable() {
        UUID listingId = UUID.randomUUID();
        when(computationService.loadListing(listingId))
                .thenThrow(new DataAccessResourceFailureException("marketplace database down"));
        UUID cachedStudent = UUID.randomUUID();
        when(matchScoreRepository.findByListingIdOrderBySkillMatchDescStudentIdAsc(eq(listingId), any(Pageable.class)))
                .thenReturn(List.of(cachedCandidate(cachedStudent, listingId, 80)));

        List<RecommendedStudent> result = recommendationService.getRecommendedStudents(listingId, null);

        assertThat(result).extracting(RecommendedStudent::getStudentId).containsExactly(cachedStudent);
    }

    @Test
    void pairScore_freshRowServedWithoutRecompute() {
        UUID listingId = UUID.randomUUID();
        when(scoreStore.find(studentId, listingId)).thenReturn(Optional.of(row(listingId, 70, false, 0L)));

        PairScoreView view = recommendationService.getPairScore(studentId, listingId);

        assertThat(view.getCompositeScore()).isEqualTo(70);
        assertThat(view.isDegraded()).isFalse();
        verifyNoInteractions(computationService);
    }

    @Test
    void pairScore_timeoutServesStaleAsDegraded() {
        UUID listingId = UUID.randomUUID();
        when(scoreStore.find(studentId, listingId)).thenReturn(Optional.of(row(listingId, 55, true, 9L)));
        when(computationService.recomputeWithTimeout(studentId, listingId, 1500L))
                .thenThrow(new ComputationTimeoutException(studentId, listingId, 1500L));

        PairScoreView view = recommendationService.getPairScore(studentId, listingId);

        assertThat(view.isDegraded()).isTrue();
        assertThat(view.isStale()).isTrue();
        assertThat(view.getCompositeScore()).isEqualTo(55);
        verify(queueService).enqueue(studentId, listingId, RecomputeReason.STALE_READ, 9L);
    }

    @Test
    void pairScore_timeoutWithoutCachedRowIsPending() {
        UUID listingId = UUID.randomUUID();
        when(scoreStore.find(studentId, listingId)).thenReturn(Optional.empty());
        when(computationService.recomputeWithTimeout(studentId, listingId, 1500L))
                .thenThrow(new ComputationTimeoutException(studentId, listingId, 1500L));
        when(scoreStore.nextEventVersion()).thenReturn(12L);

        PairScoreView view = recommendationService.getPairScore(studentId, listingId);

        assertThat(view.isPending()).isTrue();
        assertThat(view.getCompositeScore()).isNull();
        verify(queueService).enqueue(studentId, listingId, RecomputeReason.STALE_READ, 12L);
    }

    private StudentMatchContext context(MatchEngineConfiguration configuration, UUID... appliedListingIds) {
        AffinitySignals signals = AffinitySignals.empty();
        signals.setAppliedListingIds(Set.of(appliedListingIds));
        return StudentMatchContext.builder()
                .student(StudentProfile.builder().id(studentId).tenantId(tenantId).skills(List.of()).build())
                .history(StudentHistory.builder().applications(List.of()).feedback(List.of())
                        .closedInviteListingIds(Set.of()).build())
                .signals(signals)
                .transfers(List.of())
                .configuration(configuration)
                .build();
    }

    private static ListingSnapshot listing(OffsetDateTime publishedAt) {
        return ListingSnapshot.builder().id(UUID.randomUUID()).title("Listing").publishedAt(publishedAt).build();
    }

    private MatchScoreEntity row(UUID listingId, int score, boolean stale, long invalidatedVersion) {
        return MatchScoreEntity.builder()
                .studentId(studentId)
                .listingId(listingId)
                .compositeScore(score)
                .matchedSkills(List.of())
                .missingSkills(List.of())
                .transferredSkills(List.of())
                .stale(stale)
                .invalidatedVersion(invalidatedVersion)
                .computedAt(NOW)
                .build();
    }

    private MatchScoreEntity tenantRow(UUID listingId, int score) {
        MatchScoreEntity row = row(listingId, score, false, 0L);
        row.setTenantId(tenantId);
        return row;
    }

    private static MatchScoreEntity cachedCandidate(UUID studentId, UUID listingId, int skillMatch) {
        return MatchScoreEntity.builder()
                .studentId(studentId)
                .listingId(listingId)
                .compositeScore(skillMatch)
                .skillMatch(skillMatch)
                .matchedSkills(List.of("python"))
                .missingSkills(List.of())
                .transferredSkills(List.of())
                .computedAt(NOW)
                .build();
    }

    private MatchComputation computation(UUID listingId, int score) {
        return MatchComputation.builder()
                .studentId(studentId)
                .listingId(listingId)
                .compositeScore(score)
                .breakdown(ScoreBreakdown.builder().build())
                .matchedSkills(List.of())
                .missingSkills(List.of())
                .transferredSkills(List.of())
                .build();
    }

    private static SkillMatchResult skillMatch(double factor) {
        return SkillMatchResult.builder()
                .factor(factor)
                .matchedSkills(List.of())
                .missingSkills(List.of())
                .transferredSkills(List.of())
                .build();
    }
}
