package com.talent.match.repo;

import com.talent.match.dto.MatchComputation;
import com.talent.match.dto.ScoreBreakdown;
import com.talent.match.dto.ScoreWriteResult;
import com.talent.match.dto.enums.QueueEntryStatus;
import com.talent.match.dto.enums.RecomputeReason;
import com.talent.match.models.MatchScoreEntity;
import com.talent.match.repo.RecomputationQueueRepositoryCustom.ClaimedEntry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Testcontainers(disabledWithoutDocker = true)
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import(MatchEngineRepositoryIntegrationTest.MetricsConfig.class)
class MatchEngineRepositoryIntegrationTest {

    @Container
    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16.4");

    @DynamicPropertySource
    static void datasource(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
    }

    @TestConfiguration
    static class MetricsConfig {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    private static final OffsetDateTime NOW = OffsetDateTime.of(2024, 5, 1, 12, 0, 0, 0, ZoneOffset.UTC);

    @Autowired
    private RecomputationQueueRepository queueRepository;

    @Autowired
    private MatchScoreRepository matchScoreRepository;

    @Test
    void duplicateEnqueueLeavesOnePendingEntryWithHighestVersion() {
        UUID studentId = UUID.randomUUID();
        UUID listingId = UUID.randomUUID();

        boolean first = queueRepository.enqueue(studentId, listingId, RecomputeReason.LISTING_UPDATE, 4L, NOW);
        boolean second = queueRepository.enqueue(studentId, listingId, RecomputeReason.MANUAL, 9L, NOW);

        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(queueRepository.countByStatus(QueueEntryStatus.PENDING)).isEqualTo(1);
        UUID entryId = queueRepository.findDueEntryIds(10, NOW).get(0);
        ClaimedEntry claimed = queueRepository.claim(entryId, "worker-a", NOW).orElseThrow();
        assertThat(claimed.triggerVersion()).isEqualTo(9L);
        assertThat(claimed.attempts()).isEqualTo(1);
    }

    @Test
    void entryCanOnlyBeClaimedOnce() {
        queueRepository.enqueue(UUID.randomUUID(), UUID.randomUUID(), RecomputeReason.PROFILE_UPDATE, 1L, NOW);
        UUID entryId = queueRepository.findDueEntryIds(10, NOW).get(0);

        Optional<ClaimedEntry> winner = queueRepository.claim(entryId, "worker-a", NOW);
        Optional<ClaimedEntry> loser = queueRepository.claim(entryId, "worker-b", NOW);

        assertThat(winner).isPresent();
        assertThat(loser).isEmpty();
    }

    @Test
    void changeDuringClaimRaisesVersionReturnedOnCompletion() {
        UUID studentId = UUID.randomUUID();
        UUID listingId = UUID.randomUUID();
        queueRepository.enqueue(studentId, listingId, RecomputeReason.FEEDBACK, 2L, NOW);
        UUID entryId = queueRepository.findDueEntryIds(10, NOW).get(0);
        queueRepository.claim(entryId, "worker-a", NOW).orElseThrow();

        boolean created = queueRepository.enqueue(studentId, listingId, RecomputeReason.PROFILE_UPDATE, 5L, NOW);
        Optional<Long> current = queueRepository.markProcessed(entryId, "worker-a", NOW);

        assertThat(created).isFalse();
        assertThat(current).contains(5L);
        assertThat(queueRepository.enqueue(studentId, listingId, RecomputeReason.VERSION_SUPERSEDED, 5L, NOW)).isTrue();
    }

    @Test
    void higherPriorityEntriesAreDueFirst() {
        queueRepository.enqueue(UUID.randomUUID(), UUID.randomUUID(), RecomputeReason.LISTING_UPDATE, 1L, NOW.minusMinutes(5));
        queueRepository.enqueue(UUID.randomUUID(), UUID.randomUUID(), RecomputeReason.MANUAL, 2L, NOW);

        List<UUID> due = queueRepository.findDueEntryIds(10, NOW);
        ClaimedEntry first = queueRepository.claim(due.get(0), "worker", NOW).orElseThrow();

        assertThat(first.triggerVersion()).isEqualTo(2L);
    }

    @Test
    void olderComputationNeverOverwritesNewer() {
        UUID studentId = UUID.randomUUID();
        UUID listingId = UUID.randomUUID();

        ScoreWriteResult initial = matchScoreRepository.upsertIfNewer(computation(studentId, listingId, 70), 5L, 3, "v1", NOW);
        ScoreWriteResult older = matchScoreRepository.upsertIfNewer(computation(studentId, listingId, 20), 3L, 3, "v1", NOW);

        assertThat(initial.isApplied()).isTrue();
        assertThat(initial.getPreviousScore()).isNull();
        assertThat(older.isApplied()).isFalse();
        assertThat(matchScoreRepository.findByStudentIdAndListingId(studentId, listingId))
                .get().extracting(MatchScoreEntity::getCompositeScore).isEqualTo(70);
    }

    @Test
    void writeOlderThanInvalidationStaysStale() {
        UUID studentId = UUID.randomUUID();
        UUID listingId = UUID.randomUUID();
        matchScoreRepository.upsertIfNewer(computation(studentId, listingId, 70), 5L, 3, "v1", NOW);
        matchScoreRepository.markStaleByStudent(studentId, 8L, NOW);

        ScoreWriteResult racing = matchScoreRepository.upsertIfNewer(computation(studentId, listingId, 60), 6L, 3, "v1", NOW);
        ScoreWriteResult fresh = matchScoreRepository.upsertIfNewer(computation(studentId, listingId, 65), 9L, 3, "v1", NOW);

        assertThat(racing.isApplied()).isTrue();
        assertThat(racing.isStillStale()).isTrue();
        assertThat(racing.getPreviousScore()).isEqualTo(70);
        assertThat(fresh.isStillStale()).isFalse();
    }

    @Test
    void firstWriteOlderThanStudentInvalidationIsStoredStale() {
        UUID studentId = UUID.randomUUID();
        UUID listingId = UUID.randomUUID();
        List<UUID> touched = matchScoreRepository.markStaleByStudent(studentId, 51L, NOW);

        ScoreWriteResult write = matchScoreRepository.upsertIfNewer(computation(studentId, listingId, 70), 50L, 3, "v1", NOW);

        assertThat(touched).isEmpty();
        assertThat(write.isApplied()).isTrue();
        assertThat(write.isStillStale()).isTrue();
        assertThat(write.getInvalidatedVersion()).isEqualTo(51L);
        MatchScoreEntity stored = matchScoreRepository.findByStudentIdAndListingId(studentId, listingId).orElseThrow();
        assertThat(stored.isStale()).isTrue();
        assertThat(stored.getStaleSince()).isNotNull();
    }

    @Test
    void firstWriteOlderThanListingInvalidationIsStoredStale() {
        UUID studentId = UUID.randomUUID();
        UUID listingId = UUID.randomUUID();
        matchScoreRepository.markStaleByListing(listingId, 30L, NOW);

        ScoreWriteResult older = matchScoreRepository.upsertIfNewer(computation(studentId, listingId, 40), 29L, 3, "v1", NOW);
        ScoreWriteResult newer = matchScoreRepository.upsertIfNewer(computation(studentId, listingId, 45), 31L, 3, "v1", NOW);

        assertThat(older.isStillStale()).isTrue();
        assertThat(newer.isApplied()).isTrue();
        assertThat(newer.isStillStale()).isFalse();
        assertThat(newer.getInvalidatedVersion()).isEqualTo(30L);
    }

    @Test
    void firstWriteOlderThanTenantInvalidationIsStoredStale() {
        UUID tenantId = UUID.randomUUID();
        matchScoreRepository.markStaleByTenants(List.of(tenantId), 20L, NOW);
        MatchComputation computation = computation(UUID.randomUUID(), UUID.randomUUID(), 60);
        computation.setTenantId(tenantId);

        ScoreWriteResult write = matchScoreRepository.upsertIfNewer(computation, 19L, 3, "v1", NOW);

        assertThat(write.isStillStale()).isTrue();
    }

    @Test
    void firstWriteNewerThanEveryInvalidationIsFresh() {
        UUID studentId = UUID.randomUUID();
        UUID listingId = UUID.randomUUID();
        matchScoreRepository.markStaleByStudent(studentId, 7L, NOW);
        matchScoreRepository.markStaleByStudent(studentId, 5L, NOW);

        ScoreWriteResult write = matchScoreRepository.upsertIfNewer(computation(studentId, listingId, 80), 8L, 3, "v1", NOW);

        assertThat(write.isStillStale()).isFalse();
        assertThat(write.getInvalidatedVersion()).isEqualTo(7L);
    }

    @Test
    void listingInvalidationTouchesOnlyThatListing() {
        UUID student = UUID.randomUUID();
        UUID changed = UUID.randomUUID();
        UUID untouched = UUID.randomUUID();
        matchScoreRepository.upsertIfNewer(computation(student, changed, 50), 1L, 3, "v1", NOW);
        matchScoreRepository.upsertIfNewer(computation(student, untouched, 50), 1L, 3, "v1", NOW);

        List<UUID> students = matchScoreRepository.markStaleByListing(changed, 2L, NOW);

        assertThat(students).containsExactly(student);
        assertThat(matchScoreRepository.findByStudentIdAndListingId(student, changed)).get()
                .extracting(MatchScoreEntity::isStale).isEqualTo(true);
        assertThat(matchScoreRepository.findByStudentIdAndListingId(student, untouched)).get()
                .extracting(MatchScoreEntity::isStale).isEqualTo(false);
    }

    @Test
    void eventVersionsIncrease() {
        long first = matchScoreRepository.nextEventVersion();
        long second = matchScoreRepository.nextEventVersion();

        assertThat(second).isGreaterThan(first);
    }

    private static MatchComputation computation(UUID studentId, UUID listingId, int score) {
        return MatchComputation.builder()
                .studentId(studentId)
                .listingId(listingId)
                .compositeScore(score)
                .breakdown(ScoreBreakdown.builder().skillMatch(score).categoryAffinity(0).availability(100)
                        .recencyBoost(100).successHistory(0).build())
                .matchedSkills(List.of("java"))
                .missingSkills(List.of())
                .transferredSkills(List.of())
                .build();
    }
}
