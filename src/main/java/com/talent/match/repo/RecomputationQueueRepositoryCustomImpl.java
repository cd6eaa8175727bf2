package com.talent.match.repo;

import com.talent.match.dto.enums.QueueEntryStatus;
import com.talent.match.dto.enums.RecomputeReason;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;


@Slf4j
@Repository
public class RecomputationQueueRepositoryCustomImpl implements RecomputationQueueRepositoryCustom {

    private static final int MAX_ERROR_LENGTH = 2000;
    private static final int MAX_ENQUEUE_ROUNDS = 3;

    private static final String INSERT_SQL = """
            INSERT INTO recomputation_queue (id, student_id, listing_id, reason, priority, status, trigger_version,
                                             attempts, queued_at, stale_since, next_attempt_at)
            VALUES (:id, :studentId, :listingId, :reason, :priority, 'PENDING', :version, 0, :now, :now, :now)
            ON CONFLICT (student_id, listing_id) WHERE status IN ('PENDING', 'CLAIMED') DO NOTHING
            """;

    private static final String RAISE_OPEN_SQL = """
            UPDATE recomputation_queue
            SET trigger_version = GREATEST(trigger_version, :version),
                priority = CASE WHEN status = 'PENDING' THEN GREATEST(priority, :priority) ELSE priority END
            WHERE student_id = :studentId AND listing_id = :listingId AND status IN ('PENDING', 'CLAIMED')
            """;

    private static final String DUE_SQL = """
            SELECT id FROM recomputation_queue
            WHERE status = 'PENDING' AND next_attempt_at <= :now
            ORDER BY priority DESC, stale_since ASC, queued_at ASC
            LIMIT :limit
            """;

    private static final String CLAIM_SQL = """
            UPDATE recomputation_queue
            SET status = 'CLAIMED', claimed_by = :workerId, claimed_at = :now, attempts = attempts + 1
            WHERE id = :id AND status = 'PENDING'
            RETURNING id, student_id, listing_id, trigger_version, attempts
            """;

    private static final String PROCESSED_SQL = """
            UPDATE recomputation_queue
            SET status = 'PROCESSED', processed_at = :now, last_error = NULL
            WHERE id = :id AND status = 'CLAIMED' AND claimed_by = :workerId
            RETURNING trigger_version
            """;

    private static final String FAILURE_SQL = """
            UPDATE recomputation_queue
            SET status = :status, next_attempt_at = :nextAttemptAt, last_error = :error,
                claimed_by = NULL, claimed_at = NULL
            WHERE id = :id AND status = 'CLAIMED' AND claimed_by = :workerId
            """;

    private static final String RELEASE_SQL = """
            UPDATE recomputation_queue
            SET status = CASE WHEN attempts >= :maxAttempts THEN 'DEAD_LETTER' ELSE 'PENDING' END,
                last_error = CASE WHEN attempts >= :maxAttempts THEN 'claim lease expired' ELSE last_error END,
                claimed_by = NULL, claimed_at = NULL
            WHERE status = 'CLAIMED' AND claimed_at < :claimedBefore
            """;

    private static final String PURGE_SQL = """
            DELETE FROM recomputation_queue WHERE status = 'PROCESSED' AND processed_at < :processedBefore
            """;

    private static final String REQUEUE_SQL = """
            UPDATE recomputation_queue
            SET status = 'PENDING', attempts = 0, next_attempt_at = :now, reason = :reason,
                trigger_version = GREATEST(trigger_version, :version), last_error = NULL
            WHERE id IN (
                SELECT DISTINCT ON (d.student_id, d.listing_id) d.id
                FROM recomputation_queue d
                WHERE d.status = 'DEAD_LETTER'
                  AND NOT EXISTS (
                      SELECT 1 FROM recomputation_queue o
                      WHERE o.student_id = d.student_id AND o.listing_id = d.listing_id
                        AND o.status IN ('PENDING', 'CLAIMED'))
                ORDER BY d.student_id, d.listing_id, d.queued_at DESC)
            """;

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final MeterRegistry meterRegistry;

    public RecomputationQueueRepositoryCustomImpl(NamedParameterJdbcTemplate jdbcTemplate, MeterRegistry meterRegistry) {
        this.jdbcTemplate = jdbcTemplate;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public boolean enqueue(UUID studentId, UUID listingId, RecomputeReason reason, long version, OffsetDateTime now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", UUID.randomUUID())
                .addValue("studentId", studentId)
                .addValue("listingId", listingId)
                .addValue("reason", reason.name())
                .addValue("priority", reason.getPriority())
                .addValue("version", version)
                .addValue("now", now);
        // The open entry can be completed between the two statements; in that case insert again.
        for (int attempt = 0; attempt < MAX_ENQUEUE_ROUNDS; attempt++) {
            if (jdbcTemplate.update(INSERT_SQL, params) == 1) {
                meterRegistry.counter("match_queue_enqueued", "reason", reason.name()).increment();
                return true;
            }
            if (jdbcTemplate.update(RAISE_OPEN_SQL, params) > 0) {
                meterRegistry.counter("match_queue_deduplicated", "reason", reason.name()).increment();
                return false;
            }
        }
        log.warn("Could not enqueue studentId={}, listingId={} after {} rounds", studentId, listingId, MAX_ENQUEUE_ROUNDS);
        return false;
    }

    @Override
    public List<UUID> findDueEntryIds(int limit, OffsetDateTime now) {
        return jdbcTemplate.queryForList(DUE_SQL,
                new MapSqlParameterSource().addValue("limit", limit).addValue("now", now), UUID.class);
    }

    @Override
    public Optional<ClaimedEntry> claim(UUID entryId, String workerId, OffsetDateTime now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", entryId)
                .addValue("workerId", workerId)
                .addValue("now", now);
        List<ClaimedEntry> claimed = jdbcTemplate.query(CLAIM_SQL, params, (rs, rowNum) -> new ClaimedEntry(
                rs.getObject("id", UUID.class),
                rs.getObject("student_id", UUID.class),
                rs.getObject("listing_id", UUID.class),
                rs.getLong("trigger_version"),
                rs.getInt("attempts")));
        return claimed.stream().findFirst();
    }

    @Override
    public Optional<Long> markProcessed(UUID entryId, String workerId, OffsetDateTime now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", entryId)
                .addValue("workerId", workerId)
                .addValue("now", now);
        return jdbcTemplate.queryForList(PROCESSED_SQL, params, Long.class).stream().findFirst();
    }

    @Override
    public boolean recordFailure(UUID entryId, String workerId, QueueEntryStatus nextStatus,
                                 OffsetDateTime nextAttemptAt, String error) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", entryId)
                .addValue("workerId", workerId)
                .addValue("status", nextStatus.name())
                .addValue("nextAttemptAt", nextAttemptAt)
                .addValue("error", StringUtils.abbreviate(error, MAX_ERROR_LENGTH));
        return jdbcTemplate.update(FAILURE_SQL, params) == 1;
    }

    @Override
    public int releaseExpiredClaims(OffsetDateTime claimedBefore, int maxAttempts) {
        int released = jdbcTemplate.update(RELEASE_SQL, new MapSqlParameterSource()
                .addValue("claimedBefore", claimedBefore)
                .addValue("maxAttempts", maxAttempts));
        if (released > 0) {
            log.warn("Released {} queue entries whose claim lease expired before {}", released, claimedBefore);
        }
        return released;
    }

    @Override
    public int purgeProcessed(OffsetDateTime processedBefore) {
        return jdbcTemplate.update(PURGE_SQL, new MapSqlParameterSource("processedBefore", processedBefore));
    }

    @Override
    public int requeueDeadLetters(long version, OffsetDateTime now) {
        return jdbcTemplate.update(REQUEUE_SQL, new MapSqlParameterSource()
                .addValue("version", version)
                .addValue("now", now)
                .addValue("reason", RecomputeReason.DEAD_LETTER_REQUEUE.name()));
    }
}
