package com.talent.match.repo;

import com.talent.match.dto.MatchComputation;
import com.talent.match.dto.ScoreBreakdown;
import com.talent.match.dto.ScoreWriteResult;
import com.talent.match.utils.basic.BasicUtility;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;


@Slf4j
@Repository
public class MatchScoreRepositoryCustomImpl implements MatchScoreRepositoryCustom {

    private static final String STUDENT = "STUDENT";
    private static final String LISTING = "LISTING";
    private static final String TENANT = "TENANT";

    private static final String NEXT_VERSION_SQL = "SELECT nextval('match_event_version_seq')";

    private static final String ENSURE_MARKS_SQL = """
            INSERT INTO match_invalidation_marks (entity_type, entity_id, version)
            SELECT m.entity_type, m.entity_id, 0
            FROM (VALUES ('STUDENT', CAST(:studentId AS uuid)),
                         ('LISTING', CAST(:listingId AS uuid)),
                         ('TENANT', CAST(:tenantId AS uuid))) AS m (entity_type, entity_id)
            WHERE m.entity_id IS NOT NULL
            ON CONFLICT (entity_type, entity_id) DO NOTHING
            """;

    // FOR SHARE waits on an invalidation that has raised a mark but not yet committed
    private static final String UPSERT_SQL = """
            WITH previous AS (
                SELECT composite_score FROM match_scores WHERE student_id = :studentId AND listing_id = :listingId
            ),
            locked_marks AS (
                SELECT version FROM match_invalidation_marks
                WHERE (entity_type = 'STUDENT' AND entity_id = :studentId)
                   OR (entity_type = 'LISTING' AND entity_id = :listingId)
                   OR (entity_type = 'TENANT' AND entity_id = CAST(:tenantId AS uuid))
                FOR SHARE
            ),
            mark AS (
                SELECT COALESCE(MAX(version), 0) AS version FROM locked_marks
            )
            INSERT INTO match_scores (id, student_id, listing_id, tenant_id, composite_score, skill_match,
                                      category_affinity, availability, recency_boost, success_history,
                                      matched_skills, missing_skills, transferred_skills, is_stale, stale_since,
                                      computed_version, invalidated_version, computation_time_ms, engine_version, computed_at)
            SELECT :id, :studentId, :listingId, CAST(:tenantId AS uuid), :compositeScore, :skillMatch,
                   :categoryAffinity, :availability, :recencyBoost, :successHistory,
                   CAST(:matchedSkills AS jsonb), CAST(:missingSkills AS jsonb), CAST(:transferredSkills AS jsonb),
                   mark.version > :version,
                   CASE WHEN mark.version > :version THEN CAST(:computedAt AS timestamptz) END,
                   :version, mark.version, :computationTimeMs, :engineVersion, CAST(:computedAt AS timestamptz)
            FROM mark
            ON CONFLICT (student_id, listing_id) DO UPDATE SET
                tenant_id = EXCLUDED.tenant_id,
                composite_score = EXCLUDED.composite_score,
                skill_match = EXCLUDED.skill_match,
                category_affinity = EXCLUDED.category_affinity,
                availability = EXCLUDED.availability,
                recency_boost = EXCLUDED.recency_boost,
                success_history = EXCLUDED.success_history,
                matched_skills = EXCLUDED.matched_skills,
                missing_skills = EXCLUDED.missing_skills,
                transferred_skills = EXCLUDED.transferred_skills,
                is_stale = EXCLUDED.computed_version
                           < GREATEST(match_scores.invalidated_version, EXCLUDED.invalidated_version),
                stale_since = CASE WHEN EXCLUDED.computed_version
                                        < GREATEST(match_scores.invalidated_version, EXCLUDED.invalidated_version)
                                   THEN COALESCE(match_scores.stale_since, EXCLUDED.computed_at) ELSE NULL END,
                invalidated_version = GREATEST(match_scores.invalidated_version, EXCLUDED.invalidated_version),
                computed_version = EXCLUDED.computed_version,
                computation_time_ms = EXCLUDED.computation_time_ms,
                engine_version = EXCLUDED.engine_version,
                computed_at = EXCLUDED.computed_at
            WHERE match_scores.computed_version < EXCLUDED.computed_version
            RETURNING (SELECT composite_score FROM previous) AS previous_score, is_stale, invalidated_version
            """;

    private static final String RAISE_MARK_SQL = """
            INSERT INTO match_invalidation_marks (entity_type, entity_id, version, updated_at)
            VALUES (:entityType, :entityId, :version, :now)
            ON CONFLICT (entity_type, entity_id) DO UPDATE SET
                version = GREATEST(match_invalidation_marks.version, EXCLUDED.version),
                updated_at = EXCLUDED.updated_at
            """;

    private static final String MARK_STALE_BY_LISTING_SQL = """
            UPDATE match_scores
            SET is_stale = TRUE,
                invalidated_version = GREATEST(invalidated_version, :version),
                stale_since = COALESCE(stale_since, :now)
            WHERE listing_id = :listingId
            RETURNING student_id
            """;

    private static final String MARK_STALE_BY_STUDENT_SQL = """
            UPDATE match_scores
            SET is_stale = TRUE,
                invalidated_version = GREATEST(invalidated_version, :version),
                stale_since = COALESCE(stale_since, :now)
            WHERE student_id = :studentId
            RETURNING listing_id
            """;

    private static final String MARK_STALE_BY_TENANTS_SQL = """
            UPDATE match_scores
            SET is_stale = TRUE,
                invalidated_version = GREATEST(invalidated_version, :version),
                stale_since = COALESCE(stale_since, :now)
            WHERE tenant_id IN (:tenantIds)
            """;

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final MeterRegistry meterRegistry;

    public MatchScoreRepositoryCustomImpl(NamedParameterJdbcTemplate jdbcTemplate, MeterRegistry meterRegistry) {
        this.jdbcTemplate = jdbcTemplate;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public long nextEventVersion() {
        Long version = jdbcTemplate.getJdbcTemplate().queryForObject(NEXT_VERSION_SQL, Long.class);
        if (version == null) {
            throw new IllegalStateException("match_event_version_seq returned no value");
        }
        return version;
    }

    @Override
    public ScoreWriteResult upsertIfNewer(MatchComputation computation, long version, int computationTimeMs,
                                          String engineVersion, OffsetDateTime computedAt) {
        Timer.Sample sample = Timer.start(meterRegistry);
        ScoreBreakdown breakdown = computation.getBreakdown();
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", UUID.randomUUID())
                .addValue("studentId", computation.getStudentId())
                .addValue("listingId", computation.getListingId())
                .addValue("tenantId", computation.getTenantId() != null ? computation.getTenantId().toString() : null)
                .addValue("compositeScore", computation.getCompositeScore())
                .addValue("skillMatch", breakdown.getSkillMatch())
                .addValue("categoryAffinity", breakdown.getCategoryAffinity())
                .addValue("availability", breakdown.getAvailability())
                .addValue("recencyBoost", breakdown.getRecencyBoost())
                .addValue("successHistory", breakdown.getSuccessHistory())
                .addValue("matchedSkills", BasicUtility.stringifyObject(computation.getMatchedSkills()))
                .addValue("missingSkills", BasicUtility.stringifyObject(computation.getMissingSkills()))
                .addValue("transferredSkills", BasicUtility.stringifyObject(computation.getTransferredSkills()))
                .addValue("version", version)
                .addValue("computationTimeMs", computationTimeMs)
                .addValue("engineVersion", engineVersion)
                .addValue("computedAt", computedAt);
        try {
            jdbcTemplate.update(ENSURE_MARKS_SQL, params);
            List<ScoreWriteResult> rows = jdbcTemplate.query(UPSERT_SQL, params, (rs, rowNum) -> {
                int previous = rs.getInt("previous_score");
                return ScoreWriteResult.builder()
                        .applied(true)
                        .previousScore(rs.wasNull() ? null : previous)
                        .stillStale(rs.getBoolean("is_stale"))
                        .invalidatedVersion(rs.getLong("invalidated_version"))
                        .build();
            });
            if (rows.isEmpty()) {
                log.debug("Rejected out-of-order score write for studentId={}, listingId={}, version={}",
                        computation.getStudentId(), computation.getListingId(), version);
                meterRegistry.counter("match_score_writes_rejected").increment();
                return ScoreWriteResult.rejected();
            }
            return rows.get(0);
        } finally {
            sample.stop(meterRegistry.timer("match_score_upsert_duration"));
        }
    }

    @Override
    public List<UUID> markStaleByListing(UUID listingId, long version, OffsetDateTime now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("listingId", listingId)
                .addValue("version", version)
                .addValue("now", now);
        raiseMarks(LISTING, List.of(listingId), version, now);
        List<UUID> studentIds = jdbcTemplate.queryForList(MARK_STALE_BY_LISTING_SQL, params, UUID.class);
        meterRegistry.counter("match_scores_marked_stale", "scope", "listing").increment(studentIds.size());
        return studentIds;
    }

    @Override
    public List<UUID> markStaleByStudent(UUID studentId, long version, OffsetDateTime now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("studentId", studentId)
                .addValue("version", version)
                .addValue("now", now);
        raiseMarks(STUDENT, List.of(studentId), version, now);
        List<UUID> listingIds = jdbcTemplate.queryForList(MARK_STALE_BY_STUDENT_SQL, params, UUID.class);
        meterRegistry.counter("match_scores_marked_stale", "scope", "student").increment(listingIds.size());
        return listingIds;
    }

    @Override
    public int markStaleByTenants(Collection<UUID> tenantIds, long version, OffsetDateTime now) {
        if (tenantIds == null || tenantIds.isEmpty()) {
            return 0;
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("tenantIds", tenantIds)
                .addValue("version", version)
                .addValue("now", now);
        raiseMarks(TENANT, tenantIds, version, now);
        int updated = jdbcTemplate.update(MARK_STALE_BY_TENANTS_SQL, params);
        meterRegistry.counter("match_scores_marked_stale", "scope", "tenant").increment(updated);
        return updated;
    }

    // raised before the score rows are touched so a first-time write racing this invalidation sees it
    private void raiseMarks(String entityType, Collection<UUID> entityIds, long version, OffsetDateTime now) {
        SqlParameterSource[] batch = entityIds.stream()
                .map(entityId -> new MapSqlParameterSource()
                        .addValue("entityType", entityType)
                        .addValue("entityId", entityId)
                        .addValue("version", version)
                        .addValue("now", now))
                .toArray(SqlParameterSource[]::new);
        jdbcTemplate.batchUpdate(RAISE_MARK_SQL, batch);
    }
}
