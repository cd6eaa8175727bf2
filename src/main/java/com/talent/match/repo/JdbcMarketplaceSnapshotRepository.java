package com.talent.match.repo;

import com.talent.match.dto.enums.ApplicationStatus;
import com.talent.match.dto.enums.ListingStatus;
import com.talent.match.dto.enums.MarketplaceType;
import com.talent.match.service.MarketplaceRecords.ApplicationOutcome;
import com.talent.match.service.MarketplaceRecords.FeedbackRecord;
import com.talent.match.service.MarketplaceRecords.ListingSnapshot;
import com.talent.match.service.MarketplaceRecords.StudentHistory;
import com.talent.match.service.MarketplaceRecords.StudentProfile;
import com.talent.match.utils.basic.BasicUtility;
import com.talent.match.utils.basic.Constant;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;


/**
 * JDBC reader over the marketplace schema. Rows are converted to typed snapshots here, so the rest of
 * the engine never touches untyped columns.
 */
@Slf4j
@Repository
public class JdbcMarketplaceSnapshotRepository implements MarketplaceSnapshotRepository {

    private static final String STUDENT_COLUMNS = """
            u.id, u.tenant_id, u.first_name, u.last_name, u.university,
            u.public_data ->> 'hoursPerWeek' AS hours_per_week,
            u.public_data ->> 'position' AS position,
            t.marketplace_type,
            COALESCE((SELECT ss.sport_name
                      FROM student_schedules sch
                      JOIN sport_seasons ss ON ss.id = sch.sport_season_id
                      WHERE sch.user_id = u.id AND sch.is_active = TRUE
                      ORDER BY sch.updated_at DESC
                      LIMIT 1), t.sport) AS sport,
            (SELECT sch.available_hours_per_week
             FROM student_schedules sch
             WHERE sch.user_id = u.id AND sch.is_active = TRUE AND sch.available_hours_per_week IS NOT NULL
             ORDER BY sch.updated_at DESC
             LIMIT 1) AS schedule_hours
            """;

    private static final String STUDENT_SQL = "SELECT " + STUDENT_COLUMNS + """
            FROM users u
            LEFT JOIN tenants t ON t.id = u.tenant_id
            WHERE u.id = :studentId AND u.role = 'student'
            """;

    private static final String STUDENT_SKILLS_SQL = """
            SELECT s.name, s.category
            FROM user_skills us
            JOIN skills s ON s.id = us.skill_id
            WHERE us.user_id = :studentId
            """;

    private static final String CANDIDATE_STUDENTS_SQL = "SELECT " + STUDENT_COLUMNS + """
            , ARRAY_AGG(s.name) FILTER (WHERE s.name IS NOT NULL) AS skill_names
            , ARRAY_AGG(DISTINCT s.category) FILTER (WHERE s.category IS NOT NULL) AS skill_categories
            FROM users u
            LEFT JOIN tenants t ON t.id = u.tenant_id
            LEFT JOIN user_skills us ON us.user_id = u.id
            LEFT JOIN skills s ON s.id = us.skill_id
            WHERE u.role = 'student'
              AND NOT EXISTS (SELECT 1 FROM project_applications pa
                              WHERE pa.listing_id = :listingId AND pa.student_id = u.id)
            GROUP BY u.id, t.marketplace_type, t.sport
            ORDER BY u.id
            LIMIT :limit
            """;

    private static final String LISTING_COLUMNS = """
            l.id, l.tenant_id, l.title, l.category, l.skills_required, l.hours_per_week,
            l.published_at, l.status, COALESCE(u.company_name, u.display_name) AS company_name
            """;

    private static final String LISTING_SQL = "SELECT " + LISTING_COLUMNS + """
            FROM listings l
            LEFT JOIN users u ON u.id = l.author_id
            WHERE l.id = :listingId
            """;

    private static final String PUBLISHED_LISTINGS_SQL = "SELECT " + LISTING_COLUMNS + """
            FROM listings l
            LEFT JOIN users u ON u.id = l.author_id
            WHERE l.status = 'published'
              AND (CAST(:tenantId AS uuid) IS NULL OR l.tenant_id IS NULL OR l.tenant_id = CAST(:tenantId AS uuid))
            ORDER BY l.published_at DESC NULLS LAST, l.id
            LIMIT :limit
            """;

    private static final String APPLICATIONS_SQL = """
            SELECT pa.listing_id, pa.status, l.category, l.skills_required
            FROM project_applications pa
            JOIN listings l ON l.id = pa.listing_id
            WHERE pa.student_id = :studentId
            """;

    private static final String FEEDBACK_SQL = """
            SELECT mf.listing_id, mf.rating, mf.created_at, l.category
            FROM match_feedback mf
            JOIN listings l ON l.id = mf.listing_id
            WHERE mf.student_id = :studentId
            """;

    private static final String CLOSED_INVITES_SQL = """
            SELECT listing_id
            FROM corporate_invites
            WHERE student_id = :studentId AND status IN ('declined', 'accepted') AND listing_id IS NOT NULL
            """;

    private static final String APPLICANTS_SQL = """
            SELECT DISTINCT student_id FROM project_applications WHERE listing_id = :listingId
            """;

    private static final String FEEDBACK_STATS_SQL = """
            SELECT COUNT(*) AS total, COALESCE(AVG(rating), 0) AS average FROM match_feedback
            """;

    private static final String ATHLETIC_TENANTS_SQL = """
            SELECT id FROM tenants WHERE lower(marketplace_type) = 'athletic'
            """;

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final MeterRegistry meterRegistry;

    public JdbcMarketplaceSnapshotRepository(NamedParameterJdbcTemplate jdbcTemplate, MeterRegistry meterRegistry) {
        this.jdbcTemplate = jdbcTemplate;
        this.meterRegistry = meterRegistry;
    }

    @Override
    @Retry(name = Constant.SNAPSHOT_RESILIENCE)
    @CircuitBreaker(name = Constant.SNAPSHOT_RESILIENCE)
    public Optional<StudentProfile> findStudent(UUID studentId) {
        MapSqlParameterSource params = new MapSqlParameterSource("studentId", studentId);
        List<StudentProfile> rows = jdbcTemplate.query(STUDENT_SQL, params, this::mapStudent);
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        StudentProfile profile = rows.get(0);
        List<String> skills = new ArrayList<>();
        Set<String> categories = new LinkedHashSet<>();
        jdbcTemplate.query(STUDENT_SKILLS_SQL, params, rs -> {
            skills.add(rs.getString("name"));
            String category = rs.getString("category");
            if (StringUtils.isNotBlank(category)) {
                categories.add(category.trim());
            }
        });
        profile.setSkills(BasicUtility.normalizeSkills(skills));
        profile.setSkillCategories(categories);
        return Optional.of(profile);
    }

    @Override
    @Retry(name = Constant.SNAPSHOT_RESILIENCE)
    @CircuitBreaker(name = Constant.SNAPSHOT_RESILIENCE)
    public Optional<ListingSnapshot> findListing(UUID listingId) {
        List<ListingSnapshot> rows = jdbcTemplate.query(LISTING_SQL,
                new MapSqlParameterSource("listingId", listingId), LISTING_MAPPER);
        return rows.stream().findFirst();
    }

    @Override
    @Retry(name = Constant.SNAPSHOT_RESILIENCE)
    @CircuitBreaker(name = Constant.SNAPSHOT_RESILIENCE)
    public List<ListingSnapshot> findPublishedListings(UUID tenantId, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("tenantId", tenantId != null ? tenantId.toString() : null)
                .addValue("limit", limit);
        return jdbcTemplate.query(PUBLISHED_LISTINGS_SQL, params, LISTING_MAPPER);
    }

    @Override
    @Retry(name = Constant.SNAPSHOT_RESILIENCE)
    @CircuitBreaker(name = Constant.SNAPSHOT_RESILIENCE)
    public StudentHistory findHistory(UUID studentId) {
        MapSqlParameterSource params = new MapSqlParameterSource("studentId", studentId);
        List<ApplicationOutcome> applications = jdbcTemplate.query(APPLICATIONS_SQL, params, (rs, rowNum) ->
                ApplicationOutcome.builder()
                        .studentId(studentId)
                        .listingId(rs.getObject("listing_id", UUID.class))
                        .status(ApplicationStatus.fromValue(rs.getString("status")))
                        .category(BasicUtility.categoryOrDefault(rs.getString("category")))
                        .requiredSkills(BasicUtility.normalizeSkills(readTextArray(rs, "skills_required")))
                        .build());
        List<FeedbackRecord> feedback = jdbcTemplate.query(FEEDBACK_SQL, params, (rs, rowNum) ->
                FeedbackRecord.builder()
                        .studentId(studentId)
                        .listingId(rs.getObject("listing_id", UUID.class))
                        .category(BasicUtility.categoryOrDefault(rs.getString("category")))
                        .rating(rs.getInt("rating"))
                        .createdAt(rs.getObject("created_at", OffsetDateTime.class))
                        .build());
        Set<UUID> closedInvites = new HashSet<>(jdbcTemplate.queryForList(CLOSED_INVITES_SQL, params, UUID.class));
        return StudentHistory.builder()
                .applications(applications)
                .feedback(feedback)
                .closedInviteListingIds(closedInvites)
                .build();
    }

    @Override
    @Retry(name = Constant.SNAPSHOT_RESILIENCE)
    @CircuitBreaker(name = Constant.SNAPSHOT_RESILIENCE)
    public List<StudentProfile> findStudentsWithoutApplication(UUID listingId, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("listingId", listingId)
                .addValue("limit", limit);
        return jdbcTemplate.query(CANDIDATE_STUDENTS_SQL, params, (rs, rowNum) -> {
            StudentProfile profile = mapStudent(rs, rowNum);
            profile.setSkills(BasicUtility.normalizeSkills(readTextArray(rs, "skill_names")));
            profile.setSkillCategories(readTextArray(rs, "skill_categories").stream()
                    .filter(StringUtils::isNotBlank)
                    .map(String::trim)
                    .collect(Collectors.toCollection(LinkedHashSet::new)));
            return profile;
        });
    }

    @Override
    @Retry(name = Constant.SNAPSHOT_RESILIENCE)
    @CircuitBreaker(name = Constant.SNAPSHOT_RESILIENCE)
    public Set<UUID> findApplicantIds(UUID listingId) {
        return new HashSet<>(jdbcTemplate.queryForList(APPLICANTS_SQL,
                new MapSqlParameterSource("listingId", listingId), UUID.class));
    }

    @Override
    @CircuitBreaker(name = Constant.SNAPSHOT_RESILIENCE, fallbackMethod = "feedbackStatsFallback")
    public FeedbackStats findFeedbackStats() {
        List<FeedbackStats> rows = jdbcTemplate.query(FEEDBACK_STATS_SQL, Map.of(), (rs, rowNum) ->
                new FeedbackStats(rs.getLong("total"), rs.getDouble("average")));
        return rows.isEmpty() ? FeedbackStats.none() : rows.get(0);
    }

    @Override
    @Retry(name = Constant.SNAPSHOT_RESILIENCE)
    @CircuitBreaker(name = Constant.SNAPSHOT_RESILIENCE)
    public List<UUID> findAthleticTenantIds() {
        return jdbcTemplate.queryForList(ATHLETIC_TENANTS_SQL, Map.of(), UUID.class);
    }

    public FeedbackStats feedbackStatsFallback(Throwable t) {
        log.warn("Feedback statistics unavailable: {}", t.getMessage());
        meterRegistry.counter("marketplace_snapshot_fallbacks", "query", "feedback_stats").increment();
        return FeedbackStats.none();
    }

    private StudentProfile mapStudent(ResultSet rs, int rowNum) throws SQLException {
        String displayName = StringUtils.normalizeSpace(
                StringUtils.defaultString(rs.getString("first_name")) + " "
                        + StringUtils.defaultString(rs.getString("last_name")));
        return StudentProfile.builder()
                .id(rs.getObject("id", UUID.class))
                .tenantId(rs.getObject("tenant_id", UUID.class))
                .marketplaceType(MarketplaceType.fromValue(rs.getString("marketplace_type")))
                .displayName(displayName)
                .university(rs.getString("university"))
                .hoursPerWeek(firstHours(rs.getString("hours_per_week"), rs.getString("schedule_hours")))
                .sport(StringUtils.trimToNull(rs.getString("sport")))
                .position(StringUtils.trimToNull(rs.getString("position")))
                .skills(List.of())
                .skillCategories(Set.of())
                .build();
    }

    private static final RowMapper<ListingSnapshot> LISTING_MAPPER = (rs, rowNum) -> ListingSnapshot.builder()
            .id(rs.getObject("id", UUID.class))
            .tenantId(rs.getObject("tenant_id", UUID.class))
            .title(rs.getString("title"))
            .companyName(rs.getString("company_name"))
            .category(BasicUtility.categoryOrDefault(rs.getString("category")))
            .requiredSkills(BasicUtility.normalizeSkills(readTextArray(rs, "skills_required")))
            .hoursPerWeek(positiveOrNull(rs.getString("hours_per_week")))
            .publishedAt(rs.getObject("published_at", OffsetDateTime.class))
            .status(ListingStatus.fromValue(rs.getString("status")))
            .build();

    private static Integer firstHours(String... candidates) {
        return Arrays.stream(candidates)
                .map(JdbcMarketplaceSnapshotRepository::positiveOrNull)
                .filter(Objects::nonNull)
                .findFirst()
                .orElse(null);
    }

    private static Integer positiveOrNull(String raw) {
        if (!NumberUtils.isCreatable(StringUtils.trimToEmpty(raw))) {
            return null;
        }
        int hours = (int) Math.round(NumberUtils.toDouble(raw.trim()));
        return hours > 0 ? hours : null;
    }

    private static List<String> readTextArray(ResultSet rs, String column) throws SQLException {
        Array array = rs.getArray(column);
        if (array == null) {
            return List.of();
        }
        Object[] values = (Object[]) array.getArray();
        List<String> result = new ArrayList<>(values.length);
        for (Object value : values) {
            if (value != null) {
                result.add(value.toString());
            }
        }
        return result;
    }
}
