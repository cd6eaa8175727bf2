package com.talent.match.service;

import com.talent.match.dto.AffinitySignals;
import com.talent.match.dto.MatchComputation;
import com.talent.match.dto.SkillMatchResult;
import com.talent.match.dto.enums.MarketplaceType;
import com.talent.match.service.MarketplaceRecords.ListingSnapshot;
import com.talent.match.service.MarketplaceRecords.SkillTransfer;
import com.talent.match.service.MarketplaceRecords.StudentProfile;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class WeightedMatchScoreCalculatorTest {

    private static final OffsetDateTime NOW = OffsetDateTime.of(2024, 5, 1, 12, 0, 0, 0, ZoneOffset.UTC);

    private final WeightedMatchScoreCalculator calculator = new WeightedMatchScoreCalculator();

    @Test
    void partialSkillOverlap_scoresTwoThirds() {
        StudentProfile student = student(List.of("python", "sql"), 20);
        ListingSnapshot listing = listing(List.of("python", "sql", "aws"), 15, NOW.minusDays(1));

        MatchComputation result = calculator.compute(student, listing, AffinitySignals.empty(), List.of(), NOW);

        assertThat(result.getBreakdown().getSkillMatch()).isEqualTo(67);
        assertThat(result.getMatchedSkills()).containsExactly("python", "sql");
        assertThat(result.getMissingSkills()).containsExactly("aws");
        // 0.4 * 2/3 + 0.15 * 1.0 + 0.10 * 1.0
        assertThat(result.getCompositeScore()).isEqualTo(52);
    }

    @Test
    void noRequiredSkills_givesBaseScoreWhenStudentHasSkills() {
        SkillMatchResult withSkills = calculator.computeSkillMatch(List.of("java"), List.of(), List.of());
        SkillMatchResult withoutSkills = calculator.computeSkillMatch(List.of(), List.of(), List.of());

        assertThat(withSkills.getFactor()).isEqualTo(0.3);
        assertThat(withoutSkills.getFactor()).isZero();
    }

    @Test
    void recency_stepsDownWithListingAge() {
        assertThat(WeightedMatchScoreCalculator.recency(NOW.minusDays(3), NOW)).isEqualTo(1.0);
        assertThat(WeightedMatchScoreCalculator.recency(NOW.minusDays(10), NOW)).isEqualTo(0.8);
        assertThat(WeightedMatchScoreCalculator.recency(NOW.minusDays(20), NOW)).isEqualTo(0.5);
        assertThat(WeightedMatchScoreCalculator.recency(NOW.minusDays(45), NOW)).isEqualTo(0.2);
        assertThat(WeightedMatchScoreCalculator.recency(null, NOW)).isEqualTo(1.0);
    }

    @Test
    void recency_usesFractionalDays() {
        assertThat(WeightedMatchScoreCalculator.recency(NOW.minusDays(7).minusHours(1), NOW)).isEqualTo(0.8);
    }

    @Test
    void availability_bandsAndDefaults() {
        assertThat(WeightedMatchScoreCalculator.availability(20, 25)).isEqualTo(1.0);
        assertThat(WeightedMatchScoreCalculator.availability(10, 20)).isEqualTo(0.7);
        assertThat(WeightedMatchScoreCalculator.availability(40, 20)).isEqualTo(0.4);
        assertThat(WeightedMatchScoreCalculator.availability(40, 10)).isEqualTo(0.2);
        assertThat(WeightedMatchScoreCalculator.availability(null, null)).isEqualTo(1.0);
        assertThat(WeightedMatchScoreCalculator.availability(0, 40)).isEqualTo(0.4);
    }

    @Test
    void athleticTransfer_contributesStrengthForMissingLiteralSkill() {
        StudentProfile student = student(List.of("teamwork"), 20);
        student.setMarketplaceType(MarketplaceType.ATHLETIC);
        ListingSnapshot listing = listing(List.of("decision-making under pressure"), 15, NOW);
        SkillTransfer transfer = SkillTransfer.builder()
                .professionalSkill("decision-making under pressure")
                .transferStrength(0.8)
                .sport("football")
                .position("quarterback")
                .build();

        MatchComputation result = calculator.compute(student, listing, AffinitySignals.empty(), List.of(transfer), NOW);

        assertThat(result.getBreakdown().getSkillMatch()).isEqualTo(80);
        assertThat(result.getTransferredSkills()).containsExactly("decision-making under pressure");
        assertThat(result.getMissingSkills()).isEmpty();
    }

    @Test
    void literalSkillWinsOverTransfer() {
        SkillTransfer weak = SkillTransfer.builder().professionalSkill("leadership").transferStrength(0.5).build();

        SkillMatchResult result = calculator.computeSkillMatch(List.of("Leadership"), List.of("leadership"), List.of(weak));

        assertThat(result.getFactor()).isEqualTo(1.0);
        assertThat(result.getTransferredSkills()).isEmpty();
    }

    @Test
    void requiredSkillsSubsetOfStudentSkills_scoresFullSkillMatch() {
        StudentProfile student = student(List.of("python", "sql", "docker", "aws"), 20);
        ListingSnapshot listing = listing(List.of(" SQL ", "Python"), 15, NOW);

        MatchComputation result = calculator.compute(student, listing, AffinitySignals.empty(), List.of(), NOW);

        assertThat(result.getBreakdown().getSkillMatch()).isEqualTo(100);
    }

    @Test
    void categoryAffinity_combinesOverlapLearnedShareAndSuccess() {
        StudentProfile student = student(List.of("python"), 20);
        student.setSkillCategories(Set.of("Engineering"));
        ListingSnapshot listing = listing(List.of("python"), 15, NOW);
        listing.setCategory("engineering");
        AffinitySignals signals = AffinitySignals.builder()
                .categoryApplications(Map.of("engineering", 2L))
                .categoryAcceptances(Map.of("engineering", 1L))
                .categoryPositiveFeedback(Map.of())
                .totalApplications(4)
                .successfulSkills(Set.of("python"))
                .appliedListingIds(Set.of())
                .build();

        MatchComputation result = calculator.compute(student, listing, signals, List.of(), NOW);

        // 0.3 overlap + 0.4 * 0.5 learned + 0.3 success
        assertThat(result.getBreakdown().getCategoryAffinity()).isEqualTo(80);
        assertThat(result.getBreakdown().getSuccessHistory()).isEqualTo(100);
    }

    @Test
    void scoresStayWithinBounds() {
        StudentProfile student = student(List.of("a", "b"), 20);
        student.setSkillCategories(Set.of("General"));
        ListingSnapshot listing = listing(List.of("a", "b"), 20, NOW);
        AffinitySignals saturated = AffinitySignals.builder()
                .categoryApplications(Map.of("general", 10L))
                .categoryAcceptances(Map.of("general", 10L))
                .categoryPositiveFeedback(Map.of("general", 10L))
                .totalApplications(10)
                .totalFeedback(10)
                .successfulSkills(Set.of("a", "b"))
                .appliedListingIds(Set.of())
                .build();
        SkillTransfer oversized = SkillTransfer.builder().professionalSkill("a").transferStrength(3.0).build();

        MatchComputation best = calculator.compute(student, listing, saturated, List.of(oversized), NOW);
        MatchComputation worst = calculator.compute(student(List.of(), 80), listing(List.of("x"), 5, NOW.minusYears(1)),
                null, null, NOW);

        assertThat(best.getCompositeScore()).isEqualTo(100);
        assertThat(best.getBreakdown().getCategoryAffinity()).isEqualTo(100);
        assertThat(worst.getCompositeScore()).isBetween(0, 100);
        assertThat(worst.getBreakdown().getSkillMatch()).isZero();
    }

    @Test
    void computeIsDeterministic() {
        StudentProfile student = student(List.of("python", "sql"), 12);
        ListingSnapshot listing = listing(List.of("python", "aws"), 30, NOW.minusDays(9));

        MatchComputation first = calculator.compute(student, listing, AffinitySignals.empty(), List.of(), NOW);
        MatchComputation second = calculator.compute(student, listing, AffinitySignals.empty(), List.of(), NOW);

        assertThat(second).isEqualTo(first);
    }

    private static StudentProfile student(List<String> skills, Integer hours) {
        return StudentProfile.builder()
                .id(UUID.randomUUID())
                .tenantId(UUID.randomUUID())
                .marketplaceType(MarketplaceType.INSTITUTION)
                .skills(skills)
                .skillCategories(Set.of())
                .hoursPerWeek(hours)
                .build();
    }

    private static ListingSnapshot listing(List<String> required, Integer hours, OffsetDateTime publishedAt) {
        return ListingSnapshot.builder()
                .id(UUID.randomUUID())
                .category("General")
                .requiredSkills(required)
                .hoursPerWeek(hours)
                .publishedAt(publishedAt)
                .build();
    }
}
