package com.talent.match.service;

import com.talent.match.dto.AffinitySignals;
import com.talent.match.dto.MatchComputation;
import com.talent.match.dto.ScoreBreakdown;
import com.talent.match.dto.SkillMatchResult;
import com.talent.match.service.MarketplaceRecords.ListingSnapshot;
import com.talent.match.service.MarketplaceRecords.SkillTransfer;
import com.talent.match.service.MarketplaceRecords.StudentProfile;
import com.talent.match.utils.basic.BasicUtility;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;


/**
 * Five-factor weighted scorer.
 * <p>
 * Factors are computed in [0, 1]; the composite is the weighted sum, rounded once after weighting,
 * and each breakdown value is rounded from its own factor.
 * </p>
 */
@Component
public class WeightedMatchScoreCalculator implements MatchScoreCalculator {

    static final double SKILL_WEIGHT = 0.40;
    static final double AFFINITY_WEIGHT = 0.20;
    static final double AVAILABILITY_WEIGHT = 0.15;
    static final double RECENCY_WEIGHT = 0.10;
    static final double SUCCESS_WEIGHT = 0.15;

    static final double NO_REQUIREMENTS_BASE = 0.3;
    static final double CATEGORY_BASE = 0.3;
    static final double CATEGORY_LEARNED = 0.4;
    static final double CATEGORY_SUCCESS = 0.3;

    static final int DEFAULT_STUDENT_HOURS = 20;
    static final int DEFAULT_LISTING_HOURS = 15;

    private static final double MILLIS_PER_DAY = 86_400_000.0;

    @Override
    public MatchComputation compute(StudentProfile student, ListingSnapshot listing, AffinitySignals signals,
                                    List<SkillTransfer> transfers, OffsetDateTime now) {
        AffinitySignals affinity = signals == null ? AffinitySignals.empty() : signals;
        List<String> required = BasicUtility.normalizeSkills(listing.getRequiredSkills());

        SkillMatchResult skills = computeSkillMatch(student.getSkills(), required, transfers);
        double categoryAffinity = categoryAffinity(student, listing, affinity);
        double availability = availability(student.getHoursPerWeek(), listing.getHoursPerWeek());
        double recency = recency(listing.getPublishedAt(), now);
        double successHistory = successHistory(required, affinity.getSuccessfulSkills());

        double weighted = SKILL_WEIGHT * skills.getFactor()
                + AFFINITY_WEIGHT * categoryAffinity
                + AVAILABILITY_WEIGHT * availability
                + RECENCY_WEIGHT * recency
                + SUCCESS_WEIGHT * successHistory;

        return MatchComputation.builder()
                .studentId(student.getId())
                .listingId(listing.getId())
                .tenantId(student.getTenantId() != null ? student.getTenantId() : listing.getTenantId())
                .compositeScore(toScale(weighted))
                .breakdown(ScoreBreakdown.builder()
                        .skillMatch(toScale(skills.getFactor()))
                        .categoryAffinity(toScale(categoryAffinity))
                        .availability(toScale(availability))
                        .recencyBoost(toScale(recency))
                        .successHistory(toScale(successHistory))
                        .build())
                .matchedSkills(skills.getMatchedSkills())
                .missingSkills(skills.getMissingSkills())
                .transferredSkills(skills.getTransferredSkills())
                .build();
    }

    @Override
    public SkillMatchResult computeSkillMatch(Collection<String> studentSkills, Collection<String> requiredSkills,
                                              List<SkillTransfer> transfers) {
        Set<String> owned = new HashSet<>(BasicUtility.normalizeSkills(studentSkills));
        List<String> required = BasicUtility.normalizeSkills(requiredSkills);
        if (required.isEmpty()) {
            return SkillMatchResult.builder()
                    .factor(owned.isEmpty() ? 0.0 : NO_REQUIREMENTS_BASE)
                    .matchedSkills(List.of())
                    .missingSkills(List.of())
                    .transferredSkills(List.of())
                    .build();
        }

        Map<String, Double> strongest = strongestTransfers(transfers);
        List<String> matched = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        List<String> transferred = new ArrayList<>();
        double credit = 0.0;
        for (String skill : required) {
            if (owned.contains(skill)) {
                matched.add(skill);
                credit += 1.0;
                continue;
            }
            double strength = strongest.getOrDefault(skill, 0.0);
            if (strength > 0.0) {
                transferred.add(skill);
                credit += Math.min(strength, 1.0);
            } else {
                missing.add(skill);
            }
        }
        return SkillMatchResult.builder()
                .factor(clamp(credit / required.size()))
                .matchedSkills(matched)
                .missingSkills(missing)
                .transferredSkills(transferred)
                .build();
    }

    double categoryAffinity(StudentProfile student, ListingSnapshot listing, AffinitySignals affinity) {
        String category = BasicUtility.categoryOrDefault(listing.getCategory()).toLowerCase(Locale.ROOT);
        boolean overlaps = student.getSkillCategories() != null && student.getSkillCategories().stream()
                .anyMatch(owned -> owned != null && owned.trim().toLowerCase(Locale.ROOT).equals(category));

        double base = overlaps ? CATEGORY_BASE : 0.0;
        double learned = CATEGORY_LEARNED * affinity.learnedShare(category);
        double success = affinity.hasSuccessIn(category) ? CATEGORY_SUCCESS : 0.0;
        return clamp(base + learned + success);
    }

    static double availability(Integer studentHours, Integer listingHours) {
        int student = studentHours != null && studentHours > 0 ? studentHours : DEFAULT_STUDENT_HOURS;
        int listing = listingHours != null && listingHours > 0 ? listingHours : DEFAULT_LISTING_HOURS;
        int diff = Math.abs(student - listing);
        if (diff <= 5) {
            return 1.0;
        }
        if (diff <= 10) {
            return 0.7;
        }
        return diff <= 20 ? 0.4 : 0.2;
    }

    static double recency(OffsetDateTime publishedAt, OffsetDateTime now) {
        // unknown publish time counts as published now
        double days = publishedAt == null ? 0.0 : Duration.between(publishedAt, now).toMillis() / MILLIS_PER_DAY;
        if (days <= 7) {
            return 1.0;
        }
        if (days <= 14) {
            return 0.8;
        }
        return days <= 30 ? 0.5 : 0.2;
    }

    static double successHistory(List<String> required, Set<String> successfulSkills) {
        if (required.isEmpty() || successfulSkills == null || successfulSkills.isEmpty()) {
            return 0.0;
        }
        long overlap = required.stream().filter(successfulSkills::contains).count();
        return clamp((double) overlap / required.size());
    }

    private static Map<String, Double> strongestTransfers(List<SkillTransfer> transfers) {
        Map<String, Double> strongest = new HashMap<>();
        if (transfers == null) {
            return strongest;
        }
        for (SkillTransfer transfer : transfers) {
            String skill = BasicUtility.normalizeSkill(transfer.getProfessionalSkill());
            if (!skill.isEmpty()) {
                strongest.merge(skill, transfer.getTransferStrength(), Math::max);
            }
        }
        return strongest;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(value, 1.0));
    }

    private static int toScale(double factor) {
        return (int) Math.round(100 * clamp(factor));
    }
}
