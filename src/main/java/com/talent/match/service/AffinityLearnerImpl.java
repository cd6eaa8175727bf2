package com.talent.match.service;

import com.talent.match.dto.AffinitySignals;
import com.talent.match.dto.enums.ApplicationStatus;
import com.talent.match.service.MarketplaceRecords.ApplicationOutcome;
import com.talent.match.service.MarketplaceRecords.FeedbackRecord;
import com.talent.match.service.MarketplaceRecords.StudentHistory;
import com.talent.match.utils.basic.BasicUtility;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Aggregates a student's outcomes and ratings into affinity signals. Holds no state: every call
 * starts from the history it is given.
 */
@Component
public class AffinityLearnerImpl implements AffinityLearner {

    static final int POSITIVE_RATING = 4;

    @Override
    public AffinitySignals learn(StudentHistory history) {
        if (history == null) {
            return AffinitySignals.empty();
        }
        List<ApplicationOutcome> applications = history.getApplications() == null ? List.of() : history.getApplications();
        List<FeedbackRecord> feedback = history.getFeedback() == null ? List.of() : history.getFeedback();

        Map<String, Long> applicationsByCategory = new HashMap<>();
        Map<String, Long> acceptancesByCategory = new HashMap<>();
        Set<String> successfulSkills = new HashSet<>();
        Set<UUID> appliedListingIds = new HashSet<>();

        for (ApplicationOutcome application : applications) {
            String category = categoryKey(application.getCategory());
            applicationsByCategory.merge(category, 1L, Long::sum);
            ApplicationStatus status = application.getStatus() == null ? ApplicationStatus.PENDING : application.getStatus();
            if (status.isSuccessful()) {
                acceptancesByCategory.merge(category, 1L, Long::sum);
                successfulSkills.addAll(BasicUtility.normalizeSkills(application.getRequiredSkills()));
            }
            if (status != ApplicationStatus.WITHDRAWN && application.getListingId() != null) {
                appliedListingIds.add(application.getListingId());
            }
        }

        Map<String, Long> positiveByCategory = new HashMap<>();
        for (FeedbackRecord record : feedback) {
            if (record.getRating() >= POSITIVE_RATING) {
                positiveByCategory.merge(categoryKey(record.getCategory()), 1L, Long::sum);
            }
        }

        return AffinitySignals.builder()
                .categoryApplications(applicationsByCategory)
                .categoryAcceptances(acceptancesByCategory)
                .categoryPositiveFeedback(positiveByCategory)
                .totalApplications(applications.size())
                .totalFeedback(feedback.size())
                .successfulSkills(successfulSkills)
                .appliedListingIds(appliedListingIds)
                .build();
    }

    public static String categoryKey(String category) {
        return BasicUtility.categoryOrDefault(category).toLowerCase(Locale.ROOT);
    }
}
