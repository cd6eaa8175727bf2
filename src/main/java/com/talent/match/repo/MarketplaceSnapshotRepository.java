package com.talent.match.repo;

import com.talent.match.service.MarketplaceRecords.ListingSnapshot;
import com.talent.match.service.MarketplaceRecords.StudentHistory;
import com.talent.match.service.MarketplaceRecords.StudentProfile;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Read-only access to marketplace tables owned by other services. Nothing here writes.
 */
public interface MarketplaceSnapshotRepository {

    Optional<StudentProfile> findStudent(UUID studentId);

    Optional<ListingSnapshot> findListing(UUID listingId);

    /**
     * Published listings visible to a tenant, newest first.
     */
    List<ListingSnapshot> findPublishedListings(UUID tenantId, int limit);

    StudentHistory findHistory(UUID studentId);

    /**
     * Students who have not applied to the listing, ordered by id.
     */
    List<StudentProfile> findStudentsWithoutApplication(UUID listingId, int limit);

    Set<UUID> findApplicantIds(UUID listingId);

    FeedbackStats findFeedbackStats();

    /**
     * Tenants running an athletic marketplace, whose scores depend on skill mappings.
     */
    List<UUID> findAthleticTenantIds();

    record FeedbackStats(long totalFeedback, double averageRating) {
        public static FeedbackStats none() {
            return new FeedbackStats(0, 0.0);
        }
    }
}
