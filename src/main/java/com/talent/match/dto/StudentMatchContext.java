package com.talent.match.dto;

import com.talent.match.models.MatchEngineConfiguration;
import com.talent.match.service.MarketplaceRecords.SkillTransfer;
import com.talent.match.service.MarketplaceRecords.StudentHistory;
import com.talent.match.service.MarketplaceRecords.StudentProfile;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Everything about one student that scoring against many listings shares.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StudentMatchContext {
    private StudentProfile student;
    private StudentHistory history;
    private AffinitySignals signals;
    private List<SkillTransfer> transfers;
    private MatchEngineConfiguration configuration;

    /**
     * Listings the student must not be recommended: applied to (unless withdrawn) or with a closed invite.
     */
    public Set<UUID> excludedListingIds() {
        Set<UUID> excluded = new HashSet<>();
        if (signals != null && signals.getAppliedListingIds() != null) {
            excluded.addAll(signals.getAppliedListingIds());
        }
        if (history != null && history.getClosedInviteListingIds() != null) {
            excluded.addAll(history.getClosedInviteListingIds());
        }
        return excluded;
    }
}
