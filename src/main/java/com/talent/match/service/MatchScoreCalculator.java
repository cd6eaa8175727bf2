package com.talent.match.service;

import com.talent.match.dto.AffinitySignals;
import com.talent.match.dto.MatchComputation;
import com.talent.match.dto.SkillMatchResult;
import com.talent.match.service.MarketplaceRecords.ListingSnapshot;
import com.talent.match.service.MarketplaceRecords.SkillTransfer;
import com.talent.match.service.MarketplaceRecords.StudentProfile;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;

/**
 * Pure scoring function. Implementations must not read the clock or any shared state: the same
 * arguments always give the same result.
 */
public interface MatchScoreCalculator {

    MatchComputation compute(StudentProfile student, ListingSnapshot listing, AffinitySignals signals,
                             List<SkillTransfer> transfers, OffsetDateTime now);

    SkillMatchResult computeSkillMatch(Collection<String> studentSkills, Collection<String> requiredSkills,
                                       List<SkillTransfer> transfers);
}
