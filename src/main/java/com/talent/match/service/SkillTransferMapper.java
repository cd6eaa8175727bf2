package com.talent.match.service;

import com.talent.match.models.MatchEngineConfiguration;
import com.talent.match.service.MarketplaceRecords.SkillTransfer;
import com.talent.match.service.MarketplaceRecords.StudentProfile;

import java.util.List;

public interface SkillTransferMapper {

    /**
     * Professional skills the student's sport experience stands in for. Empty for tenants that are not
     * athletic or that disabled the translation.
     */
    List<SkillTransfer> resolve(StudentProfile student, MatchEngineConfiguration configuration);

    /**
     * Position-specific rows win over the sport-wide row of the same professional skill.
     */
    List<SkillTransfer> lookup(String sport, String position);
}
