package com.talent.match.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Skill-match factor in [0, 1] plus the per-skill outcome that produced it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SkillMatchResult {
    private double factor;
    private List<String> matchedSkills;
    private List<String> missingSkills;
    private List<String> transferredSkills;
}
