package com.talent.match.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Factor scores on the 0-100 scale.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoreBreakdown {
    private int skillMatch;
    private int categoryAffinity;
    private int availability;
    private int recencyBoost;
    private int successHistory;
}
