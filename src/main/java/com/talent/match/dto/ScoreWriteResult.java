package com.talent.match.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of a versioned score write. {@code applied == false} means a newer computation already won.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoreWriteResult {
    private boolean applied;
    private Integer previousScore;
    private boolean stillStale;
    private long invalidatedVersion;

    public static ScoreWriteResult rejected() {
        return ScoreWriteResult.builder().applied(false).build();
    }
}
