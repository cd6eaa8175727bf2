package com.talent.match.dto;

import com.talent.match.dto.enums.ChangeEventType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InvalidationResult {
    private ChangeEventType type;
    private long eventVersion;
    private int scoresMarkedStale;
    private int pairsEnqueued;
    private int pairsDeduplicated;
}
