package com.talent.match.dto.enums;

public enum ScoreChangeReason {
    INITIAL,
    RECOMPUTATION
}
