package com.talent.match.dto.enums;

public enum ChangeEventType {
    PROFILE_SKILLS_CHANGED,
    PROFILE_AVAILABILITY_CHANGED,
    LISTING_CHANGED,
    APPLICATION_STATUS_CHANGED,
    FEEDBACK_SUBMITTED
}
