package com.talent.match.dto.enums;

import java.util.Locale;

public enum ApplicationStatus {
    PENDING,
    ACCEPTED,
    REJECTED,
    COMPLETED,
    WITHDRAWN;

    public boolean isSuccessful() {
        return this == ACCEPTED || this == COMPLETED;
    }

    public static ApplicationStatus fromValue(String value) {
        if (value == null) {
            return PENDING;
        }
        try {
            return ApplicationStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return PENDING;
        }
    }
}
