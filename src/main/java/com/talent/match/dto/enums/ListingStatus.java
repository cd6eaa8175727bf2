package com.talent.match.dto.enums;

import java.util.Locale;

public enum ListingStatus {
    PUBLISHED,
    UNPUBLISHED;

    public static ListingStatus fromValue(String value) {
        return value != null && "published".equals(value.trim().toLowerCase(Locale.ROOT)) ? PUBLISHED : UNPUBLISHED;
    }
}
