package com.talent.match.utils.basic;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.util.UUID;

public final class DefaultValuesPopulator {

    private DefaultValuesPopulator() {
        throw new UnsupportedOperationException("Operation not supported");
    }

    public static LocalDateTime getCurrentTimestamp() {
        return LocalDateTime.now();
    }

    public static OffsetDateTime now(Clock clock) {
        return OffsetDateTime.now(clock);
    }

    public static String getUid() {
        return UUID.randomUUID().toString();
    }

    public static UUID newId() {
        return UUID.randomUUID();
    }
}
