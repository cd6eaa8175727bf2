package com.talent.match.dto;

import com.talent.match.dto.enums.ChangeEventType;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Upstream mutation that invalidates cached scores. Profile events carry {@code studentId}, listing events
 * {@code listingId}; application and feedback events carry both.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChangeEvent {
    @NotNull
    private ChangeEventType type;
    private UUID studentId;
    private UUID listingId;
    private OffsetDateTime occurredAt;
}
