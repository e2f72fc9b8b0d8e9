package com.quickbooking.booking.domain.hold;

import com.quickbooking.booking.domain.model.SlotCandidate;
import com.quickbooking.booking.domain.model.SlotProposal;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;

/**
 * Provisional claim on a slot, kept until confirmation or expiry.
 * {@code createdAt}/{@code expiresAt} are stamped by the {@link HoldStore}.
 */
public record SlotHold(
        LocalDate date,
        LocalTime time,
        String resourceId,
        String resourceName,
        String serviceId,
        String serviceName,
        int durationMinutes,
        BigDecimal price,
        Instant createdAt,
        Instant expiresAt
) {
    public SlotHold withTimestamps(Instant createdAt, Instant expiresAt) {
        return new SlotHold(date, time, resourceId, resourceName, serviceId, serviceName,
                durationMinutes, price, createdAt, expiresAt);
    }

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    public SlotCandidate toCandidate(String tenantId) {
        return new SlotCandidate(date, time, resourceId, tenantId);
    }

    public LocalDateTime startsAt() {
        return LocalDateTime.of(date, time);
    }

    public LocalDateTime endsAt() {
        return startsAt().plusMinutes(durationMinutes);
    }

    public SlotProposal toProposal(ZoneId zone) {
        LocalDateTime expiry = expiresAt == null ? null : LocalDateTime.ofInstant(expiresAt, zone);
        return new SlotProposal(date, time, resourceId, resourceName, serviceId, serviceName,
                durationMinutes, price, expiry);
    }
}
