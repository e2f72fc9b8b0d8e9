package com.quickbooking.booking.domain.model;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * A (date, time, resource) tuple a customer wants to claim. Never persisted.
 */
public record SlotCandidate(
        LocalDate date,
        LocalTime time,
        String resourceId,
        String tenantId
) {
    public LocalDateTime startsAt() {
        return LocalDateTime.of(date, time);
    }

    public LocalDateTime endsAt(int durationMinutes) {
        return startsAt().plusMinutes(durationMinutes);
    }

    public boolean isComplete() {
        return date != null && time != null
                && resourceId != null && !resourceId.isBlank()
                && tenantId != null && !tenantId.isBlank();
    }
}
