package com.quickbooking.booking.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Held slot awaiting the customer's confirmation.
 */
public record SlotProposal(
        LocalDate date,
        LocalTime time,
        String resourceId,
        String resourceName,
        String serviceId,
        String serviceName,
        int durationMinutes,
        BigDecimal price,
        LocalDateTime expiresAt
) {
}
