package com.quickbooking.booking.domain.model;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * A bookable slot offered to the customer, rendered by the chat layer.
 */
public record SlotOption(
        LocalDate date,
        LocalTime time,
        String resourceId,
        String resourceName,
        boolean preferred
) {
}
