package com.quickbooking.booking.domain.model;

import java.util.EnumSet;
import java.util.Set;

public enum BookingStatus {
    CONFIRMED,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED;

    /** Statuses that occupy the resource's time. */
    public static final Set<BookingStatus> ACTIVE = EnumSet.of(CONFIRMED, IN_PROGRESS);

    public boolean isActive() {
        return ACTIVE.contains(this);
    }
}
