package com.quickbooking.booking.domain.model;

/**
 * Outcome of a slot check. {@code conflictingBooking} is set only for {@link UnavailabilityReason#CONFLICT}.
 */
public record SlotAvailability(
        boolean available,
        UnavailabilityReason reason,
        String message,
        Booking conflictingBooking
) {
    public static SlotAvailability free() {
        return new SlotAvailability(true, null, null, null);
    }

    public static SlotAvailability rejected(UnavailabilityReason reason, String message) {
        return new SlotAvailability(false, reason, message, null);
    }

    public static SlotAvailability conflict(Booking existing) {
        return new SlotAvailability(false, UnavailabilityReason.CONFLICT,
                "Slot already booked (" + existing.getBookingCode() + ")", existing);
    }
}
