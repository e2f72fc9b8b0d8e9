package com.quickbooking.booking.domain.model;

/**
 * Result of the booking transaction. {@code replayed} is true when the customer's
 * booking for the same slot already existed and nothing new was written.
 */
public record BookingConfirmation(Booking booking, boolean replayed) {

    public static BookingConfirmation created(Booking booking) {
        return new BookingConfirmation(booking, false);
    }

    public static BookingConfirmation replayed(Booking booking) {
        return new BookingConfirmation(booking, true);
    }
}
