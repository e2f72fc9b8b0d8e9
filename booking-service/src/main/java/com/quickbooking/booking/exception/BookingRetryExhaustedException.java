package com.quickbooking.booking.exception;

import com.quickbooking.common.exception.ServiceUnavailableException;
import lombok.Getter;

/**
 * Every booking attempt failed with a transient error. The cause is the last one seen.
 * The customer's hold survives so the confirmation can be repeated.
 */
@Getter
public class BookingRetryExhaustedException extends ServiceUnavailableException {

    public static final String ERROR_CODE = "BOOKING_RETRY_EXHAUSTED";

    private final int attempts;

    public BookingRetryExhaustedException(int attempts, Throwable lastError) {
        super("Booking failed after " + attempts + " attempts: " + lastError.getMessage(), lastError);
        this.attempts = attempts;
    }

    @Override
    public String getErrorCode() {
        return ERROR_CODE;
    }
}
