package com.quickbooking.booking.exception;

import com.quickbooking.booking.domain.model.SlotAvailability;
import com.quickbooking.booking.domain.model.SlotOption;
import com.quickbooking.booking.domain.model.UnavailabilityReason;
import com.quickbooking.common.exception.BusinessException;
import lombok.Getter;

import java.util.List;

/**
 * The slot cannot be claimed: already booked, in the past, or the resource is unusable.
 * Raised by the locked re-check inside the booking transaction; never retried.
 */
@Getter
public class SlotUnavailableException extends BusinessException {

    private final UnavailabilityReason reason;
    private final String conflictingBookingCode;
    private final List<SlotOption> alternatives;

    public SlotUnavailableException(UnavailabilityReason reason, String message) {
        this(reason, message, null, List.of(), null);
    }

    private SlotUnavailableException(UnavailabilityReason reason, String message, String conflictingBookingCode,
                                     List<SlotOption> alternatives, Throwable cause) {
        super(message, cause, reason.getErrorCode());
        this.reason = reason;
        this.conflictingBookingCode = conflictingBookingCode;
        this.alternatives = List.copyOf(alternatives);
    }

    public static SlotUnavailableException from(SlotAvailability availability) {
        String code = availability.conflictingBooking() != null
                ? availability.conflictingBooking().getBookingCode()
                : null;
        return new SlotUnavailableException(availability.reason(), availability.message(), code, List.of(), null);
    }

    /**
     * Same failure, with alternatives the customer can pick instead.
     */
    public SlotUnavailableException withAlternatives(List<SlotOption> alternatives) {
        return new SlotUnavailableException(reason, getMessage(), conflictingBookingCode, alternatives, this);
    }
}
