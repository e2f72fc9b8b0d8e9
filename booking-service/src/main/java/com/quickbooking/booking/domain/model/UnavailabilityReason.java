package com.quickbooking.booking.domain.model;

/**
 * Why a slot cannot be claimed. The error code is what API clients see.
 */
public enum UnavailabilityReason {
    PAST("SLOT_IN_PAST"),
    RESOURCE_UNAVAILABLE("RESOURCE_UNAVAILABLE"),
    OUTSIDE_WORKING_HOURS("OUTSIDE_WORKING_HOURS"),
    CONFLICT("SLOT_CONFLICT");

    private final String errorCode;

    UnavailabilityReason(String errorCode) {
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
