package com.quickbooking.booking.exception;

import com.quickbooking.common.exception.BusinessException;

/**
 * No live hold for the customer: it expired, was already confirmed, or never existed.
 */
public class HoldExpiredException extends BusinessException {

    public static final String ERROR_CODE = "SESSION_EXPIRED";

    public HoldExpiredException(String customerId, String tenantId) {
        super("No pending slot for customer " + customerId + " in tenant " + tenantId
                + ". Please select a slot again.", ERROR_CODE);
    }
}
