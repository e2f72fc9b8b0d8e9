package com.quickbooking.booking.exception;

import com.quickbooking.common.exception.BusinessException;

/**
 * Tenant reached the booking quota of its plan.
 */
public class UsageLimitExceededException extends BusinessException {

    public static final String ERROR_CODE = "USAGE_LIMIT_EXCEEDED";

    public UsageLimitExceededException(String tenantId, int limit) {
        super("Tenant " + tenantId + " reached its booking limit of " + limit, ERROR_CODE);
    }
}
