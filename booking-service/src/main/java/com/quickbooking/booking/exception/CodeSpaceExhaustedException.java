package com.quickbooking.booking.exception;

import com.quickbooking.common.exception.BusinessException;

public class CodeSpaceExhaustedException extends BusinessException {

    public static final String ERROR_CODE = "CODE_SPACE_EXHAUSTED";

    public CodeSpaceExhaustedException(String tenantId, int attempts) {
        super("Could not generate a unique booking code for tenant " + tenantId
                + " after " + attempts + " attempts", ERROR_CODE);
    }
}
