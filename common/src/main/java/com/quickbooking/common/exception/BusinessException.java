package com.quickbooking.common.exception;

import lombok.Getter;

/**
 * Business-rule violation. Retrying the same request cannot change the outcome,
 * so callers treat every subclass as terminal.
 */
@Getter
public class BusinessException extends RuntimeException {
    private final String errorCode;

    public BusinessException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public BusinessException(String message, Throwable cause, String errorCode) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
