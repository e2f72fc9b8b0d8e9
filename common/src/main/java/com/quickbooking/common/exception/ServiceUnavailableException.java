package com.quickbooking.common.exception;

import com.quickbooking.common.util.Constants;

/**
 * A required dependency (database, lock, broker) did not answer in time.
 * The request may succeed if repeated later. Mapped to HTTP 503.
 */
public class ServiceUnavailableException extends RuntimeException {

    public ServiceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public String getErrorCode() {
        return Constants.ERROR_SERVICE_UNAVAILABLE;
    }
}
