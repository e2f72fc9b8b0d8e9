package com.quickbooking.common.util;

/**
 * Constants shared between modules.
 */
public final class Constants {
    private Constants() {
        // Utility class
    }

    public static final String API_V1 = "/api/v1";

    public static final String ERROR_VALIDATION = "VALIDATION_ERROR";
    public static final String ERROR_INTERNAL = "INTERNAL_ERROR";
    public static final String ERROR_SERVICE_UNAVAILABLE = "SERVICE_UNAVAILABLE";
    public static final String ERROR_NOT_FOUND = "RESOURCE_NOT_FOUND";
}
