package com.quickbooking.common.exception;

import com.quickbooking.common.util.Constants;

/**
 * Thrown when an entity referenced by id does not exist for the tenant.
 */
public class ResourceNotFoundException extends BusinessException {

    public ResourceNotFoundException(String entityType, Object identifier) {
        super(String.format("%s with identifier %s not found", entityType, identifier), Constants.ERROR_NOT_FOUND);
    }
}
