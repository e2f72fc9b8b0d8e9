package com.quickbooking.booking.domain.hold;

/**
 * Identifies a customer's conversation with one tenant. At most one hold exists per key.
 */
public record HoldKey(String customerId, String tenantId) {

    public HoldKey {
        if (customerId == null || customerId.isBlank() || tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("customerId and tenantId are required");
        }
    }

    @Override
    public String toString() {
        return customerId + "@" + tenantId;
    }
}
