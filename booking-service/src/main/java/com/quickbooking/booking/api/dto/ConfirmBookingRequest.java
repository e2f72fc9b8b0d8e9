package com.quickbooking.booking.api.dto;

import jakarta.validation.constraints.NotBlank;

public record ConfirmBookingRequest(
        @NotBlank(message = "Customer ID is required")
        String customerId,

        @NotBlank(message = "Tenant ID is required")
        String tenantId
) {
}
