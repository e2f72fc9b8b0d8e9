package com.quickbooking.booking.api.dto;

import com.quickbooking.booking.domain.model.SlotCandidate;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;
import java.time.LocalTime;

public record SelectSlotRequest(
        @NotNull(message = "Date is required")
        LocalDate date,

        @NotNull(message = "Time is required")
        LocalTime time,

        @NotBlank(message = "Resource ID is required")
        String resourceId,

        @NotBlank(message = "Tenant ID is required")
        String tenantId,

        @NotBlank(message = "Customer ID is required")
        String customerId,

        String serviceId
) {
    public SlotCandidate toCandidate() {
        return new SlotCandidate(date, time, resourceId, tenantId);
    }
}
