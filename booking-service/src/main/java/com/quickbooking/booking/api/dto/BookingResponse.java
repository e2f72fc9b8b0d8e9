package com.quickbooking.booking.api.dto;

import com.quickbooking.booking.domain.model.Booking;
import com.quickbooking.booking.domain.model.BookingStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record BookingResponse(
        Long id,
        String bookingCode,
        String tenantId,
        String customerId,
        String resourceId,
        String serviceName,
        LocalDateTime startTs,
        LocalDateTime endTs,
        BigDecimal price,
        BookingStatus status,
        LocalDateTime createdAt
) {
    public static BookingResponse from(Booking booking) {
        return new BookingResponse(
                booking.getId(),
                booking.getBookingCode(),
                booking.getTenantId(),
                booking.getCustomerId(),
                booking.getResourceId(),
                booking.getServiceName(),
                booking.getStartTs(),
                booking.getEndTs(),
                booking.getPrice(),
                booking.getStatus(),
                booking.getCreatedAt()
        );
    }
}
