package com.quickbooking.booking.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;

/**
 * Published once a quick booking is committed.
 * Consumed by the chat gateway, which renders the confirmation message.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BookingConfirmedEvent {
    private Long bookingId;
    private String bookingCode;
    private String tenantId;
    private String customerId;
    private String resourceId;
    private String resourceName;
    private String serviceName;
    private LocalDateTime startTs;
    private LocalDateTime endTs;
    private BigDecimal price;
    private String status;
    private Instant timestamp;
}
