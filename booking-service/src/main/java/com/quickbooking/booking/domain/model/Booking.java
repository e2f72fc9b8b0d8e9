package com.quickbooking.booking.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * A confirmed claim on a resource's time interval.
 * Rows are never deleted; cancellation is a status transition.
 */
@Entity
@Table(name = "bookings",
        uniqueConstraints = @UniqueConstraint(name = "uk_bookings_tenant_code", columnNames = {"tenant_id", "booking_code"}),
        indexes = {
                @Index(name = "idx_bookings_resource_start", columnList = "tenant_id,resource_id,start_ts"),
                @Index(name = "idx_bookings_customer", columnList = "customer_id")
        })
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Booking {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "booking_code", nullable = false, length = 16)
    private String bookingCode;

    @Column(name = "tenant_id", nullable = false, length = 64)
    private String tenantId;

    @Column(name = "customer_id", nullable = false, length = 64)
    private String customerId;

    @Column(name = "resource_id", nullable = false, length = 64)
    private String resourceId;

    @Column(name = "service_id", length = 64)
    private String serviceId;

    @Column(name = "service_name")
    private String serviceName;

    @Column(name = "start_ts", nullable = false)
    private LocalDateTime startTs;

    @Column(name = "end_ts", nullable = false)
    private LocalDateTime endTs;

    @Column(name = "price", precision = 10, scale = 2)
    private BigDecimal price;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private BookingStatus status;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
        if (status == null) {
            status = BookingStatus.CONFIRMED;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    /**
     * Releases the slot. Completed bookings cannot be cancelled.
     */
    public void cancel() {
        if (status == BookingStatus.COMPLETED) {
            throw new IllegalStateException("Completed booking " + bookingCode + " cannot be cancelled");
        }
        status = BookingStatus.CANCELLED;
    }

    /**
     * True when this booking still holds the resource and its interval overlaps [start, end).
     */
    public boolean occupies(LocalDateTime start, LocalDateTime end) {
        return status.isActive() && startTs.isBefore(end) && endTs.isAfter(start);
    }

    /** True when this booking is the same claim a customer is replaying. */
    public boolean isSameClaim(String customerId, String resourceId, LocalDateTime start) {
        return this.customerId.equals(customerId)
                && this.resourceId.equals(resourceId)
                && this.startTs.equals(start);
    }
}
