package com.quickbooking.booking.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Business account owning resources and bookings.
 * The usage counter is only changed while the row is locked by the booking transaction.
 */
@Entity
@Table(name = "tenants")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Tenant {

    @Id
    @Column(name = "id", length = 64)
    private String id;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "usage_current_bookings", nullable = false)
    private int usageCurrentBookings;

    /** Null means unlimited. */
    @Column(name = "usage_limit_bookings")
    private Integer usageLimitBookings;

    public boolean isBookingLimitReached() {
        return usageLimitBookings != null && usageCurrentBookings >= usageLimitBookings;
    }

    public void incrementBookingUsage() {
        usageCurrentBookings++;
    }
}
