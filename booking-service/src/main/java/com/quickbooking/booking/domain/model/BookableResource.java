package com.quickbooking.booking.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalTime;

/**
 * Bookable entity whose time is reserved (typically a staff member).
 * Its row is locked with SELECT FOR UPDATE to serialize confirmations.
 */
@Entity
@Table(name = "resources", indexes = {
        @Index(name = "idx_resources_tenant", columnList = "tenant_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BookableResource {

    @Id
    @Column(name = "id", length = 64)
    private String id;

    @Column(name = "tenant_id", nullable = false, length = 64)
    private String tenantId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "active", nullable = false)
    private boolean active;

    /** Null means no working-hours restriction. */
    @Column(name = "working_hours_start")
    private LocalTime workingHoursStart;

    @Column(name = "working_hours_end")
    private LocalTime workingHoursEnd;

    public boolean belongsTo(String tenantId) {
        return this.tenantId.equals(tenantId);
    }

    public boolean hasWorkingHours() {
        return workingHoursStart != null && workingHoursEnd != null;
    }

    /**
     * Whether [start, start + durationMinutes) fits in the working day.
     * Slots crossing midnight never fit.
     */
    public boolean fitsWorkingHours(LocalTime start, int durationMinutes) {
        if (!hasWorkingHours()) {
            return true;
        }
        LocalTime end = start.plusMinutes(durationMinutes);
        boolean wrapsMidnight = end.isBefore(start);
        return !start.isBefore(workingHoursStart) && !wrapsMidnight && !end.isAfter(workingHoursEnd);
    }
}
