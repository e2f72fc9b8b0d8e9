package com.quickbooking.booking.domain.repository;

import com.quickbooking.booking.domain.model.Booking;
import com.quickbooking.booking.domain.model.BookingStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

public interface BookingRepository extends JpaRepository<Booking, Long> {

    /**
     * Bookings of a resource whose interval overlaps [start, end).
     * Half-open: a booking ending exactly at {@code start} does not overlap.
     */
    @Query("SELECT b FROM Booking b WHERE b.tenantId = :tenantId AND b.resourceId = :resourceId " +
            "AND b.startTs < :end AND b.endTs > :start AND b.status IN :statuses ORDER BY b.startTs")
    List<Booking> findOverlapping(
            @Param("tenantId") String tenantId,
            @Param("resourceId") String resourceId,
            @Param("start") LocalDateTime start,
            @Param("end") LocalDateTime end,
            @Param("statuses") Collection<BookingStatus> statuses);

    boolean existsByTenantIdAndBookingCode(String tenantId, String bookingCode);

    List<Booking> findByTenantIdAndCustomerIdOrderByStartTsDesc(String tenantId, String customerId);
}
