package com.quickbooking.booking.domain.service;

import com.quickbooking.booking.domain.model.BookableResource;
import com.quickbooking.booking.domain.model.Booking;
import com.quickbooking.booking.domain.model.BookingStatus;
import com.quickbooking.booking.domain.model.SlotAvailability;
import com.quickbooking.booking.domain.model.SlotCandidate;
import com.quickbooking.booking.domain.model.UnavailabilityReason;
import com.quickbooking.booking.domain.repository.BookableResourceRepository;
import com.quickbooking.booking.domain.repository.BookingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Decides whether a slot can be claimed.
 *
 * Checks, in order: start in the past, resource missing/inactive/foreign,
 * outside working hours, overlap with an active booking.
 * The unlocked variants are advisory only; {@link #validateLocked} is the one
 * the booking transaction relies on.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SlotValidator {

    private final BookingRepository bookingRepository;
    private final BookableResourceRepository resourceRepository;
    private final Clock clock;

    @Value("${booking.slot.default-duration-minutes:60}")
    private int defaultDurationMinutes;

    public SlotAvailability validate(SlotCandidate candidate) {
        return validate(candidate, defaultDurationMinutes);
    }

    public SlotAvailability validate(SlotCandidate candidate, int durationMinutes) {
        if (isPast(candidate)) {
            return past(candidate);
        }
        BookableResource resource = resourceRepository.findById(candidate.resourceId()).orElse(null);
        return checkResourceAndBookings(candidate, durationMinutes, resource);
    }

    /**
     * Authoritative check. {@code lockedResource} must have been loaded with a row lock
     * in the caller's transaction.
     */
    public SlotAvailability validateLocked(SlotCandidate candidate, int durationMinutes,
                                           BookableResource lockedResource) {
        if (isPast(candidate)) {
            return past(candidate);
        }
        return checkResourceAndBookings(candidate, durationMinutes, lockedResource);
    }

    private SlotAvailability checkResourceAndBookings(SlotCandidate candidate, int durationMinutes,
                                                      BookableResource resource) {
        if (resource == null || !resource.isActive() || !resource.belongsTo(candidate.tenantId())) {
            log.debug("Resource {} not bookable for tenant {}", candidate.resourceId(), candidate.tenantId());
            return SlotAvailability.rejected(UnavailabilityReason.RESOURCE_UNAVAILABLE,
                    "Resource " + candidate.resourceId() + " is not available");
        }
        if (!resource.fitsWorkingHours(candidate.time(), durationMinutes)) {
            return SlotAvailability.rejected(UnavailabilityReason.OUTSIDE_WORKING_HOURS,
                    String.format("%s works %s-%s", resource.getName(),
                            resource.getWorkingHoursStart(), resource.getWorkingHoursEnd()));
        }

        LocalDateTime start = candidate.startsAt();
        List<Booking> overlapping = bookingRepository.findOverlapping(
                candidate.tenantId(), candidate.resourceId(), start, start.plusMinutes(durationMinutes),
                BookingStatus.ACTIVE);
        if (!overlapping.isEmpty()) {
            Booking existing = overlapping.get(0);
            log.debug("Slot {} on {} conflicts with booking {}", start, candidate.resourceId(), existing.getBookingCode());
            return SlotAvailability.conflict(existing);
        }
        return SlotAvailability.free();
    }

    private boolean isPast(SlotCandidate candidate) {
        return candidate.startsAt().isBefore(LocalDateTime.now(clock));
    }

    private SlotAvailability past(SlotCandidate candidate) {
        return SlotAvailability.rejected(UnavailabilityReason.PAST,
                "Slot " + candidate.date() + " " + candidate.time() + " is in the past");
    }
}
