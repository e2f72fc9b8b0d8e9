package com.quickbooking.booking.domain.service;

import com.quickbooking.booking.domain.hold.SlotHold;
import com.quickbooking.booking.domain.model.BookableResource;
import com.quickbooking.booking.domain.model.Booking;
import com.quickbooking.booking.domain.model.BookingConfirmation;
import com.quickbooking.booking.domain.model.BookingStatus;
import com.quickbooking.booking.domain.model.SlotAvailability;
import com.quickbooking.booking.domain.model.SlotCandidate;
import com.quickbooking.booking.domain.model.Tenant;
import com.quickbooking.booking.domain.model.UnavailabilityReason;
import com.quickbooking.booking.domain.repository.BookableResourceRepository;
import com.quickbooking.booking.domain.repository.BookingRepository;
import com.quickbooking.booking.domain.repository.TenantRepository;
import com.quickbooking.booking.exception.SlotUnavailableException;
import com.quickbooking.booking.exception.UsageLimitExceededException;
import com.quickbooking.common.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Turns a hold into a booking inside one transaction.
 *
 * Flow:
 * 1. Lock the resource row (SELECT FOR UPDATE)
 * 2. Re-validate the slot against the locked resource
 * 3. Lock the tenant row and check its booking quota
 * 4. Generate the confirmation code
 * 5. Insert the booking as CONFIRMED
 * 6. Increment the tenant usage counter
 * 7. Commit (releases both locks)
 *
 * Locks are always taken resource first, then tenant. A customer repeating the
 * confirmation of a slot they already booked gets that booking back, flagged as replayed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingTransactionCoordinator {

    private final BookableResourceRepository resourceRepository;
    private final TenantRepository tenantRepository;
    private final BookingRepository bookingRepository;
    private final SlotValidator slotValidator;
    private final BookingCodeGenerator codeGenerator;
    private final Clock clock;

    @Transactional(isolation = Isolation.READ_COMMITTED, timeoutString = "${booking.confirm.timeout-seconds:5}")
    public BookingConfirmation confirm(String customerId, String tenantId, SlotHold hold) {
        SlotCandidate candidate = hold.toCandidate(tenantId);

        BookableResource resource = resourceRepository.findByIdWithLock(hold.resourceId())
                .orElseThrow(() -> new SlotUnavailableException(UnavailabilityReason.RESOURCE_UNAVAILABLE,
                        "Resource " + hold.resourceId() + " does not exist"));

        SlotAvailability availability = slotValidator.validateLocked(candidate, hold.durationMinutes(), resource);
        if (!availability.available()) {
            Booking existing = availability.conflictingBooking();
            if (existing != null && existing.isSameClaim(customerId, hold.resourceId(), hold.startsAt())) {
                log.info("Booking {} already confirmed for customer {}, returning it", existing.getBookingCode(), customerId);
                return BookingConfirmation.replayed(existing);
            }
            log.warn("Slot {} on {} rejected at confirmation for customer {}: {}",
                    hold.startsAt(), hold.resourceId(), customerId, availability.reason());
            throw SlotUnavailableException.from(availability);
        }

        Tenant tenant = tenantRepository.findByIdWithLock(tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("Tenant", tenantId));
        if (tenant.isBookingLimitReached()) {
            throw new UsageLimitExceededException(tenantId, tenant.getUsageLimitBookings());
        }

        String code = codeGenerator.generate(tenantId);
        LocalDateTime now = LocalDateTime.now(clock);
        Booking booking = Booking.builder()
                .bookingCode(code)
                .tenantId(tenantId)
                .customerId(customerId)
                .resourceId(hold.resourceId())
                .serviceId(hold.serviceId())
                .serviceName(hold.serviceName())
                .startTs(hold.startsAt())
                .endTs(hold.endsAt())
                .price(hold.price())
                .status(BookingStatus.CONFIRMED)
                .createdAt(now)
                .updatedAt(now)
                .build();
        booking = bookingRepository.save(booking);

        tenant.incrementBookingUsage();
        tenantRepository.save(tenant);

        log.info("Booking {} confirmed: customer {}, resource {}, {}", code, customerId, hold.resourceId(), hold.startsAt());
        return BookingConfirmation.created(booking);
    }
}
