package com.quickbooking.booking.domain.service;

import com.quickbooking.booking.domain.hold.HoldKey;
import com.quickbooking.booking.domain.hold.HoldStore;
import com.quickbooking.booking.domain.hold.SlotHold;
import com.quickbooking.booking.domain.model.BookableResource;
import com.quickbooking.booking.domain.model.Booking;
import com.quickbooking.booking.domain.model.BookingConfirmation;
import com.quickbooking.booking.domain.model.ServiceOffering;
import com.quickbooking.booking.domain.model.SlotAvailability;
import com.quickbooking.booking.domain.model.SlotCandidate;
import com.quickbooking.booking.domain.model.SlotOption;
import com.quickbooking.booking.domain.model.SlotSelectionResult;
import com.quickbooking.booking.domain.repository.BookableResourceRepository;
import com.quickbooking.booking.domain.repository.BookingRepository;
import com.quickbooking.booking.domain.repository.ServiceOfferingRepository;
import com.quickbooking.booking.events.BookingEventPublisher;
import com.quickbooking.booking.exception.BookingRetryExhaustedException;
import com.quickbooking.booking.exception.HoldExpiredException;
import com.quickbooking.booking.exception.SlotUnavailableException;
import com.quickbooking.common.exception.BusinessException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Two-step quick booking used by the chat channel.
 *
 * selectSlot: advisory check, then a hold on the slot (or alternatives when it is taken).
 * confirm: hold -> booking through {@link BookingTransactionCoordinator}, retried on
 * transient failures.
 *
 * Not transactional itself: each retry attempt runs in its own coordinator transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QuickBookingService {

    public static final String ERROR_INVALID_SLOT = "INVALID_SLOT";
    public static final String ERROR_NO_ACTIVE_SERVICE = "NO_ACTIVE_SERVICE";

    private final SlotValidator slotValidator;
    private final HoldStore holdStore;
    private final BookingTransactionCoordinator coordinator;
    private final BookingRetryExecutor retryExecutor;
    private final AlternativeSlotFinder alternativeSlotFinder;
    private final ServiceOfferingRepository serviceOfferingRepository;
    private final BookableResourceRepository resourceRepository;
    private final BookingRepository bookingRepository;
    private final BookingEventPublisher eventPublisher;
    private final Clock clock;

    public SlotSelectionResult selectSlot(SlotCandidate candidate, String customerId, String tenantId) {
        return selectSlot(candidate, null, customerId, tenantId);
    }

    /**
     * Holds the slot for the customer if it is free. Never throws for an unavailable slot;
     * the result then carries the reason and nearby alternatives.
     *
     * @param serviceId service to book, or null for the tenant's default service
     */
    public SlotSelectionResult selectSlot(SlotCandidate candidate, String serviceId,
                                          String customerId, String tenantId) {
        if (candidate == null || !candidate.isComplete()) {
            throw new BusinessException("Slot needs a date, a time and a resource", ERROR_INVALID_SLOT);
        }
        if (!candidate.tenantId().equals(tenantId)) {
            throw new BusinessException("Slot belongs to tenant " + candidate.tenantId()
                    + ", not " + tenantId, ERROR_INVALID_SLOT);
        }
        HoldKey key = new HoldKey(customerId, tenantId);
        ServiceOffering service = resolveService(serviceId, tenantId);

        SlotAvailability availability = slotValidator.validate(candidate, service.getDurationMinutes());
        if (!availability.available()) {
            log.info("Slot {} on {} unavailable for {}: {}", candidate.startsAt(), candidate.resourceId(),
                    key, availability.reason());
            List<SlotOption> alternatives = alternativeSlotFinder.findNearby(candidate, service.getDurationMinutes());
            return SlotSelectionResult.unavailable(availability, alternatives);
        }

        String resourceName = resourceRepository.findById(candidate.resourceId())
                .map(BookableResource::getName)
                .orElse(candidate.resourceId());
        SlotHold hold = holdStore.put(key, new SlotHold(
                candidate.date(),
                candidate.time(),
                candidate.resourceId(),
                resourceName,
                service.getId(),
                service.getName(),
                service.getDurationMinutes(),
                service.getPrice(),
                null,
                null));
        log.info("Hold written for {}: {} {} on {} until {}", key, hold.date(), hold.time(),
                hold.resourceId(), hold.expiresAt());
        return SlotSelectionResult.proposal(hold.toProposal(clock.getZone()));
    }

    /**
     * Converts the customer's hold into a confirmed booking.
     *
     * @throws HoldExpiredException           no live hold for the customer
     * @throws SlotUnavailableException       slot taken or gone; hold cleared, alternatives attached
     * @throws BookingRetryExhaustedException transient failures on every attempt; hold kept
     */
    public Booking confirm(String customerId, String tenantId) {
        HoldKey key = new HoldKey(customerId, tenantId);
        SlotHold hold = holdStore.get(key)
                .orElseThrow(() -> new HoldExpiredException(customerId, tenantId));

        BookingConfirmation confirmation;
        try {
            confirmation = retryExecutor.execute(() -> coordinator.confirm(customerId, tenantId, hold));
        } catch (SlotUnavailableException e) {
            holdStore.remove(key, hold);
            List<SlotOption> alternatives = alternativeSlotFinder.findNearby(
                    hold.toCandidate(tenantId), hold.durationMinutes());
            log.info("Hold for {} cleared after {}; offering {} alternatives", key, e.getReason(), alternatives.size());
            throw e.withAlternatives(alternatives);
        } catch (BookingRetryExhaustedException e) {
            log.warn("Confirmation for {} exhausted retries, hold kept until {}", key, hold.expiresAt());
            throw e;
        }

        // a hold written by a newer selectSlot stays
        holdStore.remove(key, hold);
        Booking booking = confirmation.booking();
        if (confirmation.replayed()) {
            log.info("Booking {} was already confirmed for {}, not publishing again", booking.getBookingCode(), key);
        } else {
            publishConfirmed(booking, hold);
        }
        return booking;
    }

    public List<Booking> findCustomerBookings(String customerId, String tenantId) {
        return bookingRepository.findByTenantIdAndCustomerIdOrderByStartTsDesc(tenantId, customerId);
    }

    private ServiceOffering resolveService(String serviceId, String tenantId) {
        if (serviceId != null && !serviceId.isBlank()) {
            return serviceOfferingRepository.findByIdAndTenantId(serviceId, tenantId)
                    .filter(ServiceOffering::isActive)
                    .orElseThrow(() -> new BusinessException(
                            "Service " + serviceId + " is not offered by tenant " + tenantId, ERROR_NO_ACTIVE_SERVICE));
        }
        return serviceOfferingRepository.findFirstByTenantIdAndActiveTrueOrderByNameAsc(tenantId)
                .orElseThrow(() -> new BusinessException(
                        "Tenant " + tenantId + " has no active service", ERROR_NO_ACTIVE_SERVICE));
    }

    private void publishConfirmed(Booking booking, SlotHold hold) {
        try {
            eventPublisher.publishBookingConfirmed(booking, hold);
        } catch (RuntimeException e) {
            log.warn("Failed to publish confirmation of booking {} (booking stays confirmed)", booking.getBookingCode(), e);
        }
    }
}
