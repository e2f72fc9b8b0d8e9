package com.quickbooking.booking.domain.service;

import com.quickbooking.booking.domain.model.BookableResource;
import com.quickbooking.booking.domain.model.Booking;
import com.quickbooking.booking.domain.model.BookingStatus;
import com.quickbooking.booking.domain.model.SlotAvailability;
import com.quickbooking.booking.domain.model.SlotCandidate;
import com.quickbooking.booking.domain.model.UnavailabilityReason;
import com.quickbooking.booking.domain.repository.BookableResourceRepository;
import com.quickbooking.booking.domain.repository.BookingRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SlotValidatorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-11-10T10:00:00Z"), ZoneOffset.UTC);
    private static final String TENANT = "t1";
    private static final LocalDate DAY = LocalDate.of(2025, 11, 10);

    @Mock
    private BookingRepository bookingRepository;
    @Mock
    private BookableResourceRepository resourceRepository;

    private SlotValidator validator;

    @BeforeEach
    void setUp() {
        validator = new SlotValidator(bookingRepository, resourceRepository, CLOCK);
        ReflectionTestUtils.setField(validator, "defaultDurationMinutes", 60);
    }

    private static BookableResource resource() {
        return BookableResource.builder()
                .id("m123").tenantId(TENANT).name("Minh").active(true)
                .workingHoursStart(LocalTime.of(9, 0)).workingHoursEnd(LocalTime.of(18, 0))
                .build();
    }

    private static SlotCandidate at(int hour, int minute) {
        return new SlotCandidate(DAY, LocalTime.of(hour, minute), "m123", TENANT);
    }

    @Test
    @DisplayName("future slot with no active booking is available")
    void validate_freeSlot_available() {
        when(resourceRepository.findById("m123")).thenReturn(Optional.of(resource()));
        when(bookingRepository.findOverlapping(eq(TENANT), eq("m123"), any(), any(), eq(BookingStatus.ACTIVE)))
                .thenReturn(List.of());

        SlotAvailability result = validator.validate(at(15, 0));

        assertThat(result.available()).isTrue();
        assertThat(result.reason()).isNull();
        verify(bookingRepository).findOverlapping(TENANT, "m123",
                LocalDateTime.of(DAY, LocalTime.of(15, 0)), LocalDateTime.of(DAY, LocalTime.of(16, 0)),
                BookingStatus.ACTIVE);
    }

    @Test
    @DisplayName("slot starting before now is rejected as PAST without touching the database")
    void validate_pastSlot_rejected() {
        SlotAvailability result = validator.validate(at(9, 30));

        assertThat(result.available()).isFalse();
        assertThat(result.reason()).isEqualTo(UnavailabilityReason.PAST);
        verify(resourceRepository, never()).findById(any());
        verify(bookingRepository, never()).findOverlapping(any(), any(), any(), any(), any());
    }

    @Test
    @DisplayName("slot starting exactly now is not in the past")
    void validate_slotStartingNow_notPast() {
        when(resourceRepository.findById("m123")).thenReturn(Optional.of(resource()));
        when(bookingRepository.findOverlapping(any(), any(), any(), any(), any())).thenReturn(List.of());

        assertThat(validator.validate(at(10, 0)).available()).isTrue();
    }

    @Test
    @DisplayName("unknown, inactive or foreign resource is RESOURCE_UNAVAILABLE")
    void validate_unusableResource_rejected() {
        when(resourceRepository.findById("m123")).thenReturn(Optional.empty());
        assertThat(validator.validate(at(15, 0)).reason()).isEqualTo(UnavailabilityReason.RESOURCE_UNAVAILABLE);

        BookableResource inactive = resource();
        inactive.setActive(false);
        when(resourceRepository.findById("m123")).thenReturn(Optional.of(inactive));
        assertThat(validator.validate(at(15, 0)).reason()).isEqualTo(UnavailabilityReason.RESOURCE_UNAVAILABLE);

        BookableResource foreign = resource();
        foreign.setTenantId("other");
        when(resourceRepository.findById("m123")).thenReturn(Optional.of(foreign));
        assertThat(validator.validate(at(15, 0)).reason()).isEqualTo(UnavailabilityReason.RESOURCE_UNAVAILABLE);
    }

    @Test
    @DisplayName("slot running past closing time is OUTSIDE_WORKING_HOURS")
    void validate_afterClosing_rejected() {
        when(resourceRepository.findById("m123")).thenReturn(Optional.of(resource()));

        SlotAvailability result = validator.validate(at(17, 30), 60);

        assertThat(result.reason()).isEqualTo(UnavailabilityReason.OUTSIDE_WORKING_HOURS);
        verify(bookingRepository, never()).findOverlapping(any(), any(), any(), any(), any());
    }

    @Test
    @DisplayName("overlapping active booking is a CONFLICT naming the booking code")
    void validate_overlappingBooking_conflict() {
        Booking existing = Booking.builder()
                .bookingCode("BK123456").customerId("c9").resourceId("m123").tenantId(TENANT)
                .startTs(LocalDateTime.of(DAY, LocalTime.of(14, 30)))
                .endTs(LocalDateTime.of(DAY, LocalTime.of(15, 30)))
                .status(BookingStatus.CONFIRMED)
                .build();
        when(resourceRepository.findById("m123")).thenReturn(Optional.of(resource()));
        when(bookingRepository.findOverlapping(any(), any(), any(), any(), any())).thenReturn(List.of(existing));

        SlotAvailability result = validator.validate(at(15, 0));

        assertThat(result.available()).isFalse();
        assertThat(result.reason()).isEqualTo(UnavailabilityReason.CONFLICT);
        assertThat(result.message()).contains("BK123456");
        assertThat(result.conflictingBooking()).isSameAs(existing);
    }

    @Test
    @DisplayName("locked validation uses the given resource instead of loading one")
    void validateLocked_usesLockedResource() {
        when(bookingRepository.findOverlapping(any(), any(), any(), any(), any())).thenReturn(List.of());

        SlotAvailability result = validator.validateLocked(at(15, 0), 45, resource());

        assertThat(result.available()).isTrue();
        verify(resourceRepository, never()).findById(any());
        verify(bookingRepository).findOverlapping(TENANT, "m123",
                LocalDateTime.of(DAY, LocalTime.of(15, 0)), LocalDateTime.of(DAY, LocalTime.of(15, 45)),
                BookingStatus.ACTIVE);
    }
}
