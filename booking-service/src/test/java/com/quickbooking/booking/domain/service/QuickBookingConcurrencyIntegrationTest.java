package com.quickbooking.booking.domain.service;

import com.quickbooking.booking.config.RetryConfig;
import com.quickbooking.booking.domain.hold.InMemoryHoldStore;
import com.quickbooking.booking.domain.model.BookableResource;
import com.quickbooking.booking.domain.model.Booking;
import com.quickbooking.booking.domain.model.BookingStatus;
import com.quickbooking.booking.domain.model.ServiceOffering;
import com.quickbooking.booking.domain.model.SlotCandidate;
import com.quickbooking.booking.domain.model.SlotSelectionResult;
import com.quickbooking.booking.domain.model.Tenant;
import com.quickbooking.booking.domain.model.UnavailabilityReason;
import com.quickbooking.booking.domain.repository.BookableResourceRepository;
import com.quickbooking.booking.domain.repository.BookingRepository;
import com.quickbooking.booking.domain.repository.ServiceOfferingRepository;
import com.quickbooking.booking.domain.repository.TenantRepository;
import com.quickbooking.booking.events.BookingEventPublisher;
import com.quickbooking.booking.exception.HoldExpiredException;
import com.quickbooking.booking.exception.SlotUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Two customers racing for the same slot against a real PostgreSQL row lock.
 * Runs without a test-managed transaction so each confirmation commits on its own.
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import({
        InMemoryHoldStore.class,
        SlotValidator.class,
        BookingCodeGenerator.class,
        BookingTransactionCoordinator.class,
        AlternativeSlotFinder.class,
        QuickBookingService.class,
        RetryConfig.class
})
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Testcontainers(disabledWithoutDocker = true)
class QuickBookingConcurrencyIntegrationTest {

    private static final LocalDate DAY = LocalDate.of(2025, 11, 10);
    private static final SlotCandidate SLOT = new SlotCandidate(DAY, LocalTime.of(15, 0), "m123", "t1");

    @Container
    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("booking_db")
            .withUsername("postgres")
            .withPassword("postgres");

    @DynamicPropertySource
    static void configureDatasource(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
        registry.add("spring.flyway.enabled", () -> "false");
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "create");
    }

    @TestConfiguration
    static class FixedClockConfig {
        @Bean
        Clock clock() {
            return Clock.fixed(Instant.parse("2025-11-10T08:00:00Z"), ZoneOffset.UTC);
        }
    }

    @MockBean
    private BookingEventPublisher eventPublisher;

    @Autowired
    private QuickBookingService quickBookingService;
    @Autowired
    private BookingRepository bookingRepository;
    @Autowired
    private BookableResourceRepository resourceRepository;
    @Autowired
    private ServiceOfferingRepository serviceOfferingRepository;
    @Autowired
    private TenantRepository tenantRepository;

    @BeforeEach
    void seed() {
        bookingRepository.deleteAll();
        serviceOfferingRepository.deleteAll();
        resourceRepository.deleteAll();
        tenantRepository.deleteAll();

        tenantRepository.save(Tenant.builder().id("t1").name("Salon Hung").usageCurrentBookings(0).build());
        resourceRepository.save(BookableResource.builder().id("m123").tenantId("t1").name("Minh").active(true)
                .workingHoursStart(LocalTime.of(9, 0)).workingHoursEnd(LocalTime.of(18, 0)).build());
        serviceOfferingRepository.save(ServiceOffering.builder().id("s1").tenantId("t1").name("Haircut")
                .durationMinutes(60).price(BigDecimal.valueOf(150)).active(true).build());
    }

    @Test
    @DisplayName("two customers confirm m123 at 15:00 concurrently: exactly one booking, loser gets alternatives")
    void concurrentConfirm_exactlyOneWins() throws Exception {
        // given: both customers hold the same slot
        assertThat(quickBookingService.selectSlot(SLOT, "alice", "t1").available()).isTrue();
        assertThat(quickBookingService.selectSlot(SLOT, "bob", "t1").available()).isTrue();

        // when: both confirm at the same moment
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        List<Future<Booking>> results = new ArrayList<>();
        try {
            for (String customer : List.of("alice", "bob")) {
                Callable<Booking> confirm = () -> {
                    start.await();
                    return quickBookingService.confirm(customer, "t1");
                };
                results.add(pool.submit(confirm));
            }
            start.countDown();

            int succeeded = 0;
            List<SlotUnavailableException> conflicts = new ArrayList<>();
            for (Future<Booking> result : results) {
                try {
                    result.get(30, TimeUnit.SECONDS);
                    succeeded++;
                } catch (ExecutionException e) {
                    assertThat(e.getCause()).isInstanceOf(SlotUnavailableException.class);
                    conflicts.add((SlotUnavailableException) e.getCause());
                }
            }

            // then
            assertThat(succeeded).isEqualTo(1);
            assertThat(conflicts).hasSize(1);
            assertThat(conflicts.get(0).getReason()).isEqualTo(UnavailabilityReason.CONFLICT);
            assertThat(conflicts.get(0).getAlternatives()).isNotEmpty();
            assertThat(conflicts.get(0).getAlternatives().get(0).preferred()).isTrue();
        } finally {
            pool.shutdownNow();
        }

        List<Booking> bookings = bookingRepository.findAll();
        assertThat(bookings).hasSize(1);
        assertThat(bookings.get(0).getStatus()).isEqualTo(BookingStatus.CONFIRMED);
        assertThat(bookings.get(0).getBookingCode()).matches("BK\\d{6}");
        assertThat(tenantRepository.findById("t1").orElseThrow().getUsageCurrentBookings()).isEqualTo(1);
    }

    @Test
    @DisplayName("confirming twice books once and the second call finds no hold")
    void confirmTwice_noDuplicate() {
        quickBookingService.selectSlot(SLOT, "alice", "t1");

        Booking booking = quickBookingService.confirm("alice", "t1");

        assertThatThrownBy(() -> quickBookingService.confirm("alice", "t1"))
                .isInstanceOf(HoldExpiredException.class);
        assertThat(bookingRepository.findAll()).extracting(Booking::getId).containsExactly(booking.getId());
        assertThat(bookingRepository.findById(booking.getId()).orElseThrow().getCreatedAt())
                .isEqualTo(LocalDateTime.of(2025, 11, 10, 8, 0));
    }

    @Test
    @DisplayName("selecting a booked slot offers alternatives instead of a hold")
    void selectBookedSlot_returnsAlternatives() {
        quickBookingService.selectSlot(SLOT, "alice", "t1");
        quickBookingService.confirm("alice", "t1");

        SlotSelectionResult result = quickBookingService.selectSlot(SLOT, "bob", "t1");

        assertThat(result.available()).isFalse();
        assertThat(result.reason()).isEqualTo(UnavailabilityReason.CONFLICT);
        assertThat(result.alternatives()).hasSize(3);
    }
}
