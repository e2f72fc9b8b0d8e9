package com.quickbooking.booking.domain.service;

import com.quickbooking.booking.domain.repository.BookingRepository;
import com.quickbooking.booking.exception.CodeSpaceExhaustedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.util.Random;

/**
 * Short confirmation codes such as {@code BK482913}, unique per tenant.
 * The unique constraint on (tenant_id, booking_code) catches what the existence check misses.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingCodeGenerator {

    private static final int MIN = 100_000;
    private static final int RANGE = 900_000;

    private final BookingRepository bookingRepository;
    private Random random = new SecureRandom();

    @Value("${booking.code.prefix:BK}")
    private String prefix;

    @Value("${booking.code.max-attempts:10}")
    private int maxAttempts;

    @Transactional(propagation = Propagation.MANDATORY)
    public String generate(String tenantId) {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String code = prefix + (MIN + random.nextInt(RANGE));
            if (!bookingRepository.existsByTenantIdAndBookingCode(tenantId, code)) {
                return code;
            }
            log.debug("Booking code {} already taken in tenant {} (attempt {})", code, tenantId, attempt);
        }
        log.error("Booking code space exhausted for tenant {} after {} attempts", tenantId, maxAttempts);
        throw new CodeSpaceExhaustedException(tenantId, maxAttempts);
    }
}
