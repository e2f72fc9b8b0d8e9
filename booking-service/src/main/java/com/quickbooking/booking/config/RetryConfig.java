package com.quickbooking.booking.config;

import com.quickbooking.booking.domain.service.BookingRetryExecutor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.backoff.ThreadWaitSleeper;

@Configuration
public class RetryConfig {

    @Bean
    public BookingRetryExecutor bookingRetryExecutor(
            @Value("${booking.retry.max-attempts:3}") int maxAttempts,
            @Value("${booking.retry.base-delay-ms:100}") long baseDelayMs,
            @Value("${booking.retry.max-delay-ms:2000}") long maxDelayMs) {
        return new BookingRetryExecutor(maxAttempts, baseDelayMs, maxDelayMs, new ThreadWaitSleeper());
    }
}
