package com.quickbooking.booking.domain.service;

import com.quickbooking.booking.exception.BookingRetryExhaustedException;
import com.quickbooking.common.exception.BusinessException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Runs an action up to {@code maxAttempts} times with exponential backoff.
 *
 * Every {@link BusinessException} is terminal and propagates on first occurrence.
 * Anything else counts as transient; once attempts run out the last failure is
 * wrapped in {@link BookingRetryExhaustedException}.
 */
@Slf4j
public class BookingRetryExecutor {

    private final RetryTemplate retryTemplate;
    private final int maxAttempts;

    public BookingRetryExecutor(int maxAttempts, long baseDelayMs, long maxDelayMs, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;

        SimpleRetryPolicy retryPolicy = new SimpleRetryPolicy(
                maxAttempts, Map.of(BusinessException.class, false), false, true);

        ExponentialBackOffPolicy backOffPolicy = new ExponentialBackOffPolicy();
        backOffPolicy.setInitialInterval(baseDelayMs);
        backOffPolicy.setMultiplier(2.0);
        backOffPolicy.setMaxInterval(maxDelayMs);
        backOffPolicy.setSleeper(sleeper);

        this.retryTemplate = new RetryTemplate();
        this.retryTemplate.setRetryPolicy(retryPolicy);
        this.retryTemplate.setBackOffPolicy(backOffPolicy);
        this.retryTemplate.registerListener(new RetryListener() {
            @Override
            public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                                                         Throwable throwable) {
                if (!(throwable instanceof BusinessException)) {
                    log.warn("Booking attempt {}/{} failed: {}", context.getRetryCount(), maxAttempts,
                            throwable.toString());
                }
            }
        });
    }

    public <T> T execute(Supplier<T> action) {
        try {
            return retryTemplate.execute(context -> action.get());
        } catch (BusinessException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Booking failed after {} attempts", maxAttempts, e);
            throw new BookingRetryExhaustedException(maxAttempts, e);
        }
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
