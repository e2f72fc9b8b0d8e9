package com.quickbooking.booking.api.exception;

import com.quickbooking.booking.domain.model.SlotOption;
import com.quickbooking.booking.exception.BookingRetryExhaustedException;
import com.quickbooking.booking.exception.CodeSpaceExhaustedException;
import com.quickbooking.booking.exception.HoldExpiredException;
import com.quickbooking.booking.exception.SlotUnavailableException;
import com.quickbooking.booking.exception.UsageLimitExceededException;
import com.quickbooking.common.dto.BaseResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;

/**
 * Quick booking failures. Takes precedence over the shared handler, which would
 * map all of these to 400 or 503.
 */
@Slf4j
@RestControllerAdvice
@Order(Ordered.HIGHEST_PRECEDENCE)
public class BookingExceptionHandler {

    /** 409 with alternatives so the client can offer another slot right away. */
    @ExceptionHandler(SlotUnavailableException.class)
    public ResponseEntity<BaseResponse<List<SlotOption>>> handleSlotUnavailable(SlotUnavailableException ex) {
        log.info("Slot unavailable [{}]: {}", ex.getErrorCode(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(BaseResponse.error(ex.getMessage(), ex.getErrorCode(), ex.getAlternatives()));
    }

    @ExceptionHandler(HoldExpiredException.class)
    public ResponseEntity<BaseResponse<Void>> handleHoldExpired(HoldExpiredException ex) {
        log.info("Confirmation without a live hold: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.GONE)
                .body(BaseResponse.error(ex.getMessage(), ex.getErrorCode()));
    }

    @ExceptionHandler(UsageLimitExceededException.class)
    public ResponseEntity<BaseResponse<Void>> handleUsageLimit(UsageLimitExceededException ex) {
        log.warn("Usage limit: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(BaseResponse.error(ex.getMessage(), ex.getErrorCode()));
    }

    @ExceptionHandler(CodeSpaceExhaustedException.class)
    public ResponseEntity<BaseResponse<Void>> handleCodeSpaceExhausted(CodeSpaceExhaustedException ex) {
        log.error("Code generation failed: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(BaseResponse.error(ex.getMessage(), ex.getErrorCode()));
    }

    @ExceptionHandler(BookingRetryExhaustedException.class)
    public ResponseEntity<BaseResponse<Void>> handleRetryExhausted(BookingRetryExhaustedException ex) {
        log.warn("Booking retries exhausted after {} attempts", ex.getAttempts());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(BaseResponse.error("Booking is temporarily unavailable, please try again",
                        ex.getErrorCode()));
    }
}
