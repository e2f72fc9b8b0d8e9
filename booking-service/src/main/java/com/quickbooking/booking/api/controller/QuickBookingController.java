package com.quickbooking.booking.api.controller;

import com.quickbooking.booking.api.dto.BookingResponse;
import com.quickbooking.booking.api.dto.ConfirmBookingRequest;
import com.quickbooking.booking.api.dto.SelectSlotRequest;
import com.quickbooking.booking.api.dto.SlotSelectionResponse;
import com.quickbooking.booking.domain.model.Booking;
import com.quickbooking.booking.domain.model.SlotSelectionResult;
import com.quickbooking.booking.domain.service.QuickBookingService;
import com.quickbooking.common.dto.BaseResponse;
import com.quickbooking.common.util.Constants;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Endpoints called by the chat gateway when a customer taps a slot or the confirm button.
 */
@RestController
@RequestMapping(Constants.API_V1 + "/quick-booking")
@RequiredArgsConstructor
public class QuickBookingController {

    private final QuickBookingService quickBookingService;

    @PostMapping("/slots/select")
    public ResponseEntity<BaseResponse<SlotSelectionResponse>> selectSlot(
            @Valid @RequestBody SelectSlotRequest request) {
        SlotSelectionResult result = quickBookingService.selectSlot(
                request.toCandidate(), request.serviceId(), request.customerId(), request.tenantId());
        String message = result.available() ? "Slot held, please confirm" : "Slot unavailable";
        return ResponseEntity.ok(BaseResponse.success(message, SlotSelectionResponse.from(result)));
    }

    @PostMapping("/confirm")
    public ResponseEntity<BaseResponse<BookingResponse>> confirm(
            @Valid @RequestBody ConfirmBookingRequest request) {
        Booking booking = quickBookingService.confirm(request.customerId(), request.tenantId());
        return ResponseEntity.ok(BaseResponse.success("Booking confirmed", BookingResponse.from(booking)));
    }

    @GetMapping("/customers/{customerId}/bookings")
    public ResponseEntity<BaseResponse<List<BookingResponse>>> getCustomerBookings(
            @PathVariable String customerId, @RequestParam String tenantId) {
        List<BookingResponse> response = quickBookingService.findCustomerBookings(customerId, tenantId).stream()
                .map(BookingResponse::from)
                .toList();
        return ResponseEntity.ok(BaseResponse.success(response));
    }
}
