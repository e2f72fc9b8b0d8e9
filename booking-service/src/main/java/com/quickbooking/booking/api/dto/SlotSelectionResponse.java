package com.quickbooking.booking.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.quickbooking.booking.domain.model.SlotOption;
import com.quickbooking.booking.domain.model.SlotProposal;
import com.quickbooking.booking.domain.model.SlotSelectionResult;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SlotSelectionResponse(
        boolean available,
        SlotProposal proposal,
        String reason,
        String message,
        List<SlotOption> alternatives
) {
    public static SlotSelectionResponse from(SlotSelectionResult result) {
        return new SlotSelectionResponse(
                result.available(),
                result.proposal(),
                result.reason() != null ? result.reason().getErrorCode() : null,
                result.message(),
                result.alternatives()
        );
    }
}
