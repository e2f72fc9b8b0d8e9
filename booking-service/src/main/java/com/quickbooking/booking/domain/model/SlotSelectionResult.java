package com.quickbooking.booking.domain.model;

import java.util.List;

/**
 * Either a proposal for the requested slot or, when it is not available,
 * the reason and some nearby alternatives.
 */
public record SlotSelectionResult(
        boolean available,
        SlotProposal proposal,
        UnavailabilityReason reason,
        String message,
        List<SlotOption> alternatives
) {
    public static SlotSelectionResult proposal(SlotProposal proposal) {
        return new SlotSelectionResult(true, proposal, null, null, List.of());
    }

    public static SlotSelectionResult unavailable(SlotAvailability availability, List<SlotOption> alternatives) {
        return new SlotSelectionResult(false, null, availability.reason(), availability.message(),
                List.copyOf(alternatives));
    }
}
