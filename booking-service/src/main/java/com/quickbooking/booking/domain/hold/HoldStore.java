package com.quickbooking.booking.domain.hold;

import java.util.Optional;

/**
 * Ephemeral per-customer slot holds with a TTL.
 * Implementations must be safe for concurrent use from request threads and the sweeper.
 */
public interface HoldStore {

    /**
     * Stores the hold, replacing any previous one for the key.
     *
     * @return the stored hold with createdAt/expiresAt stamped
     */
    SlotHold put(HoldKey key, SlotHold hold);

    /**
     * @return the hold if present and not expired
     */
    Optional<SlotHold> get(HoldKey key);

    void remove(HoldKey key);

    /**
     * Removes the entry only while it is still {@code hold}; a newer hold for the key survives.
     *
     * @return whether the hold was removed
     */
    boolean remove(HoldKey key, SlotHold hold);

    /**
     * Evicts expired holds.
     *
     * @return number of holds removed
     */
    int sweep();

    int size();
}
