package com.quickbooking.booking.domain.hold;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link HoldStore}. Holds are lost on restart; a shared TTL cache
 * can replace this bean when the service runs on more than one node.
 */
@Slf4j
@Component
public class InMemoryHoldStore implements HoldStore {

    private final Map<HoldKey, SlotHold> holds = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration ttl;

    public InMemoryHoldStore(Clock clock, @Value("${booking.hold.ttl-seconds:900}") long ttlSeconds) {
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("booking.hold.ttl-seconds must be positive");
        }
        this.clock = clock;
        this.ttl = Duration.ofSeconds(ttlSeconds);
    }

    @Override
    public SlotHold put(HoldKey key, SlotHold hold) {
        Instant now = clock.instant();
        SlotHold stamped = hold.withTimestamps(now, now.plus(ttl));
        SlotHold previous = holds.put(key, stamped);
        if (previous != null) {
            log.debug("Hold for {} superseded ({} {} -> {} {})", key,
                    previous.date(), previous.time(), stamped.date(), stamped.time());
        }
        return stamped;
    }

    @Override
    public Optional<SlotHold> get(HoldKey key) {
        SlotHold hold = holds.get(key);
        if (hold == null) {
            return Optional.empty();
        }
        if (hold.isExpiredAt(clock.instant())) {
            // only drop the entry we looked at, a concurrent put may have replaced it
            holds.remove(key, hold);
            return Optional.empty();
        }
        return Optional.of(hold);
    }

    @Override
    public void remove(HoldKey key) {
        holds.remove(key);
    }

    @Override
    public boolean remove(HoldKey key, SlotHold hold) {
        return holds.remove(key, hold);
    }

    @Override
    @Scheduled(fixedDelayString = "${booking.hold.sweep-interval-ms:300000}")
    public int sweep() {
        Instant now = clock.instant();
        int removed = 0;
        for (Map.Entry<HoldKey, SlotHold> entry : holds.entrySet()) {
            if (entry.getValue().isExpiredAt(now) && holds.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Swept {} expired slot holds ({} remaining)", removed, holds.size());
        }
        return removed;
    }

    @Override
    public int size() {
        return holds.size();
    }
}
