package com.quickbooking.booking.domain.service;

import com.quickbooking.booking.domain.model.BookableResource;
import com.quickbooking.booking.domain.model.Booking;
import com.quickbooking.booking.domain.model.BookingStatus;
import com.quickbooking.booking.domain.model.SlotCandidate;
import com.quickbooking.booking.domain.model.SlotOption;
import com.quickbooking.booking.domain.repository.BookableResourceRepository;
import com.quickbooking.booking.domain.repository.BookingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Suggests free slots on the same resource close to one that could not be taken.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlternativeSlotFinder {

    private final BookableResourceRepository resourceRepository;
    private final BookingRepository bookingRepository;
    private final Clock clock;

    @Value("${booking.alternatives.limit:3}")
    private int limit;

    @Value("${booking.alternatives.step-minutes:30}")
    private int stepMinutes;

    @Value("${booking.alternatives.search-days:7}")
    private int searchDays;

    @Value("${booking.alternatives.default-day-start:09:00}")
    private String defaultDayStart;

    @Value("${booking.alternatives.default-day-end:18:00}")
    private String defaultDayEnd;

    /**
     * Free starts on the requested day and the following {@code searchDays} days,
     * closest to the requested start first. The first one is marked preferred.
     */
    public List<SlotOption> findNearby(SlotCandidate candidate, int durationMinutes) {
        BookableResource resource = resourceRepository.findById(candidate.resourceId())
                .filter(BookableResource::isActive)
                .filter(r -> r.belongsTo(candidate.tenantId()))
                .orElse(null);
        if (resource == null || stepMinutes <= 0) {
            return List.of();
        }

        LocalTime dayStart = resource.hasWorkingHours() ? resource.getWorkingHoursStart() : LocalTime.parse(defaultDayStart);
        LocalTime dayEnd = resource.hasWorkingHours() ? resource.getWorkingHoursEnd() : LocalTime.parse(defaultDayEnd);
        LocalDate firstDay = candidate.date();
        LocalDate lastDay = firstDay.plusDays(searchDays);

        List<Booking> booked = bookingRepository.findOverlapping(candidate.tenantId(), resource.getId(),
                firstDay.atStartOfDay(), lastDay.plusDays(1).atStartOfDay(), BookingStatus.ACTIVE);

        LocalDateTime requested = candidate.startsAt();
        LocalDateTime now = LocalDateTime.now(clock);
        List<LocalDateTime> free = new ArrayList<>();
        for (LocalDate day = firstDay; !day.isAfter(lastDay); day = day.plusDays(1)) {
            LocalDateTime start = day.atTime(dayStart);
            LocalDateTime closing = day.atTime(dayEnd);
            for (; !start.plusMinutes(durationMinutes).isAfter(closing); start = start.plusMinutes(stepMinutes)) {
                LocalDateTime end = start.plusMinutes(durationMinutes);
                if (start.isBefore(now) || start.equals(requested)) {
                    continue;
                }
                LocalDateTime slotStart = start;
                if (booked.stream().noneMatch(b -> b.occupies(slotStart, end))) {
                    free.add(start);
                }
            }
        }

        List<LocalDateTime> nearest = free.stream()
                .sorted(Comparator.<LocalDateTime>comparingLong(s -> Duration.between(requested, s).abs().toMinutes())
                        .thenComparing(Comparator.naturalOrder()))
                .limit(limit)
                .toList();

        List<SlotOption> options = new ArrayList<>();
        for (int i = 0; i < nearest.size(); i++) {
            LocalDateTime start = nearest.get(i);
            options.add(new SlotOption(start.toLocalDate(), start.toLocalTime(), resource.getId(),
                    resource.getName(), i == 0));
        }
        log.debug("Found {} alternatives for {} on {}", options.size(), requested, resource.getId());
        return options;
    }
}
