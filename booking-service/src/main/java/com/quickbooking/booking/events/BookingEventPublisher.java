package com.quickbooking.booking.events;

import com.quickbooking.booking.domain.hold.SlotHold;
import com.quickbooking.booking.domain.model.Booking;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;

/**
 * Kafka publisher for quick booking events, keyed by booking code so all events
 * of one booking land on the same partition.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingEventPublisher {

    static final String TOPIC_BOOKING_CONFIRMED = "booking-confirmed";

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final Clock clock;

    /**
     * The hold supplies the display name of the resource, which the booking row does not store.
     */
    public void publishBookingConfirmed(Booking booking, SlotHold hold) {
        BookingConfirmedEvent event = BookingConfirmedEvent.builder()
                .bookingId(booking.getId())
                .bookingCode(booking.getBookingCode())
                .tenantId(booking.getTenantId())
                .customerId(booking.getCustomerId())
                .resourceId(booking.getResourceId())
                .resourceName(hold.resourceName())
                .serviceName(booking.getServiceName())
                .startTs(booking.getStartTs())
                .endTs(booking.getEndTs())
                .price(booking.getPrice())
                .status(booking.getStatus().name())
                .timestamp(clock.instant())
                .build();

        publishEvent(TOPIC_BOOKING_CONFIRMED, booking.getBookingCode(), event);
    }

    private void publishEvent(String topic, String key, Object event) {
        log.info("Publishing event to topic {}: {}", topic, event);

        CompletableFuture<SendResult<String, Object>> future = kafkaTemplate.send(topic, key, event);

        future.whenComplete((result, ex) -> {
            if (ex == null) {
                log.info("Event {} published to topic {}: offset={}",
                        key, topic, result.getRecordMetadata().offset());
            } else {
                log.error("Failed to publish event {} to topic {}", key, topic, ex);
            }
        });
    }
}
