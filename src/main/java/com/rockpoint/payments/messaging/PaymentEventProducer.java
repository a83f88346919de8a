package com.rockpoint.payments.messaging;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Fire-and-forget publisher. A broker outage is logged and never changes the
 * outcome of the payment call that produced the event.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentEventProducer {

    private final KafkaTemplate<String, PaymentEvent> kafkaTemplate;

    @Value("${payments.kafka.topic.payment-events:payment-events}")
    private String topic;

    public void publish(PaymentEvent event) {
        String key = event.getOrderId() != null ? event.getOrderId() : event.getTransactionId();
        log.debug("Publishing payment event key={} eventId={} eventType={} status={}",
                key, event.getEventId(), event.getEventType(), event.getStatus());
        CompletableFuture<SendResult<String, PaymentEvent>> future;
        try {
            future = kafkaTemplate.send(topic, key, event);
        } catch (RuntimeException e) {
            log.error("Failed to hand payment event to Kafka key={} eventId={}", key, event.getEventId(), e);
            return;
        }
        future.whenComplete((result, ex) -> {
            if (ex != null) {
                log.error("Failed to publish payment event key={} eventId={}", key, event.getEventId(), ex);
            } else {
                log.debug("Published payment event key={} eventId={} partition={} offset={}",
                        key, event.getEventId(),
                        result != null ? result.getRecordMetadata().partition() : null,
                        result != null ? result.getRecordMetadata().offset() : null);
            }
        });
    }
}
