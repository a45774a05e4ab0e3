package com.payment.checkout.messaging;

import com.payment.checkout.domain.GatewayResponse;
import com.payment.checkout.persistence.entity.OrderEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Publishes payment result events to Kafka, keyed by order increment id so events
 * of one order stay ordered. Publishing never fails the payment flow.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentResultEventProducer {

    static final String EVENT_ACCEPTED = "PAYMENT_RESULT_ACCEPTED";
    static final String EVENT_REJECTED = "PAYMENT_RESULT_REJECTED";

    private final KafkaTemplate<String, PaymentResultEvent> kafkaTemplate;

    @Value("${checkout.kafka.topic.payment-results:payment-results}")
    private String topic;

    public void publish(OrderEntity order, GatewayResponse response, boolean success) {
        PaymentResultEvent event = PaymentResultEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .orderId(order.getId())
                .incrementId(order.getIncrementId())
                .resultCode(response.getResultCode())
                .authResult(response.getResultIndicator())
                .pspReference(response.getPspReference())
                .paymentMethod(response.getPaymentMethodDescriptor())
                .success(success)
                .orderStatus(order.getStatus())
                .timestamp(Instant.now())
                .eventType(success ? EVENT_ACCEPTED : EVENT_REJECTED)
                .build();
        send(order.getIncrementId(), event);
    }

    private void send(String key, PaymentResultEvent event) {
        log.info("Publishing payment result event: key={}, eventId={}, resultCode={}, eventType={}",
                key, event.getEventId(), event.getResultCode(), event.getEventType());
        try {
            CompletableFuture<SendResult<String, PaymentResultEvent>> future = kafkaTemplate.send(topic, key, event);
            future.whenComplete((result, ex) -> {
                if (ex != null) {
                    log.error("Failed to publish payment result event key={} eventId={}", key, event.getEventId(), ex);
                } else {
                    log.debug("Published payment result event: key={}, eventId={}, partition={}, offset={}",
                            key, event.getEventId(),
                            result != null ? result.getRecordMetadata().partition() : null,
                            result != null ? result.getRecordMetadata().offset() : null);
                }
            });
        } catch (Exception e) {
            log.error("Could not hand payment result event to Kafka key={} eventId={}", key, event.getEventId(), e);
        }
    }
}
