package com.payment.checkout.messaging;

import com.payment.checkout.domain.OrderStatus;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Emitted to Kafka for every processed payment result, so order management,
 * reconciliation and analytics can follow checkout outcomes without polling orders.
 */
@Value
@Builder
@Jacksonized
public class PaymentResultEvent {

    String eventId;
    Long orderId;
    String incrementId;
    String resultCode;
    String authResult;
    String pspReference;
    String paymentMethod;
    boolean success;
    /** Order status after processing. */
    OrderStatus orderStatus;
    Instant timestamp;
    /** Event type: PAYMENT_RESULT_ACCEPTED, PAYMENT_RESULT_REJECTED */
    String eventType;
}
