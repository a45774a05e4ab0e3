package com.payment.checkout.messaging;

import com.payment.checkout.domain.GatewayResponse;
import com.payment.checkout.domain.OrderStatus;
import com.payment.checkout.persistence.entity.OrderEntity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PaymentResultEventProducerTest {

    @Mock
    private KafkaTemplate<String, PaymentResultEvent> kafkaTemplate;

    private PaymentResultEventProducer producer;

    @BeforeEach
    void setUp() {
        producer = new PaymentResultEventProducer(kafkaTemplate);
        ReflectionTestUtils.setField(producer, "topic", "payment-results");
    }

    private static OrderEntity order() {
        return OrderEntity.builder().id(7L).incrementId("000000101").status(OrderStatus.NEW).build();
    }

    @Test
    void publishesEventKeyedByIncrementId() {
        CompletableFuture<SendResult<String, PaymentResultEvent>> future = new CompletableFuture<>();
        when(kafkaTemplate.send(anyString(), anyString(), any(PaymentResultEvent.class))).thenReturn(future);
        GatewayResponse response = GatewayResponse.builder()
                .resultCode("Authorised")
                .pspReference("PSP-1")
                .paymentMethod(GatewayResponse.PaymentMethod.builder().type("scheme").build())
                .build();

        producer.publish(order(), response, true);

        ArgumentCaptor<PaymentResultEvent> captor = ArgumentCaptor.forClass(PaymentResultEvent.class);
        verify(kafkaTemplate).send(eq("payment-results"), eq("000000101"), captor.capture());
        PaymentResultEvent event = captor.getValue();
        assertThat(event.getEventType()).isEqualTo(PaymentResultEventProducer.EVENT_ACCEPTED);
        assertThat(event.getAuthResult()).isEqualTo("Authorised");
        assertThat(event.getPaymentMethod()).isEqualTo("scheme");
        assertThat(event.getOrderStatus()).isEqualTo(OrderStatus.NEW);
        assertThat(event.getEventId()).isNotBlank();
    }

    @Test
    void kafkaFailureDoesNotPropagate() {
        when(kafkaTemplate.send(anyString(), anyString(), any(PaymentResultEvent.class)))
                .thenThrow(new IllegalStateException("producer closed"));

        assertThatCode(() -> producer.publish(order(), GatewayResponse.builder().resultCode("Refused").build(), false))
                .doesNotThrowAnyException();
    }
}
