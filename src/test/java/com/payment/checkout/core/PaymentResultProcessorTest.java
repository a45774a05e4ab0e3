package com.payment.checkout.core;

import com.payment.checkout.compliance.ComplianceAuditLogger;
import com.payment.checkout.compliance.ResponsePayloadMasker;
import com.payment.checkout.config.CheckoutProperties;
import com.payment.checkout.domain.GatewayResponse;
import com.payment.checkout.domain.OrderStatus;
import com.payment.checkout.messaging.PaymentResultEventProducer;
import com.payment.checkout.order.DefaultOrderLifecycle;
import com.payment.checkout.persistence.entity.OrderEntity;
import com.payment.checkout.persistence.entity.OrderPayment;
import com.payment.checkout.persistence.repository.OrderRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.transaction.PlatformTransactionManager;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for PaymentResultProcessor with mocked collaborators.
 */
@ExtendWith(MockitoExtension.class)
class PaymentResultProcessorTest {

    private static final long QUOTE_ID = 42L;

    @Mock private VaultRecorder vaultRecorder;
    @Mock private OrderLifecycle orderLifecycle;
    @Mock private OrderRepository orderRepository;
    @Mock private TransientStateStore stateStore;
    @Mock private QuoteManager quoteManager;
    @Mock private OrderHistoryLog historyLog;
    @Mock private ComplianceAuditLogger auditLogger;
    @Mock private PaymentResultEventProducer eventProducer;
    @Mock private PlatformTransactionManager transactionManager;

    private PaymentResultProcessor processor;
    private OrderEntity order;

    @BeforeEach
    void setUp() {
        lenient().when(vaultRecorder.recordRecurringDetails(any(), any())).thenReturn(CollaboratorResult.ok());
        lenient().when(stateStore.clear(any(), any())).thenReturn(CollaboratorResult.ok());
        lenient().when(quoteManager.disableQuote(any())).thenReturn(CollaboratorResult.ok());
        lenient().when(orderLifecycle.advanceToNew(any())).thenAnswer(inv -> inv.getArgument(0));
        lenient().when(orderLifecycle.cancel(any())).thenAnswer(inv -> inv.getArgument(0));
        lenient().when(orderRepository.save(any())).thenAnswer(inv -> inv.getArgument(0));
        lenient().when(historyLog.append(any(), any(), any())).thenAnswer(inv -> inv.getArgument(0));
        processor = processorWith(orderLifecycle);
        order = pendingOrder();
    }

    private PaymentResultProcessor processorWith(OrderLifecycle lifecycle) {
        return new PaymentResultProcessor(vaultRecorder, lifecycle, orderRepository, stateStore, quoteManager,
                historyLog, new ResultDecisionPolicy(), new ResponsePayloadMasker(), auditLogger, eventProducer,
                transactionManager);
    }

    private static OrderEntity pendingOrder() {
        return OrderEntity.builder()
                .id(7L)
                .incrementId("000000101")
                .quoteId(QUOTE_ID)
                .customerId("customer-1")
                .status(OrderStatus.PENDING_PAYMENT)
                .payment(OrderPayment.builder().methodCode("adyen_cc").build())
                .build();
    }

    private static GatewayResponse response(String resultCode, String paymentMethodType) {
        return GatewayResponse.builder()
                .resultCode(resultCode)
                .pspReference("PSP-REF-1")
                .paymentMethod(GatewayResponse.PaymentMethod.builder().type(paymentMethodType).build())
                .build();
    }

    @Test
    void emptyResponseReturnsFalseWithoutTouchingOrder() {
        boolean result = processor.process(GatewayResponse.builder().build(), order);

        assertThat(result).isFalse();
        assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING_PAYMENT);
        assertThat(order.getPayment().getAdditionalInformation()).isEmpty();
        verifyNoInteractions(vaultRecorder, orderLifecycle, orderRepository, stateStore, quoteManager, historyLog, eventProducer);
    }

    @Test
    void nullResponseReturnsFalse() {
        assertThat(processor.process(null, order)).isFalse();
        verifyNoInteractions(orderLifecycle, orderRepository, historyLog);
    }

    @Test
    void responseWithoutResultIndicatorReturnsFalseWithoutTouchingOrder() {
        GatewayResponse response = GatewayResponse.builder()
                .pspReference("PSP-REF-1")
                .additionalData(Map.of("cardSummary", "1111"))
                .build();

        boolean result = processor.process(response, order);

        assertThat(result).isFalse();
        assertThat(order.getPayment().getAdditionalInformation()).isEmpty();
        assertThat(order.getAuthResultCode()).isNull();
        verifyNoInteractions(vaultRecorder, orderLifecycle, orderRepository, stateStore, quoteManager, historyLog, eventProducer);
    }

    @Test
    void authorisedSetsTransactionIdsAndDisablesQuote() {
        boolean result = processor.process(response("Authorised", "scheme"), order);

        assertThat(result).isTrue();
        assertThat(order.getPayment().getCcTransId()).isEqualTo("PSP-REF-1");
        assertThat(order.getPayment().getLastTransId()).isEqualTo("PSP-REF-1");
        assertThat(order.getPayment().getTransactionId()).isEqualTo("PSP-REF-1");
        verify(orderLifecycle, times(1)).advanceToNew(order);
        verify(orderRepository, times(1)).save(order);
        verify(quoteManager).disableQuote(QUOTE_ID);
        verify(stateStore).clear(QUOTE_ID, "Authorised");
        verify(historyLog).append(eq(order), contains("authResult: Authorised"), eq("Authorised"));
        verify(eventProducer).publish(order, response("Authorised", "scheme"), true);
    }

    @Test
    void authorisedRecordsResponseMetadataOnPayment() {
        GatewayResponse response = GatewayResponse.builder()
                .resultCode("Authorised")
                .pspReference("PSP-REF-1")
                .additionalData(Map.of("cardSummary", "1111"))
                .donationToken("donation-token")
                .details(Map.of())
                .build();

        processor.process(response, order);

        OrderPayment payment = order.getPayment();
        assertThat(payment.getAdditionalInformation("resultCode")).isEqualTo("Authorised");
        assertThat(payment.getAdditionalInformation("pspReference")).isEqualTo("PSP-REF-1");
        assertThat(payment.getAdditionalInformation("additionalData")).isEqualTo(Map.of("cardSummary", "1111"));
        assertThat(payment.getAdditionalInformation("donationToken")).isEqualTo("donation-token");
        assertThat(payment.getAdditionalInformation()).doesNotContainKeys("action", "details");
    }

    @Test
    void authorisedSucceedsWhenQuoteCannotBeDisabled() {
        when(quoteManager.disableQuote(QUOTE_ID))
                .thenReturn(CollaboratorResult.failed(new IllegalStateException("Quote 42 not found")));

        assertThat(processor.process(response("Authorised", "scheme"), order)).isTrue();
        verify(historyLog).append(eq(order), any(), eq("Authorised"));
    }

    @Test
    void authorisedWithoutPspReferenceLeavesTransactionIdsEmpty() {
        GatewayResponse response = GatewayResponse.builder().resultCode("Authorised").build();

        assertThat(processor.process(response, order)).isTrue();
        assertThat(order.getPayment().getTransactionId()).isNull();
        verify(quoteManager).disableQuote(QUOTE_ID);
    }

    @Test
    void receivedAlipayHkIsNotAccepted() {
        assertThat(processor.process(response("Received", "alipay_hk_sometype"), order)).isFalse();
    }

    @Test
    void receivedOtherMethodIsAccepted() {
        assertThat(processor.process(response("Received", "wechatpayQR"), order)).isTrue();
        verify(orderLifecycle).advanceToNew(order);
    }

    @Test
    void refusedCancelsCancellableOrderOnce() {
        when(orderLifecycle.isCancellable(order)).thenReturn(true);

        boolean result = processor.process(response("Refused", "scheme"), order);

        assertThat(result).isFalse();
        assertThat(order.isCancelRequested()).isTrue();
        verify(orderLifecycle, times(1)).cancel(order);
        verify(quoteManager, never()).disableQuote(any());
    }

    @Test
    void refusedDoesNotCancelOrderThatCannotBeCancelled() {
        when(orderLifecycle.isCancellable(order)).thenReturn(false);

        assertThat(processor.process(response("Refused", "scheme"), order)).isFalse();
        assertThat(order.isCancelRequested()).isFalse();
        verify(orderLifecycle, never()).cancel(any());
        verify(historyLog).append(eq(order), any(), eq("Refused"));
    }

    @Test
    void cancelledCancelsCancellableOrder() {
        when(orderLifecycle.isCancellable(order)).thenReturn(true);

        assertThat(processor.process(response("Cancelled", "paypal"), order)).isFalse();
        verify(orderLifecycle).cancel(order);
    }

    @Test
    void pendingBankTransferAdvancesOnceAndSavesOnce() {
        assertThat(processor.process(response("Pending", "bankTransfer_IBAN"), order)).isTrue();

        verify(orderLifecycle, times(1)).advanceToNew(order);
        verify(orderRepository, times(1)).save(order);
        verify(historyLog).append(eq(order), contains("Waiting for the customer to transfer the money."), eq("Pending"));
    }

    @Test
    void pendingSepaDirectDebitAdvancesOnceAndSavesOnce() {
        assertThat(processor.process(response("Pending", "sepadirectdebit"), order)).isTrue();

        verify(orderLifecycle, times(1)).advanceToNew(order);
        verify(orderRepository, times(1)).save(order);
        verify(historyLog).append(eq(order), contains("sent to the bank at the end of the day"), eq("Pending"));
    }

    @Test
    void pendingOtherMethodAdvancesOnceAndSavesOnce() {
        assertThat(processor.process(response("Pending", "paypal"), order)).isTrue();

        verify(orderLifecycle, times(1)).advanceToNew(order);
        verify(orderRepository, times(1)).save(order);
        verify(historyLog).append(eq(order), contains("OFFER_CLOSED"), eq("Pending"));
    }

    @Test
    void pendingProcessedTwiceStaysNewAndIsNeverCancelled() {
        PaymentResultProcessor withRealLifecycle = processorWith(
                new DefaultOrderLifecycle(orderRepository, new CheckoutProperties()));
        GatewayResponse pending = response("Pending", "paypal");

        assertThat(withRealLifecycle.process(pending, order)).isTrue();
        assertThat(withRealLifecycle.process(pending, order)).isTrue();

        assertThat(order.getStatus()).isEqualTo(OrderStatus.NEW);
        assertThat(order.isCancelRequested()).isFalse();
        verify(historyLog, times(2)).append(eq(order), any(), eq("Pending"));
    }

    @Test
    void actionRequiredResultKeepsOrderPending() {
        GatewayResponse response = GatewayResponse.builder()
                .resultCode("RedirectShopper")
                .action(Map.of("type", "redirect", "url", "https://issuer.example/3ds"))
                .build();

        assertThat(processor.process(response, order)).isTrue();

        verify(orderLifecycle, never()).advanceToNew(any());
        verify(orderRepository, never()).save(any());
        assertThat(order.getPayment().getAdditionalInformation("action"))
                .isEqualTo(Map.of("type", "redirect", "url", "https://issuer.example/3ds"));
        verify(historyLog).append(eq(order), contains("authResult: RedirectShopper"), eq("RedirectShopper"));
    }

    @Test
    void presentToShopperIsAcceptedAndAdvancesOrder() {
        assertThat(processor.process(response("PresentToShopper", "boletobancario"), order)).isTrue();
        verify(orderLifecycle).advanceToNew(order);
    }

    @Test
    void unrecognisedResultCodeReturnsFalseWithoutTerminalState() {
        assertThat(processor.process(response("SomethingNew", "scheme"), order)).isFalse();

        verify(orderLifecycle, never()).cancel(any());
        verify(quoteManager, never()).disableQuote(any());
        verify(historyLog).append(eq(order), contains("authResult: SomethingNew"), eq("SomethingNew"));
    }

    @Test
    void authResultIsRecordedInPlaceOfResultCode() {
        GatewayResponse response = GatewayResponse.builder()
                .authResult("AUTHORISED")
                .resultCode("Authorised")
                .pspReference("PSP-REF-1")
                .build();

        assertThat(processor.process(response, order)).isTrue();
        verify(stateStore).clear(QUOTE_ID, "AUTHORISED");
        verify(historyLog).append(eq(order), contains("authResult: AUTHORISED"), eq("AUTHORISED"));
    }

    @Test
    void vaultFailureDoesNotAbortProcessing() {
        when(vaultRecorder.recordRecurringDetails(any(), any()))
                .thenReturn(CollaboratorResult.failed(new IllegalStateException("token table locked")));

        assertThat(processor.process(response("Authorised", "scheme"), order)).isTrue();
        verify(historyLog).append(eq(order), any(), eq("Authorised"));
    }

    @Test
    void stateDataCleanupFailureDoesNotAbortProcessing() {
        when(stateStore.clear(any(), any()))
                .thenReturn(CollaboratorResult.failed(new IllegalStateException("Redis unavailable")));

        assertThat(processor.process(response("Authorised", "scheme"), order)).isTrue();
        verify(quoteManager).disableQuote(QUOTE_ID);
    }

    @Test
    void unexpectedCollaboratorExceptionIsContained() {
        doThrow(new IllegalStateException("history table unavailable"))
                .when(historyLog).append(any(), any(), any());

        assertThatCode(() -> assertThat(processor.process(response("Authorised", "scheme"), order)).isFalse())
                .doesNotThrowAnyException();
        verify(eventProducer, never()).publish(any(), any(), eq(true));
    }

    @Test
    void laterStepsUseTheOrderReturnedBySave() {
        OrderEntity persisted = pendingOrder();
        persisted.setStatus(OrderStatus.NEW);
        persisted.setVersion(1L);
        when(orderRepository.save(order)).thenReturn(persisted);
        when(historyLog.append(eq(persisted), any(), eq("Authorised"))).thenReturn(persisted);

        assertThat(processor.process(response("Authorised", "scheme"), order)).isTrue();

        assertThat(persisted.getPayment().getTransactionId()).isEqualTo("PSP-REF-1");
        verify(historyLog).append(eq(persisted), contains("authResult: Authorised"), eq("Authorised"));
        verify(auditLogger).logResult(persisted, response("Authorised", "scheme"), true);
        verify(eventProducer).publish(persisted, response("Authorised", "scheme"), true);
    }

    @Test
    void refusedRecordsHistoryOnCancelledOrder() {
        OrderEntity cancelled = pendingOrder();
        cancelled.setStatus(OrderStatus.CANCELED);
        when(orderLifecycle.isCancellable(order)).thenReturn(true);
        when(orderLifecycle.cancel(order)).thenReturn(cancelled);

        assertThat(processor.process(response("Refused", "scheme"), order)).isFalse();

        assertThat(cancelled.isCancelRequested()).isTrue();
        verify(historyLog).append(eq(cancelled), any(), eq("Refused"));
    }

    @Test
    void commitFailureReturnsFalseWithoutPublishing() {
        doThrow(new ObjectOptimisticLockingFailureException(OrderEntity.class, 7L))
                .when(transactionManager).commit(any());

        assertThat(processor.process(response("Authorised", "scheme"), order)).isFalse();

        verifyNoInteractions(auditLogger, eventProducer);
    }

    @Test
    void orderMissingReturnsFalse() {
        assertThat(processor.process(response("Authorised", "scheme"), null)).isFalse();
        verifyNoInteractions(orderLifecycle, historyLog);
    }
}
