package com.payment.checkout.core;

import com.payment.checkout.compliance.ComplianceAuditLogger;
import com.payment.checkout.compliance.ResponsePayloadMasker;
import com.payment.checkout.domain.GatewayResponse;
import com.payment.checkout.domain.ResultCode;
import com.payment.checkout.messaging.PaymentResultEventProducer;
import com.payment.checkout.persistence.entity.OrderEntity;
import com.payment.checkout.persistence.entity.OrderPayment;
import com.payment.checkout.persistence.repository.OrderRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Map;

/**
 * Applies a gateway payment result to an order: records the response on the payment,
 * moves the order out of pending payment, cancels it on refusal and leaves an audit
 * comment. Vaulting, quote disabling and state-data cleanup are best-effort and never
 * abort processing.
 * <p>
 * All order writes of one result run in a single transaction, so the order handed in
 * (usually detached) is merged once and the managed copy is carried through every step.
 */
@Slf4j
@Service
public class PaymentResultProcessor {

    static final String COMMENT_HEADER = "Gateway payment details response:";

    private final VaultRecorder vaultRecorder;
    private final OrderLifecycle orderLifecycle;
    private final OrderRepository orderRepository;
    private final TransientStateStore transientStateStore;
    private final QuoteManager quoteManager;
    private final OrderHistoryLog orderHistoryLog;
    private final ResultDecisionPolicy decisionPolicy;
    private final ResponsePayloadMasker payloadMasker;
    private final ComplianceAuditLogger auditLogger;
    private final PaymentResultEventProducer eventProducer;
    private final TransactionTemplate transactionTemplate;

    public PaymentResultProcessor(VaultRecorder vaultRecorder,
                                  OrderLifecycle orderLifecycle,
                                  OrderRepository orderRepository,
                                  TransientStateStore transientStateStore,
                                  QuoteManager quoteManager,
                                  OrderHistoryLog orderHistoryLog,
                                  ResultDecisionPolicy decisionPolicy,
                                  ResponsePayloadMasker payloadMasker,
                                  ComplianceAuditLogger auditLogger,
                                  PaymentResultEventProducer eventProducer,
                                  PlatformTransactionManager transactionManager) {
        this.vaultRecorder = vaultRecorder;
        this.orderLifecycle = orderLifecycle;
        this.orderRepository = orderRepository;
        this.transientStateStore = transientStateStore;
        this.quoteManager = quoteManager;
        this.orderHistoryLog = orderHistoryLog;
        this.decisionPolicy = decisionPolicy;
        this.payloadMasker = payloadMasker;
        this.auditLogger = auditLogger;
        this.eventProducer = eventProducer;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Process a /payments/details style response for an order.
     *
     * @return true when the payment succeeded or is still in progress, false when it was
     * refused, unrecognised or could not be processed
     */
    public boolean process(GatewayResponse response, OrderEntity order) {
        if (response == null || response.isEmpty()) {
            log.error("Payment details call failed, gateway response is empty");
            return false;
        }
        if (order == null) {
            log.error("Payment details response received without an order, resultCode={}", response.getResultCode());
            return false;
        }

        String authResult = response.getResultIndicator();
        if (authResult == null) {
            // Unknown result: log the request and leave the order untouched
            log.error("Unexpected result indicator for order={}. Response: {}",
                    order.getIncrementId(), payloadMasker.mask(response));
            return false;
        }

        AppliedResult applied;
        try {
            // Commit failures (e.g. a concurrent transition winning the version check) land here too
            applied = transactionTemplate.execute(status -> apply(response, order, authResult));
        } catch (RuntimeException e) {
            log.error("Failed to process payment result for order={}, resultCode={}",
                    order.getIncrementId(), response.getResultCode(), e);
            return false;
        }
        if (applied == null) {
            return false;
        }

        auditLogger.logResult(applied.order(), response, applied.success());
        eventProducer.publish(applied.order(), response, applied.success());
        return applied.success();
    }

    private AppliedResult apply(GatewayResponse response, OrderEntity order, String authResult) {
        log.info("Updating order={} with payment result resultCode={}, authResult={}",
                order.getIncrementId(), response.getResultCode(), authResult);

        String paymentMethod = response.getPaymentMethodDescriptor();
        String pspReference = response.getPspReference() != null ? response.getPspReference().trim() : "";
        String comment = String.format("%s<br /> authResult: %s <br /> pspReference: %s <br /> paymentMethod: %s",
                COMMENT_HEADER, authResult, pspReference, paymentMethod);

        recordResponseMetadata(order.getPayment(), response);

        CollaboratorResult vaulted = vaultRecorder.recordRecurringDetails(order, response);
        if (!vaulted.isSuccess()) {
            log.error("Failed to store recurring details for order={}: {}",
                    order.getIncrementId(), vaulted.getErrorMessage());
        }

        // No further shopper action: the authorisation webhook comes next, and only a "new" order accepts it
        OrderEntity current = order;
        if (!ResultCode.isActionRequired(response.getResultCode())) {
            current = advanceToNew(current);
        }

        CollaboratorResult cleared = transientStateStore.clear(order.getQuoteId(), authResult);
        if (!cleared.isSuccess()) {
            log.error("Error cleaning the payment state data for quoteId={}: {}",
                    order.getQuoteId(), cleared.getErrorMessage());
        }

        ResultDecision decision = decisionPolicy.decide(response.getResultCode(), paymentMethod);
        switch (decision.getFollowUp()) {
            case RECORD_TRANSACTION -> recordTransaction(current, response);
            case AWAIT_NOTIFICATION -> {
                current = advanceToNew(current);
                log.info("Order={} awaits the payment notification", current.getIncrementId());
            }
            case CANCEL_ORDER -> current = cancel(current);
            case REPORT_UNRECOGNISED -> log.error(
                    "Payment details call failed for action, resultCode is {}. Raw response: {}. "
                            + "Cancel or hold the order on OFFER_CLOSED notification.",
                    response.getResultCode(), payloadMasker.mask(response));
            case NONE -> log.info("No order follow-up for order={}, resultCode={}",
                    order.getIncrementId(), response.getResultCode());
        }

        OrderEntity recorded = orderHistoryLog.append(current, comment + decision.getCommentSuffix(), authResult);
        return new AppliedResult(recorded, decision.isSuccess());
    }

    private void recordResponseMetadata(OrderPayment payment, GatewayResponse response) {
        putIfPresent(payment, "resultCode", response.getResultCode());
        putIfPresent(payment, "action", response.getAction());
        putIfPresent(payment, "additionalData", response.getAdditionalData());
        putIfPresent(payment, "pspReference", response.getPspReference());
        putIfPresent(payment, "details", response.getDetails());
        putIfPresent(payment, "donationToken", response.getDonationToken());
    }

    private static void putIfPresent(OrderPayment payment, String key, String value) {
        if (value != null && !value.isEmpty()) {
            payment.putAdditionalInformation(key, value);
        }
    }

    private static void putIfPresent(OrderPayment payment, String key, Map<String, Object> value) {
        if (value != null && !value.isEmpty()) {
            payment.putAdditionalInformation(key, value);
        }
    }

    private OrderEntity advanceToNew(OrderEntity order) {
        OrderEntity advanced = orderLifecycle.advanceToNew(order);
        return orderRepository.save(advanced);
    }

    private void recordTransaction(OrderEntity order, GatewayResponse response) {
        String pspReference = response.getPspReference();
        if (pspReference != null && !pspReference.isEmpty()) {
            OrderPayment payment = order.getPayment();
            payment.setCcTransId(pspReference);
            payment.setLastTransId(pspReference);
            payment.setTransactionId(pspReference);
        }

        CollaboratorResult disabled = quoteManager.disableQuote(order.getQuoteId());
        if (!disabled.isSuccess()) {
            log.error("Failed to disable quote quoteId={}: {}", order.getQuoteId(), disabled.getErrorMessage());
        }
    }

    private OrderEntity cancel(OrderEntity order) {
        if (!orderLifecycle.isCancellable(order)) {
            log.info("The order cannot be cancelled: order={}, status={}", order.getIncrementId(), order.getStatus());
            return order;
        }
        order.setCancelRequested(true);
        OrderEntity cancelled = orderLifecycle.cancel(order);
        cancelled.setCancelRequested(true);
        return cancelled;
    }

    private record AppliedResult(OrderEntity order, boolean success) {
    }
}
