package com.payment.checkout.compliance;

import com.payment.checkout.domain.GatewayResponse;
import com.payment.checkout.persistence.entity.OrderEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Logs processed payment results for compliance and audit. The order comment history
 * is the merchant-facing trail; these lines are the operational one.
 */
@Slf4j
@Component
public class ComplianceAuditLogger {

    public void logResult(OrderEntity order, GatewayResponse response, boolean success) {
        log.info("[AUDIT] PAYMENT_RESULT order={} resultCode={} authResult={} pspReference={} paymentMethod={} success={} status={}",
                order.getIncrementId(),
                response.getResultCode(),
                response.getResultIndicator(),
                response.getPspReference(),
                response.getPaymentMethodDescriptor(),
                success,
                order.getStatus());
    }
}
