package com.payment.checkout.core;

import com.payment.checkout.domain.GatewayResponse;
import com.payment.checkout.persistence.entity.OrderEntity;

/**
 * Persists recurring-payment tokens returned with a payment result.
 */
public interface VaultRecorder {

    CollaboratorResult recordRecurringDetails(OrderEntity order, GatewayResponse response);
}
