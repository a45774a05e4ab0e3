package com.payment.checkout.core;

import com.payment.checkout.persistence.entity.OrderEntity;

/**
 * Append-only audit trail of payment results on an order.
 */
public interface OrderHistoryLog {

    /**
     * Append a comment entry with the order's current status, store {@code authResult}
     * as the order's durable result field, and persist both.
     *
     * @return the order as persisted
     */
    OrderEntity append(OrderEntity order, String comment, String authResult);
}
