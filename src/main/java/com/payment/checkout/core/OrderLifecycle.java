package com.payment.checkout.core;

import com.payment.checkout.persistence.entity.OrderEntity;

/**
 * Order status transitions used by the payment flow.
 * <p>
 * Implementations must serialize writes per order: at most one concurrent status
 * transition per order id.
 */
public interface OrderLifecycle {

    /**
     * Move an order waiting for payment to "new" so it accepts the authorisation webhook.
     * Safe to call when the order is already past pending payment.
     */
    OrderEntity advanceToNew(OrderEntity order);

    boolean isCancellable(OrderEntity order);

    /**
     * Cancel or hold the order, depending on configuration.
     *
     * @return the order as persisted, or the given order when nothing changed
     */
    OrderEntity cancel(OrderEntity order);
}
