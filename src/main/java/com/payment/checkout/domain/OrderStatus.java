package com.payment.checkout.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Order lifecycle states the checkout flow reads and writes.
 */
public enum OrderStatus {
    /** Placed, waiting for the payment result (redirect, 3DS, async methods). */
    PENDING_PAYMENT,
    /** Payment submitted; waiting for the authorisation webhook. */
    NEW,
    PROCESSING,
    COMPLETE,
    CLOSED,
    CANCELED,
    HOLDED,
    PAYMENT_REVIEW;

    private static final Set<OrderStatus> NOT_CANCELLABLE =
            EnumSet.of(CANCELED, COMPLETE, CLOSED, HOLDED, PAYMENT_REVIEW);

    private static final Set<OrderStatus> HOLDABLE = EnumSet.of(PENDING_PAYMENT, NEW, PROCESSING);

    public boolean canCancel() {
        return !NOT_CANCELLABLE.contains(this);
    }

    public boolean canHold() {
        return HOLDABLE.contains(this);
    }
}
