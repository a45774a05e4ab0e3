package com.payment.checkout.domain;

/**
 * What to do with an order whose payment was refused or cancelled.
 */
public enum PaymentCancelledAction {
    CANCEL,
    /** Put the order on hold for manual review instead of cancelling it. */
    HOLD
}
