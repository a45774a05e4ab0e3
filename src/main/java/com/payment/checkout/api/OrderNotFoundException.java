package com.payment.checkout.api;

/**
 * Thrown when a payment result or status request references an unknown order.
 * Handler returns HTTP 404.
 */
public class OrderNotFoundException extends RuntimeException {

    public OrderNotFoundException(Long orderId) {
        super("Order " + orderId + " not found");
    }
}
