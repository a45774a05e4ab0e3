package com.payment.checkout.core;

/**
 * Deactivates the cart an order was placed from, so the shopper cannot reuse it.
 */
public interface QuoteManager {

    CollaboratorResult disableQuote(Long quoteId);
}
