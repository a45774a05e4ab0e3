package com.payment.checkout.core;

import java.util.Map;

/**
 * Per-checkout-session payment state data submitted by the storefront, keyed by quote.
 */
public interface TransientStateStore {

    void save(Long quoteId, Map<String, Object> stateData);

    /**
     * @return stored state data, or an empty map when nothing is stored
     */
    Map<String, Object> getStateData(Long quoteId);

    /**
     * Drop the quote's state data once the payment reached a result that no longer needs it.
     */
    CollaboratorResult clear(Long quoteId, String authResult);
}
