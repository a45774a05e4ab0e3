package com.payment.checkout.vault;

import com.payment.checkout.persistence.entity.VaultPaymentTokenEntity;
import lombok.Builder;
import lombok.Value;

/**
 * Everything needed to build a charge against a stored payment method.
 */
@Value
@Builder
public class VaultChargeContext {

    /** Quote of the order being paid; its state data seeds the request. */
    Long quoteId;

    /** Checkout method code of the vault payment (e.g. adyen_cc_vault, adyen_hpp_vault). */
    String paymentMethodCode;

    /** Gateway payment method type behind the vault method (e.g. scheme, klarna, sepadirectdebit). */
    String providerCode;

    VaultPaymentTokenEntity token;
}
