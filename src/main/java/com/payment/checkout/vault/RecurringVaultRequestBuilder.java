package com.payment.checkout.vault;

import com.payment.checkout.config.CheckoutProperties;
import com.payment.checkout.core.TransientStateStore;
import com.payment.checkout.persistence.entity.VaultPaymentTokenEntity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the /payments request body for a charge against a stored payment method.
 * Cards keep the native 3DS2 flow; other methods reference the stored token explicitly.
 */
@Component
@RequiredArgsConstructor
public class RecurringVaultRequestBuilder {

    public static final String CC_VAULT_CODE = "adyen_cc_vault";

    private final TransientStateStore stateStore;
    private final CheckoutProperties properties;

    public Map<String, Object> build(VaultChargeContext context) {
        VaultPaymentTokenEntity token = context.getToken();
        if (token == null) {
            throw new IllegalArgumentException("A vault charge needs a payment token");
        }
        Map<String, Object> details = token.getTokenDetails() != null ? token.getTokenDetails() : Map.of();

        Map<String, Object> requestBody = new LinkedHashMap<>(stateStore.getStateData(context.getQuoteId()));

        if (details.containsKey(VaultPaymentTokenEntity.DETAIL_TOKEN_TYPE)) {
            requestBody.put("recurringProcessingModel", details.get(VaultPaymentTokenEntity.DETAIL_TOKEN_TYPE));
        } else {
            requestBody.put("recurringProcessingModel",
                    properties.getVault().recurringProcessingModelFor(context.getProviderCode()));
        }

        if (CC_VAULT_CODE.equals(context.getPaymentMethodCode())) {
            // Without allow3DS2 the shopper is redirected to the issuer instead of the native challenge
            Map<String, Object> additionalData = additionalData(requestBody.get("additionalData"));
            additionalData.put("allow3DS2", true);
            requestBody.put("additionalData", additionalData);
        } else {
            Map<String, Object> paymentMethod = new LinkedHashMap<>();
            paymentMethod.put("type", details.get(VaultPaymentTokenEntity.DETAIL_TYPE));
            paymentMethod.put("storedPaymentMethodId", token.getGatewayToken());
            requestBody.put("paymentMethod", paymentMethod);
        }

        Map<String, Object> request = new HashMap<>();
        request.put("body", requestBody);
        return request;
    }

    private static Map<String, Object> additionalData(Object existing) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (existing instanceof Map) {
            ((Map<?, ?>) existing).forEach((key, value) -> copy.put(String.valueOf(key), value));
        }
        return copy;
    }
}
