package com.payment.checkout.compliance;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.payment.checkout.domain.GatewayResponse;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Renders gateway responses for logs with token-like values redacted.
 * Never log a raw gateway payload without going through this class.
 */
@Component
public class ResponsePayloadMasker {

    static final String MASK = "***";

    private static final Set<String> SENSITIVE_ADDITIONAL_DATA = Set.of(
            "tokenization.storedPaymentMethodId",
            "recurring.recurringDetailReference",
            "recurring.shopperReference",
            "cardSummary",
            "expiryDate",
            "cardBin",
            "issuerBin");

    private static final Set<String> SENSITIVE_ACTION = Set.of("paymentData", "token");

    private final ObjectMapper mapper = new ObjectMapper();

    public String mask(GatewayResponse response) {
        if (response == null) {
            return "null";
        }
        GatewayResponse masked = response.toBuilder()
                .donationToken(response.getDonationToken() != null ? MASK : null)
                .additionalData(maskKeys(response.getAdditionalData(), SENSITIVE_ADDITIONAL_DATA))
                .action(maskKeys(response.getAction(), SENSITIVE_ACTION))
                .build();
        try {
            return mapper.writeValueAsString(masked);
        } catch (JsonProcessingException e) {
            return "<unserializable response resultCode=" + response.getResultCode() + ">";
        }
    }

    static Map<String, Object> maskKeys(Map<String, Object> source, Set<String> sensitiveKeys) {
        if (source == null) {
            return null;
        }
        Map<String, Object> copy = new LinkedHashMap<>(source);
        copy.replaceAll((key, value) -> sensitiveKeys.contains(key) && value != null ? MASK : value);
        return copy;
    }
}
