package com.payment.checkout.vault;

import com.payment.checkout.config.CheckoutProperties;
import com.payment.checkout.core.CollaboratorResult;
import com.payment.checkout.core.VaultRecorder;
import com.payment.checkout.domain.GatewayResponse;
import com.payment.checkout.persistence.entity.OrderEntity;
import com.payment.checkout.persistence.entity.VaultPaymentTokenEntity;
import com.payment.checkout.persistence.repository.VaultPaymentTokenRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stores the recurring token a payment result carries, so the customer can be charged
 * again without re-entering payment details. Runs in its own transaction so a failed
 * token write never rolls back the order update.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VaultTokenService implements VaultRecorder {

    static final String STORED_PAYMENT_METHOD_ID = "tokenization.storedPaymentMethodId";
    static final String RECURRING_DETAIL_REFERENCE = "recurring.recurringDetailReference";
    static final String RECURRING_PROCESSING_MODEL = "recurringProcessingModel";
    static final String CARD_SUMMARY = "cardSummary";
    static final String EXPIRY_DATE = "expiryDate";

    private final VaultPaymentTokenRepository tokenRepository;
    private final CheckoutProperties properties;

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public CollaboratorResult recordRecurringDetails(OrderEntity order, GatewayResponse response) {
        if (!properties.getVault().isEnabled()) {
            return CollaboratorResult.ok();
        }
        String customerId = order.getCustomerId();
        Map<String, Object> additionalData = response.getAdditionalData();
        String gatewayToken = tokenReference(additionalData);
        if (customerId == null || gatewayToken == null) {
            log.debug("No recurring details to store for order={}", order.getIncrementId());
            return CollaboratorResult.ok();
        }

        try {
            VaultPaymentTokenEntity token = tokenRepository.findByCustomerIdAndGatewayToken(customerId, gatewayToken)
                    .orElseGet(() -> VaultPaymentTokenEntity.builder()
                            .customerId(customerId)
                            .gatewayToken(gatewayToken)
                            .build());
            token.setPaymentMethodCode(order.getPayment().getMethodCode());
            token.setTokenDetails(tokenDetails(response, additionalData));
            token.setActive(true);
            tokenRepository.save(token);
            log.info("Stored recurring token for order={}, customerId={}", order.getIncrementId(), customerId);
            return CollaboratorResult.ok();
        } catch (Exception e) {
            return CollaboratorResult.failed(e);
        }
    }

    private static String tokenReference(Map<String, Object> additionalData) {
        if (additionalData == null) {
            return null;
        }
        String reference = stringValue(additionalData.get(STORED_PAYMENT_METHOD_ID));
        return reference != null ? reference : stringValue(additionalData.get(RECURRING_DETAIL_REFERENCE));
    }

    private static Map<String, Object> tokenDetails(GatewayResponse response, Map<String, Object> additionalData) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put(VaultPaymentTokenEntity.DETAIL_TYPE, response.getPaymentMethodDescriptor());
        putIfPresent(details, VaultPaymentTokenEntity.DETAIL_MASKED_CC, additionalData.get(CARD_SUMMARY));
        putIfPresent(details, VaultPaymentTokenEntity.DETAIL_EXPIRATION_DATE, additionalData.get(EXPIRY_DATE));
        putIfPresent(details, VaultPaymentTokenEntity.DETAIL_TOKEN_TYPE, additionalData.get(RECURRING_PROCESSING_MODEL));
        return details;
    }

    private static void putIfPresent(Map<String, Object> target, String key, Object value) {
        String text = stringValue(value);
        if (text != null) {
            target.put(key, text);
        }
    }

    private static String stringValue(Object value) {
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }
}
