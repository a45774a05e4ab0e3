package com.payment.checkout.core;

import com.payment.checkout.domain.NormalizedResponse;
import com.payment.checkout.domain.ResultCode;
import com.payment.checkout.persistence.entity.OrderEntity;
import com.payment.checkout.persistence.entity.OrderPayment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rebuilds the storefront payment response from what the last processed result stored on
 * the order's payment. Used by the storefront to poll after a redirect or a voucher.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderPaymentStatusService {

    private final PaymentResponseNormalizer normalizer;

    public NormalizedResponse getPaymentStatus(OrderEntity order) {
        OrderPayment payment = order.getPayment();
        Object resultCode = payment.getAdditionalInformation("resultCode");
        if (!(resultCode instanceof String) || ((String) resultCode).isEmpty()) {
            log.info("Payment of order={} has no result code yet", order.getIncrementId());
            return normalizer.normalize(ResultCode.ERROR.getCode());
        }
        return normalizer.normalize((String) resultCode,
                asMap(payment.getAdditionalInformation("action")),
                asMap(payment.getAdditionalInformation("additionalData")));
    }

    private static Map<String, Object> asMap(Object value) {
        if (!(value instanceof Map)) {
            return null;
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        ((Map<?, ?>) value).forEach((key, entry) -> copy.put(String.valueOf(key), entry));
        return copy;
    }
}
