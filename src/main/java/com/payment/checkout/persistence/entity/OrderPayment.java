package com.payment.checkout.persistence.entity;

import com.payment.checkout.persistence.converter.JsonMapConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Payment record of an order. Gateway response data lands in {@code additionalInformation}.
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderPayment {

    /** Checkout payment method code (e.g. adyen_cc, adyen_hpp, adyen_cc_vault). */
    @Column(name = "payment_method_code")
    private String methodCode;

    @Column(name = "cc_trans_id")
    private String ccTransId;

    @Column(name = "last_trans_id")
    private String lastTransId;

    @Column(name = "transaction_id")
    private String transactionId;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "payment_additional_information", columnDefinition = "text")
    @Builder.Default
    private Map<String, Object> additionalInformation = new LinkedHashMap<>();

    public void putAdditionalInformation(String key, Object value) {
        if (additionalInformation == null) {
            additionalInformation = new LinkedHashMap<>();
        }
        additionalInformation.put(key, value);
    }

    public Object getAdditionalInformation(String key) {
        return additionalInformation != null ? additionalInformation.get(key) : null;
    }
}
