package com.payment.checkout.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * Payment gateway response to /payments or /payments/details, as handed to the
 * result processor. Only the fields the checkout flow acts on are modelled; the
 * rest of the gateway payload is ignored.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GatewayResponse {

    /** Result code of the payment (e.g. Authorised, Refused, RedirectShopper). */
    String resultCode;

    /** Result indicator sent on redirect returns; takes precedence over resultCode for bookkeeping. */
    String authResult;

    /** Shopper-facing action (redirect, 3DS2 challenge, voucher). Opaque to this service. */
    Map<String, Object> action;

    Map<String, Object> additionalData;

    /** Gateway transaction reference. */
    String pspReference;

    PaymentMethod paymentMethod;

    Map<String, Object> details;

    String donationToken;

    /**
     * Result indicator used for state-data cleanup and the order's durable result field.
     */
    @JsonIgnore
    public String getResultIndicator() {
        return authResult != null ? authResult : resultCode;
    }

    /**
     * Payment method brand, falling back to its type, or an empty string.
     */
    @JsonIgnore
    public String getPaymentMethodDescriptor() {
        if (paymentMethod == null) {
            return "";
        }
        if (paymentMethod.getBrand() != null) {
            return paymentMethod.getBrand();
        }
        return paymentMethod.getType() != null ? paymentMethod.getType() : "";
    }

    @JsonIgnore
    public boolean isEmpty() {
        return resultCode == null
                && authResult == null
                && isEmpty(action)
                && isEmpty(additionalData)
                && pspReference == null
                && paymentMethod == null
                && isEmpty(details)
                && donationToken == null;
    }

    private static boolean isEmpty(Map<String, Object> map) {
        return map == null || map.isEmpty();
    }

    @Value
    @Builder
    @Jacksonized
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class PaymentMethod {
        String brand;
        String type;
    }
}
