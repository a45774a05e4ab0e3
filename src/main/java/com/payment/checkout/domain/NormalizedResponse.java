package com.payment.checkout.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;
import lombok.Value;

import java.util.Map;

/**
 * Payment outcome as returned to the storefront. When {@code isFinal} is false the
 * storefront must perform {@code action} and submit the details again.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NormalizedResponse {

    // Lombok names the getter isFinal(), which Jackson would otherwise expose as "final"
    @JsonProperty("isFinal")
    @Getter(onMethod_ = @JsonProperty("isFinal"))
    boolean isFinal;

    ResultCode resultCode;

    Map<String, Object> action;

    Map<String, Object> additionalData;
}
