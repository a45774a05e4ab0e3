package com.payment.checkout.core;

import com.payment.checkout.domain.NormalizedResponse;
import com.payment.checkout.domain.ResultCode;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Turns a gateway result code into the response shape the storefront understands.
 * Unknown codes are reported as {@link ResultCode#ERROR} so they never reach the shopper.
 */
@Component
public class PaymentResponseNormalizer {

    public NormalizedResponse normalize(String resultCode) {
        return normalize(resultCode, null, null);
    }

    public NormalizedResponse normalize(String resultCode,
                                        Map<String, Object> action,
                                        Map<String, Object> additionalData) {
        ResultCode code = ResultCode.fromCode(resultCode).orElse(ResultCode.ERROR);
        switch (code) {
            case AUTHORISED:
            case REFUSED:
            case ERROR:
            case SUCCESS:
                return NormalizedResponse.builder()
                        .isFinal(true)
                        .resultCode(code)
                        .build();
            case REDIRECT_SHOPPER:
            case IDENTIFY_SHOPPER:
            case CHALLENGE_SHOPPER:
            case PENDING:
                return NormalizedResponse.builder()
                        .isFinal(false)
                        .resultCode(code)
                        .action(action)
                        .build();
            case PRESENT_TO_SHOPPER:
                return NormalizedResponse.builder()
                        .isFinal(true)
                        .resultCode(code)
                        .action(action)
                        .build();
            case RECEIVED:
                return NormalizedResponse.builder()
                        .isFinal(true)
                        .resultCode(code)
                        .additionalData(additionalData)
                        .build();
            default:
                // Cancelled has no storefront meaning of its own
                return NormalizedResponse.builder()
                        .isFinal(true)
                        .resultCode(ResultCode.ERROR)
                        .build();
        }
    }
}
