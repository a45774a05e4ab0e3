package com.payment.checkout.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Result codes returned by the payment gateway on /payments and /payments/details.
 * Codes are matched exactly (case-sensitive) against the gateway's wire value.
 */
public enum ResultCode {
    AUTHORISED("Authorised", false),
    REFUSED("Refused", false),
    /** Shopper must be redirected (3DS1, hosted pages, wallets). */
    REDIRECT_SHOPPER("RedirectShopper", true),
    /** 3DS2 device fingerprinting. */
    IDENTIFY_SHOPPER("IdentifyShopper", true),
    /** 3DS2 challenge. */
    CHALLENGE_SHOPPER("ChallengeShopper", true),
    RECEIVED("Received", false),
    PENDING("Pending", true),
    /** Voucher / QR code to show to the shopper. */
    PRESENT_TO_SHOPPER("PresentToShopper", false),
    ERROR("Error", false),
    CANCELLED("Cancelled", false),
    /** Point-of-sale terminal success. */
    SUCCESS("Success", false);

    private static final Map<String, ResultCode> BY_CODE = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(ResultCode::getCode, Function.identity()));

    private final String code;
    private final boolean actionRequired;

    ResultCode(String code, boolean actionRequired) {
        this.code = code;
        this.actionRequired = actionRequired;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * True when the shopper still has to act before the payment outcome is final.
     */
    public boolean isActionRequired() {
        return actionRequired;
    }

    public static Optional<ResultCode> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_CODE.get(code));
    }

    /**
     * Membership test over raw gateway strings. Null and unknown codes are not action-required.
     */
    public static boolean isActionRequired(String code) {
        return fromCode(code).map(resultCode -> resultCode.isActionRequired()).orElse(false);
    }
}
