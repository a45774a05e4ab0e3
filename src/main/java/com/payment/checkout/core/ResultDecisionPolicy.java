package com.payment.checkout.core;

import com.payment.checkout.core.ResultDecision.FollowUp;
import com.payment.checkout.domain.ResultCode;
import org.springframework.stereotype.Component;

/**
 * Maps a gateway result code (and the payment method it came from) to a {@link ResultDecision}.
 * Pure: no collaborator is touched here.
 */
@Component
public class ResultDecisionPolicy {

    static final String BANK_TRANSFER_COMMENT = "<br /><br />Waiting for the customer to transfer the money.";
    static final String DIRECT_DEBIT_COMMENT = "<br /><br />This request will be sent to the bank at the end of the day.";
    static final String AWAITING_WEBHOOK_COMMENT = "<br /><br />The payment result is not confirmed (yet)."
            + "<br />Once the payment is authorised, the order status will be updated accordingly."
            + "<br />If the order is stuck on this status, the payment can be seen as unsuccessful."
            + "<br />The order can be automatically cancelled based on the OFFER_CLOSED notification."
            + " Please contact gateway support to enable this.";

    private static final String BANK_TRANSFER = "bankTransfer";
    private static final String SEPA_DIRECT_DEBIT = "sepadirectdebit";
    private static final String ALIPAY_HK = "alipay_hk";

    public ResultDecision decide(String resultCode, String paymentMethod) {
        ResultCode code = ResultCode.fromCode(resultCode).orElse(null);
        if (code == null) {
            return ResultDecision.of(false, FollowUp.REPORT_UNRECOGNISED);
        }
        String method = paymentMethod != null ? paymentMethod : "";
        switch (code) {
            case AUTHORISED:
                return ResultDecision.of(true, FollowUp.RECORD_TRANSACTION);
            case PENDING:
                return ResultDecision.of(true, FollowUp.AWAIT_NOTIFICATION, pendingComment(method));
            case PRESENT_TO_SHOPPER:
            case IDENTIFY_SHOPPER:
            case CHALLENGE_SHOPPER:
            case REDIRECT_SHOPPER:
                return ResultDecision.of(true, FollowUp.NONE);
            case RECEIVED:
                // Alipay HK reports Received before the shopper has paid
                return ResultDecision.of(!method.contains(ALIPAY_HK), FollowUp.NONE);
            case REFUSED:
            case CANCELLED:
                return ResultDecision.of(false, FollowUp.CANCEL_ORDER);
            default:
                return ResultDecision.of(false, FollowUp.REPORT_UNRECOGNISED);
        }
    }

    private static String pendingComment(String method) {
        if (method.contains(BANK_TRANSFER)) {
            return BANK_TRANSFER_COMMENT;
        }
        if (method.equals(SEPA_DIRECT_DEBIT)) {
            return DIRECT_DEBIT_COMMENT;
        }
        return AWAITING_WEBHOOK_COMMENT;
    }
}
