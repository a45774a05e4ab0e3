package com.payment.checkout.core;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * What the processor must do for one result code: the outcome reported to the caller,
 * the order follow-up to run, and any text appended to the order comment.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ResultDecision {

    public enum FollowUp {
        /** Nothing beyond logging. */
        NONE,
        /** Store the PSP reference as transaction id and disable the quote. */
        RECORD_TRANSACTION,
        /** Advance the order to new and wait for the webhook. */
        AWAIT_NOTIFICATION,
        CANCEL_ORDER,
        /** Result code the flow does not know how to handle. */
        REPORT_UNRECOGNISED
    }

    boolean success;
    FollowUp followUp;
    /** Appended to the history comment; empty when there is nothing to add. */
    String commentSuffix;

    static ResultDecision of(boolean success, FollowUp followUp) {
        return new ResultDecision(success, followUp, "");
    }

    static ResultDecision of(boolean success, FollowUp followUp, String commentSuffix) {
        return new ResultDecision(success, followUp, commentSuffix);
    }
}
