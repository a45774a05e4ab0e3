package com.payment.checkout.core;

import java.util.Optional;

/**
 * Outcome of a best-effort collaborator call. Collaborators report failures through
 * this value instead of throwing; the caller decides how to log them.
 */
public final class CollaboratorResult {

    private static final CollaboratorResult OK = new CollaboratorResult(null);

    private final Exception error;

    private CollaboratorResult(Exception error) {
        this.error = error;
    }

    public static CollaboratorResult ok() {
        return OK;
    }

    public static CollaboratorResult failed(Exception error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null for a failed result");
        }
        return new CollaboratorResult(error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public Optional<Exception> getError() {
        return Optional.ofNullable(error);
    }

    /** Error message for logging, or null when successful. */
    public String getErrorMessage() {
        return error != null ? error.getMessage() : null;
    }

    @Override
    public String toString() {
        return isSuccess() ? "CollaboratorResult[ok]" : "CollaboratorResult[failed: " + error + "]";
    }
}
