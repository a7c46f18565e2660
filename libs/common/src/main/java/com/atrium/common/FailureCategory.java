package com.atrium.common;

/**
 * Coarse classification of every Atrium failure.
 *
 * <p>A transport adapter maps categories to responses without knowing individual exception
 * types: client-correctable failures, authorization failures and not-found are always
 * distinguishable.
 */
public enum FailureCategory {

    /** The caller supplied a value that can never be accepted (e.g. a name with no usable characters). */
    INVALID_INPUT(true),

    /** The request collides with existing state (duplicate slug, duplicate email, live resource). */
    CONFLICT(true),

    /** The caller could not be identified: missing header, bad or expired token, wrong password. */
    AUTHENTICATION(true),

    /** The caller is identified but does not own the target. */
    AUTHORIZATION(false),

    /** The target organization does not exist. */
    NOT_FOUND(false),

    /** Server-side state is damaged or an operation was cut short. */
    INTERNAL(false);

    private final boolean clientCorrectable;

    FailureCategory(boolean clientCorrectable) {
        this.clientCorrectable = clientCorrectable;
    }

    /**
     * Whether the caller can fix the failure by changing its input or credentials.
     */
    public boolean isClientCorrectable() {
        return clientCorrectable;
    }
}
