package com.contactsbook.backend.modules.auth.application;

/**
 * What access-token validation does when the denylist cannot be read.
 */
public enum DenylistFailurePolicy {

    /** Treat the token as not revoked and continue with signature and expiry checks. */
    FAIL_OPEN,

    /** Reject the token as revoked. */
    FAIL_CLOSED
}
