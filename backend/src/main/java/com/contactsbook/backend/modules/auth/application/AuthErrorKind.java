package com.contactsbook.backend.modules.auth.application;

import org.springframework.http.HttpStatus;

/**
 * Failure taxonomy of the authentication core. Every {@link AuthException} carries exactly one
 * kind so callers can switch over the outcome instead of parsing messages.
 */
public enum AuthErrorKind {

    /** Bad credentials, unconfirmed email, or a token whose subject no longer resolves. */
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED),

    /** Username or email already taken at registration. */
    CONFLICT(HttpStatus.CONFLICT),

    /** Unknown user in the email-keyed password and confirmation flows. */
    NOT_FOUND(HttpStatus.NOT_FOUND),

    /** Malformed, forged, expired or wrongly typed token, or an inactive refresh token. */
    INVALID_TOKEN(HttpStatus.UNAUTHORIZED),

    /** Access token present in the denylist. */
    REVOKED(HttpStatus.UNAUTHORIZED);

    private final HttpStatus status;

    AuthErrorKind(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
