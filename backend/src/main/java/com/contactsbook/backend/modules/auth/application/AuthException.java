package com.contactsbook.backend.modules.auth.application;

import com.contactsbook.backend.global.error.ProblemException;

public class AuthException extends ProblemException {

    private final AuthErrorKind kind;

    public AuthException(AuthErrorKind kind, String code) {
        this(kind, code, null, null);
    }

    public AuthException(AuthErrorKind kind, String code, String detail) {
        this(kind, code, detail, null);
    }

    public AuthException(AuthErrorKind kind, String code, String detail, Throwable cause) {
        super(kind.status(), code, detail, cause);
        this.kind = kind;
    }

    public AuthErrorKind getKind() {
        return kind;
    }

    public static AuthException unauthorized(String code) {
        return new AuthException(AuthErrorKind.UNAUTHORIZED, code);
    }

    public static AuthException conflict(String code, String detail) {
        return new AuthException(AuthErrorKind.CONFLICT, code, detail);
    }

    public static AuthException notFound(String code) {
        return new AuthException(AuthErrorKind.NOT_FOUND, code);
    }

    public static AuthException invalidToken(String code) {
        return new AuthException(AuthErrorKind.INVALID_TOKEN, code);
    }

    public static AuthException invalidToken(String code, Throwable cause) {
        return new AuthException(AuthErrorKind.INVALID_TOKEN, code, null, cause);
    }

    public static AuthException revoked() {
        return new AuthException(AuthErrorKind.REVOKED, "TOKEN_REVOKED");
    }
}
