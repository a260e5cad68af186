package com.contactsbook.backend.global.security;

import com.contactsbook.backend.modules.auth.application.AuthException;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

public final class SecurityUtils {

    private SecurityUtils() {
    }

    public static JwtAuthenticationPrincipal getCurrentPrincipal() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !(authentication.getPrincipal() instanceof JwtAuthenticationPrincipal principal)) {
            throw AuthException.unauthorized("UNAUTHORIZED");
        }
        return principal;
    }
}
