package com.contactsbook.backend.global.security;

import com.contactsbook.backend.modules.auth.application.UserSnapshot;

/**
 * Principal stored in the security context once a bearer token validates.
 */
public record JwtAuthenticationPrincipal(UserSnapshot user) {

    public Long userId() {
        return user.id();
    }

    public String username() {
        return user.username();
    }
}
