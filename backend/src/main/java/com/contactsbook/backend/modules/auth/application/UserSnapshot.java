package com.contactsbook.backend.modules.auth.application;

import com.contactsbook.backend.modules.auth.domain.AppUser;
import com.contactsbook.backend.modules.auth.domain.UserRole;

/**
 * Credential-free view of a user, as cached under {@code user:<username>} and returned by access
 * token validation.
 */
public record UserSnapshot(
        Long id,
        String username,
        String email,
        boolean confirmed,
        String avatar,
        UserRole role
) {

    public static UserSnapshot from(AppUser user) {
        return new UserSnapshot(
                user.getId(),
                user.getUsername(),
                user.getEmail(),
                user.isConfirmed(),
                user.getAvatar(),
                user.getRole()
        );
    }
}
