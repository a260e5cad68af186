package com.contactsbook.backend.modules.auth.presentation.dto;

import com.contactsbook.backend.modules.auth.application.UserSnapshot;
import com.contactsbook.backend.modules.auth.domain.AppUser;
import com.contactsbook.backend.modules.auth.domain.UserRole;

public record UserResponse(
        Long id,
        String username,
        String email,
        String avatar,
        UserRole role,
        boolean confirmed
) {

    public static UserResponse from(AppUser user) {
        return from(UserSnapshot.from(user));
    }

    public static UserResponse from(UserSnapshot user) {
        return new UserResponse(user.id(), user.username(), user.email(), user.avatar(), user.role(), user.confirmed());
    }
}
