package com.contactsbook.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;

import org.hibernate.validator.constraints.URL;

public record UpdateAvatarRequest(
        @NotBlank(message = "avatar is required")
        @URL(message = "avatar must be a URL") String avatar
) {
}
