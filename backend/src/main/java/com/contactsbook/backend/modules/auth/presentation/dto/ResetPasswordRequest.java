package com.contactsbook.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ResetPasswordRequest(
        @NotBlank(message = "newPassword is required")
        @Size(min = 6, max = 12, message = "newPassword must be 6-12 characters") String newPassword
) {
}
