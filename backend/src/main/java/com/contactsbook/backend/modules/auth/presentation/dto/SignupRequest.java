package com.contactsbook.backend.modules.auth.presentation.dto;

import com.contactsbook.backend.modules.auth.application.UserRegistration;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record SignupRequest(
        @NotBlank(message = "username is required")
        @Size(min = 2, max = 50, message = "username must be 2-50 characters") String username,
        @NotBlank(message = "email is required")
        @Email(message = "email must be a valid address") String email,
        @NotBlank(message = "password is required")
        @Size(min = 6, max = 12, message = "password must be 6-12 characters") String password
) {

    public UserRegistration toRegistration() {
        return new UserRegistration(username, email, password);
    }
}
