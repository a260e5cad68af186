package com.contactsbook.backend.modules.auth.presentation.dto;

public record LogoutRequest(String refreshToken) {
}
