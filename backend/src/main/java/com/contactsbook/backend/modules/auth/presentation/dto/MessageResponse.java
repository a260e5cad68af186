package com.contactsbook.backend.modules.auth.presentation.dto;

public record MessageResponse(String message) {
}
