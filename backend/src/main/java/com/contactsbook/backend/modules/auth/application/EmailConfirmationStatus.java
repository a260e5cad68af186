package com.contactsbook.backend.modules.auth.application;

public enum EmailConfirmationStatus {
    CONFIRMED,
    ALREADY_CONFIRMED,
    VERIFICATION_SENT
}
