package com.contactsbook.backend.modules.auth.domain;

public enum UserRole {
    STANDARD,
    ADMIN
}
