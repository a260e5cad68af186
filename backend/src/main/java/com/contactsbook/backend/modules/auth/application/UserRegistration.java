package com.contactsbook.backend.modules.auth.application;

public record UserRegistration(String username, String email, String password) {
}
