package com.contactsbook.backend.modules.auth.application;

/**
 * Out-of-band delivery of verification and password-reset tokens. The auth core only produces
 * tokens; rendering and transport belong to the implementation.
 */
public interface NotificationDispatcher {

    void sendEmailVerification(String email, String username, String verificationToken);

    void sendPasswordReset(String email, String resetToken);
}
