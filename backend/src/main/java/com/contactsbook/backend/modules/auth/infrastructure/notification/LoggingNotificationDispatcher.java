package com.contactsbook.backend.modules.auth.infrastructure.notification;

import com.contactsbook.backend.modules.auth.application.NotificationDispatcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Records dispatch requests in the application log. Tokens are never written out; mail
 * delivery is provided by a separate transport.
 */
@Component
public class LoggingNotificationDispatcher implements NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationDispatcher.class);

    @Override
    public void sendEmailVerification(String email, String username, String verificationToken) {
        log.info("[notification] email verification requested recipient={} username={}", email, username);
    }

    @Override
    public void sendPasswordReset(String email, String resetToken) {
        log.info("[notification] password reset requested recipient={}", email);
    }
}
