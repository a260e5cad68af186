package com.contactsbook.backend.global.security;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

/**
 * Kept apart from {@link SecurityConfig}: the JWT filter depends on the auth service, which
 * needs the encoder.
 */
@Configuration
public class PasswordEncoderConfig {

    @Bean
    public PasswordEncoder passwordEncoder(@Value("${auth.password.bcrypt-strength:10}") int strength) {
        return new BCryptPasswordEncoder(strength);
    }
}
