package com.contactsbook.backend.modules.auth.infrastructure.avatar;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Optional;

import com.contactsbook.backend.modules.auth.application.AvatarLookup;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Gravatar URL for an email: the MD5 of the trimmed, lower-cased address appended to the
 * Gravatar avatar endpoint.
 */
@Component
public class GravatarAvatarLookup implements AvatarLookup {

    private final String baseUrl;

    public GravatarAvatarLookup(@Value("${avatar.gravatar.base-url:https://www.gravatar.com/avatar/}") String baseUrl) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
    }

    @Override
    public Optional<String> lookup(String email) {
        if (email == null || email.isBlank()) {
            return Optional.empty();
        }
        String normalized = email.trim().toLowerCase(Locale.ROOT);
        return Optional.of(baseUrl + md5Hex(normalized));
    }

    private static String md5Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
