package com.contactsbook.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Locale;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.MacAlgorithm;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Signing key and HMAC algorithm for issued tokens, both fixed at startup.
 * The secret is read as Base64 when it decodes, otherwise as raw UTF-8 bytes.
 */
@Component
public class JwtTokenProvider {

    private final MacAlgorithm algorithm;
    private final SecretKey secretKey;

    public JwtTokenProvider(
            @Value("${jwt.secret}") String secretString,
            @Value("${jwt.algorithm:HS256}") String algorithmName
    ) {
        if (secretString == null || secretString.isBlank()) {
            throw new IllegalStateException("jwt.secret must be configured");
        }
        this.algorithm = resolveAlgorithm(algorithmName);

        byte[] keyBytes;
        try {
            keyBytes = Base64.getDecoder().decode(secretString);
        } catch (IllegalArgumentException ex) {
            keyBytes = secretString.getBytes(StandardCharsets.UTF_8);
        }
        if (keyBytes.length * 8 < algorithm.getKeyBitLength()) {
            throw new IllegalStateException("jwt.secret is too short for " + algorithm.getId()
                    + ": at least " + algorithm.getKeyBitLength() / 8 + " bytes required");
        }
        this.secretKey = new SecretKeySpec(keyBytes, jcaName(algorithm));
    }

    public SecretKey getSecretKey() {
        return secretKey;
    }

    public MacAlgorithm getAlgorithm() {
        return algorithm;
    }

    private static MacAlgorithm resolveAlgorithm(String name) {
        String normalized = name == null ? "HS256" : name.trim().toUpperCase(Locale.ROOT);
        return switch (normalized) {
            case "HS256" -> Jwts.SIG.HS256;
            case "HS384" -> Jwts.SIG.HS384;
            case "HS512" -> Jwts.SIG.HS512;
            default -> throw new IllegalStateException("Unsupported jwt.algorithm: " + name);
        };
    }

    private static String jcaName(MacAlgorithm algorithm) {
        return "HmacSHA" + algorithm.getId().substring(2);
    }
}
