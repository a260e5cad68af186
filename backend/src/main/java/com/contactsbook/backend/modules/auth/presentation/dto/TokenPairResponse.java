package com.contactsbook.backend.modules.auth.presentation.dto;

import com.contactsbook.backend.modules.auth.application.TokenPair;

public record TokenPairResponse(
        String accessToken,
        String tokenType,
        long expiresIn,
        String refreshToken,
        long refreshExpiresIn
) {
    public static final String DEFAULT_TOKEN_TYPE = "Bearer";

    public static TokenPairResponse from(TokenPair tokens) {
        return new TokenPairResponse(
                tokens.accessToken(),
                DEFAULT_TOKEN_TYPE,
                tokens.accessTokenTtl().toSeconds(),
                tokens.refreshToken(),
                tokens.refreshTokenTtl().toSeconds()
        );
    }
}
