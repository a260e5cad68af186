package com.contactsbook.backend.global.web;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;

/**
 * Caller provenance recorded with refresh tokens. Informational only, never used for
 * authorization decisions.
 */
public record ClientInfo(String ipAddress, String userAgent) {

    static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";

    public static ClientInfo from(HttpServletRequest request) {
        return new ClientInfo(resolveIpAddress(request), request.getHeader(HttpHeaders.USER_AGENT));
    }

    static String resolveIpAddress(HttpServletRequest request) {
        String forwardedFor = request.getHeader(FORWARDED_FOR_HEADER);
        if (StringUtils.hasText(forwardedFor)) {
            int comma = forwardedFor.indexOf(',');
            return (comma >= 0 ? forwardedFor.substring(0, comma) : forwardedFor).trim();
        }
        return request.getRemoteAddr();
    }
}
