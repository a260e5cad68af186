package com.contactsbook.backend.global.security;

import java.io.IOException;

import com.contactsbook.backend.global.error.ProblemResponse;
import com.contactsbook.backend.modules.auth.application.AuthException;

import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

@Component
public class RestAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final ObjectMapper objectMapper;

    public RestAuthenticationEntryPoint(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException authException)
            throws IOException {
        String code = "UNAUTHORIZED";
        String detail = authException.getMessage();
        if (request.getAttribute(JwtAuthenticationFilter.AUTH_FAILURE_ATTRIBUTE) instanceof AuthException failure) {
            code = failure.getCode();
            detail = failure.getDetailMessage();
        }
        ProblemResponse body = ProblemResponse.of(HttpStatus.UNAUTHORIZED, code, detail, request.getRequestURI());

        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setHeader("WWW-Authenticate", "Bearer");
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }
}
