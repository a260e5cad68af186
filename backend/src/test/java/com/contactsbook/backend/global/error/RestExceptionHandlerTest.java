package com.contactsbook.backend.global.error;

import static org.assertj.core.api.Assertions.assertThat;

import com.contactsbook.backend.modules.auth.application.AuthException;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;

class RestExceptionHandlerTest {

    private final RestExceptionHandler handler = new RestExceptionHandler();
    private final MockHttpServletRequest request = new MockHttpServletRequest("POST", "/auth/signup");

    @Test
    void authFailureKeepsItsCodeAndStatus() {
        ResponseEntity<ProblemResponse> response =
                handler.handleProblemException(AuthException.conflict("USERNAME_TAKEN", "User already exists"), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getHeaders().getContentType()).isEqualTo(MediaType.APPLICATION_PROBLEM_JSON);
        ProblemResponse body = response.getBody();
        assertThat(body).isNotNull();
        assertThat(body.code()).isEqualTo("USERNAME_TAKEN");
        assertThat(body.type()).isEqualTo("urn:problem:contactsbook:username_taken");
        assertThat(body.detail()).isEqualTo("User already exists");
        assertThat(body.instance()).isEqualTo("/auth/signup");
    }

    @Test
    void revokedTokenIsUnauthorized() {
        ResponseEntity<ProblemResponse> response = handler.handleProblemException(AuthException.revoked(), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(response.getBody().code()).isEqualTo("TOKEN_REVOKED");
    }

    @Test
    void unexpectedFailureHidesDetails() {
        ResponseEntity<ProblemResponse> response =
                handler.handleGenericException(new IllegalStateException("connection string leaked"), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().detail()).doesNotContain("connection string");
    }
}
