package com.contactsbook.backend.modules.auth.presentation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.Map;

import com.contactsbook.backend.modules.auth.application.AuthService;
import com.contactsbook.backend.modules.auth.domain.AppUser;
import com.contactsbook.backend.modules.auth.domain.UserRole;
import com.contactsbook.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.contactsbook.backend.support.AbstractContainerIntegrationTest;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
class AuthFlowIntegrationTest extends AbstractContainerIntegrationTest {

    private static final String PASSWORD = "pw123456";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private AuthService authService;

    @Autowired
    private AppUserRepository appUserRepository;

    @Test
    void signupConfirmLoginRefreshLogout() throws Exception {
        signupAndConfirm("alice", "alice@example.com");

        JsonNode tokens = login("alice", PASSWORD);
        String accessToken = tokens.path("accessToken").asText();
        String refreshToken = tokens.path("refreshToken").asText();
        assertThat(tokens.path("tokenType").asText()).isEqualTo("Bearer");
        assertThat(tokens.path("expiresIn").asLong()).isEqualTo(15 * 60);

        mockMvc.perform(get("/users/me").header("Authorization", "Bearer " + accessToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.username").value("alice"))
                .andExpect(jsonPath("$.confirmed").value(true));

        JsonNode rotated = readJson(mockMvc.perform(post("/auth/refresh")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("refreshToken", refreshToken))))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString());
        String rotatedRefresh = rotated.path("refreshToken").asText();
        assertThat(rotatedRefresh).isNotEqualTo(refreshToken);

        mockMvc.perform(post("/auth/refresh")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("refreshToken", refreshToken))))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_REFRESH_TOKEN"));

        mockMvc.perform(post("/auth/logout")
                        .header("Authorization", "Bearer " + accessToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("refreshToken", rotatedRefresh))))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/users/me").header("Authorization", "Bearer " + accessToken))
                .andExpect(status().isUnauthorized())
                .andExpect(header().string("WWW-Authenticate", "Bearer"))
                .andExpect(jsonPath("$.code").value("TOKEN_REVOKED"));

        mockMvc.perform(post("/auth/refresh")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("refreshToken", rotatedRefresh))))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void duplicateSignupConflictsAndUnconfirmedLoginFails() throws Exception {
        mockMvc.perform(post("/auth/signup")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("username", "bob", "email", "bob@example.com", "password", PASSWORD))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.confirmed").value(false));

        mockMvc.perform(post("/auth/signup")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("username", "bob", "email", "bob2@example.com", "password", PASSWORD))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("USERNAME_TAKEN"));

        mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("username", "bob", "password", PASSWORD))))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_CREDENTIALS"));
    }

    @Test
    void passwordResetInvalidatesOldPassword() throws Exception {
        signupAndConfirm("carol", "carol@example.com");

        mockMvc.perform(post("/users/request-password-reset")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("email", "nobody@example.com"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Password reset email sent successfully"));

        String resetToken = authService.createPasswordResetToken("carol@example.com");
        mockMvc.perform(post("/users/reset-password/{token}", resetToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("newPassword", "newpass1"))))
                .andExpect(status().isOk());

        mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("username", "carol", "password", PASSWORD))))
                .andExpect(status().isUnauthorized());
        login("carol", "newpass1");
    }

    @Test
    void onlyAdminsMayChangeAvatar() throws Exception {
        signupAndConfirm("dave", "dave@example.com");
        String standardToken = login("dave", PASSWORD).path("accessToken").asText();
        String body = json(Map.of("avatar", "https://cdn.example.com/dave.png"));

        mockMvc.perform(patch("/users/avatar")
                        .header("Authorization", "Bearer " + standardToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isForbidden());

        AppUser dave = appUserRepository.findByUsername("dave").orElseThrow();
        dave.setRole(UserRole.ADMIN);
        appUserRepository.save(dave);
        String adminToken = login("dave", PASSWORD).path("accessToken").asText();

        mockMvc.perform(patch("/users/avatar")
                        .header("Authorization", "Bearer " + adminToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.avatar").value("https://cdn.example.com/dave.png"));
    }

    private void signupAndConfirm(String username, String email) throws Exception {
        mockMvc.perform(post("/auth/signup")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("username", username, "email", email, "password", PASSWORD))))
                .andExpect(status().isCreated());

        String verificationToken = authService.createEmailVerificationToken(email);
        mockMvc.perform(get("/users/confirmed_email/{token}", verificationToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Email confirmed successfully"));
    }

    private JsonNode login(String username, String password) throws Exception {
        return readJson(mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("username", username, "password", password))))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString());
    }

    private String json(Object body) throws Exception {
        return objectMapper.writeValueAsString(body);
    }

    private JsonNode readJson(String content) throws Exception {
        return objectMapper.readTree(content);
    }
}
