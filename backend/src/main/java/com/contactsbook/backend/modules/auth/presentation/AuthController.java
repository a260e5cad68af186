package com.contactsbook.backend.modules.auth.presentation;

import com.contactsbook.backend.global.security.JwtAuthenticationFilter;
import com.contactsbook.backend.global.web.ClientInfo;
import com.contactsbook.backend.modules.auth.application.AuthService;
import com.contactsbook.backend.modules.auth.domain.AppUser;
import com.contactsbook.backend.modules.auth.presentation.dto.LoginRequest;
import com.contactsbook.backend.modules.auth.presentation.dto.LogoutRequest;
import com.contactsbook.backend.modules.auth.presentation.dto.RefreshRequest;
import com.contactsbook.backend.modules.auth.presentation.dto.SignupRequest;
import com.contactsbook.backend.modules.auth.presentation.dto.TokenPairResponse;
import com.contactsbook.backend.modules.auth.presentation.dto.UserResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "auth")
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @PostMapping("/auth/signup")
    @Operation(summary = "Register a new account")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Account created, verification email dispatched"),
            @ApiResponse(responseCode = "409", description = "Username or email already taken")
    })
    public ResponseEntity<UserResponse> signup(@Valid @RequestBody SignupRequest request) {
        AppUser user = authService.register(request.toRegistration());
        return ResponseEntity.status(HttpStatus.CREATED).body(UserResponse.from(user));
    }

    @PostMapping("/auth/login")
    @Operation(summary = "Exchange credentials for an access / refresh token pair")
    public ResponseEntity<TokenPairResponse> login(@Valid @RequestBody LoginRequest request,
                                                   HttpServletRequest httpRequest) {
        ClientInfo client = ClientInfo.from(httpRequest);
        return ResponseEntity.ok(TokenPairResponse.from(
                authService.login(request.username(), request.password(), client.ipAddress(), client.userAgent())));
    }

    @PostMapping("/auth/refresh")
    @Operation(summary = "Rotate a refresh token into a new token pair")
    public ResponseEntity<TokenPairResponse> refresh(@Valid @RequestBody RefreshRequest request,
                                                     HttpServletRequest httpRequest) {
        ClientInfo client = ClientInfo.from(httpRequest);
        return ResponseEntity.ok(TokenPairResponse.from(
                authService.refresh(request.refreshToken(), client.ipAddress(), client.userAgent())));
    }

    @PostMapping("/auth/logout")
    @Operation(summary = "Revoke the presented access token and refresh token")
    public ResponseEntity<Void> logout(@RequestBody(required = false) LogoutRequest request,
                                       HttpServletRequest httpRequest) {
        String accessToken = JwtAuthenticationFilter.resolveBearerToken(httpRequest);
        authService.logout(accessToken, request != null ? request.refreshToken() : null);
        return ResponseEntity.noContent().build();
    }
}
