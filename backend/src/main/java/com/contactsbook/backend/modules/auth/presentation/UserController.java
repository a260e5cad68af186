package com.contactsbook.backend.modules.auth.presentation;

import com.contactsbook.backend.global.error.ProblemException;
import com.contactsbook.backend.global.security.JwtAuthenticationPrincipal;
import com.contactsbook.backend.global.security.SecurityUtils;
import com.contactsbook.backend.global.web.ClientInfo;
import com.contactsbook.backend.global.web.ClientRateLimiter;
import com.contactsbook.backend.modules.auth.application.AuthErrorKind;
import com.contactsbook.backend.modules.auth.application.AuthException;
import com.contactsbook.backend.modules.auth.application.AuthService;
import com.contactsbook.backend.modules.auth.application.EmailConfirmationStatus;
import com.contactsbook.backend.modules.auth.presentation.dto.EmailRequest;
import com.contactsbook.backend.modules.auth.presentation.dto.MessageResponse;
import com.contactsbook.backend.modules.auth.presentation.dto.ResetPasswordRequest;
import com.contactsbook.backend.modules.auth.presentation.dto.UpdateAvatarRequest;
import com.contactsbook.backend.modules.auth.presentation.dto.UserResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/users")
@Tag(name = "users")
public class UserController {

    private static final Logger log = LoggerFactory.getLogger(UserController.class);

    private final AuthService authService;
    private final ClientRateLimiter meRateLimiter;

    public UserController(AuthService authService, ClientRateLimiter meRateLimiter) {
        this.authService = authService;
        this.meRateLimiter = meRateLimiter;
    }

    @GetMapping("/me")
    @Operation(summary = "Current user resolved from the bearer token")
    public ResponseEntity<UserResponse> me(HttpServletRequest request) {
        String ipAddress = ClientInfo.from(request).ipAddress();
        if (!meRateLimiter.allow(ipAddress)) {
            log.warn("Rate limit exceeded on /users/me ip={}", ipAddress);
            throw new ProblemException(HttpStatus.TOO_MANY_REQUESTS, "RATE_LIMITED", "Too many requests");
        }
        return ResponseEntity.ok(UserResponse.from(SecurityUtils.getCurrentPrincipal().user()));
    }

    /**
     * A token naming an address with no account is a bad request, not a missing resource.
     */
    @GetMapping("/confirmed_email/{token}")
    public ResponseEntity<MessageResponse> confirmEmail(@PathVariable("token") String token) {
        EmailConfirmationStatus status;
        try {
            status = authService.confirmEmail(token);
        } catch (AuthException ex) {
            if (ex.getKind() != AuthErrorKind.NOT_FOUND) {
                throw ex;
            }
            throw new ProblemException(HttpStatus.BAD_REQUEST, ex.getCode(), "Verification error", ex);
        }
        String message = status == EmailConfirmationStatus.ALREADY_CONFIRMED
                ? "Your email is already confirmed"
                : "Email confirmed successfully";
        return ResponseEntity.ok(new MessageResponse(message));
    }

    @PostMapping("/request_email")
    public ResponseEntity<MessageResponse> requestEmail(@Valid @RequestBody EmailRequest request) {
        EmailConfirmationStatus status = authService.requestEmailVerification(request.email());
        String message = status == EmailConfirmationStatus.ALREADY_CONFIRMED
                ? "Your email is already confirmed"
                : "Verification email sent successfully";
        return ResponseEntity.ok(new MessageResponse(message));
    }

    @PatchMapping("/avatar")
    @Operation(summary = "Replace the avatar URL of the current (admin) user")
    public ResponseEntity<UserResponse> updateAvatar(@Valid @RequestBody UpdateAvatarRequest request) {
        JwtAuthenticationPrincipal principal = SecurityUtils.getCurrentPrincipal();
        return ResponseEntity.ok(UserResponse.from(authService.updateAvatar(principal.user().email(), request.avatar())));
    }

    /**
     * Answers the same way whether or not the address is registered.
     */
    @PostMapping("/request-password-reset")
    public ResponseEntity<MessageResponse> requestPasswordReset(@Valid @RequestBody EmailRequest request) {
        try {
            authService.requestPasswordReset(request.email());
        } catch (AuthException ex) {
            if (ex.getKind() != AuthErrorKind.NOT_FOUND) {
                throw ex;
            }
            log.debug("Password reset requested for an unknown address");
        }
        return ResponseEntity.ok(new MessageResponse("Password reset email sent successfully"));
    }

    @PostMapping("/reset-password/{token}")
    public ResponseEntity<MessageResponse> resetPassword(@PathVariable("token") String token,
                                                         @Valid @RequestBody ResetPasswordRequest request) {
        try {
            authService.resetPasswordWithToken(token, request.newPassword());
        } catch (AuthException ex) {
            if (ex.getKind() != AuthErrorKind.INVALID_TOKEN && ex.getKind() != AuthErrorKind.NOT_FOUND) {
                throw ex;
            }
            throw new ProblemException(HttpStatus.BAD_REQUEST, ex.getCode(), "Invalid or expired token", ex);
        }
        return ResponseEntity.ok(new MessageResponse("Password reset successfully"));
    }
}
