package dev.blogplatform.controller;

import dev.blogplatform.dto.AuthResponse;
import dev.blogplatform.dto.ChangePasswordRequest;
import dev.blogplatform.dto.ForgotPasswordRequest;
import dev.blogplatform.dto.MessageResponse;
import dev.blogplatform.dto.ResetPasswordRequest;
import dev.blogplatform.dto.SigninRequest;
import dev.blogplatform.dto.SignupRequest;
import dev.blogplatform.dto.UserResponse;
import dev.blogplatform.security.AuthenticatedUser;
import dev.blogplatform.service.AuthService;
import dev.blogplatform.service.PasswordResetService;
import dev.blogplatform.service.UserService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/auth")
@RequiredArgsConstructor
@Tag(name = "Authentication", description = "Sign-up, sign-in and password management")
@Slf4j
public class AuthController {

    static final String RESET_REQUESTED_MESSAGE = "If the email exists, a password reset link has been sent";
    static final String PASSWORD_RESET_MESSAGE = "Password has been reset successfully";
    static final String PASSWORD_CHANGED_MESSAGE = "Password changed successfully";

    private final AuthService authService;
    private final PasswordResetService passwordResetService;
    private final UserService userService;

    @PostMapping("/signup")
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Register a new user", description = "Creates the account and returns an access token")
    public Mono<AuthResponse> signup(@Valid @RequestBody SignupRequest request) {
        log.debug("Signup attempt for username={}", request.username());
        return authService.register(request);
    }

    @PostMapping("/signin")
    @Operation(summary = "Sign in", description = "Exchanges email and password for an access token")
    public Mono<AuthResponse> signin(@Valid @RequestBody SigninRequest request) {
        return authService.signin(request);
    }

    @PostMapping("/forgot-password")
    @Operation(summary = "Request a password reset", description = "Always answers the same, whether or not the email is registered")
    public Mono<MessageResponse> forgotPassword(@Valid @RequestBody ForgotPasswordRequest request) {
        return passwordResetService.requestPasswordReset(request.email())
                .thenReturn(MessageResponse.of(RESET_REQUESTED_MESSAGE));
    }

    @PostMapping("/reset-password")
    @Operation(summary = "Reset password", description = "Sets a new password using a reset token")
    public Mono<MessageResponse> resetPassword(@Valid @RequestBody ResetPasswordRequest request) {
        return passwordResetService.resetPassword(request.token(), request.newPassword())
                .thenReturn(MessageResponse.of(PASSWORD_RESET_MESSAGE));
    }

    @PostMapping("/change-password")
    @Operation(summary = "Change password", security = @SecurityRequirement(name = "bearerAuth"))
    public Mono<MessageResponse> changePassword(@AuthenticationPrincipal AuthenticatedUser principal,
                                                @Valid @RequestBody ChangePasswordRequest request) {
        return authService.changePassword(principal.userId(), request)
                .thenReturn(MessageResponse.of(PASSWORD_CHANGED_MESSAGE));
    }

    @GetMapping("/me")
    @Operation(summary = "Current user profile", security = @SecurityRequirement(name = "bearerAuth"))
    public Mono<UserResponse> me(@AuthenticationPrincipal AuthenticatedUser principal) {
        return userService.getCurrentUser(principal.userId());
    }
}
