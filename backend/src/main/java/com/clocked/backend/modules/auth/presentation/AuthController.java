package com.clocked.backend.modules.auth.presentation;

import com.clocked.backend.global.security.JwtAuthenticationPrincipal;
import com.clocked.backend.global.web.RequestRateLimiter;
import com.clocked.backend.modules.auth.application.AuthService;
import com.clocked.backend.modules.auth.application.MagicLinkIssuer;
import com.clocked.backend.modules.auth.presentation.dto.LoginResponse;
import com.clocked.backend.modules.auth.presentation.dto.LogoutRequest;
import com.clocked.backend.modules.auth.presentation.dto.MagicLinkRequest;
import com.clocked.backend.modules.auth.presentation.dto.MagicLinkRequestedResponse;
import com.clocked.backend.modules.auth.presentation.dto.MagicLinkVerifyRequest;
import com.clocked.backend.modules.auth.presentation.dto.RefreshRequest;
import com.clocked.backend.modules.auth.presentation.dto.UserProfileResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Auth")
public class AuthController {

    private final AuthService authService;
    private final MagicLinkIssuer magicLinkIssuer;
    private final RequestRateLimiter magicLinkRateLimiter;

    public AuthController(
            AuthService authService,
            MagicLinkIssuer magicLinkIssuer,
            @Qualifier("magicLinkRateLimiter") RequestRateLimiter magicLinkRateLimiter
    ) {
        this.authService = authService;
        this.magicLinkIssuer = magicLinkIssuer;
        this.magicLinkRateLimiter = magicLinkRateLimiter;
    }

    @PostMapping("/auth/magic-link")
    @Operation(summary = "Request a magic link", description = "Rate limited per client address. Returns 404 for unknown emails.")
    public ResponseEntity<MagicLinkRequestedResponse> requestMagicLink(
            @Valid @RequestBody MagicLinkRequest request,
            HttpServletRequest servletRequest
    ) {
        magicLinkRateLimiter.acquire(servletRequest.getRemoteAddr());
        authService.requestMagicLink(request);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(new MagicLinkRequestedResponse("Magic link sent to your email", magicLinkIssuer.getTtl().toSeconds()));
    }

    @PostMapping("/auth/magic-link/verify")
    @Operation(summary = "Exchange a magic link for a token pair")
    public ResponseEntity<LoginResponse> verifyMagicLink(@Valid @RequestBody MagicLinkVerifyRequest request) {
        return ResponseEntity.ok(authService.verifyMagicLink(request));
    }

    @PostMapping("/auth/refresh")
    @Operation(summary = "Rotate a refresh token", description = "The presented refresh token is revoked; reuse fails with 401.")
    public ResponseEntity<LoginResponse> refresh(@Valid @RequestBody RefreshRequest request) {
        return ResponseEntity.ok(authService.refresh(request));
    }

    @PostMapping("/auth/logout")
    public ResponseEntity<Void> logout(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @Valid @RequestBody LogoutRequest request
    ) {
        authService.logout(principal.userId(), request);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/auth/logout-all")
    @Operation(summary = "Revoke every refresh token of the caller")
    public ResponseEntity<Void> logoutEverywhere(@AuthenticationPrincipal JwtAuthenticationPrincipal principal) {
        authService.logoutEverywhere(principal.userId());
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/auth/me")
    public ResponseEntity<UserProfileResponse> currentUser(@AuthenticationPrincipal JwtAuthenticationPrincipal principal) {
        return ResponseEntity.ok(authService.loadProfile(principal.userId()));
    }
}
