package com.clocked.backend.modules.auth.application;

import java.util.Locale;
import java.util.Map;
import java.util.UUID;

import com.clocked.backend.global.error.ProblemException;
import com.clocked.backend.modules.audit.application.AuditLogService;
import com.clocked.backend.modules.auth.domain.UserAccount;
import com.clocked.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.clocked.backend.modules.auth.presentation.dto.LoginResponse;
import com.clocked.backend.modules.auth.presentation.dto.LogoutRequest;
import com.clocked.backend.modules.auth.presentation.dto.MagicLinkRequest;
import com.clocked.backend.modules.auth.presentation.dto.MagicLinkVerifyRequest;
import com.clocked.backend.modules.auth.presentation.dto.RefreshRequest;
import com.clocked.backend.modules.auth.presentation.dto.TokenPairResponse;
import com.clocked.backend.modules.auth.presentation.dto.UserProfileResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    public static final String INVALID_MAGIC_LINK = "INVALID_MAGIC_LINK";
    public static final String INVALID_REFRESH_TOKEN = "INVALID_REFRESH_TOKEN";
    public static final String USER_NOT_FOUND = "USER_NOT_FOUND";

    static final String ACTION_USER_CREATED = "USER_CREATED";
    static final String ACTION_LOGIN = "AUTH_LOGIN";
    static final String ACTION_TOKEN_REFRESH = "AUTH_TOKEN_REFRESH";
    static final String ACTION_LOGOUT = "AUTH_LOGOUT";
    static final String ACTION_LOGOUT_ALL = "AUTH_LOGOUT_ALL";

    private static final int HANDLE_SUFFIX_LENGTH = 6;
    private static final int HANDLE_PREFIX_MAX_LENGTH = 40;
    private static final int HANDLE_ATTEMPTS = 5;

    private final MagicLinkIssuer magicLinkIssuer;
    private final TokenAuthority tokenAuthority;
    private final UserAccountRepository userAccountRepository;
    private final AuditLogService auditLogService;
    private final SecureTokenGenerator tokenGenerator;

    public AuthService(
            MagicLinkIssuer magicLinkIssuer,
            TokenAuthority tokenAuthority,
            UserAccountRepository userAccountRepository,
            AuditLogService auditLogService,
            SecureTokenGenerator tokenGenerator
    ) {
        this.magicLinkIssuer = magicLinkIssuer;
        this.tokenAuthority = tokenAuthority;
        this.userAccountRepository = userAccountRepository;
        this.auditLogService = auditLogService;
        this.tokenGenerator = tokenGenerator;
    }

    public void requestMagicLink(MagicLinkRequest request) {
        magicLinkIssuer.requestLink(request.email());
    }

    public LoginResponse verifyMagicLink(MagicLinkVerifyRequest request) {
        MagicLinkVerification verification = magicLinkIssuer.verify(request.token());
        if (!verification.isVerified()) {
            throw toProblem(verification.failure());
        }

        UserAccount user = userAccountRepository.findByEmailIgnoreCase(verification.email())
                .orElseGet(() -> createUser(verification.email()));

        TokenPair tokens = tokenAuthority.issueTokenPair(user);
        auditLogService.recordUserAction(ACTION_LOGIN, user.getId(), Map.of("method", "magic_link"));
        return new LoginResponse(TokenPairResponse.from(tokens), UserProfileResponse.from(user));
    }

    public LoginResponse refresh(RefreshRequest request) {
        TokenPair tokens = tokenAuthority.rotate(request.refreshToken())
                .orElseThrow(failure -> {
                    log.debug("Refresh rejected: {}", failure);
                    return ProblemException.unauthenticated(INVALID_REFRESH_TOKEN, "Invalid or expired refresh token");
                });

        UserAccount user = userAccountRepository.findById(tokens.userId())
                .orElseThrow(() -> ProblemException.unauthenticated(USER_NOT_FOUND, "User not found"));
        auditLogService.recordUserAction(ACTION_TOKEN_REFRESH, user.getId(), Map.of());
        return new LoginResponse(TokenPairResponse.from(tokens), UserProfileResponse.from(user));
    }

    /**
     * Revokes the presented refresh token when it belongs to the caller. Unknown or foreign
     * tokens get the same empty response so token validity is not disclosed.
     */
    public void logout(UUID callerId, LogoutRequest request) {
        tokenAuthority.verifyRefreshToken(request.refreshToken())
                .validClaims()
                .filter(claims -> claims.userId().equals(callerId))
                .ifPresent(claims -> {
                    tokenAuthority.revokeToken(claims.tokenId());
                    auditLogService.recordUserAction(ACTION_LOGOUT, callerId, Map.of("tokenId", claims.tokenId().toString()));
                });
    }

    public int logoutEverywhere(UUID callerId) {
        int revoked = tokenAuthority.revokeAllForUser(callerId);
        auditLogService.recordUserAction(ACTION_LOGOUT_ALL, callerId, Map.of("revoked", revoked));
        return revoked;
    }

    @Transactional(readOnly = true)
    public UserProfileResponse loadProfile(UUID userId) {
        return userAccountRepository.findById(userId)
                .map(UserProfileResponse::from)
                .orElseThrow(() -> ProblemException.notFound(USER_NOT_FOUND, "User not found"));
    }

    private UserAccount createUser(String email) {
        UserAccount user = new UserAccount();
        user.setEmail(email);
        user.setHandle(generateHandle(email));
        user.setPrivacyMode(false);
        UserAccount saved = userAccountRepository.save(user);
        auditLogService.recordUserAction(ACTION_USER_CREATED, saved.getId(), Map.of("email", email, "handle", saved.getHandle()));
        log.info("Created user {} on first magic-link login", saved.getId());
        return saved;
    }

    String generateHandle(String email) {
        String localPart = email.contains("@") ? email.substring(0, email.indexOf('@')) : email;
        String prefix = localPart.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_]", "");
        if (prefix.isEmpty()) {
            prefix = "user";
        }
        if (prefix.length() > HANDLE_PREFIX_MAX_LENGTH) {
            prefix = prefix.substring(0, HANDLE_PREFIX_MAX_LENGTH);
        }
        for (int attempt = 0; attempt < HANDLE_ATTEMPTS; attempt++) {
            String candidate = prefix + tokenGenerator.nextAlphanumeric(HANDLE_SUFFIX_LENGTH);
            if (!userAccountRepository.existsByHandle(candidate)) {
                return candidate;
            }
        }
        throw new IllegalStateException("Could not allocate a unique handle for " + email);
    }

    private static ProblemException toProblem(MagicLinkFailure failure) {
        return switch (failure) {
            case NOT_FOUND -> new ProblemException(HttpStatus.NOT_FOUND, INVALID_MAGIC_LINK, "Magic link not found");
            case ALREADY_USED -> new ProblemException(HttpStatus.CONFLICT, INVALID_MAGIC_LINK, "Magic link has already been used");
            case EXPIRED -> new ProblemException(HttpStatus.UNAUTHORIZED, INVALID_MAGIC_LINK, "Magic link has expired");
        };
    }
}
