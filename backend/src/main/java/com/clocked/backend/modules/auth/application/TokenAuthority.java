package com.clocked.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Date;
import java.util.Optional;
import java.util.UUID;

import javax.crypto.SecretKey;

import com.clocked.backend.modules.auth.domain.RefreshToken;
import com.clocked.backend.modules.auth.domain.RevocationReason;
import com.clocked.backend.modules.auth.domain.UserAccount;
import com.clocked.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.clocked.backend.modules.auth.infrastructure.persistence.RefreshTokenRepository;
import com.clocked.backend.modules.auth.infrastructure.persistence.UserAccountRepository;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.IncorrectClaimException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import io.jsonwebtoken.MissingClaimException;
import io.jsonwebtoken.security.SignatureException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Issues and verifies access tokens, and owns the lifecycle of refresh-token records.
 *
 * <p>Access and refresh tokens share the signing key but carry different audiences, so a token
 * of one kind is never accepted where the other is expected. Verification never throws for bad
 * input; it returns a {@link TokenVerification} describing the failure.
 */
@Service
public class TokenAuthority {

    private static final Logger log = LoggerFactory.getLogger(TokenAuthority.class);

    public static final String ISSUER = "clocked";
    public static final String ACCESS_AUDIENCE = "clocked-users";
    public static final String REFRESH_AUDIENCE = "clocked-refresh";

    static final String CLAIM_USER_ID = "userId";
    static final String CLAIM_EMAIL = "email";
    static final String CLAIM_HANDLE = "handle";
    static final String CLAIM_TOKEN_ID = "tokenId";

    private final JwtTokenProvider tokenProvider;
    private final RefreshTokenRepository refreshTokenRepository;
    private final UserAccountRepository userAccountRepository;
    private final SecureTokenGenerator tokenGenerator;
    private final Clock clock;
    private final Duration accessTokenTtl;
    private final Duration refreshTokenTtl;
    private final boolean reuseDetection;

    public TokenAuthority(
            JwtTokenProvider tokenProvider,
            RefreshTokenRepository refreshTokenRepository,
            UserAccountRepository userAccountRepository,
            SecureTokenGenerator tokenGenerator,
            Clock clock,
            @Value("${clocked.jwt.access-ttl:PT15M}") Duration accessTokenTtl,
            @Value("${clocked.jwt.refresh-ttl:P7D}") Duration refreshTokenTtl,
            @Value("${clocked.auth.refresh.reuse-detection:false}") boolean reuseDetection
    ) {
        this.tokenProvider = tokenProvider;
        this.refreshTokenRepository = refreshTokenRepository;
        this.userAccountRepository = userAccountRepository;
        this.tokenGenerator = tokenGenerator;
        this.clock = clock;
        this.accessTokenTtl = accessTokenTtl;
        this.refreshTokenTtl = refreshTokenTtl;
        this.reuseDetection = reuseDetection;
    }

    public String issueAccessToken(UserAccount user) {
        return issueAccessToken(user.getId(), user.getEmail(), user.getHandle(), clock.instant());
    }

    private String issueAccessToken(UUID userId, String email, String handle, Instant now) {
        return Jwts.builder()
                .subject(userId.toString())
                .issuer(ISSUER)
                .audience().single(ACCESS_AUDIENCE)
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(accessTokenTtl)))
                .claim(CLAIM_USER_ID, userId.toString())
                .claim(CLAIM_EMAIL, email)
                .claim(CLAIM_HANDLE, handle)
                .signWith(tokenProvider.getSecretKey(), SIG.HS256)
                .compact();
    }

    public TokenVerification<AccessTokenClaims> verifyAccessToken(String token) {
        TokenVerification<Claims> parsed = parse(token, ACCESS_AUDIENCE);
        if (!parsed.isValid()) {
            return TokenVerification.rejected(parsed.failure());
        }
        Claims claims = parsed.claims();
        Optional<UUID> userId = parseUuid(claims.get(CLAIM_USER_ID, String.class));
        if (userId.isEmpty()) {
            return TokenVerification.rejected(TokenFailure.CLAIM_MISMATCH);
        }
        return TokenVerification.valid(new AccessTokenClaims(
                userId.get(),
                claims.get(CLAIM_EMAIL, String.class),
                claims.get(CLAIM_HANDLE, String.class),
                claims.getIssuedAt().toInstant(),
                claims.getExpiration().toInstant()
        ));
    }

    @Transactional
    public IssuedRefreshToken issueRefreshToken(UUID userId) {
        return issueRefreshToken(userId, clock.instant());
    }

    private IssuedRefreshToken issueRefreshToken(UUID userId, Instant now) {
        UUID tokenId = UUID.randomUUID();
        Instant expiresAt = now.plus(refreshTokenTtl);
        refreshTokenRepository.save(new RefreshToken(
                tokenId,
                userId,
                tokenGenerator.nextToken(),
                OffsetDateTime.ofInstant(now, clock.getZone()),
                OffsetDateTime.ofInstant(expiresAt, clock.getZone())
        ));

        String token = Jwts.builder()
                .id(tokenId.toString())
                .subject(userId.toString())
                .issuer(ISSUER)
                .audience().single(REFRESH_AUDIENCE)
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiresAt))
                .claim(CLAIM_USER_ID, userId.toString())
                .claim(CLAIM_TOKEN_ID, tokenId.toString())
                .signWith(tokenProvider.getSecretKey(), SIG.HS256)
                .compact();
        return new IssuedRefreshToken(token, tokenId, expiresAt);
    }

    @Transactional(readOnly = true)
    public TokenVerification<RefreshTokenClaims> verifyRefreshToken(String token) {
        TokenVerification<Claims> parsed = parse(token, REFRESH_AUDIENCE);
        if (!parsed.isValid()) {
            return TokenVerification.rejected(parsed.failure());
        }
        Claims claims = parsed.claims();
        Optional<UUID> userId = parseUuid(claims.get(CLAIM_USER_ID, String.class));
        Optional<UUID> tokenId = parseUuid(claims.get(CLAIM_TOKEN_ID, String.class));
        if (userId.isEmpty() || tokenId.isEmpty()) {
            return TokenVerification.rejected(TokenFailure.CLAIM_MISMATCH);
        }
        RefreshTokenClaims refreshClaims = new RefreshTokenClaims(
                userId.get(),
                tokenId.get(),
                claims.getIssuedAt().toInstant(),
                claims.getExpiration().toInstant()
        );

        Optional<RefreshToken> record = refreshTokenRepository.findById(tokenId.get());
        if (record.isEmpty() || !record.get().getUserId().equals(userId.get())) {
            log.debug("Refresh token {} has no matching record", tokenId.get());
            return TokenVerification.rejected(TokenFailure.RECORD_NOT_FOUND);
        }
        if (record.get().isRevoked()) {
            log.debug("Refresh token {} was already revoked ({})", tokenId.get(), record.get().getRevokedReason());
            return TokenVerification.rejected(TokenFailure.RECORD_REVOKED, refreshClaims);
        }
        if (!record.get().getExpiresAt().isAfter(OffsetDateTime.now(clock))) {
            return TokenVerification.rejected(TokenFailure.RECORD_EXPIRED);
        }
        return TokenVerification.valid(refreshClaims);
    }

    /**
     * Rotation: verify the presented refresh token, revoke its record, and issue a new pair.
     * The revoke is a conditional update, so of several concurrent rotations with the same
     * token exactly one obtains a new pair; the others see {@link TokenFailure#RECORD_REVOKED}.
     */
    @Transactional
    public TokenVerification<TokenPair> rotate(String presentedRefreshToken) {
        TokenVerification<RefreshTokenClaims> verification = verifyRefreshToken(presentedRefreshToken);
        if (!verification.isValid()) {
            if (verification.failure() == TokenFailure.RECORD_REVOKED && verification.claims() != null) {
                onRevokedTokenPresented(verification.claims());
            }
            return TokenVerification.rejected(verification.failure());
        }
        RefreshTokenClaims claims = verification.claims();

        Optional<UserAccount> user = userAccountRepository.findById(claims.userId());
        if (user.isEmpty()) {
            return TokenVerification.rejected(TokenFailure.RECORD_NOT_FOUND);
        }
        if (!consume(claims.tokenId(), RevocationReason.ROTATED)) {
            log.info("Concurrent rotation lost for refresh token {}", claims.tokenId());
            return TokenVerification.rejected(TokenFailure.RECORD_REVOKED);
        }
        return TokenVerification.valid(issueTokenPair(user.get()));
    }

    @Transactional
    public TokenPair issueTokenPair(UserAccount user) {
        Instant now = clock.instant();
        String accessToken = issueAccessToken(user.getId(), user.getEmail(), user.getHandle(), now);
        IssuedRefreshToken refreshToken = issueRefreshToken(user.getId(), now);
        return new TokenPair(
                user.getId(),
                accessToken,
                now.plus(accessTokenTtl),
                refreshToken.token(),
                refreshToken.expiresAt(),
                now
        );
    }

    /**
     * Revokes one record. Idempotent: revoking an already revoked or unknown id is a no-op.
     */
    @Transactional
    public void revokeToken(UUID tokenId) {
        consume(tokenId, RevocationReason.LOGOUT);
    }

    @Transactional
    public int revokeAllForUser(UUID userId) {
        return revokeAllForUser(userId, RevocationReason.LOGOUT_ALL);
    }

    private int revokeAllForUser(UUID userId, RevocationReason reason) {
        int revoked = refreshTokenRepository.revokeAllForUser(userId, OffsetDateTime.now(clock), reason.name());
        log.info("Revoked {} refresh tokens for user {} ({})", revoked, userId, reason);
        return revoked;
    }

    boolean consume(UUID tokenId, RevocationReason reason) {
        return refreshTokenRepository.revokeIfActive(tokenId, OffsetDateTime.now(clock), reason.name()) == 1;
    }

    private void onRevokedTokenPresented(RefreshTokenClaims claims) {
        if (!reuseDetection) {
            return;
        }
        log.warn("Revoked refresh token {} presented again; revoking every session of user {}",
                claims.tokenId(), claims.userId());
        revokeAllForUser(claims.userId(), RevocationReason.REUSE_DETECTED);
    }

    private TokenVerification<Claims> parse(String token, String audience) {
        if (token == null || token.isBlank()) {
            return TokenVerification.rejected(TokenFailure.MISSING);
        }
        SecretKey key = tokenProvider.getSecretKey();
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(key)
                    .requireIssuer(ISSUER)
                    .requireAudience(audience)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
            return TokenVerification.valid(claims);
        } catch (ExpiredJwtException e) {
            return reject(TokenFailure.EXPIRED, audience, e);
        } catch (IncorrectClaimException | MissingClaimException e) {
            return reject(TokenFailure.CLAIM_MISMATCH, audience, e);
        } catch (SignatureException e) {
            return reject(TokenFailure.BAD_SIGNATURE, audience, e);
        } catch (JwtException | IllegalArgumentException e) {
            return reject(TokenFailure.MALFORMED, audience, e);
        }
    }

    private TokenVerification<Claims> reject(TokenFailure failure, String audience, Exception cause) {
        log.debug("Rejected {} token: {} ({})", audience, failure, cause.getClass().getSimpleName());
        return TokenVerification.rejected(failure);
    }

    private static Optional<UUID> parseUuid(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(raw));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
