package com.clocked.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Locale;
import java.util.Optional;

import com.clocked.backend.global.error.ProblemException;
import com.clocked.backend.modules.auth.domain.MagicLink;
import com.clocked.backend.modules.auth.infrastructure.persistence.MagicLinkRepository;
import com.clocked.backend.modules.auth.infrastructure.persistence.UserAccountRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Issues single-use passwordless login links.
 *
 * <p>Requesting a link for an unknown email fails with {@code USER_NOT_FOUND}, which tells the
 * caller whether an account exists. The HTTP route in front of this is rate limited for that
 * reason.
 */
@Service
public class MagicLinkIssuer {

    private static final Logger log = LoggerFactory.getLogger(MagicLinkIssuer.class);

    public static final String USER_NOT_FOUND = "USER_NOT_FOUND";

    private final MagicLinkRepository magicLinkRepository;
    private final UserAccountRepository userAccountRepository;
    private final MagicLinkSender magicLinkSender;
    private final SecureTokenGenerator tokenGenerator;
    private final Clock clock;
    private final Duration ttl;
    private final String baseUrl;

    public MagicLinkIssuer(
            MagicLinkRepository magicLinkRepository,
            UserAccountRepository userAccountRepository,
            MagicLinkSender magicLinkSender,
            SecureTokenGenerator tokenGenerator,
            Clock clock,
            @Value("${clocked.auth.magic-link.ttl:PT15M}") Duration ttl,
            @Value("${clocked.auth.magic-link.base-url:clocked://auth/magic-link}") String baseUrl
    ) {
        this.magicLinkRepository = magicLinkRepository;
        this.userAccountRepository = userAccountRepository;
        this.magicLinkSender = magicLinkSender;
        this.tokenGenerator = tokenGenerator;
        this.clock = clock;
        this.ttl = ttl;
        this.baseUrl = baseUrl;
    }

    @Transactional
    public String requestLink(String rawEmail) {
        String email = normalizeEmail(rawEmail);
        if (userAccountRepository.findByEmailIgnoreCase(email).isEmpty()) {
            throw ProblemException.notFound(USER_NOT_FOUND, "No account found with this email address");
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        String token = tokenGenerator.nextToken();
        magicLinkRepository.save(new MagicLink(token, email, now, now.plus(ttl)));

        String link = UriComponentsBuilder.fromUriString(baseUrl)
                .queryParam("token", token)
                .build()
                .toUriString();
        magicLinkSender.send(email, link);
        return token;
    }

    /**
     * Consumes the link. Only one caller can ever see a verified result for a given token.
     */
    @Transactional
    public MagicLinkVerification verify(String token) {
        if (token == null || token.isBlank()) {
            return MagicLinkVerification.rejected(MagicLinkFailure.NOT_FOUND);
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (magicLinkRepository.markUsed(token, now) == 1) {
            return magicLinkRepository.findById(token)
                    .map(link -> MagicLinkVerification.verified(link.getEmail()))
                    .orElseThrow(() -> new IllegalStateException("Magic link vanished after consumption"));
        }

        Optional<MagicLink> link = magicLinkRepository.findById(token);
        if (link.isEmpty()) {
            return MagicLinkVerification.rejected(MagicLinkFailure.NOT_FOUND);
        }
        if (link.get().isUsed()) {
            log.info("Magic link for {} presented again after use", link.get().getEmail());
            return MagicLinkVerification.rejected(MagicLinkFailure.ALREADY_USED);
        }
        return MagicLinkVerification.rejected(MagicLinkFailure.EXPIRED);
    }

    @Transactional
    public int purgeExpired(Duration retention) {
        return magicLinkRepository.deleteExpiredBefore(OffsetDateTime.now(clock).minus(retention));
    }

    static String normalizeEmail(String rawEmail) {
        return rawEmail == null ? "" : rawEmail.trim().toLowerCase(Locale.ROOT);
    }

    public Duration getTtl() {
        return ttl;
    }
}
