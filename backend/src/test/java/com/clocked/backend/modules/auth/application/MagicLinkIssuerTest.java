package com.clocked.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import com.clocked.backend.global.error.ProblemException;
import com.clocked.backend.modules.auth.domain.MagicLink;
import com.clocked.backend.modules.auth.infrastructure.persistence.MagicLinkRepository;
import com.clocked.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.clocked.backend.support.TestUsers;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class MagicLinkIssuerTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-01-01T09:00:00Z");

    @Mock
    private MagicLinkRepository magicLinkRepository;

    @Mock
    private UserAccountRepository userAccountRepository;

    @Mock
    private MagicLinkSender magicLinkSender;

    private MagicLinkIssuer issuer;

    @BeforeEach
    void setUp() {
        issuer = new MagicLinkIssuer(
                magicLinkRepository,
                userAccountRepository,
                magicLinkSender,
                new SecureTokenGenerator(),
                Clock.fixed(NOW.toInstant(), ZoneOffset.UTC),
                Duration.ofMinutes(15),
                "clocked://auth/magic-link"
        );
    }

    @Test
    void unknownEmailIsRejectedWithoutIssuingALink() {
        when(userAccountRepository.findByEmailIgnoreCase("ghost@example.com")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> issuer.requestLink("ghost@example.com"))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
                    assertThat(ex.getCode()).isEqualTo("USER_NOT_FOUND");
                });
        verify(magicLinkRepository, never()).save(any());
        verifyNoInteractions(magicLinkSender);
    }

    @Test
    void requestLinkPersistsNormalizedEmailAndSendsLink() {
        when(userAccountRepository.findByEmailIgnoreCase("alice@example.com"))
                .thenReturn(Optional.of(TestUsers.user(UUID.randomUUID(), "alice@example.com", "alice")));

        String token = issuer.requestLink("  Alice@Example.com ");

        ArgumentCaptor<MagicLink> saved = ArgumentCaptor.forClass(MagicLink.class);
        verify(magicLinkRepository).save(saved.capture());
        assertThat(token).hasSize(43);
        assertThat(saved.getValue().getToken()).isEqualTo(token);
        assertThat(saved.getValue().getEmail()).isEqualTo("alice@example.com");
        assertThat(saved.getValue().getExpiresAt()).isEqualTo(NOW.plusMinutes(15));
        assertThat(saved.getValue().isUsed()).isFalse();
        verify(magicLinkSender).send(eq("alice@example.com"), eq("clocked://auth/magic-link?token=" + token));
    }

    @Test
    void verifyConsumesLinkOnce() {
        MagicLink link = new MagicLink("tok", "alice@example.com", NOW, NOW.plusMinutes(15));
        when(magicLinkRepository.markUsed("tok", NOW)).thenReturn(1);
        when(magicLinkRepository.findById("tok")).thenReturn(Optional.of(link));

        MagicLinkVerification verification = issuer.verify("tok");

        assertThat(verification.isVerified()).isTrue();
        assertThat(verification.email()).isEqualTo("alice@example.com");
    }

    @Test
    void usedLinkIsReportedAsAlreadyUsed() {
        MagicLink link = new MagicLink("tok", "alice@example.com", NOW.minusMinutes(5), NOW.plusMinutes(10));
        link.markUsed(NOW.minusMinutes(1));
        when(magicLinkRepository.markUsed("tok", NOW)).thenReturn(0);
        when(magicLinkRepository.findById("tok")).thenReturn(Optional.of(link));

        assertThat(issuer.verify("tok").failure()).isEqualTo(MagicLinkFailure.ALREADY_USED);
    }

    @Test
    void staleLinkIsReportedAsExpired() {
        MagicLink link = new MagicLink("tok", "alice@example.com", NOW.minusMinutes(30), NOW.minusMinutes(15));
        when(magicLinkRepository.markUsed("tok", NOW)).thenReturn(0);
        when(magicLinkRepository.findById("tok")).thenReturn(Optional.of(link));

        assertThat(issuer.verify("tok").failure()).isEqualTo(MagicLinkFailure.EXPIRED);
    }

    @Test
    void unknownOrBlankTokenIsNotFound() {
        when(magicLinkRepository.markUsed("missing", NOW)).thenReturn(0);
        when(magicLinkRepository.findById("missing")).thenReturn(Optional.empty());

        assertThat(issuer.verify("missing").failure()).isEqualTo(MagicLinkFailure.NOT_FOUND);
        assertThat(issuer.verify(" ").failure()).isEqualTo(MagicLinkFailure.NOT_FOUND);
        verify(magicLinkRepository, never()).markUsed(eq(" "), any());
    }

    @Test
    void purgeRemovesLinksExpiredBeforeRetention() {
        when(magicLinkRepository.deleteExpiredBefore(NOW.minusDays(1))).thenReturn(3);

        assertThat(issuer.purgeExpired(Duration.ofDays(1))).isEqualTo(3);
        verify(magicLinkRepository, never()).findById(anyString());
    }
}
