package com.clocked.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import com.clocked.backend.modules.audit.domain.AuditLog;
import com.clocked.backend.modules.audit.infrastructure.AuditLogRepository;
import com.clocked.backend.support.AbstractPostgresIntegrationTest;
import com.clocked.backend.support.TestDataFactory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

@SpringBootTest
@AutoConfigureMockMvc
class AuthIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final String EMAIL = "alice@example.com";
    private static final AtomicInteger CLIENT_SEQUENCE = new AtomicInteger();

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private AuditLogRepository auditLogRepository;

    private TestDataFactory testData;
    private String clientAddress;

    @BeforeEach
    void setUp() {
        testData = new TestDataFactory(jdbcTemplate);
        clientAddress = "10.0.1." + CLIENT_SEQUENCE.incrementAndGet();
    }

    private MockHttpServletRequestBuilder magicLinkRequest(String email) {
        return post("/auth/magic-link")
                .with(request -> {
                    request.setRemoteAddr(clientAddress);
                    return request;
                })
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                        {"email": "%s"}
                        """.formatted(email));
    }

    private MockHttpServletRequestBuilder verifyRequest(String token) {
        return post("/auth/magic-link/verify")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                        {"token": "%s"}
                        """.formatted(token));
    }

    private JsonNode login(String email) throws Exception {
        mockMvc.perform(magicLinkRequest(email)).andExpect(status().isAccepted());
        MvcResult result = mockMvc.perform(verifyRequest(testData.latestMagicLinkToken(email)))
                .andExpect(status().isOk())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    @Test
    void magicLinkLogsInExactlyOnce() throws Exception {
        UUID userId = testData.user(EMAIL, "alice");

        mockMvc.perform(magicLinkRequest("Alice@Example.com"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.message").value("Magic link sent to your email"))
                .andExpect(jsonPath("$.expiresIn").value(900));
        String token = testData.latestMagicLinkToken(EMAIL);

        mockMvc.perform(verifyRequest(token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tokens.accessToken").isNotEmpty())
                .andExpect(jsonPath("$.tokens.refreshToken").isNotEmpty())
                .andExpect(jsonPath("$.tokens.tokenType").value("Bearer"))
                .andExpect(jsonPath("$.user.handle").value("alice"));

        mockMvc.perform(verifyRequest(token))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("INVALID_MAGIC_LINK"));

        assertThat(auditLogRepository.findByResourceKeyOrderByCreatedAtAsc(userId.toString()))
                .extracting(AuditLog::getActionType)
                .containsExactly("AUTH_LOGIN");
    }

    @Test
    void firstLoginOfNewEmailCreatesAccount() throws Exception {
        jdbcTemplate.update(
                "INSERT INTO magic_link (token, email, created_at, expires_at) VALUES (?, ?, now(), now() + interval '10 minutes')",
                "invite-token", "newcomer@example.com");

        MvcResult result = mockMvc.perform(verifyRequest("invite-token"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.user.email").value("newcomer@example.com"))
                .andReturn();

        String handle = objectMapper.readTree(result.getResponse().getContentAsString()).path("user").path("handle").asText();
        assertThat(handle).matches("newcomer[a-z0-9]{6}");
        UUID userId = UUID.fromString(objectMapper.readTree(result.getResponse().getContentAsString()).path("user").path("id").asText());
        assertThat(auditLogRepository.findByResourceKeyOrderByCreatedAtAsc(userId.toString()))
                .extracting(AuditLog::getActionType)
                .containsExactlyInAnyOrder("USER_CREATED", "AUTH_LOGIN");
    }

    @Test
    void magicLinkHonoursFifteenMinuteWindow() throws Exception {
        testData.user(EMAIL, "alice");
        jdbcTemplate.update(
                "INSERT INTO magic_link (token, email, created_at, expires_at) VALUES (?, ?, now() - interval '10 minutes', now() + interval '5 minutes')",
                "ten-minutes-old", EMAIL);
        jdbcTemplate.update(
                "INSERT INTO magic_link (token, email, created_at, expires_at) VALUES (?, ?, now() - interval '16 minutes', now() - interval '1 minute')",
                "sixteen-minutes-old", EMAIL);

        mockMvc.perform(verifyRequest("ten-minutes-old"))
                .andExpect(status().isOk());

        mockMvc.perform(verifyRequest("sixteen-minutes-old"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_MAGIC_LINK"));
    }

    @Test
    void unknownMagicLinkIsRejected() throws Exception {
        mockMvc.perform(verifyRequest("does-not-exist"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("INVALID_MAGIC_LINK"));
    }

    @Test
    void unknownEmailCannotRequestLink() throws Exception {
        mockMvc.perform(magicLinkRequest("nobody@example.com"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("USER_NOT_FOUND"));
    }

    @Test
    void sixthMagicLinkRequestFromSameClientIsThrottled() throws Exception {
        testData.user(EMAIL, "alice");
        for (int i = 0; i < 5; i++) {
            mockMvc.perform(magicLinkRequest(EMAIL)).andExpect(status().isAccepted());
        }

        mockMvc.perform(magicLinkRequest(EMAIL))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().exists("Retry-After"))
                .andExpect(jsonPath("$.code").value("RATE_LIMIT_EXCEEDED"));
    }

    @Test
    void accessTokenOpensProfile() throws Exception {
        testData.user(EMAIL, "alice");
        String accessToken = login(EMAIL).path("tokens").path("accessToken").asText();

        mockMvc.perform(get("/auth/me").header("Authorization", "Bearer " + accessToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.email").value(EMAIL))
                .andExpect(jsonPath("$.handle").value("alice"));

        mockMvc.perform(get("/auth/me"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("UNAUTHORIZED"));

        mockMvc.perform(get("/auth/me").header("Authorization", "Bearer not-a-jwt"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_ACCESS_TOKEN"));
    }

    @Test
    void refreshTokenIsSingleUse() throws Exception {
        testData.user(EMAIL, "alice");
        String original = login(EMAIL).path("tokens").path("refreshToken").asText();

        MvcResult refreshed = mockMvc.perform(post("/auth/refresh")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"refreshToken": "%s"}
                                """.formatted(original)))
                .andExpect(status().isOk())
                .andReturn();
        String rotated = objectMapper.readTree(refreshed.getResponse().getContentAsString())
                .path("tokens").path("refreshToken").asText();
        assertThat(rotated).isNotEqualTo(original);

        mockMvc.perform(post("/auth/refresh")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"refreshToken": "%s"}
                                """.formatted(original)))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_REFRESH_TOKEN"));
    }

    @Test
    void logoutEverywhereRevokesAllRefreshTokens() throws Exception {
        testData.user(EMAIL, "alice");
        JsonNode phone = login(EMAIL);
        JsonNode laptop = login(EMAIL);
        String accessToken = laptop.path("tokens").path("accessToken").asText();

        mockMvc.perform(post("/auth/logout-all").header("Authorization", "Bearer " + accessToken))
                .andExpect(status().isNoContent());

        for (JsonNode session : new JsonNode[] {phone, laptop}) {
            mockMvc.perform(post("/auth/refresh")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {"refreshToken": "%s"}
                                    """.formatted(session.path("tokens").path("refreshToken").asText())))
                    .andExpect(status().isUnauthorized());
        }
        Integer active = jdbcTemplate.queryForObject(
                "SELECT count(*) FROM refresh_token WHERE revoked = false", Integer.class);
        assertThat(active).isZero();
    }

    @Test
    void logoutRevokesOnlyPresentedToken() throws Exception {
        testData.user(EMAIL, "alice");
        JsonNode phone = login(EMAIL);
        JsonNode laptop = login(EMAIL);

        mockMvc.perform(post("/auth/logout")
                        .header("Authorization", "Bearer " + phone.path("tokens").path("accessToken").asText())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"refreshToken": "%s"}
                                """.formatted(phone.path("tokens").path("refreshToken").asText())))
                .andExpect(status().isNoContent());

        mockMvc.perform(post("/auth/refresh")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"refreshToken": "%s"}
                                """.formatted(laptop.path("tokens").path("refreshToken").asText())))
                .andExpect(status().isOk());
    }

    @Test
    void healthEndpointsArePublic() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.connections").value(0));
    }
}
