package com.clocked.backend.modules.realtime.application;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import com.clocked.backend.modules.activity.application.ActiveSessionQuery;
import com.clocked.backend.modules.activity.application.ActiveSessionView;
import com.clocked.backend.modules.auth.application.AccessTokenClaims;
import com.clocked.backend.modules.auth.application.TokenAuthority;
import com.clocked.backend.modules.auth.application.TokenVerification;
import com.clocked.backend.modules.auth.domain.UserAccount;
import com.clocked.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.clocked.backend.modules.group.application.PermissionResolver;
import com.clocked.backend.modules.realtime.domain.ClientMessage;
import com.clocked.backend.modules.realtime.domain.CloseCodes;
import com.clocked.backend.modules.realtime.domain.ConnectionTransport;
import com.clocked.backend.modules.realtime.domain.LiveConnection;
import com.clocked.backend.modules.realtime.domain.MessageType;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Per-connection lifecycle: CONNECTING until the access token and membership check out,
 * AUTHENTICATED while messages are served, CLOSED once the socket goes away.
 */
@Service
public class RealtimeSessionHandler {

    private static final Logger log = LoggerFactory.getLogger(RealtimeSessionHandler.class);

    static final String AUTHENTICATION_REQUIRED = "Authentication required";
    static final String AUTHENTICATION_FAILED = "Authentication failed";
    static final String USER_NOT_FOUND = "User not found";
    static final String NOT_A_MEMBER = "Not a member of this group";
    static final String UNKNOWN_MESSAGE_TYPE = "Unknown message type";
    static final String INVALID_MESSAGE_FORMAT = "Invalid message format";
    static final String NOT_AUTHENTICATED = "Not authenticated";
    static final String GROUP_LOAD_FAILED = "Failed to load group";
    static final String REPLACED = "Replaced by a newer connection";

    private final TokenAuthority tokenAuthority;
    private final UserAccountRepository userAccountRepository;
    private final PermissionResolver permissionResolver;
    private final ActiveSessionQuery activeSessionQuery;
    private final ConnectionRegistry registry;
    private final BroadcastHub hub;
    private final RealtimeMessageCodec codec;
    private final Executor realtimeExecutor;
    private final Clock clock;

    public RealtimeSessionHandler(
            TokenAuthority tokenAuthority,
            UserAccountRepository userAccountRepository,
            PermissionResolver permissionResolver,
            ActiveSessionQuery activeSessionQuery,
            ConnectionRegistry registry,
            BroadcastHub hub,
            RealtimeMessageCodec codec,
            @Qualifier("realtimeExecutor") Executor realtimeExecutor,
            Clock clock
    ) {
        this.tokenAuthority = tokenAuthority;
        this.userAccountRepository = userAccountRepository;
        this.permissionResolver = permissionResolver;
        this.activeSessionQuery = activeSessionQuery;
        this.registry = registry;
        this.hub = hub;
        this.codec = codec;
        this.realtimeExecutor = realtimeExecutor;
        this.clock = clock;
    }

    /**
     * Accepts a freshly opened socket. Token checks happen inline; the user and membership lookup
     * is handed to the realtime executor and finishes with a {@code connected} frame.
     */
    public LiveConnection open(ConnectionTransport transport, String accessToken) {
        LiveConnection connection = new LiveConnection(transport, clock.instant());
        if (accessToken == null || accessToken.isBlank()) {
            log.debug("Rejected realtime connection {}: no token", transport.id());
            reject(connection, AUTHENTICATION_REQUIRED);
            return connection;
        }

        TokenVerification<AccessTokenClaims> verification = tokenAuthority.verifyAccessToken(accessToken);
        if (!verification.isValid()) {
            log.debug("Rejected realtime connection {}: {}", transport.id(), verification.failure());
            reject(connection, AUTHENTICATION_FAILED);
            return connection;
        }

        registry.add(connection);
        AccessTokenClaims claims = verification.claims();
        try {
            realtimeExecutor.execute(() -> completeHandshake(connection, claims.userId()));
        } catch (RejectedExecutionException ex) {
            log.warn("Realtime executor saturated, refusing connection {}", transport.id());
            hub.disconnect(connection, CloseCodes.SERVER_ERROR, "Server busy");
        }
        return connection;
    }

    void completeHandshake(LiveConnection connection, UUID userId) {
        try {
            Optional<UserAccount> user = userAccountRepository.findById(userId);
            if (user.isEmpty()) {
                log.debug("Rejected realtime connection {}: user {} no longer exists", connection.getId(), userId);
                hub.disconnect(connection, CloseCodes.POLICY_VIOLATION, USER_NOT_FOUND);
                return;
            }
            Set<UUID> groupIds = permissionResolver.listGroupIds(userId);
            if (!connection.authenticate(userId, user.get().getHandle(), groupIds)) {
                registry.remove(connection);
                return;
            }
            registry.bindUser(connection).ifPresent(previous -> {
                log.info("User {} reconnected on {}, closing previous connection {}", userId, connection.getId(), previous.getId());
                hub.disconnect(previous, CloseCodes.GOING_AWAY, REPLACED);
            });
            if (connection.isClosed()) {
                registry.remove(connection);
                return;
            }

            log.info("Realtime client connected: user={} connection={} groups={}", userId, connection.getId(), groupIds.size());
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("userId", userId);
            data.put("handle", user.get().getHandle());
            data.put("groupIds", List.copyOf(groupIds));
            hub.send(connection, MessageType.CONNECTED, data);
        } catch (RuntimeException ex) {
            log.error("Realtime handshake failed for connection {}", connection.getId(), ex);
            hub.disconnect(connection, CloseCodes.POLICY_VIOLATION, AUTHENTICATION_FAILED);
        }
    }

    public void handleText(String connectionId, String text) {
        Optional<LiveConnection> found = registry.find(connectionId);
        if (found.isEmpty()) {
            return;
        }
        LiveConnection connection = found.get();
        connection.touch(clock.instant());

        ClientMessage message;
        try {
            message = codec.decode(text);
        } catch (InvalidClientMessageException ex) {
            log.debug("Invalid frame on connection {}: {}", connectionId, ex.getMessage());
            hub.sendError(connection, INVALID_MESSAGE_FORMAT);
            return;
        }

        if (!connection.isAuthenticated()) {
            hub.sendError(connection, NOT_AUTHENTICATED);
            return;
        }

        log.debug("Realtime message {} from user {}", message.type(), connection.getUserId());
        switch (message.type()) {
            case PING -> hub.send(connection, MessageType.PONG, null);
            case JOIN_GROUP -> joinGroup(connection, message.groupId());
            case LEAVE_GROUP -> leaveGroup(connection, message.groupId());
            case UNKNOWN -> hub.sendError(connection, UNKNOWN_MESSAGE_TYPE);
        }
    }

    public void closed(String connectionId, int code) {
        registry.find(connectionId).ifPresent(connection -> {
            connection.markClosed();
            registry.remove(connection);
            log.info("Realtime client disconnected: user={} connection={} code={}",
                    connection.getUserId(), connectionId, code);
        });
    }

    public void transportError(String connectionId, Throwable error) {
        log.warn("Realtime transport error on connection {}: {}", connectionId, error.getMessage());
        registry.find(connectionId).ifPresent(connection -> hub.disconnect(connection, CloseCodes.SERVER_ERROR, "Transport error"));
    }

    private void joinGroup(LiveConnection connection, UUID groupId) {
        if (!connection.isInScope(groupId)) {
            hub.sendError(connection, NOT_A_MEMBER);
            return;
        }
        try {
            realtimeExecutor.execute(() -> sendGroupSnapshot(connection, groupId));
        } catch (RejectedExecutionException ex) {
            log.warn("Realtime executor saturated, dropping join of group {} by user {}", groupId, connection.getUserId());
            hub.sendError(connection, GROUP_LOAD_FAILED);
        }
    }

    private void sendGroupSnapshot(LiveConnection connection, UUID groupId) {
        try {
            List<ActiveSessionView> activeSessions = activeSessionQuery.activeSessions(groupId);
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("groupId", groupId);
            data.put("activeSessions", activeSessions);
            hub.send(connection, MessageType.GROUP_JOINED, data);
        } catch (RuntimeException ex) {
            log.error("Failed to load active sessions of group {}", groupId, ex);
            hub.sendError(connection, GROUP_LOAD_FAILED);
        }
    }

    private void leaveGroup(LiveConnection connection, UUID groupId) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("groupId", groupId);
        hub.send(connection, MessageType.GROUP_LEFT, data);
    }

    private void reject(LiveConnection connection, String reason) {
        connection.markClosed();
        connection.getTransport().close(CloseCodes.POLICY_VIOLATION, reason);
    }
}
