package com.clocked.backend.modules.realtime.application;

import java.io.IOException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

import com.clocked.backend.modules.realtime.domain.BroadcastMessage;
import com.clocked.backend.modules.realtime.domain.CloseCodes;
import com.clocked.backend.modules.realtime.domain.LiveConnection;
import com.clocked.backend.modules.realtime.domain.MessageType;

import jakarta.annotation.PreDestroy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Best-effort fan-out to live connections. Sends run on the caller's thread against a snapshot
 * of the registry; a failing socket is dropped and never fails the caller.
 */
@Service
public class BroadcastHub {

    private static final Logger log = LoggerFactory.getLogger(BroadcastHub.class);

    private final ConnectionRegistry registry;
    private final RealtimeMessageCodec codec;
    private final Clock clock;

    public BroadcastHub(ConnectionRegistry registry, RealtimeMessageCodec codec, Clock clock) {
        this.registry = registry;
        this.codec = codec;
        this.clock = clock;
    }

    public int broadcastToGroup(BroadcastMessage message) {
        return broadcastToGroup(message, null);
    }

    /**
     * Delivers to each user's current connection when its scope contains the group.
     *
     * @param excludeUserId connections of this user are skipped; may be null
     * @return number of connections the frame was written to
     */
    public int broadcastToGroup(BroadcastMessage message, UUID excludeUserId) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.putAll(message.payload());
        data.put("groupId", message.groupId());
        String frame = codec.encode(message.type(), data, message.timestamp());

        int delivered = 0;
        for (LiveConnection connection : registry.userEntries()) {
            if (!connection.isInScope(message.groupId())) {
                continue;
            }
            if (excludeUserId != null && excludeUserId.equals(connection.getUserId())) {
                continue;
            }
            if (deliver(connection, frame)) {
                delivered++;
            }
        }
        log.debug("Broadcast {} to group {}: {} deliveries", message.type().wireName(), message.groupId(), delivered);
        return delivered;
    }

    public boolean sendToUser(UUID userId, MessageType type, Object data) {
        return registry.findByUser(userId)
                .filter(LiveConnection::isAuthenticated)
                .map(connection -> send(connection, type, data))
                .orElse(false);
    }

    public boolean send(LiveConnection connection, MessageType type, Object data) {
        return deliver(connection, codec.encode(type, data, clock.instant()));
    }

    public boolean sendError(LiveConnection connection, String message) {
        return send(connection, MessageType.ERROR, Map.of("message", message));
    }

    public int connectedCount() {
        return registry.connectedUsers();
    }

    public Set<UUID> groupClients(UUID groupId) {
        Set<UUID> userIds = new LinkedHashSet<>();
        for (LiveConnection connection : registry.userEntries()) {
            if (connection.isInScope(groupId) && connection.getTransport().isOpen()) {
                userIds.add(connection.getUserId());
            }
        }
        return userIds;
    }

    /**
     * Closes a connection and forgets it. Safe to call more than once.
     */
    public void disconnect(LiveConnection connection, int code, String reason) {
        connection.markClosed();
        registry.remove(connection);
        connection.getTransport().close(code, reason);
    }

    @PreDestroy
    public void shutdown() {
        List<LiveConnection> connections = registry.snapshot();
        for (LiveConnection connection : connections) {
            connection.markClosed();
            connection.getTransport().close(CloseCodes.GOING_AWAY, "Server shutting down");
        }
        registry.clear();
        log.info("Realtime hub stopped, closed {} connections", connections.size());
    }

    private boolean deliver(LiveConnection connection, String frame) {
        if (!connection.getTransport().isOpen()) {
            drop(connection);
            return false;
        }
        try {
            connection.getTransport().send(frame);
            return true;
        } catch (IOException | RuntimeException ex) {
            log.warn("Dropping connection {} of user {} after failed send: {}",
                    connection.getId(), connection.getUserId(), ex.getMessage());
            disconnect(connection, CloseCodes.SERVER_ERROR, "Send failed");
            return false;
        }
    }

    private void drop(LiveConnection connection) {
        if (registry.remove(connection)) {
            connection.markClosed();
            log.debug("Removed closed connection {} of user {}", connection.getId(),
                    Objects.toString(connection.getUserId(), "-"));
        }
    }
}
