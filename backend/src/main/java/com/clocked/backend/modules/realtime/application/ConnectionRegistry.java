package com.clocked.backend.modules.realtime.application;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import com.clocked.backend.modules.realtime.domain.LiveConnection;

import org.springframework.stereotype.Component;

/**
 * Owns every live connection. Sockets are tracked by connection id from the moment they open;
 * once authenticated, a user has exactly one entry and a newer connection displaces the older one.
 */
@Component
public class ConnectionRegistry {

    private final Map<String, LiveConnection> connections = new ConcurrentHashMap<>();
    private final Map<UUID, LiveConnection> byUser = new ConcurrentHashMap<>();

    public void add(LiveConnection connection) {
        connections.put(connection.getId(), connection);
    }

    /**
     * Makes this connection the user's only entry. The displaced connection, if any, is no longer
     * reachable through the registry and is returned so the caller can close its socket.
     */
    public Optional<LiveConnection> bindUser(LiveConnection connection) {
        LiveConnection previous = byUser.put(connection.getUserId(), connection);
        if (previous == null || previous == connection) {
            return Optional.empty();
        }
        connections.remove(previous.getId(), previous);
        return Optional.of(previous);
    }

    /**
     * Forgets the connection. A displaced connection can never remove its replacement.
     */
    public boolean remove(LiveConnection connection) {
        boolean removed = connections.remove(connection.getId(), connection);
        UUID userId = connection.getUserId();
        if (userId != null) {
            byUser.remove(userId, connection);
        }
        return removed;
    }

    public Optional<LiveConnection> find(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId));
    }

    public Optional<LiveConnection> findByUser(UUID userId) {
        return Optional.ofNullable(byUser.get(userId));
    }

    /**
     * Point-in-time copy of every tracked socket, handshaking ones included.
     */
    public List<LiveConnection> snapshot() {
        return new ArrayList<>(connections.values());
    }

    /**
     * Point-in-time copy of the one authenticated entry per user.
     */
    public List<LiveConnection> userEntries() {
        return new ArrayList<>(byUser.values());
    }

    public int connectedUsers() {
        return byUser.size();
    }

    public void clear() {
        connections.clear();
        byUser.clear();
    }
}
