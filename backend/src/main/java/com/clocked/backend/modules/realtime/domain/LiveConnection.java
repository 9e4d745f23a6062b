package com.clocked.backend.modules.realtime.domain;

import java.time.Instant;
import java.util.Set;
import java.util.UUID;

/**
 * One client socket and the identity bound to it. The group scope is the membership snapshot
 * taken at handshake and never changes for the life of the connection.
 */
public class LiveConnection {

    private final ConnectionTransport transport;

    private ConnectionState state = ConnectionState.CONNECTING;
    private UUID userId;
    private String handle;
    private Set<UUID> groupIds = Set.of();
    private volatile Instant lastActivityAt;

    public LiveConnection(ConnectionTransport transport, Instant openedAt) {
        this.transport = transport;
        this.lastActivityAt = openedAt;
    }

    public String getId() {
        return transport.id();
    }

    public ConnectionTransport getTransport() {
        return transport;
    }

    /**
     * Moves CONNECTING to AUTHENTICATED. Returns false when the connection was closed meanwhile.
     */
    public synchronized boolean authenticate(UUID userId, String handle, Set<UUID> groupIds) {
        if (state != ConnectionState.CONNECTING) {
            return false;
        }
        this.userId = userId;
        this.handle = handle;
        this.groupIds = Set.copyOf(groupIds);
        this.state = ConnectionState.AUTHENTICATED;
        return true;
    }

    public synchronized void markClosed() {
        state = ConnectionState.CLOSED;
    }

    public synchronized ConnectionState getState() {
        return state;
    }

    public synchronized boolean isAuthenticated() {
        return state == ConnectionState.AUTHENTICATED;
    }

    public synchronized boolean isClosed() {
        return state == ConnectionState.CLOSED;
    }

    public synchronized UUID getUserId() {
        return userId;
    }

    public synchronized String getHandle() {
        return handle;
    }

    public synchronized Set<UUID> getGroupIds() {
        return groupIds;
    }

    public synchronized boolean isInScope(UUID groupId) {
        return state == ConnectionState.AUTHENTICATED && groupId != null && groupIds.contains(groupId);
    }

    public void touch(Instant now) {
        lastActivityAt = now;
    }

    public boolean isIdleSince(Instant cutoff) {
        return lastActivityAt.isBefore(cutoff);
    }
}
