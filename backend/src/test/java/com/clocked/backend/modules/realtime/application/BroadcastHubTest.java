package com.clocked.backend.modules.realtime.application;

import static com.clocked.backend.modules.realtime.application.RealtimeTestSupport.json;
import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import com.clocked.backend.modules.realtime.domain.BroadcastMessage;
import com.clocked.backend.modules.realtime.domain.LiveConnection;
import com.clocked.backend.modules.realtime.domain.MessageType;

import com.fasterxml.jackson.databind.JsonNode;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class BroadcastHubTest {

    private static final Instant NOW = Instant.parse("2025-01-01T12:00:00Z");
    private static final UUID GROUP_A = UUID.fromString("00000000-0000-0000-0000-00000000aaaa");
    private static final UUID GROUP_B = UUID.fromString("00000000-0000-0000-0000-00000000bbbb");

    private ConnectionRegistry registry;
    private BroadcastHub hub;

    @BeforeEach
    void setUp() {
        registry = new ConnectionRegistry();
        hub = new BroadcastHub(registry, new RealtimeMessageCodec(RealtimeTestSupport.OBJECT_MAPPER), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private LiveConnection connect(RecordingTransport transport, UUID userId, Set<UUID> groups) {
        LiveConnection connection = new LiveConnection(transport, NOW);
        connection.authenticate(userId, "user-" + transport.id(), groups);
        registry.add(connection);
        registry.bindUser(connection);
        return connection;
    }

    private static BroadcastMessage sessionStarted(UUID groupId) {
        return new BroadcastMessage(MessageType.SESSION_STARTED, groupId, Map.of("session", Map.of("id", "s-1")), NOW);
    }

    @Test
    @DisplayName("only connections scoped to the group receive the broadcast")
    void broadcastIsScopedToGroupMembers() {
        RecordingTransport alice = new RecordingTransport("alice");
        RecordingTransport bob = new RecordingTransport("bob");
        connect(alice, UUID.randomUUID(), Set.of(GROUP_A));
        connect(bob, UUID.randomUUID(), Set.of(GROUP_B));

        int delivered = hub.broadcastToGroup(sessionStarted(GROUP_A));

        assertThat(delivered).isEqualTo(1);
        assertThat(bob.frames()).isEmpty();
        JsonNode frame = json(alice.frames().get(0));
        assertThat(frame.path("type").asText()).isEqualTo("session_started");
        assertThat(frame.path("data").path("groupId").asText()).isEqualTo(GROUP_A.toString());
        assertThat(frame.path("data").path("session").path("id").asText()).isEqualTo("s-1");
        assertThat(frame.path("timestamp").asText()).isEqualTo("2025-01-01T12:00:00Z");
    }

    @Test
    void excludedUserDoesNotReceiveOwnEvent() {
        UUID actor = UUID.randomUUID();
        RecordingTransport actorSocket = new RecordingTransport("actor");
        RecordingTransport peerSocket = new RecordingTransport("peer");
        connect(actorSocket, actor, Set.of(GROUP_A));
        connect(peerSocket, UUID.randomUUID(), Set.of(GROUP_A));

        int delivered = hub.broadcastToGroup(sessionStarted(GROUP_A), actor);

        assertThat(delivered).isEqualTo(1);
        assertThat(actorSocket.frames()).isEmpty();
        assertThat(peerSocket.frames()).hasSize(1);
    }

    @Test
    @DisplayName("a failing socket is dropped and the others still receive the message")
    void failingTransportDoesNotStopBroadcast() {
        RecordingTransport broken = new RecordingTransport("broken").failingSends();
        RecordingTransport healthy = new RecordingTransport("healthy");
        connect(broken, UUID.randomUUID(), Set.of(GROUP_A));
        connect(healthy, UUID.randomUUID(), Set.of(GROUP_A));

        int delivered = hub.broadcastToGroup(sessionStarted(GROUP_A));

        assertThat(delivered).isEqualTo(1);
        assertThat(healthy.frames()).hasSize(1);
        assertThat(registry.find("broken")).isEmpty();
        assertThat(broken.isOpen()).isFalse();
    }

    @Test
    void connectionStillHandshakingReceivesNothing() {
        RecordingTransport pending = new RecordingTransport("pending");
        registry.add(new LiveConnection(pending, NOW));

        assertThat(hub.broadcastToGroup(sessionStarted(GROUP_A))).isZero();
        assertThat(pending.frames()).isEmpty();
    }

    @Test
    @DisplayName("a newer connection of the same user replaces the older registry entry")
    void newerConnectionReplacesRegistryEntry() {
        UUID userId = UUID.randomUUID();
        RecordingTransport phone = new RecordingTransport("phone");
        RecordingTransport tablet = new RecordingTransport("tablet");
        connect(phone, userId, Set.of(GROUP_A));
        connect(tablet, userId, Set.of(GROUP_A));

        assertThat(registry.snapshot()).extracting(LiveConnection::getId).containsExactly("tablet");
        assertThat(registry.find("phone")).isEmpty();

        assertThat(hub.broadcastToGroup(sessionStarted(GROUP_A))).isEqualTo(1);
        assertThat(hub.sendToUser(userId, MessageType.PONG, null)).isTrue();
        assertThat(hub.sendToUser(UUID.randomUUID(), MessageType.PONG, null)).isFalse();

        assertThat(phone.frames()).isEmpty();
        assertThat(tablet.frames()).hasSize(2);
        assertThat(json(tablet.frames().get(1)).has("data")).isFalse();
    }

    @Test
    void removingDisplacedConnectionKeepsReplacement() {
        UUID userId = UUID.randomUUID();
        LiveConnection phone = connect(new RecordingTransport("phone"), userId, Set.of(GROUP_A));
        connect(new RecordingTransport("tablet"), userId, Set.of(GROUP_A));

        hub.disconnect(phone, 1001, "Replaced by a newer connection");

        assertThat(registry.findByUser(userId).map(LiveConnection::getId)).contains("tablet");
        assertThat(hub.connectedCount()).isEqualTo(1);
    }

    @Test
    void payloadCannotRerouteGroupId() {
        RecordingTransport alice = new RecordingTransport("alice");
        connect(alice, UUID.randomUUID(), Set.of(GROUP_A));
        Map<String, Object> payload = new HashMap<>();
        payload.put("groupId", GROUP_B.toString());
        BroadcastMessage message = new BroadcastMessage(MessageType.MEMBER_JOINED, GROUP_A, payload, NOW);
        payload.put("late", "ignored");

        hub.broadcastToGroup(message);

        JsonNode data = json(alice.frames().get(0)).path("data");
        assertThat(data.path("groupId").asText()).isEqualTo(GROUP_A.toString());
        assertThat(data.has("late")).isFalse();
    }

    @Test
    void countsUsersAndGroupClients() {
        UUID alice = UUID.randomUUID();
        UUID bob = UUID.randomUUID();
        connect(new RecordingTransport("a1"), alice, Set.of(GROUP_A));
        connect(new RecordingTransport("a2"), alice, Set.of(GROUP_A));
        connect(new RecordingTransport("b1"), bob, Set.of(GROUP_B));

        assertThat(hub.connectedCount()).isEqualTo(2);
        assertThat(hub.groupClients(GROUP_A)).containsExactly(alice);
        assertThat(hub.groupClients(GROUP_B)).containsExactly(bob);
    }

    @Test
    void shutdownClosesEverySocket() {
        RecordingTransport first = new RecordingTransport("first");
        RecordingTransport second = new RecordingTransport("second");
        connect(first, UUID.randomUUID(), Set.of(GROUP_A));
        registry.add(new LiveConnection(second, NOW));

        hub.shutdown();

        assertThat(first.closeCode()).isEqualTo(1001);
        assertThat(first.closeReason()).isEqualTo("Server shutting down");
        assertThat(second.closeCode()).isEqualTo(1001);
        assertThat(registry.snapshot()).isEmpty();
        assertThat(hub.connectedCount()).isZero();
    }
}
