package com.deckflow.test;

import com.deckflow.infrastructure.identity.ConfiguredTokenIdentityGateway;
import com.deckflow.test.support.FakeClientChannel;
import com.deckflow.test.support.TestSupport;
import com.deckflow.trigger.application.common.EnvelopeFactory;
import com.deckflow.trigger.connection.ConnectionHandle;
import com.deckflow.trigger.connection.ConnectionManager;
import com.deckflow.trigger.connection.ConnectionManager.TeardownReason;
import com.deckflow.types.enums.ControlActionEnum;
import com.deckflow.types.enums.ErrorCodeEnum;
import com.deckflow.types.exception.AppException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.CloseStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ConnectionManagerTest {

    private final EnvelopeFactory envelopeFactory = new EnvelopeFactory();

    private SimpleMeterRegistry meterRegistry;
    private ConnectionManager connectionManager;
    private List<String> teardowns;

    @BeforeEach
    public void setUp() {
        this.meterRegistry = new SimpleMeterRegistry();
        this.connectionManager = new ConnectionManager(
                new ConfiguredTokenIdentityGateway(Map.of("tok-alice", "alice", "tok-bob", "bob")),
                envelopeFactory,
                new ObjectMapper(),
                TestSupport.meterRegistryProvider(meterRegistry),
                1000L);
        this.teardowns = new ArrayList<>();
        connectionManager.addTeardownListener((connectionId, sessionId, reason) ->
                teardowns.add(connectionId + ":" + sessionId + ":" + reason));
    }

    @Test
    public void shouldAcceptBearerCredential() {
        ConnectionHandle handle = connectionManager.accept("Bearer tok-alice", new FakeClientChannel("c1"));

        assertEquals("alice", handle.getUserId());
        assertEquals("c1", handle.getConnectionId());
        assertEquals(1, connectionManager.activeConnections());
    }

    @Test
    public void shouldRejectUnknownCredential() {
        AppException ex = assertThrows(AppException.class,
                () -> connectionManager.accept("tok-mallory", new FakeClientChannel("c1")));

        assertEquals(ErrorCodeEnum.AUTH_FAILED.getCode(), ex.getCode());
        assertEquals(0, connectionManager.activeConnections());
    }

    @Test
    public void shouldDropEnvelopeForUnboundSession() {
        connectionManager.accept("tok-alice", new FakeClientChannel("c1"));

        assertFalse(connectionManager.emit("s1", envelopeFactory.control("s1", ControlActionEnum.PONG)));
    }

    @Test
    public void shouldEmitToBoundConnection() {
        FakeClientChannel channel = new FakeClientChannel("c1");
        connectionManager.accept("tok-alice", channel);
        connectionManager.bindSession("c1", "s1");

        assertTrue(connectionManager.emit("s1", envelopeFactory.control("s1", ControlActionEnum.PONG)));

        assertEquals(1, channel.sent().size());
        String frame = channel.sent().get(0);
        assertTrue(frame.contains("\"session_id\":\"s1\""));
        assertTrue(frame.contains("\"type\":\"control\""));
        assertTrue(frame.contains("\"action\":\"pong\""));
    }

    @Test
    public void shouldMoveSessionToNewestConnection() {
        FakeClientChannel first = new FakeClientChannel("c1");
        FakeClientChannel second = new FakeClientChannel("c2");
        connectionManager.accept("tok-alice", first);
        connectionManager.accept("tok-alice", second);
        connectionManager.bindSession("c1", "s1");
        connectionManager.bindSession("c2", "s1");

        assertTrue(connectionManager.isBound("s1", "c2"));
        assertFalse(connectionManager.isBound("s1", "c1"));

        connectionManager.emit("s1", envelopeFactory.control("s1", ControlActionEnum.PONG));
        assertTrue(first.sent().isEmpty());
        assertEquals(1, second.sent().size());

        connectionManager.teardown("c1", TeardownReason.CLIENT_CLOSED);
        assertTrue(teardowns.isEmpty());
        assertTrue(connectionManager.isBound("s1", "c2"));
    }

    @Test
    public void shouldNotifyListenerOnceOnTeardown() {
        FakeClientChannel channel = new FakeClientChannel("c1");
        connectionManager.accept("tok-alice", channel);
        connectionManager.bindSession("c1", "s1");

        connectionManager.teardown("c1", TeardownReason.CLIENT_CLOSED);
        connectionManager.teardown("c1", TeardownReason.CLIENT_CLOSED);

        assertEquals(List.of("c1:s1:CLIENT_CLOSED"), teardowns);
        assertFalse(channel.isOpen());
        assertEquals(CloseStatus.NORMAL, channel.getCloseStatus());
        assertFalse(connectionManager.emit("s1", envelopeFactory.control("s1", ControlActionEnum.PONG)));
    }

    @Test
    public void shouldTearDownWhenSendFails() {
        FakeClientChannel channel = new FakeClientChannel("c1");
        connectionManager.accept("tok-alice", channel);
        connectionManager.bindSession("c1", "s1");
        channel.setFailSends(true);

        assertFalse(connectionManager.emit("s1", envelopeFactory.control("s1", ControlActionEnum.PONG)));

        assertEquals(List.of("c1:s1:SEND_FAILED"), teardowns);
        assertEquals(0, connectionManager.activeConnections());
    }

    @Test
    public void shouldTearDownSilentConnectionsAndPingOthers() {
        FakeClientChannel silent = new FakeClientChannel("c1");
        FakeClientChannel alive = new FakeClientChannel("c2");
        connectionManager.accept("tok-alice", silent).setLastSeenAt(Instant.now().minus(Duration.ofMinutes(2)));
        connectionManager.accept("tok-bob", alive);
        connectionManager.bindSession("c1", "s1");

        connectionManager.sweepHeartbeats();

        assertEquals(List.of("c1:s1:HEARTBEAT_TIMEOUT"), teardowns);
        assertEquals(CloseStatus.SESSION_NOT_RELIABLE, silent.getCloseStatus());
        assertEquals(1, alive.sent().size());
        assertTrue(alive.sent().get(0).contains("\"action\":\"ping\""));
        assertEquals(1.0D, meterRegistry.counter("deckflow.connection.heartbeat_timeout.total").count());
    }

    @Test
    public void shouldReleaseSessionBinding() {
        connectionManager.accept("tok-alice", new FakeClientChannel("c1"));
        connectionManager.bindSession("c1", "s1");

        connectionManager.release("s1");

        assertFalse(connectionManager.isBound("s1", "c1"));
        assertEquals(null, connectionManager.find("c1").getBoundSessionId());
    }

    @Test
    public void shouldCloseEverythingOnShutdown() {
        FakeClientChannel channel = new FakeClientChannel("c1");
        connectionManager.accept("tok-alice", channel);

        connectionManager.shutdown();

        assertEquals(0, connectionManager.activeConnections());
        assertEquals(CloseStatus.GOING_AWAY, channel.getCloseStatus());
    }
}
