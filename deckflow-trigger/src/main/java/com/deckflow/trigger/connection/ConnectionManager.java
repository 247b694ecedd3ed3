package com.deckflow.trigger.connection;

import com.deckflow.api.dto.EnvelopeDTO;
import com.deckflow.domain.identity.adapter.gateway.IIdentityGateway;
import com.deckflow.trigger.application.common.EnvelopeFactory;
import com.deckflow.types.enums.ControlActionEnum;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 连接管理：认证接入、心跳保活、会话绑定与通道拆除。
 * <p>
 * 拆除通道只解除绑定并通知监听方，不删除会话。
 * </p>
 */
@Slf4j
@Component
public class ConnectionManager implements IEnvelopeSink {

    private final IIdentityGateway identityGateway;
    private final EnvelopeFactory envelopeFactory;
    private final ObjectMapper objectMapper;
    private final Duration heartbeatTimeout;
    private final ConcurrentMap<String, ConnectionHandle> connections;
    private final ConcurrentMap<String, String> connectionBySession;
    private final List<ChannelTeardownListener> teardownListeners;
    private final Counter heartbeatTimeoutCounter;

    public ConnectionManager(IIdentityGateway identityGateway,
                             EnvelopeFactory envelopeFactory,
                             ObjectMapper objectMapper,
                             ObjectProvider<MeterRegistry> meterRegistryProvider,
                             @Value("${connection.heartbeat.timeout-ms:45000}") long heartbeatTimeoutMs) {
        this.identityGateway = identityGateway;
        this.envelopeFactory = envelopeFactory;
        this.objectMapper = objectMapper;
        this.heartbeatTimeout = Duration.ofMillis(heartbeatTimeoutMs <= 0 ? 45000L : heartbeatTimeoutMs);
        this.connections = new ConcurrentHashMap<>();
        this.connectionBySession = new ConcurrentHashMap<>();
        this.teardownListeners = new CopyOnWriteArrayList<>();
        MeterRegistry meterRegistry = meterRegistryProvider.getIfAvailable(SimpleMeterRegistry::new);
        this.heartbeatTimeoutCounter = Counter.builder("deckflow.connection.heartbeat_timeout.total").register(meterRegistry);
    }

    /**
     * 校验凭证并登记通道，凭证无效时抛出 AUTH_FAILED。
     */
    public ConnectionHandle accept(String credential, ClientChannel channel) {
        String userId = identityGateway.verify(credential);
        ConnectionHandle handle = new ConnectionHandle(channel.getId(), userId, channel, Instant.now());
        connections.put(handle.getConnectionId(), handle);
        log.info("WS_CONNECTION_ACCEPTED connectionId={}, userId={}", handle.getConnectionId(), userId);
        return handle;
    }

    public ConnectionHandle find(String connectionId) {
        return connectionId == null ? null : connections.get(connectionId);
    }

    public void touch(String connectionId) {
        ConnectionHandle handle = find(connectionId);
        if (handle != null) {
            handle.setLastSeenAt(Instant.now());
        }
    }

    public void addTeardownListener(ChannelTeardownListener listener) {
        teardownListeners.add(listener);
    }

    /**
     * 把会话绑定到连接；会话原先绑定的连接随之解绑。
     */
    public void bindSession(String connectionId, String sessionId) {
        ConnectionHandle handle = find(connectionId);
        if (handle == null || sessionId == null) {
            return;
        }
        String previousSessionId = handle.getBoundSessionId();
        if (previousSessionId != null && !previousSessionId.equals(sessionId)) {
            connectionBySession.remove(previousSessionId, connectionId);
        }
        String previousConnectionId = connectionBySession.put(sessionId, connectionId);
        if (previousConnectionId != null && !previousConnectionId.equals(connectionId)) {
            ConnectionHandle previous = find(previousConnectionId);
            if (previous != null && sessionId.equals(previous.getBoundSessionId())) {
                previous.setBoundSessionId(null);
            }
            log.info("WS_SESSION_REBOUND sessionId={}, fromConnectionId={}, toConnectionId={}",
                    sessionId, previousConnectionId, connectionId);
        }
        handle.setBoundSessionId(sessionId);
    }

    public boolean isBound(String sessionId, String connectionId) {
        return sessionId != null && connectionId != null && connectionId.equals(connectionBySession.get(sessionId));
    }

    @Override
    public boolean emit(String sessionId, EnvelopeDTO envelope) {
        String connectionId = sessionId == null ? null : connectionBySession.get(sessionId);
        if (connectionId == null) {
            log.debug("Outbound envelope dropped, session not bound. sessionId={}, type={}", sessionId, envelope.getType());
            return false;
        }
        return sendTo(connectionId, envelope);
    }

    @Override
    public void release(String sessionId) {
        if (sessionId == null) {
            return;
        }
        String connectionId = connectionBySession.remove(sessionId);
        ConnectionHandle handle = find(connectionId);
        if (handle != null && sessionId.equals(handle.getBoundSessionId())) {
            handle.setBoundSessionId(null);
        }
    }

    /**
     * 直接向连接发送，用于尚未解析出会话的协议错误与心跳。
     */
    public boolean sendTo(String connectionId, EnvelopeDTO envelope) {
        ConnectionHandle handle = find(connectionId);
        if (handle == null || !handle.getChannel().isOpen()) {
            return false;
        }
        String text;
        try {
            text = objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException ex) {
            log.error("Failed to serialize outbound envelope. connectionId={}, type={}, error={}",
                    connectionId, envelope.getType(), ex.getMessage(), ex);
            return false;
        }
        try {
            handle.getChannel().send(text);
            return true;
        } catch (IOException | IllegalStateException ex) {
            log.warn("WS_SEND_FAILED connectionId={}, type={}, error={}", connectionId, envelope.getType(), ex.getMessage());
            teardown(connectionId, TeardownReason.SEND_FAILED);
            return false;
        }
    }

    /**
     * 心跳巡检：超时的连接拆除，其余连接发送 ping。
     */
    public void sweepHeartbeats() {
        Instant deadline = Instant.now().minus(heartbeatTimeout);
        for (ConnectionHandle handle : connections.values()) {
            if (handle.getLastSeenAt().isBefore(deadline)) {
                heartbeatTimeoutCounter.increment();
                log.warn("WS_HEARTBEAT_TIMEOUT connectionId={}, sessionId={}, lastSeenAt={}",
                        handle.getConnectionId(), handle.getBoundSessionId(), handle.getLastSeenAt());
                teardown(handle.getConnectionId(), TeardownReason.HEARTBEAT_TIMEOUT);
                continue;
            }
            sendTo(handle.getConnectionId(), envelopeFactory.control(handle.getBoundSessionId(), ControlActionEnum.PING));
        }
    }

    /**
     * 拆除连接，可重复调用。
     */
    public void teardown(String connectionId, TeardownReason reason) {
        ConnectionHandle handle = connectionId == null ? null : connections.remove(connectionId);
        if (handle == null) {
            return;
        }
        String sessionId = handle.getBoundSessionId();
        boolean wasBound = sessionId != null && connectionBySession.remove(sessionId, connectionId);
        handle.setBoundSessionId(null);
        if (handle.getChannel().isOpen()) {
            handle.getChannel().close(reason.getCloseStatus());
        }
        log.info("WS_CONNECTION_CLOSED connectionId={}, userId={}, sessionId={}, reason={}",
                connectionId, handle.getUserId(), sessionId, reason);
        if (!wasBound) {
            return;
        }
        for (ChannelTeardownListener listener : teardownListeners) {
            try {
                listener.onTeardown(connectionId, sessionId, reason);
            } catch (RuntimeException ex) {
                log.error("Teardown listener failed. connectionId={}, sessionId={}, error={}",
                        connectionId, sessionId, ex.getMessage(), ex);
            }
        }
    }

    public int activeConnections() {
        return connections.size();
    }

    @PreDestroy
    public void shutdown() {
        for (String connectionId : connections.keySet()) {
            teardown(connectionId, TeardownReason.SERVER_SHUTDOWN);
        }
    }

    public enum TeardownReason {
        CLIENT_CLOSED(CloseStatus.NORMAL),
        HEARTBEAT_TIMEOUT(CloseStatus.SESSION_NOT_RELIABLE),
        SEND_FAILED(CloseStatus.SESSION_NOT_RELIABLE),
        SERVER_SHUTDOWN(CloseStatus.GOING_AWAY);

        private final CloseStatus closeStatus;

        TeardownReason(CloseStatus closeStatus) {
            this.closeStatus = closeStatus;
        }

        public CloseStatus getCloseStatus() {
            return closeStatus;
        }
    }

    @FunctionalInterface
    public interface ChannelTeardownListener {

        void onTeardown(String connectionId, String sessionId, TeardownReason reason);
    }
}
