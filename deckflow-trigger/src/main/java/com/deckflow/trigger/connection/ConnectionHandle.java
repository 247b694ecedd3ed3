package com.deckflow.trigger.connection;

import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * 已通过认证的连接句柄。
 */
@Getter
public class ConnectionHandle {

    private final String connectionId;
    private final String userId;
    private final ClientChannel channel;
    private final Instant connectedAt;

    @Setter
    private volatile Instant lastSeenAt;

    @Setter
    private volatile String boundSessionId;

    public ConnectionHandle(String connectionId, String userId, ClientChannel channel, Instant connectedAt) {
        this.connectionId = connectionId;
        this.userId = userId;
        this.channel = channel;
        this.connectedAt = connectedAt;
        this.lastSeenAt = connectedAt;
    }
}
