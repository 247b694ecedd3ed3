package com.deckflow.trigger.job;

import com.deckflow.trigger.connection.ConnectionManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 心跳巡检任务：向存活连接发送 ping，拆除超时连接。
 */
@Slf4j
@Component
public class ConnectionHeartbeatJob {

    private final ConnectionManager connectionManager;

    public ConnectionHeartbeatJob(ConnectionManager connectionManager) {
        this.connectionManager = connectionManager;
    }

    @Scheduled(fixedDelayString = "${connection.heartbeat.interval-ms:15000}", scheduler = "daemonScheduler")
    public void sweep() {
        try {
            connectionManager.sweepHeartbeats();
        } catch (RuntimeException ex) {
            log.error("Heartbeat sweep failed. error={}", ex.getMessage(), ex);
        }
    }
}
