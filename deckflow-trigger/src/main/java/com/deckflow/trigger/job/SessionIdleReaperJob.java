package com.deckflow.trigger.job;

import com.deckflow.trigger.application.command.WorkflowOrchestratorService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 空闲会话回收任务。
 */
@Slf4j
@Component
public class SessionIdleReaperJob {

    private final WorkflowOrchestratorService orchestratorService;

    public SessionIdleReaperJob(WorkflowOrchestratorService orchestratorService) {
        this.orchestratorService = orchestratorService;
    }

    @Scheduled(fixedDelayString = "${session.reaper.interval-ms:300000}", scheduler = "daemonScheduler")
    public void reap() {
        try {
            int expired = orchestratorService.expireIdleSessions();
            if (expired > 0) {
                log.info("SESSION_IDLE_REAPED count={}", expired);
            }
        } catch (RuntimeException ex) {
            log.error("Idle session reaping failed. error={}", ex.getMessage(), ex);
        }
    }
}
