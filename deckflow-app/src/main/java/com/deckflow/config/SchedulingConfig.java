package com.deckflow.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * 调度器隔离配置：
 * 1) daemon-scheduler 承载心跳巡检与空闲会话回收；
 * 2) retry-scheduler 只承载协作方调用的退避重试，避免巡检任务拖慢重试。
 */
@Slf4j
@Configuration
@EnableScheduling
public class SchedulingConfig {

    @Bean(name = "daemonScheduler")
    public ThreadPoolTaskScheduler daemonScheduler(
            @Value("${scheduling.daemon.pool-size:2}") int poolSize,
            @Value("${scheduling.daemon.thread-name-prefix:daemon-scheduler-}") String threadNamePrefix,
            @Value("${scheduling.daemon.await-termination-seconds:30}") int awaitTerminationSeconds) {
        return buildScheduler(poolSize, threadNamePrefix, awaitTerminationSeconds);
    }

    @Bean(name = "retryScheduler")
    public ThreadPoolTaskScheduler retryScheduler(
            @Value("${scheduling.retry.pool-size:2}") int poolSize,
            @Value("${scheduling.retry.thread-name-prefix:retry-scheduler-}") String threadNamePrefix,
            @Value("${scheduling.retry.await-termination-seconds:5}") int awaitTerminationSeconds) {
        return buildScheduler(poolSize, threadNamePrefix, awaitTerminationSeconds);
    }

    private ThreadPoolTaskScheduler buildScheduler(int poolSize, String threadNamePrefix, int awaitTerminationSeconds) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(Math.max(poolSize, 1));
        scheduler.setThreadNamePrefix(threadNamePrefix);
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(Math.max(awaitTerminationSeconds, 0));
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setErrorHandler(throwable ->
                log.error("Scheduled task execution failed. scheduler={}, error={}",
                        threadNamePrefix, throwable.getMessage(), throwable));
        return scheduler;
    }
}
