package com.deckflow.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 线程池配置类。
 * <p>
 * <ul>
 *   <li>collaboratorWorkerExecutor：执行协作方同步调用，满载时拒绝，由网关转换为可重试的 UNAVAILABLE</li>
 *   <li>sessionWorkerExecutor：消费会话邮箱，满载时由提交线程执行</li>
 * </ul>
 * </p>
 *
 * @author deckflow
 * @since 2026-10-19
 */
@Slf4j
@Configuration
public class ThreadPoolConfig {

    @Bean(name = "collaboratorWorkerExecutor")
    @ConditionalOnMissingBean(name = "collaboratorWorkerExecutor")
    public ThreadPoolExecutor collaboratorWorkerExecutor(
            @Value("${executor.collaborator.core-size:8}") int coreSize,
            @Value("${executor.collaborator.max-size:32}") int maxSize,
            @Value("${executor.collaborator.keep-alive-seconds:60}") long keepAliveSeconds,
            @Value("${executor.collaborator.queue-capacity:200}") int queueCapacity,
            @Value("${executor.collaborator.rejection-policy:AbortPolicy}") String rejectionPolicy,
            @Value("${executor.collaborator.thread-name-prefix:collaborator-worker-}") String threadNamePrefix) {
        return buildExecutor(coreSize, maxSize, keepAliveSeconds, queueCapacity, rejectionPolicy, threadNamePrefix);
    }

    @Bean(name = "sessionWorkerExecutor")
    @ConditionalOnMissingBean(name = "sessionWorkerExecutor")
    public ThreadPoolExecutor sessionWorkerExecutor(
            @Value("${executor.session.core-size:8}") int coreSize,
            @Value("${executor.session.max-size:16}") int maxSize,
            @Value("${executor.session.keep-alive-seconds:60}") long keepAliveSeconds,
            @Value("${executor.session.queue-capacity:1000}") int queueCapacity,
            @Value("${executor.session.rejection-policy:CallerRunsPolicy}") String rejectionPolicy,
            @Value("${executor.session.thread-name-prefix:session-worker-}") String threadNamePrefix) {
        return buildExecutor(coreSize, maxSize, keepAliveSeconds, queueCapacity, rejectionPolicy, threadNamePrefix);
    }

    private ThreadPoolExecutor buildExecutor(int coreSize,
                                             int maxSize,
                                             long keepAliveSeconds,
                                             int queueCapacity,
                                             String rejectionPolicy,
                                             String threadNamePrefix) {
        int normalizedCoreSize = Math.max(coreSize, 1);
        int normalizedMaxSize = Math.max(maxSize, normalizedCoreSize);
        long normalizedKeepAliveSeconds = Math.max(keepAliveSeconds, 0L);
        int normalizedQueueCapacity = Math.max(queueCapacity, 0);
        BlockingQueue<Runnable> queue = normalizedQueueCapacity == 0
                ? new SynchronousQueue<>()
                : new LinkedBlockingQueue<>(normalizedQueueCapacity);
        AtomicInteger threadIndex = new AtomicInteger(0);
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(threadNamePrefix + threadIndex.incrementAndGet());
            thread.setDaemon(false);
            return thread;
        };
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                normalizedCoreSize,
                normalizedMaxSize,
                normalizedKeepAliveSeconds,
                TimeUnit.SECONDS,
                queue,
                threadFactory,
                buildRejectedExecutionHandler(rejectionPolicy));
        executor.allowCoreThreadTimeOut(false);
        return executor;
    }

    private RejectedExecutionHandler buildRejectedExecutionHandler(String policy) {
        if ("DiscardPolicy".equals(policy)) {
            return new ThreadPoolExecutor.DiscardPolicy();
        }
        if ("DiscardOldestPolicy".equals(policy)) {
            return new ThreadPoolExecutor.DiscardOldestPolicy();
        }
        if ("CallerRunsPolicy".equals(policy)) {
            return new ThreadPoolExecutor.CallerRunsPolicy();
        }
        if ("AbortPolicy".equals(policy)) {
            return new ThreadPoolExecutor.AbortPolicy();
        }
        log.warn("Unknown rejection policy '{}', fallback to AbortPolicy", policy);
        return new ThreadPoolExecutor.AbortPolicy();
    }

}
