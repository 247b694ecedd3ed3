package com.deckflow.infrastructure.repository.session;

import com.deckflow.domain.session.adapter.repository.IWorkflowSessionRepository;
import com.deckflow.domain.session.model.entity.WorkflowSessionEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 进程内会话仓储实现。
 * <p>
 * 会话生命周期随进程；空闲超时由会话回收任务按 lastActivityAt 清理。
 * 会话 ID 先占用后创建，占用记录归属用户；写锁按会话 ID 分配，删除会话时一并释放。
 * </p>
 *
 * @author deckflow
 * @since 2026-10-19
 */
@Slf4j
@Repository
public class WorkflowSessionRepositoryImpl implements IWorkflowSessionRepository {

    private final ConcurrentMap<String, WorkflowSessionEntity> sessions = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> owners = new ConcurrentHashMap<>();

    @Override
    public WorkflowSessionEntity save(WorkflowSessionEntity entity) {
        if (entity == null || entity.getId() == null) {
            throw new IllegalArgumentException("Session and session id are required");
        }
        sessions.put(entity.getId(), entity);
        owners.putIfAbsent(entity.getId(), entity.getUserId());
        return entity;
    }

    @Override
    public WorkflowSessionEntity findById(String id) {
        return id == null ? null : sessions.get(id);
    }

    @Override
    public boolean exists(String id) {
        return id != null && sessions.containsKey(id);
    }

    @Override
    public boolean claim(String id, String userId) {
        if (id == null || userId == null) {
            return false;
        }
        String owner = owners.putIfAbsent(id, userId);
        return owner == null || owner.equals(userId);
    }

    @Override
    public String ownerOf(String id) {
        return id == null ? null : owners.get(id);
    }

    @Override
    public boolean deleteById(String id) {
        if (id == null) {
            return false;
        }
        WorkflowSessionEntity removed = sessions.remove(id);
        owners.remove(id);
        locks.remove(id);
        if (removed != null) {
            log.debug("Session removed from store. sessionId={}, phase={}", id, removed.getPhase());
        }
        return removed != null;
    }

    @Override
    public List<WorkflowSessionEntity> findIdleBefore(Instant cutoff) {
        List<WorkflowSessionEntity> idle = new ArrayList<>();
        for (WorkflowSessionEntity session : sessions.values()) {
            Instant lastActivityAt = session.getLastActivityAt();
            if (lastActivityAt != null && lastActivityAt.isBefore(cutoff)) {
                idle.add(session);
            }
        }
        return idle;
    }

    @Override
    public int count() {
        return sessions.size();
    }

    @Override
    public Lock writeLock(String id) {
        if (id == null) {
            throw new IllegalArgumentException("Session id is required");
        }
        return locks.computeIfAbsent(id, key -> new ReentrantLock());
    }

    @Override
    public void releaseLock(String id) {
        if (id == null) {
            return;
        }
        locks.computeIfPresent(id, (key, lock) -> sessions.containsKey(key) || owners.containsKey(key) ? lock : null);
    }
}
