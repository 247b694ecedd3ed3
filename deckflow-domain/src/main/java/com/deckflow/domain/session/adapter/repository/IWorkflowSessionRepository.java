package com.deckflow.domain.session.adapter.repository;

import com.deckflow.domain.session.model.entity.WorkflowSessionEntity;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.locks.Lock;

/**
 * 会话仓储接口
 *
 * @author deckflow
 * @since 2026-10-19
 */
public interface IWorkflowSessionRepository {

    /**
     * 保存会话
     */
    WorkflowSessionEntity save(WorkflowSessionEntity entity);

    /**
     * 根据 ID 查询，不存在返回 null
     */
    WorkflowSessionEntity findById(String id);

    boolean exists(String id);

    /**
     * 原子占用会话 ID。ID 未被占用或已由同一用户占用时返回 true。
     */
    boolean claim(String id, String userId);

    /**
     * 会话 ID 的归属用户，包括已占用但尚未创建的会话；未占用返回 null。
     */
    String ownerOf(String id);

    /**
     * 删除会话，同时释放其写锁与 ID 占用
     */
    boolean deleteById(String id);

    /**
     * 查询最后活跃时间早于 cutoff 的会话
     */
    List<WorkflowSessionEntity> findIdleBefore(Instant cutoff);

    int count();

    /**
     * 会话级写锁，每个会话 ID 一把，不存在全局锁。
     */
    Lock writeLock(String id);

    /**
     * ID 既无会话也无占用时丢弃其写锁。
     */
    void releaseLock(String id);
}
