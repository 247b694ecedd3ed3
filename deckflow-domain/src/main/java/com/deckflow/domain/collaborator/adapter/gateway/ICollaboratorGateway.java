package com.deckflow.domain.collaborator.adapter.gateway;

import com.deckflow.domain.collaborator.model.valobj.CollaboratorRequest;
import com.deckflow.domain.collaborator.model.valobj.CollaboratorResult;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * 协作方网关端口：统一的异步调用入口，编排服务不感知具体由哪个实现应答。
 */
public interface ICollaboratorGateway {

    /**
     * 发起一次限时调用。
     * <p>
     * 超时以 {@link com.deckflow.domain.collaborator.exception.CollaboratorException}（TIMEOUT）异常完成；
     * 其它失败以原始异常或 CollaboratorException 完成，由失败分类服务统一判定。
     * </p>
     *
     * @param request 调用请求
     * @param timeout 超时时间
     * @return 异步结果
     */
    CompletableFuture<CollaboratorResult> invoke(CollaboratorRequest request, Duration timeout);

    /**
     * 尽力取消会话下所有未完成调用，晚到结果由编排服务丢弃。
     */
    void cancel(String sessionId);

    /**
     * 实现标识，如 mock、llm。
     */
    String mode();
}
