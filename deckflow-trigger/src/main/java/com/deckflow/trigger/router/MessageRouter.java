package com.deckflow.trigger.router;

import com.deckflow.domain.session.adapter.repository.IWorkflowSessionRepository;
import com.deckflow.domain.session.model.entity.WorkflowSessionEntity;
import com.deckflow.trigger.application.command.WorkflowOrchestratorService;
import com.deckflow.trigger.application.common.EnvelopeFactory;
import com.deckflow.trigger.connection.ConnectionHandle;
import com.deckflow.trigger.connection.ConnectionManager;
import com.deckflow.trigger.router.InboundMessage.ControlMessage;
import com.deckflow.trigger.router.InboundMessage.InputMessage;
import com.deckflow.trigger.router.SessionMailboxDispatcher.WorkItem;
import com.deckflow.types.common.Constants;
import com.deckflow.types.enums.ControlActionEnum;
import com.deckflow.types.enums.ErrorCodeEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * 消息路由：校验入站信封、解析会话并投递到会话邮箱。
 * <p>
 * 协议错误直接回送到来源通道，不修改任何会话状态；
 * 路由层只读取和占用会话归属，不改写会话。
 * </p>
 */
@Slf4j
@Component
public class MessageRouter {

    private static final Pattern CLIENT_SESSION_ID = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    private final ConnectionManager connectionManager;
    private final EnvelopeValidator envelopeValidator;
    private final SessionMailboxDispatcher dispatcher;
    private final WorkflowOrchestratorService orchestratorService;
    private final IWorkflowSessionRepository sessionRepository;
    private final EnvelopeFactory envelopeFactory;

    public MessageRouter(ConnectionManager connectionManager,
                         EnvelopeValidator envelopeValidator,
                         SessionMailboxDispatcher dispatcher,
                         WorkflowOrchestratorService orchestratorService,
                         IWorkflowSessionRepository sessionRepository,
                         EnvelopeFactory envelopeFactory) {
        this.connectionManager = connectionManager;
        this.envelopeValidator = envelopeValidator;
        this.dispatcher = dispatcher;
        this.orchestratorService = orchestratorService;
        this.sessionRepository = sessionRepository;
        this.envelopeFactory = envelopeFactory;
        connectionManager.addTeardownListener(this::onTeardown);
    }

    public void route(String connectionId, String raw) {
        ConnectionHandle connection = connectionManager.find(connectionId);
        if (connection == null) {
            log.debug("Inbound message dropped, connection unknown. connectionId={}", connectionId);
            return;
        }
        connectionManager.touch(connectionId);

        InboundMessage message;
        try {
            message = envelopeValidator.validate(raw);
        } catch (EnvelopeValidationException ex) {
            log.info("WS_PROTOCOL_ERROR connectionId={}, code={}, field={}, reason={}",
                    connectionId, ex.getErrorCode().getCode(), ex.getField(), ex.getInfo());
            protocolError(connectionId, ex.getSessionId(), ex.getErrorCode(), ex.getInfo());
            return;
        }

        if (message instanceof ControlMessage control) {
            routeControl(connection, control);
        } else if (message instanceof InputMessage input) {
            routeInput(connection, input);
        }
    }

    private void routeControl(ConnectionHandle connection, ControlMessage control) {
        String connectionId = connection.getConnectionId();
        ControlActionEnum action = control.action();
        if (action == ControlActionEnum.PING) {
            connectionManager.sendTo(connectionId, envelopeFactory.control(control.sessionId(), ControlActionEnum.PONG));
            return;
        }
        if (action == ControlActionEnum.PONG) {
            return;
        }
        if (action == ControlActionEnum.START) {
            routeStart(connection, control);
            return;
        }

        String sessionId = resolveOwnedSessionId(connection, control.sessionId());
        if (sessionId == null) {
            return;
        }
        connectionManager.bindSession(connectionId, sessionId);
        if (action == ControlActionEnum.CANCEL) {
            dispatcher.submit(sessionId, WorkItem.control("control.cancel", control.messageId(),
                    () -> orchestratorService.cancel(sessionId)));
        } else if (action == ControlActionEnum.CLOSE) {
            dispatcher.submit(sessionId, WorkItem.control("control.close", control.messageId(),
                    () -> orchestratorService.close(sessionId)));
        }
    }

    private void routeStart(ConnectionHandle connection, ControlMessage control) {
        String connectionId = connection.getConnectionId();
        String userId = connection.getUserId();
        String requestedId = control.sessionId();

        WorkflowSessionEntity existing = sessionRepository.findById(requestedId);
        if (existing != null) {
            if (!existing.isOwnedBy(userId)) {
                protocolError(connectionId, requestedId, ErrorCodeEnum.SESSION_FORBIDDEN, null);
                return;
            }
            connectionManager.bindSession(connectionId, requestedId);
            log.info("WS_SESSION_RESUME_REQUESTED connectionId={}, sessionId={}", connectionId, requestedId);
            dispatcher.submit(requestedId, WorkItem.control("control.resume", control.messageId(),
                    () -> orchestratorService.resume(requestedId, userId)));
            if (control.text() != null) {
                dispatcher.submit(requestedId, WorkItem.input(control.messageId(),
                        () -> orchestratorService.handleInput(requestedId, control.messageId(), control.text(), null)));
            }
            return;
        }

        String sessionId = requestedId;
        if (sessionId == null) {
            sessionId = Constants.SESSION_ID_PREFIX + UUID.randomUUID().toString().replace("-", "");
        } else if (!CLIENT_SESSION_ID.matcher(sessionId).matches()) {
            protocolError(connectionId, requestedId, ErrorCodeEnum.INVALID_ENVELOPE,
                    "session_id must match " + CLIENT_SESSION_ID.pattern());
            return;
        }
        if (!sessionRepository.claim(sessionId, userId)) {
            log.warn("WS_SESSION_FORBIDDEN connectionId={}, sessionId={}, userId={}, reason=claimed",
                    connectionId, sessionId, userId);
            protocolError(connectionId, requestedId, ErrorCodeEnum.SESSION_FORBIDDEN, null);
            return;
        }
        String newSessionId = sessionId;
        connectionManager.bindSession(connectionId, newSessionId);
        dispatcher.submit(newSessionId, WorkItem.control("control.start", control.messageId(),
                () -> orchestratorService.start(newSessionId, userId, control.messageId(), control.text())));
    }

    private void routeInput(ConnectionHandle connection, InputMessage input) {
        String connectionId = connection.getConnectionId();
        boolean bound = connectionManager.isBound(input.sessionId(), connectionId);
        String sessionId = resolveOwnedSessionId(connection, input.sessionId());
        if (sessionId == null) {
            return;
        }
        if (!bound) {
            connectionManager.bindSession(connectionId, sessionId);
            String userId = connection.getUserId();
            dispatcher.submit(sessionId, WorkItem.control("control.resume", input.messageId(),
                    () -> orchestratorService.resume(sessionId, userId)));
        }
        dispatcher.submit(sessionId, WorkItem.input(input.messageId(),
                () -> orchestratorService.handleInput(sessionId, input.messageId(), input.text(), input.answers())));
    }

    /**
     * 解析当前用户可操作的会话；按 ID 的归属判断，包括已占用、尚在创建中的会话。
     */
    private String resolveOwnedSessionId(ConnectionHandle connection, String sessionId) {
        String connectionId = connection.getConnectionId();
        String owner = sessionRepository.ownerOf(sessionId);
        if (owner == null) {
            protocolError(connectionId, sessionId, ErrorCodeEnum.SESSION_NOT_FOUND, null);
            return null;
        }
        if (!owner.equals(connection.getUserId())) {
            log.warn("WS_SESSION_FORBIDDEN connectionId={}, sessionId={}, userId={}",
                    connectionId, sessionId, connection.getUserId());
            protocolError(connectionId, sessionId, ErrorCodeEnum.SESSION_FORBIDDEN, null);
            return null;
        }
        return sessionId;
    }

    private void onTeardown(String connectionId, String sessionId, ConnectionManager.TeardownReason reason) {
        dispatcher.submit(sessionId, WorkItem.internal("connection.teardown",
                () -> orchestratorService.suspend(sessionId)));
    }

    private void protocolError(String connectionId, String sessionId, ErrorCodeEnum code, String message) {
        connectionManager.sendTo(connectionId, envelopeFactory.error(sessionId, code, message));
    }
}
