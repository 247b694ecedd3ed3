package com.deckflow.trigger.websocket;

import com.deckflow.trigger.application.common.EnvelopeFactory;
import com.deckflow.trigger.connection.ConnectionManager;
import com.deckflow.trigger.router.MessageRouter;
import com.deckflow.types.enums.ErrorCodeEnum;
import com.deckflow.types.exception.AppException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;

/**
 * 工作流 WebSocket 入口：建立连接时认证，文本帧交给消息路由。
 */
@Slf4j
@Component
public class DirectorWebSocketHandler extends TextWebSocketHandler {

    private final ConnectionManager connectionManager;
    private final MessageRouter messageRouter;
    private final EnvelopeFactory envelopeFactory;
    private final ObjectMapper objectMapper;

    public DirectorWebSocketHandler(ConnectionManager connectionManager,
                                    MessageRouter messageRouter,
                                    EnvelopeFactory envelopeFactory,
                                    ObjectMapper objectMapper) {
        this.connectionManager = connectionManager;
        this.messageRouter = messageRouter;
        this.envelopeFactory = envelopeFactory;
        this.objectMapper = objectMapper;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        Object credential = session.getAttributes().get(CredentialHandshakeInterceptor.CREDENTIAL_ATTRIBUTE);
        WebSocketClientChannel channel = new WebSocketClientChannel(session);
        try {
            connectionManager.accept(credential == null ? null : String.valueOf(credential), channel);
        } catch (AppException ex) {
            log.warn("WS_CONNECTION_REJECTED id={}, remote={}, code={}", session.getId(), session.getRemoteAddress(), ex.getCode());
            rejectConnection(channel);
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        messageRouter.route(session.getId(), message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("WS_TRANSPORT_ERROR id={}, error={}", session.getId(), exception.getMessage());
        connectionManager.teardown(session.getId(), ConnectionManager.TeardownReason.SEND_FAILED);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        connectionManager.teardown(session.getId(), ConnectionManager.TeardownReason.CLIENT_CLOSED);
    }

    private void rejectConnection(WebSocketClientChannel channel) {
        try {
            channel.send(objectMapper.writeValueAsString(envelopeFactory.error(null, ErrorCodeEnum.AUTH_FAILED, null)));
        } catch (IOException ex) {
            log.debug("Failed to send auth error before close. id={}, error={}", channel.getId(), ex.getMessage());
        }
        channel.close(CloseStatus.POLICY_VIOLATION);
    }
}
