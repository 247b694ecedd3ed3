package com.deckflow.trigger.websocket;

import com.deckflow.trigger.connection.ClientChannel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;

/**
 * 基于 Spring WebSocket 会话的通道实现，发送经并发装饰器串行化。
 */
@Slf4j
public class WebSocketClientChannel implements ClientChannel {

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final WebSocketSession session;

    public WebSocketClientChannel(WebSocketSession session) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
    }

    @Override
    public String getId() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(String text) throws IOException {
        session.sendMessage(new TextMessage(text));
    }

    @Override
    public void close(CloseStatus status) {
        try {
            session.close(status);
        } catch (IOException ex) {
            log.debug("Failed to close websocket session. id={}, error={}", session.getId(), ex.getMessage());
        }
    }
}
