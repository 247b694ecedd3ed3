package com.deckflow.trigger.connection;

import org.springframework.web.socket.CloseStatus;

import java.io.IOException;

/**
 * 物理通道抽象，一个客户端连接对应一个通道。
 */
public interface ClientChannel {

    String getId();

    boolean isOpen();

    /**
     * 发送一条文本帧，实现需保证并发调用安全。
     */
    void send(String text) throws IOException;

    void close(CloseStatus status);
}
