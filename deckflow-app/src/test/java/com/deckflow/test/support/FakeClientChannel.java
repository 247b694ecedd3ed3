package com.deckflow.test.support;

import com.deckflow.trigger.connection.ClientChannel;
import org.springframework.web.socket.CloseStatus;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 内存通道，记录发出的文本帧；failSends=true 时发送抛出 IOException。
 */
public class FakeClientChannel implements ClientChannel {

    private final String id;
    private final List<String> sent = new CopyOnWriteArrayList<>();
    private volatile boolean open = true;
    private volatile boolean failSends;
    private volatile CloseStatus closeStatus;

    public FakeClientChannel(String id) {
        this.id = id;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void send(String text) throws IOException {
        if (failSends) {
            throw new IOException("broken pipe");
        }
        sent.add(text);
    }

    @Override
    public void close(CloseStatus status) {
        this.open = false;
        this.closeStatus = status;
    }

    public void setFailSends(boolean failSends) {
        this.failSends = failSends;
    }

    public List<String> sent() {
        return new ArrayList<>(sent);
    }

    public CloseStatus getCloseStatus() {
        return closeStatus;
    }
}
