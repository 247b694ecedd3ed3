package com.deckflow.trigger.router;

import com.deckflow.types.enums.ControlActionEnum;

import java.util.Map;

/**
 * 通过结构校验的入站消息。
 */
public sealed interface InboundMessage permits InboundMessage.ControlMessage, InboundMessage.InputMessage {

    String messageId();

    String sessionId();

    record ControlMessage(String messageId,
                          String sessionId,
                          ControlActionEnum action,
                          String text) implements InboundMessage {
    }

    record InputMessage(String messageId,
                        String sessionId,
                        String text,
                        Map<String, Object> answers) implements InboundMessage {
    }
}
