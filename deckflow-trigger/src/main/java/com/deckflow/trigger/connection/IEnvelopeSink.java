package com.deckflow.trigger.connection;

import com.deckflow.api.dto.EnvelopeDTO;

/**
 * 出站信封投递端口：按会话找到当前绑定的通道。
 */
public interface IEnvelopeSink {

    /**
     * 投递信封。
     *
     * @return 会话当前有可用通道且发送成功时返回 true
     */
    boolean emit(String sessionId, EnvelopeDTO envelope);

    /**
     * 会话销毁后解除通道绑定。
     */
    void release(String sessionId);
}
