package com.deckflow.types.common;

/**
 * 全局常量定义类。
 *
 * @author deckflow
 * @since 2026-10-19
 */
public class Constants {

    /** 逗号分隔符，用于配置项切分 */
    public final static String SPLIT = ",";

    /** MDC 中的会话 ID 键 */
    public final static String MDC_SESSION_ID = "sessionId";

    /** MDC 中的消息 ID 键 */
    public final static String MDC_MESSAGE_ID = "messageId";

    /** 服务端生成的会话 ID 前缀 */
    public final static String SESSION_ID_PREFIX = "sess_";

    /** 服务端生成的消息 ID 前缀 */
    public final static String MESSAGE_ID_PREFIX = "msg_";

    /** REST 鉴权通过后写入请求属性的用户 ID 键 */
    public final static String AUTH_USER_ID_ATTRIBUTE = "auth.userId";

}
