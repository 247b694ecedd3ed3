package com.deckflow.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * 工作流策略配置属性，前缀 workflow。
 *
 * @author deckflow
 * @since 2026-10-19
 */
@Data
@ConfigurationProperties(prefix = "workflow", ignoreInvalidFields = true)
public class WorkflowProperties {

    /** 最大澄清轮数，默认3 */
    private Integer maxClarificationRounds = 3;

    /** 单阶段最大重试次数，默认3 */
    private Integer maxRetries = 3;

    /** 完整度阈值，默认0.8 */
    private Double completenessThreshold = 0.8D;

    /** 单次协作方调用超时（毫秒） */
    private Long collaboratorTimeoutMs = 30000L;

    private Integer maxQuestionsPerRound = 5;

    /** 请求文本与单个回答的最大长度 */
    private Integer inputMaxLength = 5000;

    /** 会话空闲超时（毫秒），超时后被回收 */
    private Long sessionIdleTimeoutMs = 3600000L;

    private Backoff backoff = new Backoff();

    private Generation generation = new Generation();

    @Data
    public static class Backoff {

        private Long baseMs = 500L;

        private Long maxMs = 8000L;
    }

    @Data
    public static class Generation {

        /** 生成阶段并行调用的协作方角色，structure 必须包含在内 */
        private List<String> roles = new ArrayList<>(List.of("structure", "research", "layout"));
    }
}
