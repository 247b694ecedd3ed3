package com.deckflow.domain.workflow.model.valobj;

import com.deckflow.domain.collaborator.model.valobj.CollaboratorRole;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.List;

/**
 * 工作流策略参数。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowPolicy {

    @Builder.Default
    private int maxClarificationRounds = 3;

    @Builder.Default
    private int maxRetries = 3;

    /** 完整度阈值，分析结果不低于该值即可直接生成 */
    @Builder.Default
    private double completenessThreshold = 0.8D;

    @Builder.Default
    private Duration collaboratorTimeout = Duration.ofSeconds(30);

    @Builder.Default
    private Duration backoffBase = Duration.ofMillis(500);

    @Builder.Default
    private Duration backoffMax = Duration.ofSeconds(8);

    @Builder.Default
    private int maxQuestionsPerRound = 5;

    @Builder.Default
    private int inputMaxLength = 5000;

    @Builder.Default
    private Duration sessionIdleTimeout = Duration.ofHours(1);

    @Builder.Default
    private List<String> generationRoles = List.of(
            CollaboratorRole.STRUCTURE, CollaboratorRole.RESEARCH, CollaboratorRole.LAYOUT);
}
