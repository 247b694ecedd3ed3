package com.deckflow.config;

import com.deckflow.domain.collaborator.model.valobj.CollaboratorRole;
import com.deckflow.domain.workflow.model.valobj.WorkflowPolicy;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 工作流策略装配：把配置属性规整为领域层使用的 {@link WorkflowPolicy}。
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(WorkflowProperties.class)
public class WorkflowConfig {

    @Bean
    public WorkflowPolicy workflowPolicy(WorkflowProperties properties) {
        long backoffBaseMs = Math.max(defaultIfNull(properties.getBackoff().getBaseMs(), 500L), 0L);
        long backoffMaxMs = Math.max(defaultIfNull(properties.getBackoff().getMaxMs(), 8000L), backoffBaseMs);
        WorkflowPolicy policy = WorkflowPolicy.builder()
                .maxClarificationRounds(Math.max(defaultIfNull(properties.getMaxClarificationRounds(), 3), 1))
                .maxRetries(Math.max(defaultIfNull(properties.getMaxRetries(), 3), 0))
                .completenessThreshold(normalizeThreshold(properties.getCompletenessThreshold()))
                .collaboratorTimeout(Duration.ofMillis(Math.max(defaultIfNull(properties.getCollaboratorTimeoutMs(), 30000L), 1L)))
                .backoffBase(Duration.ofMillis(backoffBaseMs))
                .backoffMax(Duration.ofMillis(backoffMaxMs))
                .maxQuestionsPerRound(Math.max(defaultIfNull(properties.getMaxQuestionsPerRound(), 5), 1))
                .inputMaxLength(Math.max(defaultIfNull(properties.getInputMaxLength(), 5000), 1))
                .sessionIdleTimeout(Duration.ofMillis(Math.max(defaultIfNull(properties.getSessionIdleTimeoutMs(), 3600000L), 1000L)))
                .generationRoles(normalizeRoles(properties.getGeneration().getRoles()))
                .build();
        log.info("Workflow policy loaded. maxRounds={}, maxRetries={}, threshold={}, timeoutMs={}, roles={}",
                policy.getMaxClarificationRounds(), policy.getMaxRetries(), policy.getCompletenessThreshold(),
                policy.getCollaboratorTimeout().toMillis(), policy.getGenerationRoles());
        return policy;
    }

    private double normalizeThreshold(Double threshold) {
        if (threshold == null || threshold.isNaN() || threshold < 0D || threshold > 1D) {
            log.warn("Invalid workflow.completeness-threshold '{}', fallback to 0.8", threshold);
            return 0.8D;
        }
        return threshold;
    }

    private List<String> normalizeRoles(List<String> roles) {
        Set<String> normalized = new LinkedHashSet<>();
        normalized.add(CollaboratorRole.STRUCTURE);
        if (roles != null) {
            for (String role : roles) {
                if (StringUtils.isNotBlank(role) && !CollaboratorRole.ANALYSIS.equals(role.trim())) {
                    normalized.add(role.trim());
                }
            }
        }
        return new ArrayList<>(normalized);
    }

    private <T> T defaultIfNull(T value, T defaultValue) {
        return value == null ? defaultValue : value;
    }
}
