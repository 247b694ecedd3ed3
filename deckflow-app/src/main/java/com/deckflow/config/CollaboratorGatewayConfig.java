package com.deckflow.config;

import com.deckflow.domain.collaborator.adapter.gateway.ICollaboratorGateway;
import com.deckflow.infrastructure.collaborator.LlmCollaboratorGateway;
import com.deckflow.infrastructure.collaborator.MockCollaboratorGateway;
import com.deckflow.infrastructure.util.JsonCodec;
import com.google.common.cache.Cache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;
import java.util.concurrent.Executor;

/**
 * 协作方网关装配：collaborator.mode=llm 且存在 ChatModel 时使用大模型，否则使用规则实现。
 */
@Slf4j
@Configuration
public class CollaboratorGatewayConfig {

    @Bean
    public ICollaboratorGateway collaboratorGateway(@Value("${collaborator.mode:mock}") String mode,
                                                    @Value("${collaborator.mock.latency-ms:0}") long mockLatencyMs,
                                                    ObjectProvider<ChatModel> chatModelProvider,
                                                    JsonCodec jsonCodec,
                                                    @Qualifier("analysisCache") Cache<String, Map<String, Object>> analysisCache,
                                                    @Qualifier("collaboratorWorkerExecutor") Executor collaboratorWorkerExecutor) {
        if (LlmCollaboratorGateway.MODE.equalsIgnoreCase(mode)) {
            ChatModel chatModel = chatModelProvider.getIfAvailable();
            if (chatModel != null) {
                log.info("Collaborator gateway initialized. mode={}, chatModel={}", LlmCollaboratorGateway.MODE,
                        chatModel.getClass().getSimpleName());
                return new LlmCollaboratorGateway(ChatClient.builder(chatModel).build(), jsonCodec, analysisCache,
                        collaboratorWorkerExecutor);
            }
            log.warn("collaborator.mode=llm but no ChatModel bean is available, fallback to mock collaborator");
        }
        log.info("Collaborator gateway initialized. mode={}, latencyMs={}", MockCollaboratorGateway.MODE, mockLatencyMs);
        return new MockCollaboratorGateway(collaboratorWorkerExecutor, mockLatencyMs);
    }
}
