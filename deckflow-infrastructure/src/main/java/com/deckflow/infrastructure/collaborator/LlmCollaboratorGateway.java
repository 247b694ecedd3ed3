package com.deckflow.infrastructure.collaborator;

import com.deckflow.domain.collaborator.exception.CollaboratorException;
import com.deckflow.domain.collaborator.model.valobj.CollaboratorFailureKind;
import com.deckflow.domain.collaborator.model.valobj.CollaboratorRequest;
import com.deckflow.domain.collaborator.model.valobj.CollaboratorResult;
import com.deckflow.domain.collaborator.model.valobj.CollaboratorRole;
import com.deckflow.infrastructure.util.JsonCodec;
import com.deckflow.types.exception.AppException;
import com.google.common.cache.Cache;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * 基于 Spring AI ChatClient 的协作方实现，要求模型只返回 JSON。
 */
@Slf4j
public class LlmCollaboratorGateway extends AbstractCollaboratorGateway {

    public static final String MODE = "llm";

    private final ChatClient chatClient;
    private final JsonCodec jsonCodec;
    private final Cache<String, Map<String, Object>> analysisCache;

    public LlmCollaboratorGateway(ChatClient chatClient,
                                  JsonCodec jsonCodec,
                                  Cache<String, Map<String, Object>> analysisCache,
                                  Executor executor) {
        super(executor);
        this.chatClient = chatClient;
        this.jsonCodec = jsonCodec;
        this.analysisCache = analysisCache;
    }

    @Override
    public String mode() {
        return MODE;
    }

    @Override
    protected CollaboratorResult doInvoke(CollaboratorRequest request) {
        String role = request.getRole();
        Map<String, Object> input = request.getPayload() == null ? Map.of() : request.getPayload();
        String cacheKey = null;
        if (CollaboratorRole.ANALYSIS.equals(role)) {
            cacheKey = jsonCodec.writeValue(input);
            Map<String, Object> cached = analysisCache.getIfPresent(cacheKey);
            if (cached != null) {
                log.debug("Analysis cache hit. sessionId={}", request.getSessionId());
                return CollaboratorResult.of(role, new LinkedHashMap<>(cached));
            }
        }
        String content = callModel(buildPrompt(role, input), request);
        Map<String, Object> payload = parsePayload(content, role);
        if (cacheKey != null) {
            analysisCache.put(cacheKey, payload);
        }
        return CollaboratorResult.of(role, payload);
    }

    private String callModel(String prompt, CollaboratorRequest request) {
        try {
            ChatClient.CallResponseSpec response = chatClient.prompt(prompt).call();
            return response == null ? null : response.content();
        } catch (ResourceAccessException | HttpServerErrorException ex) {
            throw new CollaboratorException(CollaboratorFailureKind.UNAVAILABLE,
                    "Model endpoint unavailable for role " + request.getRole(), ex);
        } catch (HttpClientErrorException ex) {
            if (ex.getStatusCode().isSameCodeAs(HttpStatus.TOO_MANY_REQUESTS)) {
                throw new CollaboratorException(CollaboratorFailureKind.UNAVAILABLE,
                        "Model endpoint rate limited for role " + request.getRole(), ex);
            }
            throw new CollaboratorException(CollaboratorFailureKind.REJECTED_INPUT,
                    "Model endpoint rejected request for role " + request.getRole(), ex);
        }
    }

    private String buildPrompt(String role, Map<String, Object> input) {
        StringBuilder prompt = new StringBuilder();
        if (CollaboratorRole.ANALYSIS.equals(role)) {
            prompt.append("You analyse presentation requests. Return JSON only with fields: ");
            prompt.append("completeness_score (number 0..1), ");
            prompt.append("questions (list of {question_id, prompt, kind: text|choice|multi_choice|scale|boolean, options, required}), ");
            prompt.append("analysis ({presentation_type, key_topics, estimated_slides}). ");
            prompt.append("Ask questions only for information that is still missing.");
        } else if (CollaboratorRole.STRUCTURE.equals(role)) {
            prompt.append("You design presentation structures. Return JSON only with fields: ");
            prompt.append("title, slides (non-empty list of {index, title, bullets}).");
        } else if (CollaboratorRole.RESEARCH.equals(role)) {
            prompt.append("You gather supporting material for presentations. Return JSON only with field: ");
            prompt.append("findings (list of {topic, note}).");
        } else if (CollaboratorRole.LAYOUT.equals(role)) {
            prompt.append("You choose slide layouts. Return JSON only with fields: theme, layouts (list of layout names).");
        } else {
            throw new CollaboratorException(CollaboratorFailureKind.REJECTED_INPUT, "Unsupported collaborator role: " + role);
        }
        prompt.append("\nRequest context: ").append(jsonCodec.writeValue(input));
        return prompt.toString();
    }

    private Map<String, Object> parsePayload(String content, String role) {
        if (StringUtils.isBlank(content)) {
            throw new CollaboratorException(CollaboratorFailureKind.TRANSIENT_INCONSISTENCY,
                    "Model returned empty content for role " + role);
        }
        Map<String, Object> payload = tryReadMap(content.trim());
        if (payload != null) {
            return payload;
        }
        int start = content.indexOf('{');
        int end = content.lastIndexOf('}');
        if (start >= 0 && end > start) {
            payload = tryReadMap(content.substring(start, end + 1));
            if (payload != null) {
                return payload;
            }
        }
        throw new CollaboratorException(CollaboratorFailureKind.TRANSIENT_INCONSISTENCY,
                "Model output for role " + role + " is not valid JSON");
    }

    private Map<String, Object> tryReadMap(String text) {
        try {
            return jsonCodec.readMap(text);
        } catch (AppException ex) {
            log.debug("Failed to parse collaborator json: {}", ex.getMessage());
            return null;
        }
    }
}
