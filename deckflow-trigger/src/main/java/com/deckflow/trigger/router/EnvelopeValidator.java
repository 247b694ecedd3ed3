package com.deckflow.trigger.router;

import com.deckflow.domain.workflow.model.valobj.WorkflowPolicy;
import com.deckflow.trigger.router.InboundMessage.ControlMessage;
import com.deckflow.trigger.router.InboundMessage.InputMessage;
import com.deckflow.types.enums.ControlActionEnum;
import com.deckflow.types.enums.EnvelopeTypeEnum;
import com.deckflow.types.enums.ErrorCodeEnum;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 入站信封结构校验。
 * <p>
 * 只检查结构与字段类型，不读取会话状态；校验失败时抛出
 * {@link EnvelopeValidationException}，调用方据此回送协议错误。
 * </p>
 */
@Component
public class EnvelopeValidator {

    private static final int MAX_MESSAGE_ID_LENGTH = 128;

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final int inputMaxLength;

    public EnvelopeValidator(ObjectMapper objectMapper, WorkflowPolicy policy) {
        this.objectMapper = objectMapper;
        this.inputMaxLength = policy.getInputMaxLength();
    }

    public InboundMessage validate(String raw) {
        JsonNode root;
        try {
            root = objectMapper.readTree(StringUtils.defaultString(raw));
        } catch (JsonProcessingException ex) {
            throw invalid("envelope", null, "envelope is not valid JSON");
        }
        if (root == null || !root.isObject()) {
            throw invalid("envelope", null, "envelope must be a JSON object");
        }
        String sessionId = readSessionId(root);

        JsonNode messageIdNode = root.get("message_id");
        if (messageIdNode == null || !messageIdNode.isTextual() || StringUtils.isBlank(messageIdNode.asText())) {
            throw invalid("message_id", sessionId, "message_id is required");
        }
        String messageId = messageIdNode.asText().trim();
        if (messageId.length() > MAX_MESSAGE_ID_LENGTH) {
            throw invalid("message_id", sessionId, "message_id is too long");
        }

        JsonNode timestampNode = root.get("timestamp");
        if (timestampNode == null || !timestampNode.isTextual() || !isIsoTimestamp(timestampNode.asText())) {
            throw invalid("timestamp", sessionId, "timestamp must be an ISO-8601 string");
        }

        JsonNode typeNode = root.get("type");
        EnvelopeTypeEnum type = typeNode != null && typeNode.isTextual() ? EnvelopeTypeEnum.fromCode(typeNode.asText()) : null;
        if (type == null) {
            throw invalid("type", sessionId, "type is missing or unknown");
        }
        if (!type.isInbound()) {
            throw new EnvelopeValidationException(ErrorCodeEnum.UNSUPPORTED_TYPE, "type", sessionId,
                    "type " + type.getCode() + " cannot be sent by clients");
        }

        JsonNode payload = root.get("payload");
        if (payload == null || !payload.isObject()) {
            throw invalid("payload", sessionId, "payload must be a JSON object");
        }

        if (type == EnvelopeTypeEnum.CONTROL) {
            return readControl(messageId, sessionId, payload);
        }
        return readInput(messageId, sessionId, payload);
    }

    private ControlMessage readControl(String messageId, String sessionId, JsonNode payload) {
        JsonNode actionNode = payload.get("action");
        ControlActionEnum action = actionNode != null && actionNode.isTextual()
                ? ControlActionEnum.fromCode(actionNode.asText())
                : null;
        if (action == null) {
            throw invalid("payload.action", sessionId, "control action is missing or unknown");
        }
        if (sessionId == null && !action.allowsMissingSession()) {
            throw invalid("session_id", sessionId, "session_id is required for action " + action.getCode());
        }
        String text = null;
        JsonNode textNode = payload.get("text");
        if (textNode != null && !textNode.isNull()) {
            if (action != ControlActionEnum.START) {
                throw invalid("payload.text", sessionId, "text is only allowed on start");
            }
            if (!textNode.isTextual()) {
                throw invalid("payload.text", sessionId, "text must be a string");
            }
            text = requireLength(textNode.asText(), sessionId);
        }
        return new ControlMessage(messageId, sessionId, action, StringUtils.trimToNull(text));
    }

    private InputMessage readInput(String messageId, String sessionId, JsonNode payload) {
        if (sessionId == null) {
            throw invalid("session_id", null, "session_id is required for input");
        }
        String text = null;
        JsonNode textNode = payload.get("text");
        if (textNode != null && !textNode.isNull()) {
            if (!textNode.isTextual()) {
                throw invalid("payload.text", sessionId, "text must be a string");
            }
            text = requireLength(textNode.asText(), sessionId);
        }
        Map<String, Object> answers = null;
        JsonNode answersNode = payload.get("answers");
        if (answersNode != null && !answersNode.isNull()) {
            answers = readAnswers(answersNode, sessionId);
        }
        boolean hasAnswers = answers != null && !answers.isEmpty();
        if (StringUtils.isBlank(text) && !hasAnswers) {
            throw invalid("payload", sessionId, "input must carry non-empty text or answers");
        }
        return new InputMessage(messageId, sessionId, text, hasAnswers ? answers : null);
    }

    private Map<String, Object> readAnswers(JsonNode answersNode, String sessionId) {
        if (!answersNode.isObject()) {
            throw invalid("payload.answers", sessionId, "answers must be an object");
        }
        Iterator<Map.Entry<String, JsonNode>> fields = answersNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (StringUtils.isBlank(field.getKey())) {
                throw invalid("payload.answers", sessionId, "answer keys must not be blank");
            }
            if (value.isObject() || value.isNull()) {
                throw invalid("payload.answers." + field.getKey(), sessionId, "answer must be a scalar or a list");
            }
            if (value.isArray()) {
                for (JsonNode item : value) {
                    if (item.isContainerNode() || item.isNull()) {
                        throw invalid("payload.answers." + field.getKey(), sessionId, "list answers must contain scalars");
                    }
                }
            }
            if (value.isTextual() && value.asText().length() > inputMaxLength) {
                throw invalid("payload.answers." + field.getKey(), sessionId, "answer exceeds " + inputMaxLength + " characters");
            }
        }
        return new LinkedHashMap<>(objectMapper.convertValue(answersNode, MAP_TYPE));
    }

    private String readSessionId(JsonNode root) {
        JsonNode node = root.get("session_id");
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual() || StringUtils.isBlank(node.asText())) {
            throw invalid("session_id", null, "session_id must be a non-empty string or null");
        }
        return node.asText().trim();
    }

    private String requireLength(String text, String sessionId) {
        if (text.length() > inputMaxLength) {
            throw invalid("payload.text", sessionId, "text exceeds " + inputMaxLength + " characters");
        }
        return text;
    }

    private boolean isIsoTimestamp(String value) {
        try {
            Instant.parse(value);
            return true;
        } catch (DateTimeParseException ex) {
            try {
                OffsetDateTime.parse(value);
                return true;
            } catch (DateTimeParseException nested) {
                return false;
            }
        }
    }

    private EnvelopeValidationException invalid(String field, String sessionId, String message) {
        return new EnvelopeValidationException(ErrorCodeEnum.INVALID_ENVELOPE, field, sessionId, message);
    }
}
