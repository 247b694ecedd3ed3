package com.deckflow.domain.collaborator.model.valobj;

import com.deckflow.types.enums.SessionPhaseEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 协作方调用请求。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CollaboratorRequest {

    private String sessionId;
    private String callId;
    private SessionPhaseEnum phase;
    private String role;
    private int attemptNumber;
    private Map<String, Object> payload;
}
