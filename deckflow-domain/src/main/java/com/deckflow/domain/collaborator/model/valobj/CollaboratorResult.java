package com.deckflow.domain.collaborator.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 协作方结构化结果。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CollaboratorResult {

    private String role;
    private Map<String, Object> payload;

    public static CollaboratorResult of(String role, Map<String, Object> payload) {
        return new CollaboratorResult(role, payload);
    }
}
