package com.deckflow.domain.collaborator.model.valobj;

/**
 * 协作方角色名。
 */
public final class CollaboratorRole {

    /** 需求分析，analyzing 与 clarifying 阶段使用 */
    public static final String ANALYSIS = "analysis";

    /** 演示文稿结构 */
    public static final String STRUCTURE = "structure";

    public static final String RESEARCH = "research";

    public static final String LAYOUT = "layout";

    private CollaboratorRole() {
    }
}
