package com.medimax.assistant.model.clinical;

import com.medimax.assistant.model.graph.NodeType;

public enum FactType {
    CONDITION(NodeType.CONDITION),
    MEDICATION(NodeType.MEDICATION),
    ENCOUNTER(NodeType.ENCOUNTER),
    SYMPTOM(NodeType.SYMPTOM),
    LAB_RESULT(NodeType.LAB_RESULT);

    private final NodeType nodeType;

    FactType(NodeType nodeType) {
        this.nodeType = nodeType;
    }

    public NodeType nodeType() {
        return nodeType;
    }
}
