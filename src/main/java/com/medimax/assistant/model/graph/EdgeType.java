package com.medimax.assistant.model.graph;

/**
 * Relationship types with their fixed endpoint labels.
 */
public enum EdgeType {
    HAS_CONDITION(NodeType.PATIENT, NodeType.CONDITION),
    TAKES_MEDICATION(NodeType.PATIENT, NodeType.MEDICATION),
    HAS_ENCOUNTER(NodeType.PATIENT, NodeType.ENCOUNTER),
    HAS_SYMPTOM(NodeType.PATIENT, NodeType.SYMPTOM),
    HAS_LAB_RESULT(NodeType.PATIENT, NodeType.LAB_RESULT),
    REPORTED_SYMPTOM(NodeType.ENCOUNTER, NodeType.SYMPTOM),
    TREATS(NodeType.MEDICATION, NodeType.CONDITION),
    MAY_INDICATE(NodeType.SYMPTOM, NodeType.CONDITION);

    private final NodeType from;
    private final NodeType to;

    EdgeType(NodeType from, NodeType to) {
        this.from = from;
        this.to = to;
    }

    public NodeType from() {
        return from;
    }

    public NodeType to() {
        return to;
    }
}
