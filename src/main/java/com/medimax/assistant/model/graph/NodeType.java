package com.medimax.assistant.model.graph;

import java.util.Locale;

/**
 * Node labels of a patient knowledge graph.
 */
public enum NodeType {
    PATIENT("Patient"),
    CONDITION("Condition"),
    MEDICATION("Medication"),
    SYMPTOM("Symptom"),
    ENCOUNTER("Encounter"),
    LAB_RESULT("LabResult");

    private final String label;

    NodeType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Lower-case label used as node ID prefix, e.g. {@code labresult}.
     */
    public String idPrefix() {
        return label.toLowerCase(Locale.ROOT);
    }

    public static NodeType fromLabel(String label) {
        for (NodeType type : values()) {
            if (type.label.equalsIgnoreCase(label)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown node label: " + label);
    }
}
