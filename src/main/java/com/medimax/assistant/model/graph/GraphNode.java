package com.medimax.assistant.model.graph;

import java.util.Map;

/**
 * One node of a synthesized patient graph. Properties are scalar values and
 * always include {@code patientId} and {@code naturalKey}.
 */
public record GraphNode(String id, NodeType type, Map<String, Object> properties) {

    public GraphNode {
        properties = Map.copyOf(properties);
    }

    public long patientId() {
        return ((Number) properties.get("patientId")).longValue();
    }
}
