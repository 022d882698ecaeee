package com.medimax.assistant.model.graph;

import java.util.Map;

public record GraphEdge(String id, String fromId, String toId, EdgeType type, Map<String, Object> properties) {

    public GraphEdge {
        properties = Map.copyOf(properties);
    }
}
