package com.medimax.assistant.model.graph;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * All nodes and edges of one patient, applied to the graph store as a unit.
 * Nodes and edges are sorted by ID.
 */
public record Subgraph(long patientId, List<GraphNode> nodes, List<GraphEdge> edges) {

    public Subgraph {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    public static Subgraph empty(long patientId) {
        return new Subgraph(patientId, List.of(), List.of());
    }

    public Optional<GraphNode> node(String id) {
        return nodes.stream().filter(n -> n.id().equals(id)).findFirst();
    }

    public Map<String, GraphNode> nodesById() {
        return nodes.stream().collect(Collectors.toMap(GraphNode::id, Function.identity()));
    }

    public List<GraphNode> nodesOfType(NodeType type) {
        return nodes.stream().filter(n -> n.type() == type).toList();
    }

    public List<GraphEdge> edgesOfType(EdgeType type) {
        return edges.stream().filter(e -> e.type() == type).toList();
    }
}
