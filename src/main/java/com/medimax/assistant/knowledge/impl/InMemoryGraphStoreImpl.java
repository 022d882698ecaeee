package com.medimax.assistant.knowledge.impl;

import com.google.common.base.Preconditions;
import com.medimax.assistant.exception.GraphConsistencyException;
import com.medimax.assistant.exception.GraphStoreException;
import com.medimax.assistant.exception.QuerySyntaxException;
import com.medimax.assistant.knowledge.GraphStore;
import com.medimax.assistant.knowledge.PatientLockTable;
import com.medimax.assistant.model.graph.GraphEdge;
import com.medimax.assistant.model.graph.GraphNode;
import com.medimax.assistant.model.graph.GraphStats;
import com.medimax.assistant.model.graph.GraphWriteResult;
import com.medimax.assistant.model.graph.Subgraph;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * In-process {@link GraphStore} for local runs and tests.
 *
 * <p>Each patient's graph is an immutable {@link Subgraph}; a replace stages and
 * validates the new graph, then swaps the reference. Queries support a single
 * node pattern:
 * <pre>
 * MATCH (n[:Label] [{key: value, ...}]) RETURN n [LIMIT k]
 * </pre>
 * Values are quoted strings, numbers, booleans or {@code $parameters}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.graph.backend", havingValue = "memory")
public class InMemoryGraphStoreImpl implements GraphStore {

    static final String CLINICAL_LABEL = "ClinicalNode";

    private static final Pattern NODE_QUERY = Pattern.compile(
        "^\\s*MATCH\\s*\\(\\s*(\\w+)\\s*(?::\\s*(\\w+))?\\s*(\\{(?:'[^']*'|\"[^\"]*\"|[^}'\"])*})?\\s*\\)"
            + "\\s*RETURN\\s+(\\w+)"
            + "(?:\\s+LIMIT\\s+(\\d+))?\\s*;?\\s*$",
        Pattern.CASE_INSENSITIVE);

    private static final Pattern PROPERTY = Pattern.compile(
        "\\s*(\\w+)\\s*:\\s*('[^']*'|\"[^\"]*\"|\\$\\w+|-?\\d+(?:\\.\\d+)?|true|false)\\s*(,|$)",
        Pattern.CASE_INSENSITIVE);

    private final ConcurrentMap<Long, Subgraph> graphs = new ConcurrentHashMap<>();
    private final PatientLockTable lockTable;

    @Override
    public GraphWriteResult replacePatientSubgraph(long patientId, Subgraph subgraph) {
        Preconditions.checkArgument(subgraph.patientId() == patientId,
            "Subgraph of patient %s cannot replace graph of patient %s", subgraph.patientId(), patientId);
        return lockTable.withLock(patientId, () -> {
            stage(subgraph);
            Subgraph previous = graphs.put(patientId, subgraph);
            log.info("Replaced graph of patient {}: {} nodes removed, {} nodes and {} edges written",
                patientId, previous == null ? 0 : previous.nodes().size(),
                subgraph.nodes().size(), subgraph.edges().size());
            return new GraphWriteResult(patientId, subgraph.nodes().size(), subgraph.edges().size());
        });
    }

    @Override
    public List<Map<String, Object>> query(String cypher, Map<String, Object> parameters) {
        Matcher matcher = NODE_QUERY.matcher(cypher == null ? "" : cypher);
        if (!matcher.matches()) {
            throw new QuerySyntaxException("Unsupported query for in-memory graph: " + cypher);
        }
        String variable = matcher.group(1);
        String label = matcher.group(2);
        Map<String, Object> filter = parseFilter(matcher.group(3), parameters == null ? Map.of() : parameters);
        if (!variable.equals(matcher.group(4))) {
            throw new QuerySyntaxException("Variable `" + matcher.group(4) + "` not defined");
        }
        int limit = matcher.group(5) == null ? Integer.MAX_VALUE : parseLimit(matcher.group(5));

        List<Map<String, Object>> rows = new ArrayList<>();
        for (Subgraph graph : new TreeMap<>(graphs).values()) {
            for (GraphNode node : graph.nodes()) {
                if (rows.size() >= limit) {
                    return rows;
                }
                if (hasLabel(node, label) && matches(node, filter)) {
                    Map<String, Object> row = new LinkedHashMap<>();
                    row.put(variable, toPlain(node));
                    rows.add(row);
                }
            }
        }
        return rows;
    }

    @Override
    public GraphStats describePatientGraph(long patientId) {
        Subgraph graph = graphs.getOrDefault(patientId, Subgraph.empty(patientId));
        return new GraphStats(patientId, graph.nodes().size(), graph.edges().size());
    }

    @Override
    public boolean isReachable() {
        return true;
    }

    @Override
    public String backendName() {
        return "memory";
    }

    /**
     * Current graph of a patient, empty when none was written.
     */
    public Subgraph snapshot(long patientId) {
        return graphs.getOrDefault(patientId, Subgraph.empty(patientId));
    }

    private static void stage(Subgraph subgraph) {
        Set<String> ids = new HashSet<>();
        for (GraphNode node : subgraph.nodes()) {
            if (!ids.add(node.id())) {
                throw new GraphConsistencyException("Duplicate node ID " + node.id());
            }
            node.properties().forEach((key, value) -> {
                if (!(value instanceof String || value instanceof Number || value instanceof Boolean)) {
                    throw new GraphStoreException("Property " + key + " of node " + node.id()
                        + " has unsupported type " + value.getClass().getSimpleName());
                }
            });
            Object owner = node.properties().get("patientId");
            if (!(owner instanceof Number number) || number.longValue() != subgraph.patientId()) {
                throw new GraphConsistencyException("Node " + node.id() + " is not tagged with patient "
                    + subgraph.patientId());
            }
        }
        for (GraphEdge edge : subgraph.edges()) {
            if (!ids.contains(edge.fromId()) || !ids.contains(edge.toId())) {
                throw new GraphConsistencyException("Dangling edge " + edge.id() + " (" + edge.type() + ")");
            }
        }
    }

    private static boolean hasLabel(GraphNode node, String label) {
        return label == null
            || CLINICAL_LABEL.equals(label)
            || node.type().label().equals(label);
    }

    private static boolean matches(GraphNode node, Map<String, Object> filter) {
        for (Map.Entry<String, Object> expected : filter.entrySet()) {
            Object actual = node.properties().get(expected.getKey());
            if (!valueEquals(actual, expected.getValue())) {
                return false;
            }
        }
        return true;
    }

    private static boolean valueEquals(Object actual, Object expected) {
        if (actual instanceof Number a && expected instanceof Number e) {
            return Double.compare(a.doubleValue(), e.doubleValue()) == 0;
        }
        return actual != null && actual.equals(expected);
    }

    private static Map<String, Object> parseFilter(String block, Map<String, Object> parameters) {
        Map<String, Object> filter = new LinkedHashMap<>();
        if (block == null) {
            return filter;
        }
        String body = block.substring(1, block.length() - 1).trim();
        if (body.isEmpty()) {
            return filter;
        }
        Matcher property = PROPERTY.matcher(body);
        int position = 0;
        while (position < body.length()) {
            property.region(position, body.length());
            if (!property.lookingAt()) {
                throw new QuerySyntaxException("Invalid property filter: " + body.substring(position).trim());
            }
            filter.put(property.group(1), literal(property.group(2), parameters));
            position = property.end();
            if (property.group(3).isEmpty()) {
                break;
            }
            if (position == body.length()) {
                throw new QuerySyntaxException("Invalid property filter: trailing comma in " + block);
            }
        }
        return filter;
    }

    private static int parseLimit(String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new QuerySyntaxException("LIMIT out of range: " + digits, e);
        }
    }

    private static Object literal(String token, Map<String, Object> parameters) {
        if (token.startsWith("$")) {
            String name = token.substring(1);
            if (!parameters.containsKey(name)) {
                throw new QuerySyntaxException("Expected parameter(s): " + name);
            }
            return parameters.get(name);
        }
        if (token.startsWith("'") || token.startsWith("\"")) {
            return token.substring(1, token.length() - 1);
        }
        if ("true".equalsIgnoreCase(token) || "false".equalsIgnoreCase(token)) {
            return Boolean.parseBoolean(token);
        }
        try {
            return token.contains(".") ? (Object) Double.parseDouble(token) : (Object) Long.parseLong(token);
        } catch (NumberFormatException e) {
            throw new QuerySyntaxException("Number out of range: " + token, e);
        }
    }

    private static Map<String, Object> toPlain(GraphNode node) {
        Map<String, Object> plain = new LinkedHashMap<>();
        plain.put("labels", List.of(CLINICAL_LABEL, node.type().label()));
        Map<String, Object> properties = new TreeMap<>(node.properties());
        properties.put("id", node.id());
        plain.put("properties", properties);
        return plain;
    }
}
