package com.medimax.assistant.knowledge;

import com.google.common.hash.Hashing;
import com.medimax.assistant.exception.GraphConsistencyException;
import com.medimax.assistant.exception.MalformedFactException;
import com.medimax.assistant.model.clinical.ClinicalFact;
import com.medimax.assistant.model.clinical.FactType;
import com.medimax.assistant.model.clinical.NaturalKeys;
import com.medimax.assistant.model.clinical.PatientSnapshot;
import com.medimax.assistant.model.graph.EdgeType;
import com.medimax.assistant.model.graph.GraphEdge;
import com.medimax.assistant.model.graph.GraphNode;
import com.medimax.assistant.model.graph.NodeType;
import com.medimax.assistant.model.graph.Subgraph;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Turns a {@link PatientSnapshot} into the patient's knowledge graph.
 *
 * <p>Pure and deterministic: node IDs are derived from
 * {@code (patientId, type, normalized natural key)}, edge IDs from
 * {@code (fromId, type, toId)}, and the output is sorted by ID. Facts sharing
 * a natural key collapse into one node; the first fact's property values win.
 *
 * <p>Edge rules:
 * <ul>
 *   <li>patient to every condition, medication, encounter, symptom and lab result</li>
 *   <li>encounter to the symptoms reported during it</li>
 *   <li>medication to the conditions named by its indications</li>
 *   <li>symptom to the conditions the curated {@link SymptomConditionMapping} associates with it</li>
 * </ul>
 *
 * @since 1.0.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PatientGraphSynthesizer {

    private static final String SEPARATOR = "\u001f";
    private static final int ID_HEX_LENGTH = 32;

    private final SymptomConditionMapping symptomConditionMapping;

    public Subgraph synthesize(PatientSnapshot snapshot) {
        long patientId = snapshot.getPatientId();

        Map<FactType, Map<String, CollectedFact>> collected = new EnumMap<>(FactType.class);
        for (FactType type : FactType.values()) {
            collected.put(type, collect(type, snapshot.facts(type)));
        }

        Map<String, GraphNode> nodes = new TreeMap<>();
        Map<String, GraphEdge> edges = new TreeMap<>();

        String patientKey = String.valueOf(patientId);
        GraphNode patient = node(patientId, NodeType.PATIENT, patientKey, snapshot.getDemographics());
        addNode(nodes, patient);

        Map<FactType, Map<String, GraphNode>> nodesByKey = new EnumMap<>(FactType.class);
        for (FactType type : FactType.values()) {
            Map<String, GraphNode> byKey = new LinkedHashMap<>();
            collected.get(type).forEach((key, fact) -> {
                GraphNode node = node(patientId, type.nodeType(), key, fact.properties);
                addNode(nodes, node);
                byKey.put(key, node);
                addEdge(edges, patientId, patient, patientEdge(type), node);
            });
            nodesByKey.put(type, byKey);
        }

        Map<String, GraphNode> conditions = nodesByKey.get(FactType.CONDITION);
        Map<String, GraphNode> encounters = nodesByKey.get(FactType.ENCOUNTER);

        collected.get(FactType.SYMPTOM).forEach((key, symptom) -> {
            GraphNode symptomNode = nodesByKey.get(FactType.SYMPTOM).get(key);
            for (String encounterKey : symptom.references) {
                GraphNode encounter = encounters.get(NaturalKeys.normalize(encounterKey));
                if (encounter != null) {
                    addEdge(edges, patientId, encounter, EdgeType.REPORTED_SYMPTOM, symptomNode);
                }
            }
            conditions.forEach((conditionKey, condition) -> {
                if (symptomConditionMapping.mayIndicate(key, conditionKey)) {
                    addEdge(edges, patientId, symptomNode, EdgeType.MAY_INDICATE, condition);
                }
            });
        });

        collected.get(FactType.MEDICATION).forEach((key, medication) -> {
            GraphNode medicationNode = nodesByKey.get(FactType.MEDICATION).get(key);
            conditions.forEach((conditionKey, condition) -> {
                boolean treats = medication.references.stream()
                    .anyMatch(indication -> SymptomConditionMapping.containsTerm(conditionKey, indication));
                if (treats) {
                    addEdge(edges, patientId, medicationNode, EdgeType.TREATS, condition);
                }
            });
        });

        Subgraph subgraph = new Subgraph(patientId, new ArrayList<>(nodes.values()), new ArrayList<>(edges.values()));
        verify(subgraph);
        log.debug("Synthesized graph for patient {}: {} nodes, {} edges",
            patientId, subgraph.nodes().size(), subgraph.edges().size());
        return subgraph;
    }

    /**
     * {@code <label>-<first 32 hex chars of sha256(patientId, label, normalized key)>}.
     */
    public static String nodeId(long patientId, NodeType type, String naturalKey) {
        String material = patientId + SEPARATOR + type.label() + SEPARATOR + NaturalKeys.normalize(naturalKey);
        return type.idPrefix() + "-" + sha256(material);
    }

    public static String edgeId(String fromId, EdgeType type, String toId) {
        return "edge-" + sha256(fromId + SEPARATOR + type.name() + SEPARATOR + toId);
    }

    private Map<String, CollectedFact> collect(FactType type, List<ClinicalFact> facts) {
        Map<String, CollectedFact> byKey = new LinkedHashMap<>();
        for (int position = 0; position < facts.size(); position++) {
            ClinicalFact fact = facts.get(position);
            if (NaturalKeys.isBlank(fact.naturalKey())) {
                throw new MalformedFactException(type.name(), position);
            }
            CollectedFact target = byKey.computeIfAbsent(NaturalKeys.normalize(fact.naturalKey()), k -> new CollectedFact());
            fact.properties().forEach(target.properties::putIfAbsent);
            target.references.addAll(fact.references());
        }
        return byKey;
    }

    private static GraphNode node(long patientId, NodeType type, String normalizedKey, Map<String, Object> source) {
        Map<String, Object> properties = new TreeMap<>();
        source.forEach((name, value) -> {
            Object scalar = scalar(value);
            if (scalar != null) {
                properties.put(name, scalar);
            }
        });
        properties.put("patientId", patientId);
        properties.put("naturalKey", normalizedKey);
        return new GraphNode(nodeId(patientId, type, normalizedKey), type, properties);
    }

    private static void addNode(Map<String, GraphNode> nodes, GraphNode node) {
        GraphNode existing = nodes.putIfAbsent(node.id(), node);
        if (existing != null && (existing.type() != node.type()
            || !existing.properties().get("naturalKey").equals(node.properties().get("naturalKey")))) {
            throw new GraphConsistencyException("Node ID collision on " + node.id());
        }
    }

    private static void addEdge(Map<String, GraphEdge> edges, long patientId, GraphNode from, EdgeType type, GraphNode to) {
        String id = edgeId(from.id(), type, to.id());
        edges.putIfAbsent(id, new GraphEdge(id, from.id(), to.id(), type, Map.of("patientId", patientId)));
    }

    private static EdgeType patientEdge(FactType type) {
        return switch (type) {
            case CONDITION -> EdgeType.HAS_CONDITION;
            case MEDICATION -> EdgeType.TAKES_MEDICATION;
            case ENCOUNTER -> EdgeType.HAS_ENCOUNTER;
            case SYMPTOM -> EdgeType.HAS_SYMPTOM;
            case LAB_RESULT -> EdgeType.HAS_LAB_RESULT;
        };
    }

    private static Object scalar(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        return value.toString();
    }

    private static void verify(Subgraph subgraph) {
        Map<String, GraphNode> byId = new LinkedHashMap<>();
        for (GraphNode node : subgraph.nodes()) {
            if (byId.put(node.id(), node) != null) {
                throw new GraphConsistencyException("Duplicate node ID " + node.id());
            }
            if (node.patientId() != subgraph.patientId()) {
                throw new GraphConsistencyException("Node " + node.id() + " belongs to another patient");
            }
        }
        for (GraphEdge edge : subgraph.edges()) {
            GraphNode from = byId.get(edge.fromId());
            GraphNode to = byId.get(edge.toId());
            if (from == null || to == null) {
                throw new GraphConsistencyException("Dangling edge " + edge.id() + " (" + edge.type() + ")");
            }
            if (from.type() != edge.type().from() || to.type() != edge.type().to()) {
                throw new GraphConsistencyException("Edge " + edge.id() + " connects "
                    + from.type() + " to " + to.type() + " but " + edge.type() + " requires "
                    + edge.type().from() + " to " + edge.type().to());
            }
        }
    }

    private static String sha256(String material) {
        return Hashing.sha256().hashString(material, StandardCharsets.UTF_8).toString().substring(0, ID_HEX_LENGTH);
    }

    private static final class CollectedFact {
        private final Map<String, Object> properties = new LinkedHashMap<>();
        private final Set<String> references = new LinkedHashSet<>();
    }
}
