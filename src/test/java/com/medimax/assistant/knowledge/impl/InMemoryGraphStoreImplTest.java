package com.medimax.assistant.knowledge.impl;

import com.medimax.assistant.config.GraphStoreConfig;
import com.medimax.assistant.exception.GraphConsistencyException;
import com.medimax.assistant.exception.GraphStoreException;
import com.medimax.assistant.exception.QuerySyntaxException;
import com.medimax.assistant.knowledge.PatientGraphSynthesizer;
import com.medimax.assistant.knowledge.PatientLockTable;
import com.medimax.assistant.model.graph.EdgeType;
import com.medimax.assistant.model.graph.GraphEdge;
import com.medimax.assistant.model.graph.GraphNode;
import com.medimax.assistant.model.graph.GraphStats;
import com.medimax.assistant.model.graph.GraphWriteResult;
import com.medimax.assistant.model.graph.NodeType;
import com.medimax.assistant.model.graph.Subgraph;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("InMemoryGraphStoreImpl")
class InMemoryGraphStoreImplTest {

    private InMemoryGraphStoreImpl store;

    @BeforeEach
    void setUp() {
        store = new InMemoryGraphStoreImpl(new PatientLockTable(new GraphStoreConfig()));
    }

    @Test
    void replace_overwritesPreviousGraph() {
        store.replacePatientSubgraph(42, graph(42, "Hypertension", "Asthma"));

        GraphWriteResult result = store.replacePatientSubgraph(42, graph(42, "Hypertension"));

        assertThat(result.nodesWritten()).isEqualTo(2);
        assertThat(result.edgesWritten()).isEqualTo(1);
        assertThat(store.describePatientGraph(42)).isEqualTo(new GraphStats(42, 2, 1));
    }

    @Test
    @DisplayName("A replace that fails while staging leaves the previous graph untouched")
    void failedReplace_keepsPreviousGraph() {
        // Given
        Subgraph original = graph(42, "Hypertension");
        store.replacePatientSubgraph(42, original);

        GraphNode patient = original.nodesOfType(NodeType.PATIENT).get(0);
        GraphEdge dangling = new GraphEdge("edge-dangling", patient.id(), "condition-missing",
            EdgeType.HAS_CONDITION, Map.of("patientId", 42L));
        Subgraph broken = new Subgraph(42, graph(42, "Asthma").nodes(), List.of(dangling));

        // When / Then
        assertThatThrownBy(() -> store.replacePatientSubgraph(42, broken))
            .isInstanceOf(GraphConsistencyException.class)
            .hasMessageContaining("Dangling edge");
        assertThat(store.snapshot(42)).isEqualTo(original);
    }

    @Test
    void nonScalarProperty_isRejected() {
        GraphNode node = new GraphNode("patient-x", NodeType.PATIENT,
            Map.of("patientId", 5L, "aliases", List.of("a", "b")));

        assertThatThrownBy(() -> store.replacePatientSubgraph(5, new Subgraph(5, List.of(node), List.of())))
            .isInstanceOf(GraphStoreException.class)
            .hasMessageContaining("aliases");
        assertThat(store.describePatientGraph(5).nodeCount()).isZero();
    }

    @Test
    void nodeOfAnotherPatient_isRejected() {
        Subgraph foreign = new Subgraph(5, graph(6, "Asthma").nodes(), List.of());

        assertThatThrownBy(() -> store.replacePatientSubgraph(5, foreign))
            .isInstanceOf(GraphConsistencyException.class);
    }

    @Test
    void patientsAreIsolated() {
        store.replacePatientSubgraph(1, graph(1, "Asthma"));
        store.replacePatientSubgraph(2, graph(2, "Asthma", "Gout"));

        store.replacePatientSubgraph(1, graph(1, "Migraine"));

        assertThat(store.describePatientGraph(2)).isEqualTo(new GraphStats(2, 3, 2));
    }

    @Test
    void query_filtersByLabelAndProperties() {
        store.replacePatientSubgraph(1, graph(1, "Asthma"));
        store.replacePatientSubgraph(2, graph(2, "Asthma", "Gout"));

        List<Map<String, Object>> rows = store.query(
            "MATCH (c:Condition {patientId: $pid}) RETURN c", Map.of("pid", 2));

        assertThat(rows).hasSize(2);
        assertThat(rows).allSatisfy(row -> {
            @SuppressWarnings("unchecked")
            Map<String, Object> node = (Map<String, Object>) row.get("c");
            assertThat(node.get("labels")).isEqualTo(List.of("ClinicalNode", "Condition"));
            assertThat((Map<String, Object>) node.get("properties")).containsEntry("patientId", 2L)
                .containsKey("id");
        });

        assertThat(store.query("MATCH (n {name: 'Gout'}) RETURN n LIMIT 5", Map.of())).hasSize(1);
        assertThat(store.query("MATCH (n:ClinicalNode) RETURN n LIMIT 2", Map.of())).hasSize(2);
    }

    @Test
    void unsupportedQuery_isSyntaxError() {
        assertThatThrownBy(() -> store.query("MATCH (a)-[r]->(b) RETURN a, b", Map.of()))
            .isInstanceOf(QuerySyntaxException.class);
        assertThatThrownBy(() -> store.query("MATCH (n {name: $missing}) RETURN n", Map.of()))
            .isInstanceOf(QuerySyntaxException.class)
            .hasMessageContaining("missing");
        assertThatThrownBy(() -> store.query("MATCH (n) RETURN m", Map.of()))
            .isInstanceOf(QuerySyntaxException.class);
    }

    @Test
    @DisplayName("Quoted filter values may contain commas and braces")
    void quotedValuesWithSeparators_areMatchedWhole() {
        store.replacePatientSubgraph(3, graph(3, "Pain, chronic", "Gout {acute}"));

        assertThat(store.query("MATCH (c:Condition {name: 'Pain, chronic', patientId: 3}) RETURN c", Map.of()))
            .hasSize(1);
        assertThat(store.query("MATCH (c:Condition {name: \"Gout {acute}\"}) RETURN c", Map.of()))
            .hasSize(1);
    }

    @Test
    void oversizedNumbers_areSyntaxErrors() {
        assertThatThrownBy(() -> store.query("MATCH (n {patientId: 99999999999999999999}) RETURN n", Map.of()))
            .isInstanceOf(QuerySyntaxException.class)
            .hasMessageContaining("99999999999999999999");
        assertThatThrownBy(() -> store.query("MATCH (n) RETURN n LIMIT 99999999999", Map.of()))
            .isInstanceOf(QuerySyntaxException.class)
            .hasMessageContaining("LIMIT");
    }

    @Test
    void malformedFilters_areSyntaxErrors() {
        assertThatThrownBy(() -> store.query("MATCH (n {name: 'Gout',}) RETURN n", Map.of()))
            .isInstanceOf(QuerySyntaxException.class)
            .hasMessageContaining("trailing comma");
        assertThatThrownBy(() -> store.query("MATCH (n {name: Gout}) RETURN n", Map.of()))
            .isInstanceOf(QuerySyntaxException.class)
            .hasMessageContaining("Invalid property filter");
        assertThatThrownBy(() -> store.query("MATCH (n) WHERE n.name = 'Gout' RETURN n", Map.of()))
            .isInstanceOf(QuerySyntaxException.class);
    }

    private static Subgraph graph(long patientId, String... conditions) {
        GraphNode patient = new GraphNode(PatientGraphSynthesizer.nodeId(patientId, NodeType.PATIENT, "" + patientId),
            NodeType.PATIENT, Map.of("patientId", patientId, "naturalKey", "" + patientId));
        List<GraphNode> nodes = new java.util.ArrayList<>(List.of(patient));
        List<GraphEdge> edges = new java.util.ArrayList<>();
        for (String name : conditions) {
            GraphNode condition = new GraphNode(PatientGraphSynthesizer.nodeId(patientId, NodeType.CONDITION, name),
                NodeType.CONDITION, Map.of("patientId", patientId, "naturalKey", name.toLowerCase(), "name", name));
            nodes.add(condition);
            edges.add(new GraphEdge(PatientGraphSynthesizer.edgeId(patient.id(), EdgeType.HAS_CONDITION, condition.id()),
                patient.id(), condition.id(), EdgeType.HAS_CONDITION, Map.of("patientId", patientId)));
        }
        return new Subgraph(patientId, nodes, edges);
    }
}
