package com.medimax.assistant.knowledge.impl;

import com.google.common.base.Preconditions;
import com.medimax.assistant.exception.GraphConnectionException;
import com.medimax.assistant.exception.GraphConsistencyException;
import com.medimax.assistant.exception.GraphStoreException;
import com.medimax.assistant.exception.GraphTransactionException;
import com.medimax.assistant.exception.QuerySyntaxException;
import com.medimax.assistant.knowledge.GraphStore;
import com.medimax.assistant.knowledge.PatientLockTable;
import com.medimax.assistant.model.graph.EdgeType;
import com.medimax.assistant.model.graph.GraphEdge;
import com.medimax.assistant.model.graph.GraphNode;
import com.medimax.assistant.model.graph.GraphStats;
import com.medimax.assistant.model.graph.GraphWriteResult;
import com.medimax.assistant.model.graph.NodeType;
import com.medimax.assistant.model.graph.Subgraph;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AccessMode;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Record;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.Transaction;
import org.neo4j.driver.exceptions.ClientException;
import org.neo4j.driver.exceptions.Neo4jException;
import org.neo4j.driver.exceptions.ServiceUnavailableException;
import org.neo4j.driver.exceptions.SessionExpiredException;
import org.neo4j.driver.exceptions.TransientException;
import org.neo4j.driver.summary.ResultSummary;
import org.neo4j.driver.types.Node;
import org.neo4j.driver.types.Path;
import org.neo4j.driver.types.Relationship;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.StreamSupport;

/**
 * Neo4j implementation of {@link GraphStore}.
 *
 * <p>Uses the driver bean configured from {@code spring.neo4j.*}. Writes run in
 * one explicit transaction per patient: delete the patient's nodes, create
 * nodes per label, create edges per type, commit. Explicit transactions are
 * used instead of managed ones so retries stay under the configured policy.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.graph.backend", havingValue = "neo4j", matchIfMissing = true)
public class Neo4jGraphStoreImpl implements GraphStore {

    static final String CLEAR_PATIENT =
        "MATCH (n:ClinicalNode {patientId: $patientId}) DETACH DELETE n";

    static final String PATIENT_STATS = """
        MATCH (n:ClinicalNode {patientId: $patientId})
        OPTIONAL MATCH (n)-[r]->()
        RETURN count(DISTINCT n) AS nodes, count(r) AS edges
        """;

    private final Driver driver;
    private final PatientLockTable lockTable;

    @PostConstruct
    public void createIndexes() {
        try (Session session = driver.session()) {
            session.run("CREATE CONSTRAINT clinical_node_id IF NOT EXISTS FOR (n:ClinicalNode) REQUIRE n.id IS UNIQUE");
            session.run("CREATE INDEX clinical_node_patient IF NOT EXISTS FOR (n:ClinicalNode) ON (n.patientId)");
            log.info("Neo4j clinical graph indexes ready");
        } catch (Exception e) {
            log.warn("Failed to create Neo4j indexes: {}", e.getMessage());
        }
    }

    @Override
    public GraphWriteResult replacePatientSubgraph(long patientId, Subgraph subgraph) {
        Preconditions.checkArgument(subgraph.patientId() == patientId,
            "Subgraph of patient %s cannot replace graph of patient %s", subgraph.patientId(), patientId);
        return lockTable.withLock(patientId, () -> writeSubgraph(patientId, subgraph));
    }

    private GraphWriteResult writeSubgraph(long patientId, Subgraph subgraph) {
        try (Session session = driver.session(); Transaction tx = session.beginTransaction()) {
            int deleted = tx.run(CLEAR_PATIENT, Map.of("patientId", patientId)).consume().counters().nodesDeleted();

            int nodesCreated = 0;
            for (Map.Entry<NodeType, List<Map<String, Object>>> entry : nodeRows(subgraph).entrySet()) {
                String cypher = "UNWIND $rows AS row CREATE (n:ClinicalNode:`" + entry.getKey().label()
                    + "`) SET n = row.properties, n.id = row.id";
                nodesCreated += tx.run(cypher, Map.of("rows", entry.getValue())).consume().counters().nodesCreated();
            }

            int edgesCreated = 0;
            for (Map.Entry<EdgeType, List<Map<String, Object>>> entry : edgeRows(subgraph).entrySet()) {
                String cypher = "UNWIND $rows AS row "
                    + "MATCH (a:ClinicalNode {id: row.fromId}) MATCH (b:ClinicalNode {id: row.toId}) "
                    + "CREATE (a)-[r:`" + entry.getKey().name() + "`]->(b) SET r = row.properties, r.id = row.id";
                ResultSummary summary = tx.run(cypher, Map.of("rows", entry.getValue())).consume();
                edgesCreated += summary.counters().relationshipsCreated();
            }

            if (nodesCreated != subgraph.nodes().size() || edgesCreated != subgraph.edges().size()) {
                throw new GraphConsistencyException("Patient " + patientId + " write created " + nodesCreated
                    + "/" + subgraph.nodes().size() + " nodes and " + edgesCreated + "/" + subgraph.edges().size()
                    + " edges");
            }

            tx.commit();
            log.info("Replaced graph of patient {}: {} nodes removed, {} nodes and {} edges written",
                patientId, deleted, nodesCreated, edgesCreated);
            return new GraphWriteResult(patientId, nodesCreated, edgesCreated);
        } catch (Neo4jException e) {
            throw translate("replace graph of patient " + patientId, e);
        }
    }

    @Override
    public List<Map<String, Object>> query(String cypher, Map<String, Object> parameters) {
        SessionConfig readOnly = SessionConfig.builder().withDefaultAccessMode(AccessMode.READ).build();
        try (Session session = driver.session(readOnly); Transaction tx = session.beginTransaction()) {
            List<Map<String, Object>> rows = tx.run(cypher, parameters == null ? Map.of() : parameters)
                .list(Neo4jGraphStoreImpl::toRow);
            tx.commit();
            return rows;
        } catch (Neo4jException e) {
            throw translate("graph query", e);
        }
    }

    @Override
    public GraphStats describePatientGraph(long patientId) {
        List<Map<String, Object>> rows = query(PATIENT_STATS, Map.of("patientId", patientId));
        if (rows.isEmpty()) {
            return new GraphStats(patientId, 0, 0);
        }
        Map<String, Object> row = rows.get(0);
        return new GraphStats(patientId, ((Number) row.get("nodes")).longValue(), ((Number) row.get("edges")).longValue());
    }

    @Override
    public boolean isReachable() {
        try {
            driver.verifyConnectivity();
            return true;
        } catch (Exception e) {
            log.warn("Neo4j unreachable: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public String backendName() {
        return "neo4j";
    }

    /**
     * Maps driver failures onto the application hierarchy: lost connections and
     * transient server errors are retryable, statement errors are not.
     */
    static RuntimeException translate(String operation, Neo4jException e) {
        if (e instanceof ServiceUnavailableException || e instanceof SessionExpiredException) {
            return new GraphConnectionException("Neo4j connection lost during " + operation + ": " + e.getMessage(), e);
        }
        if (e instanceof TransientException) {
            return new GraphTransactionException("Neo4j transient failure during " + operation + ": " + e.getMessage(), e);
        }
        if (e instanceof ClientException && e.code() != null && e.code().startsWith("Neo.ClientError.Statement")) {
            return new QuerySyntaxException(e.getMessage(), e);
        }
        return new GraphStoreException("Neo4j failure during " + operation + ": " + e.getMessage(), e);
    }

    private static Map<NodeType, List<Map<String, Object>>> nodeRows(Subgraph subgraph) {
        Map<NodeType, List<Map<String, Object>>> rows = new EnumMap<>(NodeType.class);
        for (GraphNode node : subgraph.nodes()) {
            rows.computeIfAbsent(node.type(), t -> new ArrayList<>())
                .add(Map.of("id", node.id(), "properties", node.properties()));
        }
        return rows;
    }

    private static Map<EdgeType, List<Map<String, Object>>> edgeRows(Subgraph subgraph) {
        Map<EdgeType, List<Map<String, Object>>> rows = new EnumMap<>(EdgeType.class);
        for (GraphEdge edge : subgraph.edges()) {
            rows.computeIfAbsent(edge.type(), t -> new ArrayList<>())
                .add(Map.of("id", edge.id(), "fromId", edge.fromId(), "toId", edge.toId(),
                    "properties", edge.properties()));
        }
        return rows;
    }

    private static Map<String, Object> toRow(Record record) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (String key : record.keys()) {
            row.put(key, toPlain(record.get(key).asObject()));
        }
        return row;
    }

    static Object toPlain(Object value) {
        if (value instanceof Node node) {
            Map<String, Object> plain = new LinkedHashMap<>();
            List<String> labels = new ArrayList<>();
            node.labels().forEach(labels::add);
            plain.put("labels", labels);
            plain.put("properties", toPlain(node.asMap()));
            return plain;
        }
        if (value instanceof Relationship relationship) {
            Map<String, Object> plain = new LinkedHashMap<>();
            plain.put("type", relationship.type());
            plain.put("properties", toPlain(relationship.asMap()));
            return plain;
        }
        if (value instanceof Path path) {
            Map<String, Object> plain = new LinkedHashMap<>();
            plain.put("nodes", StreamSupport.stream(path.nodes().spliterator(), false).map(Neo4jGraphStoreImpl::toPlain).toList());
            plain.put("relationships", StreamSupport.stream(path.relationships().spliterator(), false)
                .map(Neo4jGraphStoreImpl::toPlain).toList());
            return plain;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> plain = new LinkedHashMap<>();
            map.forEach((k, v) -> plain.put(String.valueOf(k), toPlain(v)));
            return plain;
        }
        if (value instanceof List<?> list) {
            return list.stream().map(Neo4jGraphStoreImpl::toPlain).toList();
        }
        if (value instanceof TemporalAccessor temporal) {
            return temporal.toString();
        }
        return value;
    }
}
