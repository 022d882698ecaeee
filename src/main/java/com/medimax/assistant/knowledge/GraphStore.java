package com.medimax.assistant.knowledge;

import com.medimax.assistant.model.graph.GraphStats;
import com.medimax.assistant.model.graph.GraphWriteResult;
import com.medimax.assistant.model.graph.Subgraph;

import java.util.List;
import java.util.Map;

/**
 * Storage of per-patient knowledge graphs.
 *
 * <p>Every node written carries a {@code patientId} property and the
 * {@code ClinicalNode} label. Query results are plain maps: nodes become
 * {@code {labels, properties}}, relationships {@code {type, properties}}.
 *
 * @since 1.0.0
 */
public interface GraphStore {

    /**
     * Atomically replaces everything stored for the patient with {@code subgraph}.
     * On failure the previous graph is left untouched.
     *
     * @param patientId owner of the subgraph
     * @param subgraph  nodes and edges to write, all tagged with {@code patientId}
     * @return counts of created nodes and edges
     */
    GraphWriteResult replacePatientSubgraph(long patientId, Subgraph subgraph);

    /**
     * Executes a read-only query. No patient scoping is applied.
     *
     * @param cypher     query text
     * @param parameters query parameters
     * @return one map per result row, keyed by return column
     */
    List<Map<String, Object>> query(String cypher, Map<String, Object> parameters);

    GraphStats describePatientGraph(long patientId);

    boolean isReachable();

    String backendName();
}
