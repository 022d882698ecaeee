package com.medimax.assistant.knowledge;

import com.medimax.assistant.model.graph.GraphWriteResult;
import com.medimax.assistant.model.graph.Subgraph;
import com.medimax.assistant.resilience.Deadline;

/**
 * Builds patient knowledge graphs from the relational store.
 *
 * @since 1.0.0
 */
public interface KnowledgeGraphService {

    /**
     * Extracts the patient's records, synthesizes the graph and replaces the
     * stored graph. Running it twice on unchanged records writes identical IDs.
     *
     * @throws com.medimax.assistant.exception.PatientNotFoundException if the patient does not exist
     */
    GraphWriteResult buildPatientGraph(long patientId, Deadline deadline);

    default GraphWriteResult buildPatientGraph(long patientId) {
        return buildPatientGraph(patientId, Deadline.none());
    }

    /**
     * Synthesizes the graph without writing it.
     */
    Subgraph previewPatientGraph(long patientId);
}
