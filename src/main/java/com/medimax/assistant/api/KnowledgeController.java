package com.medimax.assistant.api;

import com.medimax.assistant.knowledge.GraphStore;
import com.medimax.assistant.knowledge.KnowledgeGraphService;
import com.medimax.assistant.model.graph.GraphStats;
import com.medimax.assistant.model.graph.GraphWriteResult;
import com.medimax.assistant.model.graph.Subgraph;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for patient knowledge graphs.
 *
 * @since 1.0.0
 */
@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1/patients/{patientId}/knowledge-graph")
@RequiredArgsConstructor
public class KnowledgeController {

    private final KnowledgeGraphService knowledgeGraphService;
    private final GraphStore graphStore;

    /**
     * Rebuild the patient's graph from the relational records.
     *
     * POST /api/v1/patients/{patientId}/knowledge-graph
     */
    @PostMapping
    public ResponseEntity<GraphWriteResult> build(@PathVariable @Min(1) long patientId) {
        log.info("Knowledge graph build requested for patient {}", patientId);
        return ResponseEntity.ok(knowledgeGraphService.buildPatientGraph(patientId));
    }

    /**
     * Counts of what is currently stored for the patient.
     */
    @GetMapping
    public ResponseEntity<GraphStats> describe(@PathVariable @Min(1) long patientId) {
        return ResponseEntity.ok(graphStore.describePatientGraph(patientId));
    }

    /**
     * The graph the next build would write, without writing it.
     */
    @GetMapping("/preview")
    public ResponseEntity<Subgraph> preview(@PathVariable @Min(1) long patientId) {
        return ResponseEntity.ok(knowledgeGraphService.previewPatientGraph(patientId));
    }
}
