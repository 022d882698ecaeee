package com.medimax.assistant.knowledge.impl;

import com.medimax.assistant.config.ResilienceConfig;
import com.medimax.assistant.knowledge.GraphStore;
import com.medimax.assistant.knowledge.KnowledgeGraphService;
import com.medimax.assistant.knowledge.PatientGraphSynthesizer;
import com.medimax.assistant.model.clinical.PatientSnapshot;
import com.medimax.assistant.model.graph.GraphWriteResult;
import com.medimax.assistant.model.graph.Subgraph;
import com.medimax.assistant.repository.PatientRecordRepository;
import com.medimax.assistant.resilience.Deadline;
import com.medimax.assistant.resilience.ResilienceManager;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;

@Slf4j
@Service
@RequiredArgsConstructor
public class KnowledgeGraphServiceImpl implements KnowledgeGraphService {

    private final PatientRecordRepository patientRecords;
    private final PatientGraphSynthesizer synthesizer;
    private final GraphStore graphStore;
    private final ResilienceManager resilience;
    private final ResilienceConfig resilienceConfig;

    /**
     * A graph build runs as one tool attempt. When that attempt can time out before
     * the nested relational and graph retries finish, the abandoned write keeps the
     * patient lock until the driver returns.
     */
    @PostConstruct
    public void checkRetryBudgets() {
        Duration nested = buildWorstCase(resilienceConfig);
        Duration toolAttempt = resilienceConfig.policy(ResilienceConfig.TOOL).getTimeoutPerAttempt();
        if (toolAttempt.compareTo(nested) < 0) {
            log.warn("Tool attempt timeout {} is shorter than a graph build's worst case {}; "
                + "timed-out builds may hold patient locks past the request", toolAttempt, nested);
        }
    }

    static Duration buildWorstCase(ResilienceConfig config) {
        return config.policy(ResilienceConfig.RELATIONAL).worstCase()
            .plus(config.policy(ResilienceConfig.GRAPH).worstCase());
    }

    @Override
    public GraphWriteResult buildPatientGraph(long patientId, Deadline deadline) {
        long start = System.currentTimeMillis();
        Subgraph subgraph = synthesizer.synthesize(loadSnapshot(patientId, deadline));

        GraphWriteResult result = resilience.withRetry("graph.replace",
            () -> graphStore.replacePatientSubgraph(patientId, subgraph),
            resilienceConfig.policy(ResilienceConfig.GRAPH), deadline);

        log.info("Built knowledge graph for patient {} on {}: {} nodes, {} edges in {}ms",
            patientId, graphStore.backendName(), result.nodesWritten(), result.edgesWritten(),
            System.currentTimeMillis() - start);
        return result;
    }

    @Override
    public Subgraph previewPatientGraph(long patientId) {
        return synthesizer.synthesize(loadSnapshot(patientId, Deadline.none()));
    }

    private PatientSnapshot loadSnapshot(long patientId, Deadline deadline) {
        return resilience.withRetry("relational.loadSnapshot",
            () -> patientRecords.loadSnapshot(patientId),
            resilienceConfig.policy(ResilienceConfig.RELATIONAL), deadline);
    }
}
