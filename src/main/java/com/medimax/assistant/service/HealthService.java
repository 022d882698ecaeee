package com.medimax.assistant.service;

import com.medimax.assistant.client.PredictionModel;
import com.medimax.assistant.client.PredictionServiceClient;
import com.medimax.assistant.knowledge.GraphStore;
import com.medimax.assistant.repository.PatientRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Probes every backing service the assistant depends on.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HealthService {

    public static final String RELATIONAL_STORE = "relationalStore";
    public static final String GRAPH_STORE = "graphStore";

    private final PatientRecordRepository patientRecords;
    private final GraphStore graphStore;
    private final PredictionServiceClient predictionClient;

    /**
     * Reachability per dependency, in a stable order.
     */
    public Map<String, Boolean> checkDependencies() {
        Map<String, Boolean> status = new LinkedHashMap<>();
        status.put(RELATIONAL_STORE, patientRecords.isReachable());
        status.put(GRAPH_STORE, graphStore.isReachable());
        for (PredictionModel model : PredictionModel.values()) {
            status.put(model.healthKey(), predictionClient.isReachable(model));
        }

        if (status.containsValue(Boolean.FALSE)) {
            log.warn("Degraded dependencies: {}", status);
        }
        return status;
    }
}
