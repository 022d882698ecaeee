package com.medimax.assistant.agent.tools;

import com.medimax.assistant.agent.ArgumentSchema;
import com.medimax.assistant.agent.ArgumentSpec;
import com.medimax.assistant.agent.Tool;
import com.medimax.assistant.agent.ToolContext;
import com.medimax.assistant.agent.ToolResult;
import com.medimax.assistant.knowledge.KnowledgeGraphService;
import com.medimax.assistant.model.graph.GraphWriteResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rebuilds one patient's knowledge graph from the relational records.
 */
@Component
@RequiredArgsConstructor
public class BuildKnowledgeGraphTool implements Tool {

    private final KnowledgeGraphService knowledgeGraphService;

    @Override
    public String getName() {
        return "build_patient_knowledge_graph";
    }

    @Override
    public String getDescription() {
        return "Build (or rebuild) the knowledge graph of a patient from their medical records. "
            + "Run this before querying a patient's graph.";
    }

    @Override
    public ArgumentSchema getArgumentSchema() {
        return ArgumentSchema.builder()
            .field("patientId", ArgumentSpec.requiredId("Patient ID"))
            .build();
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.KNOWLEDGE;
    }

    @Override
    public ToolResult execute(Map<String, Object> arguments, ToolContext context) {
        long patientId = (Long) arguments.get("patientId");
        GraphWriteResult result = knowledgeGraphService.buildPatientGraph(patientId, context.getDeadline());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("patientId", patientId);
        data.put("nodesWritten", result.nodesWritten());
        data.put("edgesWritten", result.edgesWritten());
        return ToolResult.success(data, "Knowledge graph of patient " + patientId + " built: "
            + result.nodesWritten() + " nodes, " + result.edgesWritten() + " edges");
    }
}
