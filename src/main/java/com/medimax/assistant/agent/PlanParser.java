package com.medimax.assistant.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Reads the model's plan out of its response.
 *
 * <p>Expected shapes:
 * <pre>
 * {"tool": "query_graph", "arguments": {"cypher": "..."}}
 * {"final_answer": "..."}
 * </pre>
 * Code fences and prose around the JSON object are ignored. {@code parameters}
 * is accepted as an alias of {@code arguments}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PlanParser {

    private static final TypeReference<Map<String, Object>> ARGUMENTS = new TypeReference<>() { };

    private final ObjectMapper objectMapper;

    public AgentPlan parse(String response) {
        String json = extractJson(response);
        if (json == null) {
            return new AgentPlan.Malformed("Response contains no JSON object", response);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.debug("Plan is not valid JSON: {}", e.getOriginalMessage());
            return new AgentPlan.Malformed("Invalid JSON: " + e.getOriginalMessage(), response);
        }

        boolean hasTool = root.hasNonNull("tool");
        boolean hasAnswer = root.hasNonNull("final_answer");
        if (hasTool == hasAnswer) {
            return new AgentPlan.Malformed(hasTool
                ? "Response must contain either \"tool\" or \"final_answer\", not both"
                : "Response must contain \"tool\" or \"final_answer\"", response);
        }

        if (hasAnswer) {
            JsonNode answer = root.get("final_answer");
            String text = answer.isTextual() ? answer.asText() : answer.toString();
            if (text.isBlank()) {
                return new AgentPlan.Malformed("\"final_answer\" is empty", response);
            }
            return new AgentPlan.FinalAnswer(text);
        }

        JsonNode tool = root.get("tool");
        if (!tool.isTextual() || tool.asText().isBlank()) {
            return new AgentPlan.Malformed("\"tool\" must be a non-empty string", response);
        }
        JsonNode arguments = root.hasNonNull("arguments") ? root.get("arguments") : root.get("parameters");
        if (arguments == null || arguments.isNull()) {
            return new AgentPlan.ToolInvocation(tool.asText(), Map.of());
        }
        if (!arguments.isObject()) {
            return new AgentPlan.Malformed("\"arguments\" must be a JSON object", response);
        }
        return new AgentPlan.ToolInvocation(tool.asText(), objectMapper.convertValue(arguments, ARGUMENTS));
    }

    static String extractJson(String text) {
        if (text == null) {
            return null;
        }
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return text.substring(start, end + 1);
        }
        return null;
    }
}
