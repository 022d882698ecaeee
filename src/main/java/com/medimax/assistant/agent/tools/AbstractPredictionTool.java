package com.medimax.assistant.agent.tools;

import com.medimax.assistant.agent.Tool;
import com.medimax.assistant.agent.ToolContext;
import com.medimax.assistant.agent.ToolResult;
import com.medimax.assistant.client.PredictionModel;
import com.medimax.assistant.client.PredictionServiceClient;
import com.medimax.assistant.exception.ErrorCategory;
import com.medimax.assistant.exception.FinalErrorException;
import com.medimax.assistant.exception.PredictionServiceException;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Passes validated features to an external risk model and returns its answer
 * unchanged. Service errors come back as {@code {error, status}}.
 */
@Slf4j
public abstract class AbstractPredictionTool implements Tool {

    private final PredictionServiceClient predictionClient;
    private final PredictionModel model;

    protected AbstractPredictionTool(PredictionServiceClient predictionClient, PredictionModel model) {
        this.predictionClient = predictionClient;
        this.model = model;
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.PREDICTION;
    }

    @Override
    public ToolResult execute(Map<String, Object> arguments, ToolContext context) {
        try {
            Object prediction = predictionClient.predict(model, arguments, context.getDeadline());
            return ToolResult.success(prediction, model + " risk prediction completed");
        } catch (PredictionServiceException e) {
            log.warn("{} prediction failed with HTTP {}: {}", model, e.getStatus(), e.getResponseBody());
            return ToolResult.failure(e.getMessage(), e.getCategory(),
                error(e.getResponseBody() == null || e.getResponseBody().isBlank() ? e.getMessage() : e.getResponseBody(),
                    e.getStatus()));
        } catch (FinalErrorException e) {
            int status = e.getCause() instanceof PredictionServiceException cause ? cause.getStatus() : 503;
            log.warn("{} prediction unavailable: {}", model, e.getMessage());
            return ToolResult.failure(e.getMessage(), ErrorCategory.RETRIES_EXHAUSTED, error(e.getMessage(), status));
        }
    }

    private static Map<String, Object> error(String message, int status) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("error", message);
        error.put("status", status);
        return error;
    }
}
