package com.medimax.assistant.agent.tools;

import com.medimax.assistant.agent.ToolContext;
import com.medimax.assistant.agent.ToolResult;
import com.medimax.assistant.agent.impl.ToolContextImpl;
import com.medimax.assistant.client.PredictionModel;
import com.medimax.assistant.client.PredictionServiceClient;
import com.medimax.assistant.exception.ErrorCategory;
import com.medimax.assistant.exception.FinalErrorException;
import com.medimax.assistant.exception.PredictionServiceException;
import com.medimax.assistant.resilience.Deadline;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PredictionToolTest {

    private PredictionServiceClient client;
    private ToolContext context;

    @BeforeEach
    void setUp() {
        client = mock(PredictionServiceClient.class);
        context = ToolContextImpl.create("session-1", Deadline.none());
    }

    @Test
    void successfulPrediction_isPassedThroughUnchanged() {
        Map<String, Object> prediction = Map.of("probability", 0.71, "risk_category", "High");
        Map<String, Object> features = Map.of("age", 54.0, "gender", "Male");
        when(client.predict(eq(PredictionModel.CARDIOVASCULAR), eq(features), any())).thenReturn(prediction);

        ToolResult result = new CardiovascularRiskTool(client).execute(features, context);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getData()).isSameAs(prediction);
    }

    @Test
    void rejectedInput_isNormalizedToErrorAndStatus() {
        when(client.predict(eq(PredictionModel.DIABETES), any(), any()))
            .thenThrow(new PredictionServiceException("diabetes", 422, "{\"detail\":\"bmi out of range\"}", false));

        ToolResult result = new DiabetesRiskTool(client).execute(Map.of(), context);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorCategory()).isEqualTo(ErrorCategory.VALIDATION);
        assertThat(result.getData()).isEqualTo(Map.of("error", "{\"detail\":\"bmi out of range\"}", "status", 422));
    }

    @Test
    void exhaustedRetries_reportLastStatus() {
        PredictionServiceException last = new PredictionServiceException("diabetes", 502, "", true);
        when(client.predict(eq(PredictionModel.DIABETES), any(), any()))
            .thenThrow(new FinalErrorException("diabetes-predict", 3, last));

        ToolResult result = new DiabetesRiskTool(client).execute(Map.of(), context);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorCategory()).isEqualTo(ErrorCategory.RETRIES_EXHAUSTED);
        @SuppressWarnings("unchecked")
        Map<String, Object> error = (Map<String, Object>) result.getData();
        assertThat(error).containsEntry("status", 502);
        assertThat((String) error.get("error")).contains("failed after 3 attempt(s)");
    }

    @Test
    void schemas_declareTheModelFeatures() {
        assertThat(new CardiovascularRiskTool(client).getArgumentSchema().getFields().keySet())
            .containsExactly("age", "gender", "height", "weight", "ap_hi", "ap_lo", "cholesterol", "gluc",
                "smoke", "alco", "active");
        assertThat(new DiabetesRiskTool(client).getArgumentSchema().getFields().keySet())
            .containsExactly("age", "gender", "hypertension", "heart_disease", "smoking_history", "bmi",
                "HbA1c_level", "blood_glucose_level");
    }
}
