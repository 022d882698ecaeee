package com.medimax.assistant.agent;

import com.medimax.assistant.agent.impl.ToolContextImpl;
import com.medimax.assistant.exception.ArgumentValidationException;
import com.medimax.assistant.exception.UnknownToolException;
import com.medimax.assistant.resilience.Deadline;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ToolRegistry")
class ToolRegistryTest {

    private RecordingTool riskTool;
    private ToolRegistry registry;
    private final ToolContext context = ToolContextImpl.create("session-1", Deadline.none());

    @BeforeEach
    void setUp() {
        riskTool = new RecordingTool("predict_test_risk", ArgumentSchema.builder()
            .field("age", ArgumentSpec.requiredInteger("Age in years", 0, 120))
            .field("bmi", ArgumentSpec.requiredNumber("Body mass index", 10, 80))
            .field("gender", ArgumentSpec.requiredChoice("Gender", List.of("Female", "Male", "Other")))
            .field("smoker", ArgumentSpec.builder().type(ArgumentType.BOOLEAN).description("Smokes").build())
            .build());
        registry = new ToolRegistry(List.of(riskTool, new RecordingTool("get_patient_summary", ArgumentSchema.empty())));
    }

    @Test
    @DisplayName("Missing required field fails validation and the handler is not called")
    void missingRequiredField_rejectedBeforeExecution() {
        Map<String, Object> arguments = Map.of("age", 50, "gender", "Male");

        assertThatThrownBy(() -> registry.invoke("predict_test_risk", arguments, context))
            .isInstanceOf(ArgumentValidationException.class)
            .hasMessageContaining("'bmi'")
            .hasMessageContaining("is required");

        assertThat(riskTool.received.get()).isNull();
    }

    @Test
    void outOfRangeValue_rejected() {
        Map<String, Object> arguments = Map.of("age", 150, "bmi", 24.5, "gender", "Male");

        assertThatThrownBy(() -> registry.invoke("predict_test_risk", arguments, context))
            .isInstanceOf(ArgumentValidationException.class)
            .hasMessageContaining("must be <= 120");
        assertThat(riskTool.received.get()).isNull();
    }

    @Test
    void disallowedChoice_rejected() {
        Map<String, Object> arguments = Map.of("age", 50, "bmi", 24.5, "gender", "unknown");

        assertThatThrownBy(() -> registry.invoke("predict_test_risk", arguments, context))
            .isInstanceOf(ArgumentValidationException.class)
            .hasMessageContaining("must be one of");
    }

    @Test
    @DisplayName("Arguments are coerced to declared types and undeclared fields dropped")
    void validArguments_coercedAndPassedThrough() {
        Map<String, Object> arguments = new HashMap<>();
        arguments.put("age", "54");
        arguments.put("bmi", 27);
        arguments.put("gender", "female");
        arguments.put("smoker", "false");
        arguments.put("note", "ignored");

        ToolResult result = registry.invoke("predict_test_risk", arguments, context);

        assertThat(result.isSuccess()).isTrue();
        assertThat(riskTool.received.get())
            .containsEntry("age", 54L)
            .containsEntry("bmi", 27.0)
            .containsEntry("gender", "Female")
            .containsEntry("smoker", false)
            .doesNotContainKey("note");
    }

    @Test
    void nonIntegralNumber_rejectedForIntegerField() {
        Map<String, Object> arguments = Map.of("age", 54.5, "bmi", 24.5, "gender", "Male");

        assertThatThrownBy(() -> registry.invoke("predict_test_risk", arguments, context))
            .isInstanceOf(ArgumentValidationException.class)
            .hasMessageContaining("must be an integer");
    }

    @Test
    @DisplayName("An integer written in exponent form beyond the 64-bit range is rejected, not saturated")
    void exponentBeyondLongRange_rejected() {
        registry.register(new RecordingTool("build_graph", ArgumentSchema.builder()
            .field("patientId", ArgumentSpec.requiredId("Patient ID"))
            .build()));

        assertThatThrownBy(() -> registry.invoke("build_graph", Map.of("patientId", "1e20"), context))
            .isInstanceOf(ArgumentValidationException.class)
            .hasMessageContaining("'patientId'")
            .hasMessageContaining("64-bit integer range");
        assertThatThrownBy(() -> registry.invoke("build_graph", Map.of("patientId", 1e20), context))
            .isInstanceOf(ArgumentValidationException.class)
            .hasMessageContaining("64-bit integer range");
    }

    @Test
    void oversizedBigInteger_rejectedAsValidationError() {
        RecordingTool buildGraph = new RecordingTool("build_graph", ArgumentSchema.builder()
            .field("patientId", ArgumentSpec.requiredId("Patient ID"))
            .build());
        registry.register(buildGraph);
        Map<String, Object> arguments = Map.of("patientId", new BigInteger("99999999999999999999"));

        assertThatThrownBy(() -> registry.invoke("build_graph", arguments, context))
            .isInstanceOf(ArgumentValidationException.class)
            .hasMessageContaining("'patientId'")
            .hasMessageContaining("64-bit integer range");
        assertThat(buildGraph.received.get()).isNull();
    }

    @Test
    void integralTextForms_areAccepted() {
        RecordingTool buildGraph = new RecordingTool("build_graph", ArgumentSchema.builder()
            .field("patientId", ArgumentSpec.requiredId("Patient ID"))
            .build());
        registry.register(buildGraph);

        registry.invoke("build_graph", Map.of("patientId", "4.2e1"), context);
        assertThat(buildGraph.received.get()).containsEntry("patientId", 42L);

        registry.invoke("build_graph", Map.of("patientId", new BigInteger("7")), context);
        assertThat(buildGraph.received.get()).containsEntry("patientId", 7L);
    }

    @Test
    void unknownTool_listsAvailableTools() {
        assertThatThrownBy(() -> registry.invoke("delete_everything", Map.of(), context))
            .isInstanceOf(UnknownToolException.class)
            .hasMessageContaining("get_patient_summary, predict_test_risk");
    }

    @Test
    void duplicateNames_rejectedAtRegistration() {
        assertThatThrownBy(() -> registry.register(new RecordingTool("get_patient_summary", ArgumentSchema.empty())))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Duplicate tool name");
    }

    @Test
    void list_isSortedAndCarriesSchemas() {
        List<ToolDescriptor> descriptors = registry.list();

        assertThat(descriptors).extracting(ToolDescriptor::name)
            .containsExactly("get_patient_summary", "predict_test_risk");
        assertThat(descriptors.get(1).argumentSchema().getFields()).containsKeys("age", "bmi", "gender", "smoker");
        assertThat(descriptors.get(1).argumentSchema().getFields().get("age").constraints())
            .containsEntry("min", 0.0)
            .containsEntry("max", 120.0);
    }

    private static final class RecordingTool implements Tool {

        private final String name;
        private final ArgumentSchema schema;
        private final AtomicReference<Map<String, Object>> received = new AtomicReference<>();

        private RecordingTool(String name, ArgumentSchema schema) {
            this.name = name;
            this.schema = schema;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public String getDescription() {
            return "Test tool " + name;
        }

        @Override
        public ArgumentSchema getArgumentSchema() {
            return schema;
        }

        @Override
        public ToolResult execute(Map<String, Object> arguments, ToolContext context) {
            received.set(arguments);
            return ToolResult.success(arguments, "ok");
        }

        @Override
        public ToolCategory getCategory() {
            return ToolCategory.PREDICTION;
        }
    }
}
