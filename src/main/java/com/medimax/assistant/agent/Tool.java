package com.medimax.assistant.agent;

import java.util.Map;

/**
 * Capability the agent can invoke by name.
 *
 * <p>Every tool declares an {@link ArgumentSchema}. The {@link ToolRegistry}
 * validates and coerces the model's arguments against it before calling
 * {@link #execute}, so implementations can read typed values directly:
 * <pre>
 * public class PatientSummaryTool implements Tool {
 *     public String getName() { return "get_patient_summary"; }
 *
 *     public ToolResult execute(Map&lt;String, Object&gt; arguments, ToolContext context) {
 *         long patientId = (Long) arguments.get("patientId");
 *         ...
 *     }
 * }
 * </pre>
 *
 * Failures may be thrown; the agent turns them into failed results.
 *
 * @since 1.0.0
 */
public interface Tool {

    /**
     * Unique name used by the model to invoke the tool.
     */
    String getName();

    /**
     * Tells the model what the tool does and when to use it.
     */
    String getDescription();

    ArgumentSchema getArgumentSchema();

    /**
     * Execute with already validated arguments.
     *
     * @param arguments coerced arguments, unknown fields removed
     * @param context   per-request context
     * @return tool result
     */
    ToolResult execute(Map<String, Object> arguments, ToolContext context);

    ToolCategory getCategory();

    default ToolDescriptor describe() {
        return new ToolDescriptor(getName(), getDescription(), getCategory(), getArgumentSchema());
    }

    enum ToolCategory {
        /**
         * Reads from the relational store.
         */
        LOOKUP,

        /**
         * Builds or queries patient knowledge graphs.
         */
        KNOWLEDGE,

        /**
         * Calls an external risk model.
         */
        PREDICTION
    }
}
