package com.medimax.assistant.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Budgets for one agent run.
 *
 * <p>Properties are loaded from the {@code app.agent} namespace in application.yml.
 * Example configuration:
 * <pre>
 * app:
 *   agent:
 *     max-iterations: 6
 *     max-plan-repairs: 2
 *     request-timeout: 90s
 *     history-window: 10
 *     max-result-chars: 4000
 * </pre>
 *
 * <p>A run makes at most {@code max-iterations} tool calls and at most
 * {@code max-iterations + max-plan-repairs + 1} plan requests, plus one forced
 * final-answer request.
 *
 * @since 1.0.0
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.agent")
public class AgentConfig {

    /**
     * Maximum plan/execute cycles before a final answer is forced.
     * Default: 6
     */
    @Min(1)
    private int maxIterations = 6;

    /**
     * Malformed plans tolerated per run before the run is aborted.
     * Default: 2
     */
    @Min(0)
    private int maxPlanRepairs = 2;

    /**
     * Wall-clock budget for one chat request, covering every reasoning call,
     * tool call and backoff sleep.
     * Default: 90s
     */
    @NotNull
    private Duration requestTimeout = Duration.ofSeconds(90);

    /**
     * Number of prior turns rendered into each plan prompt.
     * Default: 10
     */
    @Min(0)
    private int historyWindow = 10;

    /**
     * Tool results are truncated to this many characters before being folded
     * into history.
     * Default: 4000
     */
    @Min(200)
    private int maxResultChars = 4000;
}
