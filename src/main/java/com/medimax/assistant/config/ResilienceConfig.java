package com.medimax.assistant.config;

import com.medimax.assistant.resilience.RetryPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.Map;

/**
 * Named retry policies for every outbound call.
 *
 * <p>Properties are loaded from the {@code app.resilience} namespace in application.yml.
 * Example configuration:
 * <pre>
 * app:
 *   resilience:
 *     policies:
 *       default:
 *         max-attempts: 3
 *         base-delay: 200ms
 *         max-delay: 5s
 *         jitter: 0.2
 *         timeout-per-attempt: 10s
 *       llm:
 *         max-attempts: 2
 *         timeout-per-attempt: 30s
 * </pre>
 *
 * <p><b>Backoff calculation:</b> after failed attempt N (starting at 1) the delay is
 * <pre>
 *   delay = min(max-delay, base-delay * 2^(N-1)) +/- jitter * delay
 * </pre>
 * Set {@code seed} to make the jitter sequence reproducible.
 *
 * <p>A policy that is not configured falls back to {@code default}.
 *
 * @since 1.0.0
 */
@Data
@ConfigurationProperties(prefix = "app.resilience")
public class ResilienceConfig {

    public static final String DEFAULT = "default";
    public static final String LLM = "llm";
    public static final String TOOL = "tool";
    public static final String GRAPH = "graph";
    public static final String PREDICTION = "prediction";
    public static final String RELATIONAL = "relational";

    private Map<String, RetryPolicy> policies = new HashMap<>();

    public RetryPolicy policy(String name) {
        RetryPolicy policy = policies.get(name);
        if (policy != null) {
            return policy;
        }
        return policies.getOrDefault(DEFAULT, RetryPolicy.defaults());
    }
}
