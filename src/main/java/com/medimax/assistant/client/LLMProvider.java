package com.medimax.assistant.client;

/**
 * Reasoning model behind the agent.
 *
 * <p>Implementations make a single attempt per call; retries and timeouts are
 * applied by the caller.
 *
 * @since 1.0.0
 */
public interface LLMProvider {

    /**
     * Execute chat completion with the model.
     *
     * @param prompt    rendered prompt
     * @param agentName name of the calling step, for logging
     * @param sessionId conversation session
     * @return the model's raw response text
     */
    String chat(String prompt, String agentName, String sessionId);
}
