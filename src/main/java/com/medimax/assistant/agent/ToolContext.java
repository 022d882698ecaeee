package com.medimax.assistant.agent;

import com.medimax.assistant.resilience.Deadline;

/**
 * Per-request information handed to tools. Never shared between requests.
 *
 * @since 1.0.0
 */
public interface ToolContext {

    String getSessionId();

    /**
     * Remaining budget of the request; tools pass it to their own outbound calls.
     */
    Deadline getDeadline();
}
