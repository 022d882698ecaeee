package com.medimax.assistant.exception;

/**
 * Failure taxonomy shared by tools, the graph store and the agent loop.
 *
 * <p>The category decides whether the {@code ResilienceManager} retries a call
 * and which HTTP status the REST layer answers with.
 */
public enum ErrorCategory {

    /**
     * Bad arguments, bad query syntax, malformed input. Never retried.
     */
    VALIDATION,

    /**
     * Timeouts, refused connections, busy responses. Retried per policy.
     */
    TRANSIENT,

    /**
     * Dangling edges or duplicate node IDs inside one synthesis pass.
     */
    CONSISTENCY,

    /**
     * Malformed plans, exhausted iteration or time budgets.
     */
    ORCHESTRATION,

    /**
     * A transient failure that outlived its retry policy.
     */
    RETRIES_EXHAUSTED,

    /**
     * Anything the categories above do not describe.
     */
    INTERNAL
}
