package com.medimax.assistant.exception;

/**
 * The graph store rejected a query. The store's message is kept verbatim so
 * the agent can correct the query on its next plan.
 */
public class QuerySyntaxException extends MediMaxException {

    public QuerySyntaxException(String message) {
        super(ErrorCategory.VALIDATION, message);
    }

    public QuerySyntaxException(String message, Throwable cause) {
        super(ErrorCategory.VALIDATION, message, cause);
    }
}
