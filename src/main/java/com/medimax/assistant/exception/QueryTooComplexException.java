package com.medimax.assistant.exception;

import lombok.Getter;

/**
 * A graph query exceeded the configured length or complexity bound.
 */
@Getter
public class QueryTooComplexException extends MediMaxException {

    private final String limit;

    public QueryTooComplexException(String limit, String message) {
        super(ErrorCategory.VALIDATION, message);
        this.limit = limit;
    }
}
