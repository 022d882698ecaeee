package com.medimax.assistant.exception;

import lombok.Getter;

/**
 * A relational fact arrived without the natural key its node ID is derived from.
 */
@Getter
public class MalformedFactException extends MediMaxException {

    private final String factType;
    private final int position;

    public MalformedFactException(String factType, int position) {
        super(ErrorCategory.VALIDATION,
            factType + " fact at position " + position + " has no natural key");
        this.factType = factType;
        this.position = position;
    }
}
