package com.medimax.assistant.exception;

import lombok.Getter;

/**
 * Error response from an external risk prediction service.
 *
 * <p>5xx, 408 and 429 answers are transient; any other status means the
 * service rejected the input.
 */
@Getter
public class PredictionServiceException extends MediMaxException {

    private final String model;
    private final int status;
    private final String responseBody;

    public PredictionServiceException(String model, int status, String responseBody, boolean retryable) {
        super(retryable ? ErrorCategory.TRANSIENT : ErrorCategory.VALIDATION,
            model + " prediction service returned HTTP " + status);
        this.model = model;
        this.status = status;
        this.responseBody = responseBody;
    }
}
