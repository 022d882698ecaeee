package com.medimax.assistant.api;

/**
 * Body of every non-2xx answer from the REST layer.
 */
public record ErrorResponse(String detail) {
}
