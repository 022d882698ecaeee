package com.medimax.assistant.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request for chat endpoint.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatRequest {

    /**
     * The user's question.
     */
    @NotBlank(message = "message is required")
    private String message;

    /**
     * Existing session ID (null for a new session).
     */
    @Size(max = 64, message = "sessionId must be at most 64 characters")
    private String sessionId;
}
