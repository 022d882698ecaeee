package com.medimax.assistant.api;

import com.medimax.assistant.model.conversation.ToolTraceEntry;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Response from chat endpoint.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatResponse {

    private String response;
    private String sessionId;
    private int iterations;

    @Builder.Default
    private List<ToolTraceEntry> toolTrace = new ArrayList<>();
}
