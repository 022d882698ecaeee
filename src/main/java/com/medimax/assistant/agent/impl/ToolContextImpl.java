package com.medimax.assistant.agent.impl;

import com.medimax.assistant.agent.ToolContext;
import com.medimax.assistant.resilience.Deadline;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ToolContextImpl implements ToolContext {

    private String sessionId;

    @Builder.Default
    private Deadline deadline = Deadline.none();

    public static ToolContextImpl create(String sessionId, Deadline deadline) {
        return ToolContextImpl.builder()
            .sessionId(sessionId)
            .deadline(deadline)
            .build();
    }
}
