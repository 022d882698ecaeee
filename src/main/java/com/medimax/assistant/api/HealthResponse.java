package com.medimax.assistant.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthResponse {

    public static final String HEALTHY = "healthy";
    public static final String DEGRADED = "degraded";

    /**
     * {@code healthy} when every dependency answers, {@code degraded} otherwise.
     */
    private String status;

    /**
     * Service name to whether it answered.
     */
    @Builder.Default
    private Map<String, Boolean> dependentServices = new LinkedHashMap<>();
}
