package com.medimax.assistant.api;

import com.medimax.assistant.service.HealthService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/health")
@RequiredArgsConstructor
public class HealthController {

    private final HealthService healthService;

    /**
     * Always answers 200; the body says which dependencies are down.
     */
    @GetMapping
    public HealthResponse health() {
        Map<String, Boolean> checks = healthService.checkDependencies();

        return HealthResponse.builder()
            .status(checks.containsValue(Boolean.FALSE) ? HealthResponse.DEGRADED : HealthResponse.HEALTHY)
            .dependentServices(checks)
            .build();
    }
}
