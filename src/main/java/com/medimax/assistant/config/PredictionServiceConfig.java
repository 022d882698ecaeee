package com.medimax.assistant.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Endpoints of the external risk prediction services.
 *
 * <pre>
 * app:
 *   prediction:
 *     connect-timeout: 5s
 *     health-timeout: 2s
 *     cardio:
 *       base-url: http://localhost:8002
 *     diabetes:
 *       base-url: http://localhost:8001
 * </pre>
 *
 * @since 1.0.0
 */
@Data
@ConfigurationProperties(prefix = "app.prediction")
public class PredictionServiceConfig {

    private Duration connectTimeout = Duration.ofSeconds(5);

    private Duration healthTimeout = Duration.ofSeconds(2);

    private Endpoint cardio = new Endpoint();

    private Endpoint diabetes = new Endpoint();

    @Data
    public static class Endpoint {

        private String baseUrl;

        private String predictPath = "/predict";

        private String healthPath = "/health";
    }
}
