package com.medimax.assistant.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration for the Gemini reasoning model.
 *
 * <p>Properties are loaded from the {@code app.gemini} namespace in application.yml.
 *
 * @since 1.0.0
 */
@Data
@ConfigurationProperties(prefix = "app.gemini")
public class GeminiConfig {

    private String baseUrl = "https://generativelanguage.googleapis.com";

    private String apiVersion = "v1beta";

    private String apiKey;

    private String model = "gemini-1.5-flash";

    /**
     * Low temperature keeps tool selection stable.
     */
    private double temperature = 0.1;

    private int maxOutputTokens = 2048;
}
