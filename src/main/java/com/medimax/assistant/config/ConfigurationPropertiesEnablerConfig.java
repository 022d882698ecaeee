package com.medimax.assistant.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers every {@code @ConfigurationProperties} class of the application.
 *
 * <ul>
 *   <li>{@link AgentConfig} - agent run budgets</li>
 *   <li>{@link ResilienceConfig} - named retry policies</li>
 *   <li>{@link GraphStoreConfig} - graph backend and query bounds</li>
 *   <li>{@link PredictionServiceConfig} - risk model endpoints</li>
 *   <li>{@link GeminiConfig} - reasoning model</li>
 * </ul>
 *
 * @since 1.0.0
 */
@Configuration
@EnableConfigurationProperties({
    AgentConfig.class,
    ResilienceConfig.class,
    GraphStoreConfig.class,
    PredictionServiceConfig.class,
    GeminiConfig.class
})
public class ConfigurationPropertiesEnablerConfig {
}
