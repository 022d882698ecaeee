package com.medimax.assistant.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Graph store settings. Connection details for Neo4j live under
 * {@code spring.neo4j} and are handled by Spring Boot's driver auto-configuration.
 *
 * <pre>
 * app:
 *   graph:
 *     backend: neo4j        # or "memory"
 *     max-query-length: 2000
 *     max-match-clauses: 4
 *     max-result-rows: 100
 *     lock-timeout: 30s
 * </pre>
 *
 * @since 1.0.0
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.graph")
public class GraphStoreConfig {

    /**
     * {@code neo4j} for the Bolt-backed store, {@code memory} for the
     * in-process store used in local runs and tests.
     */
    @NotBlank
    private String backend = "neo4j";

    /**
     * Queries longer than this are rejected by the query tool.
     */
    @Min(1)
    private int maxQueryLength = 2000;

    /**
     * Queries with more MATCH clauses than this are rejected by the query tool.
     */
    @Min(1)
    private int maxMatchClauses = 4;

    /**
     * Rows returned to the agent from a single query.
     */
    @Min(1)
    private int maxResultRows = 100;

    /**
     * Longest wait for another replace of the same patient to finish.
     */
    private Duration lockTimeout = Duration.ofSeconds(30);
}
