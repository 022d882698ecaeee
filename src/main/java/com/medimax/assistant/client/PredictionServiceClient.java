package com.medimax.assistant.client;

import com.medimax.assistant.config.PredictionServiceConfig;
import com.medimax.assistant.config.ResilienceConfig;
import com.medimax.assistant.exception.PredictionServiceException;
import com.medimax.assistant.resilience.Deadline;
import com.medimax.assistant.resilience.ResilienceManager;
import io.netty.channel.ChannelOption;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.netty.http.client.HttpClient;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * HTTP client for the external risk models. Each model exposes
 * {@code POST {baseUrl}/predict} and {@code GET {baseUrl}/health}.
 *
 * <p>Responses are returned as parsed JSON without modification.
 * HTTP errors become {@link PredictionServiceException}; 408, 429 and 5xx are
 * retryable under the {@code prediction} policy.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PredictionServiceClient {

    private final PredictionServiceConfig config;
    private final ResilienceManager resilience;
    private final ResilienceConfig resilienceConfig;

    private final Map<PredictionModel, WebClient> clients = new EnumMap<>(PredictionModel.class);

    @PostConstruct
    public void init() {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) config.getConnectTimeout().toMillis());
        for (PredictionModel model : PredictionModel.values()) {
            PredictionServiceConfig.Endpoint endpoint = endpoint(model);
            if (endpoint.getBaseUrl() == null || endpoint.getBaseUrl().isBlank()) {
                log.warn("No base URL configured for {} prediction service", model);
                continue;
            }
            clients.put(model, WebClient.builder()
                .baseUrl(endpoint.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build());
            log.info("{} prediction service at {}", model, endpoint.getBaseUrl());
        }
    }

    /**
     * Posts the features to the model and returns its JSON answer.
     *
     * @throws PredictionServiceException on HTTP errors or when the model is not configured
     * @throws com.medimax.assistant.exception.FinalErrorException when retryable failures persist
     */
    public Object predict(PredictionModel model, Map<String, Object> features, Deadline deadline) {
        WebClient client = clients.get(model);
        if (client == null) {
            throw new PredictionServiceException(model.name(), 503, "service not configured", false);
        }
        return resilience.withRetry("prediction." + model.name().toLowerCase(Locale.ROOT),
            () -> post(model, client, features),
            resilienceConfig.policy(ResilienceConfig.PREDICTION), deadline);
    }

    public boolean isReachable(PredictionModel model) {
        WebClient client = clients.get(model);
        if (client == null) {
            return false;
        }
        try {
            client.get().uri(endpoint(model).getHealthPath())
                .retrieve()
                .toBodilessEntity()
                .block(config.getHealthTimeout());
            return true;
        } catch (Exception e) {
            log.warn("{} prediction service unhealthy: {}", model, e.getMessage());
            return false;
        }
    }

    private Object post(PredictionModel model, WebClient client, Map<String, Object> features) {
        try {
            return client.post().uri(endpoint(model).getPredictPath())
                .bodyValue(features)
                .retrieve()
                .bodyToMono(Object.class)
                .block();
        } catch (WebClientResponseException e) {
            int status = e.getStatusCode().value();
            boolean retryable = status == 408 || status == 429 || e.getStatusCode().is5xxServerError();
            throw new PredictionServiceException(model.name(), status, e.getResponseBodyAsString(), retryable);
        }
    }

    private PredictionServiceConfig.Endpoint endpoint(PredictionModel model) {
        return switch (model) {
            case CARDIOVASCULAR -> config.getCardio();
            case DIABETES -> config.getDiabetes();
        };
    }
}
