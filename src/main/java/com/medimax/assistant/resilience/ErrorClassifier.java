package com.medimax.assistant.resilience;

import com.medimax.assistant.exception.MediMaxException;
import org.neo4j.driver.exceptions.ServiceUnavailableException;
import org.neo4j.driver.exceptions.SessionExpiredException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Decides whether a failure is worth retrying.
 *
 * <p>Application exceptions carry their own category. Library exceptions are
 * transient when they describe timeouts, refused or lost connections, or busy
 * HTTP answers (408, 429, 502, 503, 504). Everything else is permanent.
 *
 * @since 1.0.0
 */
@Component
public class ErrorClassifier {

    private static final Set<Integer> RETRYABLE_STATUS = Set.of(408, 429, 502, 503, 504);
    private static final int MAX_CAUSE_DEPTH = 5;

    public boolean isTransient(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < MAX_CAUSE_DEPTH) {
            if (current instanceof MediMaxException mediMax) {
                return mediMax.isTransient();
            }
            if (current instanceof TimeoutException
                || current instanceof ConnectException
                || current instanceof SocketTimeoutException) {
                return true;
            }
            if (current instanceof WebClientResponseException response) {
                return RETRYABLE_STATUS.contains(response.getStatusCode().value());
            }
            if (current instanceof WebClientRequestException) {
                return true;
            }
            if (current instanceof ServiceUnavailableException
                || current instanceof SessionExpiredException
                || current instanceof org.neo4j.driver.exceptions.TransientException) {
                return true;
            }
            if (current instanceof TransientDataAccessException
                || current instanceof RecoverableDataAccessException
                || current instanceof DataAccessResourceFailureException) {
                return true;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }
}
