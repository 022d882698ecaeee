package com.medimax.assistant.resilience;

import com.medimax.assistant.exception.ErrorCategory;
import com.medimax.assistant.exception.FinalErrorException;
import com.medimax.assistant.exception.MediMaxException;
import com.medimax.assistant.exception.OrchestrationException;
import com.medimax.assistant.exception.RequestDeadlineExceededException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Single retry/backoff/timeout wrapper for every outbound call: reasoning
 * model, tool handlers, graph store, relational store and prediction services.
 *
 * <p>Each attempt runs on the bounded-elastic scheduler under
 * {@code timeoutPerAttempt} (capped by the request {@link Deadline}). Transient
 * failures are retried with exponential backoff until {@code maxAttempts} is
 * reached, then surface as {@link FinalErrorException}. Permanent failures
 * propagate after the first attempt.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResilienceManager {

    private final ErrorClassifier errorClassifier;

    public <T> T withRetry(String operation, Callable<T> call, RetryPolicy policy) {
        return withRetry(operation, call, policy, Deadline.none());
    }

    public <T> T withRetry(String operation, Callable<T> call, RetryPolicy policy, Deadline deadline) {
        Random random = policy.newRandom();
        AtomicInteger attempts = new AtomicInteger();

        Mono<T> attempt = Mono.defer(() -> {
            if (deadline.isExpired()) {
                return Mono.error(new RequestDeadlineExceededException(operation));
            }
            log.debug("{} attempt {}/{}", operation, attempts.incrementAndGet(), policy.getMaxAttempts());
            return Mono.fromCallable(call)
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(deadline.cap(policy.getTimeoutPerAttempt()));
        });

        try {
            return attempt
                .retryWhen(Retry.from(signals -> signals.concatMap(
                    signal -> onFailure(operation, signal.failure(), signal.totalRetries(), policy, deadline, random))))
                .block();
        } catch (RuntimeException e) {
            throw unwrap(operation, e);
        }
    }

    private Mono<Long> onFailure(String operation, Throwable failure, long retriesSoFar,
                                 RetryPolicy policy, Deadline deadline, Random random) {
        int attempt = (int) retriesSoFar + 1;

        if (failure instanceof RequestDeadlineExceededException) {
            return Mono.error(failure);
        }
        if (!errorClassifier.isTransient(failure)) {
            log.debug("{} failed permanently on attempt {}: {}", operation, attempt, failure.toString());
            return Mono.error(failure);
        }
        if (attempt >= policy.getMaxAttempts()) {
            log.warn("{} gave up after {} attempt(s): {}", operation, attempt, failure.toString());
            return Mono.error(new FinalErrorException(operation, attempt, failure));
        }

        Duration delay = policy.backoffFor(attempt, random);
        if (deadline.remaining().compareTo(delay) <= 0) {
            return Mono.error(new RequestDeadlineExceededException(operation));
        }
        log.warn("{} attempt {}/{} failed ({}), retrying in {}ms",
            operation, attempt, policy.getMaxAttempts(), failure.toString(), delay.toMillis());
        return Mono.delay(delay).thenReturn(retriesSoFar);
    }

    private RuntimeException unwrap(String operation, RuntimeException blocked) {
        Throwable cause = Exceptions.unwrap(blocked);
        if (cause instanceof InterruptedException) {
            Thread.currentThread().interrupt();
            return new OrchestrationException(operation + " was interrupted", cause);
        }
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        return new MediMaxException(ErrorCategory.INTERNAL, operation + " failed: " + cause.getMessage(), cause);
    }
}
