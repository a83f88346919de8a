package com.rockpoint.payments.core;

import com.rockpoint.payments.core.http.GatewayTransportException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntFunction;

/**
 * Runs a gateway attempt under a {@link RetryPolicy} using a Resilience4j
 * {@link Retry}. Only {@link GatewayTransportException}s are retried; anything
 * else, including a well-formed error response, ends the loop immediately.
 */
@Slf4j
public final class BackoffRetrier {

    private BackoffRetrier() {}

    /**
     * @param attempt receives the number of attempts that already failed (0 for the first)
     * @throws GatewayTransportException the last transport failure once every attempt failed
     */
    public static <T> T run(String name, RetryPolicy policy, IntFunction<T> attempt) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(policy.getMaxAttempts())
                .intervalFunction(failed -> policy.delayAfter(failed).toMillis())
                .retryOnException(e -> e instanceof GatewayTransportException)
                .build();
        Retry retry = Retry.of(name, config);
        retry.getEventPublisher().onRetry(event -> log.warn("Retrying {} attempt={} wait={}ms cause={}",
                name, event.getNumberOfRetryAttempts() + 1, event.getWaitInterval().toMillis(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : null));

        AtomicInteger failed = new AtomicInteger();
        return retry.executeSupplier(() -> {
            int failedSoFar = failed.get();
            try {
                return attempt.apply(failedSoFar);
            } catch (GatewayTransportException e) {
                failed.incrementAndGet();
                throw e;
            }
        });
    }
}
