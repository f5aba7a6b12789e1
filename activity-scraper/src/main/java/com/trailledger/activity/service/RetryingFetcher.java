package com.trailledger.activity.service;

import com.trailledger.activity.source.RetryableScrapeException;
import com.trailledger.activity.source.ScrapeException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs a page fetch with bounded retries.
 *
 * Each attempt is turned into a {@link FetchOutcome} and handed to a
 * Resilience4j {@link Retry} that retries on {@link FetchOutcome.Retry}
 * results only. The wait before the next attempt is the delay suggested by the
 * adapter (or the default delay) plus a fixed settle delay. The last retryable
 * error is thrown once the attempts are used up; permanent errors are thrown
 * straight away.
 */
@Slf4j
public class RetryingFetcher {

    private final int maxAttempts;
    private final Retry retry;

    public RetryingFetcher(int maxAttempts, Duration defaultDelay, Duration settleDelay) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;

        RetryConfig config = RetryConfig.<FetchOutcome<?>>custom()
                .maxAttempts(maxAttempts)
                .retryOnResult(outcome -> outcome instanceof FetchOutcome.Retry)
                .retryOnException(e -> false)
                .intervalBiFunction((attempt, result) -> {
                    Duration wait = defaultDelay;
                    if (result.isRight() && result.get() instanceof FetchOutcome.Retry<?> retryable) {
                        wait = retryable.error().getSuggestedDelay().orElse(defaultDelay);
                    }
                    return wait.plus(settleDelay).toMillis();
                })
                .build();
        this.retry = Retry.of("pageFetch", config);
        retry.getEventPublisher().onRetry(event ->
                log.info("  Will retry in {} seconds (retry {})",
                        event.getWaitInterval().toSeconds(), event.getNumberOfRetryAttempts()));
    }

    public <T> T fetch(String pageUrl, Supplier<T> call) {
        AtomicInteger attempts = new AtomicInteger();

        FetchOutcome<T> outcome = retry.executeSupplier(() -> {
            FetchOutcome<T> current = attempt(call);
            if (current instanceof FetchOutcome.Retry<T> retryable) {
                RetryableScrapeException error = retryable.error();
                log.warn("  Retryable error on {} (attempt {}/{}): {}",
                        pageUrl, attempts.incrementAndGet(), maxAttempts, error.getMessage());
                if (error.getCause() != null) {
                    log.warn("    cause: {}", error.getCause().toString());
                }
            }
            return current;
        });

        if (outcome instanceof FetchOutcome.Success<T> success) {
            return success.value();
        }
        if (outcome instanceof FetchOutcome.Fatal<T> fatal) {
            log.error("  Permanent error on {}: {}", pageUrl, fatal.error().getMessage());
            throw fatal.error();
        }
        throw ((FetchOutcome.Retry<T>) outcome).error();
    }

    Retry getRetry() {
        return retry;
    }

    static <T> FetchOutcome<T> attempt(Supplier<T> call) {
        try {
            return new FetchOutcome.Success<>(call.get());
        } catch (RetryableScrapeException e) {
            return new FetchOutcome.Retry<>(e);
        } catch (ScrapeException e) {
            return new FetchOutcome.Fatal<>(e);
        }
    }
}
