package com.trailledger.activity.service;

import com.trailledger.activity.source.RetryableScrapeException;
import com.trailledger.activity.source.ScrapeException;

/**
 * Result of one fetch attempt.
 */
public sealed interface FetchOutcome<T> permits FetchOutcome.Success, FetchOutcome.Retry, FetchOutcome.Fatal {

    record Success<T>(T value) implements FetchOutcome<T> {}

    /** Transient failure, worth another attempt. */
    record Retry<T>(RetryableScrapeException error) implements FetchOutcome<T> {}

    /** Permanent failure, never retried. */
    record Fatal<T>(ScrapeException error) implements FetchOutcome<T> {}
}
