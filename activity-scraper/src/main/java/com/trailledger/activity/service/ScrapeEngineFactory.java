package com.trailledger.activity.service;

import com.trailledger.activity.config.TrailLedgerProperties;
import com.trailledger.activity.source.SourceAdapter;
import com.trailledger.activity.store.ParticipationStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Builds a {@link ScrapeEngine} around a freshly opened adapter.
 */
@Component
@RequiredArgsConstructor
public class ScrapeEngineFactory {

    private final ParticipationStore store;
    private final SchedulingPolicy policy;
    private final RetryingFetcher fetcher;
    private final TrailLedgerProperties properties;
    private final Clock clock;

    public ScrapeEngine create(SourceAdapter adapter, boolean forceFutureRescan) {
        ScrapeEngine engine = new ScrapeEngine(adapter, store, properties.toEngineSettings(), policy, fetcher, clock);
        engine.setForceFutureRescan(forceFutureRescan);
        return engine;
    }
}
