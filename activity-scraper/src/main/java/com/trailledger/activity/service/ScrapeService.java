package com.trailledger.activity.service;

import com.trailledger.activity.model.ScrapeRun;
import com.trailledger.activity.source.ScrapeException;
import com.trailledger.activity.source.SourceAdapter;
import com.trailledger.activity.source.SourceAdapterFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs scrape invocations and keeps a record of the recent ones.
 *
 * Each invocation opens one adapter session, logs in, and works through its
 * targets one after the other. Only one invocation runs at a time; a trigger
 * that arrives while another is running is recorded as SKIPPED.
 */
@Service
@Slf4j
public class ScrapeService {

    static final int RUN_HISTORY_SIZE = 50;
    static final String SELF = "self";

    private final ObjectProvider<SourceAdapterFactory> adapterFactories;
    private final ScrapeEngineFactory engineFactory;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Deque<ScrapeRun> recentRuns = new ArrayDeque<>();

    public ScrapeService(ObjectProvider<SourceAdapterFactory> adapterFactories,
                         ScrapeEngineFactory engineFactory,
                         Clock clock) {
        this.adapterFactories = adapterFactories;
        this.engineFactory = engineFactory;
        this.clock = clock;
    }

    public boolean isAdapterAvailable() {
        return adapterFactories.getIfAvailable() != null;
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Scrape the logged-in user and any extra profiles, in order.
     *
     * @param profileUrls extra profiles; null entries mean the logged-in user
     * @return one run record per target
     */
    public List<ScrapeRun> scrapeProfiles(String trigger, List<String> profileUrls, boolean forceFutureRescan) {
        List<String> targets = new ArrayList<>();
        targets.add(null);
        for (String url : profileUrls) {
            if (url != null && !url.isBlank() && !targets.contains(url)) targets.add(url);
        }
        return runExclusive(trigger, targets, ScrapeEngine::scrapeProfile, forceFutureRescan);
    }

    /** Scrape a single person (null for the logged-in user). */
    public ScrapeRun scrapeProfile(String trigger, String profileUrl, boolean forceFutureRescan) {
        List<String> targets = new ArrayList<>();
        targets.add(profileUrl == null || profileUrl.isBlank() ? null : profileUrl);
        return runExclusive(trigger, targets, ScrapeEngine::scrapeProfile, forceFutureRescan).get(0);
    }

    /** Re-fetch specific stored activities in one session. */
    public List<ScrapeRun> updateActivities(String trigger, List<String> activityUrls) {
        return runExclusive(trigger, activityUrls, (engine, url) -> {
            engine.updateSingleActivity(url);
            ScrapeReport report = new ScrapeReport();
            report.activityUpdated();
            return report;
        }, false);
    }

    public List<ScrapeRun> recentRuns() {
        synchronized (recentRuns) {
            return List.copyOf(recentRuns);
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    @FunctionalInterface
    interface TargetAction {
        ScrapeReport run(ScrapeEngine engine, String target);
    }

    private List<ScrapeRun> runExclusive(String trigger, List<String> targets, TargetAction action,
                                         boolean forceFutureRescan) {
        if (!running.compareAndSet(false, true)) {
            log.warn("Scrape already in progress, skipping {} trigger", trigger);
            List<ScrapeRun> skipped = new ArrayList<>();
            for (String target : targets) {
                ScrapeRun run = newRun(trigger, target);
                run.setStatus("SKIPPED");
                run.setErrorMessage("Another scrape is in progress");
                finish(run);
                skipped.add(run);
            }
            return skipped;
        }

        try {
            SourceAdapterFactory factory = adapterFactories.getIfAvailable();
            if (factory == null) {
                log.error("No source adapter is registered, cannot scrape");
                return failAll(trigger, targets, null, "No source adapter is registered");
            }
            try (SourceAdapter adapter = factory.open()) {
                ScrapeEngine engine;
                try {
                    engine = engineFactory.create(adapter, forceFutureRescan);
                    engine.login();
                } catch (ScrapeException e) {
                    log.error("Login failed at {}: {}", e.getPageUrl(), e.getMessage(), e);
                    return failAll(trigger, targets, e.getPageUrl(), e.getMessage());
                } catch (RuntimeException e) {
                    log.error("Could not start scrape: {}", e.getMessage(), e);
                    return failAll(trigger, targets, null, e.getMessage());
                }

                List<ScrapeRun> runs = new ArrayList<>();
                for (String target : targets) {
                    runs.add(runTarget(engine, trigger, target, action));
                }
                return runs;
            }
        } finally {
            running.set(false);
        }
    }

    private ScrapeRun runTarget(ScrapeEngine engine, String trigger, String target, TargetAction action) {
        ScrapeRun run = newRun(trigger, target);
        try {
            ScrapeReport report = action.run(engine, target);
            run.setActivitiesCreated(report.getCreated());
            run.setActivitiesUpdated(report.getUpdated());
            run.setParticipationsCanceled(report.getCanceled());
            run.setActivitiesSkipped(report.getUnchanged());
            run.setStatus("SUCCESS");
        } catch (ScrapeException e) {
            log.error("Scrape of {} failed at {}: {}", describe(target), e.getPageUrl(), e.getMessage(), e);
            run.setStatus("FAILED");
            run.setErrorPage(e.getPageUrl());
            run.setErrorMessage(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Scrape of {} failed: {}", describe(target), e.getMessage(), e);
            run.setStatus("FAILED");
            run.setErrorMessage(e.getMessage());
        } finally {
            finish(run);
        }
        return run;
    }

    private List<ScrapeRun> failAll(String trigger, List<String> targets, String errorPage, String message) {
        List<ScrapeRun> failed = new ArrayList<>();
        for (String target : targets) {
            ScrapeRun run = newRun(trigger, target);
            run.setStatus("FAILED");
            run.setErrorPage(errorPage);
            run.setErrorMessage(message);
            finish(run);
            failed.add(run);
        }
        return failed;
    }

    private ScrapeRun newRun(String trigger, String target) {
        return ScrapeRun.builder()
                .runId(UUID.randomUUID().toString())
                .trigger(trigger)
                .target(describe(target))
                .startedAt(LocalDateTime.now(clock))
                .status("RUNNING")
                .build();
    }

    private void finish(ScrapeRun run) {
        run.setCompletedAt(LocalDateTime.now(clock));
        synchronized (recentRuns) {
            recentRuns.addFirst(run);
            while (recentRuns.size() > RUN_HISTORY_SIZE) {
                recentRuns.removeLast();
            }
        }
    }

    private static String describe(String target) {
        return target == null ? SELF : target;
    }
}
